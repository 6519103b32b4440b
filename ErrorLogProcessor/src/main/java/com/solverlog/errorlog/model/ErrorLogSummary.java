package com.solverlog.errorlog.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per load step summary. Serialized positionally as {@code [load, iters, cost]}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"load", "iters", "cost"})
public class ErrorLogSummary {

    private double load;
    private int iters;
    /** Seconds until the next load step starts; null for the last step. */
    private Double cost;
}
