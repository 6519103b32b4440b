package com.solverlog.errorlog.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One point of the per-iteration error series. Serialized positionally as
 * {@code [iters, load, error_u, error_phi]}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"iters", "load", "errorU", "errorPhi"})
public class ErrorLogEntry {

    /** 1-based position in the job's chronological series. */
    private int iters;
    private double load;
    private double errorU;
    private double errorPhi;
}
