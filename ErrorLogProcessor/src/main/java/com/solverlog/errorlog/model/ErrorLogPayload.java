package com.solverlog.errorlog.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Aggregate view of one job as delivered to the caller: {@code [summary, entries]}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"summary", "entries"})
public class ErrorLogPayload {

    private List<ErrorLogSummary> summary;
    private List<ErrorLogEntry> entries;
}
