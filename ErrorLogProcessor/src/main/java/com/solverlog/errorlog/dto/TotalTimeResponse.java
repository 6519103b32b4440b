package com.solverlog.errorlog.dto;

/**
 * Wall time of a job in seconds.
 */
public record TotalTimeResponse(long jobId, double seconds) {
}
