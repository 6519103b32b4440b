package com.solverlog.errorlog.dto;

public record ImportResponse(long jobId) {
}
