package com.solverlog.errorlog.dto;

/**
 * Single human-readable error message returned by every failing endpoint.
 */
public record ErrorResponse(String message) {
}
