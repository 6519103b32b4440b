package com.solverlog.errorlog.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of an import call: path of the log file on the server.
 */
public record ImportRequest(@NotBlank String path) {
}
