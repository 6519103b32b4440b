package com.solverlog.errorlog.controller;

import com.solverlog.errorlog.dto.ErrorResponse;
import com.solverlog.errorlog.exception.ErrorLogException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Flattens every failure into a single {@code message} field.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ErrorLogException.class)
    public ResponseEntity<ErrorResponse> handleErrorLog(ErrorLogException e) {
        HttpStatus status = switch (e.getKind()) {
            case FORMAT -> HttpStatus.BAD_REQUEST;
            case IO -> HttpStatus.UNPROCESSABLE_ENTITY;
            case STORAGE, SERIALIZATION, DELIVERY -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        if (status.is5xxServerError()) {
            log.error("{} error: {}", e.getKind(), e.getMessage(), e);
        } else {
            log.warn("{} error: {}", e.getKind(), e.getMessage());
        }
        return respond(status, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalid(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .findFirst()
            .orElse("Invalid request");
        return respond(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String message) {
        return ResponseEntity.status(status)
            .contentType(MediaType.APPLICATION_JSON)
            .body(new ErrorResponse(message));
    }
}
