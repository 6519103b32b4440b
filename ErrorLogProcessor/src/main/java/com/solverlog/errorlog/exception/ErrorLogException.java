package com.solverlog.errorlog.exception;

/**
 * Base exception for import, query and cache failures.
 */
public class ErrorLogException extends RuntimeException {

    private final ErrorKind kind;

    public ErrorLogException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorLogException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

}
