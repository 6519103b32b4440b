package com.solverlog.errorlog.exception;

/**
 * Failure categories surfaced to the caller.
 */
public enum ErrorKind {
    IO,
    FORMAT,
    STORAGE,
    SERIALIZATION,
    DELIVERY
}
