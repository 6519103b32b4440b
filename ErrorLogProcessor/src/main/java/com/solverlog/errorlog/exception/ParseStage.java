package com.solverlog.errorlog.exception;

/**
 * Parser stage at which a log file was rejected.
 */
public enum ParseStage {
    HEADER("header"),
    PARAMS("params"),
    TEMPLATE("template");

    private final String tag;

    ParseStage(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
