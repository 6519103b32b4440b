package com.solverlog.errorlog.exception;

/**
 * The log text does not follow the expected header / params / metric layout.
 */
public class LogFormatException extends ErrorLogException {

    private final ParseStage stage;

    public LogFormatException(ParseStage stage, String message) {
        super(ErrorKind.FORMAT, "Log format error (" + stage.tag() + "): " + message);
        this.stage = stage;
    }

    public LogFormatException(ParseStage stage, String message, Throwable cause) {
        super(ErrorKind.FORMAT, "Log format error (" + stage.tag() + "): " + message, cause);
        this.stage = stage;
    }

    public ParseStage getStage() {
        return stage;
    }

}
