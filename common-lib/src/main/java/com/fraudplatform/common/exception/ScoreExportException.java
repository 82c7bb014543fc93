package com.fraudplatform.common.exception;

/** Ranked scores could not be rendered into an export format. */
public class ScoreExportException extends RuntimeException {

    public ScoreExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
