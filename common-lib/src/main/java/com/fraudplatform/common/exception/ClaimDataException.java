package com.fraudplatform.common.exception;

public class ClaimDataException extends RuntimeException {

    public ClaimDataException(String message) {
        super(message);
    }

    public ClaimDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
