package com.ecp.governance.exception;

public class ClassificationFailureException extends RuntimeException {

    public ClassificationFailureException(String message) {
        super(message);
    }

    public ClassificationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
