package com.ecp.governance.exception;

/**
 * A write would break a structural precondition, e.g. a classification referencing an unknown event.
 */
public class ConsistencyException extends RuntimeException {

    public ConsistencyException(String message) {
        super(message);
    }
}
