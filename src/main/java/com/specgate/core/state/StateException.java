package com.specgate.core.state;

/**
 * Thrown when the persisted state record cannot be read, parsed or written.
 */
public class StateException extends RuntimeException {
    public StateException(String message) {
        super(message);
    }

    public StateException(String message, Throwable cause) {
        super(message, cause);
    }
}
