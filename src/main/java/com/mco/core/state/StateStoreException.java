package com.mco.core.state;

/**
 * Thrown when a persistence backend fails to read or write orchestration state.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message) {
        super(message);
    }

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
