package com.cdflow.engine.store;

/**
 * A storage failure, wrapped with the failing operation and its key arguments.
 */
public class RunStoreException extends RuntimeException {

    public RunStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
