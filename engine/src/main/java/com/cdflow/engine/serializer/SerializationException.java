package com.cdflow.engine.serializer;

/**
 * Thrown when a run's workflow snapshot or info log cannot be encoded to
 * or decoded from its JSON column. Fatal for the operation that hit it.
 */
public class SerializationException extends RuntimeException {

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
