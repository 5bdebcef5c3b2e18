package com.cdflow.engine.service;

/**
 * Thrown when a request cannot be applied: malformed definition or trigger
 * context, unknown node, or a mutation of a run that already finished.
 * Nothing is written when this is thrown.
 */
public class ValidationException extends RuntimeException {
    public ValidationException(String message) {
        super(message);
    }
}
