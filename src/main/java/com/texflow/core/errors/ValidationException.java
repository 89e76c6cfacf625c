package com.texflow.core.errors;

/**
 * Thrown when a submission is malformed: unknown engine, oversized or empty
 * source, bad path. Raised before anything is queued.
 */
public class ValidationException extends TexflowException {

    public ValidationException(String message) {
        super(message);
    }
}
