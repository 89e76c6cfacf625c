package com.texflow.core.errors;

/**
 * Base type for failures callers are expected to branch on.
 * Subclasses map one-to-one to the pipeline's error kinds.
 */
public abstract class TexflowException extends RuntimeException {

    protected TexflowException(String message) {
        super(message);
    }

    protected TexflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
