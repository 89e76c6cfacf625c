package com.texflow.core.errors;

/**
 * Thrown at pre-flight when a dependency the compile needs is not available:
 * no live worker, unreachable container runtime, missing compiler image.
 */
public class InfrastructureUnavailableException extends TexflowException {

    public InfrastructureUnavailableException(String message) {
        super(message);
    }

    public InfrastructureUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
