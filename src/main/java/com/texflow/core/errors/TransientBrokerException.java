package com.texflow.core.errors;

/**
 * Thrown when a broker round-trip (enqueue, cancel, claim) fails.
 * Never retried inside the pipeline; the caller may resubmit.
 */
public class TransientBrokerException extends TexflowException {

    public TransientBrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
