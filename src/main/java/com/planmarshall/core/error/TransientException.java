package com.planmarshall.core.error;

/**
 * A recoverable failure of an external collaborator; retried once before escalating.
 */
public class TransientException extends PlanMarshallException {

    public TransientException(String message) {
        super(message);
    }

    public TransientException(String message, Throwable cause) {
        super(message, cause);
    }
}
