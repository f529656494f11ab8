package com.planmarshall.core.error;

/**
 * Base class for every error raised by the orchestrator and its components.
 */
public class PlanMarshallException extends RuntimeException {

    public PlanMarshallException(String message) {
        super(message);
    }

    public PlanMarshallException(String message, Throwable cause) {
        super(message, cause);
    }
}
