package com.planmarshall.core.error;

/**
 * Thrown when plan artifacts cannot be read or written.
 */
public class PlanStoreException extends PlanMarshallException {

    public PlanStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
