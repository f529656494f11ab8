package com.planmarshall.core.error;

/**
 * Thrown when intake, deliverables, tasks or step outcomes are malformed.
 */
public class ValidationException extends PlanMarshallException {

    public ValidationException(String message) {
        super(message);
    }
}
