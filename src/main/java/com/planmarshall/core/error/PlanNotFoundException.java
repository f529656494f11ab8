package com.planmarshall.core.error;

public class PlanNotFoundException extends PlanMarshallException {

    public PlanNotFoundException(String planId) {
        super("Plan not found: " + planId);
    }
}
