package com.planmarshall.core.error;

import com.planmarshall.core.model.Finding;

/**
 * Raised once a transient failure has exhausted its local retry.
 * Carries a blocking finding describing the failure so that callers can log it.
 */
public class EscalationException extends PlanMarshallException {

    private final transient Finding finding;

    public EscalationException(String message, Finding finding, Throwable cause) {
        super(message, cause);
        this.finding = finding;
    }

    public Finding getFinding() {
        return finding;
    }
}
