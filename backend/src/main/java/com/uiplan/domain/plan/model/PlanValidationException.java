package com.uiplan.domain.plan.model;

/**
 * Raised by internal validation helpers; entry points convert it to a {@link PlanResult}.
 */
public class PlanValidationException extends RuntimeException {

    private final PlanError error;

    public PlanValidationException(PlanError error) {
        super(error.describe());
        this.error = error;
    }

    public PlanError getError() {
        return error;
    }
}
