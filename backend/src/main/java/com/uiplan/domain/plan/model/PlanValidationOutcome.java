package com.uiplan.domain.plan.model;

/**
 * Boundary verdict for a caller-supplied plan.
 *
 * @param valid     true when the plan passed schema and structural checks
 * @param error     flat error description when invalid
 * @param errorCode error class when invalid
 * @param data      the parsed plan when valid
 */
public record PlanValidationOutcome(
        boolean valid,
        String error,
        ErrorCode errorCode,
        Plan data
) {
    public static PlanValidationOutcome valid(Plan plan) {
        return new PlanValidationOutcome(true, null, null, plan);
    }

    public static PlanValidationOutcome invalid(PlanError error) {
        return new PlanValidationOutcome(false, error.describe(), error.code(), null);
    }
}
