package com.uiplan.domain.plan.model;

/**
 * Success-with-plan XOR failure-with-error.
 */
public record PlanResult(
        Plan plan,
        PlanError error
) {
    public PlanResult {
        if ((plan == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of plan or error must be set");
        }
    }

    public static PlanResult success(Plan plan) {
        return new PlanResult(plan, null);
    }

    public static PlanResult failure(PlanError error) {
        return new PlanResult(null, error);
    }

    public boolean isSuccess() {
        return plan != null;
    }
}
