package com.uiplan.domain.plan.model;

/**
 * Terminal error classes of the planning core.
 */
public enum ErrorCode {
    INJECTION_DETECTED,
    INVALID_INPUT,
    SCHEMA_VIOLATION,
    FORBIDDEN_PROP,
    UNKNOWN_COMPONENT,
    INVALID_ID,
    EMPTY_LAYOUT_CHILDREN,
    LAYOUT_NESTED_IN_COMPONENT,
    PLAN_GENERATION_FAILURE;

    public boolean isStructuralInvariantViolation() {
        return this == EMPTY_LAYOUT_CHILDREN || this == LAYOUT_NESTED_IN_COMPONENT;
    }

    /**
     * Only a generation failure is a server-side fault; every other code is caused by the caller's input.
     */
    public boolean isClientError() {
        return this != PLAN_GENERATION_FAILURE;
    }
}
