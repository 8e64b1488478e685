package com.uiplan.domain.plan.model;

public record InjectionCheckResult(
        boolean safe,
        String reason
) {
    public static InjectionCheckResult passed() {
        return new InjectionCheckResult(true, null);
    }

    public static InjectionCheckResult blocked(String reason) {
        return new InjectionCheckResult(false, reason);
    }
}
