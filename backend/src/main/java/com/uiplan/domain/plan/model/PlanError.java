package com.uiplan.domain.plan.model;

/**
 * Error details. Context fields are nullable and set only where they apply.
 *
 * @param nodeId offending node id
 * @param kind   offending node kind
 * @param key    offending prop key (FORBIDDEN_PROP)
 * @param path   dotted schema path (SCHEMA_VIOLATION)
 */
public record PlanError(
        ErrorCode code,
        String message,
        String nodeId,
        String kind,
        String key,
        String path
) {
    public static PlanError of(ErrorCode code, String message) {
        return new PlanError(code, message, null, null, null, null);
    }

    public static PlanError injection(String reason) {
        return new PlanError(ErrorCode.INJECTION_DETECTED, reason, null, null, null, null);
    }

    public static PlanError schema(String path, String message) {
        return new PlanError(ErrorCode.SCHEMA_VIOLATION, message, null, null, null, path);
    }

    public static PlanError forbiddenProp(String key, String kind, String nodeId) {
        return new PlanError(ErrorCode.FORBIDDEN_PROP,
                "Prop '" + key + "' is not allowed on " + kind,
                nodeId, kind, key, null);
    }

    public static PlanError unknownComponent(String kind, String nodeId) {
        return new PlanError(ErrorCode.UNKNOWN_COMPONENT,
                "Component '" + kind + "' is not whitelisted here",
                nodeId, kind, null, null);
    }

    public static PlanError atNode(ErrorCode code, String message, String kind, String nodeId) {
        return new PlanError(code, message, nodeId, kind, null, null);
    }

    /**
     * Flat "CODE: message" form used by the validation boundary.
     */
    public String describe() {
        return code.name() + ": " + message + (nodeId != null ? " (node " + nodeId + ")" : "");
    }
}
