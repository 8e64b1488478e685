package com.uiplan.domain.plan.model;

import java.util.Objects;

/**
 * A complete UI description: a modification tag plus a layout root.
 */
public record Plan(
        ModificationType modificationType,
        LayoutNode root
) {
    public static final String ROOT_ID = "root";

    public Plan {
        Objects.requireNonNull(modificationType, "modificationType");
        Objects.requireNonNull(root, "root");
    }

    public Plan withModificationType(ModificationType type) {
        return type == modificationType ? this : new Plan(type, root);
    }
}
