package com.uiplan.domain.plan.model;

import java.util.Arrays;
import java.util.Optional;

public enum ModificationType {
    CREATE("create"),
    EDIT("edit"),
    REGENERATE("regenerate");

    private final String wireName;

    ModificationType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ModificationType> fromWireName(String value) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(value))
                .findFirst();
    }
}
