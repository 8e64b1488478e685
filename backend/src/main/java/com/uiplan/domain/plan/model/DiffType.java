package com.uiplan.domain.plan.model;

public enum DiffType {
    ADDED,
    REMOVED,
    UPDATED,
    UNCHANGED
}
