package com.uiplan.domain.plan.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Structural comparison of two plans. Iteration order of both collections is
 * depth-first, parent before children.
 */
public record PlanDiff(
        ModificationType modificationType,
        Set<String> changedNodeIds,
        Map<String, NodeDiff> diffs
) {
    public PlanDiff {
        changedNodeIds = Collections.unmodifiableSet(new LinkedHashSet<>(changedNodeIds));
        diffs = Collections.unmodifiableMap(new LinkedHashMap<>(diffs));
    }
}
