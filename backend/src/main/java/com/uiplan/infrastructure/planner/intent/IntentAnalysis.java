package com.uiplan.infrastructure.planner.intent;

import com.uiplan.domain.plan.model.ModificationType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Classifier output.
 *
 * @param modificationType create, edit or regenerate
 * @param features         resolved (negation-aware) structural flags; empty in edit mode
 * @param minimal          true when the instruction asks for a single bare card
 * @param title            card title for the minimal plan (nullable otherwise)
 */
public record IntentAnalysis(
        ModificationType modificationType,
        Set<StructuralFeature> features,
        boolean minimal,
        String title
) {
    public IntentAnalysis {
        features = features.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(StructuralFeature.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(features));
    }

    public static IntentAnalysis edit() {
        return new IntentAnalysis(ModificationType.EDIT, Set.of(), false, null);
    }

    public static IntentAnalysis minimal(ModificationType type, String title) {
        return new IntentAnalysis(type, Set.of(), true, title);
    }

    public static IntentAnalysis structural(ModificationType type, Set<StructuralFeature> features) {
        return new IntentAnalysis(type, features, false, null);
    }

    public boolean has(StructuralFeature feature) {
        return features.contains(feature);
    }

    public boolean hasAll(StructuralFeature... required) {
        for (StructuralFeature feature : required) {
            if (!features.contains(feature)) {
                return false;
            }
        }
        return true;
    }

    public boolean isEdit() {
        return modificationType == ModificationType.EDIT;
    }
}
