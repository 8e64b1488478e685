package com.uiplan.infrastructure.planner.template;

import com.uiplan.infrastructure.planner.intent.IntentAnalysis;

import java.util.function.Predicate;

/**
 * One row of the template decision table.
 *
 * @param id        stable rule id, logged on selection
 * @param predicate fires on the classifier output
 * @param template  builds the root blueprint; receives the analysis and the sanitized text
 */
public record TemplateRule(
        String id,
        Predicate<IntentAnalysis> predicate,
        Template template
) {
    @FunctionalInterface
    public interface Template {
        NodeBlueprint build(IntentAnalysis analysis, String text);
    }

    public boolean matches(IntentAnalysis analysis) {
        return predicate.test(analysis);
    }
}
