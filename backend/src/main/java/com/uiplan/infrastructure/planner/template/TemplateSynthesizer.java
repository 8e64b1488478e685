package com.uiplan.infrastructure.planner.template;

import com.uiplan.domain.plan.model.Plan;
import com.uiplan.infrastructure.planner.intent.IntentAnalysis;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds a fresh plan for create and regenerate requests.
 */
@Component
@RequiredArgsConstructor
public class TemplateSynthesizer {

    private final TemplateSelector templateSelector;

    public Plan synthesize(IntentAnalysis analysis, String text) {
        if (analysis.isEdit()) {
            throw new IllegalArgumentException("Edit requests are patched, not synthesized");
        }
        TemplateRule rule = templateSelector.select(analysis);
        NodeBlueprint blueprint = rule.template().build(analysis, text);
        return new Plan(analysis.modificationType(), NodeIdGenerator.materializeRoot(blueprint));
    }
}
