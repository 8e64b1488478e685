package com.uiplan.infrastructure.planner.template;

import com.uiplan.infrastructure.planner.intent.IntentAnalysis;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class TemplateSelector {

    private final TemplateRegistry registry;

    public TemplateRule select(IntentAnalysis analysis) {
        for (TemplateRule rule : registry.getRules()) {
            if (rule.matches(analysis)) {
                log.info("[TemplateSelector] Selected {} for features={}, minimal={}",
                        rule.id(), analysis.features(), analysis.minimal());
                return rule;
            }
        }
        // The registry ends with an always-true rule
        throw new IllegalStateException("No template rule matched " + analysis);
    }
}
