package com.uiplan.infrastructure.planner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.uiplan.domain.plan.model.Node;
import com.uiplan.domain.plan.model.Plan;
import com.uiplan.infrastructure.planner.codec.PlanJsonCodec;
import com.uiplan.infrastructure.planner.config.ComponentWhitelist;
import com.uiplan.infrastructure.planner.diff.PlanDiffEngine;
import com.uiplan.infrastructure.planner.edit.EditModePatcher;
import com.uiplan.infrastructure.planner.intent.IntentClassifier;
import com.uiplan.infrastructure.planner.intent.MinimalIntentDetector;
import com.uiplan.infrastructure.planner.security.InjectionDetector;
import com.uiplan.infrastructure.planner.security.InputSanitizer;
import com.uiplan.infrastructure.planner.security.PlanSchemaReader;
import com.uiplan.infrastructure.planner.security.PlanValidator;
import com.uiplan.infrastructure.planner.template.FormFieldDetector;
import com.uiplan.infrastructure.planner.template.PlaceholderContent;
import com.uiplan.infrastructure.planner.template.PlanTemplates;
import com.uiplan.infrastructure.planner.template.TemplateRegistry;
import com.uiplan.infrastructure.planner.template.TemplateSelector;
import com.uiplan.infrastructure.planner.template.TemplateSynthesizer;

import java.util.NoSuchElementException;

/**
 * Hand-wired planner components for unit tests.
 */
public final class PlannerFixtures {

    private PlannerFixtures() {
    }

    public static PlanJsonCodec codec() {
        return new PlanJsonCodec(new ObjectMapper());
    }

    public static PlanValidator validator() {
        return validator(new ComponentWhitelist());
    }

    public static PlanValidator validator(ComponentWhitelist whitelist) {
        PlanJsonCodec codec = codec();
        return new PlanValidator(whitelist, new PlanSchemaReader(whitelist, codec), codec);
    }

    public static IntentClassifier classifier() {
        return new IntentClassifier(new MinimalIntentDetector(), "Welcome");
    }

    public static TemplateSelector selector() {
        return selector(PlaceholderContent.defaults());
    }

    public static TemplateSelector selector(PlaceholderContent placeholders) {
        return new TemplateSelector(new TemplateRegistry(new PlanTemplates(placeholders, new FormFieldDetector())));
    }

    public static TemplateSynthesizer synthesizer() {
        return new TemplateSynthesizer(selector());
    }

    public static PlanDiffEngine diffEngine() {
        return new PlanDiffEngine(codec());
    }

    public static EditModePatcher patcher() {
        return new EditModePatcher(diffEngine(), PlaceholderContent.defaults());
    }

    public static PlanningPipeline pipeline() {
        return new PlanningPipeline(new InputSanitizer(2000), new InjectionDetector(), classifier(),
                synthesizer(), patcher(), validator());
    }

    /**
     * Classifies and synthesizes the instruction with no prior plan.
     */
    public static Plan create(String text) {
        return synthesizer().synthesize(classifier().classify(text, null), text);
    }

    public static Node find(Plan plan, String id) {
        return PlanDiffEngine.flatten(plan.root()).stream()
                .filter(node -> node.id().equals(id))
                .findFirst()
                .orElseThrow(() -> new NoSuchElementException("No node " + id));
    }

    public static boolean contains(Plan plan, String id) {
        return PlanDiffEngine.allNodeIds(plan.root()).contains(id);
    }
}
