package com.uiplan.infrastructure.planner;

import com.uiplan.domain.plan.model.ErrorCode;
import com.uiplan.domain.plan.model.InjectionCheckResult;
import com.uiplan.domain.plan.model.Plan;
import com.uiplan.domain.plan.model.PlanError;
import com.uiplan.domain.plan.model.PlanResult;
import com.uiplan.domain.plan.model.PlanValidationException;
import com.uiplan.infrastructure.planner.edit.EditModePatcher;
import com.uiplan.infrastructure.planner.intent.IntentAnalysis;
import com.uiplan.infrastructure.planner.intent.IntentClassifier;
import com.uiplan.infrastructure.planner.security.InjectionDetector;
import com.uiplan.infrastructure.planner.security.InputSanitizer;
import com.uiplan.infrastructure.planner.security.PlanValidator;
import com.uiplan.infrastructure.planner.template.TemplateSynthesizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Orchestrates one planning call:
 * <p>
 * validate prior plan → sanitize → injection screen → classify → synthesize | patch → validate
 * </p>
 * Stateless; every call sees only its own arguments.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlanningPipeline {

    private final InputSanitizer inputSanitizer;
    private final InjectionDetector injectionDetector;
    private final IntentClassifier intentClassifier;
    private final TemplateSynthesizer templateSynthesizer;
    private final EditModePatcher editModePatcher;
    private final PlanValidator planValidator;

    /**
     * @param text         raw instruction
     * @param previousPlan prior plan to edit or regenerate (nullable)
     */
    public PlanResult execute(String text, Plan previousPlan) {
        try {
            if (previousPlan != null) {
                planValidator.validateStructure(previousPlan.root());
            }

            String sanitized = inputSanitizer.sanitize(text);

            InjectionCheckResult injection = injectionDetector.check(sanitized);
            if (!injection.safe()) {
                return PlanResult.failure(PlanError.injection(injection.reason()));
            }

            IntentAnalysis analysis = intentClassifier.classify(sanitized, previousPlan);
            Plan plan = analysis.isEdit()
                    ? editModePatcher.patch(previousPlan, sanitized)
                    : templateSynthesizer.synthesize(analysis, sanitized);

            planValidator.validateStructure(plan.root());
            log.info("[PlanningPipeline] {} plan produced, root={}", plan.modificationType(), plan.root().kind());
            return PlanResult.success(plan);
        } catch (PlanValidationException e) {
            log.warn("[PlanningPipeline] Rejected: {}", e.getError().describe());
            return PlanResult.failure(e.getError());
        } catch (RuntimeException e) {
            log.error("[PlanningPipeline] Plan generation failed", e);
            return PlanResult.failure(PlanError.of(ErrorCode.PLAN_GENERATION_FAILURE,
                    "Plan generation failed: " + e.getMessage()));
        }
    }
}
