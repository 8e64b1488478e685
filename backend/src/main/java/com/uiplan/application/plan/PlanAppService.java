package com.uiplan.application.plan;

import com.uiplan.domain.plan.model.Plan;
import com.uiplan.domain.plan.model.PlanDiff;
import com.uiplan.domain.plan.model.PlanResult;
import com.uiplan.domain.plan.model.PlanValidationOutcome;
import com.uiplan.domain.plan.service.UiPlanService;
import com.uiplan.infrastructure.planner.PlanningPipeline;
import com.uiplan.infrastructure.planner.diff.PlanDiffEngine;
import com.uiplan.infrastructure.planner.security.PlanValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class PlanAppService implements UiPlanService {

    private final PlanningPipeline planningPipeline;
    private final PlanDiffEngine planDiffEngine;
    private final PlanValidator planValidator;

    @Override
    public PlanResult planFromIntent(String text, Plan previousPlan) {
        PlanResult result = planningPipeline.execute(text, previousPlan);
        if (result.isSuccess()) {
            log.info("[PlanAppService] planFromIntent ok: {}", result.plan().modificationType());
        } else {
            log.info("[PlanAppService] planFromIntent failed: {}", result.error().code());
        }
        return result;
    }

    @Override
    public PlanDiff diffPlans(Plan previous, Plan current) {
        PlanDiff diff = planDiffEngine.diff(previous, current);
        log.debug("[PlanAppService] {}", planDiffEngine.summarize(diff));
        return diff;
    }

    @Override
    public PlanValidationOutcome validatePlan(Object raw) {
        return planValidator.validateRaw(raw);
    }
}
