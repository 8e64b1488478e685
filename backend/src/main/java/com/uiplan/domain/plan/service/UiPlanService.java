package com.uiplan.domain.plan.service;

import com.uiplan.domain.plan.model.Plan;
import com.uiplan.domain.plan.model.PlanDiff;
import com.uiplan.domain.plan.model.PlanResult;
import com.uiplan.domain.plan.model.PlanValidationOutcome;

public interface UiPlanService {

    /**
     * @param previousPlan nullable; when present the instruction may edit or regenerate it
     */
    PlanResult planFromIntent(String text, Plan previousPlan);

    PlanDiff diffPlans(Plan previous, Plan current);

    /**
     * @param raw a Plan, a JSON-compatible map, a Jackson tree or a JSON string
     */
    PlanValidationOutcome validatePlan(Object raw);
}
