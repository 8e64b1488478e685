package com.uiplan.infrastructure.planner.security;

import com.uiplan.domain.plan.model.ComponentNode;
import com.uiplan.domain.plan.model.ErrorCode;
import com.uiplan.domain.plan.model.LayoutNode;
import com.uiplan.domain.plan.model.Node;
import com.uiplan.domain.plan.model.NodeVisitor;
import com.uiplan.domain.plan.model.Plan;
import com.uiplan.domain.plan.model.PlanError;
import com.uiplan.domain.plan.model.PlanResult;
import com.uiplan.domain.plan.model.PlanValidationException;
import com.uiplan.domain.plan.model.PlanValidationOutcome;
import com.uiplan.infrastructure.planner.codec.PlanJsonCodec;
import com.uiplan.infrastructure.planner.config.ComponentWhitelist;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Whitelist and structure checks for plans, both generated and caller-supplied.
 * <p>
 * Every check fails closed on the first violation. Validation never changes a plan,
 * so a plan that passes once passes again unchanged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlanValidator {

    static final Set<String> FORBIDDEN_PROPS = Set.of("style", "className", "css", "dangerouslySetInnerHTML");

    private static final Pattern ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_]+$");

    private final ComponentWhitelist whitelist;
    private final PlanSchemaReader schemaReader;
    private final PlanJsonCodec codec;

    public static boolean isForbiddenProp(String key) {
        return FORBIDDEN_PROPS.contains(key);
    }

    public void validateProps(Map<String, ?> props, String kind) {
        validateProps(props, kind, null);
    }

    public void validateProps(Map<String, ?> props, String kind, String nodeId) {
        if (props == null) {
            return;
        }
        for (String key : props.keySet()) {
            if (FORBIDDEN_PROPS.contains(key)) {
                throw new PlanValidationException(PlanError.forbiddenProp(key, kind, nodeId));
            }
        }
    }

    /**
     * Recursive structure check from the given node down.
     *
     * @throws PlanValidationException on the first violation
     */
    public void validateStructure(Node root) {
        root.accept(new StructureCheck());
    }

    public PlanResult validatePlan(Plan plan) {
        try {
            validateStructure(plan.root());
            return PlanResult.success(plan);
        } catch (PlanValidationException e) {
            log.warn("[PlanValidator] Plan rejected: {}", e.getError().describe());
            return PlanResult.failure(e.getError());
        }
    }

    /**
     * Boundary validation of an untyped value: a Plan, a JSON map structure,
     * a Jackson tree or a JSON string.
     */
    public PlanValidationOutcome validateRaw(Object raw) {
        try {
            if (raw == null) {
                throw new PlanValidationException(PlanError.schema("$", "Plan is required"));
            }
            Plan plan = raw instanceof Plan typed ? typed : schemaReader.read(codec.toTree(raw));
            validateStructure(plan.root());
            return PlanValidationOutcome.valid(plan);
        } catch (PlanValidationException e) {
            log.info("[PlanValidator] Raw plan rejected: {}", e.getError().describe());
            return PlanValidationOutcome.invalid(e.getError());
        }
    }

    private final class StructureCheck implements NodeVisitor<Void> {

        private final Set<String> seenIds = new HashSet<>();
        private boolean insideComponent;

        @Override
        public Void visitLayout(LayoutNode layout) {
            checkId(layout);
            if (!whitelist.isLayout(layout.kind())) {
                throw new PlanValidationException(PlanError.unknownComponent(layout.kind(), layout.id()));
            }
            if (layout.children().isEmpty()) {
                throw new PlanValidationException(PlanError.atNode(ErrorCode.EMPTY_LAYOUT_CHILDREN,
                        "Layout must have at least one child", layout.kind(), layout.id()));
            }
            for (Node child : layout.children()) {
                child.accept(this);
            }
            return null;
        }

        @Override
        public Void visitComponent(ComponentNode component) {
            checkId(component);
            if (whitelist.isLayout(component.kind()) && insideComponent) {
                throw new PlanValidationException(PlanError.atNode(ErrorCode.LAYOUT_NESTED_IN_COMPONENT,
                        "Layout " + component.kind() + " cannot be nested inside a component",
                        component.kind(), component.id()));
            }
            if (!whitelist.isComponent(component.kind())) {
                throw new PlanValidationException(PlanError.unknownComponent(component.kind(), component.id()));
            }
            validateProps(component.props(), component.kind(), component.id());
            component.props().forEach((key, value) -> {
                if (!isJsonCompatible(value)) {
                    throw new PlanValidationException(new PlanError(ErrorCode.SCHEMA_VIOLATION,
                            "Prop '" + key + "' is not a JSON-compatible value",
                            component.id(), component.kind(), key, component.id() + ".props." + key));
                }
            });

            boolean outer = insideComponent;
            insideComponent = true;
            for (ComponentNode child : component.children()) {
                child.accept(this);
            }
            insideComponent = outer;
            return null;
        }

        private void checkId(Node node) {
            String id = node.id();
            if (id == null || !ID_PATTERN.matcher(id).matches()) {
                throw new PlanValidationException(PlanError.atNode(ErrorCode.INVALID_ID,
                        "Invalid id format: " + id, node.kind(), id));
            }
            if (!seenIds.add(id)) {
                throw new PlanValidationException(PlanError.atNode(ErrorCode.INVALID_ID,
                        "Duplicate id: " + id, node.kind(), id));
            }
        }
    }

    static boolean isJsonCompatible(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean
                || value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger || value instanceof BigDecimal) {
            return true;
        }
        if (value instanceof Double d) {
            return Double.isFinite(d);
        }
        if (value instanceof Float f) {
            return Float.isFinite(f);
        }
        if (value instanceof Collection<?> items) {
            return items.stream().allMatch(PlanValidator::isJsonCompatible);
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String) || !isJsonCompatible(entry.getValue())) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }
}
