package com.uiplan.infrastructure.planner.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.uiplan.domain.plan.model.ComponentNode;
import com.uiplan.domain.plan.model.ErrorCode;
import com.uiplan.domain.plan.model.LayoutNode;
import com.uiplan.domain.plan.model.LayoutProps;
import com.uiplan.domain.plan.model.ModificationType;
import com.uiplan.domain.plan.model.Node;
import com.uiplan.domain.plan.model.Plan;
import com.uiplan.domain.plan.model.PlanError;
import com.uiplan.domain.plan.model.PlanValidationException;
import com.uiplan.infrastructure.planner.codec.PlanJsonCodec;
import com.uiplan.infrastructure.planner.config.ComponentWhitelist;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Type-checks a raw JSON tree against the plan schema and reads it into a {@link Plan}.
 * Structural rules (id format, uniqueness, empty layouts) are left to {@link PlanValidator}.
 */
@Component
@RequiredArgsConstructor
public class PlanSchemaReader {

    private static final Set<String> LAYOUT_PROP_KEYS = Set.of("gap", "padding", "columns");

    private final ComponentWhitelist whitelist;
    private final PlanJsonCodec codec;

    /**
     * @throws PlanValidationException on the first schema, whitelist or nesting violation
     */
    public Plan read(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw schema("$", "Plan must be a JSON object");
        }
        JsonNode type = json.get("modificationType");
        if (type == null || !type.isTextual()) {
            throw schema("modificationType", "Expected one of create, edit, regenerate");
        }
        ModificationType modificationType = ModificationType.fromWireName(type.asText())
                .orElseThrow(() -> schema("modificationType", "Unknown modification type '" + type.asText() + "'"));

        JsonNode root = json.get("root");
        if (root == null || !root.isObject()) {
            throw schema("root", "Root node is required");
        }
        String rootKind = root.path("component").asText(null);
        if (whitelist.isComponent(rootKind)) {
            throw schema("root.component", "Root must be a layout, got " + rootKind);
        }
        return new Plan(modificationType, (LayoutNode) readNode(root, "root", false));
    }

    private Node readNode(JsonNode json, String path, boolean insideComponent) {
        if (!json.isObject()) {
            throw schema(path, "Node must be a JSON object");
        }
        String id = requiredText(json, path, "id");
        String kind = requiredText(json, path, "component");

        if (whitelist.isLayout(kind)) {
            if (insideComponent) {
                throw new PlanValidationException(PlanError.atNode(ErrorCode.LAYOUT_NESTED_IN_COMPONENT,
                        "Layout " + kind + " cannot be nested inside a component", kind, id));
            }
            return readLayout(json, path, id, kind);
        }
        if (whitelist.isComponent(kind)) {
            return readComponent(json, path, id, kind);
        }
        throw new PlanValidationException(PlanError.unknownComponent(kind, id));
    }

    private LayoutNode readLayout(JsonNode json, String path, String id, String kind) {
        JsonNode props = json.get("props");
        if (props == null || !props.isObject()) {
            throw schema(path + ".props", "Layout props must be an object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = props.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            if (PlanValidator.FORBIDDEN_PROPS.contains(key)) {
                throw new PlanValidationException(PlanError.forbiddenProp(key, kind, id));
            }
            if (!LAYOUT_PROP_KEYS.contains(key)) {
                throw schema(path + ".props." + key, "Unrecognized layout prop '" + key + "'");
            }
            if (!field.getValue().isNumber()) {
                throw schema(path + ".props." + key, "Expected a number");
            }
        }
        LayoutProps layoutProps = new LayoutProps(numberOrNull(props, "gap"), numberOrNull(props, "padding"),
                numberOrNull(props, "columns"));

        JsonNode children = json.get("children");
        if (children == null || !children.isArray()) {
            throw schema(path + ".children", "Layout children must be an array");
        }
        List<Node> nodes = new ArrayList<>();
        for (int i = 0; i < children.size(); i++) {
            nodes.add(readNode(children.get(i), path + ".children." + i, false));
        }
        return new LayoutNode(id, kind, layoutProps, nodes);
    }

    private ComponentNode readComponent(JsonNode json, String path, String id, String kind) {
        JsonNode props = json.get("props");
        if (props == null || !props.isObject()) {
            throw schema(path + ".props", "Component props must be an object");
        }
        JsonNode children = json.get("children");
        List<ComponentNode> nodes = new ArrayList<>();
        if (children != null && !children.isNull()) {
            if (!children.isArray()) {
                throw schema(path + ".children", "Component children must be an array");
            }
            for (int i = 0; i < children.size(); i++) {
                nodes.add((ComponentNode) readNode(children.get(i), path + ".children." + i, true));
            }
        }
        return new ComponentNode(id, kind, codec.toPropsMap(props), nodes);
    }

    private static String requiredText(JsonNode json, String path, String field) {
        JsonNode value = json.get(field);
        if (value == null || !value.isTextual()) {
            throw schema(path + "." + field, "Expected a string");
        }
        return value.asText();
    }

    /**
     * Whole numbers that fit an int are read as Integer, anything else as Double.
     */
    private static Number numberOrNull(JsonNode props, String key) {
        JsonNode value = props.get(key);
        if (value == null) {
            return null;
        }
        if (value.canConvertToExactIntegral() && value.canConvertToInt()) {
            return value.intValue();
        }
        return value.doubleValue();
    }

    private static PlanValidationException schema(String path, String message) {
        return new PlanValidationException(PlanError.schema(path, message));
    }
}
