package com.uiplan.infrastructure.planner.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.uiplan.domain.plan.model.ComponentNode;
import com.uiplan.domain.plan.model.LayoutNode;
import com.uiplan.domain.plan.model.LayoutProps;
import com.uiplan.domain.plan.model.Node;
import com.uiplan.domain.plan.model.NodeVisitor;
import com.uiplan.domain.plan.model.Plan;
import com.uiplan.domain.plan.model.PlanError;
import com.uiplan.domain.plan.model.PlanValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Plan to JSON and back to a JSON tree.
 * <p>
 * Wire shape: {@code {"modificationType": "...", "root": node}} where a node is
 * {@code {"id", "component", "props", "children"}}. {@code children} is omitted for
 * leaf components and always written for layouts. Field order is fixed.
 */
@Component
@RequiredArgsConstructor
public class PlanJsonCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ObjectNode toJsonTree(Plan plan) {
        ObjectNode json = objectMapper.createObjectNode();
        json.put("modificationType", plan.modificationType().wireName());
        json.set("root", nodeToJson(plan.root()));
        return json;
    }

    public String toJson(Plan plan) {
        return write(toJsonTree(plan));
    }

    public Map<String, Object> toMap(Plan plan) {
        return objectMapper.convertValue(toJsonTree(plan), MAP_TYPE);
    }

    public ObjectNode nodeToJson(Node node) {
        return node.accept(new NodeVisitor<ObjectNode>() {
            @Override
            public ObjectNode visitLayout(LayoutNode layout) {
                ObjectNode json = header(layout);
                ArrayNode children = json.putArray("children");
                layout.children().forEach(child -> children.add(nodeToJson(child)));
                return json;
            }

            @Override
            public ObjectNode visitComponent(ComponentNode component) {
                ObjectNode json = header(component);
                if (component.hasChildren()) {
                    ArrayNode children = json.putArray("children");
                    component.children().forEach(child -> children.add(nodeToJson(child)));
                }
                return json;
            }
        });
    }

    /**
     * Props of either node variant as a JSON object; absent layout props are left out.
     */
    public ObjectNode propsOf(Node node) {
        return node.accept(new NodeVisitor<ObjectNode>() {
            @Override
            public ObjectNode visitLayout(LayoutNode layout) {
                LayoutProps props = layout.props();
                ObjectNode json = objectMapper.createObjectNode();
                putNumber(json, "gap", props.gap());
                putNumber(json, "padding", props.padding());
                putNumber(json, "columns", props.columns());
                return json;
            }

            @Override
            public ObjectNode visitComponent(ComponentNode component) {
                return objectMapper.valueToTree(component.props());
            }
        });
    }

    /**
     * Canonical props text, used to decide whether a node changed between plans.
     */
    public String serializeProps(Node node) {
        return write(propsOf(node));
    }

    public Map<String, Object> propsAsMap(Node node) {
        return objectMapper.convertValue(propsOf(node), MAP_TYPE);
    }

    public Map<String, Object> toPropsMap(JsonNode json) {
        return objectMapper.convertValue(json, MAP_TYPE);
    }

    /**
     * Lift a caller-supplied value to a JSON tree: a Plan, an existing JsonNode,
     * a JSON string, or a map structure.
     *
     * @throws PlanValidationException SCHEMA_VIOLATION when the value is not JSON
     */
    public JsonNode toTree(Object raw) {
        if (raw instanceof Plan plan) {
            return toJsonTree(plan);
        }
        if (raw instanceof JsonNode json) {
            return json;
        }
        if (raw instanceof String text) {
            try {
                return objectMapper.readTree(text);
            } catch (JsonProcessingException e) {
                throw new PlanValidationException(PlanError.schema("$", "Malformed JSON: " + e.getOriginalMessage()));
            }
        }
        try {
            return objectMapper.valueToTree(raw);
        } catch (IllegalArgumentException e) {
            throw new PlanValidationException(PlanError.schema("$", "Value is not JSON-compatible: " + e.getMessage()));
        }
    }

    private String write(JsonNode json) {
        try {
            return objectMapper.writeValueAsString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize plan JSON", e);
        }
    }

    private static void putNumber(ObjectNode json, String key, Number value) {
        if (value instanceof Integer whole) {
            json.put(key, whole);
        } else if (value != null) {
            json.put(key, value.doubleValue());
        }
    }

    private ObjectNode header(Node node) {
        ObjectNode json = objectMapper.createObjectNode();
        json.put("id", node.id());
        json.put("component", node.kind());
        json.set("props", propsOf(node));
        return json;
    }
}
