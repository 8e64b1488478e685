package com.uiplan.domain.plan.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Whitelisted UI element. Children, when present, are components only.
 *
 * @param props component-specific values; insertion order is preserved so that
 *              serialization stays byte-stable
 */
public record ComponentNode(
        String id,
        String kind,
        Map<String, Object> props,
        List<ComponentNode> children
) implements Node {

    public ComponentNode {
        props = props == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(props));
        children = children == null ? List.of() : List.copyOf(children);
    }

    public ComponentNode(String id, String kind, Map<String, Object> props) {
        this(id, kind, props, List.of());
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public ComponentNode withChildren(List<ComponentNode> newChildren) {
        return new ComponentNode(id, kind, props, newChildren);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitComponent(this);
    }
}
