package com.uiplan.infrastructure.planner.template;

import com.uiplan.domain.plan.model.LayoutProps;

import java.util.List;
import java.util.Map;

/**
 * Node shape without an id. Ids are assigned when the blueprint is materialized
 * under a parent, see {@link NodeIdGenerator}.
 *
 * @param layoutProps set for layout blueprints only
 * @param props       set for component blueprints only
 */
public record NodeBlueprint(
        String kind,
        boolean layout,
        LayoutProps layoutProps,
        Map<String, Object> props,
        List<NodeBlueprint> children
) {
    public NodeBlueprint {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static NodeBlueprint layout(String kind, LayoutProps props, NodeBlueprint... children) {
        return new NodeBlueprint(kind, true, props, null, List.of(children));
    }

    public static NodeBlueprint layout(String kind, LayoutProps props, List<NodeBlueprint> children) {
        return new NodeBlueprint(kind, true, props, null, children);
    }

    public static NodeBlueprint component(String kind, Map<String, Object> props, NodeBlueprint... children) {
        return new NodeBlueprint(kind, false, null, props, List.of(children));
    }

    public static NodeBlueprint component(String kind, Map<String, Object> props, List<NodeBlueprint> children) {
        return new NodeBlueprint(kind, false, null, props, children);
    }
}
