package com.uiplan.infrastructure.planner.template;

import com.uiplan.domain.plan.model.ComponentNode;
import com.uiplan.domain.plan.model.LayoutNode;
import com.uiplan.domain.plan.model.Node;
import com.uiplan.domain.plan.model.Plan;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Deterministic node ids: {@code <parentId>_<kind>_<index>}, where index is the ordinal
 * of the node among its siblings of the same kind. Never random, never time based.
 */
public final class NodeIdGenerator {

    private static final Pattern UNSAFE_ID_CHARS = Pattern.compile("[^a-zA-Z0-9_]");

    private NodeIdGenerator() {
    }

    public static String generate(String parentId, String kind, int index) {
        return UNSAFE_ID_CHARS.matcher(parentId + "_" + kind + "_" + index).replaceAll("_");
    }

    /**
     * Materialize a layout blueprint as the plan root (id {@code root}).
     */
    public static LayoutNode materializeRoot(NodeBlueprint blueprint) {
        if (!blueprint.layout()) {
            throw new IllegalStateException("Plan root must be a layout blueprint, got " + blueprint.kind());
        }
        return (LayoutNode) materialize(Plan.ROOT_ID, blueprint);
    }

    /**
     * Materialize a blueprint with the given id. Children are numbered in order,
     * each kind counted separately, before any grandchild is visited.
     */
    public static Node materialize(String id, NodeBlueprint blueprint) {
        List<String> childIds = childIds(id, blueprint.children());
        if (blueprint.layout()) {
            List<Node> children = new ArrayList<>();
            for (int i = 0; i < childIds.size(); i++) {
                children.add(materialize(childIds.get(i), blueprint.children().get(i)));
            }
            return new LayoutNode(id, blueprint.kind(), blueprint.layoutProps(), children);
        }
        List<ComponentNode> children = new ArrayList<>();
        for (int i = 0; i < childIds.size(); i++) {
            NodeBlueprint child = blueprint.children().get(i);
            if (child.layout()) {
                throw new IllegalStateException("Layout " + child.kind() + " cannot be nested in component " + blueprint.kind());
            }
            children.add((ComponentNode) materialize(childIds.get(i), child));
        }
        return new ComponentNode(id, blueprint.kind(), blueprint.props(), children);
    }

    private static List<String> childIds(String parentId, List<NodeBlueprint> children) {
        Map<String, Integer> perKind = new HashMap<>();
        List<String> ids = new ArrayList<>(children.size());
        for (NodeBlueprint child : children) {
            int index = perKind.merge(child.kind(), 1, Integer::sum) - 1;
            ids.add(generate(parentId, child.kind(), index));
        }
        return ids;
    }
}
