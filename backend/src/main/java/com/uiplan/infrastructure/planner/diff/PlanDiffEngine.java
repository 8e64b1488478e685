package com.uiplan.infrastructure.planner.diff;

import com.uiplan.domain.plan.model.DiffType;
import com.uiplan.domain.plan.model.ModificationType;
import com.uiplan.domain.plan.model.Node;
import com.uiplan.domain.plan.model.NodeDiff;
import com.uiplan.domain.plan.model.Plan;
import com.uiplan.domain.plan.model.PlanDiff;
import com.uiplan.infrastructure.planner.codec.PlanJsonCodec;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Id-keyed structural comparison of two plans.
 * <p>
 * Nodes of the previous plan are classified first, in depth-first order, then nodes
 * that only exist in the current plan are appended in their own depth-first order.
 */
@Component
@RequiredArgsConstructor
public class PlanDiffEngine {

    private final PlanJsonCodec codec;

    /**
     * @param previous nullable; absent means everything in {@code current} is new
     */
    public PlanDiff diff(Plan previous, Plan current) {
        if (current.modificationType() == ModificationType.REGENERATE) {
            return new PlanDiff(ModificationType.REGENERATE, new LinkedHashSet<>(allNodeIds(current.root())), Map.of());
        }

        if (previous == null) {
            Map<String, NodeDiff> diffs = new LinkedHashMap<>();
            for (Node node : flatten(current.root())) {
                diffs.put(node.id(), new NodeDiff(DiffType.ADDED, node.id(), node.kind(), null, codec.propsAsMap(node)));
            }
            return new PlanDiff(ModificationType.CREATE, diffs.keySet(), diffs);
        }

        Map<String, Node> previousNodes = index(previous.root());
        Map<String, Node> currentNodes = index(current.root());
        Map<String, NodeDiff> diffs = new LinkedHashMap<>();
        Set<String> changed = new LinkedHashSet<>();

        previousNodes.forEach((id, before) -> {
            Node after = currentNodes.get(id);
            if (after == null) {
                diffs.put(id, new NodeDiff(DiffType.REMOVED, id, before.kind(), codec.propsAsMap(before), null));
                changed.add(id);
            } else if (!codec.serializeProps(before).equals(codec.serializeProps(after))) {
                diffs.put(id, new NodeDiff(DiffType.UPDATED, id, after.kind(),
                        codec.propsAsMap(before), codec.propsAsMap(after)));
                changed.add(id);
            } else {
                diffs.put(id, new NodeDiff(DiffType.UNCHANGED, id, after.kind(), null, codec.propsAsMap(after)));
            }
        });

        currentNodes.forEach((id, after) -> {
            if (!previousNodes.containsKey(id)) {
                diffs.put(id, new NodeDiff(DiffType.ADDED, id, after.kind(), null, codec.propsAsMap(after)));
                changed.add(id);
            }
        });

        return new PlanDiff(ModificationType.EDIT, changed, diffs);
    }

    public List<NodeDiff> changedNodes(PlanDiff diff) {
        return diff.diffs().values().stream()
                .filter(NodeDiff::isChange)
                .toList();
    }

    public boolean isNodeChanged(String nodeId, PlanDiff diff) {
        return diff.changedNodeIds().contains(nodeId);
    }

    /**
     * One-line human summary, e.g. "Added 1 component, Removed 2 components".
     */
    public String summarize(PlanDiff diff) {
        if (diff.modificationType() == ModificationType.CREATE) {
            return "Created UI with " + diff.diffs().size() + " components";
        }
        if (diff.modificationType() == ModificationType.REGENERATE) {
            return "Regenerated UI (" + diff.changedNodeIds().size() + " total components)";
        }
        List<String> parts = new ArrayList<>();
        appendCount(parts, "Added", count(diff, DiffType.ADDED));
        appendCount(parts, "Removed", count(diff, DiffType.REMOVED));
        appendCount(parts, "Updated", count(diff, DiffType.UPDATED));
        return parts.isEmpty() ? "No changes" : String.join(", ", parts);
    }

    public static List<Node> flatten(Node root) {
        List<Node> nodes = new ArrayList<>();
        collect(root, nodes);
        return nodes;
    }

    public static List<String> allNodeIds(Node root) {
        return flatten(root).stream().map(Node::id).toList();
    }

    private static void collect(Node node, List<Node> into) {
        into.add(node);
        for (Node child : node.children()) {
            collect(child, into);
        }
    }

    private static Map<String, Node> index(Node root) {
        Map<String, Node> nodes = new LinkedHashMap<>();
        for (Node node : flatten(root)) {
            nodes.put(node.id(), node);
        }
        return nodes;
    }

    private static long count(PlanDiff diff, DiffType type) {
        return diff.diffs().values().stream().filter(d -> d.type() == type).count();
    }

    private static void appendCount(List<String> parts, String verb, long count) {
        if (count > 0) {
            parts.add(verb + " " + count + " component" + (count > 1 ? "s" : ""));
        }
    }
}
