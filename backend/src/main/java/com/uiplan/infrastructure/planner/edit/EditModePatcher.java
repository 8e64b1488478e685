package com.uiplan.infrastructure.planner.edit;

import com.uiplan.domain.plan.model.ComponentNode;
import com.uiplan.domain.plan.model.DiffType;
import com.uiplan.domain.plan.model.LayoutNode;
import com.uiplan.domain.plan.model.ModificationType;
import com.uiplan.domain.plan.model.Node;
import com.uiplan.domain.plan.model.NodeVisitor;
import com.uiplan.domain.plan.model.Plan;
import com.uiplan.domain.plan.model.PlanDiff;
import com.uiplan.infrastructure.planner.diff.PlanDiffEngine;
import com.uiplan.infrastructure.planner.template.NodeBlueprint;
import com.uiplan.infrastructure.planner.template.NodeIdGenerator;
import com.uiplan.infrastructure.planner.template.PlaceholderContent;
import com.uiplan.infrastructure.planner.template.Props;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.uiplan.domain.plan.model.UiKinds.*;
import static com.uiplan.infrastructure.planner.template.NodeBlueprint.component;

/**
 * Applies an edit instruction to a prior plan without rebuilding it.
 * <p>
 * Removals delete every node of a removed kind; additions are appended to the root.
 * Subtrees that no directive touches are carried over as the same instances, and
 * the caller's plan is never modified.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EditModePatcher {

    private final PlanDiffEngine diffEngine;
    private final PlaceholderContent placeholders;

    public Plan patch(Plan previous, String text) {
        EditDirectives directives = EditDirectives.parse(text);
        if (directives.isEmpty()) {
            log.info("[EditModePatcher] No recognized edit directive, re-tagging prior plan");
            return previous.withModificationType(ModificationType.EDIT);
        }

        LayoutNode root = previous.root();
        for (String kind : directives.removals()) {
            root = (LayoutNode) removeKind(root, kind, true);
        }
        root = elideWrapper(previous, root);

        List<NodeBlueprint> additions = additions(directives);
        if (!additions.isEmpty()) {
            root = append(root, additions);
        }

        log.info("[EditModePatcher] Removed {}, added {} node(s), root={}",
                directives.removals(), additions.size(), root.id());
        return new Plan(ModificationType.EDIT, root);
    }

    /**
     * Returns the same instance when nothing below {@code node} was removed.
     * Non-root layouts emptied by the removal are dropped as well.
     */
    private Node removeKind(Node node, String kind, boolean isRoot) {
        return node.accept(new NodeVisitor<Node>() {
            @Override
            public Node visitLayout(LayoutNode layout) {
                List<Node> kept = new ArrayList<>();
                boolean changed = false;
                for (Node child : layout.children()) {
                    if (child.kind().equals(kind)) {
                        changed = true;
                        continue;
                    }
                    Node patched = removeKind(child, kind, false);
                    if (patched == null) {
                        changed = true;
                        continue;
                    }
                    changed |= patched != child;
                    kept.add(patched);
                }
                if (!changed) {
                    return layout;
                }
                if (kept.isEmpty() && !isRoot) {
                    return null;
                }
                return layout.withChildren(kept);
            }

            @Override
            public Node visitComponent(ComponentNode component) {
                List<ComponentNode> kept = new ArrayList<>();
                boolean changed = false;
                for (ComponentNode child : component.children()) {
                    if (child.kind().equals(kind)) {
                        changed = true;
                        continue;
                    }
                    ComponentNode patched = (ComponentNode) removeKind(child, kind, false);
                    changed |= patched != child;
                    kept.add(patched);
                }
                return changed ? component.withChildren(kept) : component;
            }
        });
    }

    /**
     * A root that held two children and now holds a single layout, because the
     * other child was removed, is replaced by that layout.
     */
    private LayoutNode elideWrapper(Plan previous, LayoutNode root) {
        List<Node> before = previous.root().children();
        if (root == previous.root() || before.size() != 2 || root.children().size() != 1) {
            return root;
        }
        if (!(root.children().get(0) instanceof LayoutNode survivor)) {
            return root;
        }
        PlanDiff diff = diffEngine.diff(previous, new Plan(ModificationType.EDIT, root));
        boolean otherRemoved = before.stream()
                .filter(child -> !child.id().equals(survivor.id()))
                .map(child -> diff.diffs().get(child.id()))
                .anyMatch(d -> d != null && d.type() == DiffType.REMOVED);
        if (!otherRemoved) {
            return root;
        }
        log.info("[EditModePatcher] Promoting {} to root", survivor.id());
        return survivor;
    }

    private List<NodeBlueprint> additions(EditDirectives directives) {
        List<NodeBlueprint> additions = new ArrayList<>();
        if (directives.addModal()) {
            List<NodeBlueprint> inputs = directives.addModalInputs()
                    ? List.of(setting("Setting 1"), setting("Setting 2"))
                    : List.of();
            additions.add(component(MODAL, Props.of("isOpen", false, "title", "Settings"), inputs));
        }
        if (directives.addChart()) {
            additions.add(component(CARD, Props.of("title", "Chart", "padding", 16),
                    component(CHART, placeholders.chart(PlaceholderContent.EDIT_ADDITION).toProps())));
        }
        if (directives.addTable()) {
            additions.add(component(CARD, Props.of("title", "Table", "padding", 16),
                    component(TABLE, placeholders.table(PlaceholderContent.EDIT_ADDITION).toProps())));
        }
        return additions;
    }

    private static NodeBlueprint setting(String label) {
        return component(INPUT, Props.of("label", label, "type", "text", "placeholder", "Enter value"));
    }

    /**
     * Appends new subtrees under {@code parent}. Each takes the next per-kind index
     * among the parent's children, skipping any index whose ids are already in use.
     */
    private LayoutNode append(LayoutNode parent, List<NodeBlueprint> additions) {
        Set<String> usedIds = new HashSet<>(PlanDiffEngine.allNodeIds(parent));
        List<Node> children = new ArrayList<>(parent.children());
        for (NodeBlueprint blueprint : additions) {
            int index = (int) children.stream().filter(c -> c.kind().equals(blueprint.kind())).count();
            Node added = NodeIdGenerator.materialize(NodeIdGenerator.generate(parent.id(), blueprint.kind(), index), blueprint);
            while (collides(added, usedIds)) {
                index++;
                added = NodeIdGenerator.materialize(NodeIdGenerator.generate(parent.id(), blueprint.kind(), index), blueprint);
            }
            usedIds.addAll(PlanDiffEngine.allNodeIds(added));
            children.add(added);
        }
        return parent.withChildren(children);
    }

    private static boolean collides(Node subtree, Set<String> usedIds) {
        return PlanDiffEngine.allNodeIds(subtree).stream().anyMatch(usedIds::contains);
    }
}
