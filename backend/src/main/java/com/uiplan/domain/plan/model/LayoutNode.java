package com.uiplan.domain.plan.model;

import java.util.List;

/**
 * Container node (ColumnLayout, RowLayout, GridLayout). May hold layouts and components.
 */
public record LayoutNode(
        String id,
        String kind,
        LayoutProps props,
        List<Node> children
) implements Node {

    public LayoutNode {
        props = props == null ? LayoutProps.empty() : props;
        children = children == null ? List.of() : List.copyOf(children);
    }

    public LayoutNode withChildren(List<Node> newChildren) {
        return new LayoutNode(id, kind, props, newChildren);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLayout(this);
    }
}
