package com.uiplan.domain.plan.model;

import java.util.List;

/**
 * A node of a UI plan tree. Either a {@link LayoutNode} (container) or a
 * {@link ComponentNode} (whitelisted UI element).
 */
public sealed interface Node permits LayoutNode, ComponentNode {

    String id();

    String kind();

    /**
     * Child nodes in order. Never null; leaf components return an empty list.
     */
    List<? extends Node> children();

    <R> R accept(NodeVisitor<R> visitor);
}
