package com.uiplan.domain.plan.model;

/**
 * Exhaustive dispatch over the two {@link Node} variants.
 */
public interface NodeVisitor<R> {

    R visitLayout(LayoutNode node);

    R visitComponent(ComponentNode node);
}
