package com.uiplan.domain.plan.model;

/**
 * Props accepted by layout containers. All fields are optional JSON numbers;
 * whole values are held as {@link Integer} so they serialize without a fraction.
 *
 * @param gap     spacing between children
 * @param padding inner padding
 * @param columns column count (GridLayout only)
 */
public record LayoutProps(
        Number gap,
        Number padding,
        Number columns
) {
    public static LayoutProps of(int gap, int padding) {
        return new LayoutProps(gap, padding, null);
    }

    public static LayoutProps grid(int gap, int padding, int columns) {
        return new LayoutProps(gap, padding, columns);
    }

    public static LayoutProps empty() {
        return new LayoutProps(null, null, null);
    }
}
