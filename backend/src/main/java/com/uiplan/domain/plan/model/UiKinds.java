package com.uiplan.domain.plan.model;

/**
 * Kind names of the built-in component set. The set actually accepted at
 * validation time comes from the configured whitelist.
 */
public final class UiKinds {

    public static final String COLUMN_LAYOUT = "ColumnLayout";
    public static final String ROW_LAYOUT = "RowLayout";
    public static final String GRID_LAYOUT = "GridLayout";

    public static final String BUTTON = "Button";
    public static final String CARD = "Card";
    public static final String INPUT = "Input";
    public static final String TABLE = "Table";
    public static final String MODAL = "Modal";
    public static final String SIDEBAR = "Sidebar";
    public static final String NAVBAR = "Navbar";
    public static final String CHART = "Chart";

    private UiKinds() {
    }
}
