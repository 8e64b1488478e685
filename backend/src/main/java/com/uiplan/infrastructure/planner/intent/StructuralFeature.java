package com.uiplan.infrastructure.planner.intent;

import java.util.List;

/**
 * Structural concepts that can be requested in an instruction.
 * Keyword-driven concepts carry the words that name them.
 */
public enum StructuralFeature {
    SIDEBAR("sidebar", "side bar"),
    NAVBAR("navbar", "nav bar", "navigation"),
    TWO_COLUMNS,
    CHART("chart", "graph"),
    TABLE("table"),
    FORM("form", "input", "login"),
    MODAL("modal", "dialog"),
    DASHBOARD("dashboard", "overview"),

    // Specialized single-card archetypes
    PRODUCT_CARD,
    ITEM_CARD,
    PROFILE_CARD,
    STAT_CARD,
    HERO,
    GALLERY,
    TESTIMONIAL,
    PRICING,
    SEARCH_BAR;

    private final List<String> keywords;

    StructuralFeature(String... keywords) {
        this.keywords = List.of(keywords);
    }

    /**
     * Words that name this concept; empty for phrase- and pattern-detected features.
     */
    public List<String> keywords() {
        return keywords;
    }
}
