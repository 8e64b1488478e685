package com.uiplan.infrastructure.planner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

import static com.uiplan.domain.plan.model.UiKinds.*;

/**
 * Authoritative set of node kinds, split into layout containers and UI components.
 * Bound from {@code uiplan.whitelist.*}; the defaults are the built-in component set.
 */
@ConfigurationProperties(prefix = "uiplan.whitelist")
public class ComponentWhitelist {

    private List<String> layouts = new ArrayList<>(List.of(COLUMN_LAYOUT, ROW_LAYOUT, GRID_LAYOUT));
    private List<String> components = new ArrayList<>(
            List.of(BUTTON, CARD, INPUT, TABLE, MODAL, SIDEBAR, NAVBAR, CHART));

    public List<String> getLayouts() { return layouts; }
    public void setLayouts(List<String> layouts) { this.layouts = layouts; }

    public List<String> getComponents() { return components; }
    public void setComponents(List<String> components) { this.components = components; }

    public boolean isLayout(String kind) {
        return kind != null && layouts.contains(kind);
    }

    public boolean isComponent(String kind) {
        return kind != null && components.contains(kind);
    }

    public boolean isAllowed(String kind) {
        return isLayout(kind) || isComponent(kind);
    }
}
