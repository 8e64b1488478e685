package com.uiplan.infrastructure.planner.template;

import com.uiplan.domain.plan.model.LayoutProps;
import com.uiplan.infrastructure.planner.intent.IntentAnalysis;
import com.uiplan.infrastructure.planner.intent.StructuralFeature;
import com.uiplan.infrastructure.planner.template.FormFieldDetector.FormField;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.uiplan.domain.plan.model.UiKinds.*;
import static com.uiplan.infrastructure.planner.template.NodeBlueprint.component;
import static com.uiplan.infrastructure.planner.template.NodeBlueprint.layout;

/**
 * Root blueprints for every plan template. Ids are not assigned here.
 */
@Component
@RequiredArgsConstructor
public class PlanTemplates {

    private static final LayoutProps FLUSH = LayoutProps.of(0, 0);
    private static final LayoutProps PAGE = LayoutProps.of(16, 24);

    private final PlaceholderContent placeholders;
    private final FormFieldDetector formFieldDetector;

    public NodeBlueprint minimalCard(IntentAnalysis analysis) {
        return layout(COLUMN_LAYOUT, PAGE, card(analysis.title(), 16));
    }

    // ===== Sidebar / navbar compositions =====

    public NodeBlueprint sidebarNavbarColumns(IntentAnalysis analysis) {
        boolean chart = analysis.has(StructuralFeature.CHART);
        boolean table = analysis.has(StructuralFeature.TABLE);
        String slot = PlaceholderContent.SIDEBAR_NAVBAR_COLUMNS;
        return layout(ROW_LAYOUT, FLUSH,
                sidebar(),
                layout(COLUMN_LAYOUT, FLUSH,
                        navbar("Dashboard"),
                        layout(ROW_LAYOUT, PAGE,
                                card(chart ? "Analytics" : "Left Panel", 16, chart ? chartOf(slot) : null),
                                card(table ? "Data" : "Right Panel", 16, table ? tableOf(slot) : null))));
    }

    public NodeBlueprint sidebarColumns(IntentAnalysis analysis) {
        boolean chart = analysis.has(StructuralFeature.CHART);
        boolean table = analysis.has(StructuralFeature.TABLE);
        String slot = PlaceholderContent.SIDEBAR_COLUMNS;
        return layout(ROW_LAYOUT, FLUSH,
                sidebar(),
                layout(COLUMN_LAYOUT, FLUSH,
                        layout(ROW_LAYOUT, PAGE,
                                card(chart ? "Analytics" : "Data", 16, chart ? chartOf(slot) : null),
                                card(table ? "Recent Data" : "Content", 16, table ? tableOf(slot) : null))));
    }

    public NodeBlueprint sidebarDashboard(IntentAnalysis analysis) {
        String slot = PlaceholderContent.SIDEBAR_DASHBOARD;
        return layout(ROW_LAYOUT, FLUSH,
                sidebar(),
                layout(COLUMN_LAYOUT, PAGE,
                        card("Dashboard Overview", 16, chartOf(slot)),
                        card("Details", 16, tableOf(slot))));
    }

    public NodeBlueprint sidebar(IntentAnalysis analysis) {
        List<NodeBlueprint> main = analysis.has(StructuralFeature.NAVBAR)
                ? List.of(navbar("App"), card("Content", 16, button("Get Started")))
                : List.of(card("Welcome", 16, button("Start")));
        return layout(ROW_LAYOUT, FLUSH,
                sidebar(),
                layout(COLUMN_LAYOUT, PAGE, main));
    }

    public NodeBlueprint navbarChartTable(IntentAnalysis analysis) {
        String slot = PlaceholderContent.NAVBAR_CHART_TABLE;
        return layout(COLUMN_LAYOUT, FLUSH,
                navbar("Dashboard"),
                layout(ROW_LAYOUT, PAGE,
                        card("Analytics", 16, chartOf(slot)),
                        card("Data", 16, tableOf(slot))));
    }

    public NodeBlueprint navbarColumns(IntentAnalysis analysis) {
        boolean chart = analysis.has(StructuralFeature.CHART);
        boolean table = analysis.has(StructuralFeature.TABLE);
        String slot = PlaceholderContent.NAVBAR_COLUMNS;
        return layout(COLUMN_LAYOUT, FLUSH,
                navbar("App"),
                layout(ROW_LAYOUT, PAGE,
                        card(chart ? "Analytics" : "Left Panel", 16, chart ? chartOf(slot) : null),
                        card(table ? "Table Data" : "Right Panel", 16, table ? tableOf(slot) : null)));
    }

    public NodeBlueprint navbarDashboard(IntentAnalysis analysis) {
        return layout(COLUMN_LAYOUT, FLUSH,
                navbar("Dashboard"),
                layout(COLUMN_LAYOUT, PAGE,
                        card("Overview", 16, chartOf(PlaceholderContent.NAVBAR_DASHBOARD))));
    }

    public NodeBlueprint navbar(IntentAnalysis analysis) {
        return layout(COLUMN_LAYOUT, FLUSH,
                navbar("App"),
                card("Content", 24, button("Get Started")));
    }

    // ===== Columns and dashboards =====

    public NodeBlueprint columnsChartTable(IntentAnalysis analysis) {
        String slot = PlaceholderContent.COLUMNS_CHART_TABLE;
        return layout(COLUMN_LAYOUT, PAGE,
                layout(ROW_LAYOUT, LayoutProps.of(16, 0),
                        card("Chart", 16, chartOf(slot)),
                        card("Table", 16, tableOf(slot))));
    }

    public NodeBlueprint columns(IntentAnalysis analysis) {
        NodeBlueprint leftContent = analysis.has(StructuralFeature.CHART)
                ? chartOf(PlaceholderContent.COLUMNS)
                : button("Action");
        return layout(ROW_LAYOUT, PAGE,
                card("Left Panel", 16, leftContent),
                card("Right Panel", 16, button("Submit")));
    }

    public NodeBlueprint dashboard(IntentAnalysis analysis) {
        return layout(ROW_LAYOUT, FLUSH,
                sidebar(),
                layout(COLUMN_LAYOUT, PAGE,
                        card("Dashboard", 16, chartOf(PlaceholderContent.DASHBOARD))));
    }

    public NodeBlueprint modal(IntentAnalysis analysis) {
        return layout(COLUMN_LAYOUT, PAGE,
                component(MODAL, Props.of("isOpen", false, "title", "Modal")));
    }

    // ===== Card archetypes =====

    public NodeBlueprint productCard(IntentAnalysis analysis) {
        return page(card("Product", 16,
                card("Image", 12),
                card("Product Name", 12),
                card("$99.99", 12),
                button("Buy Now")));
    }

    public NodeBlueprint profileCard(IntentAnalysis analysis) {
        return page(card("Profile", 16,
                card("Avatar Placeholder", 12),
                card("Name", 8),
                card("Contact Info", 8),
                button("View Profile")));
    }

    public NodeBlueprint statCard(IntentAnalysis analysis) {
        return page(card("Statistics", 16,
                card("Metric 1: 1,234", 12),
                card("Metric 2: 5,678", 12),
                card("Metric 3: 9,012", 12)));
    }

    public NodeBlueprint hero(IntentAnalysis analysis) {
        return layout(COLUMN_LAYOUT, LayoutProps.of(16, 0),
                card("Hero Section", 48,
                        card("Main Heading", 16),
                        card("Subheading or Description", 16),
                        button("Call to Action")));
    }

    public NodeBlueprint gallery(IntentAnalysis analysis) {
        return layout(GRID_LAYOUT, LayoutProps.grid(16, 24, 3),
                card("Item 1", 12),
                card("Item 2", 12),
                card("Item 3", 12));
    }

    public NodeBlueprint testimonial(IntentAnalysis analysis) {
        return page(card("Testimonial", 16,
                card("Review Text", 12),
                card("- Author Name", 8)));
    }

    public NodeBlueprint pricing(IntentAnalysis analysis) {
        return page(card("Pricing Plan", 16,
                card("Standard - $49/month", 12),
                card("Features included", 12),
                button("Subscribe")));
    }

    public NodeBlueprint searchBar(IntentAnalysis analysis) {
        return page(card("Search", 16,
                component(INPUT, Props.of("label", "Search", "type", "text", "placeholder", "Search...")),
                button("Search")));
    }

    public NodeBlueprint itemCard(IntentAnalysis analysis) {
        return page(card("Item", 16,
                card("Item Details", 12),
                button("View Details")));
    }

    // ===== Forms and fallbacks =====

    public NodeBlueprint form(IntentAnalysis analysis, String text) {
        List<NodeBlueprint> content = new ArrayList<>();
        for (FormField field : formFieldDetector.detect(text)) {
            content.add(component(INPUT, field.toProps()));
        }
        if (!content.isEmpty()) {
            content.add(button(formFieldDetector.submitLabel(text)));
        }
        return page(component(CARD, Props.of("title", formFieldDetector.formTitle(text), "padding", 16), content));
    }

    public NodeBlueprint table(IntentAnalysis analysis) {
        return page(card("Data Table", 16));
    }

    public NodeBlueprint defaultCard(IntentAnalysis analysis) {
        return page(card("Welcome", 16));
    }

    // ===== Building blocks =====

    private static NodeBlueprint page(NodeBlueprint content) {
        return layout(COLUMN_LAYOUT, PAGE, content);
    }

    /**
     * Card with the given children; null entries are skipped so an absent
     * feature leaves the card without children.
     */
    private static NodeBlueprint card(String title, int padding, NodeBlueprint... children) {
        List<NodeBlueprint> present = new ArrayList<>();
        for (NodeBlueprint child : children) {
            if (child != null) {
                present.add(child);
            }
        }
        return component(CARD, Props.of("title", title, "padding", padding), present);
    }

    private static NodeBlueprint button(String label) {
        return component(BUTTON, Props.of("label", label, "variant", "primary"));
    }

    private static NodeBlueprint navbar(String title) {
        return component(NAVBAR, Props.of("title", title));
    }

    private static NodeBlueprint sidebar() {
        return component(SIDEBAR, Props.of("width", 250));
    }

    private NodeBlueprint chartOf(String slot) {
        return component(CHART, placeholders.chart(slot).toProps());
    }

    private NodeBlueprint tableOf(String slot) {
        return component(TABLE, placeholders.table(slot).toProps());
    }
}
