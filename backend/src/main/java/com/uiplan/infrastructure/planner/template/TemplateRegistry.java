package com.uiplan.infrastructure.planner.template;

import com.uiplan.infrastructure.planner.intent.IntentAnalysis;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Predicate;

import static com.uiplan.infrastructure.planner.intent.StructuralFeature.*;

/**
 * The ordered decision table. Rules are evaluated top to bottom and the first
 * match wins, so more specific compositions must come before their parts.
 */
@Component
public class TemplateRegistry {

    public static final String DEFAULT_RULE = "DEFAULT";

    private final List<TemplateRule> rules;

    public TemplateRegistry(PlanTemplates templates) {
        this.rules = List.of(
                rule("MINIMAL_CARD", a -> a.minimal(), (a, t) -> templates.minimalCard(a)),
                rule("SIDEBAR_NAVBAR_COLUMNS", a -> a.hasAll(SIDEBAR, NAVBAR, TWO_COLUMNS), (a, t) -> templates.sidebarNavbarColumns(a)),
                rule("SIDEBAR_COLUMNS", a -> a.hasAll(SIDEBAR, TWO_COLUMNS), (a, t) -> templates.sidebarColumns(a)),
                rule("SIDEBAR_DASHBOARD", a -> a.hasAll(SIDEBAR, DASHBOARD), (a, t) -> templates.sidebarDashboard(a)),
                rule("SIDEBAR", a -> a.has(SIDEBAR), (a, t) -> templates.sidebar(a)),
                rule("NAVBAR_CHART_TABLE", a -> a.hasAll(NAVBAR, TWO_COLUMNS, CHART, TABLE), (a, t) -> templates.navbarChartTable(a)),
                rule("NAVBAR_COLUMNS", a -> a.hasAll(NAVBAR, TWO_COLUMNS), (a, t) -> templates.navbarColumns(a)),
                rule("NAVBAR_DASHBOARD", a -> a.hasAll(NAVBAR, DASHBOARD), (a, t) -> templates.navbarDashboard(a)),
                rule("NAVBAR", a -> a.has(NAVBAR), (a, t) -> templates.navbar(a)),
                rule("COLUMNS_CHART_TABLE", a -> a.hasAll(TWO_COLUMNS, CHART, TABLE), (a, t) -> templates.columnsChartTable(a)),
                rule("COLUMNS", a -> a.has(TWO_COLUMNS), (a, t) -> templates.columns(a)),
                rule("DASHBOARD", a -> a.has(DASHBOARD), (a, t) -> templates.dashboard(a)),
                rule("MODAL", a -> a.has(MODAL), (a, t) -> templates.modal(a)),
                rule("PRODUCT_CARD", a -> a.has(PRODUCT_CARD), (a, t) -> templates.productCard(a)),
                rule("PROFILE_CARD", a -> a.has(PROFILE_CARD), (a, t) -> templates.profileCard(a)),
                rule("STAT_CARD", a -> a.has(STAT_CARD), (a, t) -> templates.statCard(a)),
                rule("HERO", a -> a.has(HERO), (a, t) -> templates.hero(a)),
                rule("GALLERY", a -> a.has(GALLERY), (a, t) -> templates.gallery(a)),
                rule("TESTIMONIAL", a -> a.has(TESTIMONIAL), (a, t) -> templates.testimonial(a)),
                rule("PRICING", a -> a.has(PRICING), (a, t) -> templates.pricing(a)),
                rule("SEARCH_BAR", a -> a.has(SEARCH_BAR), (a, t) -> templates.searchBar(a)),
                rule("ITEM_CARD", a -> a.has(ITEM_CARD), (a, t) -> templates.itemCard(a)),
                rule("FORM", a -> a.has(FORM), templates::form),
                rule("TABLE", a -> a.has(TABLE), (a, t) -> templates.table(a)),
                rule(DEFAULT_RULE, a -> true, (a, t) -> templates.defaultCard(a))
        );
    }

    public List<TemplateRule> getRules() {
        return rules;
    }

    private static TemplateRule rule(String id, Predicate<IntentAnalysis> predicate, TemplateRule.Template template) {
        return new TemplateRule(id, predicate, template);
    }
}
