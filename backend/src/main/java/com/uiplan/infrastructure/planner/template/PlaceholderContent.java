package com.uiplan.infrastructure.planner.template;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sample data placed into synthesized charts and tables, keyed by slot name.
 * Injected as a bean so tests can substitute their own fixtures.
 */
public record PlaceholderContent(
        Map<String, ChartFixture> charts,
        Map<String, TableFixture> tables
) {
    public static final String SIDEBAR_NAVBAR_COLUMNS = "sidebar-navbar-columns";
    public static final String SIDEBAR_COLUMNS = "sidebar-columns";
    public static final String SIDEBAR_DASHBOARD = "sidebar-dashboard";
    public static final String NAVBAR_CHART_TABLE = "navbar-chart-table";
    public static final String NAVBAR_COLUMNS = "navbar-columns";
    public static final String NAVBAR_DASHBOARD = "navbar-dashboard";
    public static final String COLUMNS_CHART_TABLE = "columns-chart-table";
    public static final String COLUMNS = "columns";
    public static final String DASHBOARD = "dashboard";
    public static final String EDIT_ADDITION = "edit-addition";

    public record DataPoint(String label, int value) {}

    public record ChartFixture(String title, String type, List<DataPoint> data) {

        public Map<String, Object> toProps() {
            List<Object> points = new ArrayList<>();
            for (DataPoint point : data) {
                points.add(Props.of("label", point.label(), "value", point.value()));
            }
            Map<String, Object> props = Props.of("title", title, "data", points);
            if (type != null) {
                props.put("type", type);
            }
            return props;
        }
    }

    public record TableColumn(String header, String key) {}

    /**
     * @param rows cell values aligned with {@code columns}
     */
    public record TableFixture(List<TableColumn> columns, List<List<String>> rows) {

        public Map<String, Object> toProps() {
            List<Object> columnProps = new ArrayList<>();
            for (TableColumn column : columns) {
                columnProps.add(Props.of("header", column.header(), "key", column.key()));
            }
            List<Object> rowProps = new ArrayList<>();
            for (List<String> row : rows) {
                Map<String, Object> cells = new LinkedHashMap<>();
                for (int i = 0; i < columns.size(); i++) {
                    cells.put(columns.get(i).key(), i < row.size() ? row.get(i) : "");
                }
                rowProps.add(cells);
            }
            return Props.of("columns", columnProps, "data", rowProps);
        }
    }

    public ChartFixture chart(String slot) {
        ChartFixture fixture = charts.get(slot);
        if (fixture == null) {
            throw new IllegalStateException("No chart placeholder configured for slot " + slot);
        }
        return fixture;
    }

    public TableFixture table(String slot) {
        TableFixture fixture = tables.get(slot);
        if (fixture == null) {
            throw new IllegalStateException("No table placeholder configured for slot " + slot);
        }
        return fixture;
    }

    public static PlaceholderContent defaults() {
        Map<String, ChartFixture> charts = new LinkedHashMap<>();
        charts.put(SIDEBAR_NAVBAR_COLUMNS, new ChartFixture("Performance", "bar", points("Jan", 45, "Feb", 60, "Mar", 75)));
        charts.put(SIDEBAR_COLUMNS, new ChartFixture("Performance", "bar", points("Jan", 45, "Feb", 60, "Mar", 75, "Apr", 65)));
        charts.put(SIDEBAR_DASHBOARD, new ChartFixture("Metrics", "line",
                points("Week 1", 40, "Week 2", 50, "Week 3", 65, "Week 4", 75)));
        charts.put(NAVBAR_CHART_TABLE, new ChartFixture("Performance", "bar", points("Q1", 40, "Q2", 55, "Q3", 70, "Q4", 65)));
        charts.put(NAVBAR_COLUMNS, new ChartFixture("Trends", "pie", points("A", 30, "B", 45, "C", 55)));
        charts.put(NAVBAR_DASHBOARD, new ChartFixture("Performance", "line",
                points("Mon", 50, "Tue", 60, "Wed", 70, "Thu", 65, "Fri", 80)));
        charts.put(COLUMNS_CHART_TABLE, new ChartFixture("Data Visualization", "bar",
                points("Q1", 40, "Q2", 55, "Q3", 70, "Q4", 65)));
        charts.put(COLUMNS, new ChartFixture("Analytics", "pie", points("Data 1", 30, "Data 2", 45, "Data 3", 35)));
        charts.put(DASHBOARD, new ChartFixture("Performance", "bar", points("Jan", 50, "Feb", 75, "Mar", 60)));
        charts.put(EDIT_ADDITION, new ChartFixture("Performance", null, points("Jan", 45, "Feb", 60)));

        List<TableColumn> itemStatusValue = List.of(
                new TableColumn("Item", "item"), new TableColumn("Status", "status"), new TableColumn("Value", "value"));
        List<TableColumn> idValueStatus = List.of(
                new TableColumn("ID", "id"), new TableColumn("Value", "value"), new TableColumn("Status", "status"));

        Map<String, TableFixture> tables = new LinkedHashMap<>();
        tables.put(SIDEBAR_NAVBAR_COLUMNS, new TableFixture(itemStatusValue, List.of(
                List.of("Item 1", "Active", "100"),
                List.of("Item 2", "Inactive", "80"))));
        tables.put(SIDEBAR_COLUMNS, new TableFixture(itemStatusValue, List.of(
                List.of("Item 1", "Active", "100"),
                List.of("Item 2", "Inactive", "80"),
                List.of("Item 3", "Active", "95"))));
        tables.put(SIDEBAR_DASHBOARD, new TableFixture(
                List.of(new TableColumn("Metric", "metric"), new TableColumn("Value", "value")), List.of(
                List.of("Users", "1,234"),
                List.of("Revenue", "$50K"),
                List.of("Growth", "15%"))));
        tables.put(NAVBAR_CHART_TABLE, new TableFixture(idValueStatus, List.of(
                List.of("1", "100", "Active"),
                List.of("2", "200", "Active"))));
        tables.put(NAVBAR_COLUMNS, new TableFixture(
                List.of(new TableColumn("Name", "name"), new TableColumn("Status", "status")), List.of(
                List.of("Item A", "Done"),
                List.of("Item B", "Pending"))));
        tables.put(COLUMNS_CHART_TABLE, new TableFixture(idValueStatus, List.of(
                List.of("1", "100", "Active"),
                List.of("2", "200", "Active"),
                List.of("3", "150", "Inactive"))));
        tables.put(EDIT_ADDITION, new TableFixture(
                List.of(new TableColumn("ID", "id"), new TableColumn("Name", "name")), List.of(
                List.of("1", "Item 1"))));

        return new PlaceholderContent(charts, tables);
    }

    private static List<DataPoint> points(Object... labelValues) {
        List<DataPoint> points = new ArrayList<>();
        for (int i = 0; i < labelValues.length; i += 2) {
            points.add(new DataPoint((String) labelValues[i], (Integer) labelValues[i + 1]));
        }
        return points;
    }
}
