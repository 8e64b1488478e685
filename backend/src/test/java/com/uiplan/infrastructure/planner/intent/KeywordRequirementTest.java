package com.uiplan.infrastructure.planner.intent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordRequirementTest {

    @Test
    @DisplayName("a mentioned keyword is required, case-insensitively")
    void mentioned_is_required() {
        assertThat(KeywordRequirement.required("sidebar", "Add a Sidebar on the left")).isTrue();
        assertThat(KeywordRequirement.required("chart", "a table only")).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "dashboard, remove the chart",
            "dashboard without chart",
            "dashboard with no chart",
            "dashboard, don't include the chart",
            "dashboard, do not add chart",
            "Dashboard WITHOUT THE CHART"
    })
    @DisplayName("negated keywords are not required")
    void negation_patterns(String text) {
        assertThat(KeywordRequirement.mentioned("chart", text)).isTrue();
        assertThat(KeywordRequirement.required("chart", text)).isFalse();
    }

    @Test
    void negation_of_other_keyword_does_not_leak() {
        assertThat(KeywordRequirement.required("table", "a table without the chart")).isTrue();
    }
}
