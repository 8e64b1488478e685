package com.uiplan.infrastructure.planner.edit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class EditDirectivesTest {

    @Nested
    @DisplayName("Removals")
    class RemovalTests {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "Remove the sidebar, Sidebar",
                "Remove the side bar, Sidebar",
                "delete the nav bar, Navbar",
                "Remove the navigation, Navbar",
                "remove the graph, Chart",
                "Remove charts, Chart",
                "delete the table, Table",
                "Remove the dialog, Modal"
        })
        void concept_keywords_name_the_kind(String text, String kind) {
            EditDirectives directives = EditDirectives.parse(text);

            assertThat(directives.removals()).containsExactly(kind);
            assertThat(directives.removes(kind)).isTrue();
        }

        @Test
        @DisplayName("every concept in a coordinated list is removed")
        void coordinated_list() {
            assertThat(EditDirectives.parse("Remove the chart and table").removals())
                    .containsExactly("Chart", "Table");
            assertThat(EditDirectives.parse("Delete the navbar, sidebar and the modal").removals())
                    .containsExactly("Sidebar", "Navbar", "Modal");
        }

        @Test
        @DisplayName("a concept after an addition verb is not part of the removal list")
        void list_stops_at_other_verb() {
            EditDirectives directives = EditDirectives.parse("Remove the sidebar and add a table");

            assertThat(directives.removals()).containsExactly("Sidebar");
            assertThat(directives.addTable()).isTrue();
        }

        @Test
        void concept_without_removal_verb_is_kept() {
            assertThat(EditDirectives.parse("Add a table next to the chart").removes("Chart")).isFalse();
        }
    }

    @Nested
    @DisplayName("Additions")
    class AdditionTests {

        @Test
        void settings_modal_with_inputs() {
            EditDirectives directives = EditDirectives.parse("Remove the sidebar and add a settings modal with two inputs.");

            assertThat(directives.addModal()).isTrue();
            assertThat(directives.addModalInputs()).isTrue();
            assertThat(directives.addChart()).isFalse();
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "Change the modal title",
                "Update the dialog",
                "Increase the padding of the table"
        })
        @DisplayName("naming a concept without add vocabulary adds nothing")
        void mention_without_add(String text) {
            EditDirectives directives = EditDirectives.parse(text);

            assertThat(directives.isEmpty()).isTrue();
        }

        @Test
        void add_graph_adds_chart() {
            assertThat(EditDirectives.parse("Add a graph").addChart()).isTrue();
        }

        @Test
        @DisplayName("removing and adding the same concept cancels the addition")
        void removal_wins_over_addition() {
            EditDirectives directives = EditDirectives.parse("remove the modal and add a modal");

            assertThat(directives.removals()).containsExactly("Modal");
            assertThat(directives.addModal()).isFalse();
        }
    }
}
