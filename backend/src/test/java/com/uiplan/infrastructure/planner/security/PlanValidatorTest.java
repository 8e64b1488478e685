package com.uiplan.infrastructure.planner.security;

import com.uiplan.domain.plan.model.ComponentNode;
import com.uiplan.domain.plan.model.ErrorCode;
import com.uiplan.domain.plan.model.LayoutNode;
import com.uiplan.domain.plan.model.LayoutProps;
import com.uiplan.domain.plan.model.ModificationType;
import com.uiplan.domain.plan.model.Node;
import com.uiplan.domain.plan.model.Plan;
import com.uiplan.domain.plan.model.PlanResult;
import com.uiplan.domain.plan.model.PlanValidationException;
import com.uiplan.domain.plan.model.PlanValidationOutcome;
import com.uiplan.infrastructure.planner.PlannerFixtures;
import com.uiplan.infrastructure.planner.codec.PlanJsonCodec;
import com.uiplan.infrastructure.planner.config.ComponentWhitelist;
import com.uiplan.infrastructure.planner.diff.PlanDiffEngine;
import com.uiplan.infrastructure.planner.template.Props;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlanValidatorTest {

    private PlanValidator validator;
    private PlanJsonCodec codec;

    @BeforeEach
    void setUp() {
        validator = PlannerFixtures.validator();
        codec = PlannerFixtures.codec();
    }

    private static Plan planWith(Node... children) {
        return new Plan(ModificationType.CREATE,
                new LayoutNode("root", "ColumnLayout", LayoutProps.of(16, 24), List.of(children)));
    }

    private static ErrorCode failureCode(PlanResult result) {
        assertThat(result.isSuccess()).isFalse();
        return result.error().code();
    }

    @Nested
    @DisplayName("validateProps")
    class PropsTests {

        @ParameterizedTest
        @ValueSource(strings = {"style", "className", "css", "dangerouslySetInnerHTML"})
        void forbidden_key_rejected_for_any_kind(String key) {
            assertThatThrownBy(() -> validator.validateProps(Map.of(key, "x"), "Button"))
                    .isInstanceOf(PlanValidationException.class)
                    .satisfies(e -> {
                        PlanValidationException ex = (PlanValidationException) e;
                        assertThat(ex.getError().code()).isEqualTo(ErrorCode.FORBIDDEN_PROP);
                        assertThat(ex.getError().key()).isEqualTo(key);
                        assertThat(ex.getError().kind()).isEqualTo("Button");
                    });
        }

        @Test
        void ordinary_props_pass() {
            assertThatCode(() -> validator.validateProps(Props.of("label", "Save", "variant", "primary"), "Button"))
                    .doesNotThrowAnyException();
            assertThatCode(() -> validator.validateProps(null, "Card")).doesNotThrowAnyException();
        }
    }

    @Nested
    @DisplayName("validateStructure")
    class StructureTests {

        @Test
        @DisplayName("forbidden prop on a nested component names the node")
        void forbidden_prop_in_tree() {
            Plan plan = planWith(new ComponentNode("root_Card_0", "Card", Props.of("title", "A"),
                    List.of(new ComponentNode("root_Card_0_Button_0", "Button", Props.of("style", "color:red")))));

            PlanResult result = validator.validatePlan(plan);

            assertThat(failureCode(result)).isEqualTo(ErrorCode.FORBIDDEN_PROP);
            assertThat(result.error().nodeId()).isEqualTo("root_Card_0_Button_0");
        }

        @Test
        void malformed_id_rejected() {
            Plan plan = planWith(new ComponentNode("root-Card-0", "Card", Props.of("title", "A")));

            assertThat(failureCode(validator.validatePlan(plan))).isEqualTo(ErrorCode.INVALID_ID);
        }

        @Test
        void duplicate_id_rejected() {
            Plan plan = planWith(
                    new ComponentNode("root_Card_0", "Card", Props.of("title", "A")),
                    new ComponentNode("root_Card_0", "Card", Props.of("title", "B")));

            PlanResult result = validator.validatePlan(plan);

            assertThat(failureCode(result)).isEqualTo(ErrorCode.INVALID_ID);
            assertThat(result.error().message()).contains("Duplicate");
        }

        @Test
        void unknown_kind_rejected() {
            Plan plan = planWith(new ComponentNode("root_Carousel_0", "Carousel", Props.of()));

            PlanResult result = validator.validatePlan(plan);

            assertThat(failureCode(result)).isEqualTo(ErrorCode.UNKNOWN_COMPONENT);
            assertThat(result.error().kind()).isEqualTo("Carousel");
        }

        @Test
        void empty_nested_layout_rejected() {
            Plan plan = planWith(new LayoutNode("root_RowLayout_0", "RowLayout", LayoutProps.empty(), List.of()));

            PlanResult result = validator.validatePlan(plan);

            assertThat(failureCode(result)).isEqualTo(ErrorCode.EMPTY_LAYOUT_CHILDREN);
            assertThat(result.error().code().isStructuralInvariantViolation()).isTrue();
        }

        @Test
        void empty_root_rejected() {
            assertThat(failureCode(validator.validatePlan(planWith()))).isEqualTo(ErrorCode.EMPTY_LAYOUT_CHILDREN);
        }

        @Test
        void layout_inside_component_rejected() {
            Plan plan = planWith(new ComponentNode("root_Card_0", "Card", Props.of("title", "A"),
                    List.of(new ComponentNode("root_Card_0_RowLayout_0", "RowLayout", Props.of()))));

            assertThat(failureCode(validator.validatePlan(plan))).isEqualTo(ErrorCode.LAYOUT_NESTED_IN_COMPONENT);
        }

        @Test
        void non_json_prop_value_rejected() {
            Plan plan = planWith(new ComponentNode("root_Card_0", "Card", Props.of("title", new Object())));

            PlanResult result = validator.validatePlan(plan);

            assertThat(failureCode(result)).isEqualTo(ErrorCode.SCHEMA_VIOLATION);
            assertThat(result.error().key()).isEqualTo("title");
        }

        @Test
        @DisplayName("configured whitelist is authoritative")
        void narrowed_whitelist_applies() {
            ComponentWhitelist whitelist = new ComponentWhitelist();
            whitelist.setComponents(List.of("Card", "Button"));
            PlanValidator narrow = PlannerFixtures.validator(whitelist);
            Plan plan = PlannerFixtures.create("A navbar with two columns showing a chart and a table");

            assertThat(failureCode(narrow.validatePlan(plan))).isEqualTo(ErrorCode.UNKNOWN_COMPONENT);
        }
    }

    @Nested
    @DisplayName("synthesized plans")
    class ClosureTests {

        private final List<String> instructions = List.of(
                "Create a dashboard with a sidebar, a navbar and two columns with a chart and a table",
                "A sidebar with a dashboard overview",
                "Login form with email and password",
                "A gallery of photos",
                "A pricing card",
                "Show a modal dialog",
                "Only one card titled 'Hi', nothing else",
                "Something vague"
        );

        @Test
        @DisplayName("every node kind is whitelisted and no forbidden prop appears")
        void whitelist_and_forbidden_prop_closure() {
            ComponentWhitelist whitelist = new ComponentWhitelist();
            for (String text : instructions) {
                Plan plan = PlannerFixtures.create(text);

                assertThat(validator.validatePlan(plan).isSuccess()).as(text).isTrue();
                for (Node node : PlanDiffEngine.flatten(plan.root())) {
                    assertThat(whitelist.isAllowed(node.kind())).as(node.id()).isTrue();
                    assertThat(codec.propsAsMap(node).keySet())
                            .as(node.id())
                            .noneMatch(PlanValidator::isForbiddenProp);
                }
            }
        }

        @Test
        @DisplayName("validation is idempotent")
        void idempotent() {
            for (String text : instructions) {
                Plan plan = PlannerFixtures.create(text);

                Plan once = validator.validateRaw(plan).data();
                Plan twice = validator.validateRaw(codec.toMap(once)).data();

                assertThat(once).isSameAs(plan);
                assertThat(twice).as(text).isEqualTo(plan);
                assertThat(codec.toJson(twice)).isEqualTo(codec.toJson(plan));
            }
        }
    }

    @Nested
    @DisplayName("validateRaw")
    class RawTests {

        @Test
        void json_string_accepted() {
            String json = """
                    {"modificationType":"edit","root":{"id":"root","component":"RowLayout","props":{"gap":8},
                     "children":[{"id":"root_Button_0","component":"Button","props":{"label":"Go"}}]}}
                    """;

            PlanValidationOutcome outcome = validator.validateRaw(json);

            assertThat(outcome.valid()).isTrue();
            assertThat(outcome.data().modificationType()).isEqualTo(ModificationType.EDIT);
            assertThat(outcome.data().root().props().gap()).isEqualTo(8);
        }

        @Test
        void fractional_layout_prop_accepted() {
            Map<String, Object> raw = Map.of(
                    "modificationType", "edit",
                    "root", Map.of("id", "root", "component", "ColumnLayout", "props", Map.of("gap", 8.5),
                            "children", List.of(Map.of("id", "root_Card_0", "component", "Card",
                                    "props", Map.of("title", "A")))));

            PlanValidationOutcome outcome = validator.validateRaw(raw);

            assertThat(outcome.valid()).isTrue();
            assertThat(outcome.data().root().props().gap()).isEqualTo(8.5);
        }

        @Test
        @DisplayName("forbidden prop in a raw plan is reported with a flat message")
        void raw_forbidden_prop() {
            Map<String, Object> raw = Map.of(
                    "modificationType", "create",
                    "root", Map.of("id", "root", "component", "ColumnLayout", "props", Map.of(),
                            "children", List.of(Map.of("id", "root_Card_0", "component", "Card",
                                    "props", Map.of("className", "big")))));

            PlanValidationOutcome outcome = validator.validateRaw(raw);

            assertThat(outcome.valid()).isFalse();
            assertThat(outcome.errorCode()).isEqualTo(ErrorCode.FORBIDDEN_PROP);
            assertThat(outcome.error()).startsWith("FORBIDDEN_PROP:").contains("className");
            assertThat(outcome.data()).isNull();
        }

        @Test
        void null_rejected() {
            assertThat(validator.validateRaw(null).errorCode()).isEqualTo(ErrorCode.SCHEMA_VIOLATION);
        }

        @Test
        void malformed_json_rejected() {
            assertThat(validator.validateRaw("{not json").errorCode()).isEqualTo(ErrorCode.SCHEMA_VIOLATION);
        }
    }
}
