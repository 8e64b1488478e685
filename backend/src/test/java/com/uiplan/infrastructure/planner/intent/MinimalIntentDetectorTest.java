package com.uiplan.infrastructure.planner.intent;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class MinimalIntentDetectorTest {

    private MinimalIntentDetector detector;

    @BeforeEach
    void setUp() {
        detector = new MinimalIntentDetector();
    }

    @Nested
    @DisplayName("isMinimal")
    class MinimalityTests {

        @ParameterizedTest
        @ValueSource(strings = {
                "Only one card, nothing else",
                "Make a minimal page",
                "A hero banner with a gallery. Actually, keep it minimal",
                "Build a landing page; simplify it",
                "one centered card please"
        })
        void minimal_requests(String text) {
            assertThat(detector.isMinimal(text)).isTrue();
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "Build a dashboard. Keep it minimal.",
                "only one card next to a chart",
                "A minimal sidebar layout",
                "Create a login form"
        })
        @DisplayName("complex structure anywhere suppresses minimality")
        void not_minimal(String text) {
            assertThat(detector.isMinimal(text)).isFalse();
        }
    }

    @Nested
    @DisplayName("extractTitle")
    class TitleTests {

        @Test
        void quoted_after_titled() {
            assertThat(detector.extractTitle("one card titled \"Quarterly Report\"")).hasValue("Quarterly Report");
        }

        @Test
        void bare_after_titled_stops_at_punctuation() {
            assertThat(detector.extractTitle("a card titled Reports, nothing else")).hasValue("Reports");
        }

        @Test
        void quoted_after_title() {
            assertThat(detector.extractTitle("card with title 'My Stats'")).hasValue("My Stats");
        }

        @Test
        void quoted_after_card() {
            assertThat(detector.extractTitle("only one card `Promo`")).hasValue("Promo");
        }

        @Test
        void absent() {
            assertThat(detector.extractTitle("only one card")).isEmpty();
        }
    }
}
