package com.uiplan.infrastructure.planner.intent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects "just one card" requests and extracts the card title.
 * <p>
 * A request for complex structure anywhere in the text (dashboard, sidebar, navbar,
 * two columns/cards, chart, table) suppresses minimality: "minimal" then means
 * "simplify what was asked for", not "collapse to a single card".
 */
@Slf4j
@Component
public class MinimalIntentDetector {

    private static final List<String> COMPLEX_STRUCTURE_TERMS = List.of(
            "dashboard", "sidebar", "navbar", "two columns", "two cards", "chart", "table"
    );

    private static final Pattern CLAUSE_SEPARATOR = Pattern.compile("[.;]");

    // First match wins
    private static final List<Pattern> TITLE_PATTERNS = List.of(
            Pattern.compile("titled\\s+['\"`]([^'\"`]+)['\"`]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("titled\\s+([^\\s,.;]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("title\\s+['\"`]([^'\"`]+)['\"`]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("title\\s+([^\\s,.;]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("card\\s+['\"`]([^'\"`]+)['\"`]", Pattern.CASE_INSENSITIVE)
    );

    public boolean isMinimal(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (hasComplexStructure(lower)) {
            return false;
        }
        return isMinimalInFinalClauses(text) || hasExplicitSingleCard(lower) || hasGeneralMinimalSignal(lower);
    }

    public boolean hasComplexStructure(String lower) {
        return COMPLEX_STRUCTURE_TERMS.stream().anyMatch(lower::contains);
    }

    /**
     * Evaluates only the last two clauses; a late directive overrides earlier requests.
     */
    boolean isMinimalInFinalClauses(String text) {
        String[] clauses = CLAUSE_SEPARATOR.split(text, -1);
        int from = Math.max(0, clauses.length - 2);
        String lastClauses = String.join(".", Arrays.copyOfRange(clauses, from, clauses.length))
                .toLowerCase(Locale.ROOT);
        return lastClauses.contains("minimal")
                || lastClauses.contains("only one card")
                || lastClauses.contains("simplif");
    }

    boolean hasExplicitSingleCard(String lower) {
        return lower.contains("only one card")
                || (lower.contains("only") && lower.contains("card") && lower.contains("nothing else"))
                || (lower.contains("minimal") && (lower.contains("only one")
                        || lower.contains("minimal page")
                        || lower.contains("minimal interface")));
    }

    boolean hasGeneralMinimalSignal(String lower) {
        return lower.contains("only one")
                || lower.contains("minimal ")
                || lower.contains("minimal\n")
                || lower.contains("minimal.")
                || lower.contains("minimal,")
                || (lower.contains("one card") && lower.contains("nothing else"))
                || (lower.contains("one") && lower.contains("centered") && lower.contains("card"));
    }

    public Optional<String> extractTitle(String text) {
        for (Pattern pattern : TITLE_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find() && !matcher.group(1).isBlank()) {
                String title = matcher.group(1).trim();
                log.debug("[MinimalIntentDetector] Title '{}' matched by {}", title, pattern.pattern());
                return Optional.of(title);
            }
        }
        return Optional.empty();
    }
}
