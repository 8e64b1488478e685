package com.uiplan.infrastructure.planner.edit;

import com.uiplan.infrastructure.planner.intent.StructuralFeature;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static com.uiplan.domain.plan.model.UiKinds.*;

/**
 * What an edit instruction asks to remove and add.
 * <p>
 * A concept is removed when it is named right after a removal verb, alone or in a
 * coordinated list ("remove the chart and table", "delete the navbar, sidebar").
 * A concept is added only next to "add" vocabulary, and never when the same
 * instruction removes it.
 *
 * @param removals kinds to delete everywhere in the tree, in fixed order
 */
public record EditDirectives(
        Set<String> removals,
        boolean addModal,
        boolean addModalInputs,
        boolean addChart,
        boolean addTable
) {
    // Removable node kind -> the concept whose keywords name it
    private static final Map<String, StructuralFeature> REMOVABLE_KINDS = removableKinds();

    private static final Map<String, Pattern> CONCEPT_PATTERNS = REMOVABLE_KINDS.entrySet().stream()
            .collect(Collectors.toMap(Map.Entry::getKey, e -> conceptPattern(e.getValue().keywords()),
                    (a, b) -> a, LinkedHashMap::new));

    private static final Pattern REMOVAL_PHRASE = removalPhrase();

    private static final Pattern ADD_VOCABULARY = Pattern.compile("\\badd(?:s|ed|ing)?\\b");

    public EditDirectives {
        removals = Collections.unmodifiableSet(new LinkedHashSet<>(removals));
    }

    public static EditDirectives parse(String text) {
        String lower = text.toLowerCase(Locale.ROOT);

        Set<String> removed = new LinkedHashSet<>();
        Matcher phrase = REMOVAL_PHRASE.matcher(lower);
        while (phrase.find()) {
            String targets = phrase.group(1);
            CONCEPT_PATTERNS.forEach((kind, pattern) -> {
                if (pattern.matcher(targets).find()) {
                    removed.add(kind);
                }
            });
        }
        Set<String> removals = new LinkedHashSet<>();
        REMOVABLE_KINDS.keySet().stream().filter(removed::contains).forEach(removals::add);

        boolean mentionsAdd = ADD_VOCABULARY.matcher(lower).find();
        boolean addModal = mentionsAdd && mentions(MODAL, lower) && !removals.contains(MODAL);
        boolean addChart = mentionsAdd && mentions(CHART, lower) && !removals.contains(CHART);
        boolean addTable = mentionsAdd && mentions(TABLE, lower) && !removals.contains(TABLE);

        return new EditDirectives(removals, addModal, addModal && lower.contains("input"), addChart, addTable);
    }

    public boolean removes(String kind) {
        return removals.contains(kind);
    }

    public boolean isEmpty() {
        return removals.isEmpty() && !addModal && !addChart && !addTable;
    }

    private static boolean mentions(String kind, String lower) {
        return CONCEPT_PATTERNS.get(kind).matcher(lower).find();
    }

    private static Map<String, StructuralFeature> removableKinds() {
        Map<String, StructuralFeature> kinds = new LinkedHashMap<>();
        kinds.put(SIDEBAR, StructuralFeature.SIDEBAR);
        kinds.put(NAVBAR, StructuralFeature.NAVBAR);
        kinds.put(CHART, StructuralFeature.CHART);
        kinds.put(TABLE, StructuralFeature.TABLE);
        kinds.put(MODAL, StructuralFeature.MODAL);
        return Collections.unmodifiableMap(kinds);
    }

    private static Pattern conceptPattern(List<String> keywords) {
        return Pattern.compile("\\b(?:" + alternation(keywords) + ")s?\\b");
    }

    /**
     * "remove|delete" followed by one or more concept names joined by commas or "and".
     * Group 1 holds the list.
     */
    private static Pattern removalPhrase() {
        List<String> keywords = REMOVABLE_KINDS.values().stream()
                .flatMap(feature -> feature.keywords().stream())
                .toList();
        String item = "(?:the\\s+)?(?:" + alternation(keywords) + ")s?\\b";
        String list = item + "(?:\\s*,\\s*(?:and\\s+)?" + item + "|\\s+and\\s+" + item + ")*";
        return Pattern.compile("\\b(?:remove|delete)\\s+(" + list + ")");
    }

    // Longest first so "side bar" wins over any shorter overlap
    private static String alternation(List<String> keywords) {
        return keywords.stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
    }
}
