package com.uiplan.infrastructure.planner.intent;

import com.uiplan.domain.plan.model.ModificationType;
import com.uiplan.domain.plan.model.Plan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.uiplan.infrastructure.planner.intent.StructuralFeature.*;

/**
 * Rule-based intent classification. Steps run in strict priority order and the
 * first one that fires short-circuits the rest:
 * <ol>
 *   <li>prior plan + resynthesis vocabulary → regenerate</li>
 *   <li>prior plan + mutation vocabulary → edit (patcher takes over)</li>
 *   <li>minimal single-card request (final clauses first, then anywhere)</li>
 *   <li>negation-aware structural feature flags</li>
 * </ol>
 * Never fails: text that matches nothing yields an empty feature set.
 */
@Slf4j
@Component
public class IntentClassifier {

    private static final Pattern RESYNTHESIS_VOCABULARY = Pattern.compile(
            "regenerate|completely|start over"
    );

    private static final Pattern MUTATION_VOCABULARY = Pattern.compile(
            "\\b(?:add(?:s|ed|ing)?|modif(?:y|ies|ied|ying)|chang(?:e|es|ed|ing)"
                    + "|updat(?:e|es|ed|ing)|remov(?:e|es|ed|ing)|delet(?:e|es|ed|ing))\\b"
    );

    private static final List<String> TWO_COLUMN_PHRASES = List.of("side by side", "two columns", "two cards");

    private static final Pattern PRODUCT_CARD_PATTERN = Pattern.compile(
            "product\\s+card|product\\s+display|product\\s+listing|product\\s+item|displaying.*product");
    private static final Pattern PRODUCT_DETAIL_PATTERN = Pattern.compile("image|title|price|button");
    private static final Pattern ITEM_CARD_PATTERN = Pattern.compile(
            "item\\s+card|listing\\s+card|card.*item|item.*card");

    private static final Map<StructuralFeature, Pattern> ARCHETYPE_PATTERNS = Map.of(
            PROFILE_CARD, Pattern.compile("profile\\s+card|user\\s+card|contact\\s+card|team\\s+member|showing.*profile"),
            STAT_CARD, Pattern.compile("stat\\s+card|statistics|metric|counter|number|stat.*display"),
            HERO, Pattern.compile("hero|banner|header\\s+section|large.*header|featured|showcase"),
            GALLERY, Pattern.compile("gallery|grid.*images|image\\s+grid|photos|portfolio|collection"),
            TESTIMONIAL, Pattern.compile("testimonial|review|comment|feedback.*display|quote\\s+card"),
            PRICING, Pattern.compile("pricing\\s+card|price.*display|tier|plan.*card|pricing\\s+table"),
            SEARCH_BAR, Pattern.compile("search\\s+bar|search\\s+box|find.*search|search\\s+with")
    );

    private final MinimalIntentDetector minimalIntentDetector;
    private final String defaultTitle;

    public IntentClassifier(MinimalIntentDetector minimalIntentDetector,
                            @Value("${uiplan.minimal.default-title:Welcome}") String defaultTitle) {
        this.minimalIntentDetector = minimalIntentDetector;
        this.defaultTitle = defaultTitle;
    }

    /**
     * @param text          sanitized instruction text
     * @param previousPlan  prior plan (nullable)
     */
    public IntentAnalysis classify(String text, Plan previousPlan) {
        String lower = text.toLowerCase(Locale.ROOT);

        ModificationType type = ModificationType.CREATE;
        if (previousPlan != null) {
            if (RESYNTHESIS_VOCABULARY.matcher(lower).find()) {
                type = ModificationType.REGENERATE;
            } else if (MUTATION_VOCABULARY.matcher(lower).find()) {
                log.info("[IntentClassifier] Mutation vocabulary with prior plan → EDIT");
                return IntentAnalysis.edit();
            }
        }

        if (minimalIntentDetector.isMinimal(text)) {
            String title = minimalIntentDetector.extractTitle(text).orElse(defaultTitle);
            log.info("[IntentClassifier] Minimal single-card intent ({}), title='{}'", type, title);
            return IntentAnalysis.minimal(type, title);
        }

        Set<StructuralFeature> features = resolveFeatures(text, lower);
        log.info("[IntentClassifier] {} with features {}", type, features);
        return IntentAnalysis.structural(type, features);
    }

    Set<StructuralFeature> resolveFeatures(String text, String lower) {
        Set<StructuralFeature> features = EnumSet.noneOf(StructuralFeature.class);

        // A keyword-driven flag is set when any of its keywords is required
        for (StructuralFeature feature : StructuralFeature.values()) {
            if (feature.keywords().stream().anyMatch(k -> KeywordRequirement.required(k, text))) {
                features.add(feature);
            }
        }

        // Multi-word phrase, so negation is coarse: any remove/without clears it
        boolean mentionsTwoColumns = TWO_COLUMN_PHRASES.stream().anyMatch(lower::contains);
        if (mentionsTwoColumns && !lower.contains("remove") && !lower.contains("without")) {
            features.add(TWO_COLUMNS);
        }

        boolean productCard = archetypeRequested(PRODUCT_CARD_PATTERN, text, lower)
                && PRODUCT_DETAIL_PATTERN.matcher(lower).find();
        if (productCard) {
            features.add(PRODUCT_CARD);
        } else if (archetypeRequested(ITEM_CARD_PATTERN, text, lower)) {
            features.add(ITEM_CARD);
        }

        ARCHETYPE_PATTERNS.forEach((feature, pattern) -> {
            if (archetypeRequested(pattern, text, lower)) {
                features.add(feature);
            }
        });

        return features;
    }

    private boolean archetypeRequested(Pattern pattern, String text, String lower) {
        Matcher matcher = pattern.matcher(lower);
        return matcher.find() && !KeywordRequirement.negated(matcher.group(), text);
    }
}
