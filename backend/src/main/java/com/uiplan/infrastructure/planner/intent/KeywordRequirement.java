package com.uiplan.infrastructure.planner.intent;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Negation-aware keyword lookup: a keyword is required when it is mentioned
 * and no negation pattern applies to it.
 */
public final class KeywordRequirement {

    private KeywordRequirement() {
    }

    public static boolean required(String keyword, String text) {
        return mentioned(keyword, text) && !negated(keyword, text);
    }

    public static boolean mentioned(String keyword, String text) {
        return text.toLowerCase(Locale.ROOT).contains(keyword.toLowerCase(Locale.ROOT));
    }

    /**
     * "remove X", "without X", "no X", "don't/do not add/use/include X".
     */
    public static boolean negated(String keyword, String text) {
        for (Pattern pattern : negationPatterns(keyword)) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> negationPatterns(String keyword) {
        String k = Pattern.quote(keyword);
        return List.of(
                Pattern.compile("remove\\s+(?:the\\s+)?" + k, Pattern.CASE_INSENSITIVE),
                Pattern.compile("without\\s+(?:the\\s+)?" + k, Pattern.CASE_INSENSITIVE),
                Pattern.compile("\\bno\\s+" + k, Pattern.CASE_INSENSITIVE),
                Pattern.compile("(?:don't|do not)\\s+(?:add|use|include)\\s+(?:the\\s+)?" + k, Pattern.CASE_INSENSITIVE)
        );
    }
}
