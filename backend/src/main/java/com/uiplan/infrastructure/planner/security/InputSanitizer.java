package com.uiplan.infrastructure.planner.security;

import com.uiplan.domain.plan.model.ErrorCode;
import com.uiplan.domain.plan.model.PlanError;
import com.uiplan.domain.plan.model.PlanValidationException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Length-checks instruction text and reduces it to a canonical form, so that
 * keyword rules and deny patterns see the same text a reader sees.
 */
@Component
public class InputSanitizer {

    // Format characters (zero-width, BOM, bidi overrides) and control characters other than line breaks and tabs
    private static final Pattern HIDDEN_CHARS = Pattern.compile("[\\p{Cf}\\p{Cc}&&[^\\n\\r\\t]]");

    private static final Pattern HORIZONTAL_RUN = Pattern.compile("[ \\t]+");

    private static final Pattern BLANK_LINE_RUN = Pattern.compile("\\n{3,}");

    private final int maxLength;

    public InputSanitizer(@Value("${uiplan.input.max-length:2000}") int maxLength) {
        this.maxLength = maxLength;
    }

    /**
     * @param text raw instruction
     * @return normalized instruction
     * @throws PlanValidationException with INVALID_INPUT for null, blank or over-long text
     */
    public String sanitize(String text) {
        if (text == null || text.isBlank()) {
            throw new PlanValidationException(PlanError.of(ErrorCode.INVALID_INPUT, "Instruction must be a non-empty string"));
        }
        if (text.length() > maxLength) {
            throw new PlanValidationException(PlanError.of(ErrorCode.INVALID_INPUT,
                    "Instruction too long (" + text.length() + " > " + maxLength + " characters)"));
        }
        return normalize(text);
    }

    String normalize(String text) {
        String canonical = Normalizer.normalize(text, Normalizer.Form.NFC)
                .replace("\r\n", "\n")
                .replace('\r', '\n');
        canonical = HIDDEN_CHARS.matcher(canonical).replaceAll("");
        canonical = HORIZONTAL_RUN.matcher(canonical).replaceAll(" ");
        return BLANK_LINE_RUN.matcher(canonical).replaceAll("\n\n").strip();
    }
}
