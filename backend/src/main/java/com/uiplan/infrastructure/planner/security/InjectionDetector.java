package com.uiplan.infrastructure.planner.security;

import com.uiplan.domain.plan.model.InjectionCheckResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Fixed deny list screening instructions for attempts to step outside the
 * whitelist. Patterns are checked in order and the first match is reported.
 */
@Slf4j
@Component
public class InjectionDetector {

    private record DenyRule(Pattern pattern, String reason) {
        DenyRule(String regex, String reason) {
            this(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), reason);
        }
    }

    private static final List<DenyRule> DENY_RULES = List.of(
            // Rule override
            new DenyRule("ignore\\s+(previous|earlier|prior|these)\\s+(rules|instructions|constraints)", "Constraint bypass attempt"),
            new DenyRule("override\\s+(constraint|rule|validation|check)", "Override attempt"),
            new DenyRule("disable\\s+(safeguard|safety|check|validation|constraint)", "Safety disable attempt"),
            new DenyRule("bypass.*validation", "Validation bypass attempt"),
            new DenyRule("remove.*constraint", "Constraint removal attempt"),

            // Whitelist bypass
            new DenyRule("add\\s+(new\\s+)?component", "Dynamic component creation attempt"),
            new DenyRule("create\\s+(new\\s+)?component", "Dynamic component creation attempt"),
            new DenyRule("modify\\s+(component|implementation)", "Component modification attempt"),
            new DenyRule("generate.*component.*dynamically", "Dynamic component generation attempt"),

            // Style and markup
            new DenyRule("use\\s+(tailwind|styled|css|styles?)", "Style injection attempt"),
            new DenyRule("add.*style", "Style injection attempt"),
            new DenyRule("generate.*css", "CSS injection attempt"),
            new DenyRule("className.*allowed", "ClassName constraint bypass attempt"),
            new DenyRule("style.*prop", "Style prop injection attempt"),

            // Execution
            new DenyRule("\\beval\\b|\\bexecut|run.*code", "Code execution attempt"),
            new DenyRule("dangerous|innerHTML", "Dangerous content attempt"),

            // Rule modification
            new DenyRule("change.*rule", "Rule modification attempt"),
            new DenyRule("forget.*whitelist", "Whitelist bypass attempt"),
            new DenyRule("new.*component.*type", "New component type injection attempt")
    );

    public InjectionCheckResult check(String text) {
        for (DenyRule rule : DENY_RULES) {
            if (rule.pattern().matcher(text).find()) {
                log.warn("[InjectionDetector] Blocked: {} (pattern={})", rule.reason(), rule.pattern().pattern());
                return InjectionCheckResult.blocked(rule.reason());
            }
        }
        return InjectionCheckResult.passed();
    }
}
