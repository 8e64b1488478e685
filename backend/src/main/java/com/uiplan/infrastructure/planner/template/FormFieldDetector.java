package com.uiplan.infrastructure.planner.template;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Detects which input fields a form request mentions, in a fixed field order.
 */
@Component
public class FormFieldDetector {

    public record FormField(String label, String type, String placeholder) {

        public Map<String, Object> toProps() {
            return Props.of("label", label, "type", type, "placeholder", placeholder);
        }
    }

    private record FieldPattern(Pattern keyword, FormField field) {}

    static final FormField EMAIL = new FormField("Email", "email", "Enter email");
    static final FormField PASSWORD = new FormField("Password", "password", "Enter password");
    static final FormField USERNAME = new FormField("Username", "text", "Enter username");
    static final FormField CONFIRM_PASSWORD = new FormField("Confirm Password", "password", "Confirm password");

    private static final List<FieldPattern> FIELD_PATTERNS = List.of(
            new FieldPattern(Pattern.compile("email"), EMAIL),
            new FieldPattern(Pattern.compile("password"), PASSWORD),
            new FieldPattern(Pattern.compile("username|user name"), USERNAME),
            new FieldPattern(Pattern.compile("confirm password|re-enter password"), CONFIRM_PASSWORD),
            new FieldPattern(Pattern.compile("full name|name"), new FormField("Full Name", "text", "Enter full name")),
            new FieldPattern(Pattern.compile("phone"), new FormField("Phone", "tel", "Enter phone number")),
            new FieldPattern(Pattern.compile("search"), new FormField("Search", "text", "Search...")),
            new FieldPattern(Pattern.compile("address"), new FormField("Address", "text", "Enter address")),
            new FieldPattern(Pattern.compile("comment|message|feedback"), new FormField("Message", "text", "Enter message"))
    );

    static final Pattern LOGIN = Pattern.compile("login|sign in");
    static final Pattern SIGN_UP = Pattern.compile("sign up|register|signup");

    public List<FormField> detect(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        List<FormField> fields = new ArrayList<>();
        for (FieldPattern pattern : FIELD_PATTERNS) {
            if (pattern.keyword().matcher(lower).find()) {
                fields.add(pattern.field());
            }
        }
        if (fields.isEmpty() && isLogin(lower)) {
            return List.of(EMAIL, PASSWORD);
        }
        if (fields.isEmpty() && isSignUp(lower)) {
            return List.of(EMAIL, USERNAME, PASSWORD, CONFIRM_PASSWORD);
        }
        return fields;
    }

    public String formTitle(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (isLogin(lower)) {
            return "Login";
        }
        return isSignUp(lower) ? "Register" : "Form";
    }

    public String submitLabel(String text) {
        return isLogin(text.toLowerCase(Locale.ROOT)) ? "Login" : "Submit";
    }

    private static boolean isLogin(String lower) {
        return LOGIN.matcher(lower).find();
    }

    private static boolean isSignUp(String lower) {
        return SIGN_UP.matcher(lower).find();
    }
}
