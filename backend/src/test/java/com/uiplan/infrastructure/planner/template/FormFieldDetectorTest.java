package com.uiplan.infrastructure.planner.template;

import com.uiplan.infrastructure.planner.template.FormFieldDetector.FormField;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class FormFieldDetectorTest {

    private FormFieldDetector detector;

    @BeforeEach
    void setUp() {
        detector = new FormFieldDetector();
    }

    @Test
    @DisplayName("fields come out in fixed order regardless of mention order")
    void fixed_order() {
        assertThat(detector.detect("a form with phone, password and email"))
                .extracting(FormField::label)
                .containsExactly("Email", "Password", "Phone");
    }

    @Test
    void login_defaults() {
        assertThat(detector.detect("a login form"))
                .extracting(FormField::label)
                .containsExactly("Email", "Password");
        assertThat(detector.formTitle("a login form")).isEqualTo("Login");
        assertThat(detector.submitLabel("a login form")).isEqualTo("Login");
    }

    @Test
    void sign_up_defaults() {
        assertThat(detector.detect("Sign up form"))
                .extracting(FormField::label)
                .containsExactly("Email", "Username", "Password", "Confirm Password");
        assertThat(detector.formTitle("Sign up form")).isEqualTo("Register");
        assertThat(detector.submitLabel("Sign up form")).isEqualTo("Submit");
    }

    @Test
    void input_props() {
        FormField phone = detector.detect("phone").get(0);

        assertThat(phone.toProps()).containsExactly(
                entry("label", "Phone"),
                entry("type", "tel"),
                entry("placeholder", "Enter phone number"));
    }

    @Test
    void nothing_detected() {
        assertThat(detector.detect("a contact form")).isEmpty();
        assertThat(detector.formTitle("a contact form")).isEqualTo("Form");
    }
}
