package com.visitor.kiosk.service;

import com.visitor.kiosk.dto.FieldValidationResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class FieldValidationServiceTest {

    private final FieldValidationService validator = new FieldValidationService();

    @ParameterizedTest
    @CsvSource({
            "email, alice@example.com, true",
            "email, alice.example.com, false",
            "phone, 12345, false",
            "phone, 1234567, true",
            "phone, 123456789012345, true",
            "phone, 1234567890123456, false",
            "phone, 555-1234, false",
            "id_number, ab, false",
            "id_number, abc, true",
            "purpose, x, true"
    })
    void appliesPerFieldRules(String field, String value, boolean expected) {
        assertThat(validator.validate(field, value).isValid()).isEqualTo(expected);
    }

    @Test
    void invalidPhoneReportsRange() {
        FieldValidationResult result = validator.validate("phone", "12345");

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).containsExactly("Invalid phone number; must be 7-15 digits.");
        assertThat(result.getField()).isEqualTo("phone");
        assertThat(result.getValue()).isEqualTo("12345");
    }

    @Test
    void validResultHasNoErrorList() {
        FieldValidationResult result = validator.validate("id_number", "abc");

        assertThat(result.isValid()).isTrue();
        assertThat(result.getErrors()).isNull();
    }

    @Test
    void nullValueFailsEmailCheck() {
        FieldValidationResult result = validator.validate("email", null);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).containsExactly("Invalid email format.");
    }
}
