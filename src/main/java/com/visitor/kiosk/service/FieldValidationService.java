package com.visitor.kiosk.service;

import com.visitor.kiosk.dto.FieldValidationResult;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-field rules for live form feedback. Unknown fields are always valid.
 */
@Service
public class FieldValidationService {

    static final int PHONE_MIN_DIGITS = 7;
    static final int PHONE_MAX_DIGITS = 15;
    static final int ID_NUMBER_MIN_LENGTH = 3;

    public FieldValidationResult validate(String field, String value) {
        String v = value == null ? "" : value;
        List<String> errors = new ArrayList<>();

        if ("email".equals(field)) {
            if (!v.contains("@")) {
                errors.add("Invalid email format.");
            }
        } else if ("phone".equals(field)) {
            if (!StringUtils.isNumeric(v) || v.length() < PHONE_MIN_DIGITS || v.length() > PHONE_MAX_DIGITS) {
                errors.add("Invalid phone number; must be 7-15 digits.");
            }
        } else if ("id_number".equals(field)) {
            if (v.length() < ID_NUMBER_MIN_LENGTH) {
                errors.add("ID must be at least 3 characters.");
            }
        }

        return new FieldValidationResult(field, value, errors.isEmpty(), errors.isEmpty() ? null : errors);
    }

    public boolean isValid(String field, String value) {
        return validate(field, value).isValid();
    }
}
