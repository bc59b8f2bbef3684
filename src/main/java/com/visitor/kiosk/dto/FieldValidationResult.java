package com.visitor.kiosk.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.List;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class FieldValidationResult {

    private String field;

    private String value;

    @JsonProperty("is_valid")
    private boolean valid;

    /** Null when the value is valid. */
    private List<String> errors;
}
