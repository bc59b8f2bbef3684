package com.visitor.kiosk.dto;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class FieldValidationRequest {

    /** e.g. email, phone, id_number */
    private String field;

    private String value;
}
