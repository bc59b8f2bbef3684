package com.visitor.kiosk.controller;

import com.visitor.kiosk.dto.FieldValidationRequest;
import com.visitor.kiosk.dto.FieldValidationResult;
import com.visitor.kiosk.service.FieldValidationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/validation")
@Tag(name = "validation", description = "Real-time field validation")
public class ValidationController {

    private final FieldValidationService fieldValidationService;

    public ValidationController(FieldValidationService fieldValidationService) {
        this.fieldValidationService = fieldValidationService;
    }

    @Operation(summary = "Validate a single form field")
    @PostMapping("/validate-field")
    public FieldValidationResult validateField(@RequestBody FieldValidationRequest request) {
        return fieldValidationService.validate(request.getField(), request.getValue());
    }
}
