package com.example.kodeposimport.dto;

import com.example.kodeposimport.enums.ValidationSeverity;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ValidationIssue {
    private String field;
    private String message;
    private ValidationSeverity severity;

    public static ValidationIssue error(String field, String message) {
        return new ValidationIssue(field, message, ValidationSeverity.ERROR);
    }

    public static ValidationIssue warning(String field, String message) {
        return new ValidationIssue(field, message, ValidationSeverity.WARNING);
    }

    public boolean isError() {
        return severity == ValidationSeverity.ERROR;
    }
}
