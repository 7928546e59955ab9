package com.example.kodeposimport.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ValidationSeverity {
    ERROR,
    WARNING,
    INFO;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    public static ValidationSeverity fromValue(String value) {
        for (ValidationSeverity severity : values()) {
            if (severity.name().equalsIgnoreCase(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + value);
    }
}
