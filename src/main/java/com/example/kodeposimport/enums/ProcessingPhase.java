package com.example.kodeposimport.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProcessingPhase {
    VALIDATION,
    TRANSFORMATION,
    INSERTION,
    COMPLETION;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
