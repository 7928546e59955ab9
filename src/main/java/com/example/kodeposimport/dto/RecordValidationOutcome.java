package com.example.kodeposimport.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class RecordValidationOutcome {
    private long rowNumber;
    private boolean valid;
    private List<String> errors;
    private List<String> warnings;
}
