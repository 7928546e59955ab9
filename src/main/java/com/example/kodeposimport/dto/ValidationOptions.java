package com.example.kodeposimport.dto;

import com.example.kodeposimport.entity.ImportConfiguration;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ValidationOptions {
    private boolean validateCoordinates;

    public static ValidationOptions from(ImportConfiguration configuration) {
        return new ValidationOptions(configuration.isValidateCoordinates());
    }
}
