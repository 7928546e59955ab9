package com.example.kodeposimport.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class RecordFailure {
    private long rowNumber;
    private String recordData;
    private List<String> reasons;
}
