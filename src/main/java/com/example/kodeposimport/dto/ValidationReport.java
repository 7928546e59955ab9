package com.example.kodeposimport.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * dry-run 结果，不写库
 */
@Data
public class ValidationReport {
    private List<RecordValidationOutcome> results = new ArrayList<>();
    private int totalRecords;
    private int validRecords;
    private int invalidRecords;
    private int warningRecords;
    // 同一份数据里出现多次的邮编
    private List<String> duplicateCodes = new ArrayList<>();
    private long estimatedProcessingTimeSeconds;
}
