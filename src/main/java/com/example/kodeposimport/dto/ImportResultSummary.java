package com.example.kodeposimport.dto;

import com.example.kodeposimport.enums.ImportStatus;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * run() 的返回值
 */
@Data
public class ImportResultSummary {
    private String jobId;
    private ImportStatus status;
    private long totalRecords;
    private long processedRecords;
    private long successfulRecords;
    private long failedRecords;
    private long duplicateRecords;
    private long processingTimeMs;
    // 阶段 -> 耗时 (毫秒)
    private Map<String, Long> phaseTimingsMs = new LinkedHashMap<>();
    private String errorMessage;
}
