package com.example.kodeposimport.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 全局统计，全部从作业表实时汇总
 */
@Data
public class StatisticsSummary {
    private long totalJobs;
    private long successfulJobs;
    private long failedJobs;
    private long cancelledJobs;
    private long activeJobs;
    private double averageProcessingTimeMs;
    private LocalDateTime lastImportAt;
    private long totalRecordsImported;
}
