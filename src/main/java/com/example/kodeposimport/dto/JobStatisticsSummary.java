package com.example.kodeposimport.dto;

import com.example.kodeposimport.entity.ImportStatistics;
import lombok.Data;

import java.util.List;

@Data
public class JobStatisticsSummary {
    private String jobId;
    private int batches;
    private long recordsCount;
    private long totalExecutionTimeMs;
    private double averageBatchTimeMs;
    // 条/秒
    private double throughputPerSecond;
    private long cacheHits;
    private long cacheMisses;
    private List<ImportStatistics> rows;
}
