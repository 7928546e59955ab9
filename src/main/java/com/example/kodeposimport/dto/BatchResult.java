package com.example.kodeposimport.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 一个批次的写入结果
 */
@Data
public class BatchResult {
    private int batchNumber;
    // 实际处理过的记录数 (stopOnFailure 时可能小于批次大小)
    private int processed;
    private int inserted;
    private int updated;
    private int skippedDuplicates;
    private int failed;
    private long executionTimeMs;
    private long cacheHits;
    private long cacheMisses;
    private List<RecordFailure> failures = new ArrayList<>();

    public BatchResult(int batchNumber) {
        this.batchNumber = batchNumber;
    }

    public int getSuccessful() {
        return inserted + updated;
    }

    public boolean hasFailures() {
        return failed > 0;
    }
}
