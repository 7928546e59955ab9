package com.example.kodeposimport.service;

import com.example.kodeposimport.dto.BatchResult;
import lombok.Data;

/**
 * run 过程中累计的计数器，每个批次结束后整体写回作业行
 */
@Data
public class JobProgress {
    private long processed;
    private long successful;
    private long failed;
    private long duplicates;

    public void recordFailure() {
        processed++;
        failed++;
    }

    public void add(BatchResult batch) {
        processed += batch.getProcessed();
        successful += batch.getSuccessful();
        failed += batch.getFailed();
        duplicates += batch.getSkippedDuplicates();
    }
}
