package com.example.kodeposimport.service;

import java.util.HashSet;
import java.util.Set;

/**
 * 单个作业内已知存在的邮编 (库里查到的 + 本作业写入的)
 * 只在一次 run 内使用，不跨作业共享；非线程安全
 */
public class JobCodeCache {

    private final Set<Integer> present = new HashSet<>();

    // 当前批次的命中统计, 每次 resetBatchCounters() 清零
    private long batchHits;
    private long batchMisses;

    public boolean contains(int code) {
        return present.contains(code);
    }

    public void markPresent(int code) {
        present.add(code);
    }

    public void recordHit() {
        batchHits++;
    }

    public void recordMiss() {
        batchMisses++;
    }

    public long getBatchHits() {
        return batchHits;
    }

    public long getBatchMisses() {
        return batchMisses;
    }

    public void resetBatchCounters() {
        batchHits = 0;
        batchMisses = 0;
    }

}
