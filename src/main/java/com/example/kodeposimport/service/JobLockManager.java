package com.example.kodeposimport.service;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内防止同一个作业被并发 run
 */
@Component
public class JobLockManager {

    // 线程安全的 Set
    private final Set<String> runningJobIds = ConcurrentHashMap.newKeySet();

    /**
     * 尝试锁定作业
     * @return true 如果锁定成功, false 如果作业已在运行
     */
    public boolean tryLock(String jobId) {
        return runningJobIds.add(jobId);
    }

    public void releaseLock(String jobId) {
        runningJobIds.remove(jobId);
    }

    public boolean isLocked(String jobId) {
        return runningJobIds.contains(jobId);
    }
}
