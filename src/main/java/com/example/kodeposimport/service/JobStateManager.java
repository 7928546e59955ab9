package com.example.kodeposimport.service;

import com.example.kodeposimport.config.AppProperties;
import com.example.kodeposimport.enums.ImportStatus;
import com.example.kodeposimport.repository.ImportJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * 作业行的所有写操作 (每个方法独立事务提交)
 * 状态流转都是带条件的单条 UPDATE: 返回 false 表示当前状态已经不允许该流转 (比如已被取消)
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JobStateManager {

    private final ImportJobRepository jobRepo;
    private final AppProperties config;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean start(String jobId) {
        int updated = jobRepo.start(jobId, ImportStatus.PENDING, ImportStatus.PROCESSING,
                config.getCurrentNodeId(), LocalDateTime.now());
        if (updated == 0) {
            log.info("作业[{}] 不是 PENDING 状态，无法启动", jobId);
        }
        return updated > 0;
    }

    /**
     * 非终态之间前进一步
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean advance(String jobId, ImportStatus from, ImportStatus to) {
        if (!from.canTransitionTo(to) || to.isTerminal()) {
            throw new IllegalStateException("状态流转非法: " + from + " -> " + to);
        }
        int updated = jobRepo.transition(jobId, from, to, LocalDateTime.now());
        if (updated == 0) {
            log.info("作业[{}] 已不在 {} 状态，流转到 {} 失败", jobId, from, to);
        }
        return updated > 0;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean complete(String jobId) {
        return jobRepo.finish(jobId, List.of(ImportStatus.INSERTING), ImportStatus.COMPLETED,
                null, LocalDateTime.now()) > 0;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean fail(String jobId, String errorMessage) {
        return jobRepo.finish(jobId, ImportStatus.ACTIVE, ImportStatus.FAILED,
                errorMessage, LocalDateTime.now()) > 0;
    }

    /**
     * @return false: 作业已是终态
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean cancel(String jobId) {
        return jobRepo.finish(jobId, ImportStatus.ACTIVE, ImportStatus.CANCELLED,
                null, LocalDateTime.now()) > 0;
    }

    /**
     * 把一批作业强制置为失败 (启动清理 / 僵尸作业)
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int failAll(Collection<String> jobIds, Collection<ImportStatus> from, String errorMessage) {
        if (jobIds.isEmpty()) {
            return 0;
        }
        return jobRepo.failJobs(jobIds, from, errorMessage, LocalDateTime.now());
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void updateTotalRecords(String jobId, long total) {
        jobRepo.updateTotalRecords(jobId, total, LocalDateTime.now());
    }

    /**
     * 只写计数器，不影响状态
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void updateProgress(String jobId, JobProgress progress, long elapsedMs) {
        jobRepo.updateProgress(jobId, progress.getProcessed(), progress.getSuccessful(), progress.getFailed(),
                progress.getDuplicates(), elapsedMs, LocalDateTime.now());
    }

    @Transactional(readOnly = true)
    public ImportStatus currentStatus(String jobId) {
        return jobRepo.findStatusById(jobId).orElse(null);
    }
}
