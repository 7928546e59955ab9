package com.example.kodeposimport.scheduler;

import com.example.kodeposimport.config.AppProperties;
import com.example.kodeposimport.entity.ImportJob;
import com.example.kodeposimport.enums.ImportStatus;
import com.example.kodeposimport.repository.ImportJobRepository;
import com.example.kodeposimport.repository.ImportStatisticsRepository;
import com.example.kodeposimport.repository.ImportValidationResultRepository;
import com.example.kodeposimport.service.JobLockManager;
import com.example.kodeposimport.service.JobStateManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 定时维护
 *   1. 僵尸作业: 执行中但长时间没有进度更新，且本进程没有在跑它
 *   2. 过期的校验结果 / 批次统计 (作业行本身永不删除)
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ImportMaintenanceScheduler {

    static final String STALLED_MESSAGE = "Import stalled without progress and was stopped";

    private static final Set<ImportStatus> RUNNING = EnumSet.of(
            ImportStatus.PROCESSING, ImportStatus.VALIDATING, ImportStatus.TRANSFORMING, ImportStatus.INSERTING);

    private final ImportJobRepository jobRepo;
    private final ImportValidationResultRepository validationResultRepo;
    private final ImportStatisticsRepository statisticsRepo;
    private final JobStateManager stateManager;
    private final JobLockManager lockManager;
    private final AppProperties config;

    /**
     * 每 10 分钟运行一次
     */
    @Scheduled(fixedDelayString = "${app.maintenance.stalled-check-interval-ms:600000}")
    public void rescueStalledJobs() {
        AppProperties.Maintenance maintenance = config.getMaintenance();
        if (!maintenance.isEnabled()) {
            return;
        }
        LocalDateTime threshold = LocalDateTime.now().minusMinutes(maintenance.getStalledMinutes());

        List<String> stalled = jobRepo.findByStatusInAndUpdatedAtBefore(RUNNING, threshold).stream()
                .map(ImportJob::getId)
                .filter(id -> !lockManager.isLocked(id))
                .collect(Collectors.toList());
        for (String jobId : stalled) {
            log.error("发现僵尸作业[{}]，超过 {} 分钟没有进度，强制置为失败。", jobId, maintenance.getStalledMinutes());
        }
        stateManager.failAll(stalled, RUNNING, STALLED_MESSAGE);
    }

    /**
     * 每天凌晨 3 点清理过期数据
     */
    @Scheduled(cron = "${app.maintenance.purge-cron:0 0 3 * * *}")
    @Transactional
    public void purgeExpiredRows() {
        AppProperties.Maintenance maintenance = config.getMaintenance();
        if (!maintenance.isEnabled() || maintenance.getRetentionDays() <= 0) {
            return;
        }
        LocalDateTime cutoff = LocalDateTime.now().minusDays(maintenance.getRetentionDays());
        int results = validationResultRepo.deleteOlderThan(cutoff);
        int stats = statisticsRepo.deleteOlderThan(cutoff);
        if (results > 0 || stats > 0) {
            log.info("清理过期数据: 校验结果 {} 行, 批次统计 {} 行 (早于 {})", results, stats, cutoff);
        }
    }
}
