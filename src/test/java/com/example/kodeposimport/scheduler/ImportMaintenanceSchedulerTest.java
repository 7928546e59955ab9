package com.example.kodeposimport.scheduler;

import com.example.kodeposimport.config.AppProperties;
import com.example.kodeposimport.entity.ImportJob;
import com.example.kodeposimport.enums.ImportStatus;
import com.example.kodeposimport.repository.ImportJobRepository;
import com.example.kodeposimport.repository.ImportStatisticsRepository;
import com.example.kodeposimport.repository.ImportValidationResultRepository;
import com.example.kodeposimport.service.JobLockManager;
import com.example.kodeposimport.service.JobStateManager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ImportMaintenanceSchedulerTest {

    @Mock private ImportJobRepository jobRepo;
    @Mock private ImportValidationResultRepository validationResultRepo;
    @Mock private ImportStatisticsRepository statisticsRepo;
    @Mock private JobStateManager stateManager;
    @Spy private JobLockManager lockManager = new JobLockManager();
    @Spy private AppProperties config = new AppProperties();

    @InjectMocks
    private ImportMaintenanceScheduler scheduler;

    private static ImportJob job(String id) {
        ImportJob job = new ImportJob();
        job.setId(id);
        job.setStatus(ImportStatus.INSERTING);
        return job;
    }

    @Test
    @DisplayName("僵尸作业置为失败，本进程正在跑的作业跳过")
    void rescueStalledJobs_skipsLockedJobs() {
        when(jobRepo.findByStatusInAndUpdatedAtBefore(anyCollection(), any(LocalDateTime.class)))
                .thenReturn(List.of(job("stalled"), job("running")));
        lockManager.tryLock("running");

        scheduler.rescueStalledJobs();

        verify(stateManager).failAll(eq(List.of("stalled")), anyCollection(),
                eq(ImportMaintenanceScheduler.STALLED_MESSAGE));
    }

    @Test
    void rescueStalledJobs_disabled() {
        config.getMaintenance().setEnabled(false);

        scheduler.rescueStalledJobs();

        verifyNoInteractions(jobRepo, stateManager);
    }

    @Test
    @DisplayName("清理过期的校验结果和批次统计")
    void purgeExpiredRows() {
        config.getMaintenance().setRetentionDays(30);
        when(validationResultRepo.deleteOlderThan(any(LocalDateTime.class))).thenReturn(3);
        when(statisticsRepo.deleteOlderThan(any(LocalDateTime.class))).thenReturn(1);

        scheduler.purgeExpiredRows();

        verify(validationResultRepo).deleteOlderThan(argThat(cutoff ->
                cutoff.isBefore(LocalDateTime.now().minusDays(29)) && cutoff.isAfter(LocalDateTime.now().minusDays(31))));
        verify(statisticsRepo).deleteOlderThan(any(LocalDateTime.class));
        verifyNoInteractions(jobRepo);
    }
}
