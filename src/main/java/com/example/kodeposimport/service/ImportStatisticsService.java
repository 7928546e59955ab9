package com.example.kodeposimport.service;

import com.example.kodeposimport.dto.JobStatisticsSummary;
import com.example.kodeposimport.dto.StatisticsSummary;
import com.example.kodeposimport.entity.ImportStatistics;
import com.example.kodeposimport.enums.ImportStatus;
import com.example.kodeposimport.exception.JobNotFoundException;
import com.example.kodeposimport.repository.ImportJobRepository;
import com.example.kodeposimport.repository.ImportStatisticsRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 统计全部由持久化的行实时汇总，本身不保存状态
 */
@Service
@RequiredArgsConstructor
public class ImportStatisticsService {

    private final ImportJobRepository jobRepo;
    private final ImportStatisticsRepository statisticsRepo;

    @Transactional(readOnly = true)
    public StatisticsSummary summary() {
        StatisticsSummary summary = new StatisticsSummary();
        summary.setTotalJobs(jobRepo.count());
        summary.setSuccessfulJobs(jobRepo.countByStatus(ImportStatus.COMPLETED));
        summary.setFailedJobs(jobRepo.countByStatus(ImportStatus.FAILED));
        summary.setCancelledJobs(jobRepo.countByStatus(ImportStatus.CANCELLED));
        summary.setActiveJobs(jobRepo.countByStatusIn(ImportStatus.ACTIVE));
        Double average = jobRepo.averageCompletedProcessingTimeMs();
        summary.setAverageProcessingTimeMs(average == null ? 0.0 : average);
        summary.setLastImportAt(jobRepo.lastCompletedAt());
        summary.setTotalRecordsImported(jobRepo.sumSuccessfulRecords());
        return summary;
    }

    /**
     * 单个作业的批次统计汇总
     */
    @Transactional(readOnly = true)
    public JobStatisticsSummary jobStatistics(String jobId) {
        if (!jobRepo.existsById(jobId)) {
            throw new JobNotFoundException(jobId);
        }
        List<ImportStatistics> rows = statisticsRepo.findByJobIdOrderByCreatedAtAsc(jobId);

        JobStatisticsSummary summary = new JobStatisticsSummary();
        summary.setJobId(jobId);
        summary.setRows(rows);
        summary.setBatches(rows.size());
        long records = 0;
        long time = 0;
        for (ImportStatistics row : rows) {
            records += row.getRecordsCount();
            time += row.getExecutionTimeMs();
            summary.setCacheHits(summary.getCacheHits() + row.getCacheHits());
            summary.setCacheMisses(summary.getCacheMisses() + row.getCacheMisses());
        }
        summary.setRecordsCount(records);
        summary.setTotalExecutionTimeMs(time);
        summary.setAverageBatchTimeMs(rows.isEmpty() ? 0.0 : (double) time / rows.size());
        // 耗时为 0 (极小批次) 时不计算吞吐
        summary.setThroughputPerSecond(time == 0 ? 0.0 : records * 1000.0 / time);
        return summary;
    }
}
