package com.example.kodeposimport.service;

import com.example.kodeposimport.dto.*;
import com.example.kodeposimport.entity.ImportConfiguration;
import com.example.kodeposimport.entity.ImportJob;
import com.example.kodeposimport.entity.ImportValidationResult;
import com.example.kodeposimport.enums.ImportContentType;
import com.example.kodeposimport.enums.ImportStatus;
import com.example.kodeposimport.enums.ValidationSeverity;
import com.example.kodeposimport.exception.*;
import com.example.kodeposimport.repository.ImportConfigurationRepository;
import com.example.kodeposimport.repository.ImportJobRepository;
import com.example.kodeposimport.repository.ImportValidationResultRepository;
import com.google.gson.Gson;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 驱动一个作业跑完整个状态机 (在调用线程上同步执行)
 * PROCESSING(解析) -> VALIDATING -> TRANSFORMING -> INSERTING(按批次) -> COMPLETED
 *
 * 作业行是唯一的进度来源，每个批次结束都会写回计数器；
 * 每个批次开始前重新读取作业状态，被取消则在批次边界停下。
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ImportPipeline {

    private final ImportJobRepository jobRepo;
    private final ImportConfigurationRepository configRepo;
    private final ImportValidationResultRepository validationResultRepo;
    private final JobStateManager stateManager;
    private final JobLockManager lockManager;
    private final ImportPayloadParser payloadParser;
    private final RecordNormalizer normalizer;
    private final RecordValidator validator;
    private final RecordTransformer transformer;
    private final DuplicateResolver duplicateResolver;
    private final BatchInserter batchInserter;

    private final Gson gson = new Gson();

    /**
     * 原始文件内容: 在 PROCESSING 阶段解析，解析失败作业置为 FAILED
     */
    public ImportResultSummary run(String jobId, String rawContent) {
        return execute(jobId, job -> payloadParser.parse(rawContent, job.getContentType()));
    }

    /**
     * 已经解析好的记录 (上传接口在建作业前先解析，避免无效文件产生作业)
     */
    public ImportResultSummary run(String jobId, List<SourceRecord> records) {
        return execute(jobId, job -> records);
    }

    private ImportResultSummary execute(String jobId, Function<ImportJob, List<SourceRecord>> source) {
        // 1. 【进门加锁】
        if (!lockManager.tryLock(jobId)) {
            throw new ImportException(ImportErrorCode.JOB_NOT_RUNNABLE, "Import job " + jobId + " is already running");
        }
        try {
            ImportJob job = jobRepo.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            ImportConfiguration configuration = configRepo.findByJobId(jobId)
                    .orElseThrow(() -> new JobNotFoundException(jobId));

            if (!stateManager.start(jobId)) {
                throw new ImportException(ImportErrorCode.JOB_NOT_RUNNABLE,
                        "Import job " + jobId + " is " + job.getStatus().value() + " and cannot be run");
            }

            JobRun run = new JobRun(jobId, job.getContentType(), configuration);
            try {
                process(run, () -> source.apply(job));
                if (stateManager.complete(jobId)) {
                    log.info("作业[{}] 导入完成", jobId);
                } else {
                    log.info("作业[{}] 在最后一个批次后被取消", jobId);
                }
            } catch (JobCancelledException e) {
                log.info("作业[{}] 已停止: {}", jobId, e.getMessage());
            } catch (RecordRejectedException e) {
                log.warn("作业[{}] 遇到无效记录终止: {}", jobId, e.getMessage());
                stateManager.fail(jobId, e.getMessage());
            } catch (ImportException e) {
                // 解析失败 / 存储不可用
                log.error("作业[{}] 失败: {}", jobId, e.getMessage(), e);
                stateManager.fail(jobId, e.getMessage());
            } catch (DataAccessException e) {
                log.error("作业[{}] 访问数据库失败", jobId, e);
                stateManager.fail(jobId, PostalCodeStore.UNAVAILABLE_MESSAGE);
            } catch (RuntimeException e) {
                log.error("作业[{}] 处理异常", jobId, e);
                stateManager.fail(jobId, "Import failed due to an internal error");
            } finally {
                stateManager.updateProgress(jobId, run.progress, run.elapsedMs());
            }
            return summarize(run);
        } finally {
            // 2. 【出门解锁】
            lockManager.releaseLock(jobId);
        }
    }

    private void process(JobRun run, Supplier<List<SourceRecord>> source) {
        String jobId = run.jobId;
        ImportConfiguration configuration = run.configuration;

        // ---- PROCESSING: 解析 ----
        long phaseStart = System.currentTimeMillis();
        List<SourceRecord> records = source.get();
        stateManager.updateTotalRecords(jobId, records.size());
        run.phase("processing", phaseStart);
        log.info("作业[{}] 解析完成, 记录数: {}", jobId, records.size());

        // ---- VALIDATING: 归一化 + 校验 ----
        advance(jobId, ImportStatus.PROCESSING, ImportStatus.VALIDATING);
        phaseStart = System.currentTimeMillis();
        List<ValidatedRecord> valid = validate(run, records);
        stateManager.updateProgress(jobId, run.progress, run.elapsedMs());
        run.phase("validation", phaseStart);
        log.info("作业[{}] 校验完成, 有效: {}, 无效: {}", jobId, valid.size(), run.progress.getFailed());

        // ---- TRANSFORMING: 类型转换 ----
        advance(jobId, ImportStatus.VALIDATING, ImportStatus.TRANSFORMING);
        phaseStart = System.currentTimeMillis();
        List<StagedRecord> staged = transform(run, valid);
        stateManager.updateProgress(jobId, run.progress, run.elapsedMs());
        run.phase("transformation", phaseStart);

        // ---- INSERTING: 按批次写入 ----
        advance(jobId, ImportStatus.TRANSFORMING, ImportStatus.INSERTING);
        phaseStart = System.currentTimeMillis();
        insert(run, staged);
        run.phase("insertion", phaseStart);
    }

    private List<ValidatedRecord> validate(JobRun run, List<SourceRecord> records) {
        ValidationOptions options = ValidationOptions.from(run.configuration);
        List<ValidatedRecord> valid = new ArrayList<>();
        for (SourceRecord record : records) {
            String recordData = gson.toJson(record.getRaw());
            List<ValidationIssue> issues;
            CanonicalPostalRecord canonical = null;
            try {
                canonical = normalizer.normalize(record.getRaw(), run.contentType);
                issues = validator.validate(canonical, options);
            } catch (MalformedRecordException e) {
                issues = List.of(ValidationIssue.error("record", e.getMessage()));
            }

            if (!RecordValidator.isValid(issues)) {
                List<String> reasons = messages(issues);
                saveResult(run.jobId, record.getRowNumber(), recordData, reasons, ValidationSeverity.ERROR);
                rejectRecord(run, record.getRowNumber(), reasons);
                continue;
            }
            if (!issues.isEmpty()) {
                saveResult(run.jobId, record.getRowNumber(), recordData, messages(issues), ValidationSeverity.WARNING);
            }
            valid.add(new ValidatedRecord(record.getRowNumber(), recordData, canonical));
        }
        return valid;
    }

    private List<StagedRecord> transform(JobRun run, List<ValidatedRecord> valid) {
        List<StagedRecord> staged = new ArrayList<>(valid.size());
        for (ValidatedRecord record : valid) {
            try {
                staged.add(new StagedRecord(record.rowNumber, record.recordData, transformer.transform(record.canonical)));
            } catch (IllegalArgumentException e) {
                List<String> reasons = List.of(e.getMessage());
                saveResult(run.jobId, record.rowNumber, record.recordData, reasons, ValidationSeverity.ERROR);
                rejectRecord(run, record.rowNumber, reasons);
            }
        }
        return staged;
    }

    private void insert(JobRun run, List<StagedRecord> staged) {
        String jobId = run.jobId;
        ImportConfiguration configuration = run.configuration;
        int batchSize = configuration.getBatchSize();
        boolean stopOnFailure = !configuration.isSkipInvalidRecords();
        JobCodeCache cache = new JobCodeCache();

        int batchNumber = 0;
        for (int from = 0; from < staged.size(); from += batchSize) {
            // 批次边界: 检查作业是否被取消
            ensureStillRunning(jobId, ImportStatus.INSERTING);

            List<StagedRecord> batch = staged.subList(from, Math.min(from + batchSize, staged.size()));
            batchNumber++;

            List<ResolvedRecord> resolved = duplicateResolver.resolve(batch, configuration.getDuplicateStrategy(), cache);
            BatchResult result = batchInserter.insert(jobId, batchNumber, configuration.getDuplicateStrategy(),
                    resolved, stopOnFailure, cache);

            for (RecordFailure failure : result.getFailures()) {
                saveResult(jobId, failure.getRowNumber(), failure.getRecordData(), failure.getReasons(),
                        ValidationSeverity.ERROR);
            }
            run.progress.add(result);
            stateManager.updateProgress(jobId, run.progress, run.elapsedMs());

            if (stopOnFailure && result.hasFailures()) {
                RecordFailure first = result.getFailures().get(0);
                throw new RecordRejectedException(rejectionMessage(first.getRowNumber(), first.getReasons()));
            }
        }
    }

    private void advance(String jobId, ImportStatus from, ImportStatus to) {
        if (!stateManager.advance(jobId, from, to)) {
            ensureStillRunning(jobId, from);
        }
    }

    /**
     * 作业被取消 (或被维护任务置为失败) 时抛 JobCancelledException
     */
    private void ensureStillRunning(String jobId, ImportStatus expected) {
        ImportStatus current = stateManager.currentStatus(jobId);
        if (current != expected) {
            throw new JobCancelledException("job status changed to " + current + " while " + expected);
        }
    }

    /**
     * 数据错误计数; skip_invalid_records=false 时直接终止作业
     */
    private void rejectRecord(JobRun run, long rowNumber, List<String> reasons) {
        run.progress.recordFailure();
        if (!run.configuration.isSkipInvalidRecords()) {
            throw new RecordRejectedException(rejectionMessage(rowNumber, reasons));
        }
    }

    private String rejectionMessage(long rowNumber, List<String> reasons) {
        return "Import aborted at row " + rowNumber + ": " + String.join("; ", reasons);
    }

    private void saveResult(String jobId, long rowNumber, String recordData, List<String> reasons,
                            ValidationSeverity severity) {
        ImportValidationResult result = new ImportValidationResult();
        result.setJobId(jobId);
        result.setRowNumber(rowNumber);
        result.setRecordData(recordData);
        result.setValidationErrors(gson.toJson(reasons));
        result.setSeverity(severity);
        validationResultRepo.save(result);
    }

    private List<String> messages(List<ValidationIssue> issues) {
        return issues.stream().map(ValidationIssue::getMessage).collect(Collectors.toList());
    }

    private ImportResultSummary summarize(JobRun run) {
        ImportJob job = jobRepo.findById(run.jobId).orElseThrow(() -> new JobNotFoundException(run.jobId));
        ImportResultSummary summary = new ImportResultSummary();
        summary.setJobId(job.getId());
        summary.setStatus(job.getStatus());
        summary.setTotalRecords(job.getTotalRecords());
        summary.setProcessedRecords(job.getProcessedRecords());
        summary.setSuccessfulRecords(job.getSuccessfulRecords());
        summary.setFailedRecords(job.getFailedRecords());
        summary.setDuplicateRecords(job.getDuplicateRecords());
        summary.setProcessingTimeMs(job.getProcessingTimeMs());
        summary.setPhaseTimingsMs(run.phaseTimings);
        summary.setErrorMessage(job.getErrorMessage());
        return summary;
    }

    private static class ValidatedRecord {
        private final long rowNumber;
        private final String recordData;
        private final CanonicalPostalRecord canonical;

        ValidatedRecord(long rowNumber, String recordData, CanonicalPostalRecord canonical) {
            this.rowNumber = rowNumber;
            this.recordData = recordData;
            this.canonical = canonical;
        }
    }

    /**
     * 一次 run 的内存状态, run 结束即丢弃
     */
    private static class JobRun {
        private final String jobId;
        private final ImportContentType contentType;
        private final ImportConfiguration configuration;
        private final long startedAt = System.currentTimeMillis();
        private final JobProgress progress = new JobProgress();
        private final Map<String, Long> phaseTimings = new LinkedHashMap<>();

        JobRun(String jobId, ImportContentType contentType, ImportConfiguration configuration) {
            this.jobId = jobId;
            this.contentType = contentType;
            this.configuration = configuration;
        }

        void phase(String name, long phaseStart) {
            phaseTimings.put(name, System.currentTimeMillis() - phaseStart);
        }

        long elapsedMs() {
            return System.currentTimeMillis() - startedAt;
        }
    }
}
