package com.example.kodeposimport.service;

import com.example.kodeposimport.config.AppProperties;
import com.example.kodeposimport.dto.HistoryFilter;
import com.example.kodeposimport.dto.HistoryPage;
import com.example.kodeposimport.dto.ImportConfigurationRequest;
import com.example.kodeposimport.dto.JobStatusView;
import com.example.kodeposimport.entity.ImportConfiguration;
import com.example.kodeposimport.entity.ImportJob;
import com.example.kodeposimport.entity.ImportValidationResult;
import com.example.kodeposimport.enums.DuplicateStrategy;
import com.example.kodeposimport.enums.ImportContentType;
import com.example.kodeposimport.enums.ImportStatus;
import com.example.kodeposimport.enums.ValidationSeverity;
import com.example.kodeposimport.exception.ImportErrorCode;
import com.example.kodeposimport.exception.ImportException;
import com.example.kodeposimport.exception.JobNotFoundException;
import com.example.kodeposimport.repository.ImportConfigurationRepository;
import com.example.kodeposimport.repository.ImportJobRepository;
import com.example.kodeposimport.repository.ImportValidationResultRepository;
import com.google.gson.Gson;
import jakarta.persistence.criteria.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 作业生命周期: 创建 / 查询状态 / 取消 / 历史
 * 驱动执行在 ImportPipeline
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ImportJobManager {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    // 对外的排序字段 -> 实体属性
    private static final Map<String, String> SORT_FIELDS = Map.of(
            "created_at", "createdAt",
            "completed_at", "completedAt",
            "processing_time_ms", "processingTimeMs");

    private final ImportJobRepository jobRepo;
    private final ImportConfigurationRepository configRepo;
    private final ImportValidationResultRepository validationResultRepo;
    private final JobStateManager stateManager;
    private final AppProperties config;

    private final Gson gson = new Gson();

    /**
     * 作业和配置在同一个事务里保存
     */
    @Transactional
    public ImportJob create(String filename, long fileSize, ImportContentType contentType,
                           ImportConfigurationRequest request, String createdBy) {
        ImportConfiguration configuration = buildConfiguration(request);

        ImportJob job = new ImportJob();
        job.setFilename(filename);
        job.setFileSize(fileSize);
        job.setContentType(contentType);
        job.setStatus(ImportStatus.PENDING);
        job.setCreatedBy(StringUtils.trimToNull(createdBy));
        job = jobRepo.save(job);

        configuration.setJobId(job.getId());
        configRepo.save(configuration);

        log.info("创建导入作业[{}], 文件: {}, 大小: {} bytes, 策略: {}, 批次: {}", job.getId(), filename, fileSize,
                configuration.getDuplicateStrategy().value(), configuration.getBatchSize());
        return job;
    }

    /**
     * 部分配置 + 默认值 -> 完整配置 (未保存)
     * 超出范围的值抛 INVALID_CONFIGURATION
     */
    public ImportConfiguration buildConfiguration(ImportConfigurationRequest request) {
        AppProperties.Import limits = config.getImporting();
        ImportConfigurationRequest req = request == null ? new ImportConfigurationRequest() : request;

        ImportConfiguration configuration = new ImportConfiguration();

        if (req.getDuplicateStrategy() == null) {
            configuration.setDuplicateStrategy(DuplicateStrategy.SKIP);
        } else {
            DuplicateStrategy strategy = DuplicateStrategy.fromValue(req.getDuplicateStrategy());
            if (strategy == null) {
                throw ImportException.invalidConfiguration(
                        "Invalid duplicate_strategy: " + req.getDuplicateStrategy() + " (expected skip, update or error)");
            }
            configuration.setDuplicateStrategy(strategy);
        }

        int batchSize = req.getBatchSize() == null ? limits.getDefaultBatchSize() : req.getBatchSize();
        if (batchSize < 1 || batchSize > limits.getMaxBatchSize()) {
            throw ImportException.invalidConfiguration(
                    "batch_size must be between 1 and " + limits.getMaxBatchSize());
        }
        configuration.setBatchSize(batchSize);

        configuration.setValidateCoordinates(req.getValidateCoordinates() == null || req.getValidateCoordinates());
        configuration.setSkipInvalidRecords(req.getSkipInvalidRecords() == null || req.getSkipInvalidRecords());

        String email = StringUtils.trimToNull(req.getNotificationEmail());
        if (email != null && !EMAIL.matcher(email).matches()) {
            throw ImportException.invalidConfiguration("Invalid notification_email: " + email);
        }
        configuration.setNotificationEmail(email);

        if (req.getCustomValidationRules() != null) {
            configuration.setCustomValidationRules(gson.toJson(req.getCustomValidationRules()));
        }
        return configuration;
    }

    @Transactional(readOnly = true)
    public ImportJob getJob(String jobId) {
        return jobRepo.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    @Transactional(readOnly = true)
    public ImportConfiguration getConfiguration(String jobId) {
        return configRepo.findByJobId(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * 当前快照 + 进度百分比 + 剩余时间估算
     */
    @Transactional(readOnly = true)
    public JobStatusView status(String jobId) {
        ImportJob job = getJob(jobId);

        JobStatusView view = new JobStatusView();
        view.setJob(job);
        view.setConfiguration(configRepo.findByJobId(jobId).orElse(null));

        long total = job.getTotalRecords();
        long processed = job.getProcessedRecords();
        view.setProgressPercentage(total == 0 ? 0.0 : processed * 100.0 / total);

        // 只有处理过记录才能估算; 终态作业剩余时间为 0
        if (job.getStatus().isTerminal()) {
            view.setEstimatedRemainingTimeMs(processed > 0 ? 0L : null);
        } else if (processed > 0 && job.getStartedAt() != null) {
            long elapsed = Math.max(0, Duration.between(job.getStartedAt(), LocalDateTime.now()).toMillis());
            view.setEstimatedRemainingTimeMs(elapsed * Math.max(0, total - processed) / processed);
        }
        return view;
    }

    /**
     * @return 是否取消成功; 终态作业返回 false
     */
    public boolean cancel(String jobId) {
        ImportJob job = getJob(jobId);
        if (job.getStatus().isTerminal()) {
            log.info("作业[{}] 已是终态 {}，忽略取消请求", jobId, job.getStatus());
            return false;
        }
        boolean cancelled = stateManager.cancel(jobId);
        if (cancelled) {
            log.info("作业[{}] 已取消 (原状态 {})，将在下一个批次边界停止", jobId, job.getStatus());
        }
        return cancelled;
    }

    @Transactional(readOnly = true)
    public HistoryPage history(HistoryFilter filter) {
        AppProperties.Import limits = config.getImporting();
        HistoryFilter f = filter == null ? new HistoryFilter() : filter;

        int page = f.getPage() == null ? 1 : Math.max(1, f.getPage());
        int pageSize = f.getPageSize() == null ? limits.getHistoryDefaultPageSize() : f.getPageSize();
        pageSize = Math.min(Math.max(1, pageSize), limits.getHistoryMaxPageSize());

        String sortBy = f.getSortBy() == null ? "created_at" : f.getSortBy().trim().toLowerCase();
        String property = SORT_FIELDS.get(sortBy);
        if (property == null) {
            throw new ImportException(ImportErrorCode.INVALID_REQUEST,
                    "Invalid sort_by: " + f.getSortBy() + " (expected created_at, completed_at or processing_time_ms)");
        }
        Sort.Direction direction;
        if (f.getSortOrder() == null || "desc".equalsIgnoreCase(f.getSortOrder())) {
            direction = Sort.Direction.DESC;
        } else if ("asc".equalsIgnoreCase(f.getSortOrder())) {
            direction = Sort.Direction.ASC;
        } else {
            throw new ImportException(ImportErrorCode.INVALID_REQUEST,
                    "Invalid sort_order: " + f.getSortOrder() + " (expected asc or desc)");
        }

        PageRequest pageRequest = PageRequest.of(page - 1, pageSize, Sort.by(direction, property));
        Page<ImportJob> result = jobRepo.findAll(historySpec(f), pageRequest);
        return new HistoryPage(result.getContent(), result.getTotalElements(), page, pageSize, result.getTotalPages());
    }

    private Specification<ImportJob> historySpec(HistoryFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (filter.getStatus() != null) {
                predicates.add(cb.equal(root.get("status"), filter.getStatus()));
            }
            if (filter.getCreatedFrom() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("createdAt"), filter.getCreatedFrom()));
            }
            if (filter.getCreatedTo() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("createdAt"), filter.getCreatedTo()));
            }
            if (StringUtils.isNotBlank(filter.getCreatedBy())) {
                predicates.add(cb.equal(root.get("createdBy"), filter.getCreatedBy().trim()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    /**
     * 作业的校验结果, 按行号排序
     * @param severity 为空表示全部
     */
    @Transactional(readOnly = true)
    public List<ImportValidationResult> validationResults(String jobId, ValidationSeverity severity) {
        getJob(jobId);
        if (severity == null) {
            return validationResultRepo.findByJobIdOrderByRowNumberAsc(jobId);
        }
        return validationResultRepo.findByJobIdAndSeverityOrderByRowNumberAsc(jobId, severity);
    }
}
