package com.example.kodeposimport.service;

import com.example.kodeposimport.config.AppProperties;
import com.example.kodeposimport.dto.*;
import com.example.kodeposimport.entity.ImportConfiguration;
import com.example.kodeposimport.entity.ImportJob;
import com.example.kodeposimport.enums.DuplicateStrategy;
import com.example.kodeposimport.enums.ImportContentType;
import com.example.kodeposimport.enums.RegionTimezone;
import com.example.kodeposimport.enums.ValidationSeverity;
import com.example.kodeposimport.exception.ImportErrorCode;
import com.example.kodeposimport.exception.ImportException;
import com.example.kodeposimport.exception.MalformedRecordException;
import com.example.kodeposimport.util.CharsetFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.stream.Collectors;

/**
 * 对外的导入入口: 上传、dry-run 校验、默认配置和模板
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ImportService {

    static final List<String> CSV_HEADERS = List.of(
            "kodepos", "province", "city", "district", "village", "latitude", "longitude", "elevation", "timezone");

    private final ImportJobManager jobManager;
    private final ImportPipeline pipeline;
    private final ImportPayloadParser payloadParser;
    private final RecordNormalizer normalizer;
    private final RecordValidator validator;
    private final AppProperties config;

    /**
     * 上传并同步执行导入
     * 文件过大、类型不支持、内容无法解析、配置非法都在建作业之前拒绝
     */
    public ImportResultSummary submit(String filename, String declaredContentType, byte[] content,
                                      ImportConfigurationRequest configuration, String createdBy) {
        long maxSize = config.getImporting().getMaxFileSizeBytes();
        if (content.length > maxSize) {
            throw ImportException.fileTooLarge(content.length, maxSize);
        }
        ImportContentType contentType = ImportContentType.fromMimeType(declaredContentType);
        if (contentType == null) {
            throw ImportException.unsupportedContentType(declaredContentType);
        }
        // 先校验配置，避免解析大文件后才发现
        jobManager.buildConfiguration(configuration);

        List<SourceRecord> records = payloadParser.parse(decode(content), contentType);

        String name = StringUtils.defaultIfBlank(filename, "upload");
        ImportJob job = jobManager.create(name, content.length, contentType, configuration, createdBy);
        log.info("开始执行导入作业[{}], 记录数: {}", job.getId(), records.size());
        return pipeline.run(job.getId(), records);
    }

    /**
     * dry-run: 只做归一化 + 校验，不写库
     */
    public ValidationReport validate(ValidateRequest request) {
        if (request == null || request.getData() == null || request.getData().isEmpty()) {
            throw new ImportException(ImportErrorCode.INVALID_REQUEST, "data must be a non-empty array of records");
        }
        ImportConfiguration configuration = jobManager.buildConfiguration(request.getConfiguration());
        ValidationOptions options = ValidationOptions.from(configuration);

        ValidationReport report = new ValidationReport();
        Map<String, Integer> codeCounts = new LinkedHashMap<>();
        long rowNumber = 0;
        for (Object raw : request.getData()) {
            rowNumber++;
            List<ValidationIssue> issues;
            try {
                CanonicalPostalRecord canonical = normalizer.normalize(raw, ImportContentType.JSON);
                issues = validator.validate(canonical, options);
                if (canonical.getCode() != null) {
                    codeCounts.merge(canonical.getCode(), 1, Integer::sum);
                }
            } catch (MalformedRecordException e) {
                issues = List.of(ValidationIssue.error("record", e.getMessage()));
            }

            List<String> errors = messagesOf(issues, ValidationSeverity.ERROR);
            List<String> warnings = messagesOf(issues, ValidationSeverity.WARNING);
            boolean valid = errors.isEmpty();
            report.getResults().add(new RecordValidationOutcome(rowNumber, valid, errors, warnings));
            if (valid) {
                report.setValidRecords(report.getValidRecords() + 1);
            } else {
                report.setInvalidRecords(report.getInvalidRecords() + 1);
            }
            if (!warnings.isEmpty()) {
                report.setWarningRecords(report.getWarningRecords() + 1);
            }
        }

        report.setTotalRecords(request.getData().size());
        report.setDuplicateCodes(codeCounts.entrySet().stream()
                .filter(e -> e.getValue() > 1)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList()));
        int perSecond = Math.max(1, config.getImporting().getEstimateRecordsPerSecond());
        report.setEstimatedProcessingTimeSeconds((report.getTotalRecords() + perSecond - 1) / perSecond);
        return report;
    }

    /**
     * 默认配置和各项限制
     */
    public Map<String, Object> defaults() {
        AppProperties.Import limits = config.getImporting();
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("duplicate_strategy", DuplicateStrategy.SKIP.value());
        defaults.put("batch_size", limits.getDefaultBatchSize());
        defaults.put("validate_coordinates", true);
        defaults.put("skip_invalid_records", true);

        Map<String, Object> limitMap = new LinkedHashMap<>();
        limitMap.put("max_file_size_bytes", limits.getMaxFileSizeBytes());
        limitMap.put("max_batch_size", limits.getMaxBatchSize());
        limitMap.put("supported_content_types",
                Arrays.stream(ImportContentType.values()).map(ImportContentType::getMimeType).collect(Collectors.toList()));
        limitMap.put("duplicate_strategies",
                Arrays.stream(DuplicateStrategy.values()).map(DuplicateStrategy::value).collect(Collectors.toList()));
        limitMap.put("timezones",
                Arrays.stream(RegionTimezone.values()).map(Enum::name).collect(Collectors.toList()));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("defaults", defaults);
        result.put("limits", limitMap);
        return result;
    }

    /**
     * 支持的输入模板 (JSON 示例记录 + CSV 表头)
     */
    public Map<String, Object> templates() {
        Map<String, Object> example = new LinkedHashMap<>();
        example.put("kodepos", "10110");
        example.put("province", "DKI Jakarta");
        example.put("city", "Jakarta Pusat");
        example.put("district", "Menteng");
        example.put("village", "Menteng");
        example.put("latitude", -6.1944);
        example.put("longitude", 106.8229);
        example.put("elevation", 10);
        example.put("timezone", "Asia/Jakarta");

        Map<String, Object> json = new LinkedHashMap<>();
        json.put("content_type", ImportContentType.JSON.getMimeType());
        json.put("example", List.of(example));

        Map<String, Object> csv = new LinkedHashMap<>();
        csv.put("content_type", ImportContentType.CSV.getMimeType());
        csv.put("headers", CSV_HEADERS);
        csv.put("example", String.join(",", CSV_HEADERS) + "\n"
                + "10110,DKI Jakarta,Jakarta Pusat,Menteng,Menteng,-6.1944,106.8229,10,Asia/Jakarta");

        Map<String, Object> aliases = new LinkedHashMap<>();
        for (FieldAlias field : FieldAlias.values()) {
            aliases.put(field.canonicalName(), field.getAliases());
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("json", json);
        result.put("csv", csv);
        result.put("field_aliases", aliases);
        return result;
    }

    private String decode(byte[] content) {
        try {
            return CharsetFactory.decode(content, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            log.info("上传内容不是合法的 UTF-8: {}", e.getMessage());
            throw ImportException.malformedPayload("File is not valid UTF-8 text");
        }
    }

    private List<String> messagesOf(List<ValidationIssue> issues, ValidationSeverity severity) {
        return issues.stream()
                .filter(issue -> issue.getSeverity() == severity)
                .map(ValidationIssue::getMessage)
                .collect(Collectors.toList());
    }
}
