package com.example.kodeposimport.controller;

import com.example.kodeposimport.dto.*;
import com.example.kodeposimport.entity.ImportValidationResult;
import com.example.kodeposimport.enums.ImportStatus;
import com.example.kodeposimport.enums.ValidationSeverity;
import com.example.kodeposimport.exception.ImportErrorCode;
import com.example.kodeposimport.exception.ImportException;
import com.example.kodeposimport.service.ImportJobManager;
import com.example.kodeposimport.service.ImportService;
import com.example.kodeposimport.service.ImportStatisticsService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/import")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
@Slf4j
public class ImportController {

    private final ImportService importService;
    private final ImportJobManager jobManager;
    private final ImportStatisticsService statisticsService;
    private final ObjectMapper objectMapper;

    /**
     * 上传文件并同步执行导入
     * configuration: 可选，JSON 格式的部分配置
     */
    @PostMapping("/upload")
    public ImportResultSummary upload(@RequestParam("file") MultipartFile file,
                                      @RequestParam(value = "configuration", required = false) String configuration,
                                      @RequestHeader(value = "X-User-Id", required = false) String userId) throws IOException {
        ImportConfigurationRequest request = parseConfiguration(configuration);
        return importService.submit(file.getOriginalFilename(), file.getContentType(), file.getBytes(), request, userId);
    }

    @GetMapping("/status/{jobId}")
    public JobStatusView status(@PathVariable String jobId) {
        return jobManager.status(jobId);
    }

    @GetMapping("/history")
    public HistoryPage history(@RequestParam(value = "status", required = false) String status,
                               @RequestParam(value = "created_from", required = false)
                               @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime createdFrom,
                               @RequestParam(value = "created_to", required = false)
                               @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime createdTo,
                               @RequestParam(value = "created_by", required = false) String createdBy,
                               @RequestParam(value = "page", required = false) Integer page,
                               @RequestParam(value = "page_size", required = false) Integer pageSize,
                               @RequestParam(value = "sort_by", required = false) String sortBy,
                               @RequestParam(value = "sort_order", required = false) String sortOrder) {
        HistoryFilter filter = new HistoryFilter();
        filter.setStatus(StringUtils.isBlank(status) ? null : parseStatus(status));
        filter.setCreatedFrom(createdFrom);
        filter.setCreatedTo(createdTo);
        filter.setCreatedBy(createdBy);
        filter.setPage(page);
        filter.setPageSize(pageSize);
        filter.setSortBy(sortBy);
        filter.setSortOrder(sortOrder);
        return jobManager.history(filter);
    }

    @GetMapping("/jobs/{jobId}/validation-results")
    public List<ImportValidationResult> validationResults(@PathVariable String jobId,
                                                          @RequestParam(value = "severity", required = false) String severity) {
        ValidationSeverity filter = null;
        if (StringUtils.isNotBlank(severity)) {
            try {
                filter = ValidationSeverity.fromValue(severity);
            } catch (IllegalArgumentException e) {
                throw new ImportException(ImportErrorCode.INVALID_REQUEST, e.getMessage());
            }
        }
        return jobManager.validationResults(jobId, filter);
    }

    @GetMapping("/jobs/{jobId}/statistics")
    public JobStatisticsSummary jobStatistics(@PathVariable String jobId) {
        return statisticsService.jobStatistics(jobId);
    }

    /**
     * dry-run 校验，不写库
     */
    @PostMapping("/validate")
    public ValidationReport validate(@RequestBody ValidateRequest request) {
        return importService.validate(request);
    }

    @DeleteMapping("/cancel/{jobId}")
    public Map<String, Object> cancel(@PathVariable String jobId) {
        boolean cancelled = jobManager.cancel(jobId);
        return Map.of("job_id", jobId, "cancelled", cancelled);
    }

    @GetMapping("/statistics")
    public StatisticsSummary statistics() {
        return statisticsService.summary();
    }

    @GetMapping("/config")
    public Map<String, Object> config() {
        return importService.defaults();
    }

    @GetMapping("/templates")
    public Map<String, Object> templates() {
        return importService.templates();
    }

    private ImportConfigurationRequest parseConfiguration(String json) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, ImportConfigurationRequest.class);
        } catch (JsonProcessingException e) {
            throw ImportException.invalidConfiguration("configuration is not valid JSON");
        }
    }

    private ImportStatus parseStatus(String status) {
        try {
            return ImportStatus.fromValue(status.trim());
        } catch (IllegalArgumentException e) {
            throw new ImportException(ImportErrorCode.INVALID_REQUEST, e.getMessage());
        }
    }

    // ---------------- 错误处理: 只返回错误码和摘要 ----------------

    @ExceptionHandler(ImportException.class)
    public ResponseEntity<ErrorResponse> handleImportException(ImportException e) {
        if (e.getCode().getHttpStatus().is5xxServerError()) {
            log.error("导入请求失败: {}", e.getMessage(), e);
        } else {
            log.info("导入请求被拒绝: {} {}", e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(e.getCode().getHttpStatus())
                .body(new ErrorResponse(e.getCode().name(), e.getMessage()));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleMaxUploadSize(MaxUploadSizeExceededException e) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(ImportErrorCode.FILE_TOO_LARGE.name(), "File exceeds the upload size limit"));
    }

    @ExceptionHandler({MultipartException.class, MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.info("请求格式错误: {}", e.getMessage());
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(ImportErrorCode.INVALID_REQUEST.name(), "Malformed request"));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException e) {
        log.error("数据库访问失败", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse(ImportErrorCode.STORE_UNAVAILABLE.name(), "Store unavailable"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("未处理的异常", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(ImportErrorCode.INTERNAL_ERROR.name(), "Internal error"));
    }

    public record ErrorResponse(String code, String message) {}
}
