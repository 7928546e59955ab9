package com.example.kodeposimport.entity;

import com.example.kodeposimport.enums.ValidationSeverity;
import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 单条记录的校验结果 (只保存有问题的记录)
 */
@Entity
@Data
@Table(name = "import_validation_results", indexes = {
        @Index(name = "idx_ivr_job_id", columnList = "job_id"),
        @Index(name = "idx_ivr_severity", columnList = "severity")
})
public class ImportValidationResult {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(length = 36)
    private String id;

    @Column(name = "job_id", nullable = false, length = 36)
    private String jobId;

    /**
     * 原始输入中的位置 (从1开始)
     */
    @Column(name = "`row_number`", nullable = false) // MySQL 8 保留字，需要转义
    private long rowNumber;

    /**
     * 原始记录 (JSON)
     */
    @Column(columnDefinition = "TEXT", nullable = false)
    private String recordData;

    /**
     * 错误原因 (JSON 数组，按规则顺序)
     */
    @Column(columnDefinition = "TEXT", nullable = false)
    private String validationErrors;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private ValidationSeverity severity;

    private LocalDateTime createdAt;

    @PrePersist void onCreate() { if (createdAt == null) createdAt = LocalDateTime.now(); }
}
