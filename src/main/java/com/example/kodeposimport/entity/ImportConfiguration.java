package com.example.kodeposimport.entity;

import com.example.kodeposimport.enums.DuplicateStrategy;
import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 作业配置，和 ImportJob 一对一，创建后不再修改
 */
@Entity
@Data
@Table(name = "import_configuration")
public class ImportConfiguration {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(length = 36)
    private String id;

    @Column(name = "job_id", nullable = false, unique = true, length = 36)
    private String jobId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private DuplicateStrategy duplicateStrategy;

    private int batchSize;

    private boolean validateCoordinates;

    private boolean skipInvalidRecords;

    private String notificationEmail;

    /**
     * 自定义校验规则 (JSON 对象原样保存)
     */
    @Column(columnDefinition = "TEXT")
    private String customValidationRules;

    private LocalDateTime createdAt;

    @PrePersist void onCreate() { createdAt = LocalDateTime.now(); }
}
