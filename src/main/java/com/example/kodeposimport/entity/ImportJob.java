package com.example.kodeposimport.entity;

import com.example.kodeposimport.enums.ImportContentType;
import com.example.kodeposimport.enums.ImportStatus;
import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 一次导入 (对应一个上传的文件)
 *   1. 作业行是进度的唯一来源，每个批次结束都会更新
 *   2. 终态作业保留作审计，不删除
 */
@Entity
@Data
@Table(name = "import_jobs", indexes = {
        @Index(name = "idx_import_jobs_status", columnList = "status"),
        @Index(name = "idx_import_jobs_created_at", columnList = "created_at"),
        @Index(name = "idx_import_jobs_filename", columnList = "filename")
})
public class ImportJob {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(length = 36)
    private String id;

    @Column(nullable = false)
    private String filename;

    /**
     * 文件大小 (字节)
     */
    @Column(name = "file_size", nullable = false)
    private Long fileSize;

    @Enumerated(EnumType.STRING)
    @Column(name = "content_type", nullable = false, length = 30)
    private ImportContentType contentType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ImportStatus status;

    private long totalRecords;
    private long processedRecords;
    private long successfulRecords;
    private long failedRecords;
    private long duplicateRecords;

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    private long processingTimeMs;

    /**
     * 只在终态失败时设置
     */
    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    private String createdBy;

    /**
     * 执行该作业的节点 (启动时写入)
     */
    @Column(name = "node_id", length = 50)
    private String nodeId;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    @PrePersist void onCreate() {
        if (createdAt == null) createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }
    @PreUpdate void onUpdate() { updatedAt = LocalDateTime.now(); }
}
