package com.example.kodeposimport.entity;

import com.example.kodeposimport.enums.ProcessingPhase;
import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 每个装载批次一行
 */
@Entity
@Data
@Table(name = "import_statistics", indexes = {
        @Index(name = "idx_istat_job_id", columnList = "job_id"),
        @Index(name = "idx_istat_phase", columnList = "processing_phase")
})
public class ImportStatistics {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(length = 36)
    private String id;

    @Column(name = "job_id", nullable = false, length = 36)
    private String jobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_phase", nullable = false, length = 20)
    private ProcessingPhase processingPhase;

    @Column(nullable = false, length = 50)
    private String operationType;

    private long recordsCount;

    private long executionTimeMs;

    private Long memoryUsageKb;

    private long cacheHits;
    private long cacheMisses;

    private LocalDateTime createdAt;

    @PrePersist void onCreate() { if (createdAt == null) createdAt = LocalDateTime.now(); }
}
