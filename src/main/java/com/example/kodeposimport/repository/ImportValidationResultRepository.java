package com.example.kodeposimport.repository;

import com.example.kodeposimport.entity.ImportValidationResult;
import com.example.kodeposimport.enums.ValidationSeverity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface ImportValidationResultRepository extends JpaRepository<ImportValidationResult, String> {

    List<ImportValidationResult> findByJobIdOrderByRowNumberAsc(String jobId);

    List<ImportValidationResult> findByJobIdAndSeverityOrderByRowNumberAsc(String jobId, ValidationSeverity severity);

    long countByJobIdAndSeverity(String jobId, ValidationSeverity severity);

    /**
     * 清理过期的校验结果
     * 用途: ImportMaintenanceScheduler
     */
    @Modifying
    @Query("DELETE FROM ImportValidationResult r WHERE r.createdAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") LocalDateTime cutoff);
}
