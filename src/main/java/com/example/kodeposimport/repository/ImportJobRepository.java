package com.example.kodeposimport.repository;

import com.example.kodeposimport.entity.ImportJob;
import com.example.kodeposimport.enums.ImportStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 导入作业
 * 状态相关的更新全部是带条件的单条 UPDATE，保证不会把别人写入的终态覆盖掉
 */
@Repository
public interface ImportJobRepository extends JpaRepository<ImportJob, String>, JpaSpecificationExecutor<ImportJob> {

    @Query("SELECT j.status FROM ImportJob j WHERE j.id = :id")
    Optional<ImportStatus> findStatusById(@Param("id") String id);

    /**
     * PENDING -> PROCESSING，同时记录开始时间和执行节点
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ImportJob j SET j.status = :to, j.startedAt = :now, j.updatedAt = :now, j.nodeId = :nodeId " +
            "WHERE j.id = :id AND j.status = :from")
    int start(@Param("id") String id, @Param("from") ImportStatus from, @Param("to") ImportStatus to,
              @Param("nodeId") String nodeId, @Param("now") LocalDateTime now);

    /**
     * 非终态之间的阶段流转
     * @return 1 表示流转成功, 0 表示当前状态已经不是 from (比如被取消了)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ImportJob j SET j.status = :to, j.updatedAt = :now WHERE j.id = :id AND j.status = :from")
    int transition(@Param("id") String id, @Param("from") ImportStatus from, @Param("to") ImportStatus to,
                   @Param("now") LocalDateTime now);

    /**
     * 进入终态 (COMPLETED / FAILED / CANCELLED)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ImportJob j SET j.status = :to, j.errorMessage = :errorMessage, j.completedAt = :now, " +
            "j.updatedAt = :now WHERE j.id = :id AND j.status IN :from")
    int finish(@Param("id") String id, @Param("from") Collection<ImportStatus> from, @Param("to") ImportStatus to,
               @Param("errorMessage") String errorMessage, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ImportJob j SET j.totalRecords = :total, j.updatedAt = :now WHERE j.id = :id")
    int updateTotalRecords(@Param("id") String id, @Param("total") long total, @Param("now") LocalDateTime now);

    /**
     * 只更新计数器，不碰 status
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ImportJob j SET j.processedRecords = :processed, j.successfulRecords = :successful, " +
            "j.failedRecords = :failed, j.duplicateRecords = :duplicate, j.processingTimeMs = :elapsed, " +
            "j.updatedAt = :now WHERE j.id = :id")
    int updateProgress(@Param("id") String id, @Param("processed") long processed,
                       @Param("successful") long successful, @Param("failed") long failed,
                       @Param("duplicate") long duplicate, @Param("elapsed") long elapsedMs,
                       @Param("now") LocalDateTime now);

    /**
     * 批量把一组状态的作业置为失败 (启动清理 / 僵尸作业)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ImportJob j SET j.status = com.example.kodeposimport.enums.ImportStatus.FAILED, " +
            "j.errorMessage = :message, j.completedAt = :now, j.updatedAt = :now WHERE j.id IN :ids AND j.status IN :from")
    int failJobs(@Param("ids") Collection<String> ids, @Param("from") Collection<ImportStatus> from,
                 @Param("message") String message, @Param("now") LocalDateTime now);

    List<ImportJob> findByStatusInAndNodeId(Collection<ImportStatus> statuses, String nodeId);

    List<ImportJob> findByStatusInAndUpdatedAtBefore(Collection<ImportStatus> statuses, LocalDateTime threshold);

    // ---- 统计 ----

    long countByStatus(ImportStatus status);

    long countByStatusIn(Collection<ImportStatus> statuses);

    @Query("SELECT AVG(j.processingTimeMs) FROM ImportJob j " +
            "WHERE j.status = com.example.kodeposimport.enums.ImportStatus.COMPLETED AND j.processingTimeMs > 0")
    Double averageCompletedProcessingTimeMs();

    @Query("SELECT MAX(j.completedAt) FROM ImportJob j " +
            "WHERE j.status = com.example.kodeposimport.enums.ImportStatus.COMPLETED")
    LocalDateTime lastCompletedAt();

    @Query("SELECT COALESCE(SUM(j.successfulRecords), 0) FROM ImportJob j")
    long sumSuccessfulRecords();
}
