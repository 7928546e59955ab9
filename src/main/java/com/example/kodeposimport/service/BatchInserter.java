package com.example.kodeposimport.service;

import com.example.kodeposimport.dto.BatchResult;
import com.example.kodeposimport.dto.PostalCode;
import com.example.kodeposimport.dto.RecordFailure;
import com.example.kodeposimport.dto.ResolvedRecord;
import com.example.kodeposimport.entity.ImportStatistics;
import com.example.kodeposimport.enums.DuplicateStrategy;
import com.example.kodeposimport.enums.ProcessingPhase;
import com.example.kodeposimport.enums.RecordOutcome;
import com.example.kodeposimport.repository.ImportStatisticsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.List;

/**
 * 一个批次 = 一个连接 + 一个事务，每条记录一个 savepoint
 *   1. 约束冲突是数据级错误，只回滚到该记录的 savepoint，按策略重新归类
 *   2. 其它 SQLException (含超时) 回滚整个批次，抛 StoreUnavailableException
 *   3. 成功提交后写一行 import_statistics
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BatchInserter {

    public static final String OPERATION_TYPE = "batch-insert";

    private final PostalCodeStore store;
    private final ImportStatisticsRepository statisticsRepo;

    /**
     * @param stopOnFailure 遇到第一条失败记录就停止 (skip_invalid_records=false)，已处理的记录照常提交
     */
    public BatchResult insert(String jobId, int batchNumber, DuplicateStrategy strategy,
                              List<ResolvedRecord> records, boolean stopOnFailure, JobCodeCache cache) {
        long start = System.currentTimeMillis();
        BatchResult result = new BatchResult(batchNumber);

        try (Connection conn = store.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                for (ResolvedRecord record : records) {
                    if (stopOnFailure && result.hasFailures()) {
                        break;
                    }
                    RecordOutcome outcome = write(conn, record, strategy, result);
                    count(result, outcome);
                }
                conn.commit();
            } catch (SQLException e) {
                rollbackQuietly(conn);
                log.error("批次写入失败, 作业: {}, 批次: {}", jobId, batchNumber, e);
                throw store.unavailable(e);
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            log.error("获取连接失败, 作业: {}, 批次: {}", jobId, batchNumber, e);
            throw store.unavailable(e);
        }

        result.setExecutionTimeMs(System.currentTimeMillis() - start);
        result.setCacheHits(cache.getBatchHits());
        result.setCacheMisses(cache.getBatchMisses());
        saveStatistics(jobId, result);

        log.info("作业[{}] 批次 {} 完成: 处理 {}, 新增 {}, 更新 {}, 重复 {}, 失败 {}, 耗时 {} ms",
                jobId, batchNumber, result.getProcessed(), result.getInserted(), result.getUpdated(),
                result.getSkippedDuplicates(), result.getFailed(), result.getExecutionTimeMs());
        return result;
    }

    private RecordOutcome write(Connection conn, ResolvedRecord record, DuplicateStrategy strategy,
                                BatchResult result) throws SQLException {
        PostalCode postalCode = record.getRecord().getPostalCode();
        switch (record.getAction()) {
            case SKIP_DUPLICATE:
                return RecordOutcome.SKIPPED_DUPLICATE;
            case CONFLICT:
                addFailure(result, record, record.getReason());
                return RecordOutcome.FAILED;
            case UPDATE:
                if (store.update(conn, postalCode) > 0) {
                    return RecordOutcome.UPDATED;
                }
                // 判定之后被删掉了，按新增处理
                return insertWithSavepoint(conn, record, strategy, result);
            case INSERT:
            default:
                return insertWithSavepoint(conn, record, strategy, result);
        }
    }

    private RecordOutcome insertWithSavepoint(Connection conn, ResolvedRecord record, DuplicateStrategy strategy,
                                              BatchResult result) throws SQLException {
        PostalCode postalCode = record.getRecord().getPostalCode();
        Savepoint savepoint = conn.setSavepoint();
        try {
            store.insert(conn, postalCode);
            return RecordOutcome.INSERTED;
        } catch (SQLException e) {
            if (!store.isIntegrityViolation(e)) {
                throw e;
            }
            conn.rollback(savepoint);
            if (!store.isUniqueViolation(e)) {
                log.warn("邮编 {} 写入被约束拒绝: {}", postalCode.getCode(), e.getMessage());
                addFailure(result, record, PostalCodeStore.CONSTRAINT_MESSAGE);
                return RecordOutcome.FAILED;
            }
            // 并发作业抢先写入了同一个邮编
            log.warn("邮编 {} 写入时发生唯一约束冲突，按 {} 策略重新归类", postalCode.getCode(), strategy.value());
            switch (strategy) {
                case UPDATE:
                    store.update(conn, postalCode);
                    return RecordOutcome.UPDATED;
                case ERROR:
                    addFailure(result, record, DuplicateResolver.conflictReason(postalCode.getCode()));
                    return RecordOutcome.FAILED;
                case SKIP:
                default:
                    return RecordOutcome.SKIPPED_DUPLICATE;
            }
        }
    }

    private void count(BatchResult result, RecordOutcome outcome) {
        result.setProcessed(result.getProcessed() + 1);
        switch (outcome) {
            case INSERTED:
                result.setInserted(result.getInserted() + 1);
                break;
            case UPDATED:
                result.setUpdated(result.getUpdated() + 1);
                break;
            case SKIPPED_DUPLICATE:
                result.setSkippedDuplicates(result.getSkippedDuplicates() + 1);
                break;
            case FAILED:
                result.setFailed(result.getFailed() + 1);
                break;
        }
    }

    private void addFailure(BatchResult result, ResolvedRecord record, String reason) {
        result.getFailures().add(new RecordFailure(record.getRecord().getRowNumber(),
                record.getRecord().getRecordData(), List.of(reason)));
    }

    private void saveStatistics(String jobId, BatchResult result) {
        Runtime runtime = Runtime.getRuntime();
        ImportStatistics stats = new ImportStatistics();
        stats.setJobId(jobId);
        stats.setProcessingPhase(ProcessingPhase.INSERTION);
        stats.setOperationType(OPERATION_TYPE);
        stats.setRecordsCount(result.getProcessed());
        stats.setExecutionTimeMs(result.getExecutionTimeMs());
        stats.setMemoryUsageKb((runtime.totalMemory() - runtime.freeMemory()) / 1024);
        stats.setCacheHits(result.getCacheHits());
        stats.setCacheMisses(result.getCacheMisses());
        statisticsRepo.save(stats);
    }

    private void rollbackQuietly(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.warn("批次回滚失败", e);
        }
    }
}
