package com.example.kodeposimport.service;

import com.example.kodeposimport.dto.ResolvedRecord;
import com.example.kodeposimport.dto.StagedRecord;
import com.example.kodeposimport.enums.DuplicateAction;
import com.example.kodeposimport.enums.DuplicateStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 按邮编判断写入动作
 * 同一作业里先写入的邮编 (包括同一批次里靠前的记录) 视为已存在
 * 不加跨作业锁: 判定之后别的作业抢先写入的情况由 BatchInserter 按约束冲突重新归类
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DuplicateResolver {

    private final PostalCodeStore store;

    public List<ResolvedRecord> resolve(List<StagedRecord> batch, DuplicateStrategy strategy, JobCodeCache cache) {
        cache.resetBatchCounters();

        // 1. 缓存里没有的邮编一次性查库
        Set<Integer> unknown = new LinkedHashSet<>();
        for (StagedRecord record : batch) {
            int code = record.getPostalCode().getCode();
            if (cache.contains(code)) {
                cache.recordHit();
            } else {
                cache.recordMiss();
                unknown.add(code);
            }
        }
        for (Integer code : store.findExistingCodes(unknown)) {
            cache.markPresent(code);
        }

        // 2. 顺序判定，判定为写入的邮编对后面的记录来说已存在
        List<ResolvedRecord> resolved = new ArrayList<>(batch.size());
        for (StagedRecord record : batch) {
            int code = record.getPostalCode().getCode();
            boolean exists = cache.contains(code);
            resolved.add(decide(record, code, exists, strategy));
            cache.markPresent(code);
        }

        if (log.isDebugEnabled()) {
            log.debug("重复判定完成, 批次记录数: {}, 缓存命中: {}, 查库: {}", batch.size(), cache.getBatchHits(), unknown.size());
        }
        return resolved;
    }

    private ResolvedRecord decide(StagedRecord record, int code, boolean exists, DuplicateStrategy strategy) {
        if (!exists) {
            return new ResolvedRecord(record, DuplicateAction.INSERT, null);
        }
        switch (strategy) {
            case UPDATE:
                return new ResolvedRecord(record, DuplicateAction.UPDATE, null);
            case ERROR:
                return new ResolvedRecord(record, DuplicateAction.CONFLICT, conflictReason(code));
            case SKIP:
            default:
                return new ResolvedRecord(record, DuplicateAction.SKIP_DUPLICATE, null);
        }
    }

    public static String conflictReason(int code) {
        return "Duplicate postal code " + code + " already exists";
    }
}
