package com.example.kodeposimport.enums;

/**
 * 单条记录的写入结果 (由 BatchInserter 汇报)
 */
public enum RecordOutcome {
    INSERTED,
    UPDATED,
    SKIPPED_DUPLICATE,
    FAILED
}
