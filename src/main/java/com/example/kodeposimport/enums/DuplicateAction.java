package com.example.kodeposimport.enums;

/**
 * 重复判定后的写入动作
 */
public enum DuplicateAction {
    INSERT,
    UPDATE,
    SKIP_DUPLICATE,
    CONFLICT // 策略为 error 且邮编已存在
}
