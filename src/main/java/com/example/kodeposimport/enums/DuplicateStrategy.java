package com.example.kodeposimport.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 邮编已存在时的处理策略
 */
public enum DuplicateStrategy {
    SKIP,   // 记为重复，不写入
    UPDATE, // 覆盖所有非主键字段
    ERROR;  // 记为失败记录

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    /**
     * @return 未知策略返回 null
     */
    public static DuplicateStrategy fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (DuplicateStrategy strategy : values()) {
            if (strategy.name().equalsIgnoreCase(value.trim())) {
                return strategy;
            }
        }
        return null;
    }
}
