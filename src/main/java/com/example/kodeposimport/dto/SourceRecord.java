package com.example.kodeposimport.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 解析后的原始记录
 * raw: 正常情况是 Map；CSV 列数多于表头时是 String[]；JSON 数组里的非对象元素原样保留
 */
@Data
@AllArgsConstructor
public class SourceRecord {
    // 原始输入中的位置 (从1开始)
    private long rowNumber;
    private Object raw;
}
