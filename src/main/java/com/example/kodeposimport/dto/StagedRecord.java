package com.example.kodeposimport.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 转换完成、等待写入的记录，带着行号和原始记录以便记录错误
 */
@Data
@AllArgsConstructor
public class StagedRecord {
    private long rowNumber;
    private String recordData;
    private PostalCode postalCode;
}
