package com.example.kodeposimport.dto;

import lombok.Data;

import java.util.Map;

/**
 * 调用方传入的 (部分) 配置，缺失字段使用默认值
 */
@Data
public class ImportConfigurationRequest {
    private String duplicateStrategy;
    private Integer batchSize;
    private Boolean validateCoordinates;
    private Boolean skipInvalidRecords;
    private String notificationEmail;
    private Map<String, Object> customValidationRules;
}
