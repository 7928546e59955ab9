package com.example.kodeposimport.dto;

import lombok.Data;

import java.util.List;

/**
 * dry-run 校验请求
 */
@Data
public class ValidateRequest {
    private List<Object> data;
    private ImportConfigurationRequest configuration;
}
