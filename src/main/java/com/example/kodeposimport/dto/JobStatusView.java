package com.example.kodeposimport.dto;

import com.example.kodeposimport.entity.ImportConfiguration;
import com.example.kodeposimport.entity.ImportJob;
import lombok.Data;

@Data
public class JobStatusView {
    private ImportJob job;
    private ImportConfiguration configuration;
    private double progressPercentage;
    // processed 为 0 时无法估算，返回 null
    private Long estimatedRemainingTimeMs;
}
