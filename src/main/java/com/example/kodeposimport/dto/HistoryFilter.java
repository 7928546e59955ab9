package com.example.kodeposimport.dto;

import com.example.kodeposimport.enums.ImportStatus;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 历史查询条件，空字段表示不过滤
 */
@Data
public class HistoryFilter {
    private ImportStatus status;
    private LocalDateTime createdFrom;
    private LocalDateTime createdTo;
    private String createdBy;
    // 从 1 开始
    private Integer page;
    private Integer pageSize;
    // created_at | completed_at | processing_time_ms
    private String sortBy;
    // asc | desc
    private String sortOrder;
}
