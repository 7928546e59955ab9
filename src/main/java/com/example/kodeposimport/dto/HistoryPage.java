package com.example.kodeposimport.dto;

import com.example.kodeposimport.entity.ImportJob;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class HistoryPage {
    private List<ImportJob> jobs;
    private long total;
    private int page;
    private int pageSize;
    private int totalPages;
}
