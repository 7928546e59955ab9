package com.example.kodeposimport.dto;

import com.example.kodeposimport.enums.DuplicateAction;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ResolvedRecord {
    private StagedRecord record;
    private DuplicateAction action;
    // 只有 CONFLICT 才有
    private String reason;

    public int getCode() {
        return record.getPostalCode().getCode();
    }
}
