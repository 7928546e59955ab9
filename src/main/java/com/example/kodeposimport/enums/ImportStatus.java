package com.example.kodeposimport.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * 导入作业状态机
 * PENDING -> PROCESSING -> VALIDATING -> TRANSFORMING -> INSERTING -> COMPLETED
 * 任何非终态都可以转到 FAILED 或 CANCELLED
 */
public enum ImportStatus {
    PENDING,
    PROCESSING,
    VALIDATING,
    TRANSFORMING,
    INSERTING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public static final Set<ImportStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELLED);

    public static final Set<ImportStatus> ACTIVE = EnumSet.of(PENDING, PROCESSING, VALIDATING, TRANSFORMING, INSERTING);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean canTransitionTo(ImportStatus target) {
        if (isTerminal()) {
            return false;
        }
        if (target == FAILED || target == CANCELLED) {
            return true;
        }
        // 正常流程只能前进一步
        return target.ordinal() == this.ordinal() + 1;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    public static ImportStatus fromValue(String value) {
        for (ImportStatus status : values()) {
            if (status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown import status: " + value);
    }
}
