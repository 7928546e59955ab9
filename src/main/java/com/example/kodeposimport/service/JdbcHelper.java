package com.example.kodeposimport.service;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

/**
 * postal_codes 表的 SQL
 */
@Component
public class JdbcHelper {

    public static final String TABLE_NAME = "postal_codes";

    // 写入列 (顺序和 bind 保持一致)
    public static final List<String> COLUMNS = List.of(
            "code", "village", "district", "regency", "province", "latitude", "longitude", "elevation", "timezone");

    /**
     * INSERT INTO postal_codes (code, ...) VALUES (?, ...)
     */
    public String insertSql() {
        return "INSERT INTO " + TABLE_NAME + " (" + String.join(", ", COLUMNS) + ") VALUES ("
                + placeholders(COLUMNS.size()) + ")";
    }

    /**
     * 覆盖所有非主键字段, 最后一个参数是 code
     */
    public String updateSql() {
        StringBuilder sql = new StringBuilder("UPDATE ").append(TABLE_NAME).append(" SET ");
        for (int i = 1; i < COLUMNS.size(); i++) {
            if (i > 1) {
                sql.append(", ");
            }
            sql.append(COLUMNS.get(i)).append(" = ?");
        }
        sql.append(" WHERE code = ?");
        return sql.toString();
    }

    /**
     * SELECT code FROM postal_codes WHERE code IN (?, ?, ...)
     */
    public String existingCodesSql(int codeCount) {
        if (codeCount <= 0) {
            throw new IllegalArgumentException("codeCount must be positive");
        }
        return "SELECT code FROM " + TABLE_NAME + " WHERE code IN (" + placeholders(codeCount) + ")";
    }

    private String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }
}
