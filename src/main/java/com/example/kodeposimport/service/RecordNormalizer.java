package com.example.kodeposimport.service;

import com.example.kodeposimport.dto.CanonicalPostalRecord;
import com.example.kodeposimport.enums.ImportContentType;
import com.example.kodeposimport.exception.MalformedRecordException;
import com.example.kodeposimport.util.RecordValues;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 把不同命名习惯的原始记录映射成统一结构 (无副作用)
 */
@Component
public class RecordNormalizer {

    public CanonicalPostalRecord normalize(Object raw, ImportContentType contentType) {
        if (!(raw instanceof Map)) {
            throw new MalformedRecordException(describeMalformed(raw, contentType));
        }

        // 1. key 去空格转小写，重复 key 保留第一个非空值
        Map<String, String> values = new HashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) raw).entrySet()) {
            if (entry.getKey() == null) {
                continue;
            }
            String key = entry.getKey().toString().trim().toLowerCase(Locale.ROOT);
            String value = RecordValues.toText(entry.getValue());
            if (value != null) {
                values.putIfAbsent(key, value);
            }
        }

        // 2. 按别名表取值
        CanonicalPostalRecord record = new CanonicalPostalRecord();
        for (FieldAlias field : FieldAlias.values()) {
            for (String alias : field.getAliases()) {
                String value = values.get(alias);
                if (value != null) {
                    field.apply(record, value);
                    break;
                }
            }
        }
        return record;
    }

    private String describeMalformed(Object raw, ImportContentType contentType) {
        if (raw instanceof String[]) {
            return "CSV row has more values than the header (" + ((String[]) raw).length + " values)";
        }
        if (contentType != null && contentType.isDelimitedText()) {
            return "Row is not a key/value record";
        }
        return "Record is not a JSON object";
    }
}
