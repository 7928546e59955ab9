package com.example.kodeposimport.service;

import com.example.kodeposimport.config.AppProperties;
import com.example.kodeposimport.dto.SourceRecord;
import com.example.kodeposimport.enums.ImportContentType;
import com.example.kodeposimport.exception.ImportException;
import com.example.kodeposimport.service.impl.CsvRecordIterator;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.univocity.parsers.common.TextParsingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把上传的文本拆成带行号的原始记录
 * 整个文件无法解析 (不是合法 JSON、CSV 没有表头/数据行) 抛 MALFORMED_PAYLOAD
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ImportPayloadParser {

    private static final char BOM = '\uFEFF';

    private final AppProperties config;

    public List<SourceRecord> parse(String content, ImportContentType contentType) {
        if (StringUtils.isBlank(content)) {
            throw ImportException.malformedPayload("File is empty");
        }
        String text = content.charAt(0) == BOM ? content.substring(1) : content;
        List<SourceRecord> records = contentType.isDelimitedText() ? parseCsv(text) : parseJson(text);
        log.debug("解析完成, 类型: {}, 记录数: {}", contentType, records.size());
        return records;
    }

    // ---------------- JSON ----------------

    private List<SourceRecord> parseJson(String text) {
        JsonElement root;
        try {
            root = JsonParser.parseString(text);
        } catch (JsonParseException e) {
            log.debug("JSON 解析失败", e);
            throw ImportException.malformedPayload("Invalid JSON payload");
        }

        List<SourceRecord> records = new ArrayList<>();
        if (root.isJsonArray()) {
            long rowNumber = 0;
            for (JsonElement element : root.getAsJsonArray()) {
                records.add(new SourceRecord(++rowNumber, toRaw(element)));
            }
        } else if (root.isJsonObject()) {
            records.add(new SourceRecord(1, toRaw(root)));
        } else {
            throw ImportException.malformedPayload("JSON payload must be an object or an array of objects");
        }

        if (records.isEmpty()) {
            throw ImportException.malformedPayload("JSON file contains no records");
        }
        return records;
    }

    /**
     * 对象转成 Map (数字保持原文，避免 10110 变成 10110.0)；其它元素原样返回
     */
    private Object toRaw(JsonElement element) {
        if (!element.isJsonObject()) {
            return element.toString();
        }
        JsonObject object = element.getAsJsonObject();
        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
            JsonElement value = entry.getValue();
            if (value == null || value.isJsonNull()) {
                map.put(entry.getKey(), null);
            } else if (value.isJsonPrimitive()) {
                map.put(entry.getKey(), value.getAsString());
            } else {
                map.put(entry.getKey(), value.toString());
            }
        }
        return map;
    }

    // ---------------- CSV ----------------

    private List<SourceRecord> parseCsv(String text) {
        List<SourceRecord> records = new ArrayList<>();
        try (CsvRecordIterator iterator = new CsvRecordIterator(new StringReader(text), config.getCsv().toParserSettings())) {
            if (iterator.getHeaders() == null || iterator.getHeaders().length == 0) {
                throw ImportException.malformedPayload("CSV file has no header row");
            }
            while (iterator.hasNext()) {
                records.add(iterator.next());
            }
        } catch (TextParsingException e) {
            log.debug("CSV 解析失败", e);
            throw ImportException.malformedPayload("Invalid CSV payload near line " + (e.getLineIndex() + 1));
        }

        if (records.isEmpty()) {
            throw ImportException.malformedPayload("CSV file contains no data rows");
        }
        return records;
    }
}
