package com.example.kodeposimport.service.impl;

import com.example.kodeposimport.dto.SourceRecord;
import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import lombok.extern.slf4j.Slf4j;

import java.io.Reader;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * 逐行读取带表头的 CSV，每行转成 header -> value
 * 列数多于表头的行原样返回 String[]，交给 normalizer 判定为畸形记录
 */
@Slf4j
public class CsvRecordIterator implements Iterator<SourceRecord>, AutoCloseable {
    private final Reader reader;
    private final CsvParser parser;
    private final String[] headers;
    private String[] nextRow;
    // 数据行序号 (不含表头，从1开始)
    private long rowNumber = 0;

    public CsvRecordIterator(Reader reader, CsvParserSettings settings) {
        this.reader = reader;
        this.parser = new CsvParser(settings);
        this.parser.beginParsing(reader);
        this.nextRow = parser.parseNext(); // 预读，同时完成表头解析
        this.headers = parser.getContext().headers();
        if (log.isDebugEnabled()) {
            log.debug("CSV headers: {}", headers == null ? null : String.join(",", headers));
        }
    }

    public String[] getHeaders() {
        return headers;
    }

    @Override
    public boolean hasNext() {
        return nextRow != null;
    }

    @Override
    public SourceRecord next() {
        if (nextRow == null) {
            throw new NoSuchElementException();
        }
        String[] current = nextRow;
        nextRow = parser.parseNext(); // 预读下一行
        rowNumber++;
        return new SourceRecord(rowNumber, convertRow(current));
    }

    private Object convertRow(String[] row) {
        if (row.length > headers.length) {
            return row;
        }
        Map<String, Object> record = new LinkedHashMap<>();
        for (int i = 0; i < headers.length; i++) {
            record.put(headers[i], i < row.length ? row[i] : null);
        }
        return record;
    }

    @Override
    public void close() {
        parser.stopParsing();
        try {
            reader.close();
        } catch (Exception e) {
            log.warn("关闭 CSV reader 失败", e);
        }
    }
}
