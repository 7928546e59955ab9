package com.example.kodeposimport.exception;

/**
 * 单条记录无法解析成 key/value 结构
 */
public class MalformedRecordException extends RuntimeException {
    public MalformedRecordException(String message) {
        super(message);
    }
}
