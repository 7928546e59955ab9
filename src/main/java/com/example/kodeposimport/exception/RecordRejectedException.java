package com.example.kodeposimport.exception;

/**
 * skip_invalid_records=false 时，第一条数据错误终止整个作业
 */
public class RecordRejectedException extends RuntimeException {
    public RecordRejectedException(String message) {
        super(message);
    }
}
