package com.example.kodeposimport.exception;

/**
 * 基础设施级错误 (库不可达、超时)，会让整个作业失败
 * message 是可以写进 error_message 的摘要，原始 SQLException 放在 cause 里
 */
public class StoreUnavailableException extends ImportException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(ImportErrorCode.STORE_UNAVAILABLE, message, cause);
    }
}
