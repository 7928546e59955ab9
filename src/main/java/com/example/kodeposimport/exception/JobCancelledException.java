package com.example.kodeposimport.exception;

/**
 * 专用于"作业被取消"的控制流异常，在批次边界抛出
 */
public class JobCancelledException extends RuntimeException {
    public JobCancelledException(String message) {
        super(message);
    }
}
