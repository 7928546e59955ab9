package com.example.kodeposimport.exception;

import org.springframework.http.HttpStatus;

/**
 * 对外暴露的错误码 (稳定，不含内部细节)
 */
public enum ImportErrorCode {
    FILE_TOO_LARGE(HttpStatus.BAD_REQUEST),
    UNSUPPORTED_CONTENT_TYPE(HttpStatus.BAD_REQUEST),
    MALFORMED_PAYLOAD(HttpStatus.BAD_REQUEST),
    INVALID_CONFIGURATION(HttpStatus.BAD_REQUEST),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST),
    JOB_NOT_FOUND(HttpStatus.NOT_FOUND),
    JOB_NOT_RUNNABLE(HttpStatus.CONFLICT),
    STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;

    ImportErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
