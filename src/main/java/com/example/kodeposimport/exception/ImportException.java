package com.example.kodeposimport.exception;

import lombok.Getter;

/**
 * 导入流程的业务异常，message 可以直接返回给调用方
 */
@Getter
public class ImportException extends RuntimeException {

    private final ImportErrorCode code;

    public ImportException(ImportErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ImportException(ImportErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static ImportException fileTooLarge(long size, long limit) {
        return new ImportException(ImportErrorCode.FILE_TOO_LARGE,
                "File size " + size + " bytes exceeds the limit of " + limit + " bytes");
    }

    public static ImportException unsupportedContentType(String contentType) {
        return new ImportException(ImportErrorCode.UNSUPPORTED_CONTENT_TYPE,
                "File type " + contentType + " not allowed");
    }

    public static ImportException malformedPayload(String message) {
        return new ImportException(ImportErrorCode.MALFORMED_PAYLOAD, message);
    }

    public static ImportException invalidConfiguration(String message) {
        return new ImportException(ImportErrorCode.INVALID_CONFIGURATION, message);
    }
}
