package com.example.kodeposimport.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 支持的上传格式
 * application/vnd.ms-excel 是部分浏览器对 .csv 文件上报的类型，内容按 CSV 文本解析
 */
public enum ImportContentType {
    JSON("application/json"),
    CSV("text/csv"),
    LEGACY_SPREADSHEET("application/vnd.ms-excel");

    private final String mimeType;

    ImportContentType(String mimeType) {
        this.mimeType = mimeType;
    }

    @JsonValue
    public String getMimeType() {
        return mimeType;
    }

    public boolean isDelimitedText() {
        return this != JSON;
    }

    /**
     * @param mimeType 上传时声明的类型 (忽略 "; charset=utf-8" 之类的参数)
     * @return 不支持的类型返回 null
     */
    public static ImportContentType fromMimeType(String mimeType) {
        if (mimeType == null) {
            return null;
        }
        String bare = mimeType.split(";")[0].trim().toLowerCase(Locale.ROOT);
        for (ImportContentType type : values()) {
            if (type.mimeType.equals(bare)) {
                return type;
            }
        }
        return null;
    }
}
