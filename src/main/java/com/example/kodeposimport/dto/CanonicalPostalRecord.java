package com.example.kodeposimport.dto;

import lombok.Data;

/**
 * 归一化后的记录，值都是去掉首尾空格的文本，缺失为 null
 * 类型转换在校验通过之后由 RecordTransformer 完成
 */
@Data
public class CanonicalPostalRecord {
    private String code;
    private String village;
    private String district;
    private String regency;
    private String province;
    private String latitude;
    private String longitude;
    private String elevation;
    private String timezone;
}
