package com.example.kodeposimport.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * postal_codes 表的一行
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostalCode {
    private int code;
    private String village;
    private String district;
    private String regency;
    private String province;
    private Double latitude;
    private Double longitude;
    private Integer elevation;
    private String timezone;
}
