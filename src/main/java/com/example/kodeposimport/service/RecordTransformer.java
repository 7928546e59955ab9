package com.example.kodeposimport.service;

import com.example.kodeposimport.config.AppProperties;
import com.example.kodeposimport.dto.CanonicalPostalRecord;
import com.example.kodeposimport.dto.PostalCode;
import com.example.kodeposimport.enums.RegionTimezone;
import com.example.kodeposimport.util.RecordValues;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * 校验通过的记录 -> postal_codes 行
 * 不做业务校验，只做类型转换；转换不了抛 IllegalArgumentException
 */
@Component
@RequiredArgsConstructor
public class RecordTransformer {

    private final AppProperties config;

    public PostalCode transform(CanonicalPostalRecord record) {
        AppProperties.Region region = config.getRegion();

        Long code = RecordValues.parseInteger(record.getCode());
        if (code == null) {
            throw new IllegalArgumentException("Postal code is not an integer: " + record.getCode());
        }

        RegionTimezone timezone = record.getTimezone() == null
                ? RegionTimezone.DEFAULT : RegionTimezone.resolve(record.getTimezone());
        if (timezone == null) {
            throw new IllegalArgumentException("Unknown timezone: " + record.getTimezone());
        }

        Long elevation = RecordValues.parseInteger(record.getElevation());

        return PostalCode.builder()
                .code(code.intValue())
                .village(StringUtils.truncate(record.getVillage(), region.getTextMaxLength()))
                .district(StringUtils.truncate(record.getDistrict(), region.getTextMaxLength()))
                .regency(StringUtils.truncate(record.getRegency(), region.getTextMaxLength()))
                .province(StringUtils.truncate(record.getProvince(), region.getProvinceMaxLength()))
                .latitude(coordinate("latitude", record.getLatitude()))
                .longitude(coordinate("longitude", record.getLongitude()))
                .elevation(elevation == null || Math.abs(elevation) > Integer.MAX_VALUE ? null : elevation.intValue())
                .timezone(timezone.name())
                .build();
    }

    // 关闭坐标校验时坐标可以缺失，但给了就必须是数字
    private Double coordinate(String field, String value) {
        if (value == null) {
            return null;
        }
        Double number = RecordValues.parseDouble(value);
        if (number == null) {
            throw new IllegalArgumentException("Field " + field + " is not a number: " + value);
        }
        return number;
    }
}
