package com.example.kodeposimport.service;

import com.example.kodeposimport.config.AppProperties;
import com.example.kodeposimport.dto.CanonicalPostalRecord;
import com.example.kodeposimport.dto.ValidationIssue;
import com.example.kodeposimport.dto.ValidationOptions;
import com.example.kodeposimport.enums.RegionTimezone;
import com.example.kodeposimport.util.RecordValues;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 单条记录校验
 * 所有规则都会执行 (不短路)，问题按规则顺序返回；没有 ERROR 级别的问题即为有效
 */
@Component
@RequiredArgsConstructor
public class RecordValidator {

    private final AppProperties config;

    public List<ValidationIssue> validate(CanonicalPostalRecord record, ValidationOptions options) {
        AppProperties.Region region = config.getRegion();
        List<ValidationIssue> issues = new ArrayList<>();

        // 1. 邮编
        validateCode(record.getCode(), region, issues);

        // 2. 必填的行政区划
        requireText("village", record.getVillage(), issues);
        requireText("district", record.getDistrict(), issues);
        requireText("regency", record.getRegency(), issues);
        requireText("province", record.getProvince(), issues);

        // 3. 坐标
        if (options.isValidateCoordinates()) {
            validateCoordinate("latitude", record.getLatitude(), region.getMinLatitude(), region.getMaxLatitude(), issues);
            validateCoordinate("longitude", record.getLongitude(), region.getMinLongitude(), region.getMaxLongitude(), issues);
        }

        // 4. 时区 (缺省不算错，写入时默认 WIB)
        if (record.getTimezone() != null && RegionTimezone.resolve(record.getTimezone()) == null) {
            issues.add(ValidationIssue.error("timezone",
                    "Unknown timezone: " + record.getTimezone() + " (expected WIB, WITA or WIT)"));
        }

        // 5. 海拔只是警告，非整数写入时丢弃
        if (record.getElevation() != null && RecordValues.parseInteger(record.getElevation()) == null) {
            issues.add(ValidationIssue.warning("elevation", "Elevation must be a whole number, value ignored"));
        }

        // 6. 超长文本写入时截断
        checkLength("village", record.getVillage(), region.getTextMaxLength(), issues);
        checkLength("district", record.getDistrict(), region.getTextMaxLength(), issues);
        checkLength("regency", record.getRegency(), region.getTextMaxLength(), issues);
        checkLength("province", record.getProvince(), region.getProvinceMaxLength(), issues);

        return issues;
    }

    public static boolean isValid(List<ValidationIssue> issues) {
        return issues.stream().noneMatch(ValidationIssue::isError);
    }

    private void validateCode(String code, AppProperties.Region region, List<ValidationIssue> issues) {
        if (code == null) {
            issues.add(ValidationIssue.error("code", "Missing required field: code"));
            return;
        }
        Long value = RecordValues.parseInteger(code);
        if (value == null) {
            issues.add(ValidationIssue.error("code", "Postal code must be an integer: " + code));
        } else if (value < region.getMinCode() || value > region.getMaxCode()) {
            issues.add(ValidationIssue.error("code", "Postal code " + code + " is outside the valid range "
                    + region.getMinCode() + "-" + region.getMaxCode()));
        }
    }

    private void requireText(String field, String value, List<ValidationIssue> issues) {
        if (value == null || value.isBlank()) {
            issues.add(ValidationIssue.error(field, "Missing required field: " + field));
        }
    }

    private void validateCoordinate(String field, String value, double min, double max, List<ValidationIssue> issues) {
        if (value == null) {
            issues.add(ValidationIssue.error(field, "Missing required field: " + field));
            return;
        }
        Double number = RecordValues.parseDouble(value);
        if (number == null) {
            issues.add(ValidationIssue.error(field, "Field " + field + " must be a valid number: " + value));
        } else if (number < min || number > max) {
            issues.add(ValidationIssue.error(field, "Field " + field + " " + value
                    + " is outside the service region (" + min + " to " + max + ")"));
        }
    }

    private void checkLength(String field, String value, int maxLength, List<ValidationIssue> issues) {
        if (value != null && value.length() > maxLength) {
            issues.add(ValidationIssue.warning(field,
                    "Field " + field + " exceeds " + maxLength + " characters and will be truncated"));
        }
    }
}
