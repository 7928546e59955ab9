package com.example.kodeposimport.util;

import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;

/**
 * 记录字段的文本/数值转换
 */
public final class RecordValues {

    private RecordValues() {
    }

    /**
     * 任意值转成去掉首尾空格的文本，空白视为缺失
     * 整数值的浮点数不带小数部分 (10110.0 -> "10110")
     */
    public static String toText(Object value) {
        if (value == null) {
            return null;
        }
        String text;
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (!Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
                text = String.valueOf((long) d);
            } else {
                text = String.valueOf(d);
            }
        } else if (value instanceof BigDecimal) {
            text = ((BigDecimal) value).stripTrailingZeros().toPlainString();
        } else {
            text = String.valueOf(value);
        }
        return StringUtils.trimToNull(text);
    }

    /**
     * @return 不是数字返回 null
     */
    public static BigDecimal parseDecimal(String text) {
        if (StringUtils.isBlank(text)) {
            return null;
        }
        try {
            return new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * "10110" 和 "10110.0" 都是整数, "10.5" 和 "abc" 不是
     * @return 不是整数返回 null
     */
    public static Long parseInteger(String text) {
        BigDecimal decimal = parseDecimal(text);
        if (decimal == null) {
            return null;
        }
        try {
            return decimal.stripTrailingZeros().longValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }

    public static Double parseDouble(String text) {
        BigDecimal decimal = parseDecimal(text);
        return decimal == null ? null : decimal.doubleValue();
    }
}
