package com.example.kodeposimport.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

public class RecordValuesTest {

    @Test
    @DisplayName("整数值的浮点数不带小数部分")
    void toText_integralDouble() {
        assertEquals("10110", RecordValues.toText(10110.0));
        assertEquals("10110", RecordValues.toText(10110));
        assertEquals("-6.1944", RecordValues.toText(-6.1944));
        assertEquals("10", RecordValues.toText(new BigDecimal("10.00")));
    }

    @Test
    @DisplayName("去首尾空格, 空白视为缺失")
    void toText_trimAndBlank() {
        assertEquals("Menteng", RecordValues.toText("  Menteng \t"));
        assertNull(RecordValues.toText("   "));
        assertNull(RecordValues.toText(null));
    }

    @Test
    void parseInteger() {
        assertEquals(10110L, RecordValues.parseInteger("10110"));
        assertEquals(10110L, RecordValues.parseInteger("10110.0"));
        assertNull(RecordValues.parseInteger("10.5"));
        assertNull(RecordValues.parseInteger("abc"));
        assertNull(RecordValues.parseInteger(null));
    }

    @Test
    void parseDouble() {
        assertEquals(-6.1944, RecordValues.parseDouble("-6.1944"));
        assertNull(RecordValues.parseDouble("north"));
    }
}
