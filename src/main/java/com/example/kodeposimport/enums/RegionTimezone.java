package com.example.kodeposimport.enums;

import java.util.List;
import java.util.Locale;

/**
 * 印尼时区，以及数据源里常见的别名
 */
public enum RegionTimezone {
    WIB(List.of("wib", "asia/jakarta", "asia/pontianak", "utc+7")),
    WITA(List.of("wita", "asia/makassar", "utc+8")),
    WIT(List.of("wit", "asia/jayapura", "utc+9"));

    public static final RegionTimezone DEFAULT = WIB;

    private final List<String> aliases;

    RegionTimezone(List<String> aliases) {
        this.aliases = aliases;
    }

    /**
     * @return 无法识别返回 null
     */
    public static RegionTimezone resolve(String value) {
        if (value == null) {
            return null;
        }
        String key = value.trim().toLowerCase(Locale.ROOT);
        for (RegionTimezone zone : values()) {
            if (zone.aliases.contains(key)) {
                return zone;
            }
        }
        return null;
    }
}
