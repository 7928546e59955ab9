package com.example.kodeposimport.service;

import com.example.kodeposimport.dto.CanonicalPostalRecord;

import java.util.List;
import java.util.function.BiConsumer;

/**
 * 历史数据源里的字段名 -> 标准字段
 * 同一字段有多个别名时，按列表顺序取第一个非空值
 */
public enum FieldAlias {
    CODE(List.of("code", "kodepos", "postal_code", "postalcode", "kode_pos"), CanonicalPostalRecord::setCode),
    VILLAGE(List.of("village", "kelurahan", "desa"), CanonicalPostalRecord::setVillage),
    DISTRICT(List.of("district", "kecamatan"), CanonicalPostalRecord::setDistrict),
    REGENCY(List.of("regency", "city", "kota", "kabupaten"), CanonicalPostalRecord::setRegency),
    PROVINCE(List.of("province", "provinsi"), CanonicalPostalRecord::setProvince),
    LATITUDE(List.of("latitude", "lat"), CanonicalPostalRecord::setLatitude),
    LONGITUDE(List.of("longitude", "lng", "lon", "long"), CanonicalPostalRecord::setLongitude),
    ELEVATION(List.of("elevation", "altitude"), CanonicalPostalRecord::setElevation),
    TIMEZONE(List.of("timezone", "tz"), CanonicalPostalRecord::setTimezone);

    // 全部小写
    private final List<String> aliases;
    private final BiConsumer<CanonicalPostalRecord, String> setter;

    FieldAlias(List<String> aliases, BiConsumer<CanonicalPostalRecord, String> setter) {
        this.aliases = aliases;
        this.setter = setter;
    }

    public List<String> getAliases() {
        return aliases;
    }

    public String canonicalName() {
        return aliases.get(0);
    }

    void apply(CanonicalPostalRecord record, String value) {
        setter.accept(record, value);
    }
}
