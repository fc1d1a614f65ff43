package com.lshann.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StorageType {
    MEMORY,
    ROCKSDB;

    @JsonCreator
    public static StorageType fromJson(String value) {
        if (value == null) return null;
        return StorageType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }
}
