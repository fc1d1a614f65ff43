package com.lshann.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum HashFamilyType {
    L2,     // p-stable Euclidean buckets
    SRP,    // sign random projections (cosine)
    MIPS;   // asymmetric inner-product transform over L2

    @JsonCreator
    public static HashFamilyType fromJson(String value) {
        if (value == null) return null;
        return HashFamilyType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }
}
