package com.chanakya.littleyears.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MomentType {
    PHOTO,
    ART,
    AUDIO,
    VIDEO,
    NOTE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses the stored or wire form, accepting either case.
     */
    public static MomentType fromWireName(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
