package com.chanakya.littleyears.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Visibility {
    PUBLIC,  // Anyone who can see the kid
    PRIVATE; // Only grandparents on the kid's allowed list

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses the stored or wire form, accepting either case.
     */
    public static Visibility fromWireName(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
