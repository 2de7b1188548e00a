package com.id.swl.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Selects one of the two persisted views of a (source, parameter) series.
 */
public enum SwlSeries {

    /** Points at their original timestamps. */
    RAW,

    /** Points on whole-minute boundaries. */
    MIN1;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SwlSeries fromCode(String code) {
        if (code == null || code.isBlank()) {
            return RAW;
        }
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown series '%s', expected 'raw' or 'min1'".formatted(code));
        }
    }
}
