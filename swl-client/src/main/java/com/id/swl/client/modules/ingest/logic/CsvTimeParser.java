package com.id.swl.client.modules.ingest.logic;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses the {@code yyyy-MM-dd HH:mm:ss[.fraction]} timestamps of measurement CSV exports.
 * Times are UTC; the fraction is padded or truncated to microseconds.
 */
public final class CsvTimeParser {

    private static final DateTimeFormatter BASE_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss", Locale.US);
    private static final int MICRO_DIGITS = 6;

    private CsvTimeParser() {
    }

    public static Optional<Instant> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }

        String basePart = trimmed;
        long micros = 0;
        int dot = trimmed.indexOf('.');
        if (dot >= 0) {
            basePart = trimmed.substring(0, dot);
            Optional<Long> fraction = parseFraction(trimmed.substring(dot + 1));
            if (fraction.isEmpty()) {
                return Optional.empty();
            }
            micros = fraction.get();
        }

        try {
            LocalDateTime ldt = LocalDateTime.parse(basePart, BASE_FORMAT);
            return Optional.of(ldt.toInstant(ZoneOffset.UTC).plusNanos(micros * 1_000L));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    // Only the first whitespace-delimited token counts as the fraction
    private static Optional<Long> parseFraction(String tail) {
        String digits = tail.strip().split("\\s+", 2)[0];
        if (digits.isEmpty() || !digits.chars().allMatch(c -> c >= '0' && c <= '9')) {
            return Optional.empty();
        }
        String padded = (digits + "000000").substring(0, MICRO_DIGITS);
        return Optional.of(Long.parseLong(padded));
    }
}
