package com.id.swl.client.modules.ingest.logic;

import com.id.swl.model.SwlMeasurement;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Streams measurements out of a two-column CSV: a {@code Time} column and one value column,
 * in any order. Rows whose time or value is empty or unparsable are skipped.
 */
@Slf4j
public class CsvMeasurementReader implements Closeable {

    public static final String TIME_COLUMN = "Time";

    private final BufferedReader reader;
    private final String source;
    private final String parameter;
    private final int timeIdx;
    private final int valueIdx;
    @Getter
    private final String valueColumn;
    @Getter
    private long skippedRows;

    private CsvMeasurementReader(BufferedReader reader, List<String> headers, String source, String parameter) {
        this.reader = reader;
        this.source = source;
        this.parameter = parameter;
        this.timeIdx = headers.indexOf(TIME_COLUMN);
        this.valueIdx = timeIdx == 0 ? 1 : 0;
        this.valueColumn = headers.get(valueIdx);
    }

    /**
     * Opens the file and validates its header.
     *
     * @throws IllegalArgumentException when the header has no {@code Time} column or not exactly one other column
     */
    public static CsvMeasurementReader open(Path file, String source, String parameter) throws IOException {
        BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
        try {
            String headerLine = stripBom(reader.readLine());
            List<String> headers = headerLine == null ? List.of() : parseCsvLine(headerLine);
            if (!headers.contains(TIME_COLUMN) || headers.size() != 2) {
                throw new IllegalArgumentException("CSV header unexpected, expected '%s' plus one value column, got %s"
                        .formatted(TIME_COLUMN, headers));
            }
            return new CsvMeasurementReader(reader, headers, source, parameter);
        } catch (IOException | RuntimeException e) {
            reader.close();
            throw e;
        }
    }

    /**
     * Reads up to {@code size} well-formed rows.
     *
     * @return The next rows, empty once the file is exhausted
     */
    public List<SwlMeasurement> nextBatch(int size) throws IOException {
        List<SwlMeasurement> batch = new ArrayList<>(Math.min(size, 4096));
        String line;
        while (batch.size() < size && (line = reader.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            Optional<SwlMeasurement> row = toMeasurement(parseCsvLine(line));
            if (row.isPresent()) {
                batch.add(row.get());
            } else {
                skippedRows++;
            }
        }
        return batch;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }

    private Optional<SwlMeasurement> toMeasurement(List<String> fields) {
        if (fields.size() <= Math.max(timeIdx, valueIdx)) {
            return Optional.empty();
        }
        Optional<Instant> time = CsvTimeParser.parse(fields.get(timeIdx));
        Optional<Double> value = parseValue(fields.get(valueIdx));
        if (time.isEmpty() || value.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(SwlMeasurement.builder()
                .time(time.get())
                .source(source)
                .parameter(parameter)
                .value(value.get())
                .build());
    }

    static Optional<Double> parseValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        switch (trimmed.toLowerCase(Locale.ROOT)) {
            case "nan", "+nan", "-nan":
                return Optional.of(Double.NaN);
            case "inf", "+inf", "infinity", "+infinity":
                return Optional.of(Double.POSITIVE_INFINITY);
            case "-inf", "-infinity":
                return Optional.of(Double.NEGATIVE_INFINITY);
            default:
                break;
        }
        try {
            return Optional.of(Double.parseDouble(trimmed));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    private static String stripBom(String s) {
        if (s != null && !s.isEmpty() && s.charAt(0) == '\uFEFF') {
            return s.substring(1);
        }
        return s;
    }

    // Quoted fields may contain commas; doubled quotes are escapes
    static List<String> parseCsvLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '"') {
                if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    cur.append('"');
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (ch == ',' && !inQuotes) {
                fields.add(cur.toString().trim());
                cur.setLength(0);
            } else {
                cur.append(ch);
            }
        }
        fields.add(cur.toString().trim());
        return fields;
    }
}
