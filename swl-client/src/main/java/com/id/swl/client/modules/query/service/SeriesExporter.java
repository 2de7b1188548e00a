package com.id.swl.client.modules.query.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.id.swl.model.SwlMeasurement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes queried points to disk. {@code .csv} files get a {@code time,value,source,parameter} table;
 * anything else is written as a JSON array, with {@code .json} appended when the path has no extension.
 */
@Service
@Slf4j
public class SeriesExporter {

    private static final String CSV_HEADER = "time,value,source,parameter";

    private final ObjectMapper objectMapper;

    public SeriesExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return The path actually written
     */
    public Path export(Path out, List<SwlMeasurement> points, String source, String parameter) throws IOException {
        String ext = extension(out);
        Path target = ext.isEmpty() ? out.resolveSibling(out.getFileName() + ".json") : out;

        if (ext.equals("csv")) {
            writeCsv(target, points, source, parameter);
        } else {
            writeJson(target, points, source, parameter);
        }
        log.debug("Exported %d points to %s".formatted(points.size(), target));
        return target;
    }

    private void writeJson(Path target, List<SwlMeasurement> points, String source, String parameter) throws IOException {
        List<Map<String, Object>> rows = points.stream()
                .map(p -> {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("time", p.getTime().toString());
                    row.put("value", p.getValue());
                    row.put("source", source);
                    row.put("parameter", parameter);
                    return row;
                })
                .toList();
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            objectMapper.writeValue(writer, rows);
        }
    }

    private static void writeCsv(Path target, List<SwlMeasurement> points, String source, String parameter) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            writer.write(CSV_HEADER);
            writer.newLine();
            for (SwlMeasurement p : points) {
                writer.write(String.join(",", p.getTime().toString(), String.valueOf(p.getValue()),
                        csvField(source), csvField(parameter)));
                writer.newLine();
            }
        }
    }

    private static String csvField(String s) {
        if (s.contains(",") || s.contains("\"") || s.contains("\n")) {
            return "\"" + s.replace("\"", "\"\"") + "\"";
        }
        return s;
    }

    private static String extension(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
