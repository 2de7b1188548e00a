package com.id.swl.client.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.id.swl.client.modules.api.service.SwlApiClient;
import com.id.swl.client.modules.ingest.model.BulkLoadOptions;
import com.id.swl.client.modules.ingest.model.BulkLoadResult;
import com.id.swl.client.modules.ingest.service.BulkLoader;
import com.id.swl.client.modules.query.service.SeriesExporter;
import com.id.swl.model.SwlMeasurement;
import com.id.swl.model.SwlQueryReq;
import com.id.swl.model.enums.SwlSeries;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Dispatches {@code health}, {@code ingest} and {@code query}, named by the first non-option argument.
 * Results go to stdout; failures are logged and turn into exit code 1.
 */
@Component
@Slf4j
public class SwlCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final String USAGE = """
            Usage:
              health
              ingest --file=<csv> --source=<s> --parameter=<p> [--batch-size=1000] [--sleep-ms=50] [--max-batches=0]
              query --source=<s> --parameter=<p> --start=<iso> --end=<iso> [--series=raw|min1] [--out=<path>]
            Options: --swl.client.api-base-url=<url> (default http://localhost:8080)""";

    private final SwlApiClient apiClient;
    private final BulkLoader bulkLoader;
    private final SeriesExporter seriesExporter;
    private final ObjectMapper objectMapper;
    private final PrintStream out;

    private int exitCode;

    public SwlCommandRunner(SwlApiClient apiClient,
                            BulkLoader bulkLoader,
                            SeriesExporter seriesExporter,
                            ObjectMapper objectMapper) {
        this(apiClient, bulkLoader, seriesExporter, objectMapper, System.out);
    }

    SwlCommandRunner(SwlApiClient apiClient,
                     BulkLoader bulkLoader,
                     SeriesExporter seriesExporter,
                     ObjectMapper objectMapper,
                     PrintStream out) {
        this.apiClient = apiClient;
        this.bulkLoader = bulkLoader;
        this.seriesExporter = seriesExporter;
        this.objectMapper = objectMapper;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        if (commands.isEmpty()) {
            out.println(USAGE);
            exitCode = 2;
            return;
        }

        String command = commands.get(0);
        try {
            switch (command) {
                case "health" -> health();
                case "ingest" -> ingest(args);
                case "query" -> query(args);
                default -> {
                    log.error("Unknown command '%s'".formatted(command));
                    out.println(USAGE);
                    exitCode = 2;
                }
            }
        } catch (IllegalArgumentException | DateTimeParseException e) {
            log.error("Command '%s' rejected: %s".formatted(command, e.getMessage()));
            exitCode = 1;
        } catch (RestClientException | IOException e) {
            log.error("Command '%s' failed: %s".formatted(command, e.getMessage()), e);
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void health() throws JsonProcessingException {
        out.println(objectMapper.writeValueAsString(apiClient.health()));
    }

    private void ingest(ApplicationArguments args) throws IOException {
        BulkLoadOptions options = BulkLoadOptions.builder()
                .file(Path.of(required(args, "file")))
                .source(required(args, "source"))
                .parameter(required(args, "parameter"))
                .batchSize(intOption(args, "batch-size", BulkLoadOptions.DEFAULT_BATCH_SIZE))
                .sleepMs(intOption(args, "sleep-ms", (int) BulkLoadOptions.DEFAULT_SLEEP_MS))
                .maxBatches(intOption(args, "max-batches", 0))
                .build();

        BulkLoadResult result = bulkLoader.load(options);
        out.println(objectMapper.writeValueAsString(result));
    }

    private void query(ApplicationArguments args) throws IOException {
        String source = required(args, "source");
        String parameter = required(args, "parameter");
        SwlQueryReq req = SwlQueryReq.builder()
                .source(source)
                .parameter(parameter)
                .start(Instant.parse(required(args, "start")))
                .end(Instant.parse(required(args, "end")))
                .series(SwlSeries.fromCode(option(args, "series")))
                .build();

        List<SwlMeasurement> points = apiClient.query(req);
        out.println(points.size());

        String outPath = option(args, "out");
        if (outPath != null && !outPath.isBlank()) {
            Path written = seriesExporter.export(Path.of(outPath), points, source, parameter);
            out.println("[OK] Exported: " + written);
        }
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }

    private static String required(ApplicationArguments args, String name) {
        String value = option(args, name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required option --%s".formatted(name));
        }
        return value;
    }

    private static int intOption(ApplicationArguments args, String name, int defaultValue) {
        String value = option(args, name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Option --%s must be an integer, got '%s'".formatted(name, value));
        }
    }
}
