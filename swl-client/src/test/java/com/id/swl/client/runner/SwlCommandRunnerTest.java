package com.id.swl.client.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.id.swl.client.modules.api.service.SwlApiClient;
import com.id.swl.client.modules.ingest.model.BulkLoadOptions;
import com.id.swl.client.modules.ingest.model.BulkLoadResult;
import com.id.swl.client.modules.ingest.service.BulkLoader;
import com.id.swl.client.modules.query.service.SeriesExporter;
import com.id.swl.model.SwlMeasurement;
import com.id.swl.model.SwlQueryReq;
import com.id.swl.model.enums.SwlSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.web.client.ResourceAccessException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SwlCommandRunnerTest {

    @Mock
    private SwlApiClient apiClient;
    @Mock
    private BulkLoader bulkLoader;
    @Mock
    private SeriesExporter seriesExporter;

    @Captor
    private ArgumentCaptor<SwlQueryReq> reqCaptor;
    @Captor
    private ArgumentCaptor<BulkLoadOptions> optionsCaptor;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private SwlCommandRunner runner;

    @BeforeEach
    void setup() {
        runner = new SwlCommandRunner(apiClient, bulkLoader, seriesExporter, new ObjectMapper(),
                new PrintStream(stdout, true, StandardCharsets.UTF_8));
    }

    @Test
    void healthPrintsServiceAnswer() {
        when(apiClient.health()).thenReturn(Map.of("status", "ok"));

        runner.run(new DefaultApplicationArguments("health"));

        assertEquals("{\"status\":\"ok\"}", output().trim());
        assertEquals(0, runner.getExitCode());
    }

    @Test
    void ingestPassesOptionsAndPrintsTotals() throws IOException {
        when(bulkLoader.load(any())).thenReturn(new BulkLoadResult(10, 10, 4, 0));

        runner.run(new DefaultApplicationArguments("ingest", "--file=data.csv", "--source=ACE",
                "--parameter=IMF_Bz", "--batch-size=500", "--max-batches=2"));

        verify(bulkLoader).load(optionsCaptor.capture());
        BulkLoadOptions options = optionsCaptor.getValue();
        assertEquals(Path.of("data.csv"), options.file());
        assertEquals(500, options.batchSize());
        assertEquals(BulkLoadOptions.DEFAULT_SLEEP_MS, options.sleepMs());
        assertEquals(2, options.maxBatches());
        assertEquals("{\"rows\":10,\"raw\":10,\"min1\":4,\"elapsed_s\":0}", output().trim());
    }

    @Test
    void queryPrintsCountAndExports() throws IOException {
        List<SwlMeasurement> points = List.of(SwlMeasurement.builder()
                .time(Instant.parse("2004-11-07T00:00:00Z")).value(1.0).build());
        when(apiClient.query(any())).thenReturn(points);
        when(seriesExporter.export(eq(Path.of("out.csv")), eq(points), eq("ACE"), eq("IMF_Bz")))
                .thenReturn(Path.of("out.csv"));

        runner.run(new DefaultApplicationArguments("query", "--source=ACE", "--parameter=IMF_Bz",
                "--start=2004-11-07T00:00:00Z", "--end=2004-11-07T02:00:00Z", "--series=min1", "--out=out.csv"));

        verify(apiClient).query(reqCaptor.capture());
        assertEquals(SwlSeries.MIN1, reqCaptor.getValue().getSeries());
        assertEquals(Instant.parse("2004-11-07T02:00:00Z"), reqCaptor.getValue().getEnd());
        assertTrue(output().startsWith("1"));
        assertEquals(0, runner.getExitCode());
    }

    @Test
    void missingOptionFailsWithoutCalls() {
        runner.run(new DefaultApplicationArguments("query", "--source=ACE"));

        assertEquals(1, runner.getExitCode());
        verifyNoInteractions(apiClient, seriesExporter);
    }

    @Test
    void unreachableServiceSetsExitCode() {
        when(apiClient.health()).thenThrow(new ResourceAccessException("connection refused"));

        runner.run(new DefaultApplicationArguments("health"));

        assertEquals(1, runner.getExitCode());
    }

    @Test
    void unknownCommandPrintsUsage() {
        runner.run(new DefaultApplicationArguments("plot"));

        assertTrue(output().contains("Usage:"));
        assertEquals(2, runner.getExitCode());
    }

    private String output() {
        return stdout.toString(StandardCharsets.UTF_8);
    }
}
