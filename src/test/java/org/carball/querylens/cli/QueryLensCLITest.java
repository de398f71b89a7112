package org.carball.querylens.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.querylens.config.OutputFormat;
import org.carball.querylens.model.query.LoggedQuery;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class QueryLensCLITest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream outBuffer = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuffer = new ByteArrayOutputStream();

    private static String fixture() throws Exception {
        return Path.of(QueryLensCLITest.class.getResource("/fixtures/query-log.json").toURI()).toString();
    }

    private int run(String... args) {
        return QueryLensCLI.run(args,
                new PrintStream(outBuffer, true, StandardCharsets.UTF_8),
                new PrintStream(errBuffer, true, StandardCharsets.UTF_8));
    }

    @Test
    void shouldWriteJsonAndTextReports() throws Exception {
        // Given
        Path output = tempDir.resolve("report.json");

        // When
        int exitCode = run(fixture(), "--output", output.toString(), "--format", "both",
                "--config.slow-query-threshold-ms", "1000");

        // Then
        assertThat(exitCode).isEqualTo(0);
        Path json = tempDir.resolve("report.json");
        Path text = tempDir.resolve("report.txt");
        assertThat(json).exists();
        assertThat(text).exists();

        JsonNode report = new ObjectMapper().readTree(Files.readString(json));
        assertThat(report.get("analysis_summary").get("total_queries_analyzed").asInt()).isEqualTo(4);
        assertThat(report.get("slow_queries").get(0).get("query_preview").asText())
                .startsWith("SELECT * FROM property_prices");
        assertThat(Files.readString(text)).contains("QUERY PERFORMANCE ANALYSIS REPORT");
        assertThat(outBuffer.toString(StandardCharsets.UTF_8)).contains("Analysis complete!");
    }

    @Test
    void shouldFailForUnknownOption() throws Exception {
        // When
        int exitCode = run(fixture(), "--frobnicate");

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(errBuffer.toString(StandardCharsets.UTF_8)).contains("Unknown option: --frobnicate");
    }

    @Test
    void shouldFailForMissingLogFile() {
        // When
        int exitCode = run(tempDir.resolve("missing.json").toString());

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(errBuffer.toString(StandardCharsets.UTF_8)).contains("Query log file not found");
    }

    @Test
    void shouldPrintUsageWithoutArguments() {
        assertThat(run()).isEqualTo(1);
        assertThat(outBuffer.toString(StandardCharsets.UTF_8)).contains("Usage:");
    }

    @Test
    void shouldPrintUsageOnHelp() {
        assertThat(run("--help")).isEqualTo(0);
        assertThat(outBuffer.toString(StandardCharsets.UTF_8)).contains("--jdbc-url");
    }

    @Test
    void shouldParseOptions() throws Exception {
        // When
        QueryLensCLI.CliOptions options = QueryLensCLI.parseArgs(new String[]{
                fixture(), "-o", tempDir.resolve("out.json").toString(), "-f", "text",
                "--config.n-plus-one-threshold", "5",
                "--jdbc-url", "jdbc:postgresql://localhost:5432/app", "--db-user", "app",
                "--explain-analyze", "-v"});

        // Then
        assertThat(options.getOutputFormat()).isEqualTo(OutputFormat.TEXT);
        assertThat(options.getJdbcUrl()).isEqualTo("jdbc:postgresql://localhost:5432/app");
        assertThat(options.getDbUser()).isEqualTo("app");
        assertThat(options.isExplainAnalyze()).isTrue();
        assertThat(options.isVerbose()).isTrue();
        assertThat(QueryLensCLI.outputFiles(options)).containsExactly(tempDir.resolve("out").toString() + ".txt");
    }

    @Test
    void shouldRejectInvalidFormat() {
        assertThatThrownBy(() -> QueryLensCLI.parseArgs(new String[]{fixture(), "--format", "xml"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid output format");
    }

    @Test
    void shouldMaskCredentialsInJdbcUrl() {
        assertThat(QueryLensCLI.maskJdbcUrl("jdbc:postgresql://db:5432/app?user=app&password=s3cret"))
                .isEqualTo("jdbc:postgresql://db:5432/app?***");
        assertThat(QueryLensCLI.maskJdbcUrl("jdbc:postgresql://app:s3cret@db:5432/app"))
                .isEqualTo("jdbc:postgresql://***@db:5432/app");
        assertThat(QueryLensCLI.maskJdbcUrl("jdbc:postgresql://localhost:5432/app"))
                .isEqualTo("jdbc:postgresql://localhost:5432/app");
    }

    @Test
    void shouldNotPrintPasswordFromJdbcUrl() throws Exception {
        // Given: an unreachable database still lets the replay finish without plans
        Path output = tempDir.resolve("report.json");

        // When
        run(fixture(), "--output", output.toString(),
                "--jdbc-url", "jdbc:postgresql://127.0.0.1:1/app?password=s3cret",
                "--config.plan-fetch-timeout-ms", "500");

        // Then
        String printed = outBuffer.toString(StandardCharsets.UTF_8) + errBuffer.toString(StandardCharsets.UTF_8);
        assertThat(printed).contains("jdbc:postgresql://127.0.0.1:1/app?***").doesNotContain("s3cret");
    }

    @Test
    void shouldDetectNPlusOneInHistoricalLog() throws Exception {
        // Given
        StringBuilder queries = new StringBuilder();
        for (int i = 0; i < 12; i++) {
            if (i > 0) {
                queries.append(",\n");
            }
            queries.append(String.format(
                    "{ \"sql_text\": \"SELECT * FROM properties WHERE id = %d\", \"duration_ms\": 2.0, "
                            + "\"rows_returned\": 1, \"timestamp\": \"2020-01-01T08:00:%02dZ\" }", i, i));
        }
        Path log = tempDir.resolve("old-log.json");
        Files.writeString(log, "{ \"export_metadata\": { \"database_name\": \"listings\", \"export_timestamp\": \"2020-01-01T09:00:00Z\" }, \"queries\": [\n"
                + queries + "\n] }");
        Path output = tempDir.resolve("historical.json");

        // When
        int exitCode = run(log.toString(), "--output", output.toString());

        // Then
        assertThat(exitCode).isEqualTo(0);
        JsonNode report = new ObjectMapper().readTree(Files.readString(output));
        assertThat(report.get("n_plus_one_patterns")).hasSize(1);
        assertThat(report.get("n_plus_one_patterns").get(0).get("occurrence_count").asInt()).isEqualTo(12);
    }

    @Test
    void shouldReplayAsOfNewestLoggedStatement() {
        // Given
        List<LoggedQuery> queries = List.of(
                new LoggedQuery("SELECT 1", 1.0, 1L, Instant.parse("2020-01-01T08:00:00Z")),
                new LoggedQuery("SELECT 2", 1.0, 1L, null),
                new LoggedQuery("SELECT 3", 1.0, 1L, Instant.parse("2020-01-01T09:30:00Z")));

        // Then
        assertThat(QueryLensCLI.replayClock(queries).instant()).isEqualTo(Instant.parse("2020-01-01T09:30:00Z"));
        assertThat(QueryLensCLI.replayClock(List.of())).isNotNull();
    }
}
