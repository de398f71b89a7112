package org.carball.querylens.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.model.query.LoggedQuery;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads executed statements from an exported query log so they can be replayed into the
 * analyzer.
 * <p>
 * Expected layout:
 * <pre>
 * {
 *   "export_metadata": { "database_name": "...", "export_timestamp": "...", "total_queries": 3 },
 *   "queries": [ { "sql_text": "...", "duration_ms": 12.5, "rows_returned": 1, "timestamp": "2024-..." } ]
 * }
 * </pre>
 * Only {@code sql_text} is required per entry.
 */
@Slf4j
public class QueryLogFileConnector {

    private static final String[] REQUIRED_METADATA = {"database_name", "export_timestamp"};

    private final JsonNode exportData;

    public QueryLogFileConnector(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Query log export file not found: " + path);
        }

        ObjectMapper objectMapper = new ObjectMapper();
        exportData = objectMapper.readTree(Files.readString(path));

        validateExportFormat();
        log.info("Loaded query log export from {}", path);
    }

    /**
     * Returns the logged statements in file order. Entries without SQL text are skipped.
     */
    public List<LoggedQuery> getAllQueries() {
        List<LoggedQuery> results = new ArrayList<>();
        int index = 0;
        for (JsonNode queryNode : exportData.get("queries")) {
            LoggedQuery query = parseQuery(queryNode, index++);
            if (query != null) {
                results.add(query);
            }
        }
        return results;
    }

    /**
     * Total query count from the metadata, or the number of entries when the metadata has none.
     */
    public int getQueryCount() {
        JsonNode totalQueries = exportData.get("export_metadata").get("total_queries");
        if (totalQueries != null && totalQueries.canConvertToInt()) {
            return totalQueries.asInt();
        }
        return exportData.get("queries").size();
    }

    public ExportMetadata getExportMetadata() {
        JsonNode metadata = exportData.get("export_metadata");
        return new ExportMetadata(
                metadata.get("database_name").asText(),
                metadata.get("export_timestamp").asText(),
                metadata.path("source").asText("unknown"),
                getQueryCount()
        );
    }

    private void validateExportFormat() {
        if (exportData == null || !exportData.isObject()) {
            throw new IllegalStateException("Invalid JSON format in export file");
        }

        JsonNode metadata = exportData.get("export_metadata");
        if (metadata == null) {
            throw new IllegalStateException("Missing export_metadata section in export file");
        }

        JsonNode queries = exportData.get("queries");
        if (queries == null || !queries.isArray()) {
            throw new IllegalStateException("Missing or invalid queries section in export file");
        }

        for (String field : REQUIRED_METADATA) {
            if (!metadata.has(field)) {
                throw new IllegalStateException("Missing required metadata field: " + field);
            }
        }
    }

    private LoggedQuery parseQuery(JsonNode queryNode, int index) {
        JsonNode sqlText = queryNode.get("sql_text");
        if (sqlText == null || sqlText.asText().isBlank()) {
            log.warn("Skipping query #{}: missing sql_text", index);
            return null;
        }

        Double durationMs = queryNode.hasNonNull("duration_ms") ? queryNode.get("duration_ms").asDouble() : null;
        Long rowsReturned = queryNode.hasNonNull("rows_returned") ? queryNode.get("rows_returned").asLong() : null;

        Instant timestamp = null;
        if (queryNode.hasNonNull("timestamp")) {
            try {
                timestamp = Instant.parse(queryNode.get("timestamp").asText());
            } catch (DateTimeParseException e) {
                log.warn("Query #{} has an invalid timestamp '{}', using replay time",
                        index, queryNode.get("timestamp").asText());
            }
        }

        return new LoggedQuery(sqlText.asText(), durationMs, rowsReturned, timestamp);
    }

    /**
     * Metadata about the query log export.
     */
    public record ExportMetadata(String databaseName, String exportTimestamp, String source, int totalQueries) {

        @Override
        public String toString() {
            return String.format("ExportMetadata{database='%s', timestamp='%s', source='%s', queries=%d}",
                    databaseName, exportTimestamp, source, totalQueries);
        }
    }
}
