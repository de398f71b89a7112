package org.carball.querylens.monitor;

import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.analyzer.QueryPerformanceAnalyzer;
import org.carball.querylens.output.PerformanceReport;

import javax.sql.DataSource;
import java.io.PrintStream;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs statements against a {@link DataSource} and reports each execution, including failed
 * ones, to a {@link QueryPerformanceAnalyzer}.
 */
@Slf4j
public class MonitoringQueryExecutor {

    private final DataSource dataSource;
    private final QueryPerformanceAnalyzer analyzer;
    private final Clock clock;
    private final Instant startedAt;

    public MonitoringQueryExecutor(DataSource dataSource, QueryPerformanceAnalyzer analyzer) {
        this(dataSource, analyzer, Clock.systemUTC());
    }

    MonitoringQueryExecutor(DataSource dataSource, QueryPerformanceAnalyzer analyzer, Clock clock) {
        this.dataSource = dataSource;
        this.analyzer = analyzer;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    /**
     * Executes a statement with positional parameters and returns its rows keyed by column
     * label. Statements without a result set return an empty list and are recorded with
     * their update count.
     *
     * @throws SQLException after the failed attempt has been recorded with zero rows
     */
    public List<Map<String, Object>> executeQuery(String sql, Object... parameters) throws SQLException {
        long start = System.nanoTime();

        try (Connection connection = dataSource.getConnection();
             PreparedStatement ps = connection.prepareStatement(sql)) {

            if (parameters != null) {
                for (int i = 0; i < parameters.length; i++) {
                    ps.setObject(i + 1, parameters[i]);
                }
            }

            List<Map<String, Object>> rows = new ArrayList<>();
            long rowCount;
            if (ps.execute()) {
                try (ResultSet rs = ps.getResultSet()) {
                    ResultSetMetaData metaData = rs.getMetaData();
                    int columns = metaData.getColumnCount();
                    while (rs.next()) {
                        Map<String, Object> row = new LinkedHashMap<>();
                        for (int c = 1; c <= columns; c++) {
                            row.put(metaData.getColumnLabel(c), rs.getObject(c));
                        }
                        rows.add(row);
                    }
                }
                rowCount = rows.size();
            } else {
                rowCount = Math.max(0, ps.getUpdateCount());
            }

            analyzer.recordQuery(sql, elapsedMs(start), rowCount);
            return rows;
        } catch (SQLException e) {
            double elapsed = elapsedMs(start);
            analyzer.recordQuery(sql, elapsed, 0L);
            log.warn("Monitored query failed after {}ms: {}", String.format(Locale.ROOT, "%.1f", elapsed), e.getMessage());
            throw e;
        }
    }

    public double getMonitoringDurationMinutes() {
        return Duration.between(startedAt, clock.instant()).toMillis() / 60_000.0;
    }

    public PerformanceSummary getPerformanceSummary() {
        return new PerformanceSummary(getMonitoringDurationMinutes(), analyzer.buildReport());
    }

    public void printPerformanceSummary(PrintStream out) {
        PerformanceSummary summary = getPerformanceSummary();
        out.printf(Locale.ROOT, "%n⏱️ Performance monitoring duration: %.1f minutes%n", summary.monitoringDurationMinutes());
        out.print(summary.analysisReport().toText());
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    public record PerformanceSummary(double monitoringDurationMinutes, PerformanceReport analysisReport) {}
}
