package org.carball.querylens.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.model.query.ParameterizedStatement;
import org.carball.querylens.parser.QueryNormalizer;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.time.Duration;

/**
 * Fetches PostgreSQL plans with {@code EXPLAIN (FORMAT JSON)} over JDBC.
 * <p>
 * Plan analysis uses its own small connection pool so the analyzer never competes with the
 * application for connections. Each request runs in a transaction that is always rolled
 * back, so {@code EXPLAIN ANALYZE} of a data-modifying statement leaves no trace.
 * <p>
 * Statements recorded with JDBC {@code ?} markers have no parameter values to run with.
 * They are renumbered as {@code $1, $2, ...} and explained with {@code GENERIC_PLAN}
 * (PostgreSQL 16 and later), never analyzed.
 */
@Slf4j
public class JdbcPlanFetcher implements PlanFetcher, AutoCloseable {

    static final String EXPLAIN = "EXPLAIN (FORMAT JSON, COSTS TRUE) ";
    static final String EXPLAIN_ANALYZE = "EXPLAIN (ANALYZE, FORMAT JSON, BUFFERS) ";
    static final String EXPLAIN_GENERIC = "EXPLAIN (GENERIC_PLAN, FORMAT JSON, COSTS TRUE) ";

    private final DataSource dataSource;
    private final boolean ownsDataSource;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public JdbcPlanFetcher(DataSource dataSource) {
        this(dataSource, false);
    }

    private JdbcPlanFetcher(DataSource dataSource, boolean ownsDataSource) {
        this.dataSource = dataSource;
        this.ownsDataSource = ownsDataSource;
    }

    /**
     * Creates a fetcher backed by a dedicated HikariCP pool.
     */
    public static JdbcPlanFetcher pooled(String jdbcUrl, String username, String password, int maxPoolSize) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setUsername(username);
        config.setPassword(password);

        config.setMaximumPoolSize(maxPoolSize);
        config.setMinimumIdle(0);
        config.setConnectionTimeout(2000);
        config.setIdleTimeout(60000);
        config.setReadOnly(false);
        config.setAutoCommit(false);
        config.setPoolName("QueryLensPlanPool");

        HikariDataSource pool = new HikariDataSource(config);
        log.info("Plan analysis pool configured: pool={}, max={}", config.getPoolName(), config.getMaximumPoolSize());
        return new JdbcPlanFetcher(pool, true);
    }

    @Override
    public JsonNode explain(String sql, boolean analyze, Duration timeout) throws PlanFetchException {
        String explainSql = explainStatement(sql, analyze);
        int timeoutSeconds = (int) Math.max(1, (timeout.toMillis() + 999) / 1000);

        try (Connection connection = dataSource.getConnection()) {
            connection.setAutoCommit(false);
            try (Statement statement = connection.createStatement()) {
                statement.setQueryTimeout(timeoutSeconds);
                try (ResultSet rs = statement.executeQuery(explainSql)) {
                    if (!rs.next()) {
                        throw new PlanFetchException("EXPLAIN returned no rows");
                    }
                    return objectMapper.readTree(rs.getString(1));
                }
            } finally {
                connection.rollback();
            }
        } catch (SQLTimeoutException e) {
            throw new PlanFetchException("Plan fetch timed out after " + timeoutSeconds + "s", e);
        } catch (SQLException e) {
            throw new PlanFetchException("Database error while fetching plan: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new PlanFetchException("Plan is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    static String explainStatement(String sql, boolean analyze) {
        ParameterizedStatement statement = QueryNormalizer.toPositionalParameters(sql);
        if (statement.hasParameters()) {
            if (analyze) {
                log.debug("Statement has {} parameters, explaining a generic plan instead of analyzing it",
                        statement.parameterCount());
            }
            return EXPLAIN_GENERIC + statement.text();
        }
        return (analyze ? EXPLAIN_ANALYZE : EXPLAIN) + sql;
    }

    @Override
    public void close() {
        if (ownsDataSource && dataSource instanceof HikariDataSource pool) {
            pool.close();
        }
    }
}
