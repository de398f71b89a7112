package org.carball.querylens.cli;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.analyzer.QueryPerformanceAnalyzer;
import org.carball.querylens.config.AnalysisConfig;
import org.carball.querylens.config.ConfigurationLoader;
import org.carball.querylens.config.OutputFormat;
import org.carball.querylens.model.query.LoggedQuery;
import org.carball.querylens.output.PerformanceReport;
import org.carball.querylens.parser.QueryLogFileConnector;
import org.carball.querylens.plan.JdbcPlanFetcher;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

@Slf4j
public class QueryLensCLI {

    private static final String VERSION = "1.0.0";
    private static final Pattern USER_INFO = Pattern.compile("//[^/@?]+@");
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║          QueryLens Query Performance Analyzer v%s          ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs the CLI and returns the process exit code.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage(out);
            return args.length < 1 ? 1 : 0;
        }

        JdbcPlanFetcher planFetcher = null;
        try {
            CliOptions options = parseArgs(args);
            AnalysisConfig config = new ConfigurationLoader().loadConfiguration(options.getConfigFile(), args);
            if (options.isExplainAnalyze()) {
                config = config.toBuilder().enableExplainAnalyze(true).build();
            }

            out.println("\n🔍 Starting analysis...");
            out.println("   Query log: " + options.getQueryLogFile());
            out.println("   Output: " + String.join(", ", outputFiles(options)));
            out.println("   Plan analysis: " + (options.getJdbcUrl() != null ? "enabled (" + maskJdbcUrl(options.getJdbcUrl()) + ")" : "disabled"));
            out.println();

            out.print("📥 Loading query log... ");
            QueryLogFileConnector connector = new QueryLogFileConnector(options.getQueryLogFile());
            List<LoggedQuery> queries = connector.getAllQueries();
            out.println("✓");
            if (options.isVerbose()) {
                out.println("     - " + connector.getExportMetadata());
                out.println("     - Loaded " + queries.size() + " statements");
            }

            if (options.getJdbcUrl() != null) {
                planFetcher = JdbcPlanFetcher.pooled(options.getJdbcUrl(), options.getDbUser(),
                        options.getDbPassword(), config.getMaxConcurrentPlanAnalyses());
            }

            PerformanceReport report;
            try (QueryPerformanceAnalyzer analyzer = new QueryPerformanceAnalyzer(config, planFetcher, replayClock(queries))) {
                out.print("📊 Replaying statements... ");
                int failed = 0;
                for (LoggedQuery query : queries) {
                    if (analyzer.recordQuery(query.sqlText(), query.durationMs(), query.rowsReturned(), query.timestamp()) == null) {
                        failed++;
                    }
                }
                out.println("✓");
                if (failed > 0) {
                    out.println("   ⚠️  " + failed + " statements could not be recorded");
                }

                if (analyzer.isPlanAnalysisEnabled()) {
                    out.print("🧭 Waiting for execution plan analysis... ");
                    boolean done = analyzer.awaitPendingPlanAnalyses(planWaitTimeout(config));
                    out.println(done ? "✓" : "(timed out, continuing with partial plans)");
                }

                report = analyzer.buildReport();
            }

            out.print(report.toText());

            out.print("📝 Writing results... ");
            writeResults(report, options);
            out.println("✓");

            out.println("\n✅ Analysis complete!");
            for (String file : outputFiles(options)) {
                out.println("     - " + file);
            }
            return 0;

        } catch (IllegalArgumentException | IllegalStateException e) {
            err.println("\n❌ Configuration error: " + e.getMessage());
            err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (IOException e) {
            err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        } catch (RuntimeException e) {
            err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return 1;
        } finally {
            if (planFetcher != null) {
                planFetcher.close();
            }
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage(PrintStream out) {
        out.println("\nUsage: java -jar querylens.jar <query-log.json> [options]");
        out.println();
        out.println("Arguments:");
        out.println("  query-log.json      Exported query log (export_metadata + queries)");
        out.println();
        out.println("Options:");
        out.println("  --output, -o        Output file for the report (default: performance-report.json)");
        out.println("  --format, -f        Output format: json|text|both (default: json)");
        out.println("  --config            YAML file with analysis settings");
        out.println("  --jdbc-url          PostgreSQL JDBC URL; enables execution plan analysis");
        out.println("  --db-user           Database user for plan analysis");
        out.println("  --db-password       Database password for plan analysis");
        out.println("  --explain-analyze   Use EXPLAIN ANALYZE (runs each statement inside a rolled-back transaction)");
        out.println("  --verbose, -v       Enable verbose output");
        out.println("  --help, -h          Show this help message");
        out.println();
        out.println(ConfigurationLoader.getConfigurationHelp());
        out.println("Examples:");
        out.println("  # Analyze a query log offline");
        out.println("  java -jar querylens.jar query-log.json --format both");
        out.println();
        out.println("  # Include execution plans from a database");
        out.println("  java -jar querylens.jar query-log.json --jdbc-url jdbc:postgresql://localhost:5432/app --db-user app");
    }

    static CliOptions parseArgs(String[] args) {
        CliOptions options = new CliOptions();
        options.setQueryLogFile(Paths.get(args[0]));

        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--output":
                case "-o":
                    options.setOutputFile(requireValue(args, ++i, "Output file not specified"));
                    break;

                case "--format":
                case "-f":
                    String format = requireValue(args, ++i, "Output format not specified");
                    try {
                        options.setOutputFormat(OutputFormat.valueOf(format.toUpperCase(Locale.ROOT)));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, text, or both");
                    }
                    break;

                case "--config":
                    options.setConfigFile(Paths.get(requireValue(args, ++i, "Configuration file not specified")));
                    break;

                case "--jdbc-url":
                    options.setJdbcUrl(requireValue(args, ++i, "JDBC URL not specified"));
                    break;

                case "--db-user":
                    options.setDbUser(requireValue(args, ++i, "Database user not specified"));
                    break;

                case "--db-password":
                    options.setDbPassword(requireValue(args, ++i, "Database password not specified"));
                    break;

                case "--explain-analyze":
                    options.setExplainAnalyze(true);
                    break;

                case "--verbose":
                case "-v":
                    options.setVerbose(true);
                    break;

                default:
                    if (arg.startsWith("--config.")) {
                        // handled by ConfigurationLoader
                        requireValue(args, ++i, "Value not specified for " + arg);
                        break;
                    }
                    throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        if (!Files.exists(options.getQueryLogFile())) {
            throw new IllegalArgumentException("Query log file not found: " + options.getQueryLogFile());
        }

        Path outputDir = Paths.get(options.getOutputFile()).toAbsolutePath().getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }

        return options;
    }

    private static String requireValue(String[] args, int index, String message) {
        if (index >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[index];
    }

    static List<String> outputFiles(CliOptions options) {
        String baseFileName = removeFileExtension(options.getOutputFile());
        List<String> files = new ArrayList<>();
        if (options.getOutputFormat() != OutputFormat.TEXT) {
            files.add(baseFileName + ".json");
        }
        if (options.getOutputFormat() != OutputFormat.JSON) {
            files.add(baseFileName + ".txt");
        }
        return files;
    }

    private static void writeResults(PerformanceReport report, CliOptions options) throws IOException {
        for (String file : outputFiles(options)) {
            String content = file.endsWith(".json") ? report.toJson() : report.toText();
            Files.writeString(Paths.get(file), content);
        }
    }

    /**
     * Hides credentials in a JDBC URL: user info before the host and the whole query string.
     */
    static String maskJdbcUrl(String jdbcUrl) {
        String masked = USER_INFO.matcher(jdbcUrl).replaceFirst("//***@");
        int query = masked.indexOf('?');
        return query >= 0 ? masked.substring(0, query) + "?***" : masked;
    }

    /**
     * A replayed log is analyzed as of its newest statement, so the analysis window covers
     * the logged history instead of the time the tool runs.
     */
    static Clock replayClock(List<LoggedQuery> queries) {
        return queries.stream()
                .map(LoggedQuery::timestamp)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .map(latest -> Clock.fixed(latest, ZoneOffset.UTC))
                .orElseGet(Clock::systemUTC);
    }

    private static Duration planWaitTimeout(AnalysisConfig config) {
        // every queued fetch may take the full timeout, spread over the worker pool
        long rounds = (long) Math.ceil((double) config.getPlanAnalysisQueueCapacity() / config.getMaxConcurrentPlanAnalyses()) + 1;
        return config.getPlanFetchTimeout().multipliedBy(rounds);
    }

    private static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    @Data
    static class CliOptions {
        private Path queryLogFile;
        private String outputFile = "performance-report.json";
        private OutputFormat outputFormat = OutputFormat.JSON;
        private Path configFile;
        private String jdbcUrl;
        private String dbUser;
        private String dbPassword;
        private boolean explainAnalyze;
        private boolean verbose;
    }
}
