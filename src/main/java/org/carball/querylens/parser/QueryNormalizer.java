package org.carball.querylens.parser;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.DateValue;
import net.sf.jsqlparser.expression.DoubleValue;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.HexValue;
import net.sf.jsqlparser.expression.IntervalExpression;
import net.sf.jsqlparser.expression.JdbcParameter;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.expression.TimeValue;
import net.sf.jsqlparser.expression.TimestampValue;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.delete.Delete;
import net.sf.jsqlparser.statement.insert.Insert;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.update.Update;
import net.sf.jsqlparser.util.TablesNamesFinder;
import net.sf.jsqlparser.util.deparser.ExpressionDeParser;
import net.sf.jsqlparser.util.deparser.SelectDeParser;
import net.sf.jsqlparser.util.deparser.StatementDeParser;
import org.carball.querylens.model.query.NormalizationStrategy;
import org.carball.querylens.model.query.NormalizedQuery;
import org.carball.querylens.model.query.ParameterizedStatement;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw SQL into a literal-free form and a short fingerprint, and extracts the tables
 * a statement touches. Both operations try JSqlParser first and fall back to regular
 * expressions; neither ever throws.
 */
@Slf4j
public final class QueryNormalizer {

    public static final String PLACEHOLDER = "?";
    public static final int FINGERPRINT_LENGTH = 12;

    private static final Pattern STRING_LITERAL = Pattern.compile("'(?:[^']|'')*'");
    private static final Pattern NUMERIC_LITERAL = Pattern.compile("\\b\\d+(?:\\.\\d+)?\\b");
    private static final Pattern BOOLEAN_LITERAL = Pattern.compile("\\b(?:TRUE|FALSE)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern EXPLAINABLE_PREFIX = Pattern.compile(
            "^\\s*\\(*\\s*(?:SELECT|WITH|INSERT|UPDATE|DELETE|VALUES)\\b", Pattern.CASE_INSENSITIVE);

    // FROM also covers DELETE FROM, INTO covers INSERT INTO
    private static final Pattern TABLE_PATTERN = Pattern.compile(
            "\\b(?:FROM|JOIN|UPDATE|INTO)\\s+((?:\"?[A-Za-z_][A-Za-z0-9_$]*\"?\\.)?\"?[A-Za-z_][A-Za-z0-9_$]*\"?)",
            Pattern.CASE_INSENSITIVE
    );

    private QueryNormalizer() {
        // Utility class - prevent instantiation
    }

    /**
     * Normalizes a statement. Blank input yields the empty text.
     */
    public static NormalizedQuery normalize(String rawSql) {
        if (rawSql == null || rawSql.isBlank()) {
            return new NormalizedQuery("", hash(""), NormalizationStrategy.FALLBACK, false);
        }

        try {
            Statement statement = CCJSqlParserUtil.parse(rawSql);
            String normalized = normalizeStructurally(statement);
            if (!normalized.isEmpty()) {
                return new NormalizedQuery(normalized, hash(normalized), NormalizationStrategy.PARSED,
                        isExplainable(statement));
            }
        } catch (JSQLParserException | RuntimeException e) {
            log.debug("Structural normalization failed, using regex fallback: {}", e.getMessage());
        }

        String normalized = normalizeWithRegex(rawSql);
        return new NormalizedQuery(normalized, hash(normalized), NormalizationStrategy.FALLBACK,
                EXPLAINABLE_PREFIX.matcher(rawSql).find());
    }

    /**
     * Renumbers JDBC {@code ?} markers as PostgreSQL positional parameters so the statement
     * can be explained as a generic plan. Markers inside string literals are left alone.
     * Statements that cannot be parsed come back unchanged with a parameter count of 0.
     */
    public static ParameterizedStatement toPositionalParameters(String rawSql) {
        if (rawSql == null || rawSql.indexOf('?') < 0) {
            return new ParameterizedStatement(rawSql, 0);
        }

        try {
            Statement statement = CCJSqlParserUtil.parse(rawSql);
            StringBuilder buffer = new StringBuilder();
            PositionalParameterDeParser expressionDeParser = new PositionalParameterDeParser();
            deparse(statement, expressionDeParser, new SelectDeParser(expressionDeParser, buffer), buffer);
            return new ParameterizedStatement(buffer.toString(), expressionDeParser.parameterCount);
        } catch (JSQLParserException | RuntimeException e) {
            log.debug("Could not renumber parameters: {}", e.getMessage());
            return new ParameterizedStatement(rawSql, 0);
        }
    }

    public static String fingerprint(String rawSql) {
        return normalize(rawSql).fingerprint();
    }

    /**
     * Regex normalization: string and numeric literals become placeholders, whitespace is
     * collapsed and the result is upper-cased.
     */
    public static String normalizeWithRegex(String rawSql) {
        if (rawSql == null) {
            return "";
        }
        String normalized = STRING_LITERAL.matcher(rawSql).replaceAll(PLACEHOLDER);
        normalized = NUMERIC_LITERAL.matcher(normalized).replaceAll(PLACEHOLDER);
        normalized = BOOLEAN_LITERAL.matcher(normalized).replaceAll(PLACEHOLDER);
        normalized = WHITESPACE.matcher(normalized).replaceAll(" ");
        return normalized.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Returns the lower-case, schema-less names of the tables a statement reads or writes.
     */
    public static Set<String> extractTableNames(String rawSql) {
        Set<String> tables = new TreeSet<>();
        if (rawSql == null || rawSql.isBlank()) {
            return tables;
        }

        try {
            Statement statement = CCJSqlParserUtil.parse(rawSql);
            List<String> names = new TablesNamesFinder().getTableList(statement);
            for (String name : names) {
                tables.add(cleanTableName(name));
            }
            return tables;
        } catch (JSQLParserException | RuntimeException e) {
            log.debug("Structural table extraction failed, using regex fallback: {}", e.getMessage());
        }

        return extractTableNamesWithRegex(rawSql);
    }

    public static Set<String> extractTableNamesWithRegex(String rawSql) {
        Set<String> tables = new TreeSet<>();
        if (rawSql == null) {
            return tables;
        }

        Matcher matcher = TABLE_PATTERN.matcher(rawSql);
        while (matcher.find()) {
            tables.add(cleanTableName(matcher.group(1)));
        }
        return tables;
    }

    private static String normalizeStructurally(Statement statement) {
        StringBuilder buffer = new StringBuilder();
        ExpressionDeParser expressionDeParser = new LiteralMaskingExpressionDeParser();
        deparse(statement, expressionDeParser, new IdentifierFoldingSelectDeParser(expressionDeParser, buffer), buffer);
        return WHITESPACE.matcher(buffer.toString()).replaceAll(" ").trim();
    }

    private static void deparse(Statement statement,
                                ExpressionDeParser expressionDeParser,
                                SelectDeParser selectDeParser,
                                StringBuilder buffer) {
        expressionDeParser.setSelectVisitor(selectDeParser);
        expressionDeParser.setBuffer(buffer);
        statement.accept(new StatementDeParser(expressionDeParser, selectDeParser, buffer));
    }

    private static boolean isExplainable(Statement statement) {
        return statement instanceof Select
                || statement instanceof Insert
                || statement instanceof Update
                || statement instanceof Delete;
    }

    private static String cleanTableName(String name) {
        String cleaned = name.replace("\"", "").replace("`", "");
        int lastDot = cleaned.lastIndexOf('.');
        if (lastDot >= 0) {
            cleaned = cleaned.substring(lastDot + 1);
        }
        return cleaned.toLowerCase(Locale.ROOT);
    }

    static String hash(String normalizedText) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            byte[] bytes = digest.digest(normalizedText.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes).substring(0, FINGERPRINT_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    /**
     * Replaces the name at the start of what was just appended to the buffer with its
     * lower-case (identifiers) or upper-case (function names) form.
     */
    private static void foldName(StringBuilder buffer, int start, String name, boolean upperCase) {
        if (name != null && buffer.indexOf(name, start) == start) {
            String folded = upperCase ? name.toUpperCase(Locale.ROOT) : name.toLowerCase(Locale.ROOT);
            buffer.replace(start, start + name.length(), folded);
        }
    }

    private static class LiteralMaskingExpressionDeParser extends ExpressionDeParser {

        @Override
        public void visit(LongValue longValue) {
            getBuffer().append(PLACEHOLDER);
        }

        @Override
        public void visit(DoubleValue doubleValue) {
            getBuffer().append(PLACEHOLDER);
        }

        @Override
        public void visit(StringValue stringValue) {
            getBuffer().append(PLACEHOLDER);
        }

        @Override
        public void visit(HexValue hexValue) {
            getBuffer().append(PLACEHOLDER);
        }

        @Override
        public void visit(DateValue dateValue) {
            getBuffer().append(PLACEHOLDER);
        }

        @Override
        public void visit(TimeValue timeValue) {
            getBuffer().append(PLACEHOLDER);
        }

        @Override
        public void visit(TimestampValue timestampValue) {
            getBuffer().append(PLACEHOLDER);
        }

        @Override
        public void visit(IntervalExpression interval) {
            if (interval.getExpression() != null) {
                super.visit(interval);
                return;
            }
            getBuffer().append("INTERVAL ").append(PLACEHOLDER);
            if (interval.getIntervalType() != null) {
                getBuffer().append(' ').append(interval.getIntervalType().toUpperCase(Locale.ROOT));
            }
        }

        @Override
        public void visit(Column column) {
            String name = column.getFullyQualifiedName();
            // JSqlParser reads unquoted boolean literals as columns
            if ("true".equalsIgnoreCase(name) || "false".equalsIgnoreCase(name)) {
                getBuffer().append(PLACEHOLDER);
                return;
            }
            int start = getBuffer().length();
            super.visit(column);
            foldName(getBuffer(), start, name, false);
        }

        @Override
        public void visit(Function function) {
            int start = getBuffer().length();
            super.visit(function);
            foldName(getBuffer(), start, function.getName(), true);
        }
    }

    private static class PositionalParameterDeParser extends ExpressionDeParser {

        private int parameterCount;

        @Override
        public void visit(JdbcParameter parameter) {
            getBuffer().append('$').append(++parameterCount);
        }
    }

    private static class IdentifierFoldingSelectDeParser extends SelectDeParser {

        IdentifierFoldingSelectDeParser(ExpressionDeParser expressionVisitor, StringBuilder buffer) {
            super(expressionVisitor, buffer);
        }

        @Override
        public void visit(Table table) {
            int start = getBuffer().length();
            super.visit(table);
            foldName(getBuffer(), start, table.getFullyQualifiedName(), false);
        }
    }
}
