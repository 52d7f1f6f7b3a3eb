package org.carball.nplusone.fingerprint;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex pipeline for MySQL-family dialects. Each step is applied exactly once and in
 * order; comment stripping must run before literal replacement so that quotes inside
 * comments cannot open a string.
 */
public class MysqlFingerprinter implements Fingerprinter {

    static final String MYSQLDUMP_FINGERPRINT = "mysqldump";
    static final String PERCONA_FINGERPRINT = "percona-toolkit";
    static final String USE_FINGERPRINT = "use ?";

    private static final String MYSQLDUMP_PREFIX = "SELECT /*!40001 SQL_NO_CACHE */ * FROM `";

    private static final Pattern PERCONA_CHECKSUM = Pattern.compile("\\*\\w+\\.\\w+:[0-9]/[0-9]\\*/");

    private static final Pattern STORED_PROCEDURE_CALL = Pattern.compile(
            "\\A\\s*(call\\s+\\S+)\\(", Pattern.CASE_INSENSITIVE);

    private static final Pattern MULTI_ROW_INSERT = Pattern.compile(
            "\\A((?:INSERT|REPLACE)(?: IGNORE)?\\s+INTO.+?VALUES\\s*\\(.*?\\))\\s*,\\s*\\(",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    // /*! ... */ blocks are optimizer hints and stay, as do the repeat markers this pipeline emits
    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*(?!!|repeat ).*?\\*/", Pattern.DOTALL);
    private static final Pattern LINE_COMMENT = Pattern.compile("(?:--|#)[^\\r\\n]*(?=[\\r\\n]|\\Z)");

    private static final Pattern USE_STATEMENT = Pattern.compile("\\Ause \\S+\\Z", Pattern.CASE_INSENSITIVE);

    private static final Pattern ESCAPED_QUOTE = Pattern.compile("\\\\[\"']");
    private static final Pattern DOUBLE_QUOTED = Pattern.compile("\".*?\"", Pattern.DOTALL);
    private static final Pattern SINGLE_QUOTED = Pattern.compile("'.*?'", Pattern.DOTALL);

    private static final Pattern BOOLEAN = Pattern.compile("\\btrue\\b|\\bfalse\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBER = Pattern.compile("[0-9+-][0-9a-f.x+-]*");
    private static final Pattern NUMBER_ARTIFACT = Pattern.compile("[xb.+-]\\?");
    private static final Pattern WHITESPACE = Pattern.compile("[ \\n\\t\\r\\f]+");
    private static final Pattern NULL = Pattern.compile("\\bnull\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern VALUE_LIST = Pattern.compile("\\b(in|values?)(?:[\\s,]*\\([\\s?,]*\\))+");
    private static final Pattern FIELD_ARGUMENTS = Pattern.compile(
            "(?<!\\w)field\\s*\\(\\s*(\\S+)\\s*,\\s*(\\?+)(?:\\s*,\\s*\\?+)*\\)");
    private static final Pattern REPEATED_UNION = Pattern.compile(
            "\\b(select\\s.*?)(?:(\\sunion(?:\\sall)?)\\s\\1)+");
    private static final Pattern LIMIT_OFFSET = Pattern.compile("\\blimit \\?(?:, ?\\?| offset \\?)");
    private static final Pattern ORDER_BY = Pattern.compile("\\border by");
    private static final Pattern ASCENDING = Pattern.compile("\\G(.+?)\\s+asc");

    @Override
    public String fingerprint(String sql) {
        if (sql == null) {
            throw new NormalizationException("Cannot fingerprint a null query", null);
        }

        try {
            return normalize(sql);
        } catch (StackOverflowError e) {
            throw new NormalizationException("Query exhausted the regex engine during normalization", sql, e);
        }
    }

    private String normalize(String sql) {
        Optional<String> sentinel = toolSignature(sql).or(() -> storedProcedure(sql));
        if (sentinel.isPresent()) {
            return sentinel.get();
        }

        String query = firstInsertTuple(sql);
        query = stripComments(query);
        if (isUseStatement(query)) {
            return USE_FINGERPRINT;
        }

        query = replaceStrings(query);
        query = replaceBooleans(query);
        query = replaceNumbers(query);
        query = collapseNumberArtifacts(query);
        query = normalizeWhitespace(query);
        query = replaceNulls(query);
        query = collapseValueLists(query);
        query = collapseFieldArguments(query);
        query = collapseRepeatedUnions(query);
        query = normalizeLimit(query);
        return stripAscending(query);
    }

    static Optional<String> toolSignature(String sql) {
        if (sql.startsWith(MYSQLDUMP_PREFIX)) {
            return Optional.of(MYSQLDUMP_FINGERPRINT);
        }
        if (PERCONA_CHECKSUM.matcher(sql).find()) {
            return Optional.of(PERCONA_FINGERPRINT);
        }
        return Optional.empty();
    }

    static Optional<String> storedProcedure(String sql) {
        Matcher matcher = STORED_PROCEDURE_CALL.matcher(sql);
        if (matcher.find()) {
            return Optional.of(matcher.group(1).toLowerCase(Locale.ROOT));
        }
        return Optional.empty();
    }

    static String firstInsertTuple(String sql) {
        Matcher matcher = MULTI_ROW_INSERT.matcher(sql);
        return matcher.find() ? matcher.group(1) : sql;
    }

    static String stripComments(String sql) {
        String query = BLOCK_COMMENT.matcher(sql).replaceAll("");
        return LINE_COMMENT.matcher(query).replaceAll("");
    }

    static boolean isUseStatement(String sql) {
        return USE_STATEMENT.matcher(sql).find();
    }

    static String replaceStrings(String sql) {
        String query = ESCAPED_QUOTE.matcher(sql).replaceAll("");
        query = DOUBLE_QUOTED.matcher(query).replaceAll("?");
        return SINGLE_QUOTED.matcher(query).replaceAll("?");
    }

    static String replaceBooleans(String sql) {
        return BOOLEAN.matcher(sql).replaceAll("?");
    }

    static String replaceNumbers(String sql) {
        return NUMBER.matcher(sql).replaceAll("?");
    }

    static String collapseNumberArtifacts(String sql) {
        return NUMBER_ARTIFACT.matcher(sql).replaceAll("?");
    }

    static String normalizeWhitespace(String sql) {
        return WHITESPACE.matcher(sql.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    static String replaceNulls(String sql) {
        return NULL.matcher(sql).replaceAll("?");
    }

    static String collapseValueLists(String sql) {
        return VALUE_LIST.matcher(sql).replaceAll("$1(?+)");
    }

    static String collapseFieldArguments(String sql) {
        return FIELD_ARGUMENTS.matcher(sql).replaceAll("field($1, ?+)");
    }

    static String collapseRepeatedUnions(String sql) {
        return REPEATED_UNION.matcher(sql).replaceAll("$1 /*repeat$2*/");
    }

    static String normalizeLimit(String sql) {
        return LIMIT_OFFSET.matcher(sql).replaceAll("limit ?");
    }

    static String stripAscending(String sql) {
        if (!ORDER_BY.matcher(sql).find()) {
            return sql;
        }
        return ASCENDING.matcher(sql).replaceAll("$1");
    }
}
