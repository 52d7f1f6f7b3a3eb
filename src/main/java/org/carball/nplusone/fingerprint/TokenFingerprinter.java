package org.carball.nplusone.fingerprint;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lightweight lexer-based normalizer for engines without a structural parser (SQLite).
 *
 * <p>Comments are dropped, literals and bind parameters become {@code ?}, unquoted words
 * are lower-cased and quoted identifiers are kept verbatim. Tokens are joined with single
 * spaces, so spacing around operators does not matter. Constant {@code IN} and
 * {@code VALUES} lists, multi-row batches included, collapse to {@code (?+)}.
 */
public class TokenFingerprinter implements Fingerprinter {

    private static final String PLACEHOLDER = "?";
    private static final Set<String> LITERAL_WORDS = Set.of("true", "false", "null");
    private static final String OPERATOR_CHARS = "<>=!|&+-*/%^~";

    // a collapsed list re-lexes as "( ? + )" and must collapse again
    private static final Pattern CONSTANT_LIST = Pattern.compile(
            "\\b(in|values) \\( (?:\\? \\+|\\?(?: , \\?)*) \\)(?: , \\( \\?(?: , \\?)* \\))*");

    @Override
    public String fingerprint(String sql) {
        if (sql == null) {
            throw new NormalizationException("Cannot fingerprint a null query", null);
        }

        List<String> tokens = tokenize(sql);
        return CONSTANT_LIST.matcher(join(tokens)).replaceAll("$1 (?+)");
    }

    List<String> tokenize(String sql) {
        List<String> tokens = new ArrayList<>();
        int length = sql.length();
        int i = 0;

        while (i < length) {
            char c = sql.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '-' && peek(sql, i + 1) == '-') {
                i = skipLine(sql, i);
            } else if (c == '/' && peek(sql, i + 1) == '*') {
                int end = sql.indexOf("*/", i + 2);
                if (end < 0) {
                    throw new NormalizationException("Unterminated block comment", sql);
                }
                i = end + 2;
            } else if (c == '\'') {
                i = skipQuoted(sql, i, '\'');
                tokens.add(PLACEHOLDER);
            } else if ((c == 'x' || c == 'X') && peek(sql, i + 1) == '\'') {
                i = skipQuoted(sql, i + 1, '\'');
                tokens.add(PLACEHOLDER);
            } else if (c == '"' || c == '`') {
                int end = skipQuoted(sql, i, c);
                tokens.add(sql.substring(i, end));
                i = end;
            } else if (c == '[') {
                int end = sql.indexOf(']', i + 1);
                if (end < 0) {
                    throw new NormalizationException("Unterminated bracket identifier", sql);
                }
                tokens.add(sql.substring(i, end + 1));
                i = end + 1;
            } else if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(sql, i + 1)))) {
                i = skipNumber(sql, i);
                tokens.add(PLACEHOLDER);
            } else if (c == '?') {
                i = skipWhile(sql, i + 1, Character::isDigit);
                tokens.add(PLACEHOLDER);
            } else if ((c == ':' || c == '@' || c == '$') && isWordStart(peek(sql, i + 1))) {
                i = skipWhile(sql, i + 1, TokenFingerprinter::isWordPart);
                tokens.add(PLACEHOLDER);
            } else if (isWordStart(c)) {
                int end = skipWhile(sql, i, TokenFingerprinter::isWordPart);
                String word = sql.substring(i, end).toLowerCase(Locale.ROOT);
                tokens.add(LITERAL_WORDS.contains(word) ? PLACEHOLDER : word);
                i = end;
            } else if (OPERATOR_CHARS.indexOf(c) >= 0) {
                int end = skipWhile(sql, i, ch -> OPERATOR_CHARS.indexOf(ch) >= 0);
                tokens.add(sql.substring(i, end));
                i = end;
            } else {
                tokens.add(String.valueOf(c));
                i++;
            }
        }

        // a trailing statement terminator is not part of the shape
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).equals(";")) {
            tokens.remove(tokens.size() - 1);
        }
        return tokens;
    }

    private static String join(List<String> tokens) {
        StringBuilder out = new StringBuilder();
        String previous = null;
        for (String token : tokens) {
            if (previous != null && !previous.equals(".") && !token.equals(".")) {
                out.append(' ');
            }
            out.append(token);
            previous = token;
        }
        return out.toString();
    }

    private static char peek(String sql, int index) {
        return index < sql.length() ? sql.charAt(index) : '\0';
    }

    private static int skipLine(String sql, int start) {
        int end = sql.indexOf('\n', start);
        return end < 0 ? sql.length() : end + 1;
    }

    /**
     * Returns the index just past the closing quote; a doubled quote is an escaped quote.
     */
    private static int skipQuoted(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                if (peek(sql, i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        throw new NormalizationException("Unterminated quoted text", sql);
    }

    private static int skipNumber(String sql, int start) {
        if (sql.charAt(start) == '0' && (peek(sql, start + 1) == 'x' || peek(sql, start + 1) == 'X')) {
            return skipWhile(sql, start + 2, ch -> Character.digit(ch, 16) >= 0);
        }

        int i = skipWhile(sql, start, ch -> Character.isDigit(ch) || ch == '.');
        char exponent = peek(sql, i);
        if (exponent == 'e' || exponent == 'E') {
            int next = i + 1;
            if (peek(sql, next) == '+' || peek(sql, next) == '-') {
                next++;
            }
            if (Character.isDigit(peek(sql, next))) {
                i = skipWhile(sql, next, Character::isDigit);
            }
        }
        return i;
    }

    private static int skipWhile(String sql, int start, CharPredicate predicate) {
        int i = start;
        while (i < sql.length() && predicate.test(sql.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isWordStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    @FunctionalInterface
    private interface CharPredicate {
        boolean test(char c);
    }
}
