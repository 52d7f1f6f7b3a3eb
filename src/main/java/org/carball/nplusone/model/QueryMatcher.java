package org.carball.nplusone.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Ignore predicate tested against raw SQL before a query is recorded.
 */
public final class QueryMatcher {

    private final String exact;
    private final Pattern pattern;

    private QueryMatcher(String exact, Pattern pattern) {
        this.exact = exact;
        this.pattern = pattern;
    }

    public static QueryMatcher exact(String sql) {
        return new QueryMatcher(Objects.requireNonNull(sql, "sql"), null);
    }

    public static QueryMatcher pattern(Pattern pattern) {
        return new QueryMatcher(null, Objects.requireNonNull(pattern, "pattern"));
    }

    public static QueryMatcher pattern(String regex) {
        return pattern(Pattern.compile(regex));
    }

    public boolean matches(String sql) {
        if (sql == null) {
            return false;
        }
        return pattern != null ? pattern.matcher(sql).find() : exact.equals(sql);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueryMatcher other)) return false;
        return Objects.equals(exact, other.exact)
                && Objects.equals(pattern == null ? null : pattern.pattern(),
                                  other.pattern == null ? null : other.pattern.pattern());
    }

    @Override
    public int hashCode() {
        return Objects.hash(exact, pattern == null ? null : pattern.pattern());
    }

    @Override
    public String toString() {
        return pattern != null ? "/" + pattern.pattern() + "/" : exact;
    }
}
