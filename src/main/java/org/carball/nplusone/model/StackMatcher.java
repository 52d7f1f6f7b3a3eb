package org.carball.nplusone.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Allow-list entry tested against a single call-stack frame.
 */
public final class StackMatcher {

    private final String text;
    private final Pattern pattern;

    private StackMatcher(String text, Pattern pattern) {
        this.text = text;
        this.pattern = pattern;
    }

    /**
     * Matches frames containing the given text.
     */
    public static StackMatcher contains(String text) {
        return new StackMatcher(Objects.requireNonNull(text, "text"), null);
    }

    /**
     * Matches frames in which the pattern can be found anywhere.
     */
    public static StackMatcher pattern(Pattern pattern) {
        return new StackMatcher(null, Objects.requireNonNull(pattern, "pattern"));
    }

    public static StackMatcher pattern(String regex) {
        return pattern(Pattern.compile(regex));
    }

    public boolean matches(String frame) {
        if (frame == null) {
            return false;
        }
        return pattern != null ? pattern.matcher(frame).find() : frame.contains(text);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StackMatcher other)) return false;
        return Objects.equals(text, other.text)
                && Objects.equals(pattern == null ? null : pattern.pattern(),
                                  other.pattern == null ? null : other.pattern.pattern());
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, pattern == null ? null : pattern.pattern());
    }

    @Override
    public String toString() {
        return pattern != null ? "/" + pattern.pattern() + "/" : text;
    }
}
