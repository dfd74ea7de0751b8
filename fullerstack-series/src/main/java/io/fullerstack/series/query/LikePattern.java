package io.fullerstack.series.query;

import java.util.regex.Pattern;

/**
 * Case-insensitive wildcard match: {@code *} is any run of characters, {@code ?}
 * exactly one. The pattern may match anywhere in the text.
 */
final class LikePattern {

    private final String source;
    private final Pattern pattern;

    private LikePattern(String source) {
        this.source = source;
        this.pattern = Pattern.compile(translate(source), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    }

    /**
     * @return a matcher, or null when {@code source} is null or blank (match everything)
     */
    static LikePattern compile(String source) {
        if (source == null || source.isBlank()) {
            return null;
        }
        return new LikePattern(source);
    }

    boolean matches(String text) {
        return pattern.matcher(text == null ? "" : text).find();
    }

    private static String translate(String like) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : like.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return regex.toString();
    }

    @Override
    public String toString() {
        return source;
    }
}
