package com.github.tarcv.phppcre;

import java.util.Objects;

/**
 * A PHP PCRE pattern split into its regex body and the modifier text that follows the closing
 * delimiter.
 */
public final class DelimitedPattern {
    private final String pattern;
    private final char delimiter;
    private final String regex;
    private final String modifiers;

    private DelimitedPattern(final String pattern, final char delimiter, final String regex, final String modifiers) {
        this.pattern = pattern;
        this.delimiter = delimiter;
        this.regex = regex;
        this.modifiers = modifiers;
    }

    /**
     * Splits {@code pattern} at its delimiters.
     * <p>
     * Leading ASCII whitespace is skipped. The delimiter is the first character that is ASCII,
     * not alphanumeric and not a backslash. Bracket style delimiters are closed by their
     * counterpart, any other delimiter by itself. The body ends at the <em>last</em> occurrence
     * of the closing delimiter.
     *
     * @throws PatternSyntaxException if no delimiter is found or it is never closed
     */
    public static DelimitedPattern split(final String pattern) {
        int delimiterIndex = -1;
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (isAsciiWhitespace(c)) {
                continue;
            }
            if (c < 0x80 && !isAsciiAlphanumeric(c) && c != '\\') {
                delimiterIndex = i;
            }
            break;
        }
        if (delimiterIndex < 0) {
            throw new PatternSyntaxException(PcreErrorCode.PATTERN_MISSING_DELIMITER, pattern);
        }

        char delimiter = pattern.charAt(delimiterIndex);
        int end = pattern.lastIndexOf(closingDelimiter(delimiter));
        if (end <= delimiterIndex) {
            throw new PatternSyntaxException(PcreErrorCode.PATTERN_UNTERMINATED, pattern);
        }
        return new DelimitedPattern(pattern, delimiter,
                pattern.substring(delimiterIndex + 1, end), pattern.substring(end + 1));
    }

    static char closingDelimiter(final char delimiter) {
        switch (delimiter) {
            case '(':
                return ')';
            case '<':
                return '>';
            case '[':
                return ']';
            case '{':
                return '}';
            default:
                return delimiter;
        }
    }

    private static boolean isAsciiWhitespace(final char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\f' || c == '\r';
    }

    private static boolean isAsciiAlphanumeric(final char c) {
        return (c >= '0' && c <= '9') || (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    public String pattern() {
        return pattern;
    }

    public char delimiter() {
        return delimiter;
    }

    public char closingDelimiter() {
        return closingDelimiter(delimiter);
    }

    public String regex() {
        return regex;
    }

    public String modifiers() {
        return modifiers;
    }

    @Override
    public boolean equals(final Object that) {
        if (!(that instanceof DelimitedPattern)) { return false; }
        final DelimitedPattern other = (DelimitedPattern) that;
        return pattern.equals(other.pattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pattern);
    }

    @Override
    public String toString() {
        return "DelimitedPattern{" +
                "delimiter=" + delimiter +
                ", regex=\"" + regex + '"' +
                ", modifiers=\"" + modifiers + '"' +
                '}';
    }
}
