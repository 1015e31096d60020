package com.github.tarcv.phppcre;

/**
 * The delimited envelope of a pattern is malformed: no delimiter could be found,
 * or the closing delimiter is missing.
 */
public class PatternSyntaxException extends PcreException {
    private final String pattern;

    public PatternSyntaxException(final PcreErrorCode errorCode, final String pattern) {
        super(errorCode, describe(errorCode) + ": \"" + pattern + "\"");
        this.pattern = pattern;
    }

    public String getPattern() {
        return pattern;
    }

    private static String describe(final PcreErrorCode errorCode) {
        switch (errorCode) {
            case PATTERN_MISSING_DELIMITER:
                return "invalid PHP PCRE pattern, no delimiter";
            case PATTERN_UNTERMINATED:
                return "invalid PHP PCRE pattern, no ending delimiter";
            default:
                return "invalid PHP PCRE pattern";
        }
    }
}
