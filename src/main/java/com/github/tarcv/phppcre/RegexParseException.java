package com.github.tarcv.phppcre;

public class RegexParseException extends PcreException {
    private final int line;
    private final int offset;
    private final char[] preContext;
    private final char[] postContext;

    public RegexParseException(PcreErrorCode errorCode, String message, int line, int offset, char[] preContext, char[] postContext) {
        super(errorCode, "invalid PHP PCRE regex: " + message + " at line " + line + ", offset " + offset);
        this.line = line;
        this.offset = offset;
        this.preContext = preContext;
        this.postContext = postContext;
    }

    /**
     * @return 1-based line of the offending position
     */
    public int getLine() {
        return line;
    }

    /**
     * @return 1-based column of the offending position within {@link #getLine()}
     */
    public int getOffset() {
        return offset;
    }

    public char[] getPreContext() {
        return preContext.clone();
    }

    public char[] getPostContext() {
        return postContext.clone();
    }
}
