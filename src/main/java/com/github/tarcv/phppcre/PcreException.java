package com.github.tarcv.phppcre;

/**
 * Base of every failure raised while compiling a PHP PCRE pattern or extracting
 * characters from it. The concrete failure is identified by {@link #getErrorCode()}.
 */
public class PcreException extends RuntimeException {
    private final PcreErrorCode status;

    public PcreException(final PcreErrorCode status, final String message) {
        super(message);
        this.status = status;
    }

    public PcreException(final PcreErrorCode status, final String message, final Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public PcreErrorCode getErrorCode() {
        return status;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "status=" + status +
                ", message=" + getMessage() +
                '}';
    }
}
