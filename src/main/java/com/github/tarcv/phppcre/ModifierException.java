package com.github.tarcv.phppcre;

public class ModifierException extends PcreException {
    private final int modifier;

    public ModifierException(final PcreErrorCode errorCode, final int modifier) {
        super(errorCode, (errorCode == PcreErrorCode.MODIFIER_UNSUPPORTED ? "unsupported" : "unrecognized")
                + " PHP PCRE modifier: '" + new String(Character.toChars(modifier)) + "'");
        this.modifier = modifier;
    }

    /**
     * @return the offending modifier as a code point
     */
    public int getModifier() {
        return modifier;
    }
}
