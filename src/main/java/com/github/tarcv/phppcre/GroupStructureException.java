package com.github.tarcv.phppcre;

/**
 * The located group exists, but its body is not a repetition of single characters.
 * The cause, when present, is the {@link CharacterSetStructureException} naming the node that
 * could not be enumerated.
 */
public class GroupStructureException extends PcreException {
    private final String pattern;
    private final int index;

    public GroupStructureException(final String pattern, final int index, final Throwable cause) {
        super(PcreErrorCode.GROUP_STRUCTURE,
                "group " + index + " of invalid structure in pattern: \"" + pattern + "\"", cause);
        this.pattern = pattern;
        this.index = index;
    }

    public String getPattern() {
        return pattern;
    }

    public int getIndex() {
        return index;
    }
}
