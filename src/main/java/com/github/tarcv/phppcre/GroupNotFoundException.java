package com.github.tarcv.phppcre;

public class GroupNotFoundException extends PcreException {
    private final String pattern;
    private final int index;

    public GroupNotFoundException(final String pattern, final int index) {
        super(PcreErrorCode.GROUP_NOT_FOUND, "group " + index + " not found in pattern: \"" + pattern + "\"");
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
