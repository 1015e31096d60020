package com.github.tarcv.phppcre;

public class CharacterSetStructureException extends PcreException {
    private final Hir node;

    public CharacterSetStructureException(final Hir node) {
        super(PcreErrorCode.CHARACTER_SET_STRUCTURE,
                "cannot enumerate characters of " + node.kind() + " node: " + node);
        this.node = node;
    }

    public Hir getNode() {
        return node;
    }
}
