package com.github.tarcv.phppcre;

import com.ibm.icu.text.UnicodeSet;

/**
 * Interpret a sub-tree that matches exactly one character into the set of characters it can
 * match.
 * <p>
 * Only alternations of literals and classes, possibly nested in groups, have such a finite
 * alphabet. Every other node makes the enumeration fail with
 * {@link CharacterSetStructureException}.
 */
public final class CharacterSetEnumerator implements Hir.Visitor<UnicodeSet> {
    private static final CharacterSetEnumerator INSTANCE = new CharacterSetEnumerator();

    private CharacterSetEnumerator() {
    }

    /**
     * @return the characters matched by {@code hir}, frozen
     * @throws CharacterSetStructureException if {@code hir} is not an alternative of characters
     */
    public static UnicodeSet enumerate(final Hir hir) {
        return hir.accept(INSTANCE).freeze();
    }

    /**
     * The part of a group that is repeated: the child of a {@link Hir.Repetition} directly inside
     * the group, otherwise the group's child itself.
     */
    public static Hir repeatedBody(final Hir.Group group) {
        Hir child = group.child();
        if (child instanceof Hir.Repetition) {
            return ((Hir.Repetition) child).child();
        }
        return child;
    }

    /**
     * Enumerates the characters of the repeated body of {@code group}. A group with an empty
     * body yields the empty set.
     */
    public static UnicodeSet enumerateGroup(final Hir.Group group) {
        if (group.child().kind() == Hir.Kind.EMPTY) {
            return new UnicodeSet().freeze();
        }
        return enumerate(repeatedBody(group));
    }

    @Override
    public UnicodeSet visitAlternation(final Hir.Alternation alternation) {
        UnicodeSet union = new UnicodeSet();
        for (Hir child : alternation.children()) {
            union.addAll(child.accept(this));
        }
        return union;
    }

    @Override
    public UnicodeSet visitClass(final Hir.CharClass charClass) {
        UnicodeSet set = charClass.set();
        UnicodeSet characters = new UnicodeSet();
        for (int i = 0; i < set.getRangeCount(); i++) {
            characters.add(set.getRangeStart(i), set.getRangeEnd(i));
        }
        return characters;
    }

    @Override
    public UnicodeSet visitGroup(final Hir.Group group) {
        return group.child().accept(this);
    }

    @Override
    public UnicodeSet visitLiteral(final Hir.Literal literal) {
        return new UnicodeSet(literal.codePoint(), literal.codePoint());
    }

    @Override
    public UnicodeSet visitConcat(final Hir.Concat concat) {
        throw new CharacterSetStructureException(concat);
    }

    @Override
    public UnicodeSet visitRepetition(final Hir.Repetition repetition) {
        throw new CharacterSetStructureException(repetition);
    }

    @Override
    public UnicodeSet visitAnchor(final Hir.Anchor anchor) {
        throw new CharacterSetStructureException(anchor);
    }

    @Override
    public UnicodeSet visitWordBoundary(final Hir.WordBoundary wordBoundary) {
        throw new CharacterSetStructureException(wordBoundary);
    }

    @Override
    public UnicodeSet visitEmpty(final Hir.Empty empty) {
        throw new CharacterSetStructureException(empty);
    }
}
