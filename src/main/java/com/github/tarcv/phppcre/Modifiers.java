package com.github.tarcv.phppcre;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import static com.github.tarcv.phppcre.Modifier.*;

/**
 * The set of modifiers of a PHP PCRE pattern. Immutable.
 */
public final class Modifiers {
    public static final Modifiers NONE = new Modifiers(EnumSet.noneOf(Modifier.class));

    private final Set<Modifier> fFlags;

    private Modifiers(final EnumSet<Modifier> flags) {
        this.fFlags = Collections.unmodifiableSet(flags);
    }

    /**
     * @throws ModifierException {@link PcreErrorCode#MODIFIER_UNSUPPORTED} if {@code flags}
     *         contains {@link Modifier#INFO_JCHANGED}, as {@link #parse(String)} does
     */
    public static Modifiers of(final Collection<Modifier> flags) {
        if (flags.contains(INFO_JCHANGED)) {
            throw new ModifierException(PcreErrorCode.MODIFIER_UNSUPPORTED, INFO_JCHANGED.letter);
        }
        return flags.isEmpty() ? NONE : new Modifiers(EnumSet.copyOf(flags));
    }

    /**
     * Interprets the text following the closing delimiter.
     * <p>
     * Newlines, carriage returns and spaces are skipped. Repeating a letter has no
     * further effect.
     *
     * @param text the modifier letters
     * @return the parsed modifiers
     * @throws ModifierException {@link PcreErrorCode#MODIFIER_UNRECOGNIZED} for the first unknown
     *         character, or {@link PcreErrorCode#MODIFIER_UNSUPPORTED} when {@code J} is present
     */
    public static Modifiers parse(final String text) {
        EnumSet<Modifier> flags = EnumSet.noneOf(Modifier.class);
        int i = 0;
        while (i < text.length()) {
            int c = text.codePointAt(i);
            i += Character.charCount(c);
            if (c == '\n' || c == '\r' || c == ' ') {
                continue;
            }
            Modifier modifier = Modifier.fromLetter(c);
            if (modifier == null) {
                throw new ModifierException(PcreErrorCode.MODIFIER_UNRECOGNIZED, c);
            }
            flags.add(modifier);
        }
        if (flags.contains(INFO_JCHANGED)) {
            throw new ModifierException(PcreErrorCode.MODIFIER_UNSUPPORTED, INFO_JCHANGED.letter);
        }
        return flags.isEmpty() ? NONE : new Modifiers(flags);
    }

    public boolean contains(final Modifier modifier) {
        return fFlags.contains(modifier);
    }

    public Set<Modifier> flags() {
        return fFlags;
    }

    public boolean isCaseless() {
        return fFlags.contains(CASELESS);
    }

    public boolean isMultiline() {
        return fFlags.contains(MULTILINE);
    }

    public boolean isDotall() {
        return fFlags.contains(DOTALL);
    }

    public boolean isExtended() {
        return fFlags.contains(EXTENDED);
    }

    public boolean isUngreedy() {
        return fFlags.contains(UNGREEDY);
    }

    public boolean isAnchored() {
        return fFlags.contains(ANCHORED);
    }

    public boolean isDollarEndOnly() {
        return fFlags.contains(DOLLAR_END_ONLY);
    }

    public boolean isSpeedup() {
        return fFlags.contains(SPEEDUP);
    }

    public boolean isExtra() {
        return fFlags.contains(EXTRA);
    }

    public boolean isUtf8() {
        return fFlags.contains(UTF8);
    }

    @Override
    public boolean equals(final Object that) {
        if (!(that instanceof Modifiers)) { return false; }
        return fFlags.equals(((Modifiers) that).fFlags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fFlags);
    }

    /**
     * @return the modifiers as PHP letters, in declaration order
     */
    @Override
    public String toString() {
        StringBuilder letters = new StringBuilder();
        for (Modifier modifier : fFlags) {
            letters.append(modifier.letter);
        }
        return letters.toString();
    }
}
