package com.github.tarcv.phppcre;

/**
 * Pattern modifiers accepted after the closing delimiter of a PHP PCRE pattern.
 */
public enum Modifier {
    /**
     * {@code i}: enable case insensitive matching.
     */
    CASELESS('i'),

    /**
     * {@code m}: control behavior of "$" and "^".
     * If set, recognize line terminators within the subject,
     * otherwise, match only at start and end of the subject.
     */
    MULTILINE('m'),

    /**
     * {@code s}: if set, '.' matches line terminators,  otherwise '.' matching stops at line end.
     */
    DOTALL('s'),

    /**
     * {@code x}: allow white space and #comments within patterns.
     */
    EXTENDED('x'),

    /**
     * {@code A}: the match is anchored at the start of the subject.
     * Accepted, no effect on the structure of the pattern.
     */
    ANCHORED('A'),

    /**
     * {@code D}: "$" matches only at the very end of the subject.
     * Accepted, no effect on the structure of the pattern.
     */
    DOLLAR_END_ONLY('D'),

    /**
     * {@code S}: spend more time studying the pattern. Accepted, no effect.
     */
    SPEEDUP('S'),

    /**
     * {@code U}: invert the greediness of all quantifiers.
     */
    UNGREEDY('U'),

    /**
     * {@code X}: historic PCRE extra checks. Accepted, no effect.
     */
    EXTRA('X'),

    /**
     * {@code u}: treat pattern and subject as UTF-8.
     * Accepted, patterns are always handled as Unicode here.
     */
    UTF8('u'),

    /**
     * {@code J}: allow duplicate names for subpatterns.
     * Recognized only to be rejected, since it changes capture group numbering.
     */
    INFO_JCHANGED('J');

    final char letter;

    Modifier(final char letter) {
        this.letter = letter;
    }

    public char letter() {
        return letter;
    }

    static Modifier fromLetter(final int letter) {
        for (Modifier modifier : values()) {
            if (modifier.letter == letter) {
                return modifier;
            }
        }
        return null;
    }
}
