package com.github.tarcv.phppcre;

import com.ibm.icu.text.UnicodeSet;
import com.ibm.icu.text.UnicodeSetIterator;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The characters a wiki glues onto the text of a link, as configured by the site's link trail
 * pattern, e.g. {@code /^([a-z]+)(.*)$/sD}.
 * <p>
 * The alphabet is taken from the repeated body of the pattern's first capturing group.
 */
public final class LinkTrail {
    private static final Logger LOGGER = Logger.getLogger(LinkTrail.class.getName());

    /**
     * Number of the capturing group holding the trail.
     */
    public static final int GROUP_INDEX = 1;

    /**
     * Larger alphabets are only logged by size.
     */
    private static final int MAX_LOGGED_CHARACTERS = 1 << 7;

    private final String pattern;
    private final UnicodeSet characters;

    private LinkTrail(final String pattern, final UnicodeSet characters) {
        this.pattern = pattern;
        this.characters = characters;
    }

    /**
     * Compiles {@code pattern} and extracts the link trail alphabet from group
     * {@value #GROUP_INDEX}.
     *
     * @throws PatternSyntaxException if the delimiters are missing or unbalanced
     * @throws ModifierException if a modifier is unknown or unsupported
     * @throws RegexParseException if the expression between the delimiters is invalid
     * @throws GroupNotFoundException if the pattern has no group {@value #GROUP_INDEX}
     * @throws GroupStructureException if the group does not repeat single characters
     */
    public static LinkTrail extract(final String pattern) {
        PhpPattern compiled = PhpPattern.compile(pattern);

        Hir.Group group = compiled.group(GROUP_INDEX)
                .orElseThrow(() -> new GroupNotFoundException(pattern, GROUP_INDEX));
        LOGGER.fine(() -> String.format("repeated = %s", CharacterSetEnumerator.repeatedBody(group)));

        UnicodeSet characters;
        try {
            characters = CharacterSetEnumerator.enumerateGroup(group);
        } catch (CharacterSetStructureException e) {
            throw new GroupStructureException(pattern, GROUP_INDEX, e);
        }

        if (LOGGER.isLoggable(Level.FINE)) {
            if (characters.size() <= MAX_LOGGED_CHARACTERS) {
                LOGGER.fine(String.format("link trail: (%d) %s", characters.size(), characters.toPattern(true)));
            } else {
                LOGGER.fine(String.format("link trail: (%d)", characters.size()));
            }
        }
        return new LinkTrail(pattern, characters);
    }

    public String pattern() {
        return pattern;
    }

    /**
     * @return the alphabet, frozen
     */
    public UnicodeSet characters() {
        return characters;
    }

    public int size() {
        return characters.size();
    }

    public boolean contains(final int codePoint) {
        return characters.contains(codePoint);
    }

    public boolean isEmpty() {
        return characters.isEmpty();
    }

    /**
     * @return every character of the alphabet once, in ascending code point order
     */
    @Override
    public String toString() {
        StringBuilder text = new StringBuilder(characters.size());
        UnicodeSetIterator it = new UnicodeSetIterator(characters);
        while (it.nextRange()) {
            for (int c = it.codepoint; c <= it.codepointEnd; c++) {
                text.appendCodePoint(c);
            }
        }
        return text.toString();
    }

    @Override
    public boolean equals(final Object that) {
        if (!(that instanceof LinkTrail)) { return false; }
        final LinkTrail other = (LinkTrail) that;
        return pattern.equals(other.pattern) && characters.equals(other.characters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pattern, characters);
    }
}
