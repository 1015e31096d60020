// New code and changes are © 2024 TarCV
// © 2016 and later: Unicode, Inc. and others.
// License & terms of use: http://www.unicode.org/copyright.html
package com.github.tarcv.phppcre;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Class `PhpPattern` represents a compiled PHP PCRE pattern, that is a regular expression
 * written between delimiters and followed by modifiers, e.g. {@code /^([a-z]+)(.*)$/sD}.
 * <p>
 * Compiling produces an immutable {@link Hir} tree that can be interrogated structurally.
 * There is no matching engine.
 */
public final class PhpPattern {
    private static final Logger LOGGER = Logger.getLogger(PhpPattern.class.getName());

    /**
     * The source pattern string, delimiters and modifiers included.
     */
    final DelimitedPattern fPattern;
    /**
     * The modifiers used when compiling the pattern.
     */
    final Modifiers fModifiers;
    /**
     * The compiled tree.
     */
    final Hir fTree;
    /**
     * Number of capturing groups.
     */
    final int fGroupCount;
    /**
     * Map from capture group names to numbers.
     */
    final Map<String, Integer> fNamedCaptureMap;

    private PhpPattern(final DelimitedPattern pattern, final Modifiers modifiers, final RegexCompile compiler) {
        this.fPattern = pattern;
        this.fModifiers = modifiers;
        this.fTree = compiler.compile();
        this.fGroupCount = compiler.captureCount();
        this.fNamedCaptureMap = compiler.namedCaptureMap();
    }

    /**
     * Compiles a delimited PHP PCRE pattern.
     *
     * @param pattern The pattern, e.g. {@code /ab+c/i}.
     * @return      A PhpPattern object for the compiled pattern.
     * @throws PatternSyntaxException if the delimiters are missing or unbalanced
     * @throws ModifierException if a modifier is unknown or unsupported
     * @throws RegexParseException if the expression between the delimiters is invalid
     */
    public static PhpPattern compile(final String pattern) {
        DelimitedPattern delimited = DelimitedPattern.split(pattern);
        Modifiers modifiers = Modifiers.parse(delimited.modifiers());
        PhpPattern compiled = new PhpPattern(delimited, modifiers, new RegexCompile(delimited.regex(), modifiers));
        LOGGER.fine(() -> String.format("pattern %s compiled to Hir(%s), modifiers \"%s\"",
                pattern, compiled.fTree, modifiers));
        return compiled;
    }

    /**
     * Returns the pattern string this pattern was compiled from.
     */
    public String pattern() {
        return fPattern.pattern();
    }

    /**
     * Returns the expression between the delimiters.
     */
    public String regex() {
        return fPattern.regex();
    }

    public char delimiter() {
        return fPattern.delimiter();
    }

    public Modifiers modifiers() {
        return fModifiers;
    }

    public Hir hir() {
        return fTree;
    }

    public int groupCount() {
        return fGroupCount;
    }

    /**
     * Finds a capturing group by number.
     *
     * @param index capture group number, counted from 1
     * @return the group, or empty if the pattern has no such group
     */
    public Optional<Hir.Group> group(final int index) {
        return fTree.findGroup(index);
    }

    /**
     * Get the group number corresponding to a named capture group.
     *
     * @param  groupName   The capture group name.
     * @throws PcreException {@link PcreErrorCode#GROUP_NOT_FOUND} if no group has that name
     */
    public int groupNumberFromName(final String groupName) {
        Integer number = fNamedCaptureMap.get(groupName);
        if (number == null) {
            throw new PcreException(PcreErrorCode.GROUP_NOT_FOUND,
                    "group \"" + groupName + "\" not found in pattern: \"" + pattern() + "\"");
        }
        return number;
    }

    /**
     * Two PhpPattern objects are considered equal if they were compiled from identical pattern
     * strings.
     */
    @Override
    public boolean equals(final Object that) {
        if (!(that instanceof PhpPattern)) { return false; }
        final PhpPattern other = (PhpPattern) that;
        return this.fPattern.equals(other.fPattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fPattern);
    }

    @Override
    public String toString() {
        return "PhpPattern{" +
                "pattern=" + pattern() +
                ", hir=" + fTree +
                ", modifiers=" + fModifiers +
                '}';
    }
}
