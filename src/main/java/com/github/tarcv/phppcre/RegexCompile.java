package com.github.tarcv.phppcre;

import com.ibm.icu.text.UnicodeSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.github.tarcv.phppcre.Modifier.*;
import static com.github.tarcv.phppcre.PcreErrorCode.*;

/**
 * Compiles the body of a PHP PCRE pattern into a {@link Hir} tree.
 * <p>
 * This is a recursive descent parser: one method per precedence level
 * (alternation, concatenation, quantified atom, atom), with modifiers applied while the
 * nodes are built. Instances are single use.
 */
final class RegexCompile {
    static final int U_PARSE_CONTEXT_LEN = 16;

    /**
     * Largest bound accepted in a {min,max} quantifier.
     */
    static final int MAX_REPEAT = 65535;

    private final RegexStaticSets fStaticSets = RegexStaticSets.INSTANCE;

    private final String fRXPat;
    private final int fPatLength;
    private int fScanIndex = 0;

    // Modifiers in effect at the current scan position. Changed by inline (?flags).
    private EnumSet<Modifier> fModeFlags;

    private int fCaptureCount = 0;
    private final Map<String, Integer> fNamedCaptureMap = new LinkedHashMap<>();

    RegexCompile(final String regex, final Modifiers modifiers) {
        this.fRXPat = regex;
        this.fPatLength = regex.length();
        this.fModeFlags = EnumSet.noneOf(Modifier.class);
        this.fModeFlags.addAll(modifiers.flags());
    }

    /**
     * Parses {@code regex} with the semantic options of {@code modifiers}.
     *
     * @throws RegexParseException if the body is not a valid expression
     */
    static Hir compile(final String regex, final Modifiers modifiers) {
        return new RegexCompile(regex, modifiers).compile();
    }

    Hir compile() {
        Hir result = parseAlternation();
        if (fScanIndex < fPatLength) {
            // parseAlternation() only stops early at a ')'
            throw error(REGEX_MISMATCHED_PAREN, "unopened group", fScanIndex);
        }
        return result;
    }

    /**
     * @return number of capturing groups seen so far
     */
    int captureCount() {
        return fCaptureCount;
    }

    Map<String, Integer> namedCaptureMap() {
        return Collections.unmodifiableMap(fNamedCaptureMap);
    }

    //------------------------------------------------------------------------------
    //
    //   Scanning
    //
    //------------------------------------------------------------------------------

    private boolean isSet(final Modifier flag) {
        return fModeFlags.contains(flag);
    }

    /**
     * Advance past white space and #comments when the extended modifier is on.
     */
    private void skipSpaceAndComments() {
        if (!isSet(EXTENDED)) {
            return;
        }
        while (fScanIndex < fPatLength) {
            char c = fRXPat.charAt(fScanIndex);
            if (c == '#') {
                int eol = fRXPat.indexOf('\n', fScanIndex);
                fScanIndex = eol < 0 ? fPatLength : eol + 1;
            } else if (RegexStaticSets.gExtendedSpaceChars.indexOf(c) >= 0) {
                fScanIndex++;
            } else {
                break;
            }
        }
    }

    private int peekChar() {
        skipSpaceAndComments();
        return fScanIndex < fPatLength ? fRXPat.codePointAt(fScanIndex) : -1;
    }

    private boolean nextCharIf(final char matching) {
        skipSpaceAndComments();
        return nextRawIf(matching);
    }

    /**
     * Like {@link #nextCharIf(char)}, but white space is significant.
     */
    private boolean nextRawIf(final char matching) {
        if (fScanIndex < fPatLength && fRXPat.charAt(fScanIndex) == matching) {
            fScanIndex++;
            return true;
        }
        return false;
    }

    private int rawCharAt(final int index) {
        return index < fPatLength ? fRXPat.charAt(index) : -1;
    }

    private int nextCodePoint() {
        int c = fRXPat.codePointAt(fScanIndex);
        fScanIndex += Character.charCount(c);
        return c;
    }

    private static boolean isDigit(final int c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAsciiAlphanumeric(final int c) {
        return isDigit(c) || (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    /**
     * @return whether a quantifier starts at the current (already skipped) position
     */
    private boolean atQuantifier() {
        int c = rawCharAt(fScanIndex);
        return c == '*' || c == '+' || c == '?' || (c == '{' && isDigit(rawCharAt(fScanIndex + 1)));
    }

    //------------------------------------------------------------------------------
    //
    //   Expressions
    //
    //------------------------------------------------------------------------------

    private Hir parseAlternation() {
        List<Hir> alternatives = new ArrayList<>();
        alternatives.add(parseConcatenation());
        while (nextCharIf('|')) {
            int barIndex = fScanIndex - 1;
            if (alternatives.get(alternatives.size() - 1).kind() == Hir.Kind.EMPTY) {
                throw error(REGEX_EMPTY_ALTERNATE, "alternation with an empty alternative", barIndex);
            }
            Hir next = parseConcatenation();
            if (next.kind() == Hir.Kind.EMPTY) {
                throw error(REGEX_EMPTY_ALTERNATE, "alternation with an empty alternative", barIndex);
            }
            alternatives.add(next);
        }
        return Hir.alternation(alternatives);
    }

    private Hir parseConcatenation() {
        List<Hir> items = new ArrayList<>();
        int c;
        while ((c = peekChar()) != -1 && c != '|' && c != ')') {
            Hir item = parseQuantified(items);
            if (item != null) {
                items.add(item);
            }
        }
        return Hir.concat(items);
    }

    /**
     * @param items the enclosing concatenation. All but the last character of a
     *              {@code \Q...\E} sequence are added to it directly, so that a quantifier
     *              binds to the last quoted character only.
     * @return the atom with any quantifiers applied, or {@code null} if the atom produced
     *         nothing, e.g. a comment or an inline flag setting
     */
    private Hir parseQuantified(final List<Hir> items) {
        Hir atom = fRXPat.startsWith("\\Q", fScanIndex) ? parseQuotedSequence(items) : parseAtom();
        skipSpaceAndComments();
        if (!atQuantifier()) {
            return atom;
        }
        if (atom == null) {
            throw error(REGEX_RULE_SYNTAX, "quantifier does not follow a repeatable item", fScanIndex);
        }

        int min;
        int max;
        int c = fRXPat.charAt(fScanIndex);
        switch (c) {
            case '*':
                fScanIndex++;
                min = 0;
                max = Hir.Repetition.UNBOUNDED;
                break;
            case '+':
                fScanIndex++;
                min = 1;
                max = Hir.Repetition.UNBOUNDED;
                break;
            case '?':
                fScanIndex++;
                min = 0;
                max = 1;
                break;
            default: {
                fScanIndex++;
                min = parseRepeatBound();
                if (nextRawIf(',')) {
                    max = isDigit(rawCharAt(fScanIndex)) ? parseRepeatBound() : Hir.Repetition.UNBOUNDED;
                } else {
                    max = min;
                }
                if (rawCharAt(fScanIndex) != '}') {
                    throw error(REGEX_BAD_INTERVAL, "malformed {min,max} quantifier", fScanIndex);
                }
                if (max != Hir.Repetition.UNBOUNDED && max < min) {
                    throw error(REGEX_MAX_LT_MIN, "{min,max} quantifier with max less than min", fScanIndex);
                }
                fScanIndex++;
            }
        }

        boolean lazy = nextRawIf('?');
        if (!lazy && rawCharAt(fScanIndex) == '+') {
            throw error(REGEX_UNIMPLEMENTED, "possessive quantifiers are not supported", fScanIndex);
        }
        skipSpaceAndComments();
        if (atQuantifier()) {
            throw error(REGEX_RULE_SYNTAX, "quantifier does not follow a repeatable item", fScanIndex);
        }

        // The ungreedy modifier swaps the meaning of the '?' suffix.
        boolean greedy = lazy == isSet(UNGREEDY);
        return new Hir.Repetition(atom, min, max, greedy);
    }

    private int parseRepeatBound() {
        int start = fScanIndex;
        long value = 0;
        while (isDigit(rawCharAt(fScanIndex))) {
            if (value <= MAX_REPEAT) {
                value = value * 10 + (fRXPat.charAt(fScanIndex) - '0');
            }
            fScanIndex++;
        }
        if (fScanIndex == start) {
            throw error(REGEX_BAD_INTERVAL, "malformed {min,max} quantifier", fScanIndex);
        }
        if (value > MAX_REPEAT) {
            throw error(REGEX_NUMBER_TOO_BIG, "quantifier bound larger than " + MAX_REPEAT, start);
        }
        return (int) value;
    }

    private Hir parseAtom() {
        int c = peekChar();
        switch (c) {
            case '(':
                return parseGroup();
            case '[':
                return new Hir.CharClass(parseClass());
            case '.':
                fScanIndex++;
                return new Hir.CharClass(isSet(DOTALL) ? fStaticSets.fAnyChar : fStaticSets.fAnyCharNoNewline);
            case '^':
                fScanIndex++;
                return new Hir.Anchor(isSet(MULTILINE) ? Hir.AnchorKind.START_LINE : Hir.AnchorKind.START_TEXT);
            case '$':
                fScanIndex++;
                return new Hir.Anchor(isSet(MULTILINE) ? Hir.AnchorKind.END_LINE : Hir.AnchorKind.END_TEXT);
            case '\\':
                return parseEscape();
            default:
                if (atQuantifier()) {
                    throw error(REGEX_RULE_SYNTAX, "quantifier does not follow a repeatable item", fScanIndex);
                }
                nextCodePoint();
                return literal(c);
        }
    }

    private Hir literal(final int c) {
        if (isSet(CASELESS)) {
            UnicodeSet variants = caseClosure(new UnicodeSet(c, c));
            if (variants.size() > 1) {
                return new Hir.CharClass(variants);
            }
        }
        return new Hir.Literal(c);
    }

    private static UnicodeSet caseClosure(final UnicodeSet set) {
        return new UnicodeSet(set).closeOver(UnicodeSet.CASE_INSENSITIVE).removeAllStrings();
    }

    //------------------------------------------------------------------------------
    //
    //   Groups
    //
    //------------------------------------------------------------------------------

    private Hir parseGroup() {
        final int openParen = fScanIndex;
        fScanIndex++;

        final EnumSet<Modifier> savedFlags = EnumSet.copyOf(fModeFlags);
        Hir.GroupKind kind = Hir.GroupKind.CAPTURING;
        String name = null;

        if (nextRawIf('?')) {
            int c = rawCharAt(fScanIndex);
            switch (c) {
                case -1:
                    throw error(REGEX_MISMATCHED_PAREN, "missing closing parenthesis", fScanIndex);
                case '#': {
                    int close = fRXPat.indexOf(')', fScanIndex);
                    if (close < 0) {
                        throw error(REGEX_MISMATCHED_PAREN, "missing ) after comment", fPatLength);
                    }
                    fScanIndex = close + 1;
                    return null;
                }
                case ':':
                    fScanIndex++;
                    kind = Hir.GroupKind.NON_CAPTURING;
                    break;
                case 'P':
                    fScanIndex++;
                    if (rawCharAt(fScanIndex) != '<') {
                        throw error(REGEX_UNIMPLEMENTED, "named back references and subroutine calls are not supported",
                                openParen);
                    }
                    fScanIndex++;
                    kind = Hir.GroupKind.NAMED_CAPTURING;
                    name = parseGroupName('>');
                    break;
                case '<': {
                    int next = rawCharAt(fScanIndex + 1);
                    if (next == '=' || next == '!') {
                        throw error(REGEX_UNIMPLEMENTED, "look-behind assertions are not supported", openParen);
                    }
                    fScanIndex++;
                    kind = Hir.GroupKind.NAMED_CAPTURING;
                    name = parseGroupName('>');
                    break;
                }
                case '\'':
                    fScanIndex++;
                    kind = Hir.GroupKind.NAMED_CAPTURING;
                    name = parseGroupName('\'');
                    break;
                case '=':
                case '!':
                    throw error(REGEX_UNIMPLEMENTED, "look-ahead assertions are not supported", openParen);
                case '>':
                    throw error(REGEX_UNIMPLEMENTED, "atomic groups are not supported", openParen);
                case '|':
                    throw error(REGEX_UNIMPLEMENTED, "branch reset groups are not supported", openParen);
                case '(':
                    throw error(REGEX_UNIMPLEMENTED, "conditional groups are not supported", openParen);
                default:
                    if (c == 'R' || c == '&' || c == '+' || isDigit(c)) {
                        throw error(REGEX_UNIMPLEMENTED, "recursion and subroutine calls are not supported", openParen);
                    }
                    if (parseInlineFlags()) {
                        // (?flags) stays in effect until the end of the enclosing group
                        return null;
                    }
                    kind = Hir.GroupKind.NON_CAPTURING;
            }
        }

        int index = 0;
        if (kind != Hir.GroupKind.NON_CAPTURING) {
            index = ++fCaptureCount;
            if (name != null) {
                fNamedCaptureMap.put(name, index);
            }
        }

        Hir body = parseAlternation();
        if (!nextCharIf(')')) {
            throw error(REGEX_MISMATCHED_PAREN, "missing closing parenthesis", fScanIndex);
        }
        fModeFlags = savedFlags;
        return new Hir.Group(kind, index, name, body);
    }

    /**
     * Parses the flag letters of {@code (?imsxU-imsxU)} or {@code (?imsxU-imsxU:...)} and applies
     * them to the current mode.
     *
     * @return true if the group ended after the flags, false if a ':' introduced a group body
     */
    private boolean parseInlineFlags() {
        boolean negate = false;
        while (true) {
            int flagIndex = fScanIndex;
            int c = rawCharAt(fScanIndex);
            if (c == -1) {
                throw error(REGEX_MISMATCHED_PAREN, "missing closing parenthesis", fScanIndex);
            }
            fScanIndex++;
            if (c == ')') {
                return true;
            }
            if (c == ':') {
                return false;
            }
            if (c == '-' && !negate) {
                negate = true;
                continue;
            }
            Modifier flag = inlineFlag(c);
            if (flag == null) {
                throw error(REGEX_INVALID_FLAG, "unrecognized inline flag", flagIndex);
            }
            if (negate) {
                fModeFlags.remove(flag);
            } else {
                fModeFlags.add(flag);
            }
        }
    }

    private static Modifier inlineFlag(final int c) {
        switch (c) {
            case 'i':
                return CASELESS;
            case 'm':
                return MULTILINE;
            case 's':
                return DOTALL;
            case 'x':
                return EXTENDED;
            case 'U':
                return UNGREEDY;
            default:
                return null;
        }
    }

    private String parseGroupName(final char terminator) {
        int start = fScanIndex;
        int end = fRXPat.indexOf(terminator, start);
        if (end < 0) {
            throw error(REGEX_INVALID_CAPTURE_GROUP_NAME, "unterminated group name", start);
        }
        String name = fRXPat.substring(start, end);
        boolean valid = !name.isEmpty() && !isDigit(name.charAt(0));
        for (int i = 0; valid && i < name.length(); i++) {
            char c = name.charAt(i);
            valid = isAsciiAlphanumeric(c) || c == '_';
        }
        if (!valid) {
            throw error(REGEX_INVALID_CAPTURE_GROUP_NAME, "invalid group name", start);
        }
        if (fNamedCaptureMap.containsKey(name)) {
            throw error(REGEX_INVALID_CAPTURE_GROUP_NAME, "duplicate group name", start);
        }
        fScanIndex = end + 1;
        return name;
    }

    //------------------------------------------------------------------------------
    //
    //   Escapes
    //
    //------------------------------------------------------------------------------

    /**
     * Parses a backslash sequence outside of a bracket expression.
     */
    private Hir parseEscape() {
        final int escapeStart = fScanIndex;
        fScanIndex++;
        if (fScanIndex >= fPatLength) {
            throw error(REGEX_BAD_ESCAPE_SEQUENCE, "pattern may not end with backslash", escapeStart);
        }
        int c = nextCodePoint();
        switch (c) {
            case 'b':
                return new Hir.WordBoundary(false);
            case 'B':
                return new Hir.WordBoundary(true);
            case 'A':
                return new Hir.Anchor(Hir.AnchorKind.START_TEXT);
            case 'z':
                return new Hir.Anchor(Hir.AnchorKind.END_TEXT);
            case 'Z':
                return new Hir.Anchor(Hir.AnchorKind.END_TEXT_OR_NEWLINE);
            case 'E':
                // A stray \E is ignored.
                return null;
            default:
                UnicodeSet set = escapeSet(c, escapeStart);
                if (set != null) {
                    return new Hir.CharClass(set);
                }
                return literal(escapeCodePoint(c, escapeStart, false));
        }
    }

    /**
     * Parses {@code \Q...\E} starting at the backslash.
     *
     * @return the last quoted character, or {@code null} if nothing was quoted
     */
    private Hir parseQuotedSequence(final List<Hir> items) {
        fScanIndex += 2;
        List<Integer> quoted = quotedSequence();
        if (quoted.isEmpty()) {
            return null;
        }
        for (int q : quoted.subList(0, quoted.size() - 1)) {
            items.add(literal(q));
        }
        return literal(quoted.get(quoted.size() - 1));
    }

    /**
     * Reads the code points following {@code \Q} up to {@code \E} or the end of the pattern.
     */
    private List<Integer> quotedSequence() {
        List<Integer> quoted = new ArrayList<>();
        while (fScanIndex < fPatLength) {
            if (fRXPat.startsWith("\\E", fScanIndex)) {
                fScanIndex += 2;
                break;
            }
            quoted.add(nextCodePoint());
        }
        return quoted;
    }

    /**
     * @param c the character after the backslash, already consumed
     * @return the set for a class escape ({@code \d}, {@code \p{..}}, ...), or {@code null}
     *         if {@code c} does not start one
     */
    private UnicodeSet escapeSet(final int c, final int escapeStart) {
        if (c == 'p' || c == 'P') {
            return parseProperty(c == 'P', escapeStart);
        }
        return fStaticSets.escapeClass(c);
    }

    private UnicodeSet parseProperty(final boolean negated, final int escapeStart) {
        String name;
        if (nextRawIf('{')) {
            int close = fRXPat.indexOf('}', fScanIndex);
            if (close < 0) {
                throw error(REGEX_PROPERTY_SYNTAX, "missing } after property name", escapeStart);
            }
            name = fRXPat.substring(fScanIndex, close);
            fScanIndex = close + 1;
        } else if (fScanIndex < fPatLength) {
            name = new String(Character.toChars(nextCodePoint()));
        } else {
            throw error(REGEX_PROPERTY_SYNTAX, "missing property name", escapeStart);
        }

        boolean complement = negated;
        if (name.startsWith("^")) {
            complement = !complement;
            name = name.substring(1);
        }
        if ("L&".equals(name)) {
            name = "LC";
        }
        if (name.isEmpty() || !name.matches("[A-Za-z0-9_ =.-]+")) {
            throw error(REGEX_PROPERTY_SYNTAX, "invalid property name", escapeStart);
        }

        UnicodeSet set;
        try {
            set = new UnicodeSet("[\\p{" + name + "}]");
        } catch (IllegalArgumentException e) {
            throw error(REGEX_PROPERTY_SYNTAX, "unknown property " + name, escapeStart);
        }
        if (isSet(CASELESS)) {
            set = caseClosure(set);
        }
        set.removeAll(fStaticSets.fSurrogates);
        return complement ? fStaticSets.complement(set) : set.freeze();
    }

    /**
     * Decodes an escape that stands for a single code point.
     *
     * @param c the character after the backslash, already consumed
     * @param insideClass whether the escape appears in a bracket expression
     */
    private int escapeCodePoint(final int c, final int escapeStart, final boolean insideClass) {
        switch (c) {
            case 'a':
                return 0x07;
            case 'b':
                if (insideClass) {
                    return 0x08;
                }
                break;
            case 'e':
                return 0x1b;
            case 'f':
                return 0x0c;
            case 'n':
                return 0x0a;
            case 'r':
                return 0x0d;
            case 't':
                return 0x09;
            case 'c': {
                int control = rawCharAt(fScanIndex);
                if (control < 0x20 || control > 0x7e) {
                    throw error(REGEX_BAD_ESCAPE_SEQUENCE, "\\c must be followed by a printable ASCII character",
                            escapeStart);
                }
                fScanIndex++;
                return Character.toUpperCase(control) ^ 0x40;
            }
            case 'x':
                if (nextRawIf('{')) {
                    return parseBracedNumber(16, escapeStart);
                }
                return parseFixedNumber(16, 2);
            case 'o':
                if (!nextRawIf('{')) {
                    throw error(REGEX_BAD_ESCAPE_SEQUENCE, "\\o must be followed by {", escapeStart);
                }
                return parseBracedNumber(8, escapeStart);
            case '0':
                return parseFixedNumber(8, 2);
            case 'g':
            case 'k':
                throw error(REGEX_UNIMPLEMENTED, "back references are not supported", escapeStart);
            case 'G':
            case 'K':
            case 'R':
            case 'X':
            case 'C':
            case 'N':
                throw error(REGEX_UNIMPLEMENTED, "unsupported escape sequence", escapeStart);
            default:
                if (c >= '1' && c <= '9') {
                    throw error(REGEX_UNIMPLEMENTED, "back references are not supported", escapeStart);
                }
                if (!isAsciiAlphanumeric(c)) {
                    return c;
                }
        }
        throw error(REGEX_BAD_ESCAPE_SEQUENCE, "unrecognized escape sequence", escapeStart);
    }

    private int parseFixedNumber(final int radix, final int maxDigits) {
        int value = 0;
        for (int i = 0; i < maxDigits && Character.digit(rawCharAt(fScanIndex), radix) >= 0; i++) {
            value = value * radix + Character.digit(fRXPat.charAt(fScanIndex), radix);
            fScanIndex++;
        }
        return value;
    }

    private int parseBracedNumber(final int radix, final int escapeStart) {
        int start = fScanIndex;
        long value = 0;
        while (Character.digit(rawCharAt(fScanIndex), radix) >= 0) {
            if (value <= Character.MAX_CODE_POINT) {
                value = value * radix + Character.digit(fRXPat.charAt(fScanIndex), radix);
            }
            fScanIndex++;
        }
        if (fScanIndex == start || !nextRawIf('}')) {
            throw error(REGEX_BAD_ESCAPE_SEQUENCE, "malformed character code", escapeStart);
        }
        if (value > Character.MAX_CODE_POINT || (value >= 0xd800 && value <= 0xdfff)) {
            throw error(REGEX_BAD_ESCAPE_SEQUENCE, "character code is not a Unicode scalar value", escapeStart);
        }
        return (int) value;
    }

    //------------------------------------------------------------------------------
    //
    //   Bracket expressions
    //
    //------------------------------------------------------------------------------

    /**
     * Parses {@code [...]} starting at the opening bracket. White space is always significant
     * inside the brackets.
     *
     * @return the frozen set of matched code points, with case closure and negation applied
     */
    private UnicodeSet parseClass() {
        fScanIndex++;
        final boolean negated = nextRawIf('^');
        final UnicodeSet set = new UnicodeSet();

        boolean first = true;
        while (true) {
            if (fScanIndex >= fPatLength) {
                throw error(REGEX_MISSING_CLOSE_BRACKET, "missing terminating ] for character class", fScanIndex);
            }
            final int itemStart = fScanIndex;
            int c = fRXPat.codePointAt(fScanIndex);
            if (c == ']' && !first) {
                fScanIndex++;
                break;
            }
            first = false;

            UnicodeSet posix = parsePosixClass();
            if (posix != null) {
                set.addAll(posix);
                rejectRangeAfterClass();
                continue;
            }
            if (fRXPat.startsWith("\\Q", fScanIndex)) {
                fScanIndex += 2;
                for (int q : quotedSequence()) {
                    set.add(q);
                }
                continue;
            }
            if (fRXPat.startsWith("\\E", fScanIndex)) {
                fScanIndex += 2;
                continue;
            }

            int low;
            if (c == '\\') {
                int escaped = nextClassEscape();
                UnicodeSet escapedSet = escapeSet(escaped, itemStart);
                if (escapedSet != null) {
                    set.addAll(escapedSet);
                    rejectRangeAfterClass();
                    continue;
                }
                low = escapeCodePoint(escaped, itemStart, true);
            } else {
                low = nextCodePoint();
            }

            if (rawCharAt(fScanIndex) == '-' && fScanIndex + 1 < fPatLength && rawCharAt(fScanIndex + 1) != ']') {
                fScanIndex++;
                final int highStart = fScanIndex;
                int high;
                List<Integer> quotedTail = Collections.emptyList();
                if (fRXPat.startsWith("\\Q", fScanIndex)) {
                    fScanIndex += 2;
                    List<Integer> quoted = quotedSequence();
                    if (quoted.isEmpty()) {
                        throw error(REGEX_INVALID_RANGE, "invalid range in character class", highStart);
                    }
                    // [a-\Qzx\E] is the range a-z followed by x
                    high = quoted.get(0);
                    quotedTail = quoted.subList(1, quoted.size());
                } else if (rawCharAt(fScanIndex) == '\\') {
                    int escaped = nextClassEscape();
                    if (escaped == 'd' || escaped == 'D' || escaped == 'w' || escaped == 'W'
                            || escaped == 's' || escaped == 'S' || escaped == 'h' || escaped == 'H'
                            || escaped == 'v' || escaped == 'V' || escaped == 'p' || escaped == 'P') {
                        throw error(REGEX_INVALID_RANGE, "invalid range in character class", highStart);
                    }
                    high = escapeCodePoint(escaped, highStart, true);
                } else if (fRXPat.startsWith("[:", fScanIndex) && parsePosixClass() != null) {
                    throw error(REGEX_INVALID_RANGE, "invalid range in character class", highStart);
                } else {
                    high = nextCodePoint();
                }
                if (low > high) {
                    throw error(REGEX_INVALID_RANGE, "range out of order in character class", itemStart);
                }
                set.add(low, high);
                for (int q : quotedTail) {
                    set.add(q);
                }
            } else {
                set.add(low);
            }
        }

        UnicodeSet result = isSet(CASELESS) ? caseClosure(set) : set;
        result.removeAll(fStaticSets.fSurrogates);
        return negated ? fStaticSets.complement(result) : result.freeze();
    }

    /**
     * Consumes a backslash inside a bracket expression and the character after it.
     */
    private int nextClassEscape() {
        final int escapeStart = fScanIndex;
        fScanIndex++;
        if (fScanIndex >= fPatLength) {
            throw error(REGEX_BAD_ESCAPE_SEQUENCE, "pattern may not end with backslash", escapeStart);
        }
        int c = nextCodePoint();
        if (c == 'A' || c == 'z' || c == 'Z' || c == 'B') {
            throw error(REGEX_BAD_ESCAPE_SEQUENCE, "escape sequence is invalid in character class", escapeStart);
        }
        return c;
    }

    private void rejectRangeAfterClass() {
        if (rawCharAt(fScanIndex) == '-' && fScanIndex + 1 < fPatLength && rawCharAt(fScanIndex + 1) != ']') {
            throw error(REGEX_INVALID_RANGE, "invalid range in character class", fScanIndex);
        }
    }

    /**
     * Parses {@code [:name:]} or {@code [:^name:]} at the current position.
     *
     * @return the class, or {@code null} (consuming nothing) if the text is not in that form,
     *         in which case the '[' is an ordinary character
     */
    private UnicodeSet parsePosixClass() {
        if (!fRXPat.startsWith("[:", fScanIndex)) {
            return null;
        }
        int nameStart = fScanIndex + 2;
        boolean negated = rawCharAt(nameStart) == '^';
        if (negated) {
            nameStart++;
        }
        int nameEnd = nameStart;
        while (nameEnd < fPatLength && Character.isLetter(fRXPat.charAt(nameEnd))) {
            nameEnd++;
        }
        if (nameEnd == nameStart || !fRXPat.startsWith(":]", nameEnd)) {
            return null;
        }
        String name = fRXPat.substring(nameStart, nameEnd);
        UnicodeSet set = fStaticSets.fPosixSets.get(name);
        if (set == null) {
            throw error(REGEX_RULE_SYNTAX, "unknown POSIX class name", fScanIndex);
        }
        fScanIndex = nameEnd + 2;
        return negated ? fStaticSets.complement(set) : set;
    }

    //------------------------------------------------------------------------------
    //
    //   Errors
    //
    //------------------------------------------------------------------------------

    private RegexParseException error(final PcreErrorCode code, final String message, final int position) {
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < position && i < fPatLength; i++) {
            if (fRXPat.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        int contextEnd = Math.min(position, fPatLength);
        char[] preContext = fRXPat.substring(Math.max(0, contextEnd - U_PARSE_CONTEXT_LEN), contextEnd).toCharArray();
        char[] postContext = fRXPat.substring(contextEnd, Math.min(fPatLength, contextEnd + U_PARSE_CONTEXT_LEN))
                .toCharArray();
        return new RegexParseException(code, message, line, position - lineStart + 1, preContext, postContext);
    }
}
