// New code and changes are © 2024 TarCV
// © 2016 and later: Unicode, Inc. and others.
// License & terms of use: http://www.unicode.org/copyright.html
package com.github.tarcv.phppcre;

import com.ibm.icu.text.UnicodeSet;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

enum RegexStaticSets { // 'enum' here implements the singleton pattern
    INSTANCE;  // Ptr to all lazily initialized constant
//   shared sets.

    // "Rule Char" Characters are those with special meaning, and therefore
//    need to be escaped to appear as literals in a regexp.
    final static String gRuleSet_rule_chars = "*?+[(){}^$|\\.";

    //
//  Unicode Set pattern for Regular Expression  \w
//
    final static String gIsWordPattern = "[\\p{Alphabetic}\\p{M}\\p{Nd}\\p{Pc}\\u200c\\u200d]";

    //
//  Unicode Set Definitions for Regular Expression  \s
//
    final static String gIsSpacePattern = "[\\p{WhiteSpace}]";

    //
//  Unicode Set Definitions for Regular Expression  \d
//
    final static String gIsDigitPattern = "[\\p{Nd}]";

    //
//  PCRE horizontal and vertical white space, \h and \v
//
    final static String gIsHorizSpacePattern = "[\\u0009\\u0020\\u00a0\\u1680\\u180e\\u2000-\\u200a\\u202f\\u205f\\u3000]";
    final static String gIsVertSpacePattern = "[\\u000a-\\u000d\\u0085\\u2028\\u2029]";

    //
//  White space skipped between tokens in extended (x) mode.
//
    final static String gExtendedSpaceChars = " \t\n\u000b\f\r";

    final UnicodeSet fWordSet;
    final UnicodeSet fSpaceSet;
    final UnicodeSet fDigitSet;
    final UnicodeSet fHorizSpaceSet;
    final UnicodeSet fVertSpaceSet;

    final UnicodeSet fAnyChar;              // Every Unicode scalar value, the '.' of dot-all mode.
    final UnicodeSet fAnyCharNoNewline;     // The default '.'.
    final UnicodeSet fSurrogates;

    final Map<String, UnicodeSet> fPosixSets;    // [:name:] classes, ASCII only.

    RegexStaticSets() {
        fWordSet = new UnicodeSet(gIsWordPattern).freeze();
        fSpaceSet = new UnicodeSet(gIsSpacePattern).freeze();
        fDigitSet = new UnicodeSet(gIsDigitPattern).freeze();
        fHorizSpaceSet = new UnicodeSet(gIsHorizSpacePattern).freeze();
        fVertSpaceSet = new UnicodeSet(gIsVertSpacePattern).freeze();

        fSurrogates = new UnicodeSet(0xd800, 0xdfff).freeze();
        fAnyChar = new UnicodeSet(0, 0x10ffff).removeAll(fSurrogates).freeze();
        fAnyCharNoNewline = new UnicodeSet(fAnyChar).remove('\n').freeze();

        Map<String, UnicodeSet> posix = new HashMap<>();
        posix.put("alnum", new UnicodeSet().add('0', '9').add('A', 'Z').add('a', 'z').freeze());
        posix.put("alpha", new UnicodeSet().add('A', 'Z').add('a', 'z').freeze());
        posix.put("ascii", new UnicodeSet(0x00, 0x7f).freeze());
        posix.put("blank", new UnicodeSet().add('\t').add(' ').freeze());
        posix.put("cntrl", new UnicodeSet().add(0x00, 0x1f).add(0x7f).freeze());
        posix.put("digit", new UnicodeSet('0', '9').freeze());
        posix.put("graph", new UnicodeSet('!', '~').freeze());
        posix.put("lower", new UnicodeSet('a', 'z').freeze());
        posix.put("print", new UnicodeSet(' ', '~').freeze());
        posix.put("punct", new UnicodeSet().add('!', '/').add(':', '@').add('[', '`').add('{', '~').freeze());
        posix.put("space", new UnicodeSet().add('\t', '\r').add(' ').freeze());
        posix.put("upper", new UnicodeSet('A', 'Z').freeze());
        posix.put("word", new UnicodeSet().add('0', '9').add('A', 'Z').add('a', 'z').add('_').freeze());
        posix.put("xdigit", new UnicodeSet().add('0', '9').add('A', 'F').add('a', 'f').freeze());
        fPosixSets = Collections.unmodifiableMap(posix);
    }

    /**
     * @return the set for a backslash class escape such as {@code \d} or {@code \W},
     *         or {@code null} if {@code c} does not name one
     */
    UnicodeSet escapeClass(final int c) {
        UnicodeSet positive;
        switch (Character.toLowerCase(c)) {
            case 'd':
                positive = fDigitSet;
                break;
            case 'w':
                positive = fWordSet;
                break;
            case 's':
                positive = fSpaceSet;
                break;
            case 'h':
                positive = fHorizSpaceSet;
                break;
            case 'v':
                positive = fVertSpaceSet;
                break;
            default:
                return null;
        }
        return Character.isUpperCase(c) ? complement(positive) : positive;
    }

    /**
     * @return the complement of {@code set} within the Unicode scalar values
     */
    UnicodeSet complement(final UnicodeSet set) {
        return new UnicodeSet(fAnyChar).removeAll(set).freeze();
    }
}
