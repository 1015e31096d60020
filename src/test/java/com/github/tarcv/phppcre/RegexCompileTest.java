package com.github.tarcv.phppcre;

import com.ibm.icu.text.UnicodeSet;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;

import static com.github.tarcv.phppcre.Modifier.*;
import static com.github.tarcv.phppcre.PcreErrorCode.*;

public class RegexCompileTest {

//---------------------------------------------------------------------------
//
//   Helpers to build expected trees
//
//---------------------------------------------------------------------------

    static Hir compile(final String regex, final Modifier... modifiers) {
        Modifiers flags = modifiers.length == 0 ? Modifiers.NONE : Modifiers.of(Arrays.asList(modifiers));
        return RegexCompile.compile(regex, flags);
    }

    static Hir lit(final int c) {
        return new Hir.Literal(c);
    }

    static Hir cls(final String pattern) {
        return new Hir.CharClass(new UnicodeSet(pattern));
    }

    static Hir concat(final Hir... children) {
        return new Hir.Concat(Arrays.asList(children));
    }

    static Hir alt(final Hir... children) {
        return new Hir.Alternation(Arrays.asList(children));
    }

    static Hir group(final int index, final Hir child) {
        return new Hir.Group(Hir.GroupKind.CAPTURING, index, null, child);
    }

    static Hir nonCapturing(final Hir child) {
        return new Hir.Group(Hir.GroupKind.NON_CAPTURING, 0, null, child);
    }

    static Hir rep(final Hir child, final int min, final int max, final boolean greedy) {
        return new Hir.Repetition(child, min, max, greedy);
    }

    static UnicodeSet classOf(final Hir hir) {
        Assert.assertEquals(Hir.Kind.CLASS, hir.kind());
        return ((Hir.CharClass) hir).set();
    }

//---------------------------------------------------------------------------
//
//    regex_err       Check that a pattern fails to compile with the expected
//                    status at the expected line and column.
//
//---------------------------------------------------------------------------
    static void regex_err(final String pat, final int errLine, final int errCol,
                          final PcreErrorCode expectedStatus) {
        try {
            RegexCompile.compile(pat, Modifiers.NONE);
        } catch (RegexParseException e) {
            Assert.assertEquals(pat, expectedStatus, e.getErrorCode());
            Assert.assertEquals(pat, errLine, e.getLine());
            Assert.assertEquals(pat, errCol, e.getOffset());
            return;
        } catch (Throwable e) {
            throw new AssertionError("Unexpected exception", e);
        }
        Assert.fail("Expected " + expectedStatus + " compiling \"" + pat + "\"");
    }

    @Test
    public void Basic() {
        Assert.assertEquals(Hir.Empty.INSTANCE, compile(""));
        Assert.assertEquals(lit('a'), compile("a"));
        Assert.assertEquals(concat(lit('a'), rep(lit('b'), 1, Hir.Repetition.UNBOUNDED, true), lit('c')),
                compile("ab+c"));
        Assert.assertEquals(alt(lit('a'), lit('b'), concat(lit('c'), lit('d'))), compile("a|b|cd"));
        Assert.assertEquals(group(1, Hir.Empty.INSTANCE), compile("()"));
        Assert.assertEquals(nonCapturing(Hir.Empty.INSTANCE), compile("(?:)"));
        Assert.assertEquals(concat(lit(0x1f600), lit('!')), compile("\uD83D\uDE00!"));
    }

    @Test
    public void Quantifiers() {
        Assert.assertEquals(rep(lit('a'), 0, Hir.Repetition.UNBOUNDED, true), compile("a*"));
        Assert.assertEquals(rep(lit('a'), 0, 1, true), compile("a?"));
        Assert.assertEquals(rep(lit('a'), 0, Hir.Repetition.UNBOUNDED, false), compile("a*?"));
        Assert.assertEquals(rep(lit('x'), 2, 2, true), compile("x{2}"));
        Assert.assertEquals(rep(lit('x'), 2, Hir.Repetition.UNBOUNDED, true), compile("x{2,}"));
        Assert.assertEquals(rep(lit('x'), 2, 5, false), compile("x{2,5}?"));
        Assert.assertEquals(rep(group(1, concat(lit('a'), lit('b'))), 1, Hir.Repetition.UNBOUNDED, true),
                compile("(ab)+"));

        // A brace that does not start an interval is an ordinary character.
        Assert.assertEquals(concat(lit('a'), lit('{'), lit(','), lit('3'), lit('}')), compile("a{,3}"));
        Assert.assertEquals(concat(lit('a'), lit('b'), lit('c'), lit('{'), lit('a'), lit(','), lit('2'), lit('}')),
                compile("abc{a,2}"));
        Assert.assertEquals(lit('}'), compile("}"));
    }

    @Test
    public void Ungreedy() {
        Assert.assertEquals(rep(lit('a'), 0, Hir.Repetition.UNBOUNDED, false), compile("a*", UNGREEDY));
        Assert.assertEquals(rep(lit('a'), 0, Hir.Repetition.UNBOUNDED, true), compile("a*?", UNGREEDY));
        Assert.assertEquals(rep(lit('a'), 1, 3, false), compile("a{1,3}", UNGREEDY));
        Assert.assertEquals(concat(rep(lit('a'), 0, 1, false), rep(lit('b'), 0, 1, true)),
                compile("(?U)a?b??"));
    }

    @Test
    public void Caseless() {
        Assert.assertEquals(cls("[Aa]"), compile("a", CASELESS));
        Assert.assertEquals(lit('1'), compile("1", CASELESS));
        Assert.assertEquals(cls("[A-Ca-c]"), compile("[a-c]", CASELESS));
        Assert.assertEquals(concat(cls("[Aa]"), lit('b')), compile("(?i:a)b").accept(new UnwrapGroups()));
        Assert.assertEquals(concat(lit('a'), cls("[Bb]")), compile("a(?i)b"));

        UnicodeSet negated = classOf(compile("[^a]", CASELESS));
        Assert.assertFalse(negated.contains('a'));
        Assert.assertFalse(negated.contains('A'));
        Assert.assertTrue(negated.contains('b'));
    }

    @Test
    public void Dot() {
        UnicodeSet dot = classOf(compile("."));
        Assert.assertFalse(dot.contains('\n'));
        Assert.assertTrue(dot.contains('\r'));
        Assert.assertTrue(dot.contains('a'));
        Assert.assertTrue(dot.contains(0x10ffff));
        Assert.assertFalse(dot.contains(0xd800));

        UnicodeSet dotAll = classOf(compile(".", DOTALL));
        Assert.assertTrue(dotAll.contains('\n'));
        Assert.assertEquals(dot.size() + 1, dotAll.size());
        Assert.assertEquals(dotAll, classOf(compile("(?s).")));
    }

    @Test
    public void Anchors() {
        Assert.assertEquals(concat(new Hir.Anchor(Hir.AnchorKind.START_TEXT), lit('a'),
                new Hir.Anchor(Hir.AnchorKind.END_TEXT)), compile("^a$"));
        Assert.assertEquals(concat(new Hir.Anchor(Hir.AnchorKind.START_LINE), lit('a'),
                new Hir.Anchor(Hir.AnchorKind.END_LINE)), compile("^a$", MULTILINE));
        Assert.assertEquals(concat(new Hir.Anchor(Hir.AnchorKind.START_TEXT),
                new Hir.Anchor(Hir.AnchorKind.END_TEXT), new Hir.Anchor(Hir.AnchorKind.END_TEXT_OR_NEWLINE)),
                compile("\\A\\z\\Z", MULTILINE));
        Assert.assertEquals(concat(new Hir.WordBoundary(false), lit('f'), lit('o'), lit('o'), new Hir.WordBoundary(true)),
                compile("\\bfoo\\B"));
    }

    @Test
    public void Extended() {
        Assert.assertEquals(concat(lit('a'), lit('b'), lit('c')), compile("a b # comment\n c", EXTENDED));
        Assert.assertEquals(concat(lit('a'), cls("[\\ ]")), compile("a[ ]", EXTENDED));
        Assert.assertEquals(concat(lit('a'), lit(' '), lit('#'), lit('b')), compile("a\\ \\# b", EXTENDED));
        Assert.assertEquals(rep(lit('a'), 1, Hir.Repetition.UNBOUNDED, true), compile("a  +", EXTENDED));
        Assert.assertEquals(concat(lit('a'), lit(' '), lit('b')), compile("a b"));
        Assert.assertEquals(concat(lit('a'), lit('b'), lit(' '), lit('c')), compile("(?x) a b (?-x) c").accept(new UnwrapGroups()));
    }

    @Test
    public void Groups() {
        RegexCompile compiler = new RegexCompile("(a)(?:b)(?P<n>c)(?<m>d)(?'o'e)(?#comment)(f)", Modifiers.NONE);
        Hir hir = compiler.compile();
        Assert.assertEquals(5, compiler.captureCount());
        Assert.assertEquals(Integer.valueOf(2), compiler.namedCaptureMap().get("n"));
        Assert.assertEquals(Integer.valueOf(3), compiler.namedCaptureMap().get("m"));
        Assert.assertEquals(Integer.valueOf(4), compiler.namedCaptureMap().get("o"));
        Assert.assertEquals(concat(
                group(1, lit('a')),
                nonCapturing(lit('b')),
                new Hir.Group(Hir.GroupKind.NAMED_CAPTURING, 2, "n", lit('c')),
                new Hir.Group(Hir.GroupKind.NAMED_CAPTURING, 3, "m", lit('d')),
                new Hir.Group(Hir.GroupKind.NAMED_CAPTURING, 4, "o", lit('e')),
                group(5, lit('f'))), hir);

        // Numbered in the order of the opening parentheses.
        Assert.assertEquals(group(1, concat(lit('a'), group(2, lit('b')))), compile("(a(b))"));
    }

    @Test
    public void Escapes() {
        Assert.assertEquals(lit('A'), compile("\\x41"));
        Assert.assertEquals(lit(0), compile("\\x"));
        Assert.assertEquals(lit(0x1f600), compile("\\x{1F600}"));
        Assert.assertEquals(lit('A'), compile("\\o{101}"));
        Assert.assertEquals(lit('\n'), compile("\\012"));
        Assert.assertEquals(lit(0), compile("\\0"));
        Assert.assertEquals(lit(0x01), compile("\\cA"));
        Assert.assertEquals(lit(0x01), compile("\\ca"));
        Assert.assertEquals(concat(lit(0x07), lit(0x1b), lit('\f'), lit('\n'), lit('\r'), lit('\t')),
                compile("\\a\\e\\f\\n\\r\\t"));
        Assert.assertEquals(concat(lit('.'), lit('*'), lit('\\'), lit('/'), lit('é')), compile("\\.\\*\\\\\\/\\é"));
        Assert.assertEquals(concat(lit('a'), lit('.'), lit('b')), compile("\\Qa.b\\E"));
        Assert.assertEquals(concat(lit('a'), lit('.')), compile("\\Qa.\\E\\E"));
        Assert.assertEquals(concat(group(1, lit('a')), lit(0)), compile("(a)\\0"));
    }

    @Test
    public void QuotedSequences() {
        // A quantifier after \E applies to the last quoted character only.
        Assert.assertEquals(compile("ab*"), compile("\\Qab\\E*"));
        Assert.assertEquals(concat(lit('a'), lit('.'), rep(lit('+'), 2, 2, true)), compile("\\Qa.+\\E{2}"));
        Assert.assertEquals(compile("xaby"), compile("x\\Qab\\Ey"));
        Assert.assertEquals(compile("x\\.y"), compile("x\\Q.\\Ey"));
        Assert.assertEquals(concat(lit('a'), lit('b')), compile("a\\Q\\Eb"));
        Assert.assertEquals(concat(cls("[Aa]"), cls("[Bb]")), compile("\\Qab", CASELESS));
        Assert.assertEquals(group(1, concat(lit('a'), lit(')'))), compile("(\\Qa)\\E)"));
    }

    @Test
    public void ClassEscapes() {
        UnicodeSet digits = classOf(compile("\\d"));
        Assert.assertTrue(digits.contains('5'));
        Assert.assertTrue(digits.contains(0x0663));
        Assert.assertFalse(digits.contains('a'));
        Assert.assertFalse(classOf(compile("\\D")).contains('5'));
        Assert.assertTrue(classOf(compile("\\w")).contains('ж'));
        Assert.assertTrue(classOf(compile("\\s")).contains('\t'));
        Assert.assertTrue(classOf(compile("\\h")).contains(0x3000));
        Assert.assertFalse(classOf(compile("\\h")).contains('\n'));
        Assert.assertTrue(classOf(compile("\\v")).contains(0x2028));

        Assert.assertTrue(classOf(compile("\\pL")).contains('ж'));
        Assert.assertFalse(classOf(compile("\\p{^L}")).contains('a'));
        Assert.assertFalse(classOf(compile("\\PL")).contains('a'));
        Assert.assertTrue(classOf(compile("\\P{L}")).contains('1'));
        Assert.assertTrue(classOf(compile("\\p{Greek}")).contains(0x03b1));
        Assert.assertTrue(classOf(compile("\\p{L&}")).contains('a'));
        Assert.assertTrue(classOf(compile("\\p{Lu}", CASELESS)).contains('a'));
    }

    @Test
    public void BracketExpressions() {
        Assert.assertEquals(cls("[a-c]"), compile("[a-c]"));
        Assert.assertEquals(cls("[\\]a]"), compile("[]a]"));
        Assert.assertEquals(cls("[a\\-z]"), compile("[a\\-z]"));
        Assert.assertEquals(cls("[a\\-]"), compile("[a-]"));
        Assert.assertEquals(cls("[\\[a]"), compile("[[a]"));
        Assert.assertEquals(cls("[\\u0008\\n]"), compile("[\\b\\n]"));
        Assert.assertEquals(cls("[a-z_]"), compile("[[:lower:]_]"));
        Assert.assertEquals(cls("[0-9A-Fa-f]"), compile("[[:xdigit:]]"));
        Assert.assertEquals(cls("[a.b]"), compile("[\\Qa.b\\E]"));
        Assert.assertEquals(cls("[a-z]"), compile("[a-\\Qz\\E]"));
        Assert.assertEquals(cls("[a-c\\-]"), compile("[a-\\Qc-\\E]"));
        Assert.assertEquals(cls("[\\u00e0-\\u00e5a]"), compile("[\\x{e0}-\\x{e5}a]"));

        UnicodeSet notDigits = classOf(compile("[[:^digit:]]"));
        Assert.assertFalse(notDigits.contains('5'));
        Assert.assertTrue(notDigits.contains('a'));

        UnicodeSet wordOrDash = classOf(compile("[\\w-]"));
        Assert.assertTrue(wordOrDash.contains('-'));
        Assert.assertTrue(wordOrDash.contains('a'));

        UnicodeSet negated = classOf(compile("[^a]"));
        Assert.assertFalse(negated.contains('a'));
        Assert.assertTrue(negated.contains('b'));
        Assert.assertFalse(negated.contains(0xdc00));
    }

    @Test
    public void Errors() {
        Assert.assertEquals(REGEX_ERROR_START.getIndex() + 1, REGEX_RULE_SYNTAX.getIndex());

        // Missing close parentheses
        regex_err("Comment (?# with no close", 1, 26, REGEX_MISMATCHED_PAREN);
        regex_err("Capturing Parenthesis(...", 1, 26, REGEX_MISMATCHED_PAREN);
        regex_err("Grouping only parens (?: blah blah", 1, 35, REGEX_MISMATCHED_PAREN);
        regex_err("(((((((", 1, 8, REGEX_MISMATCHED_PAREN);

        // Extra close paren
        regex_err("Grouping only parens (?: blah)) blah", 1, 31, REGEX_MISMATCHED_PAREN);
        regex_err(")))))))", 1, 1, REGEX_MISMATCHED_PAREN);

        // Look-ahead, Look-behind and other unsupported groups
        regex_err("(?=a)", 1, 1, REGEX_UNIMPLEMENTED);
        regex_err("x(?<!a)", 1, 2, REGEX_UNIMPLEMENTED);
        regex_err("(?>a)", 1, 1, REGEX_UNIMPLEMENTED);
        regex_err("(?R)", 1, 1, REGEX_UNIMPLEMENTED);
        regex_err("abc(?<@xyz).*", 1, 7, REGEX_INVALID_CAPTURE_GROUP_NAME);
        regex_err("(?P<1a>x)", 1, 5, REGEX_INVALID_CAPTURE_GROUP_NAME);
        regex_err("(?<n>a)(?<n>b)", 1, 11, REGEX_INVALID_CAPTURE_GROUP_NAME);
        regex_err("(?z)", 1, 3, REGEX_INVALID_FLAG);

        // Quantifiers are allowed only after something that can be quantified.
        regex_err("+", 1, 1, REGEX_RULE_SYNTAX);
        regex_err("abc\ndef(*2)", 2, 5, REGEX_RULE_SYNTAX);
        regex_err("abc**", 1, 5, REGEX_RULE_SYNTAX);
        regex_err("*c", 1, 1, REGEX_RULE_SYNTAX);
        regex_err("(?i)*", 1, 5, REGEX_RULE_SYNTAX);
        regex_err("a*+", 1, 3, REGEX_UNIMPLEMENTED);

        // Mal-formed {min,max} quantifiers
        regex_err("abc{4,2}", 1, 8, REGEX_MAX_LT_MIN);
        regex_err("abc{1,b}", 1, 7, REGEX_BAD_INTERVAL);
        regex_err("abc{1,,2}", 1, 7, REGEX_BAD_INTERVAL);
        regex_err("abc{1,2a}", 1, 8, REGEX_BAD_INTERVAL);
        regex_err("abc{222222222222222222222}", 1, 5, REGEX_NUMBER_TOO_BIG);
        regex_err("abc{5,687865858}", 1, 7, REGEX_NUMBER_TOO_BIG);

        // Alternation
        regex_err("a|", 1, 2, REGEX_EMPTY_ALTERNATE);
        regex_err("|a", 1, 1, REGEX_EMPTY_ALTERNATE);
        regex_err("(a||b)", 1, 3, REGEX_EMPTY_ALTERNATE);

        // Escapes
        regex_err("abc\\", 1, 4, REGEX_BAD_ESCAPE_SEQUENCE);
        regex_err("a\\q", 1, 2, REGEX_BAD_ESCAPE_SEQUENCE);
        regex_err("\\x{110000}", 1, 1, REGEX_BAD_ESCAPE_SEQUENCE);
        regex_err("\\x{d800}", 1, 1, REGEX_BAD_ESCAPE_SEQUENCE);
        regex_err("\\x{41", 1, 1, REGEX_BAD_ESCAPE_SEQUENCE);
        regex_err("(ab)\\1", 1, 5, REGEX_UNIMPLEMENTED);
        regex_err("\\k<n>", 1, 1, REGEX_UNIMPLEMENTED);
        regex_err("\\p{NotAProperty}", 1, 1, REGEX_PROPERTY_SYNTAX);
        regex_err("\\p{L", 1, 1, REGEX_PROPERTY_SYNTAX);

        // Bracket expressions
        regex_err("[abc", 1, 5, REGEX_MISSING_CLOSE_BRACKET);
        regex_err("[]", 1, 3, REGEX_MISSING_CLOSE_BRACKET);
        regex_err("[z-a]", 1, 2, REGEX_INVALID_RANGE);
        regex_err("[\\d-z]", 1, 4, REGEX_INVALID_RANGE);
        regex_err("[a-\\d]", 1, 4, REGEX_INVALID_RANGE);
        regex_err("[[:foo:]]", 1, 2, REGEX_RULE_SYNTAX);
        regex_err("[\\z]", 1, 2, REGEX_BAD_ESCAPE_SEQUENCE);
        regex_err("[a-\\Q\\E]", 1, 4, REGEX_INVALID_RANGE);
        regex_err("[z-\\Qa\\E]", 1, 2, REGEX_INVALID_RANGE);
    }

    @Test
    public void ErrorContext() {
        try {
            RegexCompile.compile("abcdefghijklmnopqrstuvwxyz)0123456789", Modifiers.NONE);
            Assert.fail();
        } catch (RegexParseException e) {
            Assert.assertEquals(REGEX_MISMATCHED_PAREN, e.getErrorCode());
            Assert.assertEquals("klmnopqrstuvwxyz", new String(e.getPreContext()));
            Assert.assertEquals(")0123456789", new String(e.getPostContext()));
            Assert.assertTrue(e.getMessage(), e.getMessage().contains("offset 27"));
        }
    }

    /**
     * Replaces scoping-only non-capturing groups by their contents, for comparing
     * trees of patterns that use (?flags:...).
     */
    static final class UnwrapGroups implements Hir.Visitor<Hir> {
        @Override
        public Hir visitEmpty(final Hir.Empty empty) {
            return empty;
        }

        @Override
        public Hir visitLiteral(final Hir.Literal literal) {
            return literal;
        }

        @Override
        public Hir visitClass(final Hir.CharClass charClass) {
            return charClass;
        }

        @Override
        public Hir visitConcat(final Hir.Concat concat) {
            Hir[] children = concat.children().stream().map(c -> c.accept(this)).toArray(Hir[]::new);
            return RegexCompileTest.concat(children);
        }

        @Override
        public Hir visitAlternation(final Hir.Alternation alternation) {
            Hir[] children = alternation.children().stream().map(c -> c.accept(this)).toArray(Hir[]::new);
            return alt(children);
        }

        @Override
        public Hir visitGroup(final Hir.Group group) {
            Hir child = group.child().accept(this);
            return group.isCapturing() ? new Hir.Group(group.groupKind(), group.index(), group.name(), child) : child;
        }

        @Override
        public Hir visitRepetition(final Hir.Repetition repetition) {
            return rep(repetition.child().accept(this), repetition.min(), repetition.max(), repetition.isGreedy());
        }

        @Override
        public Hir visitAnchor(final Hir.Anchor anchor) {
            return anchor;
        }

        @Override
        public Hir visitWordBoundary(final Hir.WordBoundary wordBoundary) {
            return wordBoundary;
        }
    }
}
