package com.github.tarcv.phppcre;

import com.ibm.icu.text.UnicodeSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * High-level intermediate representation of a compiled regular expression.
 * <p>
 * The set of node types is closed: every node is one of the nested classes of {@code Hir}.
 * Nodes are immutable and own their children, so a tree can be shared freely between threads.
 */
public abstract class Hir {

    public enum Kind {
        EMPTY,
        LITERAL,
        CLASS,
        CONCAT,
        ALTERNATION,
        GROUP,
        REPETITION,
        ANCHOR,
        WORD_BOUNDARY
    }

    /**
     * Bottom-up traversal over the closed set of node types.
     *
     * @param <R> result of visiting a node
     */
    public interface Visitor<R> {
        R visitEmpty(Empty empty);

        R visitLiteral(Literal literal);

        R visitClass(CharClass charClass);

        R visitConcat(Concat concat);

        R visitAlternation(Alternation alternation);

        R visitGroup(Group group);

        R visitRepetition(Repetition repetition);

        R visitAnchor(Anchor anchor);

        R visitWordBoundary(WordBoundary wordBoundary);
    }

    private Hir() {
    }

    public abstract Kind kind();

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Finds the capturing group numbered {@code index}, searching depth-first in pattern order.
     * Non-capturing groups never match but their contents are searched.
     *
     * @param index capture group number, counted from 1
     * @return the group, or empty if the tree has no such group
     */
    public abstract Optional<Group> findGroup(int index);

    /**
     * Renders this node as an equivalent regular expression.
     */
    @Override
    public final String toString() {
        StringBuilder out = new StringBuilder();
        appendTo(out);
        return out.toString();
    }

    abstract void appendTo(StringBuilder out);

    static Hir concat(final List<Hir> children) {
        if (children.isEmpty()) {
            return Empty.INSTANCE;
        }
        return children.size() == 1 ? children.get(0) : new Concat(children);
    }

    static Hir alternation(final List<Hir> children) {
        if (children.isEmpty()) {
            return Empty.INSTANCE;
        }
        return children.size() == 1 ? children.get(0) : new Alternation(children);
    }

    private static Optional<Group> findGroupIn(final List<Hir> children, final int index) {
        for (Hir child : children) {
            Optional<Group> found = child.findGroup(index);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    private static void appendChild(final StringBuilder out, final Hir child, final Kind parent) {
        boolean wrap;
        switch (child.kind()) {
            case ALTERNATION:
                wrap = parent == Kind.CONCAT || parent == Kind.REPETITION;
                break;
            case CONCAT:
                wrap = parent == Kind.REPETITION;
                break;
            case EMPTY:
            case REPETITION:
                wrap = parent == Kind.REPETITION;
                break;
            default:
                wrap = false;
        }
        if (wrap) {
            out.append("(?:");
            child.appendTo(out);
            out.append(')');
        } else {
            child.appendTo(out);
        }
    }

    /**
     * Matches the empty string.
     */
    public static final class Empty extends Hir {
        static final Empty INSTANCE = new Empty();

        private Empty() {
        }

        @Override
        public Kind kind() {
            return Kind.EMPTY;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitEmpty(this);
        }

        @Override
        public Optional<Group> findGroup(final int index) {
            return Optional.empty();
        }

        @Override
        void appendTo(final StringBuilder out) {
        }
    }

    /**
     * Matches a single code point exactly.
     */
    public static final class Literal extends Hir {
        private final int codePoint;

        Literal(final int codePoint) {
            this.codePoint = codePoint;
        }

        public int codePoint() {
            return codePoint;
        }

        @Override
        public Kind kind() {
            return Kind.LITERAL;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }

        @Override
        public Optional<Group> findGroup(final int index) {
            return Optional.empty();
        }

        @Override
        void appendTo(final StringBuilder out) {
            if (codePoint < 0x80 && RegexStaticSets.gRuleSet_rule_chars.indexOf(codePoint) >= 0) {
                out.append('\\').append((char) codePoint);
            } else if (codePoint < 0x20 || codePoint == 0x7f) {
                out.append(String.format("\\x%02X", codePoint));
            } else {
                out.appendCodePoint(codePoint);
            }
        }

        @Override
        public boolean equals(final Object that) {
            return that instanceof Literal && ((Literal) that).codePoint == codePoint;
        }

        @Override
        public int hashCode() {
            return codePoint;
        }
    }

    /**
     * Matches any one code point of a set.
     */
    public static final class CharClass extends Hir {
        private final UnicodeSet set;

        CharClass(final UnicodeSet set) {
            this.set = set.isFrozen() ? set : set.cloneAsThawed().freeze();
        }

        /**
         * @return the frozen set of code points, exposing its ranges through
         *         {@link UnicodeSet#getRangeCount()}, {@link UnicodeSet#getRangeStart(int)} and
         *         {@link UnicodeSet#getRangeEnd(int)}
         */
        public UnicodeSet set() {
            return set;
        }

        @Override
        public Kind kind() {
            return Kind.CLASS;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitClass(this);
        }

        @Override
        public Optional<Group> findGroup(final int index) {
            return Optional.empty();
        }

        @Override
        void appendTo(final StringBuilder out) {
            out.append(set.toPattern(true));
        }

        @Override
        public boolean equals(final Object that) {
            return that instanceof CharClass && ((CharClass) that).set.equals(set);
        }

        @Override
        public int hashCode() {
            return set.hashCode();
        }
    }

    public static final class Concat extends Hir {
        private final List<Hir> children;

        Concat(final List<Hir> children) {
            this.children = Collections.unmodifiableList(new ArrayList<>(children));
        }

        public List<Hir> children() {
            return children;
        }

        @Override
        public Kind kind() {
            return Kind.CONCAT;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitConcat(this);
        }

        @Override
        public Optional<Group> findGroup(final int index) {
            return findGroupIn(children, index);
        }

        @Override
        void appendTo(final StringBuilder out) {
            for (Hir child : children) {
                appendChild(out, child, Kind.CONCAT);
            }
        }

        @Override
        public boolean equals(final Object that) {
            return that instanceof Concat && ((Concat) that).children.equals(children);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.CONCAT, children);
        }
    }

    public static final class Alternation extends Hir {
        private final List<Hir> children;

        Alternation(final List<Hir> children) {
            this.children = Collections.unmodifiableList(new ArrayList<>(children));
        }

        public List<Hir> children() {
            return children;
        }

        @Override
        public Kind kind() {
            return Kind.ALTERNATION;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitAlternation(this);
        }

        @Override
        public Optional<Group> findGroup(final int index) {
            return findGroupIn(children, index);
        }

        @Override
        void appendTo(final StringBuilder out) {
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) {
                    out.append('|');
                }
                appendChild(out, children.get(i), Kind.ALTERNATION);
            }
        }

        @Override
        public boolean equals(final Object that) {
            return that instanceof Alternation && ((Alternation) that).children.equals(children);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.ALTERNATION, children);
        }
    }

    public enum GroupKind {
        CAPTURING,
        NAMED_CAPTURING,
        NON_CAPTURING
    }

    /**
     * A parenthesized sub-pattern.
     */
    public static final class Group extends Hir {
        private final GroupKind groupKind;
        private final int index;
        private final String name;
        private final Hir child;

        Group(final GroupKind groupKind, final int index, final String name, final Hir child) {
            this.groupKind = groupKind;
            this.index = index;
            this.name = name;
            this.child = child;
        }

        public GroupKind groupKind() {
            return groupKind;
        }

        public boolean isCapturing() {
            return groupKind != GroupKind.NON_CAPTURING;
        }

        /**
         * @return capture group number, or 0 for a non-capturing group
         */
        public int index() {
            return index;
        }

        /**
         * @return the name of a named group, otherwise {@code null}
         */
        public String name() {
            return name;
        }

        public Hir child() {
            return child;
        }

        @Override
        public Kind kind() {
            return Kind.GROUP;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitGroup(this);
        }

        @Override
        public Optional<Group> findGroup(final int index) {
            if (isCapturing() && this.index == index) {
                return Optional.of(this);
            }
            return child.findGroup(index);
        }

        @Override
        void appendTo(final StringBuilder out) {
            switch (groupKind) {
                case CAPTURING:
                    out.append('(');
                    break;
                case NAMED_CAPTURING:
                    out.append("(?P<").append(name).append('>');
                    break;
                default:
                    out.append("(?:");
            }
            child.appendTo(out);
            out.append(')');
        }

        @Override
        public boolean equals(final Object that) {
            if (!(that instanceof Group)) { return false; }
            final Group other = (Group) that;
            return groupKind == other.groupKind && index == other.index
                    && Objects.equals(name, other.name) && child.equals(other.child);
        }

        @Override
        public int hashCode() {
            return Objects.hash(groupKind, index, name, child);
        }
    }

    /**
     * Repeats its child between {@link #min()} and {@link #max()} times.
     */
    public static final class Repetition extends Hir {
        public static final int UNBOUNDED = -1;

        private final Hir child;
        private final int min;
        private final int max;
        private final boolean greedy;

        Repetition(final Hir child, final int min, final int max, final boolean greedy) {
            this.child = child;
            this.min = min;
            this.max = max;
            this.greedy = greedy;
        }

        public Hir child() {
            return child;
        }

        public int min() {
            return min;
        }

        /**
         * @return the upper bound, or {@link #UNBOUNDED}
         */
        public int max() {
            return max;
        }

        public boolean isGreedy() {
            return greedy;
        }

        @Override
        public Kind kind() {
            return Kind.REPETITION;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitRepetition(this);
        }

        @Override
        public Optional<Group> findGroup(final int index) {
            return child.findGroup(index);
        }

        @Override
        void appendTo(final StringBuilder out) {
            appendChild(out, child, Kind.REPETITION);
            if (min == 0 && max == UNBOUNDED) {
                out.append('*');
            } else if (min == 1 && max == UNBOUNDED) {
                out.append('+');
            } else if (min == 0 && max == 1) {
                out.append('?');
            } else if (min == max) {
                out.append('{').append(min).append('}');
            } else if (max == UNBOUNDED) {
                out.append('{').append(min).append(",}");
            } else {
                out.append('{').append(min).append(',').append(max).append('}');
            }
            if (!greedy) {
                out.append('?');
            }
        }

        @Override
        public boolean equals(final Object that) {
            if (!(that instanceof Repetition)) { return false; }
            final Repetition other = (Repetition) that;
            return min == other.min && max == other.max && greedy == other.greedy && child.equals(other.child);
        }

        @Override
        public int hashCode() {
            return Objects.hash(child, min, max, greedy);
        }
    }

    public enum AnchorKind {
        START_LINE("(?m:^)"),
        END_LINE("(?m:$)"),
        START_TEXT("^"),
        END_TEXT("$"),
        END_TEXT_OR_NEWLINE("\\Z");

        final String syntax;

        AnchorKind(final String syntax) {
            this.syntax = syntax;
        }
    }

    public static final class Anchor extends Hir {
        private final AnchorKind anchorKind;

        Anchor(final AnchorKind anchorKind) {
            this.anchorKind = anchorKind;
        }

        public AnchorKind anchorKind() {
            return anchorKind;
        }

        @Override
        public Kind kind() {
            return Kind.ANCHOR;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitAnchor(this);
        }

        @Override
        public Optional<Group> findGroup(final int index) {
            return Optional.empty();
        }

        @Override
        void appendTo(final StringBuilder out) {
            out.append(anchorKind.syntax);
        }

        @Override
        public boolean equals(final Object that) {
            return that instanceof Anchor && ((Anchor) that).anchorKind == anchorKind;
        }

        @Override
        public int hashCode() {
            return anchorKind.hashCode();
        }
    }

    public static final class WordBoundary extends Hir {
        private final boolean negated;

        WordBoundary(final boolean negated) {
            this.negated = negated;
        }

        /**
         * @return true for {@code \B}
         */
        public boolean isNegated() {
            return negated;
        }

        @Override
        public Kind kind() {
            return Kind.WORD_BOUNDARY;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitWordBoundary(this);
        }

        @Override
        public Optional<Group> findGroup(final int index) {
            return Optional.empty();
        }

        @Override
        void appendTo(final StringBuilder out) {
            out.append(negated ? "\\B" : "\\b");
        }

        @Override
        public boolean equals(final Object that) {
            return that instanceof WordBoundary && ((WordBoundary) that).negated == negated;
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(negated);
        }
    }
}
