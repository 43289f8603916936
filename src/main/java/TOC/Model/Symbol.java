package TOC.Model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Alphabet token shared by tapes, automaton labels and stacks.
 * <p>
 * {@link #BLANK} and {@link #EPSILON} are dedicated variants. A data symbol is never equal to either of them,
 * even when its text reads "#" or "ε".
 */
public final class Symbol implements Comparable<Symbol> {

    public enum Kind { EPSILON, BLANK, DATA }

    public static final Symbol BLANK = new Symbol(Kind.BLANK, "");
    public static final Symbol EPSILON = new Symbol(Kind.EPSILON, "");

    private final Kind kind;
    private final String text;

    private Symbol(Kind kind, String text) {
        this.kind = kind;
        this.text = text;
    }

    /**
     * Data symbol with the given (non-empty) text. Multi-character text is one atomic token.
     */
    public static Symbol of(String text) {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) {
            throw new ValidationException("A data symbol needs at least one character; use Symbol.EPSILON or Symbol.BLANK");
        }
        return new Symbol(Kind.DATA, text);
    }

    public static Symbol of(char c) {
        return new Symbol(Kind.DATA, String.valueOf(c));
    }

    /**
     * One data symbol per character of the word.
     */
    public static List<Symbol> characters(String word) {
        List<Symbol> result = new ArrayList<>(word.length());
        for (int i = 0; i < word.length(); i++) {
            result.add(of(word.charAt(i)));
        }
        return result;
    }

    /**
     * Data symbols for each token, where null or "" become {@link #BLANK}.
     */
    public static List<Symbol> tape(String... tokens) {
        List<Symbol> result = new ArrayList<>(tokens.length);
        for (String token : tokens) {
            result.add(token == null || token.isEmpty() ? BLANK : of(token));
        }
        return result;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Text of a data symbol; empty for the sentinels.
     */
    public String text() {
        return text;
    }

    /**
     * Number of input characters consumed by this symbol as a label.
     */
    public int length() {
        return text.length();
    }

    public boolean isBlank() {
        return kind == Kind.BLANK;
    }

    public boolean isEpsilon() {
        return kind == Kind.EPSILON;
    }

    public boolean isData() {
        return kind == Kind.DATA;
    }

    @Override
    public int compareTo(Symbol o) {
        int byKind = kind.compareTo(o.kind);
        return byKind != 0 ? byKind : text.compareTo(o.text);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Symbol)) {
            return false;
        }
        Symbol other = (Symbol) o;
        return kind == other.kind && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + text.hashCode();
    }

    @Override
    public String toString() {
        return switch (kind) {
            case BLANK -> "<blank>";
            case EPSILON -> "<eps>";
            case DATA -> text;
        };
    }
}
