/*
 * @LICENSE@
 */

package org.formlang.automaton;

/**
 * An input symbol of a finite automaton, identified by its label.
 * {@link #EPSILON} labels the empty-string transitions; it is never equal to
 * a symbol created by the constructor, whatever its label, and it sorts
 * before every such symbol.
 */
public final class Symbol implements Comparable<Symbol> {

    public static final Symbol EPSILON = new Symbol("ε", true);

    private final String label;
    private final boolean epsilon;

    public Symbol(String label) {
        this(label, false);
    }

    private Symbol(String label, boolean epsilon) {
        if (label == null) throw new NullPointerException("label");
        this.label = label;
        this.epsilon = epsilon;
    }

    public String getLabel() {
        return label;
    }

    public boolean isEpsilon() {
        return epsilon;
    }

    public int compareTo(Symbol o) {
        if (epsilon != o.epsilon) return epsilon ? -1 : 1;
        return label.compareTo(o.label);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Symbol))
            return false;
        final Symbol s = (Symbol) o;
        return epsilon == s.epsilon && label.equals(s.label);
    }

    @Override
    public int hashCode() {
        return epsilon ? 0 : label.hashCode() * 31 + 1;
    }

    @Override
    public String toString() {
        return label;
    }
}
