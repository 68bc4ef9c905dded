/*
 * @LICENSE@
 */

package org.formlang.automaton;

/**
 * A state of a finite automaton, identified by its label.
 */
public final class State implements Comparable<State> {

    private final String label;

    public State(String label) {
        if (label == null) throw new NullPointerException("label");
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public int compareTo(State o) {
        return label.compareTo(o.label);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof State))
            return false;
        return label.equals(((State) o).label);
    }

    @Override
    public int hashCode() {
        return label.hashCode();
    }

    @Override
    public String toString() {
        return label;
    }
}
