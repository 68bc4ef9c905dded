/*
 * @LICENSE@
 */

package org.formlang.automaton;

/**
 * A finite automaton with any number of start states and any number of
 * next states per <code>(state, symbol)</code>, but no epsilon transitions.
 */
public final class NondeterministicFiniteAutomaton extends FiniteAutomaton {

    public static final class Builder extends AbstractBuilder<Builder> {

        public Builder() {
        }

        @Override
        Builder self() {
            return this;
        }

        @Override
        void checkTransition(State from, Symbol symbol, State to) {
            if (symbol.isEpsilon()) {
                throw new IllegalArgumentException(
                    "epsilon transition " + from + " -> " + to + " in an NFA");
            }
        }

        @Override
        public NondeterministicFiniteAutomaton build() {
            return new NondeterministicFiniteAutomaton(this);
        }
    }

    private NondeterministicFiniteAutomaton(Builder b) {
        super(b);
    }

    @Override
    String kindName() {
        return "NFA";
    }
}
