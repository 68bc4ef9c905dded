/*
 * @LICENSE@
 */

package org.formlang.automaton;

/**
 * A nondeterministic finite automaton which may also move on
 * {@link Symbol#EPSILON} without consuming input.
 */
public final class EpsilonNFA extends FiniteAutomaton {

    public static final class Builder extends AbstractBuilder<Builder> {

        public Builder() {
        }

        @Override
        Builder self() {
            return this;
        }

        @Override
        public EpsilonNFA build() {
            return new EpsilonNFA(this);
        }
    }

    private EpsilonNFA(Builder b) {
        super(b);
    }

    @Override
    String kindName() {
        return "Epsilon-NFA";
    }
}
