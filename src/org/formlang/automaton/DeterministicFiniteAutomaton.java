/*
 * @LICENSE@
 */

package org.formlang.automaton;

import static org.formlang.Misc.LS;

import java.util.Collection;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A finite automaton with at most one start state, no epsilon transitions
 * and at most one next state per <code>(state, symbol)</code>. It may be
 * partial: a missing transition rejects.
 */
public final class DeterministicFiniteAutomaton extends FiniteAutomaton {

    private static final Logger logger = Logger.getLogger("org.formlang");
    private static final Level level = Level.FINER;

    /**
     * Builds a DFA. Giving a <code>(state, symbol)</code> a second,
     * different next state throws
     * {@link FiniteAutomaton.NondeterministicTransitionException}; adding
     * the same transition twice is harmless. A DFA has a single start
     * state: adding one replaces the previous.
     */
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
                    "epsilon transition " + from + " -> " + to + " in a DFA");
            }
            SortedSet<State> targets = delta.targets(from, symbol);
            if (!targets.isEmpty() && !targets.contains(to)) {
                throw new NondeterministicTransitionException(
                    from + " --" + symbol + "--> already goes to "
                        + targets.first() + ", not " + to);
            }
        }

        @Override
        public Builder addStartState(State state) {
            startStates.clear();
            return super.addStartState(state);
        }

        public Builder setStartState(State state) {
            return addStartState(state);
        }

        public Builder setStartState(String label) {
            return addStartState(new State(label));
        }

        @Override
        public DeterministicFiniteAutomaton build() {
            return new DeterministicFiniteAutomaton(this);
        }
    }

    private final State startState;

    private DeterministicFiniteAutomaton(Builder b) {
        super(b);
        this.startState = startStates.isEmpty() ? null : startStates.first();
        assert super.isDeterministic() : this;
    }

    @Override
    String kindName() {
        return "DFA";
    }

    /**
     * @return the start state, or null if there is none.
     */
    public State getStartState() {
        return startState;
    }

    /**
     * @return the next state, or null if the transition is missing.
     */
    public State nextState(State state, Symbol symbol) {
        SortedSet<State> targets = delta.targets(state, symbol);
        return targets.isEmpty() ? null : targets.first();
    }

    @Override
    public boolean accepts(List<Symbol> word) {
        State state = startState;
        if (state == null) return false;
        for (Symbol symbol : word) {
            if (symbol.isEpsilon()) continue;
            state = nextState(state, symbol);
            if (state == null) return false;
        }
        return isFinal(state);
    }

    @Override
    public boolean isDeterministic() {
        return true;
    }

    @Override
    public DeterministicFiniteAutomaton toDeterministic() {
        return this;
    }

    /**
     * @return true if every state has a next state on every input symbol.
     */
    public boolean isComplete() {
        for (State state : states) {
            for (Symbol symbol : inputSymbols) {
                if (nextState(state, symbol) == null) return false;
            }
        }
        return true;
    }

    /**
     * Missing transitions are sent to a fresh, non-final sink state which
     * loops on every symbol. A DFA without a start state gets the sink as
     * its start state.
     *
     * @return this DFA if it is already complete, otherwise a complete copy.
     */
    public DeterministicFiniteAutomaton toComplete() {
        return toComplete(inputSymbols);
    }

    /*
     * completes over inputSymbols plus alphabet
     */
    DeterministicFiniteAutomaton toComplete(Collection<Symbol> alphabet) {
        SortedSet<Symbol> sigma = new TreeSet<Symbol>(inputSymbols);
        sigma.addAll(alphabet);
        if (startState != null && sigma.size() == inputSymbols.size() && isComplete()) {
            return this;
        }
        Builder b = copyInto(new Builder());
        State sink = new StateAllocator(states).named("sink");
        b.addState(sink);
        for (Symbol symbol : sigma) {
            b.addInputSymbol(symbol);
            b.addTransition(sink, symbol, sink);
            for (State state : states) {
                if (nextState(state, symbol) == null) {
                    b.addTransition(state, symbol, sink);
                }
            }
        }
        if (startState == null) {
            b.setStartState(sink);
        }
        return b.build();
    }

    /**
     * Unreachable states are dropped, the DFA is completed and equivalent
     * states are merged by partition refinement. Each merged state keeps
     * the least label of its class.
     *
     * @return the minimal complete DFA accepting the same language.
     */
    public DeterministicFiniteAutomaton minimize() {
        DeterministicFiniteAutomaton ret = Minimizer.minimize(this);
        if (logger.isLoggable(level)) {
            logger.log(level, "minimized " + states.size() + " to "
                + ret.states.size() + " states:" + LS + ret);
        }
        return ret;
    }
}
