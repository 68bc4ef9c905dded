/*
 * @LICENSE@
 */

package org.formlang.automaton;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Moore style DFA minimization. Blocks start as {final, non-final}; each
 * round splits a block whenever two of its states go to different blocks on
 * some symbol. The block count never decreases, and the refinement is stable
 * once a round leaves it unchanged.
 */
final class Minimizer {

    private Minimizer() {
    } // never instantiated

    static DeterministicFiniteAutomaton minimize(DeterministicFiniteAutomaton dfa) {

        final DeterministicFiniteAutomaton complete = prune(dfa).toComplete();
        final List<State> states = new ArrayList<State>(complete.getStates());
        final List<Symbol> sigma = new ArrayList<Symbol>(complete.getInputSymbols());

        Map<State, Integer> block = new HashMap<State, Integer>();
        boolean anyFinal = false, anyNonFinal = false;
        for (State state : states) {
            boolean isFinal = complete.isFinal(state);
            block.put(state, isFinal ? 1 : 0);
            anyFinal |= isFinal;
            anyNonFinal |= !isFinal;
        }
        int count = (anyFinal ? 1 : 0) + (anyNonFinal ? 1 : 0);

        for (;;) {
            final Map<List<Integer>, Integer> signatures =
                new HashMap<List<Integer>, Integer>();
            final Map<State, Integer> next = new HashMap<State, Integer>();
            for (State state : states) {
                List<Integer> signature = new ArrayList<Integer>(sigma.size() + 1);
                signature.add(block.get(state));
                for (Symbol symbol : sigma) {
                    signature.add(block.get(complete.nextState(state, symbol)));
                }
                Integer id = signatures.get(signature);
                if (id == null) {
                    id = signatures.size();
                    signatures.put(signature, id);
                }
                next.put(state, id);
            }
            block = next;
            if (signatures.size() == count) break;
            count = signatures.size();
        }

        // states are sorted, so the first of each block has its least label
        final Map<Integer, State> representative = new LinkedHashMap<Integer, State>();
        for (State state : states) {
            if (!representative.containsKey(block.get(state))) {
                representative.put(block.get(state), state);
            }
        }
        assert representative.size() == count;

        final DeterministicFiniteAutomaton.Builder b =
            new DeterministicFiniteAutomaton.Builder();
        for (Symbol symbol : sigma) b.addInputSymbol(symbol);
        for (State state : representative.values()) {
            b.addState(state);
            if (complete.isFinal(state)) b.addFinalState(state);
            for (Symbol symbol : sigma) {
                State target = complete.nextState(state, symbol);
                b.addTransition(state, symbol, representative.get(block.get(target)));
            }
        }
        b.setStartState(representative.get(block.get(complete.getStartState())));
        return b.build();
    }

    /*
     * drops every state not reachable from the start state
     */
    private static DeterministicFiniteAutomaton prune(DeterministicFiniteAutomaton dfa) {
        final Set<State> reachable = dfa.reachableStates();
        final DeterministicFiniteAutomaton.Builder b =
            new DeterministicFiniteAutomaton.Builder();
        for (Symbol symbol : dfa.getInputSymbols()) b.addInputSymbol(symbol);
        for (State state : reachable) {
            b.addState(state);
            if (dfa.isFinal(state)) b.addFinalState(state);
        }
        for (FiniteAutomaton.Transition t : dfa.getTransitions()) {
            if (reachable.contains(t.getFrom())) {
                b.addTransition(t.getFrom(), t.getSymbol(), t.getTo());
            }
        }
        if (dfa.getStartState() != null) b.setStartState(dfa.getStartState());
        return b.build();
    }
}
