/*
 * @LICENSE@
 */

package org.formlang.automaton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The transition relation of an automaton: <code>(state, symbol)</code>
 * mapped to a sorted set of next states. {@link Symbol#EPSILON} is a
 * legitimate key. Mutable while a builder owns it; an automaton only ever
 * reads its copy.
 */
final class TransitionFunction {

    private final SortedMap<State, SortedMap<Symbol, SortedSet<State>>> map =
        new TreeMap<State, SortedMap<Symbol, SortedSet<State>>>();
    private int size = 0;

    TransitionFunction() {
    }

    TransitionFunction(TransitionFunction that) {
        for (Map.Entry<State, SortedMap<Symbol, SortedSet<State>>> e : that.map.entrySet()) {
            SortedMap<Symbol, SortedSet<State>> row = new TreeMap<Symbol, SortedSet<State>>();
            for (Map.Entry<Symbol, SortedSet<State>> f : e.getValue().entrySet()) {
                row.put(f.getKey(), new TreeSet<State>(f.getValue()));
            }
            map.put(e.getKey(), row);
        }
        size = that.size;
    }

    /**
     * @return true if the transition was not already present.
     */
    boolean add(State from, Symbol symbol, State to) {
        SortedMap<Symbol, SortedSet<State>> row = map.get(from);
        if (row == null) {
            row = new TreeMap<Symbol, SortedSet<State>>();
            map.put(from, row);
        }
        SortedSet<State> targets = row.get(symbol);
        if (targets == null) {
            targets = new TreeSet<State>();
            row.put(symbol, targets);
        }
        if (targets.add(to)) {
            ++size;
            return true;
        }
        return false;
    }

    SortedSet<State> targets(State from, Symbol symbol) {
        SortedMap<Symbol, SortedSet<State>> row = map.get(from);
        SortedSet<State> ret = row == null ? null : row.get(symbol);
        return ret == null
            ? Collections.unmodifiableSortedSet(new TreeSet<State>())
            : Collections.unmodifiableSortedSet(ret);
    }

    SortedMap<Symbol, SortedSet<State>> row(State from) {
        SortedMap<Symbol, SortedSet<State>> row = map.get(from);
        return row == null
            ? Collections.unmodifiableSortedMap(new TreeMap<Symbol, SortedSet<State>>())
            : Collections.unmodifiableSortedMap(row);
    }

    boolean hasEpsilonTransitions() {
        for (SortedMap<Symbol, SortedSet<State>> row : map.values()) {
            if (row.containsKey(Symbol.EPSILON)) return true;
        }
        return false;
    }

    /**
     * @return true if no <code>(state, symbol)</code> has two next states.
     */
    boolean isFunctional() {
        for (SortedMap<Symbol, SortedSet<State>> row : map.values()) {
            for (SortedSet<State> targets : row.values()) {
                if (targets.size() > 1) return false;
            }
        }
        return true;
    }

    List<FiniteAutomaton.Transition> transitions() {
        List<FiniteAutomaton.Transition> ret =
            new ArrayList<FiniteAutomaton.Transition>(size);
        for (Map.Entry<State, SortedMap<Symbol, SortedSet<State>>> e : map.entrySet()) {
            for (Map.Entry<Symbol, SortedSet<State>> f : e.getValue().entrySet()) {
                for (State to : f.getValue()) {
                    ret.add(new FiniteAutomaton.Transition(e.getKey(), f.getKey(), to));
                }
            }
        }
        return ret;
    }
}
