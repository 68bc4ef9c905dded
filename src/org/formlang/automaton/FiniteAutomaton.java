/*
 * @LICENSE@
 */

package org.formlang.automaton;

import static org.formlang.Misc.LS;
import static org.formlang.Misc.setString;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.formlang.Misc;
import org.formlang.Misc.BreadthFirstVisitor;

/**
 * Base class of the three kinds of finite automata: {@link EpsilonNFA},
 * {@link NondeterministicFiniteAutomaton} and
 * {@link DeterministicFiniteAutomaton}. There are no other subclasses.
 * <p>
 * An automaton is immutable once built; every operation returns a new
 * automaton. States created by an operation (subsets, product pairs, sinks,
 * renamed copies) get fresh labels, so operands are never aliased into the
 * result.
 * <p>
 * Input symbols never include {@link Symbol#EPSILON}. Words passed to
 * {@link #accepts(List)} may contain it; it is skipped.
 */
public abstract class FiniteAutomaton {

    private static final Logger logger = Logger.getLogger("org.formlang");
    private static final Level level = Level.FINEST;

    /**
     * Upper bound on the number of subsets the subset construction may
     * create before giving up.
     */
    public static final int MAX_STATE_COUNT = 10 * 1000;

    /**
     * A runtime exception thrown when an automaton construction exceeds
     * its resource bounds.
     */
    public static final class ConstructionException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public ConstructionException(String msg) {
            super(msg);
        }
    }

    /**
     * Thrown when a deterministic automaton is given a second, different
     * next state for the same <code>(state, symbol)</code>.
     */
    public static final class NondeterministicTransitionException extends IllegalStateException {

        private static final long serialVersionUID = 1L;

        public NondeterministicTransitionException(String msg) {
            super(msg);
        }
    }

    /**
     * A <code>(from, symbol, to)</code> triple.
     */
    public static final class Transition implements Comparable<Transition> {

        private final State from;
        private final Symbol symbol;
        private final State to;

        public Transition(State from, Symbol symbol, State to) {
            this.from = from;
            this.symbol = symbol;
            this.to = to;
        }
        public State getFrom() {
            return from;
        }
        public Symbol getSymbol() {
            return symbol;
        }
        public State getTo() {
            return to;
        }
        public int compareTo(Transition o) {
            int ret = from.compareTo(o.from);
            if (ret == 0) ret = symbol.compareTo(o.symbol);
            if (ret == 0) ret = to.compareTo(o.to);
            return ret;
        }
        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Transition))
                return false;
            final Transition t = (Transition) o;
            return from.equals(t.from) && symbol.equals(t.symbol) && to.equals(t.to);
        }
        @Override
        public int hashCode() {
            return (from.hashCode() * 31 + symbol.hashCode()) * 31 + to.hashCode();
        }
        @Override
        public String toString() {
            return from + " --" + symbol + "--> " + to;
        }
    }

    /**
     * Accumulates the parts of an automaton. Adding a transition, a start
     * state or a final state also adds its states and symbol.
     *
     * @param <B>
     *            the concrete builder, returned by every mutator for
     *            chaining.
     */
    public abstract static class AbstractBuilder<B extends AbstractBuilder<B>> {

        final SortedSet<State> states = new TreeSet<State>();
        final SortedSet<Symbol> inputSymbols = new TreeSet<Symbol>();
        final SortedSet<State> startStates = new TreeSet<State>();
        final SortedSet<State> finalStates = new TreeSet<State>();
        final TransitionFunction delta = new TransitionFunction();

        AbstractBuilder() {
        }

        abstract B self();

        /*
         * hook for the variants to veto a transition before it is added
         */
        void checkTransition(State from, Symbol symbol, State to) {
        }

        public B addState(State state) {
            states.add(state);
            return self();
        }

        public B addState(String label) {
            return addState(new State(label));
        }

        public B addInputSymbol(Symbol symbol) {
            if (symbol.isEpsilon()) {
                throw new IllegalArgumentException("epsilon is not an input symbol");
            }
            inputSymbols.add(symbol);
            return self();
        }

        public B addInputSymbol(String label) {
            return addInputSymbol(new Symbol(label));
        }

        public B addTransition(State from, Symbol symbol, State to) {
            checkTransition(from, symbol, to);
            states.add(from);
            states.add(to);
            if (!symbol.isEpsilon()) inputSymbols.add(symbol);
            delta.add(from, symbol, to);
            return self();
        }

        public B addTransition(String from, String symbol, String to) {
            return addTransition(new State(from), new Symbol(symbol), new State(to));
        }

        public B addStartState(State state) {
            states.add(state);
            startStates.add(state);
            return self();
        }

        public B addStartState(String label) {
            return addStartState(new State(label));
        }

        public B addFinalState(State state) {
            states.add(state);
            finalStates.add(state);
            return self();
        }

        public B addFinalState(String label) {
            return addFinalState(new State(label));
        }

        public abstract FiniteAutomaton build();
    }

    /*
     * Acceptance rules for the product construction.
     */
    enum Product {
        UNION {
            boolean isFinal(boolean lhs, boolean rhs) {
                return lhs || rhs;
            }
        },
        INTERSECTION {
            boolean isFinal(boolean lhs, boolean rhs) {
                return lhs && rhs;
            }
        },
        DIFFERENCE {
            boolean isFinal(boolean lhs, boolean rhs) {
                return lhs && !rhs;
            }
        },
        SYMMETRIC_DIFFERENCE {
            boolean isFinal(boolean lhs, boolean rhs) {
                return lhs != rhs;
            }
        };

        abstract boolean isFinal(boolean lhs, boolean rhs);
    }

    final SortedSet<State> states;
    final SortedSet<Symbol> inputSymbols;
    final SortedSet<State> startStates;
    final SortedSet<State> finalStates;
    final TransitionFunction delta;

    FiniteAutomaton(AbstractBuilder<?> b) {
        this.states = Collections.unmodifiableSortedSet(new TreeSet<State>(b.states));
        this.inputSymbols = Collections.unmodifiableSortedSet(new TreeSet<Symbol>(b.inputSymbols));
        this.startStates = Collections.unmodifiableSortedSet(new TreeSet<State>(b.startStates));
        this.finalStates = Collections.unmodifiableSortedSet(new TreeSet<State>(b.finalStates));
        this.delta = new TransitionFunction(b.delta);
    }

    abstract String kindName();

    public SortedSet<State> getStates() {
        return states;
    }

    public SortedSet<Symbol> getInputSymbols() {
        return inputSymbols;
    }

    public SortedSet<State> getStartStates() {
        return startStates;
    }

    public SortedSet<State> getFinalStates() {
        return finalStates;
    }

    public boolean isFinal(State state) {
        return finalStates.contains(state);
    }

    /**
     * @return every transition, sorted by source, symbol and target.
     */
    public List<Transition> getTransitions() {
        return Collections.unmodifiableList(delta.transitions());
    }

    /**
     * @return the states reachable from <code>from</code> through
     *         {@link Symbol#EPSILON} transitions, <code>from</code>
     *         included.
     */
    public SortedSet<State> epsilonClosure(State from) {
        return epsilonClosure(Collections.singleton(from));
    }

    public SortedSet<State> epsilonClosure(Collection<State> from) {
        Set<State> visited = new BreadthFirstVisitor<State>() {
            @Override
            protected Iterable<State> successors(State state) {
                return delta.targets(state, Symbol.EPSILON);
            }
        }.start(from).visited();
        return Collections.unmodifiableSortedSet(new TreeSet<State>(visited));
    }

    /*
     * states reachable from the start states along any transition
     */
    Set<State> reachableStates() {
        return new BreadthFirstVisitor<State>() {
            @Override
            protected Iterable<State> successors(State state) {
                List<State> next = new ArrayList<State>();
                for (SortedSet<State> targets : delta.row(state).values()) {
                    next.addAll(targets);
                }
                return next;
            }
        }.start(startStates).visited();
    }

    /**
     * Subset simulation.
     *
     * @param word
     *            the symbols of the word, in order.
     * @return true if some run on <code>word</code> ends in a final state.
     */
    public boolean accepts(List<Symbol> word) {
        Set<State> current = epsilonClosure(startStates);
        for (Symbol symbol : word) {
            if (symbol.isEpsilon()) continue;
            Set<State> next = new TreeSet<State>();
            for (State state : current) {
                next.addAll(delta.targets(state, symbol));
            }
            if (next.isEmpty()) return false;
            current = epsilonClosure(next);
        }
        return !Misc.disjoint(current, finalStates);
    }

    /**
     * @param labels
     *            the symbol labels of the word, in order.
     */
    public boolean accepts(String... labels) {
        return accepts(wordFrom(labels));
    }

    static List<Symbol> wordFrom(String... labels) {
        List<Symbol> ret = new ArrayList<Symbol>(labels.length);
        for (String label : labels) ret.add(new Symbol(label));
        return ret;
    }

    public boolean acceptsEpsilon() {
        return accepts(Collections.<Symbol>emptyList());
    }

    /**
     * @return true if no final state is reachable from a start state.
     */
    public boolean isEmpty() {
        return Misc.disjoint(reachableStates(), finalStates);
    }

    /**
     * @return true if there is at most one start state, no epsilon
     *         transition and at most one next state per
     *         <code>(state, symbol)</code>.
     */
    public boolean isDeterministic() {
        return startStates.size() <= 1
            && !delta.hasEpsilonTransitions()
            && delta.isFunctional();
    }

    /*
     * copies every part of this automaton into b, labels unchanged
     */
    <B extends AbstractBuilder<B>> B copyInto(B b) {
        for (State state : states) b.addState(state);
        for (Symbol symbol : inputSymbols) b.addInputSymbol(symbol);
        for (Transition t : delta.transitions()) {
            b.addTransition(t.getFrom(), t.getSymbol(), t.getTo());
        }
        for (State state : startStates) b.addStartState(state);
        for (State state : finalStates) b.addFinalState(state);
        return b;
    }

    /**
     * Subset construction over epsilon-closed sets of states. Only the
     * subsets reachable from the start closure are built and the empty
     * subset never is, so the result is in general partial.
     *
     * @throws ConstructionException
     *             if more than {@link #MAX_STATE_COUNT} subsets are needed.
     */
    public DeterministicFiniteAutomaton toDeterministic() {

        if (isDeterministic()) {
            return copyInto(new DeterministicFiniteAutomaton.Builder()).build();
        }

        final DeterministicFiniteAutomaton.Builder b =
            new DeterministicFiniteAutomaton.Builder();
        for (Symbol symbol : inputSymbols) b.addInputSymbol(symbol);
        if (startStates.isEmpty()) {
            return b.build();
        }

        final StateAllocator allocator = new StateAllocator();
        final Map<Set<State>, State> names = new HashMap<Set<State>, State>();
        final SortedSet<State> init = epsilonClosure(startStates);

        new BreadthFirstVisitor<SortedSet<State>>() {

            int watchdog = 0;

            State nameOf(SortedSet<State> subset) {
                State ret = names.get(subset);
                if (ret == null) {
                    ret = allocator.named(setString(subset));
                    names.put(subset, ret);
                    b.addState(ret);
                }
                return ret;
            }

            @Override
            protected void visit(SortedSet<State> subset) {
                if (++watchdog > MAX_STATE_COUNT) {
                    throw new ConstructionException(
                        "DFA state count exceeded: " + MAX_STATE_COUNT);
                }
                // every visited subset is a state, dead non-final ones included
                State state = nameOf(subset);
                if (!Misc.disjoint(subset, finalStates)) {
                    b.addFinalState(state);
                }
            }

            @Override
            protected Iterable<SortedSet<State>> successors(SortedSet<State> subset) {
                List<SortedSet<State>> ret = new ArrayList<SortedSet<State>>();
                for (Symbol symbol : inputSymbols) {
                    Set<State> step = new TreeSet<State>();
                    for (State state : subset) {
                        step.addAll(delta.targets(state, symbol));
                    }
                    if (step.isEmpty()) continue;
                    SortedSet<State> next = epsilonClosure(step);
                    b.addTransition(nameOf(subset), symbol, nameOf(next));
                    ret.add(next);
                }
                return ret;
            }
        }.start(init);

        b.setStartState(names.get(init));
        DeterministicFiniteAutomaton ret = b.build();
        if (logger.isLoggable(level)) {
            logger.log(level, "subset construction: " + LS + ret);
        }
        return ret;
    }

    /**
     * @return an automaton without epsilon transitions accepting the same
     *         language: <code>q --a--> r</code> whenever <code>r</code> is in
     *         the closure of a step on <code>a</code> from the closure of
     *         <code>q</code>, and <code>q</code> is final when its closure
     *         holds a final state.
     */
    public NondeterministicFiniteAutomaton removeEpsilonTransitions() {
        NondeterministicFiniteAutomaton.Builder b =
            new NondeterministicFiniteAutomaton.Builder();
        for (State state : states) b.addState(state);
        for (Symbol symbol : inputSymbols) b.addInputSymbol(symbol);
        for (State state : startStates) b.addStartState(state);
        for (State state : states) {
            SortedSet<State> closure = epsilonClosure(state);
            if (!Misc.disjoint(closure, finalStates)) b.addFinalState(state);
            for (Symbol symbol : inputSymbols) {
                Set<State> step = new TreeSet<State>();
                for (State p : closure) step.addAll(delta.targets(p, symbol));
                for (State r : epsilonClosure(step)) {
                    b.addTransition(state, symbol, r);
                }
            }
        }
        return b.build();
    }

    /**
     * The complement is taken relative to this automaton's own input
     * symbols: a word holding any other symbol is accepted by neither.
     *
     * @return a complete DFA accepting exactly the words over the input
     *         symbols this automaton rejects.
     */
    public DeterministicFiniteAutomaton complement() {
        DeterministicFiniteAutomaton complete = toDeterministic().toComplete();
        DeterministicFiniteAutomaton.Builder b =
            new DeterministicFiniteAutomaton.Builder();
        for (State state : complete.states) {
            b.addState(state);
            if (!complete.isFinal(state)) b.addFinalState(state);
        }
        for (Symbol symbol : complete.inputSymbols) b.addInputSymbol(symbol);
        for (Transition t : complete.delta.transitions()) {
            b.addTransition(t.getFrom(), t.getSymbol(), t.getTo());
        }
        b.setStartState(complete.getStartState());
        return b.build();
    }

    /**
     * Two DFAs are combined by the product construction and give a DFA;
     * otherwise both are embedded side by side under a fresh start state
     * with epsilon transitions to the old start states.
     */
    public FiniteAutomaton union(FiniteAutomaton other) {
        if (this instanceof DeterministicFiniteAutomaton
                && other instanceof DeterministicFiniteAutomaton) {
            return product(this, other, Product.UNION);
        }
        EpsilonNFA.Builder b = new EpsilonNFA.Builder();
        StateAllocator allocator = new StateAllocator();
        Map<State, State> lhs = embed(this, b, allocator, true);
        Map<State, State> rhs = embed(other, b, allocator, true);
        State start = allocator.named("start");
        b.addStartState(start);
        for (State state : startStates) {
            b.addTransition(start, Symbol.EPSILON, lhs.get(state));
        }
        for (State state : other.startStates) {
            b.addTransition(start, Symbol.EPSILON, rhs.get(state));
        }
        return b.build();
    }

    public DeterministicFiniteAutomaton intersection(FiniteAutomaton other) {
        return product(this, other, Product.INTERSECTION);
    }

    /**
     * @return a DFA accepting the words accepted by this automaton and not
     *         by <code>other</code>.
     */
    public DeterministicFiniteAutomaton difference(FiniteAutomaton other) {
        return product(this, other, Product.DIFFERENCE);
    }

    public EpsilonNFA concatenate(FiniteAutomaton other) {
        EpsilonNFA.Builder b = new EpsilonNFA.Builder();
        StateAllocator allocator = new StateAllocator();
        Map<State, State> lhs = embed(this, b, allocator, false);
        Map<State, State> rhs = embed(other, b, allocator, true);
        for (State state : startStates) {
            b.addStartState(lhs.get(state));
        }
        for (State f : finalStates) {
            for (State s : other.startStates) {
                b.addTransition(lhs.get(f), Symbol.EPSILON, rhs.get(s));
            }
        }
        return b.build();
    }

    public EpsilonNFA kleeneStar() {
        EpsilonNFA.Builder b = new EpsilonNFA.Builder();
        StateAllocator allocator = new StateAllocator();
        Map<State, State> inner = embed(this, b, allocator, false);
        State hub = allocator.named("start");
        b.addStartState(hub).addFinalState(hub);
        for (State state : startStates) {
            b.addTransition(hub, Symbol.EPSILON, inner.get(state));
        }
        for (State state : finalStates) {
            b.addTransition(inner.get(state), Symbol.EPSILON, hub);
        }
        return b.build();
    }

    /**
     * @return true if both automata accept the same words, decided by the
     *         emptiness of the symmetric difference of their completed
     *         DFAs over the joint input symbols.
     */
    public boolean isEquivalentTo(FiniteAutomaton other) {
        return product(this, other, Product.SYMMETRIC_DIFFERENCE).isEmpty();
    }

    /*
     * Copies fa's states under fresh labels, with its symbols and
     * transitions (and finals if asked). Start states are left to the
     * caller.
     */
    private static Map<State, State> embed(
            FiniteAutomaton fa,
            AbstractBuilder<?> b,
            StateAllocator allocator,
            boolean keepFinals) {

        Map<State, State> ret = new LinkedHashMap<State, State>();
        for (State state : fa.states) {
            State copy = allocator.named(state.getLabel());
            ret.put(state, copy);
            b.addState(copy);
        }
        for (Symbol symbol : fa.inputSymbols) b.addInputSymbol(symbol);
        for (Transition t : fa.delta.transitions()) {
            b.addTransition(ret.get(t.getFrom()), t.getSymbol(), ret.get(t.getTo()));
        }
        if (keepFinals) {
            for (State state : fa.finalStates) b.addFinalState(ret.get(state));
        }
        return ret;
    }

    /*
     * Product construction over the joint input symbols. Both operands are
     * determinized and completed first, so every pair has a successor on
     * every symbol; only pairs reachable from the start pair are built.
     */
    static DeterministicFiniteAutomaton product(
            FiniteAutomaton lhs,
            FiniteAutomaton rhs,
            final Product mode) {

        final SortedSet<Symbol> sigma = new TreeSet<Symbol>(lhs.inputSymbols);
        sigma.addAll(rhs.inputSymbols);
        final DeterministicFiniteAutomaton l = lhs.toDeterministic().toComplete(sigma);
        final DeterministicFiniteAutomaton r = rhs.toDeterministic().toComplete(sigma);

        final DeterministicFiniteAutomaton.Builder b =
            new DeterministicFiniteAutomaton.Builder();
        for (Symbol symbol : sigma) b.addInputSymbol(symbol);

        final StateAllocator allocator = new StateAllocator();
        final Map<List<State>, State> names = new HashMap<List<State>, State>();
        final List<State> init = Arrays.asList(l.getStartState(), r.getStartState());

        new BreadthFirstVisitor<List<State>>() {

            State nameOf(List<State> pair) {
                State ret = names.get(pair);
                if (ret == null) {
                    ret = allocator.named("(" + pair.get(0) + ", " + pair.get(1) + ")");
                    names.put(pair, ret);
                    b.addState(ret);
                }
                return ret;
            }

            @Override
            protected void visit(List<State> pair) {
                if (mode.isFinal(l.isFinal(pair.get(0)), r.isFinal(pair.get(1)))) {
                    b.addFinalState(nameOf(pair));
                }
            }

            @Override
            protected Iterable<List<State>> successors(List<State> pair) {
                List<List<State>> ret = new ArrayList<List<State>>(sigma.size());
                for (Symbol symbol : sigma) {
                    List<State> next = Arrays.asList(
                        l.nextState(pair.get(0), symbol),
                        r.nextState(pair.get(1), symbol));
                    b.addTransition(nameOf(pair), symbol, nameOf(next));
                    ret.add(next);
                }
                return ret;
            }
        }.start(init);

        b.setStartState(names.get(init));
        DeterministicFiniteAutomaton ret = b.build();
        if (logger.isLoggable(level)) {
            logger.log(level, mode + " product: " + LS + ret);
        }
        return ret;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(kindName()).append(':').append(LS);
        sb.append("States: ").append(setString(states)).append(LS);
        sb.append("Input symbols: ").append(setString(inputSymbols)).append(LS);
        sb.append("Start state(s): ").append(setString(startStates)).append(LS);
        sb.append("Final states: ").append(setString(finalStates)).append(LS);
        sb.append("Transitions:").append(LS);
        for (Transition t : delta.transitions()) {
            sb.append("  ").append(t).append(LS);
        }
        return sb.toString();
    }
}
