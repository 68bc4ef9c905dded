/*
 * @LICENSE@
 */

package org.formlang.cfg;

import static org.formlang.Misc.LS;
import static org.formlang.Misc.setString;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.formlang.Misc.BreadthFirstVisitor;

/**
 * An immutable context-free grammar.
 * <p>
 * The start symbol, the head of every production and every symbol of every
 * production body are folded into the variable and terminal sets at
 * construction. Derived analyses (generating, nullable and reachable
 * symbols, unit pairs, the Chomsky Normal Form) are pure functions of the
 * grammar: they are computed on first use and cached. Two threads racing on
 * a first use may both compute the same result; whichever is cached last
 * wins, which is harmless since the results are equal.
 * <p>
 * Every transformation returns a new grammar; the receiver is never
 * modified.
 */
public final class CFG {

    private static final Logger logger = Logger.getLogger("org.formlang");
    private static final Level level = Level.FINER;

    /**
     * A pair <code>(A, B)</code> such that <code>A</code> derives
     * <code>B</code> using unit productions only.
     */
    public static final class UnitPair {

        private final Variable first;
        private final Variable second;

        public UnitPair(Variable first, Variable second) {
            this.first = first;
            this.second = second;
        }
        public Variable getFirst() {
            return first;
        }
        public Variable getSecond() {
            return second;
        }
        @Override
        public int hashCode() {
            return 31 * first.hashCode() + second.hashCode();
        }
        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof UnitPair))
                return false;
            final UnitPair up = (UnitPair) o;
            return first.equals(up.first) && second.equals(up.second);
        }
        @Override
        public String toString() {
            return "(" + first + ", " + second + ")";
        }
    }

    /**
     * A runtime exception thrown when the textual form of a grammar cannot
     * be parsed.
     */
    public static final class NotParsableException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        private final int line;

        public NotParsableException(String msg, int line) {
            super(msg + " (line " + line + ")");
            this.line = line;
        }

        /**
         * @return the 1-based line of the offending rule.
         */
        public int getLine() {
            return line;
        }
    }

    /*
     * Hands out variables that are not yet part of a grammar. Generated
     * labels always contain '#'; a counter suffix resolves any clash.
     */
    private static final class VariableAllocator {

        private final Set<String> taken = new HashSet<String>();
        private int counter = 0;

        VariableAllocator(Collection<Variable> existing) {
            for (Variable v : existing) taken.add(v.value);
        }

        Variable named(String hint) {
            String label = hint;
            while (!taken.add(label)) {
                label = hint + '#' + (++counter);
            }
            return new Variable(label);
        }

        Variable next(String prefix) {
            String label;
            do {
                label = prefix + '#' + (++counter);
            } while (!taken.add(label));
            return new Variable(label);
        }
    }

    private final SortedSet<Variable> variables;
    private final SortedSet<Terminal> terminals;
    private final Variable startSymbol;
    private final Set<Production> productions;

    private volatile Set<CfgObject> generatingSymbols;
    private volatile Set<CfgObject> nullableSymbols;
    private volatile Set<CfgObject> reachableSymbols;
    private volatile Set<UnitPair> unitPairs;
    private volatile Map<Variable, List<Production>> productionsByHead;
    private volatile CFG normalForm;

    public CFG(
            Collection<Variable> variables,
            Collection<Terminal> terminals,
            Variable startSymbol,
            Collection<Production> productions) {

        if (startSymbol == null) throw new NullPointerException("startSymbol");
        SortedSet<Variable> vs = new TreeSet<Variable>(variables);
        SortedSet<Terminal> ts = new TreeSet<Terminal>(terminals);
        Set<Production> ps = new LinkedHashSet<Production>(productions);
        vs.add(startSymbol);
        for (Production p : ps) {
            vs.add(p.getHead());
            for (CfgObject o : p.getBody()) {
                if (o instanceof Variable) {
                    vs.add((Variable) o);
                } else {
                    assert o instanceof Terminal : o;
                    ts.add((Terminal) o);
                }
            }
        }
        this.variables = Collections.unmodifiableSortedSet(vs);
        this.terminals = Collections.unmodifiableSortedSet(ts);
        this.startSymbol = startSymbol;
        this.productions = Collections.unmodifiableSet(ps);
    }

    public CFG(Variable startSymbol, Collection<Production> productions) {
        this(Collections.<Variable>emptySet(), Collections.<Terminal>emptySet(),
            startSymbol, productions);
    }

    /**
     * Reads a grammar from text, one rule per line:
     * <pre>
     *     S -> A B | a
     *     A -> a A | ε
     * </pre>
     * Tokens are whitespace separated. A token starting with an upper case
     * letter is a variable, any other token a terminal; <code>ε</code>,
     * <code>$</code> and <code>epsilon</code> stand for the empty string,
     * and <code>"VAR:x"</code> / <code>"TER:X"</code> force the kind. The
     * start symbol is <code>S</code> when present, otherwise the first head.
     *
     * @throws NotParsableException
     *             if a rule is malformed.
     */
    public static CFG fromText(String text) {
        return new CFGTextParser().parse(text, null);
    }

    public static CFG fromText(String text, Variable startSymbol) {
        return new CFGTextParser().parse(text, startSymbol);
    }

    public SortedSet<Variable> getVariables() {
        return variables;
    }

    public SortedSet<Terminal> getTerminals() {
        return terminals;
    }

    public Variable getStartSymbol() {
        return startSymbol;
    }

    public Set<Production> getProductions() {
        return productions;
    }

    List<Production> productionsOf(Variable head) {
        Map<Variable, List<Production>> map = productionsByHead;
        if (map == null) {
            map = new LinkedHashMap<Variable, List<Production>>();
            for (Production p : productions) {
                List<Production> list = map.get(p.getHead());
                if (list == null) {
                    list = new ArrayList<Production>();
                    map.put(p.getHead(), list);
                }
                list.add(p);
            }
            productionsByHead = map;
        }
        List<Production> ret = map.get(head);
        return ret != null ? ret : Collections.<Production>emptyList();
    }

    /**
     * @return the symbols deriving some terminal string: every terminal, and
     *         every variable with a production whose body is made of
     *         generating symbols only.
     */
    public Set<CfgObject> getGeneratingSymbols() {
        Set<CfgObject> ret = generatingSymbols;
        if (ret == null) {
            generatingSymbols = ret = generatingOrNullable(false);
        }
        return ret;
    }

    /**
     * @return the variables deriving the empty string.
     */
    public Set<CfgObject> getNullableSymbols() {
        Set<CfgObject> ret = nullableSymbols;
        if (ret == null) {
            nullableSymbols = ret = generatingOrNullable(true);
        }
        return ret;
    }

    /*
     * Forward fixed point: remaining[i] counts the body occurrences of
     * production i not yet known to be in the set, impacts maps a symbol to
     * the productions it occurs in (once per occurrence). A production
     * whose counter reaches zero brings its head in.
     */
    private Set<CfgObject> generatingOrNullable(boolean nullable) {

        final List<Production> prods = new ArrayList<Production>(productions);
        final int[] remaining = new int[prods.size()];
        final Map<CfgObject, List<Integer>> impacts =
            new HashMap<CfgObject, List<Integer>>();

        for (int i = 0; i < prods.size(); ++i) {
            List<CfgObject> body = prods.get(i).getBody();
            remaining[i] = body.size();
            for (CfgObject o : body) {
                List<Integer> list = impacts.get(o);
                if (list == null) {
                    list = new ArrayList<Integer>();
                    impacts.put(o, list);
                }
                list.add(i);
            }
        }

        final Set<CfgObject> ret = new LinkedHashSet<CfgObject>();
        final Queue<CfgObject> worklist = new LinkedList<CfgObject>();
        if (!nullable) {
            ret.addAll(terminals);
            worklist.addAll(terminals);
        }
        for (int i = 0; i < prods.size(); ++i) {
            if (remaining[i] == 0 && ret.add(prods.get(i).getHead())) {
                worklist.add(prods.get(i).getHead());
            }
        }
        while (!worklist.isEmpty()) {
            List<Integer> impacted = impacts.get(worklist.remove());
            if (impacted == null) continue;
            for (int i : impacted) {
                if (--remaining[i] == 0) {
                    Variable head = prods.get(i).getHead();
                    if (ret.add(head)) worklist.add(head);
                }
            }
        }
        return Collections.unmodifiableSet(ret);
    }

    /**
     * @return the symbols reachable from the start symbol, the start symbol
     *         included.
     */
    public Set<CfgObject> getReachableSymbols() {
        Set<CfgObject> ret = reachableSymbols;
        if (ret == null) {
            ret = new BreadthFirstVisitor<CfgObject>() {
                @Override
                protected Iterable<CfgObject> successors(CfgObject o) {
                    if (!(o instanceof Variable)) {
                        return Collections.<CfgObject>emptyList();
                    }
                    List<CfgObject> next = new ArrayList<CfgObject>();
                    for (Production p : productionsOf((Variable) o)) {
                        next.addAll(p.getBody());
                    }
                    return next;
                }
            }.start(startSymbol).visited();
            reachableSymbols = ret = Collections.unmodifiableSet(
                new LinkedHashSet<CfgObject>(ret));
        }
        return ret;
    }

    public boolean generateEpsilon() {
        return getNullableSymbols().contains(startSymbol);
    }

    /**
     * @return true if the grammar generates no word at all.
     */
    public boolean isEmpty() {
        return !getGeneratingSymbols().contains(startSymbol);
    }

    /**
     * Removes every symbol that is not both generating and reachable, along
     * with every production mentioning one. Generating symbols are computed
     * first and reachability is computed on the grammar that remains, so a
     * symbol only reachable through a non-generating one is dropped too.
     *
     * @return a new grammar without useless symbols.
     */
    public CFG removeUselessSymbols() {
        final Set<CfgObject> generating = getGeneratingSymbols();
        final Set<Production> stage = new LinkedHashSet<Production>();
        for (Production p : productions) {
            if (generating.contains(p.getHead())
                    && generating.containsAll(p.getBody())) {
                stage.add(p);
            }
        }
        final Set<CfgObject> reachable =
            new CFG(startSymbol, stage).getReachableSymbols();
        final Set<Production> kept = new LinkedHashSet<Production>();
        for (Production p : stage) {
            if (reachable.contains(p.getHead())) kept.add(p);
        }
        return new CFG(startSymbol, kept);
    }

    /**
     * @return a new grammar generating the same language minus the empty
     *         word, plus <code>start -> ε</code> when the start symbol is
     *         nullable.
     */
    public CFG removeEpsilon() {
        final Set<CfgObject> nullable = getNullableSymbols();
        final Set<Production> ret = new LinkedHashSet<Production>();
        for (Production p : productions) {
            List<List<CfgObject>> bodies = new ArrayList<List<CfgObject>>();
            bodies.add(new ArrayList<CfgObject>());
            for (CfgObject o : p.getBody()) {
                List<List<CfgObject>> next =
                    new ArrayList<List<CfgObject>>(2 * bodies.size());
                for (List<CfgObject> body : bodies) {
                    List<CfgObject> with = new ArrayList<CfgObject>(body);
                    with.add(o);
                    next.add(with);
                    if (nullable.contains(o)) next.add(body);
                }
                bodies = next;
            }
            for (List<CfgObject> body : bodies) {
                if (!body.isEmpty()) ret.add(new Production(p.getHead(), body));
            }
        }
        if (nullable.contains(startSymbol)) {
            ret.add(new Production(startSymbol));
        }
        return new CFG(variables, terminals, startSymbol, ret);
    }

    /**
     * @return every pair <code>(A, B)</code> with <code>A =>* B</code>
     *         through unit productions, including every <code>(A, A)</code>.
     */
    public Set<UnitPair> getUnitPairs() {
        Set<UnitPair> ret = unitPairs;
        if (ret == null) {
            final Map<Variable, List<Variable>> unitEdges =
                new HashMap<Variable, List<Variable>>();
            for (Production p : productions) {
                if (!p.isUnit()) continue;
                List<Variable> list = unitEdges.get(p.getHead());
                if (list == null) {
                    list = new ArrayList<Variable>();
                    unitEdges.put(p.getHead(), list);
                }
                list.add((Variable) p.getBody().get(0));
            }
            BreadthFirstVisitor<Variable> closure =
                new BreadthFirstVisitor<Variable>() {
                    @Override
                    protected Iterable<Variable> successors(Variable v) {
                        List<Variable> next = unitEdges.get(v);
                        return next != null ? next : Collections.<Variable>emptyList();
                    }
                };
            ret = new LinkedHashSet<UnitPair>();
            for (Variable v : variables) {
                for (Variable u : closure.start(v).visited()) {
                    ret.add(new UnitPair(v, u));
                }
            }
            unitPairs = ret = Collections.unmodifiableSet(ret);
        }
        return ret;
    }

    /**
     * @return a new grammar without unit productions: for every unit pair
     *         <code>(A, B)</code> and every non-unit production
     *         <code>B -> β</code> it has <code>A -> β</code>.
     */
    public CFG eliminateUnitProductions() {
        final Set<Production> ret = new LinkedHashSet<Production>();
        for (UnitPair up : getUnitPairs()) {
            for (Production p : productionsOf(up.getSecond())) {
                if (!p.isUnit()) {
                    ret.add(new Production(up.getFirst(), p.getBody()));
                }
            }
        }
        return new CFG(variables, terminals, startSymbol, ret);
    }

    /**
     * @return true if every production is <code>A -> B C</code>,
     *         <code>A -> a</code> or <code>start -> ε</code>.
     */
    public boolean isNormalForm() {
        for (Production p : productions) {
            List<CfgObject> body = p.getBody();
            switch (body.size()) {
            case 0:
                if (!p.getHead().equals(startSymbol)) return false;
                break;
            case 1:
                if (!(body.get(0) instanceof Terminal)) return false;
                break;
            case 2:
                if (!(body.get(0) instanceof Variable)
                        || !(body.get(1) instanceof Variable)) return false;
                break;
            default:
                return false;
            }
        }
        return true;
    }

    /**
     * Converts the grammar to Chomsky Normal Form: useless symbols,
     * epsilon productions and unit productions are removed, terminals in
     * long bodies are lifted into fresh variables and long bodies are split
     * in binary chains. The result is computed once per grammar.
     *
     * @return an equivalent grammar in Chomsky Normal Form.
     */
    public CFG toNormalForm() {
        CFG ret = normalForm;
        if (ret == null) {
            ret = isNormalForm() ? this : normalFormFrom();
            if (logger.isLoggable(level)) {
                logger.log(level, "normal form: " + LS + ret);
            }
            normalForm = ret;
        }
        return ret;
    }

    private CFG normalFormFrom() {

        final CFG reduced = removeUselessSymbols()
            .removeEpsilon()
            .eliminateUnitProductions()
            .removeUselessSymbols();

        final VariableAllocator fresh = new VariableAllocator(reduced.variables);
        final Map<Terminal, Variable> lifted = new HashMap<Terminal, Variable>();
        final Set<Production> ret = new LinkedHashSet<Production>();

        for (Production p : reduced.productions) {
            if (p.isEpsilon()) {
                continue;                   // start -> ε is re-added below
            }
            List<CfgObject> body = p.getBody();
            if (body.size() == 1) {
                assert body.get(0) instanceof Terminal : p;
                ret.add(p);
                continue;
            }
            List<CfgObject> vbody = new ArrayList<CfgObject>(body.size());
            for (CfgObject o : body) {
                if (o instanceof Terminal) {
                    Variable v = lifted.get(o);
                    if (v == null) {
                        v = fresh.named("T#" + o.value);
                        lifted.put((Terminal) o, v);
                        ret.add(new Production(v, o));
                    }
                    vbody.add(v);
                } else {
                    vbody.add(o);
                }
            }
            Variable head = p.getHead();
            final int n = vbody.size();
            for (int i = 0; i < n - 2; ++i) {
                Variable next = fresh.next("C");
                ret.add(new Production(head, vbody.get(i), next));
                head = next;
            }
            ret.add(new Production(head, vbody.get(n - 2), vbody.get(n - 1)));
        }
        if (generateEpsilon()) {
            ret.add(new Production(startSymbol));
        }
        return new CFG(startSymbol, ret);
    }

    /**
     * Membership test. The empty word is answered from the nullable
     * symbols; any other word by the CYK algorithm over the Chomsky Normal
     * Form.
     *
     * @param word
     *            the terminals of the word, in order.
     * @return true if the grammar generates <code>word</code>.
     */
    public boolean contains(List<Terminal> word) {
        if (word.isEmpty()) {
            return generateEpsilon();
        }
        return toNormalForm().cyk(word);
    }

    /**
     * @param labels
     *            the terminal labels of the word, in order.
     */
    public boolean contains(String... labels) {
        List<Terminal> word = new ArrayList<Terminal>(labels.length);
        for (String label : labels) word.add(new Terminal(label));
        return contains(word);
    }

    /*
     * table[i][j] holds the variables deriving word[i..j] (inclusive).
     */
    @SuppressWarnings("unchecked")
    private boolean cyk(List<Terminal> word) {
        assert isNormalForm() : this;

        final Map<CfgObject, Set<Variable>> terminalRules =
            new HashMap<CfgObject, Set<Variable>>();
        final List<Production> binaryRules = new ArrayList<Production>();
        for (Production p : productions) {
            if (p.getBody().size() == 1) {
                Set<Variable> heads = terminalRules.get(p.getBody().get(0));
                if (heads == null) {
                    heads = new HashSet<Variable>();
                    terminalRules.put(p.getBody().get(0), heads);
                }
                heads.add(p.getHead());
            } else if (p.getBody().size() == 2) {
                binaryRules.add(p);
            }
        }

        final int n = word.size();
        final Set<Variable>[][] table = new Set[n][n];
        for (int i = 0; i < n; ++i) {
            Set<Variable> heads = terminalRules.get(word.get(i));
            table[i][i] = heads != null
                ? heads : Collections.<Variable>emptySet();
        }
        for (int len = 2; len <= n; ++len) {
            for (int i = 0; i + len <= n; ++i) {
                final int j = i + len - 1;
                final Set<Variable> cell = new HashSet<Variable>();
                for (int k = i; k < j; ++k) {
                    Set<Variable> left = table[i][k];
                    Set<Variable> right = table[k + 1][j];
                    if (left.isEmpty() || right.isEmpty()) continue;
                    for (Production p : binaryRules) {
                        if (left.contains(p.getBody().get(0))
                                && right.contains(p.getBody().get(1))) {
                            cell.add(p.getHead());
                        }
                    }
                }
                table[i][j] = cell;
            }
        }
        return table[0][n - 1].contains(startSymbol);
    }

    /**
     * @return the grammar in the text format read by
     *         {@link #fromText(String)}.
     */
    public String toText() {
        return CFGTextParser.toText(this);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("CFG:").append(LS);
        sb.append("Variables: ").append(setString(variables)).append(LS);
        sb.append("Terminals: ").append(setString(terminals)).append(LS);
        sb.append("Start Symbol: ").append(startSymbol).append(LS);
        sb.append("Productions:").append(LS);
        for (Production p : productions) {
            sb.append("  ").append(p).append(LS);
        }
        return sb.toString();
    }
}
