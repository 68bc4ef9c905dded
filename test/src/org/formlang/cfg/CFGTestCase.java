/*
 * @LICENSE@
 */

package org.formlang.cfg;

import static org.formlang.FormalAssert.*;
import static org.formlang.Misc.LS;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import org.formlang.AbstractFormalTestCase;

public class CFGTestCase extends AbstractFormalTestCase {

    private static final Variable S = new Variable("S");
    private static final Variable A = new Variable("A");
    private static final Variable B = new Variable("B");
    private static final Variable C = new Variable("C");
    private static final Terminal a = new Terminal("a");
    private static final Terminal b = new Terminal("b");
    private static final Terminal c = new Terminal("c");

    /*
     * S -> A B, A -> a A | a, B -> b B | b
     */
    private static CFG aPlusBPlus() {
        return new CFG(S, Arrays.asList(
            new Production(S, A, B),
            new Production(A, a, A),
            new Production(A, a),
            new Production(B, b, B),
            new Production(B, b)));
    }

    public static void main(String[] args) {
        junit.textui.TestRunner.run(CFGTestCase.class);
    }

    public CFGTestCase(String name) {
        super(name);
    }

    public void testSymbolsAreFolded() {
        CFG cfg = new CFG(
            Collections.singleton(C),
            Collections.singleton(c),
            S,
            Arrays.asList(new Production(S, A, b)));
        assertEquals(new HashSet<Variable>(Arrays.asList(S, A, C)), cfg.getVariables());
        assertEquals(new HashSet<Terminal>(Arrays.asList(b, c)), cfg.getTerminals());
        assertEquals(S, cfg.getStartSymbol());
        assertEquals(1, cfg.getProductions().size());
        try {
            cfg.getVariables().add(B);
            fail("should throw");
        } catch (UnsupportedOperationException e) {}
    }

    public void testConcreteScenario() {
        CFG cfg = aPlusBPlus();
        assertContains(cfg, "ab", "aabb", "aaabbb");
        assertNotContains(cfg, "", "ba", "a", "b", "abab");
        // the language is a+ b+, so a single b after two a's is generated
        assertContains(cfg, "aab", "abbb");
    }

    public void testEqualCountsRejectUnbalanced() {
        CFG cfg = new CFG(S, Arrays.asList(
            new Production(S, a, S, b),
            new Production(S, a, b)));
        assertContains(cfg, "ab", "aabb", "aaabbb");
        assertNotContains(cfg, "", "ba", "aab", "abb", "abab");
    }

    public void testGeneratingSymbols() {
        CFG cfg = new CFG(S, Arrays.asList(
            new Production(S, A, B),
            new Production(S, a),
            new Production(A, a, A),
            new Production(B, b)));
        Set<CfgObject> generating = cfg.getGeneratingSymbols();
        assertTrue(generating.containsAll(Arrays.asList(S, B, a, b)));
        assertFalse(generating.contains(A));
        assertFalse(generating.contains(Epsilon.INSTANCE));
        assertSame(generating, cfg.getGeneratingSymbols());
    }

    public void testNullableSymbols() {
        CFG cfg = new CFG(S, Arrays.asList(
            new Production(S, A, B),
            new Production(A, a, A),
            new Production(A),
            new Production(B, b),
            new Production(B, Epsilon.INSTANCE),
            new Production(C, c)));
        assertEquals(new HashSet<CfgObject>(Arrays.asList(S, A, B)),
            cfg.getNullableSymbols());
        assertTrue(cfg.generateEpsilon());
        assertFalse(aPlusBPlus().generateEpsilon());
        assertTrue(aPlusBPlus().getNullableSymbols().isEmpty());
    }

    public void testNullableNeedsEveryOccurrence() {
        // S -> A A c is not nullable even though A is
        CFG cfg = new CFG(S, Arrays.asList(
            new Production(S, A, A, c),
            new Production(A)));
        assertFalse(cfg.generateEpsilon());
        assertTrue(cfg.getNullableSymbols().contains(A));
    }

    public void testReachableSymbols() {
        CFG cfg = new CFG(S, Arrays.asList(
            new Production(S, A, a),
            new Production(A, b),
            new Production(B, c),
            new Production(C, B)));
        assertEquals(new HashSet<CfgObject>(Arrays.asList(S, A, a, b)),
            cfg.getReachableSymbols());
    }

    public void testRemoveUselessSymbols() {
        CFG cfg = new CFG(S, Arrays.asList(
            new Production(S, A, B),
            new Production(S, a),
            new Production(A, a, A),
            new Production(B, b),
            new Production(C, c)));
        CFG reduced = cfg.removeUselessSymbols();
        assertEquals(Collections.singleton(new Production(S, a)), reduced.getProductions());
        assertEquals(Collections.singleton(S), reduced.getVariables());
        assertEquals(Collections.singleton(a), reduced.getTerminals());
        // the input is untouched
        assertEquals(5, cfg.getProductions().size());
    }

    public void testRemoveUselessOfEmptyLanguage() {
        CFG cfg = new CFG(S, Arrays.asList(new Production(S, a, S)));
        assertTrue(cfg.isEmpty());
        CFG reduced = cfg.removeUselessSymbols();
        assertTrue(reduced.getProductions().isEmpty());
        assertEquals(S, reduced.getStartSymbol());
        assertNotContains(cfg, "", "a", "aa");
    }

    public void testFixedPointsAreIdempotent() {
        CFG cfg = new CFG(S, Arrays.asList(
            new Production(S, A, B),
            new Production(S, B, C),
            new Production(A, a, A),
            new Production(A),
            new Production(B, b),
            new Production(C, C, c)));
        CFG once = cfg.removeUselessSymbols();
        CFG twice = once.removeUselessSymbols();
        assertEquals(once.getProductions(), twice.getProductions());
        assertEquals(once.getGeneratingSymbols(), twice.getGeneratingSymbols());
        assertEquals(once.getNullableSymbols(), twice.getNullableSymbols());
        assertEquals(once.getReachableSymbols(), twice.getReachableSymbols());
    }

    public void testRemoveEpsilon() {
        CFG cfg = new CFG(S, Arrays.asList(
            new Production(S, A, B),
            new Production(A, a, A),
            new Production(A),
            new Production(B, b),
            new Production(B)));
        CFG noEps = cfg.removeEpsilon();
        Set<Production> expected = new HashSet<Production>(Arrays.asList(
            new Production(S, A, B),
            new Production(S, A),
            new Production(S, B),
            new Production(S),
            new Production(A, a, A),
            new Production(A, a),
            new Production(B, b)));
        assertEquals(expected, noEps.getProductions());
        for (String w : words("ab", 5)) {
            assertEquals(w, cfg.contains(labels(w)), noEps.contains(labels(w)));
        }
    }

    public void testRemoveEpsilonKeepsOnlyStartEpsilon() {
        CFG cfg = new CFG(S, Arrays.asList(
            new Production(S, a, A),
            new Production(A, b),
            new Production(A)));
        CFG noEps = cfg.removeEpsilon();
        assertFalse(noEps.generateEpsilon());
        for (Production p : noEps.getProductions()) {
            assertFalse(p.toString(), p.getBody().isEmpty());
        }
        assertContains(noEps, "a", "ab");
    }

    public void testUnitPairs() {
        CFG cfg = new CFG(S, Arrays.asList(
            new Production(S, A),
            new Production(A, B),
            new Production(B, b)));
        Set<CFG.UnitPair> expected = new HashSet<CFG.UnitPair>(Arrays.asList(
            new CFG.UnitPair(S, S),
            new CFG.UnitPair(S, A),
            new CFG.UnitPair(S, B),
            new CFG.UnitPair(A, A),
            new CFG.UnitPair(A, B),
            new CFG.UnitPair(B, B)));
        assertEquals(expected, cfg.getUnitPairs());
        assertEquals("(S, A)", new CFG.UnitPair(S, A).toString());
    }

    public void testEliminateUnitProductions() {
        CFG cfg = new CFG(S, Arrays.asList(
            new Production(S, A),
            new Production(S, a, S),
            new Production(A, B),
            new Production(B, b)));
        CFG noUnits = cfg.eliminateUnitProductions();
        Set<Production> expected = new HashSet<Production>(Arrays.asList(
            new Production(S, b),
            new Production(S, a, S),
            new Production(A, b),
            new Production(B, b)));
        assertEquals(expected, noUnits.getProductions());
        assertSameLanguage(cfg, noUnits, "ab", 5);
    }

    public void testUnitCycle() {
        CFG cfg = new CFG(S, Arrays.asList(
            new Production(S, A),
            new Production(A, S),
            new Production(A, a)));
        CFG noUnits = cfg.eliminateUnitProductions();
        assertEquals(new HashSet<Production>(Arrays.asList(
            new Production(S, a),
            new Production(A, a))), noUnits.getProductions());
        assertContains(cfg, "a");
        assertNotContains(cfg, "", "aa");
    }

    public void testEmptyWordOnEpsilonGrammar() {
        CFG cfg = new CFG(S, Arrays.asList(new Production(S)));
        assertTrue(cfg.generateEpsilon());
        assertTrue(cfg.contains(Collections.<Terminal>emptyList()));
        assertNotContains(cfg, "a");
    }

    public void testGrammarWithoutProductions() {
        CFG cfg = new CFG(S, Collections.<Production>emptySet());
        assertTrue(cfg.isEmpty());
        assertFalse(cfg.generateEpsilon());
        assertNotContains(cfg, "", "a");
        assertTrue(cfg.isNormalForm());
    }

    public void testUnknownTerminal() {
        assertNotContains(aPlusBPlus(), "ac", "c");
        assertFalse(aPlusBPlus().contains("a", "bb"));
    }

    public void testToString() {
        CFG cfg = new CFG(S, Arrays.asList(
            new Production(S, A, b),
            new Production(A)));
        String expected =
            "CFG:" + LS +
            "Variables: {A, S}" + LS +
            "Terminals: {b}" + LS +
            "Start Symbol: S" + LS +
            "Productions:" + LS +
            "  S -> A b" + LS +
            "  A -> ε" + LS;
        assertEquals(expected, cfg.toString());
    }
}
