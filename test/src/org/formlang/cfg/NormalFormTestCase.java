/*
 * @LICENSE@
 */

package org.formlang.cfg;

import static org.formlang.FormalAssert.*;

import java.util.Arrays;

import org.formlang.AbstractFormalTestCase;

/**
 * Chomsky Normal Form conversion and CYK membership, checked against
 * grammars whose languages are known in closed form.
 */
public class NormalFormTestCase extends AbstractFormalTestCase {

    private static final Variable S = new Variable("S");
    private static final Variable A = new Variable("A");
    private static final Variable B = new Variable("B");
    private static final Terminal a = new Terminal("a");
    private static final Terminal b = new Terminal("b");

    public static void main(String[] args) {
        junit.textui.TestRunner.run(NormalFormTestCase.class);
    }

    public NormalFormTestCase(String name) {
        super(name);
    }

    private interface Language {
        boolean contains(String w);
    }

    private static int count(String w, char c) {
        int n = 0;
        for (int i = 0; i < w.length(); ++i) if (w.charAt(i) == c) ++n;
        return n;
    }

    private static void assertLanguage(CFG cfg, Language expected, int maxLength) {
        CFG cnf = cfg.toNormalForm();
        assertTrue(cnf.toString(), cnf.isNormalForm());
        for (String w : words("ab", maxLength)) {
            assertEquals("\"" + w + "\" in " + cfg, expected.contains(w), cfg.contains(labels(w)));
            assertEquals("\"" + w + "\" in " + cnf, expected.contains(w), cnf.contains(labels(w)));
        }
    }

    public void testDyck() {
        // S -> a S b | S S | ε
        CFG cfg = new CFG(S, Arrays.asList(
            new Production(S, a, S, b),
            new Production(S, S, S),
            new Production(S)));
        assertLanguage(cfg, new Language() {
            public boolean contains(String w) {
                int depth = 0;
                for (int i = 0; i < w.length(); ++i) {
                    depth += w.charAt(i) == 'a' ? 1 : -1;
                    if (depth < 0) return false;
                }
                return depth == 0;
            }
        }, 8);
    }

    public void testEqualCounts() {
        // S -> a B | b A, A -> a | a S | b A A, B -> b | b S | a B B
        CFG cfg = new CFG(S, Arrays.asList(
            new Production(S, a, B),
            new Production(S, b, A),
            new Production(A, a),
            new Production(A, a, S),
            new Production(A, b, A, A),
            new Production(B, b),
            new Production(B, b, S),
            new Production(B, a, B, B)));
        assertLanguage(cfg, new Language() {
            public boolean contains(String w) {
                return w.length() > 0 && count(w, 'a') == count(w, 'b');
            }
        }, 8);
    }

    public void testUnitAndEpsilonChains() {
        // S -> A | B b, A -> a A | ε | B, B -> b: a* | a*b | bb
        CFG cfg = new CFG(S, Arrays.asList(
            new Production(S, A),
            new Production(S, B, b),
            new Production(A, a, A),
            new Production(A),
            new Production(A, B),
            new Production(B, b)));
        assertLanguage(cfg, new Language() {
            public boolean contains(String w) {
                return w.matches("a*b?|bb");
            }
        }, 6);
    }

    public void testNormalFormShape() {
        CFG cfg = new CFG(S, Arrays.asList(
            new Production(S, a, S, b),
            new Production(S, a, b),
            new Production(S)));
        CFG cnf = cfg.toNormalForm();
        assertTrue(cnf.isNormalForm());
        assertTrue(cnf.generateEpsilon());
        for (Production p : cnf.getProductions()) {
            if (p.getBody().isEmpty()) assertEquals(S, p.getHead());
        }
        assertFalse(cfg.isNormalForm());
        assertSame(cnf, cfg.toNormalForm());
        assertSame(cnf, cnf.toNormalForm());
    }

    public void testFreshVariablesAvoidExistingNames() {
        Variable clash = new Variable("C#1");
        Variable lifted = new Variable("T#a");
        CFG cfg = new CFG(S, Arrays.asList(
            new Production(S, a, clash, lifted, b),
            new Production(clash, a),
            new Production(lifted, b)));
        CFG cnf = cfg.toNormalForm();
        assertTrue(cnf.isNormalForm());
        assertTrue(cnf.getProductions().contains(new Production(clash, a)));
        assertTrue(cnf.getProductions().contains(new Production(lifted, b)));
        assertContains(cfg, "aabb");
        assertNotContains(cfg, "ab", "aab", "abb", "aabbb", "");
    }

    public void testEpsilonEliminationPreservesNonEmptyWords() {
        CFG cfg = new CFG(S, Arrays.asList(
            new Production(S, A, B, A),
            new Production(A, a, A),
            new Production(A),
            new Production(B, b, B),
            new Production(B)));
        CFG noEps = cfg.removeEpsilon();
        assertEquals(cfg.generateEpsilon(), noEps.generateEpsilon());
        assertSameLanguage(cfg, noEps, "ab", 6);
        assertContains(cfg, "", "aba", "bbb", "aab");
        assertNotContains(cfg, "abab", "bab");
    }

    public void testConcreteScenarioNormalForm() {
        CFG cfg = CFG.fromText(
            "S -> A B\n" +
            "A -> a A | a\n" +
            "B -> b B | b\n");
        CFG cnf = cfg.toNormalForm();
        assertTrue(cnf.isNormalForm());
        assertContains(cnf, "ab", "aabb", "aaabbb");
        assertNotContains(cnf, "", "ba");
    }
}
