/*
 * @LICENSE@
 */

package org.formlang.automaton;

import static org.formlang.FormalAssert.*;

import java.util.Arrays;
import java.util.HashSet;

import org.formlang.AbstractFormalTestCase;

public class MinimizeTestCase extends AbstractFormalTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(MinimizeTestCase.class);
    }

    public MinimizeTestCase(String name) {
        super(name);
    }

    private static void assertMinimal(DeterministicFiniteAutomaton dfa, int expectedSize, String alphabet) {
        DeterministicFiniteAutomaton min = dfa.minimize();
        assertEquals(min.toString(), expectedSize, min.getStates().size());
        assertTrue(min.isComplete());
        assertNotNull(min.getStartState());
        assertSameLanguage(dfa, min, alphabet, 6);
        DeterministicFiniteAutomaton again = min.minimize();
        assertEquals(min.getStates().size(), again.getStates().size());
        assertSameLanguage(min, again, alphabet, 6);
    }

    public void testAlreadyMinimal() {
        assertMinimal(DFATestCase.endsWithAb(), 3, "ab");
    }

    public void testMergesEquivalentStates() {
        // even number of a's, spelled with four states
        DeterministicFiniteAutomaton dfa = new DeterministicFiniteAutomaton.Builder()
            .setStartState("s0")
            .addTransition("s0", "a", "s1")
            .addTransition("s1", "a", "s2")
            .addTransition("s2", "a", "s3")
            .addTransition("s3", "a", "s0")
            .addFinalState("s0")
            .addFinalState("s2")
            .build();
        assertMinimal(dfa, 2, "a");
        assertEquals(new HashSet<State>(Arrays.asList(new State("s0"), new State("s1"))),
            dfa.minimize().getStates());
    }

    public void testDropsUnreachableStates() {
        DeterministicFiniteAutomaton dfa = new DeterministicFiniteAutomaton.Builder()
            .setStartState("p")
            .addTransition("p", "a", "p")
            .addFinalState("p")
            .addTransition("u", "a", "v")
            .addFinalState("v")
            .build();
        assertMinimal(dfa, 1, "a");
        assertFalse(dfa.minimize().getStates().contains(new State("u")));
    }

    public void testPartialGetsSink() {
        DeterministicFiniteAutomaton dfa = new DeterministicFiniteAutomaton.Builder()
            .setStartState("p")
            .addTransition("p", "a", "q")
            .addFinalState("q")
            .addInputSymbol("b")
            .build();
        assertMinimal(dfa, 3, "ab");
    }

    public void testEmptyLanguage() {
        DeterministicFiniteAutomaton dfa = new DeterministicFiniteAutomaton.Builder()
            .setStartState("p")
            .addTransition("p", "a", "q")
            .addTransition("q", "b", "p")
            .build();
        assertMinimal(dfa, 1, "ab");
        assertTrue(dfa.minimize().getFinalStates().isEmpty());
        assertMinimal(new DeterministicFiniteAutomaton.Builder().addInputSymbol("a").build(), 1, "a");
    }

    public void testDeterminizedNfa() {
        DeterministicFiniteAutomaton dfa = NFATestCase.nthFromLastIsA(2).toDeterministic();
        assertMinimal(dfa, 4, "ab");
        assertMinimal(NFATestCase.aPlus().toDeterministic(), 2, "ab");
    }

    public void testMinimalDfasOfEquivalentAutomataHaveEqualSize() {
        DeterministicFiniteAutomaton lhs = NFATestCase.nthFromLastIsA(3).toDeterministic().minimize();
        DeterministicFiniteAutomaton rhs = NFATestCase.nthFromLastIsA(3)
            .union(NFATestCase.nthFromLastIsA(3)).toDeterministic().minimize();
        assertEquals(lhs.getStates().size(), rhs.getStates().size());
        assertTrue(lhs.isEquivalentTo(rhs));
    }
}
