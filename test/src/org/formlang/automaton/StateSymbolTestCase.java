/*
 * @LICENSE@
 */

package org.formlang.automaton;

import java.util.Arrays;
import java.util.TreeSet;

import org.formlang.AbstractFormalTestCase;

public class StateSymbolTestCase extends AbstractFormalTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(StateSymbolTestCase.class);
    }

    public StateSymbolTestCase(String name) {
        super(name);
    }

    public void testStateEquality() {
        assertEquals(new State("q0"), new State("q0"));
        assertEquals(new State("q0").hashCode(), new State("q0").hashCode());
        assertFalse(new State("q0").equals(new State("q1")));
        assertTrue(new State("q0").compareTo(new State("q1")) < 0);
        assertEquals("q0", new State("q0").toString());
    }

    public void testSymbolEquality() {
        assertEquals(new Symbol("a"), new Symbol("a"));
        assertEquals(new Symbol("a").hashCode(), new Symbol("a").hashCode());
        assertFalse(new Symbol("a").equals(new Symbol("b")));
        assertFalse(new Symbol("a").equals(new State("a")));
    }

    public void testEpsilonIsReserved() {
        assertTrue(Symbol.EPSILON.isEpsilon());
        assertFalse(new Symbol("ε").isEpsilon());
        assertFalse(Symbol.EPSILON.equals(new Symbol("ε")));
        assertFalse(new Symbol("ε").equals(Symbol.EPSILON));
        TreeSet<Symbol> set = new TreeSet<Symbol>(Arrays.asList(
            new Symbol("b"), new Symbol("ε"), Symbol.EPSILON, new Symbol("a")));
        assertEquals(4, set.size());
        assertSame(Symbol.EPSILON, set.first());
    }

    public void testNullLabel() {
        try {
            new State(null);
            fail("should throw");
        } catch (NullPointerException e) {}
        try {
            new Symbol(null);
            fail("should throw");
        } catch (NullPointerException e) {}
    }

    public void testStateAllocator() {
        StateAllocator allocator = new StateAllocator(Arrays.asList(new State("sink")));
        assertEquals(new State("q"), allocator.named("q"));
        assertEquals(new State("q#1"), allocator.named("q"));
        assertEquals(new State("sink#2"), allocator.named("sink"));
        assertEquals(new State("q#3"), allocator.named("q"));
    }
}
