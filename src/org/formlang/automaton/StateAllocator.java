/*
 * @LICENSE@
 */

package org.formlang.automaton;

import java.util.HashSet;
import java.util.Set;

/*
 * Hands out states with distinct labels for one construction. A label keeps
 * its hint when free; otherwise "#n" is appended until it is.
 */
final class StateAllocator {

    private final Set<String> taken = new HashSet<String>();
    private int counter = 0;

    StateAllocator() {
    }

    StateAllocator(Iterable<State> reserved) {
        for (State state : reserved) taken.add(state.getLabel());
    }

    State named(String hint) {
        String label = hint;
        while (!taken.add(label)) {
            label = hint + '#' + (++counter);
        }
        return new State(label);
    }
}
