/*
 * @LICENSE@
 */

package org.formlang.regex;

import static org.formlang.Misc.LS;

import java.util.Stack;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.formlang.automaton.EpsilonNFA;
import org.formlang.automaton.State;
import org.formlang.automaton.Symbol;
import org.formlang.regex.AST.Visitor.TraversalOrder;

/**
 * Thompson's construction: every node becomes a fragment with a single
 * entry and a single exit state, glued to its children's fragments by
 * epsilon transitions. The tree is folded bottom up on a stack of
 * fragments.
 */
final class Thompson {

    private static final Logger logger = Logger.getLogger("org.formlang");
    private static final Level level = Level.FINEST;

    private static final class Fragment {

        final State start;
        final State end;

        Fragment(State start, State end) {
            this.start = start;
            this.end = end;
        }
    }

    private Thompson() {
    } // never instantiated

    static EpsilonNFA compile(AST.Node root) {

        final EpsilonNFA.Builder b = new EpsilonNFA.Builder();
        final Stack<Fragment> kids = new Stack<Fragment>();

        new AST.Visitor(TraversalOrder.BOTTOM_UP) {

            private int counter = 0;

            private Fragment fragment() {
                State start = new State(Integer.toString(counter++));
                State end = new State(Integer.toString(counter++));
                b.addState(start).addState(end);
                return new Fragment(start, end);
            }

            @Override
            protected void visit(AST.Symbol node) {
                Fragment f = fragment();
                b.addTransition(f.start, new Symbol(node.label), f.end);
                kids.push(f);
            }

            @Override
            protected void visit(AST.Epsilon node) {
                Fragment f = fragment();
                b.addTransition(f.start, Symbol.EPSILON, f.end);
                kids.push(f);
            }

            @Override
            protected void visit(AST.EmptyLanguage node) {
                kids.push(fragment());
            }

            @Override
            protected void visit(AST.Concatenation node) {
                Fragment right = kids.pop();
                Fragment left = kids.pop();
                b.addTransition(left.end, Symbol.EPSILON, right.start);
                kids.push(new Fragment(left.start, right.end));
            }

            @Override
            protected void visit(AST.Union node) {
                Fragment right = kids.pop();
                Fragment left = kids.pop();
                Fragment f = fragment();
                b.addTransition(f.start, Symbol.EPSILON, left.start)
                    .addTransition(f.start, Symbol.EPSILON, right.start)
                    .addTransition(left.end, Symbol.EPSILON, f.end)
                    .addTransition(right.end, Symbol.EPSILON, f.end);
                kids.push(f);
            }

            @Override
            protected void visit(AST.KleeneStar node) {
                Fragment inner = kids.pop();
                Fragment f = fragment();
                b.addTransition(f.start, Symbol.EPSILON, inner.start)
                    .addTransition(f.start, Symbol.EPSILON, f.end)
                    .addTransition(inner.end, Symbol.EPSILON, inner.start)
                    .addTransition(inner.end, Symbol.EPSILON, f.end);
                kids.push(f);
            }
        }.walk(root);

        assert kids.size() == 1;
        Fragment f = kids.pop();
        EpsilonNFA ret = b.addStartState(f.start).addFinalState(f.end).build();
        if (logger.isLoggable(level)) {
            logger.log(level, "compiled " + root + ":" + LS + ret);
        }
        return ret;
    }
}
