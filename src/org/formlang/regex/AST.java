/*
 * @LICENSE@
 */

package org.formlang.regex;

import static org.formlang.Misc.LS;

import java.util.Stack;

import org.formlang.regex.AST.Visitor.TraversalOrder;

/**
 * Uninstantiable class which serves as a source container for the node
 * classes, the visitor and the static factories used to build the parse
 * trees of regular expressions.
 * <p>
 * Nodes are immutable, so subtrees may be shared between trees. Every
 * traversal, including {@link Node#toString()}, runs on an explicit stack:
 * tree depth is bounded by the heap only.
 */
public final class AST {

    public static abstract class Node {

        Node() {
        }

        /**
         * The equals relation is always the identity relation for all Node
         * subclasses.
         */
        @Override
        public final boolean equals(Object o) {
            return super.equals(o);
        }
        @Override
        public final int hashCode() {
            return super.hashCode();
        }

        /**
         * Fully parenthesized rendering: <code>(L · R)</code>,
         * <code>(L + R)</code>, <code>(X)*</code>, <code>ε</code>,
         * <code>∅</code> and symbol labels.
         */
        @Override
        public final String toString() {
            final Stack<String> kids = new Stack<String>();
            new Visitor(TraversalOrder.BOTTOM_UP) {
                @Override
                protected void visit(Symbol node) {
                    kids.push(node.label);
                }
                @Override
                protected void visit(Epsilon node) {
                    kids.push("ε");
                }
                @Override
                protected void visit(EmptyLanguage node) {
                    kids.push("∅");
                }
                @Override
                protected void visit(Concatenation node) {
                    String right = kids.pop();
                    kids.push("(" + kids.pop() + " · " + right + ")");
                }
                @Override
                protected void visit(Union node) {
                    String right = kids.pop();
                    kids.push("(" + kids.pop() + " + " + right + ")");
                }
                @Override
                protected void visit(KleeneStar node) {
                    kids.push("(" + kids.pop() + ")*");
                }
            }.walk(this);
            assert kids.size() == 1;
            return kids.pop();
        }

        /**
         * @return an indented, one node per line rendering, for logging.
         */
        public final String toTreeString() {
            final StringBuilder sb = new StringBuilder();
            new Visitor(TraversalOrder.TOP_DOWN) {
                private void line(String label) {
                    for (int i = 0; i < 4 * depth(); ++i) sb.append(' ');
                    sb.append(label).append(LS);
                }
                @Override
                protected void visit(Symbol node) {
                    line("'" + node.label + "'");
                }
                @Override
                protected void visit(Epsilon node) {
                    line("ε");
                }
                @Override
                protected void visit(EmptyLanguage node) {
                    line("∅");
                }
                @Override
                protected void visit(Concatenation node) {
                    line("·");
                }
                @Override
                protected void visit(Union node) {
                    line("+");
                }
                @Override
                protected void visit(KleeneStar node) {
                    line("*");
                }
            }.walk(this);
            return sb.toString();
        }
    }

    public static final class Symbol extends Node {

        final String label;

        private Symbol(String label) {
            if (label == null) throw new NullPointerException("label");
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    /**
     * The language holding only the empty word.
     */
    public static final class Epsilon extends Node {

        private Epsilon() {
        }
    }

    /**
     * The language holding no word at all.
     */
    public static final class EmptyLanguage extends Node {

        private EmptyLanguage() {
        }
    }

    public static abstract class NonTerminal extends Node {

        NonTerminal() {
        }

        abstract Node[] children();
    }

    public static abstract class Binary extends NonTerminal {

        final Node left, right;

        private Binary(Node left, Node right) {
            if (left == null || right == null) throw new NullPointerException("operand");
            this.left = left;
            this.right = right;
        }

        public Node getLeft() {
            return left;
        }

        public Node getRight() {
            return right;
        }

        @Override
        final Node[] children() {
            return new Node[] {left, right};
        }
    }

    public static final class Concatenation extends Binary {

        private Concatenation(Node left, Node right) {
            super(left, right);
        }
    }

    public static final class Union extends Binary {

        private Union(Node left, Node right) {
            super(left, right);
        }
    }

    public static final class KleeneStar extends NonTerminal {

        final Node inner;

        private KleeneStar(Node inner) {
            if (inner == null) throw new NullPointerException("inner");
            this.inner = inner;
        }

        public Node getInner() {
            return inner;
        }

        @Override
        Node[] children() {
            return new Node[] {inner};
        }
    }

    /**
     * Walks a tree without native recursion. In {@link TraversalOrder#TOP_DOWN}
     * order a node is visited before its children, in
     * {@link TraversalOrder#BOTTOM_UP} order after them; children are always
     * taken left to right.
     */
    public static abstract class Visitor {

        public enum TraversalOrder {
            TOP_DOWN,
            BOTTOM_UP;
        }

        private final TraversalOrder order;
        private int depth;

        protected Visitor(TraversalOrder order) {
            this.order = order;
        }

        public final void walk(Node root) {
            final Stack<Node> nodes = new Stack<Node>();
            final Stack<Integer> depths = new Stack<Integer>();
            final Stack<Boolean> expanded = new Stack<Boolean>();
            nodes.push(root);
            depths.push(0);
            expanded.push(Boolean.FALSE);
            while (!nodes.isEmpty()) {
                final Node node = nodes.pop();
                final int d = depths.pop();
                final boolean done = expanded.pop();
                if (!(node instanceof NonTerminal) || done
                        || order == TraversalOrder.TOP_DOWN) {
                    depth = d;
                    visit(node);
                }
                if (node instanceof NonTerminal && !done) {
                    if (order == TraversalOrder.BOTTOM_UP) {
                        nodes.push(node);
                        depths.push(d);
                        expanded.push(Boolean.TRUE);
                    }
                    Node[] children = ((NonTerminal) node).children();
                    for (int i = children.length - 1; i >= 0; --i) {
                        nodes.push(children[i]);
                        depths.push(d + 1);
                        expanded.push(Boolean.FALSE);
                    }
                }
            }
        }

        /**
         * @return the depth of the node being visited, 0 for the root.
         */
        protected final int depth() {
            return depth;
        }

        /*
         * "instanceof" dispatch is ugly but it's only in one place - here.
         */
        protected void visit(Node node) {
            if (node instanceof Symbol) {
                visit((Symbol) node);
            } else if (node instanceof Epsilon) {
                visit((Epsilon) node);
            } else if (node instanceof EmptyLanguage) {
                visit((EmptyLanguage) node);
            } else if (node instanceof Concatenation) {
                visit((Concatenation) node);
            } else if (node instanceof Union) {
                visit((Union) node);
            } else if (node instanceof KleeneStar) {
                visit((KleeneStar) node);
            } else {
                assert false : "unknown node type " + node.getClass();
            }
        }

        protected void visit(Symbol node) {}
        protected void visit(Epsilon node) {}
        protected void visit(EmptyLanguage node) {}
        protected void visit(Concatenation node) {}
        protected void visit(Union node) {}
        protected void visit(KleeneStar node) {}
    }

    /*
     * static factories of convenience for the parser, the combinators and
     * testing
     */

    public static Symbol symbol(String label) {
        return new Symbol(label);
    }

    public static Epsilon epsilon() {
        return new Epsilon();
    }

    public static EmptyLanguage empty() {
        return new EmptyLanguage();
    }

    /**
     * @return the left-nested concatenation of <code>nodes</code>; epsilon
     *         when there are none.
     */
    public static Node cat(Node... nodes) {
        Node root = null;
        for (Node node : nodes) {
            root = root == null ? node : new Concatenation(root, node);
        }
        return root == null ? epsilon() : root;
    }

    /**
     * @return the left-nested union of <code>nodes</code>; the empty
     *         language when there are none.
     */
    public static Node union(Node... nodes) {
        Node root = null;
        for (Node node : nodes) {
            root = root == null ? node : new Union(root, node);
        }
        return root == null ? empty() : root;
    }

    public static KleeneStar star(Node inner) {
        return new KleeneStar(inner);
    }

    private AST() {}    // uninstantiable
}
