/*
 * @LICENSE@
 */

package org.formlang;

import java.util.AbstractQueue;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;


/**
 * This class implements a bunch of reusable, miscellaneous static objects,
 * interfaces, classes, and methods shared by the grammar, automaton and
 * regex packages.
 */
public final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    /*
     * idiom suppression for Strings
     */
    public static Iterable<Character> iterize(final CharSequence cs) {
        return new Iterable<Character>() {
            public Iterator<Character> iterator() {
                return new Iterator<Character>() {
                    private int i = 0;

                    public boolean hasNext() {
                        return i < cs.length();
                    }

                    public Character next() {
                        return cs.charAt(i++);
                    }

                    public void remove() {
                        throw new UnsupportedOperationException();
                    }
                };
            }
        };
    }

    /**
     * Renders a collection as <code>{a, b, c}</code>; the empty collection
     * renders as <code>{}</code>.
     */
    public static String setString(Iterable<?> items) {
        StringBuilder sb = new StringBuilder();
        sb.append('{');
        final int mark = sb.length();
        for (Object item : items) {
            sb.append(sb.length() == mark ? "" : ", ").append(item);
        }
        sb.append('}');
        return sb.toString();
    }

    public static <T> boolean disjoint(Collection<T> lhs, Collection<T> rhs) {
        for (T t : lhs) if (rhs.contains(t)) return false;
        return true;
    }

    public static final class FlagMgr {

        private List<String> labels = new ArrayList<String>(4);
        private int defined = 0;
        private Integer implemented = null;
        boolean frozen = false;

        private boolean contains(int f, int g) {
            return (g | f) == f;
        }

        public int next(String label) {
            if (frozen)
                throw new IllegalStateException("frozen FlagMgr");
            labels.add(label);
            int flag = 1 << (labels.size() - 1);
            defined |= flag;
            return flag;
        };

        public int freezeAndCount() {
            frozen = true;
            return labels.size();
        }

        public FlagMgr setImplemented(int implemented) {
            if (!contains(defined, implemented)) {
                throw new IllegalArgumentException(
                    "unknown flags: " + (implemented & ~defined));
            }
            this.implemented = implemented;
            return this;
        }

        public void check(int flags) {
            if (!contains(defined, flags)) {
                throw new IllegalArgumentException(
                    "unknown flags: " + (flags & ~defined));
            } else if (implemented != null && !contains(implemented, flags)) {
                throw new IllegalArgumentException(
                    "unimplemented flags: " + stringFrom(flags & ~implemented));
            }
        }

        public String stringFrom(int flags) {
            StringBuilder sb = new StringBuilder();
            int n = 0;
            while (flags != 0) {
                for (; (flags & 1) == 0; flags >>= 1, ++n)
                    ;
                sb.append(sb.length() == 0 ? "" : ", ").append(labels.get(n));
                flags &= ~1;
            }
            return sb.toString();
        }
    };

    public static boolean isSet(int flags, int FLAG) {
        return (flags & FLAG) != 0;
    }

    /**
     * A FIFO queue which silently refuses elements it already holds.
     */
    public static final class SetQueue<E> extends AbstractQueue<E> {

        private final Map<E, Boolean> map = new LinkedHashMap<E, Boolean>();

        public SetQueue() {
            super();
        }
        public SetQueue(Collection<? extends E> c) {
            this();
            addAll(c);
        }
        @Override
        public Iterator<E> iterator() {
            return Collections.unmodifiableSet(map.keySet()).iterator();
        }

        @Override
        public int size() {
            return map.size();
        }

        public boolean offer(E o) {
            if (o == null || map.containsKey(o)) return false;
            map.put(o, Boolean.TRUE);
            return true;
        }

        public E peek() {
            return isEmpty() ? null : map.keySet().iterator().next();
        }

        public E poll() {
            if (isEmpty()) return null;
            Iterator<E> it = map.keySet().iterator();
            E ret = it.next();
            it.remove();
            return ret;
        }
    }

    /**
     * Generic breadth first search over a digraph given implicitly by
     * {@link #successors(Object)}. Vertices are compared by value, so they
     * must have consistent equals() and hashCode().
     */
    public static abstract class BreadthFirstVisitor<V> {

        private final Set<V> black = new LinkedHashSet<V>();
        private final Queue<V> gray = new SetQueue<V>();

        public final BreadthFirstVisitor<V> start(Iterable<? extends V> inits) {
            black.clear(); gray.clear();
            for (V init : inits) if (!black.contains(init)) visitFrom(init);
            return this;
        }

        public final BreadthFirstVisitor<V> start(V init) {
            black.clear(); gray.clear();
            visitFrom(init);
            return this;
        }

        /**
         * @return every vertex visited by the last search, in visiting order.
         */
        public final Set<V> visited() {
            return Collections.unmodifiableSet(black);
        }

        private void visitFrom(V init) {
            gray.offer(init);
            while (!gray.isEmpty()) {
                V vertex = gray.remove();
                black.add(vertex);
                visit(vertex);
                for (V next : successors(vertex)) {
                    if (!black.contains(next)) gray.offer(next);
                }
            }
        }

        protected abstract Iterable<? extends V> successors(V vertex);

        protected void visit(V vertex) {}
    }
}
