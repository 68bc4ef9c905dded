/*
 * @LICENSE@
 */

package org.formlang.cfg;

/**
 * An atom of a context-free grammar: a {@link Variable}, a {@link Terminal}
 * or the {@link Epsilon} marker. The hierarchy is closed; there are no other
 * subclasses.
 * <p>
 * Atoms are immutable and identified by their kind and label alone: two
 * atoms of the same kind with equal labels are equal, hash alike and sort
 * together. Across kinds, epsilon sorts before terminals, which sort before
 * variables.
 */
public abstract class CfgObject implements Comparable<CfgObject> {

    final String value;

    CfgObject(String value) {
        if (value == null) throw new NullPointerException("value");
        this.value = value;
    }

    /**
     * @return the label of this atom.
     */
    public final String getValue() {
        return value;
    }

    abstract int kind();

    public final int compareTo(CfgObject o) {
        int ret = kind() - o.kind();
        return ret != 0 ? ret : value.compareTo(o.value);
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || o.getClass() != getClass())
            return false;
        return value.equals(((CfgObject) o).value);
    }

    @Override
    public final int hashCode() {
        return 31 * kind() + value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
