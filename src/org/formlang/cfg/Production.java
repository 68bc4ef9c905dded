/*
 * @LICENSE@
 */

package org.formlang.cfg;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A production rule <code>head -> body</code>. Explicit {@link Epsilon}
 * atoms in the body are stripped at construction, so the empty list is the
 * only representation of an epsilon body.
 */
public final class Production {

    private final Variable head;
    private final List<CfgObject> body;

    public Production(Variable head, List<? extends CfgObject> body) {
        if (head == null) throw new NullPointerException("head");
        this.head = head;
        List<CfgObject> filtered = new ArrayList<CfgObject>(body.size());
        for (CfgObject o : body) {
            if (o == null) throw new NullPointerException("body symbol");
            if (!(o instanceof Epsilon)) filtered.add(o);
        }
        this.body = Collections.unmodifiableList(filtered);
    }

    public Production(Variable head, CfgObject... body) {
        this(head, Arrays.asList(body));
    }

    public Variable getHead() {
        return head;
    }

    /**
     * @return the body, never containing {@link Epsilon}.
     */
    public List<CfgObject> getBody() {
        return body;
    }

    boolean isEpsilon() {
        return body.isEmpty();
    }

    /*
     * A -> B, B a single variable
     */
    boolean isUnit() {
        return body.size() == 1 && body.get(0) instanceof Variable;
    }

    @Override
    public int hashCode() {
        return 31 * head.hashCode() + body.hashCode();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Production))
            return false;
        final Production p = (Production) o;
        return head.equals(p.head) && body.equals(p.body);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(head).append(" -> ");
        if (body.isEmpty()) {
            sb.append(Epsilon.INSTANCE);
        }
        final int mark = sb.length();
        for (CfgObject o : body) {
            sb.append(sb.length() == mark ? "" : " ").append(o);
        }
        return sb.toString();
    }
}
