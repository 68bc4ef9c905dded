/*
 * @LICENSE@
 */

package org.formlang.cfg;

/**
 * A terminal of a context-free grammar.
 */
public final class Terminal extends CfgObject {

    public Terminal(String value) {
        super(value);
    }

    @Override
    int kind() {
        return 1;
    }
}
