/*
 * @LICENSE@
 */

package org.formlang.cfg;

/**
 * A variable (non-terminal) of a context-free grammar.
 */
public final class Variable extends CfgObject {

    public Variable(String value) {
        super(value);
    }

    @Override
    int kind() {
        return 2;
    }
}
