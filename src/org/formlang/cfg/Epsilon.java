/*
 * @LICENSE@
 */

package org.formlang.cfg;

/**
 * The empty string. Never equal to a {@link Terminal} or {@link Variable},
 * whatever their label.
 */
public final class Epsilon extends CfgObject {

    public static final Epsilon INSTANCE = new Epsilon();

    private Epsilon() {
        super("ε");
    }

    @Override
    int kind() {
        return 0;
    }
}
