/*
 * @LICENSE@
 */

package org.formlang.regex;

import static org.formlang.Misc.LS;
import static org.formlang.Misc.iterize;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.formlang.Misc.FlagMgr;
import org.formlang.automaton.EpsilonNFA;
import org.formlang.automaton.Symbol;

/**
 * A regular expression over arbitrary symbols, held as an {@link AST} parse
 * tree. Pattern syntax:
 * <ul>
 * <li><code>a b</code>, <code>a.b</code>, <code>a·b</code>: concatenation</li>
 * <li><code>a+b</code>, <code>a|b</code>: union</li>
 * <li><code>a*</code>: Kleene star</li>
 * <li><code>ε</code>, <code>$</code>: the empty word; <code>∅</code>: the
 * empty language</li>
 * <li><code>( )</code>: grouping; <code>\</code> makes the next character a
 * symbol</li>
 * </ul>
 * Star binds tightest, then concatenation, then union. By default every
 * other character is a symbol of its own, so <code>ab</code> is the
 * concatenation of <code>a</code> and <code>b</code>; see
 * {@link #MULTI_CHARACTER_SYMBOLS}.
 * <p>
 * Instances are immutable. Membership is answered by an epsilon-NFA
 * compiled from the tree on first use and cached.
 */
public final class Regex {

    private static final Logger logger = Logger.getLogger("org.formlang");
    private static final Level level = Level.FINER;

    private static final FlagMgr flagMgr = new FlagMgr();

    /**
     * A symbol is the longest run of characters up to whitespace or a
     * metacharacter, so <code>ab cd*</code> is the concatenation of
     * <code>ab</code> and the star of <code>cd</code>.
     */
    public static final int MULTI_CHARACTER_SYMBOLS = flagMgr.next("MULTI_CHARACTER_SYMBOLS");

    static {
        flagMgr.freezeAndCount();
        flagMgr.setImplemented(MULTI_CHARACTER_SYMBOLS);
    }

    private final AST.Node root;
    private final int flags;
    private volatile EpsilonNFA epsilonNfa;

    /**
     * @throws java.util.regex.PatternSyntaxException
     *             if <code>regex</code> is malformed.
     */
    public Regex(String regex) {
        this(regex, 0);
    }

    /**
     * @throws IllegalArgumentException
     *             if <code>flags</code> holds an unknown flag.
     * @throws java.util.regex.PatternSyntaxException
     *             if <code>regex</code> is malformed.
     */
    public Regex(String regex, int flags) {
        flagMgr.check(flags);
        this.flags = flags;
        this.root = new RegexParser().parse(regex, flags);
        if (logger.isLoggable(level)) {
            logger.log(level, "regex: " + regex + ", flags: "
                + flagMgr.stringFrom(flags) + LS + root.toTreeString());
        }
    }

    public Regex(AST.Node root) {
        if (root == null) throw new NullPointerException("root");
        this.root = root;
        this.flags = 0;
    }

    public AST.Node getRoot() {
        return root;
    }

    public int getFlags() {
        return flags;
    }

    /**
     * @return the epsilon-NFA accepting this expression's language, built
     *         once per instance.
     */
    public EpsilonNFA toEpsilonNfa() {
        EpsilonNFA ret = epsilonNfa;
        if (ret == null) {
            epsilonNfa = ret = Thompson.compile(root);
        }
        return ret;
    }

    public boolean accepts(List<Symbol> word) {
        return toEpsilonNfa().accepts(word);
    }

    /**
     * @param labels
     *            the symbol labels of the word, in order.
     */
    public boolean accepts(String... labels) {
        return toEpsilonNfa().accepts(labels);
    }

    /**
     * Membership of a word made of single character symbols.
     */
    public boolean matches(CharSequence input) {
        List<Symbol> word = new ArrayList<Symbol>(input.length());
        for (char c : iterize(input)) {
            word.add(new Symbol(String.valueOf(c)));
        }
        return accepts(word);
    }

    public Regex union(Regex other) {
        return new Regex(AST.union(root, other.root));
    }

    public Regex concatenate(Regex other) {
        return new Regex(AST.cat(root, other.root));
    }

    public Regex kleeneStar() {
        return new Regex(AST.star(root));
    }

    /**
     * @return true if both expressions denote the same language.
     */
    public boolean isEquivalentTo(Regex other) {
        return toEpsilonNfa().isEquivalentTo(other.toEpsilonNfa());
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
