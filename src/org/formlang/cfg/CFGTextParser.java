/*
 * @LICENSE@
 */

package org.formlang.cfg;

import static org.formlang.Misc.LS;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads and writes the line oriented text form of a grammar. Not thread
 * safe; use one instance per parse.
 */
final class CFGTextParser {

    private static final Logger logger = Logger.getLogger("org.formlang");
    private static final Level level = Level.FINEST;

    private static final String ARROW = "->";
    private static final String ALT = "|";
    private static final String VAR_PREFIX = "\"VAR:";
    private static final String TER_PREFIX = "\"TER:";

    private final Map<Variable, Boolean> heads = new LinkedHashMap<Variable, Boolean>();
    private final Set<Production> productions = new LinkedHashSet<Production>();
    private int lineNo = 0;

    CFG parse(String text, Variable startSymbol) {
        for (String line : text.split("\\r?\\n", -1)) {
            ++lineNo;
            if (line.trim().length() == 0) continue;
            parseRule(line);
        }
        if (startSymbol == null) {
            if (heads.isEmpty()) {
                throw new CFG.NotParsableException("no rules", lineNo);
            }
            startSymbol = heads.containsKey(new Variable("S"))
                ? new Variable("S") : heads.keySet().iterator().next();
        }
        CFG ret = new CFG(heads.keySet(), new ArrayList<Terminal>(),
            startSymbol, productions);
        if (logger.isLoggable(level)) {
            logger.log(level, "read " + productions.size()
                + " productions, start symbol " + startSymbol);
        }
        return ret;
    }

    private void parseRule(String line) {
        final List<String> tokens = tokenize(line);
        final int arrow = tokens.indexOf(ARROW);
        if (arrow < 0) {
            throw new CFG.NotParsableException("missing '" + ARROW + "'", lineNo);
        }
        if (arrow != 1) {
            throw new CFG.NotParsableException(
                "malformed head '" + join(tokens.subList(0, arrow)) + "'", lineNo);
        }
        final CfgObject head = atomFrom(tokens.get(0));
        if (!(head instanceof Variable)) {
            throw new CFG.NotParsableException(
                "head '" + tokens.get(0) + "' is not a variable", lineNo);
        }
        heads.put((Variable) head, Boolean.TRUE);

        List<CfgObject> body = new ArrayList<CfgObject>();
        for (String token : tokens.subList(arrow + 1, tokens.size())) {
            if (token.equals(ALT)) {
                addAlternative((Variable) head, body);
                body = new ArrayList<CfgObject>();
            } else {
                body.add(atomFrom(token));
            }
        }
        addAlternative((Variable) head, body);
    }

    private void addAlternative(Variable head, List<CfgObject> body) {
        if (body.isEmpty()) {
            throw new CFG.NotParsableException("empty alternative for " + head, lineNo);
        }
        productions.add(new Production(head, body));
    }

    /*
     * Splits on whitespace; "->" and "|" are tokens of their own. A quoted
     * token runs to the first '"' that ends a token (see endsToken), so it
     * may hold separators.
     */
    private List<String> tokenize(String line) {
        final List<String> ret = new ArrayList<String>();
        int i = 0;
        final int n = line.length();
        while (i < n) {
            char c = line.charAt(i);
            if (Character.isWhitespace(c)) {
                ++i;
            } else if (c == '|') {
                ret.add(ALT);
                ++i;
            } else if (line.startsWith(ARROW, i)) {
                ret.add(ARROW);
                i += ARROW.length();
            } else if (c == '"') {
                int close = i + 1;
                while (close < n && !(line.charAt(close) == '"' && endsToken(line, close + 1))) {
                    ++close;
                }
                if (close == n) {
                    throw new CFG.NotParsableException(
                        "unterminated quoted symbol " + line.substring(i), lineNo);
                }
                ret.add(line.substring(i, close + 1));
                i = close + 1;
            } else {
                int j = i;
                while (j < n && !Character.isWhitespace(line.charAt(j))
                        && line.charAt(j) != '|' && !line.startsWith(ARROW, j)) {
                    ++j;
                }
                ret.add(line.substring(i, j));
                i = j;
            }
        }
        return ret;
    }

    /*
     * true at the end of the line, at whitespace, at '|' and at "->"
     */
    private static boolean endsToken(String line, int i) {
        return i == line.length()
            || Character.isWhitespace(line.charAt(i))
            || line.charAt(i) == '|'
            || line.startsWith(ARROW, i);
    }

    private static String join(List<String> tokens) {
        StringBuilder sb = new StringBuilder();
        for (String token : tokens) {
            sb.append(sb.length() == 0 ? "" : " ").append(token);
        }
        return sb.toString();
    }

    private CfgObject atomFrom(String token) {
        if (token.startsWith(VAR_PREFIX)) {
            return new Variable(quoted(token, VAR_PREFIX));
        } else if (token.startsWith(TER_PREFIX)) {
            return new Terminal(quoted(token, TER_PREFIX));
        } else if (token.equals("ε") || token.equals("$") || token.equals("epsilon")) {
            return Epsilon.INSTANCE;
        } else if (Character.isUpperCase(token.charAt(0))) {
            return new Variable(token);
        } else {
            return new Terminal(token);
        }
    }

    private String quoted(String token, String prefix) {
        if (token.length() <= prefix.length() || !token.endsWith("\"")) {
            throw new CFG.NotParsableException(
                "unterminated quoted symbol " + token, lineNo);
        }
        return token.substring(prefix.length(), token.length() - 1);
    }

    /*
     * inverse of parse(): the start symbol's rules come first, labels that
     * would read back as another kind are quoted
     */
    static String toText(CFG cfg) {
        StringBuilder sb = new StringBuilder();
        Set<Variable> order = new LinkedHashSet<Variable>();
        order.add(cfg.getStartSymbol());
        order.addAll(cfg.getVariables());
        for (Variable head : order) {
            List<Production> prods = cfg.productionsOf(head);
            if (prods.isEmpty()) continue;
            sb.append(textOf(head)).append(' ').append(ARROW);
            String sep = " ";
            for (Production p : prods) {
                sb.append(sep);
                sep = " | ";
                if (p.getBody().isEmpty()) {
                    sb.append(Epsilon.INSTANCE);
                }
                final int mark = sb.length();
                for (CfgObject o : p.getBody()) {
                    sb.append(sb.length() == mark ? "" : " ").append(textOf(o));
                }
            }
            sb.append(LS);
        }
        return sb.toString();
    }

    private static String textOf(CfgObject o) {
        final String v = o.value;
        for (int i = v.indexOf('"'); i >= 0; i = v.indexOf('"', i + 1)) {
            if (endsToken(v, i + 1) && i + 1 < v.length()) {
                throw new IllegalArgumentException(
                    "label cannot be written as text: " + v);
            }
        }
        final boolean plain = v.length() > 0
            && v.split("\\s+", -1).length == 1
            && v.indexOf('|') < 0
            && !v.contains(ARROW)
            && !v.startsWith("\"")
            && !v.equals("ε") && !v.equals("$") && !v.equals("epsilon");
        if (o instanceof Variable) {
            return plain && Character.isUpperCase(v.charAt(0)) ? v : VAR_PREFIX + v + "\"";
        } else {
            return plain && !Character.isUpperCase(v.charAt(0)) ? v : TER_PREFIX + v + "\"";
        }
    }
}
