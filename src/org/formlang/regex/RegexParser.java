/*
 * @LICENSE@
 */

package org.formlang.regex;

import static org.formlang.Misc.isSet;

import java.util.regex.PatternSyntaxException;

import org.formlang.regex.AST.Node;

/**
 * Precedence parser for regular expressions over arbitrary symbols:
 * <pre>
 *     union  := concat (('+' | '|') concat)*
 *     concat := star (['.' | '·'] star)*
 *     star   := atom '*'*
 *     atom   := '(' union ')' | 'ε' | '$' | '∅' | symbol
 * </pre>
 * Whitespace separates tokens and is otherwise ignored. A backslash makes
 * the next character a symbol. Unions and concatenations nest to the left.
 * Not thread safe; use one instance per parse.
 */
final class RegexParser {

    private static final int EOX = -1;  // end of expression
    private static final int BACKSLASH = 0x80000000;

    private static final String META = "()+|*.·ε$∅\\";

    /*
     * fields to hold parameters
     */
    private String regex;
    private boolean multiCharacterSymbols;

    /*
     * state for nextToken() and friends
     */
    private int iNext;
    private int iCurrent;
    private int token;      // bit 31 is set if escaped

    private void init() {
        iNext = 0;
        iCurrent = 0;
        token = EOX;
    }

    Node parse(String regex, int flags) {

        this.regex = regex;
        this.multiCharacterSymbols = isSet(flags, Regex.MULTI_CHARACTER_SYMBOLS);
        init();

        nextToken();
        if (token == EOX) {
            return AST.epsilon();
        }
        Node ret = union();
        if (token == ')') {
            throw syntaxError("unbalanced parenthesis");
        }
        assert token == EOX : "unexpected token at end of pattern: " + (char) token;
        return ret;
    }

    private Node union() {
        Node ret = concatenation();
        while (token == '+' || token == '|') {
            nextToken();
            ret = AST.union(ret, concatenation());
        }
        return ret;
    }

    private Node concatenation() {
        Node ret = star();
        for (;;) {
            if (token == '.' || token == '·') {
                nextToken();
                ret = AST.cat(ret, star());
            } else if (startsOperand()) {
                ret = AST.cat(ret, star());
            } else {
                break;
            }
        }
        return ret;
    }

    private boolean startsOperand() {
        switch (token) {
        case EOX:
        case ')':
        case '+':
        case '|':
        case '*':
        case '.':
        case '·':
            return false;
        default:
            return true;
        }
    }

    private Node star() {
        Node ret = atom();
        while (token == '*') {
            nextToken();
            ret = AST.star(ret);
        }
        return ret;
    }

    /*
     * on entry token is the first token of the atom, on exit the first one
     * after it
     */
    private Node atom() {
        Node ret;
        switch (token) {
        case '(':
            nextToken();
            if (token == ')') {
                throw syntaxError("empty group");
            }
            ret = union();
            if (token != ')') {
                throw syntaxError("unbalanced parenthesis");
            }
            nextToken();
            return ret;
        case 'ε':
        case '$':
            nextToken();
            return AST.epsilon();
        case '∅':
            nextToken();
            return AST.empty();
        case EOX:
            throw syntaxError("missing operand at end of pattern");
        case ')':
        case '+':
        case '|':
        case '*':
        case '.':
        case '·':
            throw syntaxError("missing operand before '" + (char) token + "'");
        default:
            return symbol();
        }
    }

    /*
     * one character, or with MULTI_CHARACTER_SYMBOLS the longest run of
     * characters up to whitespace or an unescaped metacharacter
     */
    private Node symbol() {
        final StringBuilder sb = new StringBuilder();
        sb.append((char) (token & ~BACKSLASH));
        if (multiCharacterSymbols) {
            while (hasNextChar()) {
                char c = regex.charAt(iNext);
                if (Character.isWhitespace(c) || (c != '\\' && META.indexOf(c) >= 0)) {
                    break;
                }
                nextToken();
                sb.append((char) (token & ~BACKSLASH));
            }
        }
        nextToken();
        return AST.symbol(sb.toString());
    }

    /*
     * char scanner stuff
     */

    private boolean hasNextChar() {
        return iNext < regex.length();
    }

    private boolean nextRawChar() {
        if (hasNextChar()) {
            token = regex.charAt(iNext++);
            return true;
        } else {
            return false;
        }
    }

    private void nextToken() {
        do {
            iCurrent = iNext;
            if (nextRawChar()) {
                if (token == '\\') {
                    if (!nextRawChar()) {
                        throw syntaxError("dangling escape");
                    }
                    token |= BACKSLASH;
                }
            } else {
                token = EOX;
            }
        } while (token != EOX && Character.isWhitespace(token));
    }

    private PatternSyntaxException syntaxError(String msg) {
        return new PatternSyntaxException(msg, regex, iCurrent);
    }
}
