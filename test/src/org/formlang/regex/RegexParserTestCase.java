/*
 * @LICENSE@
 */

package org.formlang.regex;

import java.util.regex.PatternSyntaxException;

import org.formlang.AbstractFormalTestCase;

public class RegexParserTestCase extends AbstractFormalTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(RegexParserTestCase.class);
    }

    public RegexParserTestCase(String name) {
        super(name);
    }

    private static void assertParse(String expected, String regex) {
        assertParse(expected, regex, 0);
    }

    private static void assertParse(String expected, String regex, int flags) {
        assertEquals(regex, expected, new Regex(regex, flags).toString());
    }

    private static void assertSyntaxError(String regex, int index, String description) {
        try {
            new Regex(regex);
            fail("should throw: " + regex);
        } catch (PatternSyntaxException e) {
            assertEquals(regex, index, e.getIndex());
            assertEquals(regex, description, e.getDescription());
            assertEquals(regex, e.getPattern());
        }
    }

    public void testSymbols() {
        assertParse("a", "a");
        assertParse("(a · b)", "ab");
        assertParse("((a · b) · c)", "abc");
        assertParse("(a · b)", "a b");
        assertParse("(a · b)", "  a\tb  ");
    }

    public void testOperators() {
        assertParse("(a + b)", "a+b");
        assertParse("(a + b)", "a|b");
        assertParse("((a + b) + c)", "a+b|c");
        assertParse("(a · b)", "a.b");
        assertParse("(a · b)", "a·b");
        assertParse("(a)*", "a*");
        assertParse("((a)*)*", "a**");
    }

    public void testPrecedence() {
        assertParse("(a + ((b)* · c))", "a+b*c");
        assertParse("((a · (b)*) + c)", "ab*+c");
        assertParse("((((a + b))* · a) · b)", "(a+b)*ab");
        assertParse("(a · ((b + c))*)", "a(b|c)*");
        assertParse("(a · (b + c))", "a.(b+c)");
    }

    public void testEpsilonAndEmpty() {
        assertParse("ε", "ε");
        assertParse("ε", "$");
        assertParse("∅", "∅");
        assertParse("(a + ε)", "a+$");
        assertParse("(∅)*", "∅*");
        assertParse("ε", "");
        assertParse("ε", "   ");
    }

    public void testEscapes() {
        assertParse("*", "\\*");
        assertParse("((a · +) · b)", "a\\+b");
        assertParse("(( · ))", "\\(\\)");
        assertParse("$", "\\$");
        assertParse("\\", "\\\\");
    }

    public void testSyntaxErrors() {
        assertSyntaxError("(a", 2, "unbalanced parenthesis");
        assertSyntaxError("a)", 1, "unbalanced parenthesis");
        assertSyntaxError("(a+b))", 5, "unbalanced parenthesis");
        assertSyntaxError("()", 1, "empty group");
        assertSyntaxError("a+", 2, "missing operand at end of pattern");
        assertSyntaxError("a|", 2, "missing operand at end of pattern");
        assertSyntaxError("a.", 2, "missing operand at end of pattern");
        assertSyntaxError("*a", 0, "missing operand before '*'");
        assertSyntaxError("a+*", 2, "missing operand before '*'");
        assertSyntaxError("a++b", 2, "missing operand before '+'");
        assertSyntaxError("(|a)", 1, "missing operand before '|'");
        assertSyntaxError("a\\", 1, "dangling escape");
    }

    public void testUnknownFlags() {
        try {
            new Regex("a", 1 << 20);
            fail("should throw");
        } catch (IllegalArgumentException e) {
        }
    }

    public void testMultiCharacterSymbols() {
        final int flags = Regex.MULTI_CHARACTER_SYMBOLS;
        assertParse("abc", "abc", flags);
        assertParse("(ab · (cd)*)", "ab cd*", flags);
        assertParse("(foo + bar)", "foo+bar", flags);
        assertParse("((if · then) + else)", "(if.then)|else", flags);
        assertParse("a*b", "a\\*b", flags);
        assertEquals(flags, new Regex("x", flags).getFlags());
    }
}
