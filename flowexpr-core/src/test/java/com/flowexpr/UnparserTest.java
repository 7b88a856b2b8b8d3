package com.flowexpr;

import com.flowexpr.ast.*;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class UnparserTest {

    private static String compact(String source) {
        return Unparser.compact(ExpressionParser.parse(source));
    }

    private static String indented(String source) {
        return Unparser.indented(ExpressionParser.parse(source));
    }

    @Test
    void testOperatorSpacing() {
        assertEquals("1 + 2*3", compact("1+2*3"));
        assertEquals("a > 1 && b != 2", compact("a>1&&b!=2"));
        assertEquals("-x", compact("- x"));
        assertEquals("--x", compact("- - x"));
    }

    @Test
    void testCompactCollections() {
        assertEquals("f(1)[2]", compact("f( 1 )[ 2 ]"));
        assertEquals("x := [y -> 2, z -> 3]", compact("x := [y -> 2, z->3]"));
        assertEquals("[]", compact("[ ]"));
        assertEquals("f()", compact("f( )"));
        assertEquals("(1 + 1)", compact("(1+1)"));
        assertEquals("[1, 2]", compact("@(1, 2)"));
        assertEquals("m[1, 2]", compact("m[1,2]"));
    }

    @Test
    void testReferenceSampleCompact() {
        assertEquals("-1 + hello(1, 'w\"orld', 3)*2 - (1 + 1)",
            compact("-1+hello(\n    1,\n    'w\\\"orld',\n    3,\n)*2-(1+1)"));
        assertEquals("['fruit' -> 'apple', 'vegetable' -> 'carrot']",
            compact("['fruit' ->   'apple',  'vegetable' -> 'carrot']"));
    }

    @Test
    void testStringsUseSingleQuotes() {
        assertEquals("'double'", compact("\"double\""));
        assertEquals("'it\\'s'", compact("\"it's\""));
        assertEquals("'\\\\'", compact("'\\\\'"));
    }

    @Test
    void testNumbers() {
        assertEquals("1.5", Unparser.compact(Leaf.num(1.5)));
        assertEquals("2.0", Unparser.compact(Leaf.num(2.0)));
        assertEquals("0.25", compact(".25"));
        assertEquals("99999999999999999999", compact("99999999999999999999"));
        assertThrows(IllegalArgumentException.class, () -> Unparser.compact(Leaf.num(Double.NaN)));
    }

    @Test
    void testIndentedCall() {
        String expected = String.join("\n",
            "f(",
            "    1,",
            "    [",
            "        2,",
            "        3,",
            "    ],",
            ")");
        assertEquals(expected, indented("f(1, [2, 3])"));
    }

    @Test
    void testIndentedList() {
        String expected = String.join("\n",
            "[",
            "    'a',",
            "    b -> 1,",
            "]");
        assertEquals(expected, indented("['a', b -> 1]"));
        assertEquals("[]", indented("[]"));
        assertEquals("f()", indented("f()"));
    }

    @Test
    void testIndentWidth() {
        Node node = ExpressionParser.parse("f(x)");
        assertEquals("f(\n  x,\n)", new Unparser(2).render(node, IndentMode.INDENTED));
        assertEquals("f(x)", new Unparser(2).render(node, IndentMode.COMPACT));
        assertThrows(IllegalArgumentException.class, () -> new Unparser(0));
    }

    @Test
    void testHandBuiltTree() {
        Node node = Branch.of(Tag.LOGICAL,
            Branch.of(Tag.COMPARE, Leaf.var("a"), Leaf.op("="), Leaf.num(1)),
            Leaf.op("||"),
            Branch.of(Tag.GET, Leaf.var("m"), Branch.of(Tag.KEY, Leaf.str("k"))));
        assertEquals("a = 1 || m['k']", Unparser.compact(node));
    }

    @Test
    void testRenderingLeavesTreeUnchanged() {
        Node node = ExpressionParser.parse("f([1, 2], 'x')");
        Node copy = ExpressionParser.parse("f([1, 2], 'x')");
        Unparser.indented(node);
        Unparser.compact(node);
        assertEquals(copy, node);
    }
}
