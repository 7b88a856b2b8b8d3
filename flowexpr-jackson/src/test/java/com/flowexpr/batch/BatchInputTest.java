package com.flowexpr.batch;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BatchInputTest {

    private static final Path FILE = Path.of("exprs.txt");

    @Test
    void testSplitsOnBlankLines() {
        List<BatchInput> inputs = BatchInput.split(FILE, "1+2\n\n\nf(x)\n   \n[1]\n");
        assertEquals(3, inputs.size());
        assertEquals("1+2", inputs.get(0).source());
        assertEquals("f(x)", inputs.get(1).source());
        assertEquals("[1]", inputs.get(2).source());
        assertEquals(List.of(1, 2, 3), inputs.stream().map(BatchInput::index).toList());
        assertEquals(List.of(1, 4, 6), inputs.stream().map(BatchInput::line).toList());
    }

    @Test
    void testMultiLineExpressionKeepsNewlines() {
        List<BatchInput> inputs = BatchInput.split(FILE, "hello(\r\n    1,\r\n    2,\r\n)");
        assertEquals(1, inputs.size());
        assertEquals("hello(\n    1,\n    2,\n)", inputs.get(0).source());
    }

    @Test
    void testCommentsAreDropped() {
        List<BatchInput> inputs = BatchInput.split(FILE, "// header\n1\n  // inside\n+ 2\n\n// only a comment\n");
        assertEquals(1, inputs.size());
        assertEquals("1\n+ 2", inputs.get(0).source());
        assertEquals(2, inputs.get(0).line());
    }

    @Test
    void testEmptyContent() {
        assertTrue(BatchInput.split(FILE, "").isEmpty());
        assertTrue(BatchInput.split(FILE, "\n\n// nothing\n").isEmpty());
    }

    @Test
    void testLabel() {
        BatchInput input = new BatchInput(FILE, 2, 7, "x");
        assertEquals("exprs.txt#2 (line 7)", input.label());
    }

    @Test
    void testOnlyLexerLineBreaksSplit() {
        List<BatchInput> inputs = BatchInput.split(FILE, "1\f+ 2\u2028\n\n3\r\n");
        assertEquals(2, inputs.size());
        assertEquals("1\f+ 2\u2028", inputs.get(0).source());
        assertEquals(3, inputs.get(1).line());
    }
}
