package com.flowexpr.batch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

public class BatchRunnerTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    private int run(String... args) throws InterruptedException {
        BatchRunner.Config config = BatchRunner.Config.parse(args);
        assertNotNull(config, "arguments should be accepted");
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        return new BatchRunner(config, out).run();
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    // ==================== Config ====================

    @Test
    void testConfigDefaults() {
        BatchRunner.Config config = BatchRunner.Config.parse(new String[]{"a.txt", "b.txt"});
        assertNotNull(config);
        assertEquals(BatchRunner.Mode.COMPACT, config.mode());
        assertEquals(2, config.files().size());
        assertTrue(config.threads() >= 1);
        assertFalse(config.strict);
    }

    @Test
    void testConfigOptions() {
        BatchRunner.Config config = BatchRunner.Config.parse(new String[]{
            "--mode=json", "--threads=3", "--indent=2", "--max-depth=10", "--strict", "--verbose", "x.txt"
        });
        assertNotNull(config);
        assertEquals(BatchRunner.Mode.JSON, config.mode());
        assertEquals(3, config.threads());
        assertEquals(2, config.indentWidth);
        assertEquals(10, config.maxDepth);
        assertTrue(config.strict);
        assertTrue(config.verbose);
    }

    @Test
    void testConfigRejectsBadUsage() {
        assertNull(BatchRunner.Config.parse(new String[]{}));
        assertNull(BatchRunner.Config.parse(new String[]{"--help"}));
        assertNull(BatchRunner.Config.parse(new String[]{"--mode=xml", "a.txt"}));
        assertNull(BatchRunner.Config.parse(new String[]{"--threads=0", "a.txt"}));
        assertNull(BatchRunner.Config.parse(new String[]{"--indent=abc", "a.txt"}));
        assertNull(BatchRunner.Config.parse(new String[]{"--bogus", "a.txt"}));
    }

    // ==================== Runs ====================

    @Test
    void testAllExpressionsParse() throws Exception {
        Path file = write("ok.txt", "// arithmetic\n1+2*3\n\nf(1)[2]\n");
        assertEquals(0, run("--threads=2", file.toString()));

        String out = output();
        assertTrue(out.contains("== " + file + "#1 (line 2)\n1 + 2*3\n"), out);
        assertTrue(out.contains("== " + file + "#2 (line 4)\nf(1)[2]\n"), out);
        assertTrue(out.contains("Parsed 2 of 2 expressions, 0 failed"), out);
    }

    @Test
    void testFailuresAreReportedPerExpression() throws Exception {
        Path file = write("mixed.txt", "a +\n\n[1, 2\n\n{1}\n\nx := 1\n");
        assertEquals(1, run(file.toString()));

        String out = output();
        assertTrue(out.contains("!! " + file + "#1 (line 1)"), out);
        assertTrue(out.contains("!! " + file + "#2 (line 3)"), out);
        assertTrue(out.contains("!! " + file + "#3 (line 5)"), out);
        assertTrue(out.contains("== " + file + "#4 (line 7)\nx := 1\n"), out);
        assertTrue(out.contains("Parsed 1 of 4 expressions, 3 failed"), out);
    }

    @Test
    void testResultsKeepInputOrder() throws Exception {
        StringBuilder content = new StringBuilder();
        for (int i = 0; i < 50; i++) {
            content.append("n").append(i).append(" + ").append(i).append("\n\n");
        }
        Path file = write("many.txt", content.toString());
        assertEquals(0, run("--threads=4", file.toString()));

        String out = output();
        int previous = -1;
        for (int i = 0; i < 50; i++) {
            int at = out.indexOf("\nn" + i + " + " + i + "\n");
            assertTrue(at > previous, "expression " + i + " out of order");
            previous = at;
        }
    }

    @Test
    void testModes() throws Exception {
        Path file = write("modes.txt", "f(1, 2)\n");

        assertEquals(0, run("--mode=tree", file.toString()));
        assertTrue(output().contains("CALL(VAR(f), ARGS(NUM(1), NUM(2)))"), output());

        buffer.reset();
        assertEquals(0, run("--mode=indented", "--indent=2", file.toString()));
        assertTrue(output().contains("f(\n  1,\n  2,\n)"), output());

        buffer.reset();
        assertEquals(0, run("--mode=json", file.toString()));
        assertTrue(output().contains("\"CALL\""), output());
        assertTrue(output().contains("\"ARGS\""), output());
    }

    @Test
    void testStrictRejectsTrailingInput() throws Exception {
        Path file = write("trailing.txt", "a = b + c\n");

        assertEquals(0, run(file.toString()));
        assertTrue(output().contains("\na = b\n"), output());

        buffer.reset();
        assertEquals(1, run("--strict", file.toString()));
        assertTrue(output().contains("!! " + file + "#1"), output());
    }

    @Test
    void testLongChainFailsOnlyItsOwnInput() throws Exception {
        Path file = write("chain.txt", "a + b\n\n1" + "+1".repeat(50000) + "\n\nc * d\n");
        assertEquals(1, run(file.toString()));

        String out = output();
        assertTrue(out.contains("== " + file + "#1 (line 1)\na + b\n"), out);
        assertTrue(out.contains("!! " + file + "#2 (line 3)"), out);
        assertTrue(out.contains("== " + file + "#3 (line 5)\nc*d\n"), out);
        assertTrue(out.contains("Parsed 2 of 3 expressions, 1 failed"), out);
    }

    @Test
    void testRenderingOverflowIsContained() throws Exception {
        Path file = write("tall.txt", "1" + "+1".repeat(100000) + "\n\nok\n");
        assertEquals(1, run("--max-depth=1000000", "--threads=1", file.toString()));

        String out = output();
        assertTrue(out.contains("!! " + file + "#1 (line 1)"), out);
        assertTrue(out.contains("== " + file + "#2 (line 3)\nok\n"), out);
    }

    @Test
    void testModeNameIgnoresDefaultLocale() {
        Locale saved = Locale.getDefault();
        try {
            Locale.setDefault(new Locale("tr", "TR"));
            BatchRunner.Config config = BatchRunner.Config.parse(new String[]{"--mode=indented", "a.txt"});
            assertNotNull(config);
            assertEquals(BatchRunner.Mode.INDENTED, config.mode());
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    void testMaxDepth() throws Exception {
        Path file = write("deep.txt", "[[[1]]]\n");
        assertEquals(0, run(file.toString()));

        buffer.reset();
        assertEquals(1, run("--max-depth=2", file.toString()));
    }

    @Test
    void testUnreadableFile() throws Exception {
        Path good = write("good.txt", "1\n");
        Path missing = dir.resolve("missing.txt");
        assertEquals(1, run(good.toString(), missing.toString()));

        String out = output();
        assertTrue(out.contains("!! " + missing + ": cannot read"), out);
        assertTrue(out.contains("Parsed 1 of 1 expressions, 0 failed"), out);
    }
}
