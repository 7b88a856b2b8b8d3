package com.flowexpr.batch;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * One expression read from a batch file.
 *
 * @param file   file the expression came from
 * @param index  1-based position of the expression within the file
 * @param line   1-based line of the file where the expression starts
 * @param source expression text
 */
public record BatchInput(Path file, int index, int line, String source) {

    static final String COMMENT_PREFIX = "//";

    /**
     * Splits file content into expressions. Expressions are separated by blank
     * lines; lines starting with {@code //} are comments and dropped.
     */
    public static List<BatchInput> split(Path file, String content) {
        List<BatchInput> inputs = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int startLine = 0;
        int lineNumber = 0;

        // Same line breaks as the lexer: \n, \r and \r\n
        for (String line : content.lines().toList()) {
            lineNumber++;
            if (line.strip().startsWith(COMMENT_PREFIX)) {
                continue;
            }
            if (line.isBlank()) {
                if (current.length() > 0) {
                    inputs.add(new BatchInput(file, inputs.size() + 1, startLine, current.toString()));
                    current.setLength(0);
                }
                continue;
            }
            if (current.length() == 0) {
                startLine = lineNumber;
            } else {
                current.append('\n');
            }
            current.append(line);
        }
        if (current.length() > 0) {
            inputs.add(new BatchInput(file, inputs.size() + 1, startLine, current.toString()));
        }
        return inputs;
    }

    public String label() {
        return file + "#" + index + " (line " + line + ")";
    }
}
