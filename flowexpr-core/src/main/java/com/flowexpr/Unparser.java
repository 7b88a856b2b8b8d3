package com.flowexpr;

import com.flowexpr.ast.Branch;
import com.flowexpr.ast.Leaf;
import com.flowexpr.ast.Node;

import java.math.BigDecimal;
import java.util.stream.Collectors;

/**
 * Renders an expression tree back to source text.
 *
 * <p>The output re-parses to the same tree; it is not guaranteed to match the
 * original text. Strings are always written with single quotes, escaping
 * {@code '} and {@code \}. Rendering is a pure function of the node and the
 * mode, and instances are immutable.</p>
 */
public class Unparser {

    public static final int DEFAULT_INDENT_WIDTH = 4;

    private static final Unparser DEFAULT = new Unparser(DEFAULT_INDENT_WIDTH);

    private final String indent;

    public Unparser() {
        this(DEFAULT_INDENT_WIDTH);
    }

    public Unparser(int indentWidth) {
        if (indentWidth < 1) {
            throw new IllegalArgumentException("indentWidth must be positive, got " + indentWidth);
        }
        this.indent = " ".repeat(indentWidth);
    }

    public static String compact(Node node) {
        return DEFAULT.render(node, IndentMode.COMPACT);
    }

    public static String indented(Node node) {
        return DEFAULT.render(node, IndentMode.INDENTED);
    }

    public String render(Node node, IndentMode mode) {
        if (node instanceof Leaf leaf) {
            return renderLeaf(leaf);
        }
        Branch branch = (Branch) node;
        boolean indented = mode == IndentMode.INDENTED;

        return switch (branch.tag()) {
            case UNOP, PRODOP -> join(branch, "", mode);
            case SUMOP, COMPARE, LOGICAL -> join(branch, " ", mode);
            case FUNC -> render(branch.child(0), mode) + " -> " + render(branch.child(1), mode);
            case ASSIGN -> render(branch.child(0), mode) + " := " + render(branch.child(1), mode);
            case CALL -> {
                String callee = render(branch.child(0), mode);
                Branch args = (Branch) branch.child(1);
                if (!indented || args.size() == 0) {
                    yield callee + "(" + render(args, mode) + ")";
                }
                yield callee + "(\n" + indent(render(args, mode)) + "\n)";
            }
            case GET -> render(branch.child(0), mode) + "[" + render(branch.child(1), mode) + "]";
            case KEY -> join(branch, ", ", mode);
            case PAREN -> "(" + join(branch, ", ", mode) + ")";
            case LIST -> {
                if (!indented || branch.size() == 0) {
                    yield "[" + join(branch, ", ", mode) + "]";
                }
                yield "[\n" + indent(join(branch, ",\n", mode)) + ",\n]";
            }
            case ARGS -> {
                if (!indented || branch.size() == 0) {
                    yield join(branch, ", ", mode);
                }
                yield join(branch, ",\n", mode) + ",";
            }
            default -> throw new IllegalArgumentException("Cannot render " + branch.tag());
        };
    }

    private String renderLeaf(Leaf leaf) {
        return switch (leaf.tag()) {
            case NUM -> renderNumber((Number) leaf.value());
            case STR -> quote(leaf.text());
            case VAR, OP -> leaf.text();
            default -> throw new IllegalArgumentException("Cannot render " + leaf.tag());
        };
    }

    private String join(Branch branch, String separator, IndentMode mode) {
        return branch.children().stream()
            .map(child -> render(child, mode))
            .collect(Collectors.joining(separator));
    }

    private String indent(String text) {
        return text.lines()
            .map(line -> line.isBlank() ? line : indent + line)
            .collect(Collectors.joining("\n"));
    }

    private static String quote(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    private static String renderNumber(Number value) {
        if (value instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) {
                throw new IllegalArgumentException("No literal form for " + d);
            }
            // Always keep a fraction
            String text = BigDecimal.valueOf(d).toPlainString();
            return text.indexOf('.') >= 0 ? text : text + ".0";
        }
        return value.toString();
    }
}
