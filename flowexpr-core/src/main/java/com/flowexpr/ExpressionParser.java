package com.flowexpr;

import com.flowexpr.ast.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent, precedence-climbing parser for data-flow expressions.
 *
 * <p>Grammar, lowest precedence first:</p>
 * <pre>
 * expression  -> logical ( ":=" logical )?
 * function    -> logical ( "->" logical )?
 * logical     -> compare ( ( "&amp;&amp;" | "||" ) compare )*
 * compare     -> sum ( ( "=" | "!=" | "&gt;" | "&lt;" | "&gt;=" | "&lt;=" | "&lt;=&gt;" ) product )*
 * sum         -> product ( ( "+" | "-" ) product )*
 * product     -> postfix ( ( "*" | "/" | "%" ) postfix )*
 * postfix     -> primary ( "(" args ")" | "[" args "]" )*
 * primary     -> word | number | string | ( "+" | "-" ) primary
 *              | "(" args ")" | "[" args "]" | "@(" args ")"
 * args        -> ( function ( "," function )* ","? )?
 * </pre>
 *
 * <p>The right operand of a comparison is parsed at product level, so
 * {@code a = b + c} compares {@code a} with {@code b} and leaves {@code + c}
 * unconsumed. Unary operators apply to a single primary, which makes
 * {@code -f(x)} a call of {@code -f}.</p>
 *
 * <p>Nesting is bounded by {@link ParserOptions#maxDepth()}. Collections, unary
 * operators, every step of a binary operator chain and every call or index
 * applied to a value each count as one level, so the height of the resulting
 * tree stays proportional to the limit even for long flat chains such as
 * {@code 1+1+1+...} or {@code f()()()...}.</p>
 *
 * <p>By default parsing stops after the first complete expression and ignores
 * what follows; {@link ParserOptions#requireFullInput()} turns leftovers into
 * a {@code TRAILING_INPUT} error.</p>
 *
 * <p>A parser instance walks its token list once and is not thread-safe;
 * the static {@code parse} helpers create one per call.</p>
 */
public class ExpressionParser {
    private static final Logger log = LoggerFactory.getLogger(ExpressionParser.class);

    private static final Lexer DEFAULT_LEXER = new Lexer();

    private static final Set<String> LOGICAL_OPERATORS = Set.of("and", "or");
    private static final Set<String> COMPARE_OPERATORS = Set.of(
        "equals", "notEquals", "greater", "lesser", "greaterOrEqual", "lessOrEqual", "equalsIgnoreCase");
    private static final Set<String> SUM_OPERATORS = Set.of("add", "minus");
    private static final Set<String> PRODUCT_OPERATORS = Set.of("multiply", "divide", "mod");
    private static final Set<String> UNARY_OPERATORS = Set.of("add", "minus");
    // Every operator variant some grammar rule consumes
    private static final Set<String> GRAMMAR_OPERATORS = Set.of(
        "arrow", "assign", "and", "or",
        "equals", "notEquals", "greater", "lesser", "greaterOrEqual", "lessOrEqual", "equalsIgnoreCase",
        "add", "minus", "multiply", "divide", "mod");

    /**
     * A lookahead result: the next non-space token and the index just past it.
     */
    record Lookahead(Token token, int next) {
    }

    private final List<Token> tokens;
    private final ParserOptions options;
    private int current = 0;
    private int depth = 0;
    private boolean used = false;

    public ExpressionParser(List<Token> tokens) {
        this(tokens, ParserOptions.DEFAULTS);
    }

    public ExpressionParser(List<Token> tokens, ParserOptions options) {
        this.tokens = List.copyOf(tokens);
        this.options = options;
    }

    public static Node parse(String source) {
        return parse(source, ParserOptions.DEFAULTS);
    }

    public static Node parse(String source, ParserOptions options) {
        return parse(DEFAULT_LEXER.tokenize(source), options);
    }

    public static Node parse(List<Token> tokens, ParserOptions options) {
        return new ExpressionParser(tokens, options).parse();
    }

    /**
     * Parses the token list into an expression tree.
     *
     * @throws ParseException if the tokens do not form a valid expression
     */
    public Node parse() {
        if (used) {
            throw new IllegalStateException("ExpressionParser instances parse only once");
        }
        used = true;

        Node root = parseExpression();

        Lookahead rest = peekSkippingSpace(current);
        if (!rest.token().isEnd()) {
            if (options.requireFullInput()) {
                throw unexpected(rest.token(), "Unexpected input after expression", ParseException.Kind.TRAILING_INPUT);
            }
            log.debug("Ignoring input after expression starting at {}", rest.token().describe());
        }
        if (log.isDebugEnabled()) {
            log.debug("Parsed {} tokens into {}", tokens.size(), root.tag());
        }
        return root;
    }

    // ========================================================================
    // Lookahead
    // ========================================================================

    /**
     * Returns the first non-space token at or after {@code index}, or a synthetic
     * end token when the stream is exhausted.
     */
    Lookahead peekSkippingSpace(int index) {
        for (int i = index; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (!token.isSpace()) {
                return new Lookahead(token, i + 1);
            }
        }
        return new Lookahead(endToken(), tokens.size());
    }

    private Token endToken() {
        if (tokens.isEmpty()) {
            return Token.endOfInput(1, 0);
        }
        Token last = tokens.get(tokens.size() - 1);
        return Token.endOfInput(last.line(), last.end());
    }

    private boolean isOperator(Token token, Set<String> variants) {
        return token.is(TokenCategory.OPERATOR) && variants.contains(token.variant());
    }

    // ========================================================================
    // Binary levels
    // ========================================================================

    private Node parseExpression() {
        Node left = parseLogical();
        Lookahead mid = peekSkippingSpace(current);
        if (mid.token().is(TokenCategory.OPERATOR, "assign")) {
            current = mid.next();
            Node right = parseLogical();
            return Branch.of(Tag.ASSIGN, left, right);
        }
        return left;
    }

    private Node parseFunction() {
        Node left = parseLogical();
        Lookahead mid = peekSkippingSpace(current);
        if (mid.token().is(TokenCategory.OPERATOR, "arrow")) {
            current = mid.next();
            Node right = parseLogical();
            return Branch.of(Tag.FUNC, left, right);
        }
        return left;
    }

    private Node parseLogical() {
        int base = depth;
        Node left = parseCompare();
        while (true) {
            Lookahead mid = peekSkippingSpace(current);
            if (!isOperator(mid.token(), LOGICAL_OPERATORS)) {
                depth = base;
                return left;
            }
            enter(mid.token());
            current = mid.next();
            Node right = parseCompare();
            left = Branch.of(Tag.LOGICAL, left, Leaf.op(mid.token().text()), right);
        }
    }

    private Node parseCompare() {
        int base = depth;
        Node left = parseSum();
        while (true) {
            Lookahead mid = peekSkippingSpace(current);
            if (!isOperator(mid.token(), COMPARE_OPERATORS)) {
                depth = base;
                return left;
            }
            enter(mid.token());
            current = mid.next();
            // Right side stops at product level
            Node right = parseProduct();
            left = Branch.of(Tag.COMPARE, left, Leaf.op(mid.token().text()), right);
        }
    }

    private Node parseSum() {
        int base = depth;
        Node left = parseProduct();
        while (true) {
            Lookahead mid = peekSkippingSpace(current);
            if (!isOperator(mid.token(), SUM_OPERATORS)) {
                depth = base;
                return left;
            }
            enter(mid.token());
            current = mid.next();
            Node right = parseProduct();
            left = Branch.of(Tag.SUMOP, left, Leaf.op(mid.token().text()), right);
        }
    }

    private Node parseProduct() {
        int base = depth;
        Node left = parsePostfix();
        while (true) {
            Lookahead mid = peekSkippingSpace(current);
            if (!isOperator(mid.token(), PRODUCT_OPERATORS)) {
                depth = base;
                return left;
            }
            enter(mid.token());
            current = mid.next();
            Node right = parsePostfix();
            left = Branch.of(Tag.PRODOP, left, Leaf.op(mid.token().text()), right);
        }
    }

    // ========================================================================
    // Postfix and primary
    // ========================================================================

    private Node parsePostfix() {
        int base = depth;
        Node left = parsePrimary();
        while (true) {
            Lookahead next = peekSkippingSpace(current);
            Token open = next.token();
            if (!open.is(TokenCategory.OPEN)) {
                depth = base;
                return left;
            }
            switch (open.variant()) {
                case "lparen" -> {
                    enter(open);
                    current = next.next();
                    left = Branch.of(Tag.CALL, left, new Branch(Tag.ARGS, parseCollection(open)));
                }
                case "lsquare" -> {
                    enter(open);
                    current = next.next();
                    left = Branch.of(Tag.GET, left, new Branch(Tag.KEY, parseCollection(open)));
                }
                default -> throw new ParseException(ParseException.Kind.NOT_IMPLEMENTED, open,
                    "Postfix '" + open.text() + "' is not implemented");
            }
        }
    }

    private Node parsePrimary() {
        Lookahead next = peekSkippingSpace(current);
        Token token = next.token();
        current = next.next();

        return switch (token.category()) {
            case WORD -> Leaf.var(token.text());
            case NUMBER -> Leaf.num(parseNumber(token.text()));
            case STRING -> {
                if (token.is(TokenCategory.STRING, "escape")) {
                    throw new ParseException(ParseException.Kind.UNEXPECTED_TOKEN, token,
                        "Escape outside of a string literal");
                }
                yield parseString(token);
            }
            case OPEN -> switch (token.variant()) {
                case "lparen" -> new Branch(Tag.PAREN, parseCollection(token));
                // "@(" is the PowerShell-style array literal
                case "lsquare", "larray" -> new Branch(Tag.LIST, parseCollection(token));
                default -> throw new ParseException(ParseException.Kind.NOT_IMPLEMENTED, token,
                    "Literal opened by '" + token.text() + "' is not implemented");
            };
            case OPERATOR -> {
                if (!UNARY_OPERATORS.contains(token.variant())) {
                    throw new ParseException(ParseException.Kind.NOT_IMPLEMENTED, token,
                        "Prefix operator '" + token.text() + "' is not implemented");
                }
                enter(token);
                Node operand = parsePrimary();
                depth--;
                yield Branch.of(Tag.UNOP, Leaf.op(token.text()), operand);
            }
            case END -> throw new ParseException(ParseException.Kind.UNEXPECTED_END, token,
                "Expected an expression");
            default -> throw new ParseException(ParseException.Kind.UNEXPECTED_TOKEN, token,
                "Invalid expression start");
        };
    }

    /**
     * Parses the elements of a collection whose open delimiter has been consumed,
     * up to and including the matching close delimiter.
     */
    private List<Node> parseCollection(Token open) {
        enter(open);
        String close = closeFor(open);
        List<Node> elements = new ArrayList<>();

        while (true) {
            Lookahead next = peekSkippingSpace(current);
            Token token = next.token();
            if (token.is(TokenCategory.CLOSE)) {
                if (!token.variant().equals(close)) {
                    throw new ParseException(ParseException.Kind.UNEXPECTED_TOKEN, token,
                        "Mismatched close delimiter for '" + open.text() + "' at line " + open.line()
                            + ", offset " + open.start());
                }
                current = next.next();
                break;
            }
            if (token.isEnd()) {
                throw new ParseException(ParseException.Kind.UNEXPECTED_END, open,
                    "Unclosed '" + open.text() + "'");
            }

            elements.add(parseFunction());

            Lookahead sep = peekSkippingSpace(current);
            if (sep.token().is(TokenCategory.SEP, "comma")) {
                current = sep.next();
            } else if (!sep.token().is(TokenCategory.CLOSE) && !sep.token().isEnd()) {
                throw unexpected(sep.token(), "Expected ',' or closing delimiter",
                    ParseException.Kind.UNEXPECTED_TOKEN);
            }
        }

        depth--;
        return elements;
    }

    private static String closeFor(Token open) {
        return switch (open.variant()) {
            case "lsquare" -> "rsquare";
            case "lcurly" -> "rcurly";
            default -> "rparen";
        };
    }

    /**
     * Reads a string literal whose opening quote has been consumed. Tokens up to the
     * matching quote contribute their raw text; an escape token makes the token after
     * it literal content.
     */
    private Node parseString(Token quote) {
        StringBuilder value = new StringBuilder();
        boolean escaped = false;
        for (int i = current; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (escaped) {
                value.append(token.text());
                escaped = false;
            } else if (token.is(TokenCategory.STRING, quote.variant())) {
                current = i + 1;
                return Leaf.str(value.toString());
            } else if (token.is(TokenCategory.STRING, "escape")) {
                escaped = true;
            } else {
                value.append(token.text());
            }
        }
        throw new ParseException(ParseException.Kind.UNEXPECTED_END, quote, "Unterminated string literal");
    }

    private static Number parseNumber(String text) {
        if (text.indexOf('.') >= 0) {
            return Double.parseDouble(text);
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            // Only digits reach here, so this is an overflow
            return new BigInteger(text);
        }
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private void enter(Token token) {
        if (++depth > options.maxDepth()) {
            throw new ParseException(ParseException.Kind.NESTING_TOO_DEEP, token,
                "Expression nested deeper than " + options.maxDepth() + " levels");
        }
    }

    private ParseException unexpected(Token token, String message, ParseException.Kind kind) {
        if (token.is(TokenCategory.OPERATOR) && !GRAMMAR_OPERATORS.contains(token.variant())) {
            return new ParseException(ParseException.Kind.NOT_IMPLEMENTED, token,
                "Operator '" + token.text() + "' (" + token.variant() + ") is not implemented");
        }
        return new ParseException(kind, token, message);
    }
}
