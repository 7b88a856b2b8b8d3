package com.flowexpr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Ordered token rule table compiled into a single alternation.
 *
 * <p>Each rule becomes one capturing branch of the alternation, in declaration
 * order. Matching is attempted at a fixed position and the first branch that
 * matches decides the token, so overlapping symbols resolve to whichever
 * variant was declared first. That is how {@code <=} ends up as
 * {@code lessOrEqual} rather than {@code least} and {@code ^} as {@code xor}
 * rather than {@code bitwiseXor}.</p>
 *
 * <p>Instances are immutable and safe to share between threads. Rule patterns
 * may use capturing groups of their own but not numbered back-references.</p>
 */
public final class TokenRules {

    private static final TokenRules DEFAULTS = createDefaults();

    // An unescaped backslash followed by a group number
    private static final Pattern NUMBERED_BACK_REFERENCE = Pattern.compile("(?<!\\\\)(?:\\\\\\\\)*\\\\[1-9]");

    private final List<TokenRule> rules;
    private final Pattern pattern;
    // Group number of each rule's branch inside the combined pattern
    private final int[] branchGroups;

    private TokenRules(List<TokenRule> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
        this.branchGroups = new int[rules.size()];

        StringBuilder alternation = new StringBuilder();
        int group = 0;
        for (int i = 0; i < rules.size(); i++) {
            TokenRule rule = rules.get(i);
            if (i > 0) {
                alternation.append('|');
            }
            alternation.append('(').append(rule.regex()).append(')');
            group++;
            branchGroups[i] = group;
            group += Pattern.compile(rule.regex()).matcher("").groupCount();
        }
        this.pattern = Pattern.compile(alternation.toString());
    }

    /**
     * The shared default table of the data-flow expression language.
     */
    public static TokenRules defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<TokenRule> rules() {
        return rules;
    }

    /**
     * Returns a fresh matcher over {@code line}. Matchers are not thread-safe,
     * callers create one per line.
     */
    Matcher matcher(CharSequence line) {
        return pattern.matcher(line);
    }

    /**
     * Returns the rule whose branch produced the current match of {@code matcher}.
     */
    TokenRule matchedRule(Matcher matcher) {
        for (int i = 0; i < branchGroups.length; i++) {
            if (matcher.start(branchGroups[i]) != -1) {
                return rules.get(i);
            }
        }
        throw new IllegalStateException("Match did not come from any rule branch");
    }

    private static TokenRules createDefaults() {
        return builder()
            .literal(TokenCategory.OPERATOR, "arrow", "->")
            .literal(TokenCategory.OPERATOR, "assign", ":=")
            .literal(TokenCategory.OPERATOR, "add", "+")
            .literal(TokenCategory.OPERATOR, "minus", "-")
            .literal(TokenCategory.OPERATOR, "divide", "/")
            .literal(TokenCategory.OPERATOR, "multiply", "*")
            .literal(TokenCategory.OPERATOR, "mod", "%")
            .literal(TokenCategory.OPERATOR, "and", "&&")
            .literal(TokenCategory.OPERATOR, "or", "||")
            .literal(TokenCategory.OPERATOR, "xor", "^")
            .literal(TokenCategory.OPERATOR, "bitwiseAnd", "&")
            .literal(TokenCategory.OPERATOR, "bitwiseOr", "|")
            .literal(TokenCategory.OPERATOR, "bitwiseXor", "^")
            .literal(TokenCategory.OPERATOR, "equals", "=")
            .literal(TokenCategory.OPERATOR, "notEquals", "!=")
            .literal(TokenCategory.OPERATOR, "equalsIgnoreCase", "<=>")
            .literal(TokenCategory.OPERATOR, "greaterOrEqual", ">=")
            .literal(TokenCategory.OPERATOR, "lessOrEqual", "<=")
            .literal(TokenCategory.OPERATOR, "least", "<=")
            .literal(TokenCategory.OPERATOR, "greater", ">")
            .literal(TokenCategory.OPERATOR, "lesser", "<")
            .literal(TokenCategory.OPERATOR, "concat", "+")
            .literal(TokenCategory.OPEN, "larray", "@(")
            .literal(TokenCategory.OPEN, "lparen", "(")
            .literal(TokenCategory.OPEN, "lcurly", "{")
            .literal(TokenCategory.OPEN, "lsquare", "[")
            .literal(TokenCategory.CLOSE, "rparen", ")")
            .literal(TokenCategory.CLOSE, "rcurly", "}")
            .literal(TokenCategory.CLOSE, "rsquare", "]")
            .literal(TokenCategory.SEP, "comma", ",")
            .literal(TokenCategory.STRING, "apostrophe", "'")
            .literal(TokenCategory.STRING, "quotes", "\"")
            .literal(TokenCategory.STRING, "escape", "\\")
            .pattern(TokenCategory.SPACE, "space", "\\s+")
            // Decimal first, otherwise "1.5" would stop after "1"
            .pattern(TokenCategory.NUMBER, "number", "\\d*\\.\\d+|\\d+")
            .pattern(TokenCategory.WORD, "item", "#item(?:_\\d+)?")
            .pattern(TokenCategory.WORD, "index", "#index(?:_\\d+)?")
            .pattern(TokenCategory.WORD, "word", "[A-Za-z_][A-Za-z0-9_]*")
            .build();
    }

    /**
     * Collects rules in declaration order.
     */
    public static final class Builder {
        private final List<TokenRule> rules = new ArrayList<>();

        private Builder() {
        }

        /**
         * Adds a rule matching {@code symbol} verbatim.
         */
        public Builder literal(TokenCategory category, String variant, String symbol) {
            if (symbol == null || symbol.isEmpty()) {
                throw new IllegalArgumentException("Literal for " + variant + " must not be empty");
            }
            return add(new TokenRule(category, variant, Pattern.quote(symbol), true));
        }

        /**
         * Adds a rule matching the regular expression {@code regex}.
         */
        public Builder pattern(TokenCategory category, String variant, String regex) {
            Pattern compiled;
            try {
                compiled = Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid pattern for " + variant + ": " + regex, e);
            }
            if (NUMBERED_BACK_REFERENCE.matcher(regex).find()) {
                throw new IllegalArgumentException("Pattern for " + variant
                    + " uses a numbered back-reference, use a named group instead: " + regex);
            }
            if (compiled.matcher("").matches()) {
                throw new IllegalArgumentException("Pattern for " + variant + " matches the empty string: " + regex);
            }
            return add(new TokenRule(category, variant, regex, false));
        }

        private Builder add(TokenRule rule) {
            if (rule.category() == null || rule.category() == TokenCategory.END) {
                throw new IllegalArgumentException("Rules cannot produce category " + rule.category());
            }
            if (rule.variant() == null || rule.variant().isEmpty()) {
                throw new IllegalArgumentException("Variant name must not be empty");
            }
            rules.add(rule);
            return this;
        }

        public TokenRules build() {
            if (rules.isEmpty()) {
                throw new IllegalStateException("Token rule table is empty");
            }
            return new TokenRules(rules);
        }
    }
}
