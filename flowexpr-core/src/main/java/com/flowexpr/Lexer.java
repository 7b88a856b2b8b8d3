package com.flowexpr;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.regex.Matcher;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Splits source text into tokens using a {@link TokenRules} table.
 *
 * <p>Text is processed line by line. At every position the rule alternation is
 * tried anchored at that position; there is no searching forward, so every
 * character ends up in exactly one token, whitespace included. A position no
 * rule matches raises {@link LexException}.</p>
 *
 * <p>The lexer holds no per-call state and can be shared between threads.</p>
 */
public class Lexer {
    private static final Logger log = LoggerFactory.getLogger(Lexer.class);

    private final TokenRules rules;

    public Lexer() {
        this(TokenRules.defaults());
    }

    public Lexer(TokenRules rules) {
        this.rules = rules;
    }

    public TokenRules rules() {
        return rules;
    }

    /**
     * Tokenizes the whole source eagerly.
     *
     * @throws LexException at the first position no rule matches
     */
    public List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        tokens(source).forEachRemaining(tokens::add);
        if (log.isTraceEnabled()) {
            log.trace("Tokenized {} chars into {} tokens", source.length(), tokens.size());
        }
        return tokens;
    }

    /**
     * Returns a lazy, single-pass iterator over the tokens of {@code source}.
     * A {@link LexException} is thrown by {@code hasNext()}/{@code next()} once
     * the failing position is reached.
     */
    public Iterator<Token> tokens(String source) {
        return new TokenIterator(source);
    }

    public Stream<Token> stream(String source) {
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(tokens(source), Spliterator.ORDERED | Spliterator.NONNULL),
            false);
    }

    private final class TokenIterator implements Iterator<Token> {
        private final Iterator<String> lines;
        private String line;
        private Matcher matcher;
        private int lineNumber = 0;
        private int position = 0;
        private Token next;

        TokenIterator(String source) {
            this.lines = source.lines().iterator();
        }

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public Token next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Token token = next;
            next = null;
            return token;
        }

        private Token advance() {
            while (line == null || position >= line.length()) {
                if (!lines.hasNext()) {
                    return null;
                }
                line = lines.next();
                matcher = rules.matcher(line);
                lineNumber++;
                position = 0;
            }

            matcher.region(position, line.length());
            if (!matcher.lookingAt() || matcher.end() == position) {
                throw new LexException(lineNumber, position, line);
            }

            TokenRule rule = rules.matchedRule(matcher);
            Token token = new Token(rule.category(), rule.variant(), matcher.group(), position, matcher.end(), lineNumber);
            position = matcher.end();
            return token;
        }
    }
}
