package com.flowexpr;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class TokenRulesTest {

    @Test
    void testDefaultsAreShared() {
        assertSame(TokenRules.defaults(), TokenRules.defaults());
        assertEquals("arrow", TokenRules.defaults().rules().get(0).variant());
    }

    @Test
    void testDeclarationOrderBeatsLongestMatch() {
        TokenRules rules = TokenRules.builder()
            .literal(TokenCategory.OPERATOR, "lesser", "<")
            .literal(TokenCategory.OPERATOR, "lessOrEqual", "<=")
            .literal(TokenCategory.OPERATOR, "equals", "=")
            .build();

        List<String> variants = new Lexer(rules).tokenize("<=").stream()
            .map(Token::variant)
            .collect(Collectors.toList());
        assertEquals(List.of("lesser", "equals"), variants);
    }

    @Test
    void testPatternsWithCapturingGroups() {
        TokenRules rules = TokenRules.builder()
            .pattern(TokenCategory.WORD, "pair", "(a)(b)")
            .pattern(TokenCategory.WORD, "other", "(c)+")
            .literal(TokenCategory.SEP, "comma", ",")
            .build();

        List<Token> tokens = new Lexer(rules).tokenize("ab,cc");
        assertEquals("pair", tokens.get(0).variant());
        assertEquals("comma", tokens.get(1).variant());
        assertEquals("other", tokens.get(2).variant());
        assertEquals("cc", tokens.get(2).text());
    }

    @Test
    void testLiteralsAreQuoted() {
        TokenRules rules = TokenRules.builder()
            .literal(TokenCategory.OPERATOR, "star", "*")
            .literal(TokenCategory.OPERATOR, "dot", ".")
            .build();

        assertThrows(LexException.class, () -> new Lexer(rules).tokenize("x"));
        assertEquals(2, new Lexer(rules).tokenize("*.").size());
        assertTrue(rules.rules().get(0).literal());
    }

    @Test
    void testInvalidRulesAreRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> TokenRules.builder().pattern(TokenCategory.SPACE, "space", "\\s*"));
        assertThrows(IllegalArgumentException.class,
            () -> TokenRules.builder().pattern(TokenCategory.WORD, "broken", "[a-"));
        assertThrows(IllegalArgumentException.class,
            () -> TokenRules.builder().literal(TokenCategory.END, "end", "$"));
        assertThrows(IllegalArgumentException.class,
            () -> TokenRules.builder().literal(TokenCategory.OPERATOR, "", "+"));
        assertThrows(IllegalArgumentException.class,
            () -> TokenRules.builder().literal(TokenCategory.OPERATOR, "nothing", ""));
        assertThrows(IllegalStateException.class, () -> TokenRules.builder().build());
    }

    @Test
    void testNumberedBackReferencesAreRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> TokenRules.builder().pattern(TokenCategory.STRING, "doubled", "(['\"])\\1"));
        assertTrue(e.getMessage().contains("back-reference"), e.getMessage());

        // An escaped backslash before a digit is a literal, not a reference
        TokenRules rules = TokenRules.builder()
            .pattern(TokenCategory.WORD, "path", "\\\\1")
            .pattern(TokenCategory.WORD, "named", "(?<q>x)\\k<q>")
            .build();
        List<Token> tokens = new Lexer(rules).tokenize("\\1xx");
        assertEquals(List.of("path", "named"), tokens.stream().map(Token::variant).collect(Collectors.toList()));
    }
}
