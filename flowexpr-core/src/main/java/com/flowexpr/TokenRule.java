package com.flowexpr;

/**
 * One entry of the token rule table.
 *
 * @param category category assigned to matches
 * @param variant  variant name assigned to matches
 * @param regex    regular expression source; literals are stored quoted
 * @param literal  whether the rule was declared as a literal symbol
 */
public record TokenRule(TokenCategory category, String variant, String regex, boolean literal) {
}
