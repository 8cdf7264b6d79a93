package com.visaeligibility.expression;

import java.util.List;

/**
 * Membership test. With {@code substring} unset the needle must equal one of
 * the candidates; with it set there is exactly one candidate and the needle's
 * text must occur inside it.
 */
public record In(Expression needle, List<Expression> candidates, boolean substring) implements Expression {

    public In {
        candidates = List.copyOf(candidates);
    }

    public static In anyOf(Expression needle, List<Expression> candidates) {
        return new In(needle, candidates, false);
    }

    public static In substringOf(Expression needle, Expression haystack) {
        return new In(needle, List.of(haystack), true);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIn(this);
    }
}
