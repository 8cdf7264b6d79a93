package com.visaeligibility.expression;

import java.util.Arrays;
import java.util.Optional;

public enum ComparisonOperator {

    EQ("=="),
    NE("!="),
    GT(">"),
    GE(">="),
    LT("<"),
    LE("<=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isEquality() {
        return this == EQ || this == NE;
    }

    /**
     * Applies the operator to the sign of a {@code compareTo} result.
     */
    public boolean test(int comparison) {
        return switch (this) {
            case EQ -> comparison == 0;
            case NE -> comparison != 0;
            case GT -> comparison > 0;
            case GE -> comparison >= 0;
            case LT -> comparison < 0;
            case LE -> comparison <= 0;
        };
    }

    public static Optional<ComparisonOperator> fromSymbol(String symbol) {
        // strict-equality spellings map onto the typed comparison
        String normalized = switch (symbol) {
            case "===" -> "==";
            case "!==" -> "!=";
            default -> symbol;
        };
        return Arrays.stream(values())
                .filter(op -> op.symbol.equals(normalized))
                .findFirst();
    }
}
