package com.agentguard.condition;

import java.time.LocalTime;
import java.util.Arrays;
import java.util.Optional;

/**
 * Comparison operators allowed in a {@code time} clause.
 */
public enum TimeComparison {
    LT("<"),
    LTE("<="),
    GT(">"),
    GTE(">="),
    EQ("==");

    private final String symbol;

    TimeComparison(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean test(LocalTime actual, LocalTime bound) {
        int cmp = actual.compareTo(bound);
        return switch (this) {
            case LT -> cmp < 0;
            case LTE -> cmp <= 0;
            case GT -> cmp > 0;
            case GTE -> cmp >= 0;
            case EQ -> cmp == 0;
        };
    }

    public static Optional<TimeComparison> fromSymbol(String symbol) {
        return Arrays.stream(values()).filter(op -> op.symbol.equals(symbol)).findFirst();
    }
}
