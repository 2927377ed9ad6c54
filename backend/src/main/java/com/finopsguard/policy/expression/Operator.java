package com.finopsguard.policy.expression;

import java.util.Locale;

/**
 * Comparison operators available to policy rules.
 */
public enum Operator {
    EQ("=="),
    NE("!="),
    GT(">"),
    LT("<"),
    GTE(">="),
    LTE("<="),
    IN("in"),
    CONTAINS("contains"),
    STARTS_WITH("starts_with"),
    ENDS_WITH("ends_with");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isNumeric() {
        return this == GT || this == LT || this == GTE || this == LTE;
    }

    /**
     * Resolve an operator from its symbol or enum name, ignoring case.
     *
     * @throws PolicyExpressionException for an unknown operator
     */
    public static Operator fromSymbol(String symbol) {
        if (symbol == null) {
            throw new PolicyExpressionException("Operator must not be null");
        }
        String normalized = symbol.trim().toLowerCase(Locale.ROOT);
        for (Operator operator : values()) {
            if (operator.symbol.equals(normalized) || operator.name().equalsIgnoreCase(normalized)) {
                return operator;
            }
        }
        return switch (normalized) {
            case "=", "eq" -> EQ;
            case "ne", "<>" -> NE;
            case "ge" -> GTE;
            case "le" -> LTE;
            default -> throw new PolicyExpressionException("Unknown operator: " + symbol);
        };
    }
}
