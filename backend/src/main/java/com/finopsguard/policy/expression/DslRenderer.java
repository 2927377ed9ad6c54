package com.finopsguard.policy.expression;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Renders an expression tree back to rule syntax. {@code or} children of an
 * {@code and} are parenthesized; the output parses back to an equal tree.
 */
class DslRenderer implements ExpressionVisitor<String> {

    @Override
    public String visitRule(Rule rule) {
        String operator = rule.operator() == null ? "?" : rule.operator().getSymbol();
        return rule.field() + " " + operator + " " + literal(rule.value());
    }

    @Override
    public String visitAnd(And and) {
        return and.children().stream()
                .map(child -> child instanceof Or ? "(" + child.accept(this) + ")" : child.accept(this))
                .collect(Collectors.joining(" and "));
    }

    @Override
    public String visitOr(Or or) {
        return or.children().stream()
                .map(child -> child.accept(this))
                .collect(Collectors.joining(" or "));
    }

    static String literal(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Collection<?> values) {
            return values.stream().map(DslRenderer::literal).collect(Collectors.joining(", ", "[", "]"));
        }
        if (value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
            return d.toString();
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString()).stripTrailingZeros().toPlainString();
        }
        return "\"" + value.toString().replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
