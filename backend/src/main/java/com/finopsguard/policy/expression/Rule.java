package com.finopsguard.policy.expression;

/**
 * Compares the context value at {@code field} against {@code value}.
 *
 * @param field dotted context path such as {@code resource.type} or {@code environment}
 * @param value a string, number, boolean, or a list of those for {@code in}
 */
public record Rule(String field, Operator operator, Object value) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitRule(this);
    }
}
