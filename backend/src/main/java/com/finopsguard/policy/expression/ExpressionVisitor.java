package com.finopsguard.policy.expression;

public interface ExpressionVisitor<R> {

    R visitRule(Rule rule);

    R visitAnd(And and);

    R visitOr(Or or);
}
