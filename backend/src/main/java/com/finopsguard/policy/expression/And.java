package com.finopsguard.policy.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * True iff every child is true.
 */
public record And(List<Expression> children) implements Expression {

    public And {
        children = children == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(children));
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAnd(this);
    }
}
