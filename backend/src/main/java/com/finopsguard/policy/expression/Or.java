package com.finopsguard.policy.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * True iff any child is true.
 */
public record Or(List<Expression> children) implements Expression {

    public Or {
        children = children == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(children));
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitOr(this);
    }
}
