package com.finopsguard.policy.expression;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Node of a policy rule tree: a {@link Rule} leaf, or an {@link And} / {@link Or}
 * over child expressions.
 *
 * Trees are immutable and are walked with an {@link ExpressionVisitor}.
 */
public interface Expression {

    <R> R accept(ExpressionVisitor<R> visitor);

    /**
     * Renders the expression in rule syntax, e.g.
     * {@code resource.type == "aws_gpu_instance" and environment == "dev"}.
     */
    default String toDsl() {
        return accept(new DslRenderer());
    }

    /**
     * Context fields referenced anywhere in the tree.
     */
    default Set<String> fields() {
        return accept(new FieldCollector());
    }

    /**
     * Leaf rules in left-to-right order.
     */
    default List<Rule> rules() {
        return accept(new RuleCollector());
    }

    static Rule rule(String field, Operator operator, Object value) {
        return new Rule(field, operator, value);
    }

    static And and(Expression... children) {
        return new And(Arrays.asList(children));
    }

    static Or or(Expression... children) {
        return new Or(Arrays.asList(children));
    }
}
