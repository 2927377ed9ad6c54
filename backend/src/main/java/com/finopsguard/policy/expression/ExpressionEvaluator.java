package com.finopsguard.policy.expression;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates an expression tree bottom-up against one context.
 *
 * RULE SEMANTICS:
 * - A field missing from the context makes the rule false
 * - Numeric operators coerce numbers and numeric strings; anything else is false
 * - A list on one side and a scalar on the other is false, except for
 *   {@code in} (value list) and {@code contains} (field list membership)
 * - {@code contains} on scalars is a case-insensitive substring test
 *
 * Structural problems in the tree raise {@link PolicyExpressionException}.
 */
public class ExpressionEvaluator implements ExpressionVisitor<Boolean> {

    private final EvaluationContext context;

    public ExpressionEvaluator(EvaluationContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    public static boolean evaluate(Expression expression, EvaluationContext context) {
        if (expression == null) {
            throw new PolicyExpressionException("Expression must not be null");
        }
        return expression.accept(new ExpressionEvaluator(context));
    }

    /**
     * Checks the tree for structural problems without evaluating it.
     */
    public static void validate(Expression expression) {
        if (expression == null) {
            throw new PolicyExpressionException("Expression must not be null");
        }
        expression.accept(new ExpressionVisitor<Void>() {
            @Override
            public Void visitRule(Rule rule) {
                checkRule(rule);
                return null;
            }

            @Override
            public Void visitAnd(And and) {
                checkChildren("and", and.children()).forEach(child -> child.accept(this));
                return null;
            }

            @Override
            public Void visitOr(Or or) {
                checkChildren("or", or.children()).forEach(child -> child.accept(this));
                return null;
            }
        });
    }

    @Override
    public Boolean visitRule(Rule rule) {
        checkRule(rule);
        Optional<Object> actual = context.lookup(rule.field());
        if (actual.isEmpty()) {
            return false;
        }
        return compare(rule.operator(), actual.get(), rule.value());
    }

    @Override
    public Boolean visitAnd(And and) {
        for (Expression child : checkChildren("and", and.children())) {
            if (!child.accept(this)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public Boolean visitOr(Or or) {
        for (Expression child : checkChildren("or", or.children())) {
            if (child.accept(this)) {
                return true;
            }
        }
        return false;
    }

    static boolean compare(Operator operator, Object actual, Object expected) {
        boolean actualIsList = actual instanceof Collection<?>;
        boolean expectedIsList = expected instanceof Collection<?>;

        return switch (operator) {
            case EQ -> actualIsList == expectedIsList && valuesEqual(actual, expected);
            case NE -> actualIsList == expectedIsList && !valuesEqual(actual, expected);
            case GT, LT, GTE, LTE -> compareNumeric(operator, actual, expected);
            case IN -> in(actual, (Collection<?>) expected);
            case CONTAINS -> contains(actual, expected);
            case STARTS_WITH -> !actualIsList && !expectedIsList && expected != null
                    && String.valueOf(actual).startsWith(String.valueOf(expected));
            case ENDS_WITH -> !actualIsList && !expectedIsList && expected != null
                    && String.valueOf(actual).endsWith(String.valueOf(expected));
        };
    }

    private static boolean in(Object actual, Collection<?> allowed) {
        if (actual instanceof Collection<?> values) {
            return values.stream().anyMatch(value -> in(value, allowed));
        }
        return allowed.stream().anyMatch(candidate -> valuesEqual(actual, candidate));
    }

    private static boolean contains(Object actual, Object expected) {
        if (expected == null || expected instanceof Collection<?>) {
            return false;
        }
        if (actual instanceof Collection<?> values) {
            return values.stream().anyMatch(value -> valuesEqual(value, expected)
                    || String.valueOf(value).equalsIgnoreCase(String.valueOf(expected)));
        }
        return String.valueOf(actual).toLowerCase(Locale.ROOT)
                .contains(String.valueOf(expected).toLowerCase(Locale.ROOT));
    }

    private static boolean compareNumeric(Operator operator, Object actual, Object expected) {
        Optional<Double> left = toNumber(actual);
        Optional<Double> right = toNumber(expected);
        if (left.isEmpty() || right.isEmpty()) {
            return false;
        }
        int comparison = Double.compare(left.get(), right.get());
        return switch (operator) {
            case GT -> comparison > 0;
            case LT -> comparison < 0;
            case GTE -> comparison >= 0;
            case LTE -> comparison <= 0;
            default -> false;
        };
    }

    static boolean valuesEqual(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        if (left instanceof Collection<?> l && right instanceof Collection<?> r) {
            if (l.size() != r.size()) {
                return false;
            }
            List<?> leftList = new ArrayList<>(l);
            List<?> rightList = new ArrayList<>(r);
            for (int i = 0; i < leftList.size(); i++) {
                if (!valuesEqual(leftList.get(i), rightList.get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (left instanceof Number || right instanceof Number) {
            Optional<Double> l = toNumber(left);
            Optional<Double> r = toNumber(right);
            if (l.isPresent() && r.isPresent()) {
                return Double.compare(l.get(), r.get()) == 0;
            }
        }
        return String.valueOf(left).equals(String.valueOf(right));
    }

    static Optional<Double> toNumber(Object value) {
        if (value instanceof Number number) {
            return Optional.of(number.doubleValue());
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Optional.of(Double.parseDouble(text.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static void checkRule(Rule rule) {
        if (rule.field() == null || rule.field().isBlank()) {
            throw new PolicyExpressionException("Rule field must not be blank");
        }
        if (rule.operator() == null) {
            throw new PolicyExpressionException("Rule on '" + rule.field() + "' has no operator");
        }
        if (rule.operator() == Operator.IN && !(rule.value() instanceof Collection<?>)) {
            throw new PolicyExpressionException("Operator 'in' on '" + rule.field() + "' requires a list value");
        }
    }

    private static List<Expression> checkChildren(String kind, List<Expression> children) {
        if (children.isEmpty()) {
            throw new PolicyExpressionException("'" + kind + "' expression has no children");
        }
        for (Expression child : children) {
            if (child == null) {
                throw new PolicyExpressionException("'" + kind + "' expression has a null child");
            }
        }
        return children;
    }
}
