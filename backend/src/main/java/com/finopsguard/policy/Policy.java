package com.finopsguard.policy;

import com.finopsguard.policy.expression.Expression;
import com.finopsguard.policy.expression.ExpressionEvaluator;
import com.finopsguard.policy.expression.PolicyExpressionException;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A cost-governance policy.
 *
 * EVALUATION MODES:
 * - Budget: {@code budget} is set; fails when the monthly estimate exceeds it
 * - Rule: {@code expression} is set; the expression describes a forbidden
 *   condition, so the policy fails when it evaluates true
 *
 * When both are set the budget wins.
 */
@Getter
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode
public class Policy {

    private final String id;

    private final String name;

    private final String description;

    /**
     * Monthly budget limit in USD.
     */
    private final Double budget;

    private final Expression expression;

    @Builder.Default
    private final ViolationMode onViolation = ViolationMode.ADVISORY;

    @Builder.Default
    private final boolean enabled = true;

    public boolean isBudgetPolicy() {
        return budget != null;
    }

    /**
     * Rule policies referencing {@code resource.*} fields are evaluated once
     * per resource rather than once per request.
     */
    public boolean isResourceScoped() {
        return !isBudgetPolicy()
                && expression != null
                && expression.fields().stream().anyMatch(field -> field.startsWith("resource."));
    }

    /**
     * @throws PolicyExpressionException if the policy cannot be evaluated
     */
    public void validate() {
        if (budget == null && expression == null) {
            throw new PolicyExpressionException("Policy '" + id + "' has neither a budget nor an expression");
        }
        if (budget != null && (budget.isNaN() || budget < 0)) {
            throw new PolicyExpressionException("Policy '" + id + "' has an invalid budget: " + budget);
        }
        if (budget == null) {
            ExpressionEvaluator.validate(expression);
        }
    }
}
