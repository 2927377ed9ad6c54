package com.finopsguard.policy.expression;

/**
 * Raised for a policy or rule that cannot be evaluated: no budget and no
 * expression, a blank field, a missing operator, an empty {@code and}/{@code or},
 * an {@code in} without a list, or rule text that does not parse.
 */
public class PolicyExpressionException extends RuntimeException {

    public PolicyExpressionException(String message) {
        super(message);
    }

    public PolicyExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
