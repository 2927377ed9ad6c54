package com.finopsguard.parser.terraform;

/**
 * Non-literal attribute value (reference, function call, conditional) kept as source text.
 */
public record HclExpression(String text) {

    @Override
    public String toString() {
        return text;
    }
}
