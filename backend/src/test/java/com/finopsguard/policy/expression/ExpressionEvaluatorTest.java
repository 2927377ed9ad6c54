package com.finopsguard.policy.expression;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpressionEvaluatorTest {

    private final EvaluationContext context = EvaluationContext.of(Map.of(
            "environment", "dev",
            "estimated_monthly_cost", 91.104,
            "risk_flags", List.of("over_budget"),
            "resource", Map.of(
                    "type", "aws_instance",
                    "size", "t3.xlarge",
                    "count", 2,
                    "tags", Map.of("owner", "Platform-Team", "app.kubernetes.io/name", "web"))
    ));

    @Nested
    @DisplayName("Rule Tests")
    class RuleTests {

        @Test
        @DisplayName("Should compare strings and numbers")
        void shouldCompareScalars() {
            assertThat(evaluate(Expression.rule("environment", Operator.EQ, "dev"))).isTrue();
            assertThat(evaluate(Expression.rule("environment", Operator.NE, "prod"))).isTrue();
            assertThat(evaluate(Expression.rule("resource.count", Operator.EQ, 2L))).isTrue();
            assertThat(evaluate(Expression.rule("estimated_monthly_cost", Operator.GT, 90))).isTrue();
            assertThat(evaluate(Expression.rule("estimated_monthly_cost", Operator.LTE, 91))).isFalse();
        }

        @Test
        @DisplayName("Should coerce numeric strings for numeric operators")
        void shouldCoerceNumericStrings() {
            assertThat(evaluate(Expression.rule("resource.count", Operator.GTE, "2"))).isTrue();
            assertThat(evaluate(Expression.rule("environment", Operator.GT, 1))).isFalse();
        }

        @Test
        @DisplayName("Should treat a missing field as false")
        void shouldFailOnMissingField() {
            assertThat(evaluate(Expression.rule("resource.tags.cost_center", Operator.EQ, "x"))).isFalse();
            assertThat(evaluate(Expression.rule("resource.tags.cost_center", Operator.NE, "x"))).isFalse();
        }

        @Test
        @DisplayName("Should match membership with in and contains")
        void shouldMatchMembership() {
            assertThat(evaluate(Expression.rule("resource.size", Operator.IN, List.of("t3.large", "t3.xlarge"))))
                    .isTrue();
            assertThat(evaluate(Expression.rule("risk_flags", Operator.CONTAINS, "over_budget"))).isTrue();
            assertThat(evaluate(Expression.rule("resource.tags.owner", Operator.CONTAINS, "platform"))).isTrue();
        }

        @Test
        @DisplayName("Should not compare a list with a scalar")
        void shouldRejectListScalarMismatch() {
            assertThat(evaluate(Expression.rule("risk_flags", Operator.EQ, "over_budget"))).isFalse();
            assertThat(evaluate(Expression.rule("environment", Operator.EQ, List.of("dev")))).isFalse();
        }

        @Test
        @DisplayName("Should match prefixes and suffixes")
        void shouldMatchAffixes() {
            assertThat(evaluate(Expression.rule("resource.type", Operator.STARTS_WITH, "aws_"))).isTrue();
            assertThat(evaluate(Expression.rule("resource.size", Operator.ENDS_WITH, "xlarge"))).isTrue();
        }

        @Test
        @DisplayName("Should resolve tag keys that contain dots")
        void shouldResolveDottedTagKeys() {
            assertThat(evaluate(Expression.rule("resource.tags.app.kubernetes.io/name", Operator.EQ, "web"))).isTrue();
            assertThat(context.lookup("resource.tags.app.kubernetes.io/name")).contains("web");
            assertThat(context.lookup("resource.tags.app.kubernetes")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Composite Tests")
    class CompositeTests {

        @Test
        @DisplayName("Should combine children with and/or")
        void shouldCombineChildren() {
            // Given
            Expression dev = Expression.rule("environment", Operator.EQ, "dev");
            Expression prod = Expression.rule("environment", Operator.EQ, "prod");

            // When / Then
            assertThat(evaluate(Expression.and(dev, prod))).isFalse();
            assertThat(evaluate(Expression.or(prod, dev))).isTrue();
            assertThat(evaluate(Expression.and(dev, Expression.or(prod, dev)))).isTrue();
        }

        @Test
        @DisplayName("Should reject structurally broken trees")
        void shouldRejectBrokenTrees() {
            assertThatThrownBy(() -> evaluate(new And(List.of())))
                    .isInstanceOf(PolicyExpressionException.class)
                    .hasMessageContaining("no children");
            assertThatThrownBy(() -> ExpressionEvaluator.validate(
                    Expression.rule("resource.size", Operator.IN, "t3.large")))
                    .isInstanceOf(PolicyExpressionException.class)
                    .hasMessageContaining("requires a list");
            assertThatThrownBy(() -> evaluate(Expression.rule(" ", Operator.EQ, "x")))
                    .isInstanceOf(PolicyExpressionException.class);
        }

        @Test
        @DisplayName("Should collect fields and leaf rules")
        void shouldCollectFieldsAndRules() {
            // Given
            Expression expression = Expression.and(
                    Expression.rule("resource.type", Operator.EQ, "aws_instance"),
                    Expression.or(
                            Expression.rule("environment", Operator.EQ, "dev"),
                            Expression.rule("environment", Operator.EQ, "test")));

            // Then
            assertThat(expression.fields()).containsExactlyInAnyOrder("resource.type", "environment");
            assertThat(expression.rules()).hasSize(3);
            assertThat(expression.toDsl())
                    .isEqualTo("resource.type == \"aws_instance\" and (environment == \"dev\" or environment == \"test\")");
        }
    }

    private boolean evaluate(Expression expression) {
        return ExpressionEvaluator.evaluate(expression, context);
    }
}
