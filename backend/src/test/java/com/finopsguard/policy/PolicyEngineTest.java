package com.finopsguard.policy;

import com.finopsguard.domain.model.CanonicalResource;
import com.finopsguard.domain.model.CanonicalResourceModel;
import com.finopsguard.domain.model.PricingConfidence;
import com.finopsguard.policy.dsl.RuleExpressionParser;
import com.finopsguard.policy.expression.Expression;
import com.finopsguard.policy.expression.Operator;
import com.finopsguard.policy.expression.Rule;
import com.finopsguard.pricing.PriceSourceType;
import com.finopsguard.simulation.CostBreakdownEntry;
import com.finopsguard.simulation.SimulationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PolicyEngineTest {

    private final PolicyEngine policyEngine = new PolicyEngine();

    private final CanonicalResource web = CanonicalResource.builder()
            .type("aws_instance").name("web").size("t3.medium").region("us-east-1").count(1).build();
    private final CanonicalResource batch = CanonicalResource.builder()
            .type("aws_instance").name("batch").size("t3.xlarge").region("us-east-1").count(2).build();
    private final CanonicalResourceModel model = CanonicalResourceModel.of(List.of(web, batch));

    // 30.368 + 242.944 a month at the bundled t3 prices
    private final SimulationResult simulation = new SimulationResult(
            273.312, 63.77, List.of(entry(web, 0.0416), entry(batch, 0.1664)), List.of(),
            PricingConfidence.MEDIUM, 3);

    @Nested
    @DisplayName("Budget Policy Tests")
    class BudgetPolicyTests {

        @Test
        @DisplayName("Should fail when the monthly estimate exceeds the budget")
        void shouldFailOverBudget() {
            // Given
            SimulationResult small = new SimulationResult(91.104, 21.26, List.of(), List.of(),
                    PricingConfidence.MEDIUM, 1);
            Policy policy = budget("tight", 50.0, ViolationMode.ADVISORY);

            // When
            PolicyEvaluationReport report = policyEngine.evaluate(List.of(policy), small, model, "dev");

            // Then
            PolicyEvaluationResult result = report.results().get(0);
            assertThat(result.status()).isEqualTo(PolicyStatus.FAIL);
            assertThat(result.reason()).isEqualTo("Monthly cost $91.10 exceeds budget $50.00");
            assertThat(result.violationDetails())
                    .containsEntry("actual_cost", 91.1)
                    .containsEntry("budget_limit", 50.0)
                    .containsEntry("overage", 41.1);
            assertThat(report.blocked()).isFalse();
            assertThat(report.overallStatus()).isEqualTo(PolicyEvaluationReport.OverallStatus.ADVISORY);
        }

        @Test
        @DisplayName("Should pass when the estimate equals the budget")
        void shouldPassAtBudget() {
            Policy policy = budget("exact", 273.312, ViolationMode.BLOCK);

            PolicyEvaluationReport report = policyEngine.evaluate(List.of(policy), simulation, model, "prod");

            assertThat(report.passedPolicies()).containsExactly("exact");
            assertThat(report.overallStatus()).isEqualTo(PolicyEvaluationReport.OverallStatus.PASS);
        }

        @Test
        @DisplayName("Should prefer the budget when a policy has both budget and rule")
        void shouldPreferBudget() {
            Policy policy = budget("both", 1000.0, ViolationMode.BLOCK).toBuilder()
                    .expression(Expression.rule("environment", Operator.EQ, "dev"))
                    .build();

            PolicyEvaluationReport report = policyEngine.evaluate(List.of(policy), simulation, model, "dev");

            assertThat(report.results().get(0).status()).isEqualTo(PolicyStatus.PASS);
        }
    }

    @Nested
    @DisplayName("Rule Policy Tests")
    class RulePolicyTests {

        @Test
        @DisplayName("Should report violating resources for resource-scoped rules")
        void shouldReportViolatingResources() {
            // Given
            Policy policy = rule("no_xlarge", "resource.size == 't3.xlarge' and environment == 'dev'",
                    ViolationMode.BLOCK);

            // When
            PolicyEvaluationReport report = policyEngine.evaluate(List.of(policy), simulation, model, "dev");

            // Then
            assertThat(report.blocked()).isTrue();
            assertThat(report.overallStatus()).isEqualTo(PolicyEvaluationReport.OverallStatus.BLOCK);
            PolicyEvaluationResult result = report.blockingViolations().get(0);
            assertThat(result.violationDetails().get("violating_resources"))
                    .isEqualTo(List.of(batch.getId()));
            assertThat(result.violationDetails().get("failed_rules"))
                    .isEqualTo(List.of("resource.size == \"t3.xlarge\"", "environment == \"dev\""));
            assertThat(result.reason()).contains(batch.getId());
        }

        @Test
        @DisplayName("Should evaluate global rules once against request totals")
        void shouldEvaluateGlobalRules() {
            // Given
            Policy policy = rule("total_cap", "estimated_monthly_cost > 200 and resource_types.aws_instance >= 3",
                    ViolationMode.ADVISORY);

            // When
            PolicyEvaluationReport report = policyEngine.evaluate(List.of(policy), simulation, model, "staging");

            // Then
            PolicyEvaluationResult result = report.results().get(0);
            assertThat(result.isFailed()).isTrue();
            assertThat(result.violationDetails()).doesNotContainKey("violating_resources");
            assertThat(report.advisoryViolations()).hasSize(1);
        }

        @Test
        @DisplayName("Should pass rules whose condition does not hold")
        void shouldPassWhenConditionFalse() {
            Policy policy = rule("no_gpu", "resource.type == 'aws_gpu_instance'", ViolationMode.BLOCK);

            PolicyEvaluationReport report = policyEngine.evaluate(List.of(policy), simulation, model, "dev");

            assertThat(report.results().get(0).reason()).isEqualTo("Policy 'no_gpu' rules satisfied");
            assertThat(report.blocked()).isFalse();
        }

        @Test
        @DisplayName("Should treat warning violations as non-blocking")
        void shouldNotBlockOnWarning() {
            Policy policy = rule("warn", "environment == 'dev'", ViolationMode.WARNING);

            PolicyEvaluationReport report = policyEngine.evaluate(List.of(policy), simulation, model, "dev");

            assertThat(report.blocked()).isFalse();
            assertThat(report.advisoryViolations()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Aggregation Tests")
    class AggregationTests {

        @Test
        @DisplayName("Should skip malformed and disabled policies without affecting others")
        void shouldSkipMalformedAndDisabled() {
            // Given
            Policy malformed = Policy.builder().id("broken").name("broken")
                    .expression(new Rule("resource.size", Operator.IN, "t3.xlarge")).build();
            Policy disabled = budget("off", 1.0, ViolationMode.BLOCK).toBuilder().enabled(false).build();
            Policy budget = budget("cap", 100.0, ViolationMode.BLOCK);

            // When
            PolicyEvaluationReport report = policyEngine.evaluate(
                    List.of(malformed, disabled, budget), simulation, model, "dev");

            // Then
            assertThat(report.skippedPolicies()).containsExactly("broken");
            assertThat(report.results()).extracting(PolicyEvaluationResult::policyId).containsExactly("cap");
            assertThat(report.blocked()).isTrue();
        }

        @Test
        @DisplayName("Should override the violation mode for a single evaluation")
        void shouldOverrideMode() {
            Policy policy = budget("cap", 100.0, ViolationMode.ADVISORY);

            PolicyEvaluationResult result = policyEngine.evaluatePolicy(
                    policy, simulation, model, "dev", ViolationMode.BLOCK);

            assertThat(result.isBlocking()).isTrue();
            assertThat(result.onViolation()).isEqualTo(ViolationMode.BLOCK);
        }

        @Test
        @DisplayName("Should pass with no policies")
        void shouldPassWithNoPolicies() {
            PolicyEvaluationReport report = policyEngine.evaluate(List.of(), simulation, model, "dev");

            assertThat(report.overallStatus()).isEqualTo(PolicyEvaluationReport.OverallStatus.PASS);
            assertThat(report.results()).isEmpty();
        }
    }

    private static Policy budget(String id, double budget, ViolationMode mode) {
        return Policy.builder().id(id).name(id).budget(budget).onViolation(mode).build();
    }

    private static Policy rule(String id, String rule, ViolationMode mode) {
        return Policy.builder().id(id).name(id).expression(RuleExpressionParser.parse(rule)).onViolation(mode).build();
    }

    private static CostBreakdownEntry entry(CanonicalResource resource, double hourly) {
        double monthly = hourly * resource.getCount() * 730;
        return new CostBreakdownEntry(resource.getId(), resource.getType(), resource.getName(), resource.getSize(),
                resource.getRegion(), resource.getCount(), resource.getSize(), hourly, monthly,
                PricingConfidence.MEDIUM, PriceSourceType.STATIC, new ArrayList<>());
    }
}
