package com.finopsguard.policy;

import com.finopsguard.policy.expression.Expression;
import com.finopsguard.policy.expression.Operator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Registers the built-in policies at startup.
 *
 * Policies already present (same id) are left untouched, so restarts and
 * manual registrations are safe.
 */
@Component
@ConditionalOnProperty(prefix = "finopsguard.policy", name = "seed-defaults", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class DefaultPolicySeeder implements CommandLineRunner {

    static final List<String> LARGE_INSTANCE_SIZES =
            List.of("m5.large", "m5.xlarge", "m5.2xlarge", "c5.large", "c5.xlarge");

    private final PolicyStore policyStore;
    private final PolicyProperties properties;

    @Override
    public void run(String... args) {
        int seeded = 0;
        for (Policy policy : defaultPolicies(properties.getDefaultMonthlyBudget())) {
            if (!policyStore.contains(policy.getId())) {
                policyStore.add(policy);
                seeded++;
            }
        }
        log.info("Seeded {} default policies", seeded);
    }

    static List<Policy> defaultPolicies(double monthlyBudget) {
        return List.of(
                Policy.builder()
                        .id("default_monthly_budget")
                        .name("Default Monthly Budget")
                        .description("Default monthly budget limit")
                        .budget(monthlyBudget)
                        .onViolation(ViolationMode.ADVISORY)
                        .build(),
                Policy.builder()
                        .id("no_gpu_in_dev")
                        .name("No GPU Instances in Development")
                        .description("Prevent GPU instances in development environment")
                        .expression(Expression.and(
                                Expression.rule("resource.type", Operator.EQ, "aws_gpu_instance"),
                                Expression.rule("environment", Operator.EQ, "dev")))
                        .onViolation(ViolationMode.ADVISORY)
                        .build(),
                Policy.builder()
                        .id("no_large_instances_in_dev")
                        .name("No Large Instances in Development")
                        .description("Prevent large instance types in development environment")
                        .expression(Expression.and(
                                Expression.rule("resource.size", Operator.IN, LARGE_INSTANCE_SIZES),
                                Expression.rule("environment", Operator.EQ, "dev")))
                        .onViolation(ViolationMode.BLOCK)
                        .build()
        );
    }
}
