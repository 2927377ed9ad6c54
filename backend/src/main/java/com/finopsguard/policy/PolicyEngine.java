package com.finopsguard.policy;

import com.finopsguard.domain.model.CanonicalResource;
import com.finopsguard.domain.model.CanonicalResourceModel;
import com.finopsguard.policy.expression.EvaluationContext;
import com.finopsguard.policy.expression.ExpressionEvaluator;
import com.finopsguard.policy.expression.PolicyExpressionException;
import com.finopsguard.policy.expression.Rule;
import com.finopsguard.simulation.CostBreakdownEntry;
import com.finopsguard.simulation.SimulationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Evaluates policies against a simulated request.
 *
 * EVALUATION:
 * - Every enabled policy is evaluated in the order given; there is no short-circuit
 * - Budget policies compare the monthly estimate against the budget
 * - Rule policies fail when their expression is true; resource-scoped rules are
 *   evaluated once per resource and report the violating resource ids
 * - Malformed policies are logged and skipped without affecting the others
 *
 * The report is blocked iff at least one blocking policy failed.
 */
@Service
@Slf4j
public class PolicyEngine {

    public PolicyEvaluationReport evaluate(List<Policy> policies, SimulationResult simulation,
                                           CanonicalResourceModel model, String environment) {
        EvaluationContext global = PolicyContexts.global(simulation, model, environment);
        List<EvaluationContext> resourceContexts = resourceContexts(global, simulation, model);

        List<PolicyEvaluationResult> results = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (Policy policy : policies) {
            if (!policy.isEnabled()) {
                continue;
            }
            try {
                results.add(evaluate(policy, policy.getOnViolation(), simulation, global, resourceContexts));
            } catch (PolicyExpressionException e) {
                log.warn("Skipping malformed policy '{}': {}", policy.getId(), e.getMessage());
                skipped.add(policy.getId());
            }
        }

        PolicyEvaluationReport report = PolicyEvaluationReport.of(results, skipped);
        log.info("Evaluated {} policies: status={}, {} blocking, {} advisory, {} skipped",
                results.size(), report.overallStatus().getValue(), report.blockingViolations().size(),
                report.advisoryViolations().size(), skipped.size());
        return report;
    }

    /**
     * Evaluate one policy, optionally overriding its violation mode.
     *
     * @param mode violation mode to report with, or null to keep the policy's own
     * @throws PolicyExpressionException if the policy is malformed
     */
    public PolicyEvaluationResult evaluatePolicy(Policy policy, SimulationResult simulation,
                                                 CanonicalResourceModel model, String environment,
                                                 ViolationMode mode) {
        EvaluationContext global = PolicyContexts.global(simulation, model, environment);
        ViolationMode effective = mode != null ? mode : policy.getOnViolation();
        return evaluate(policy, effective, simulation, global, resourceContexts(global, simulation, model));
    }

    private PolicyEvaluationResult evaluate(Policy policy, ViolationMode mode, SimulationResult simulation,
                                            EvaluationContext global, List<EvaluationContext> resourceContexts) {
        policy.validate();
        if (policy.isBudgetPolicy()) {
            return evaluateBudget(policy, mode, simulation.estimatedMonthlyCost());
        }
        if (policy.isResourceScoped()) {
            return evaluatePerResource(policy, mode, resourceContexts);
        }
        return evaluateGlobal(policy, mode, global);
    }

    private PolicyEvaluationResult evaluateBudget(Policy policy, ViolationMode mode, double monthlyCost) {
        double budget = policy.getBudget();
        if (monthlyCost > budget) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("actual_cost", roundCents(monthlyCost));
            details.put("budget_limit", budget);
            details.put("overage", roundCents(monthlyCost - budget));
            return PolicyEvaluationResult.failed(policy, mode,
                    String.format(Locale.ROOT, "Monthly cost $%.2f exceeds budget $%.2f", monthlyCost, budget),
                    details);
        }
        return PolicyEvaluationResult.passed(policy, mode,
                String.format(Locale.ROOT, "Monthly cost $%.2f within budget $%.2f", monthlyCost, budget));
    }

    private PolicyEvaluationResult evaluateGlobal(Policy policy, ViolationMode mode, EvaluationContext context) {
        if (!ExpressionEvaluator.evaluate(policy.getExpression(), context)) {
            return PolicyEvaluationResult.passed(policy, mode, rulesSatisfied(policy));
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("failed_rules", failedRules(policy, List.of(context)));
        return PolicyEvaluationResult.failed(policy, mode,
                String.format("Policy '%s' rule violation", policy.getName()), details);
    }

    private PolicyEvaluationResult evaluatePerResource(Policy policy, ViolationMode mode,
                                                       List<EvaluationContext> resourceContexts) {
        List<EvaluationContext> violating = resourceContexts.stream()
                .filter(context -> ExpressionEvaluator.evaluate(policy.getExpression(), context))
                .toList();
        if (violating.isEmpty()) {
            return PolicyEvaluationResult.passed(policy, mode, rulesSatisfied(policy));
        }

        List<String> resourceIds = violating.stream()
                .map(context -> String.valueOf(context.lookup("resource.id").orElse("unknown")))
                .toList();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("violating_resources", resourceIds);
        details.put("failed_rules", failedRules(policy, violating));
        return PolicyEvaluationResult.failed(policy, mode,
                String.format("Policy '%s' rule violation (resource: %s)", policy.getName(),
                        String.join(", ", resourceIds)),
                details);
    }

    private static List<String> failedRules(Policy policy, List<EvaluationContext> contexts) {
        Set<String> failed = new LinkedHashSet<>();
        for (Rule rule : policy.getExpression().rules()) {
            if (contexts.stream().anyMatch(context -> ExpressionEvaluator.evaluate(rule, context))) {
                failed.add(rule.toDsl());
            }
        }
        return new ArrayList<>(failed);
    }

    private static String rulesSatisfied(Policy policy) {
        return String.format("Policy '%s' rules satisfied", policy.getName());
    }

    private static List<EvaluationContext> resourceContexts(EvaluationContext global, SimulationResult simulation,
                                                            CanonicalResourceModel model) {
        Map<String, CostBreakdownEntry> costs = simulation.breakdown().stream()
                .collect(Collectors.toMap(CostBreakdownEntry::resourceId, Function.identity(), (a, b) -> a));
        return model.getResources().stream()
                .map((CanonicalResource resource) ->
                        PolicyContexts.forResource(global, resource, costs.get(resource.getId())))
                .toList();
    }

    private static double roundCents(double amount) {
        return Math.round(amount * 100.0) / 100.0;
    }
}
