package com.finopsguard.policy;

import com.finopsguard.domain.model.CanonicalResource;
import com.finopsguard.domain.model.CanonicalResourceModel;
import com.finopsguard.policy.expression.EvaluationContext;
import com.finopsguard.simulation.CostBreakdownEntry;
import com.finopsguard.simulation.SimulationResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the contexts policy rules are evaluated against.
 *
 * GLOBAL KEYS:
 * environment, estimated_monthly_cost, estimated_first_week_cost,
 * cost.monthly, cost.first_week, pricing_confidence, total_resources,
 * risk_flags, resource_types.&lt;type&gt; and regions.&lt;region&gt; (summed counts)
 *
 * RESOURCE KEYS (per-resource contexts only):
 * resource.id, resource.type, resource.name, resource.region, resource.size,
 * resource.count, resource.monthly_cost, resource.tags.&lt;key&gt;, resource.metadata.&lt;key&gt;
 */
public final class PolicyContexts {

    private PolicyContexts() {
    }

    public static EvaluationContext global(SimulationResult simulation, CanonicalResourceModel model,
                                           String environment) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("environment", environment);
        values.put("estimated_monthly_cost", simulation.estimatedMonthlyCost());
        values.put("estimated_first_week_cost", simulation.estimatedFirstWeekCost());
        values.put("cost", Map.of(
                "monthly", simulation.estimatedMonthlyCost(),
                "first_week", simulation.estimatedFirstWeekCost()));
        values.put("pricing_confidence", simulation.pricingConfidence().getValue());
        values.put("total_resources", model.size());
        values.put("risk_flags", simulation.riskFlags());

        Map<String, Integer> typeCounts = new LinkedHashMap<>();
        Map<String, Integer> regionCounts = new LinkedHashMap<>();
        for (CanonicalResource resource : model.getResources()) {
            typeCounts.merge(resource.getType(), resource.getCount(), Integer::sum);
            regionCounts.merge(resource.getRegion(), resource.getCount(), Integer::sum);
        }
        values.put("resource_types", typeCounts);
        values.put("regions", regionCounts);
        return EvaluationContext.of(values);
    }

    public static EvaluationContext forResource(EvaluationContext global, CanonicalResource resource,
                                                CostBreakdownEntry cost) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("id", resource.getId());
        values.put("type", resource.getType());
        values.put("name", resource.getName());
        values.put("region", resource.getRegion());
        values.put("size", resource.getSize());
        values.put("count", resource.getCount());
        values.put("tags", resource.getTags());
        values.put("metadata", resource.getMetadata());
        if (cost != null) {
            values.put("monthly_cost", cost.monthlyCost());
            values.put("cost_notes", cost.notes());
        }
        return global.with("resource", values);
    }
}
