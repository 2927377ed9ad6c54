package com.finopsguard.recommendation;

import com.finopsguard.domain.model.CanonicalResource;
import com.finopsguard.domain.model.CanonicalResourceModel;
import com.finopsguard.domain.model.CloudProvider;
import com.finopsguard.pricing.PriceSourceType;
import com.finopsguard.pricing.catalog.StaticPriceCatalog;
import com.finopsguard.simulation.CostBreakdownEntry;
import com.finopsguard.simulation.PricingSkuMapper;
import com.finopsguard.simulation.SimulationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Generates cost optimization hints from a simulated model.
 *
 * RECOMMENDATION TYPES:
 * 1. Right-size: a cheaper machine of the same family exists (non-production only)
 * 2. Spot: dev/test machines above $100/month could run on spot capacity
 * 3. Schedule: dev/test machines could stop outside working hours
 * 4. Reserved: production machines could use a 1-year commitment
 *
 * Only machine-sized resources are considered, and hints saving less than
 * {@value #MINIMUM_SAVINGS_THRESHOLD} USD a month are dropped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecommendationEngine {

    private final Map<CloudProvider, StaticPriceCatalog> staticPriceCatalogs;
    private final PricingSkuMapper skuMapper;

    static final double HOURS_PER_MONTH = 730;
    static final double MINIMUM_SAVINGS_THRESHOLD = 10.0; // $10/month minimum
    static final double SPOT_COST_THRESHOLD = 100.0;
    static final double RI_1_YEAR_DISCOUNT = 0.30;  // 30% savings for 1-year RI
    static final double SPOT_DISCOUNT = 0.70;       // ~70% savings for spot instances
    static final double DEV_HOURS_RATIO = 0.357;    // 12hr/day * 5 days/week = 60hr/168hr

    public List<Recommendation> recommend(CanonicalResourceModel model, SimulationResult simulation,
                                          String environment) {
        Map<String, CostBreakdownEntry> costs = simulation.breakdown().stream()
                .collect(Collectors.toMap(CostBreakdownEntry::resourceId, Function.identity(), (a, b) -> a));

        List<Recommendation> recommendations = new ArrayList<>();
        for (CanonicalResource resource : model.getResources()) {
            CostBreakdownEntry cost = costs.get(resource.getId());
            if (cost == null || cost.monthlyCost() <= 0 || !skuMapper.isSizePriced(resource.getType())) {
                continue;
            }
            recommendations.addAll(recommendFor(resource, cost, environment));
        }
        log.debug("Generated {} recommendations for {} resources", recommendations.size(), model.size());
        return recommendations;
    }

    private List<Recommendation> recommendFor(CanonicalResource resource, CostBreakdownEntry cost,
                                              String environment) {
        List<Recommendation> recommendations = new ArrayList<>();
        boolean production = isProduction(environment);
        boolean devTest = !production && isLikelyDevTest(environment, resource.getName());

        // Rightsizing within the same family
        if (!production && cost.priceSource() != PriceSourceType.DEFAULT) {
            findDownsize(resource, cost).ifPresent(recommendations::add);
        }

        // Spot capacity for expensive dev/test machines
        if (devTest && cost.monthlyCost() > SPOT_COST_THRESHOLD) {
            double savings = cost.monthlyCost() * SPOT_DISCOUNT;
            recommendations.add(new Recommendation(
                    "spot-" + resource.getId(),
                    Recommendation.RecommendationType.SPOT,
                    resource.getId(),
                    String.format("Run %s on spot capacity", resource.getId()),
                    "Non-production workload above $100/month. Spot or preemptible capacity typically saves ~70%.",
                    roundCents(savings)));
        }

        // Schedule shutdown outside working hours
        if (devTest) {
            double savings = cost.monthlyCost() * (1 - DEV_HOURS_RATIO);
            if (savings >= MINIMUM_SAVINGS_THRESHOLD) {
                recommendations.add(new Recommendation(
                        "schedule-" + resource.getId(),
                        Recommendation.RecommendationType.SCHEDULE,
                        resource.getId(),
                        "Schedule automatic shutdown during off-hours",
                        "Running 12 hours a day on weekdays only covers about 36% of the month.",
                        roundCents(savings)));
            }
        }

        // Reserved capacity for steady production machines
        if (production) {
            double savings = cost.monthlyCost() * RI_1_YEAR_DISCOUNT;
            if (savings >= MINIMUM_SAVINGS_THRESHOLD) {
                recommendations.add(new Recommendation(
                        "reserved-" + resource.getId(),
                        Recommendation.RecommendationType.RESERVED,
                        resource.getId(),
                        "Consider a 1-year reservation for " + cost.sku(),
                        "Production capacity is usually stable. 1-year commitments typically save ~30%.",
                        roundCents(savings)));
            }
        }
        return recommendations;
    }

    private Optional<Recommendation> findDownsize(CanonicalResource resource, CostBreakdownEntry cost) {
        StaticPriceCatalog catalog = staticPriceCatalogs.get(resource.getCloud());
        Optional<String> family = SkuFamilies.familyOf(cost.sku());
        if (catalog == null || family.isEmpty()) {
            return Optional.empty();
        }

        String bestSku = null;
        double bestPrice = 0;
        for (String candidate : catalog.getHourlyPrices().keySet()) {
            if (candidate.equals(cost.sku()) || !family.equals(SkuFamilies.familyOf(candidate))) {
                continue;
            }
            Optional<Double> price = catalog.lookup(candidate, resource.getRegion());
            // next size down: the most expensive candidate still cheaper than today
            if (price.isPresent() && price.get() > 0 && price.get() < cost.hourlyPrice() && price.get() > bestPrice) {
                bestSku = candidate;
                bestPrice = price.get();
            }
        }
        if (bestSku == null) {
            return Optional.empty();
        }

        double savings = (cost.hourlyPrice() - bestPrice) * resource.getCount() * HOURS_PER_MONTH;
        if (savings < MINIMUM_SAVINGS_THRESHOLD) {
            return Optional.empty();
        }
        return Optional.of(new Recommendation(
                "right-size-" + resource.getId(),
                Recommendation.RecommendationType.RIGHT_SIZE,
                resource.getId(),
                String.format("Downsize %s from %s to %s", resource.getId(), cost.sku(), bestSku),
                String.format(Locale.ROOT, "%s costs $%.4f/hour versus $%.4f/hour for %s.",
                        bestSku, bestPrice, cost.hourlyPrice(), cost.sku()),
                roundCents(savings)));
    }

    private static boolean isProduction(String environment) {
        String env = environment == null ? "" : environment.toLowerCase(Locale.ROOT);
        return env.equals("prod") || env.equals("production") || env.equals("prd");
    }

    private static boolean isLikelyDevTest(String environment, String resourceName) {
        String combined = ((environment != null ? environment : "") + " "
                + (resourceName != null ? resourceName : "")).toLowerCase(Locale.ROOT);
        return combined.contains("dev") ||
               combined.contains("test") ||
               combined.contains("staging") ||
               combined.contains("qa") ||
               combined.contains("sandbox") ||
               combined.contains("nonprod");
    }

    private static double roundCents(double amount) {
        return Math.round(amount * 100.0) / 100.0;
    }
}
