package com.finopsguard.recommendation;

import com.finopsguard.domain.model.CanonicalResource;
import com.finopsguard.domain.model.CanonicalResourceModel;
import com.finopsguard.domain.model.CloudProvider;
import com.finopsguard.domain.model.PricingConfidence;
import com.finopsguard.pricing.PriceSourceType;
import com.finopsguard.pricing.catalog.AwsStaticPriceCatalog;
import com.finopsguard.simulation.CostBreakdownEntry;
import com.finopsguard.simulation.PricingSkuMapper;
import com.finopsguard.simulation.SimulationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for RecommendationEngine.
 *
 * Test strategy:
 * 1. Test recommendation generation for different environments
 * 2. Verify threshold-based filtering works correctly
 * 3. Ensure only machine-sized resources are considered
 */
class RecommendationEngineTest {

    private RecommendationEngine recommendationEngine;

    @BeforeEach
    void setUp() {
        recommendationEngine = new RecommendationEngine(
                Map.of(CloudProvider.AWS, new AwsStaticPriceCatalog()),
                new PricingSkuMapper()
        );
    }

    @Nested
    @DisplayName("Non-Production Tests")
    class NonProductionTests {

        @Test
        @DisplayName("Should suggest the next size down, spot and a shutdown schedule in dev")
        void shouldRecommendForExpensiveDevInstance() {
            // Given
            Priced priced = priced(instance("build", "m5.2xlarge", 1), 0.384, PriceSourceType.STATIC);

            // When
            List<Recommendation> result = recommendationEngine.recommend(priced.model(), priced.simulation(), "dev");

            // Then
            assertThat(result)
                    .extracting(Recommendation::type)
                    .containsExactly(
                            Recommendation.RecommendationType.RIGHT_SIZE,
                            Recommendation.RecommendationType.SPOT,
                            Recommendation.RecommendationType.SCHEDULE);
            Recommendation rightSize = result.get(0);
            assertThat(rightSize.summary()).contains("m5.xlarge");
            assertThat(rightSize.estimatedSavingsMonthly()).isEqualTo(140.16);
            assertThat(result.get(1).estimatedSavingsMonthly()).isEqualTo(196.22);
            assertThat(result.get(2).estimatedSavingsMonthly()).isEqualTo(180.25);
        }

        @Test
        @DisplayName("Should treat dev-like resource names as dev/test")
        void shouldDetectDevTestFromName() {
            // Given
            Priced priced = priced(instance("qa-runner", "m5.2xlarge", 1), 0.384, PriceSourceType.STATIC);

            // When
            List<Recommendation> result = recommendationEngine.recommend(priced.model(), priced.simulation(), "shared");

            // Then
            assertThat(result)
                    .extracting(Recommendation::type)
                    .contains(Recommendation.RecommendationType.SPOT, Recommendation.RecommendationType.SCHEDULE);
        }

        @Test
        @DisplayName("Should drop hints below the minimum savings threshold")
        void shouldFilterSmallSavings() {
            // Given
            Priced priced = priced(instance("tiny", "t3.micro", 1), 0.0104, PriceSourceType.STATIC);

            // When
            List<Recommendation> result = recommendationEngine.recommend(priced.model(), priced.simulation(), "dev");

            // Then
            assertThat(result).isEmpty();
        }

        @Test
        @DisplayName("Should not right-size resources priced at the default estimate")
        void shouldSkipRightSizeForDefaultPrices() {
            // Given
            Priced priced = priced(instance("odd", "m5.2xlarge", 1), 0.384, PriceSourceType.DEFAULT);

            // When
            List<Recommendation> result = recommendationEngine.recommend(priced.model(), priced.simulation(), "dev");

            // Then
            assertThat(result)
                    .extracting(Recommendation::type)
                    .doesNotContain(Recommendation.RecommendationType.RIGHT_SIZE);
        }
    }

    @Nested
    @DisplayName("Production Tests")
    class ProductionTests {

        @Test
        @DisplayName("Should only suggest a reservation in production")
        void shouldRecommendReservation() {
            // Given
            Priced priced = priced(instance("web", "m5.2xlarge", 1), 0.384, PriceSourceType.STATIC);

            // When
            List<Recommendation> result = recommendationEngine.recommend(priced.model(), priced.simulation(), "prod");

            // Then
            assertThat(result).hasSize(1);
            assertThat(result.get(0).type()).isEqualTo(Recommendation.RecommendationType.RESERVED);
            assertThat(result.get(0).estimatedSavingsMonthly()).isEqualTo(84.1);
            assertThat(result.get(0).id()).isEqualTo("reserved-" + priced.model().getResources().get(0).getId());
        }

        @Test
        @DisplayName("Should ignore resources not priced by machine size")
        void shouldIgnoreServiceResources() {
            // Given
            CanonicalResource cluster = CanonicalResource.builder()
                    .type("aws_eks_cluster").name("main").size("cluster").region("us-east-1").build();
            Priced priced = priced(cluster, 10.0, PriceSourceType.STATIC);

            // When
            List<Recommendation> result = recommendationEngine.recommend(priced.model(), priced.simulation(), "prod");

            // Then
            assertThat(result).isEmpty();
        }
    }

    private static CanonicalResource instance(String name, String size, int count) {
        return CanonicalResource.builder()
                .type("aws_instance")
                .name(name)
                .size(size)
                .region("us-east-1")
                .count(count)
                .build();
    }

    private static Priced priced(CanonicalResource resource, double hourly, PriceSourceType source) {
        CanonicalResourceModel model = CanonicalResourceModel.of(List.of(resource));
        String sku = new PricingSkuMapper().toSku(resource);
        double monthly = hourly * resource.getCount() * 730;
        CostBreakdownEntry entry = new CostBreakdownEntry(
                resource.getId(), resource.getType(), resource.getName(), resource.getSize(), resource.getRegion(),
                resource.getCount(), sku, hourly, monthly, source.getConfidence(), source, new ArrayList<>());
        SimulationResult simulation = new SimulationResult(monthly, monthly / 30 * 7, List.of(entry), List.of(),
                PricingConfidence.MEDIUM, 1);
        return new Priced(model, simulation);
    }

    private record Priced(CanonicalResourceModel model, SimulationResult simulation) {}
}
