package com.finopsguard.api;

import com.finopsguard.analysis.CostAnalysisService;
import com.finopsguard.analysis.dto.CheckRequest;
import com.finopsguard.analysis.dto.CheckResponse;
import com.finopsguard.analysis.dto.PolicyEvaluationRequest;
import com.finopsguard.analysis.dto.PolicyEvaluationResponse;
import com.finopsguard.pricing.PriceCatalogItem;
import com.finopsguard.pricing.PriceCatalogService;
import com.finopsguard.pricing.PriceSourceType;
import com.finopsguard.pricing.PricingResolver;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * REST API for cost checks and price data.
 *
 * ENDPOINT DESIGN:
 * - Thin layer over {@link CostAnalysisService}; all decisions happen there
 * - Errors are mapped to status codes by {@link ApiExceptionHandler}
 * - A blocked check is still a 200: the caller reads {@code policyEval.blocked}
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Cost Analysis", description = "IaC cost impact checks and pricing data")
public class AnalysisController {

    private final CostAnalysisService costAnalysisService;
    private final PriceCatalogService priceCatalogService;
    private final PricingResolver pricingResolver;
    private final Clock clock;

    @PostMapping("/check")
    @Operation(summary = "Check the cost impact of an IaC change",
               description = "Parses the payload, estimates monthly cost and evaluates policies")
    public ResponseEntity<CheckResponse> checkCostImpact(@Valid @RequestBody CheckRequest request) {
        return ResponseEntity.ok(costAnalysisService.checkCostImpact(request));
    }

    @PostMapping("/policy/evaluate")
    @Operation(summary = "Evaluate one policy against an IaC change",
               description = "Uses a registered policy id or an ad-hoc policy definition")
    public ResponseEntity<PolicyEvaluationResponse> evaluatePolicy(
            @Valid @RequestBody PolicyEvaluationRequest request
    ) {
        return ResponseEntity.ok(costAnalysisService.evaluatePolicy(request));
    }

    @GetMapping("/price-catalog")
    @Operation(summary = "List static catalog prices",
               description = "Optionally filtered by cloud, region and SKUs")
    public ResponseEntity<PriceCatalogResponse> getPriceCatalog(
            @RequestParam(required = false) String cloud,
            @RequestParam(required = false) String region,
            @RequestParam(required = false) List<String> skus
    ) {
        List<PriceCatalogItem> items = priceCatalogService.listCatalog(cloud, region);
        if (skus != null && !skus.isEmpty()) {
            Set<String> wanted = Set.copyOf(skus);
            items = items.stream().filter(item -> wanted.contains(item.sku())).toList();
        }
        return ResponseEntity.ok(new PriceCatalogResponse(
                clock.instant(),
                PriceSourceType.STATIC.getConfidence().getValue(),
                items
        ));
    }

    @PostMapping("/pricing/cache/flush")
    @Operation(summary = "Flush cached price quotes and catalog listings")
    public ResponseEntity<Void> flushPricingCache() {
        log.info("Pricing cache flush requested");
        pricingResolver.flush();
        priceCatalogService.evictCatalog();
        return ResponseEntity.noContent().build();
    }

    public record PriceCatalogResponse(
            Instant updatedAt,
            String pricingConfidence,
            List<PriceCatalogItem> items
    ) {}
}
