package com.finopsguard.analysis;

import com.finopsguard.analysis.dto.CheckRequest;
import com.finopsguard.analysis.dto.CheckResponse;
import com.finopsguard.analysis.dto.PolicyEvaluationRequest;
import com.finopsguard.analysis.dto.PolicyEvaluationResponse;
import com.finopsguard.analysis.dto.ResourceBreakdownItem;
import com.finopsguard.domain.model.CanonicalResourceModel;
import com.finopsguard.parser.IacParser;
import com.finopsguard.policy.Policy;
import com.finopsguard.policy.PolicyEngine;
import com.finopsguard.policy.PolicyEvaluationReport;
import com.finopsguard.policy.PolicyEvaluationResult;
import com.finopsguard.policy.PolicyNotFoundException;
import com.finopsguard.policy.PolicyStore;
import com.finopsguard.policy.ViolationMode;
import com.finopsguard.policy.dsl.PolicyDslParser;
import com.finopsguard.recommendation.Recommendation;
import com.finopsguard.recommendation.RecommendationEngine;
import com.finopsguard.simulation.CostBreakdownEntry;
import com.finopsguard.simulation.CostSimulationService;
import com.finopsguard.simulation.SimulationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Orchestrates one cost impact check.
 *
 * PIPELINE:
 * 1. Decode the payload (base64, or plain text as given)
 * 2. Parse into the canonical resource model
 * 3. Price and simulate, flagging budget overruns
 * 4. Evaluate the policy snapshot plus the request budget, if any
 * 5. Attach optimization hints
 *
 * Each request works on its own policy snapshot, so concurrent edits to the
 * store never change a running evaluation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CostAnalysisService {

    public static final String REQUEST_BUDGET_POLICY_ID = "request_budget";
    public static final String POLICY_BLOCKED = "policy_blocked";
    public static final String POLICY_ADVISORY = "policy_advisory";

    private final IacParser iacParser;
    private final CostSimulationService simulationService;
    private final PolicyEngine policyEngine;
    private final PolicyStore policyStore;
    private final PolicyDslParser policyDslParser;
    private final RecommendationEngine recommendationEngine;

    public CheckResponse checkCostImpact(CheckRequest request) {
        long start = System.currentTimeMillis();
        log.info("Cost check: iacType={}, environment={}", request.iacType(), request.environment());

        CanonicalResourceModel model = iacParser.parse(request.iacType(), decodePayload(request.iacPayload()));
        Double budget = request.budgetRules() != null ? request.budgetRules().monthlyBudget() : null;
        SimulationResult simulation = simulationService.simulate(model, budget);

        List<Policy> policies = selectPolicies(request.policyIds());
        if (budget != null) {
            policies.add(Policy.builder()
                    .id(REQUEST_BUDGET_POLICY_ID)
                    .name("Request Budget Rule")
                    .description("Monthly budget supplied with the request")
                    .budget(budget)
                    .onViolation(ViolationMode.ADVISORY)
                    .build());
        }
        PolicyEvaluationReport report = policyEngine.evaluate(policies, simulation, model, request.environment());

        List<String> riskFlags = new ArrayList<>(simulation.riskFlags());
        if (report.blocked()) {
            riskFlags.add(POLICY_BLOCKED);
        } else if (!report.advisoryViolations().isEmpty()) {
            riskFlags.add(POLICY_ADVISORY);
        }

        List<Recommendation> recommendations =
                recommendationEngine.recommend(model, simulation, request.environment());

        long duration = System.currentTimeMillis() - start;
        log.info("Cost check complete: {} resources, ${}/month, status={}, {}ms",
                model.size(), roundCents(simulation.estimatedMonthlyCost()),
                report.overallStatus().getValue(), duration);

        return new CheckResponse(
                roundCents(simulation.estimatedMonthlyCost()),
                roundCents(simulation.estimatedFirstWeekCost()),
                simulation.breakdown().stream().map(CostAnalysisService::toBreakdownItem).toList(),
                riskFlags,
                recommendations,
                report,
                simulation.pricingConfidence().getValue(),
                duration
        );
    }

    /**
     * Evaluate a single registered or ad-hoc policy against an IaC change.
     *
     * @throws IllegalArgumentException if neither a policy id nor a DSL definition is given
     * @throws PolicyNotFoundException if the policy id is unknown
     */
    public PolicyEvaluationResponse evaluatePolicy(PolicyEvaluationRequest request) {
        Policy policy = resolvePolicy(request);
        ViolationMode mode = request.mode() == null || request.mode().isBlank()
                ? null
                : ViolationMode.fromValue(request.mode());

        CanonicalResourceModel model = iacParser.parse(request.iacType(), decodePayload(request.iacPayload()));
        SimulationResult simulation = simulationService.simulate(model);
        PolicyEvaluationResult result =
                policyEngine.evaluatePolicy(policy, simulation, model, request.environment(), mode);

        log.info("Policy '{}' evaluated: {}", policy.getId(), result.status().getValue());
        return new PolicyEvaluationResponse(
                result,
                result.isBlocking(),
                roundCents(simulation.estimatedMonthlyCost()),
                simulation.pricingConfidence().getValue()
        );
    }

    private Policy resolvePolicy(PolicyEvaluationRequest request) {
        if (request.policyId() != null && !request.policyId().isBlank()) {
            return policyStore.get(request.policyId())
                    .orElseThrow(() -> new PolicyNotFoundException(request.policyId()));
        }
        if (request.policyDsl() != null && !request.policyDsl().isBlank()) {
            return policyDslParser.parseSingle(request.policyDsl());
        }
        throw new IllegalArgumentException("Either policyId or policyDsl is required");
    }

    private List<Policy> selectPolicies(List<String> policyIds) {
        if (policyIds == null || policyIds.isEmpty()) {
            return new ArrayList<>(policyStore.snapshot());
        }
        List<Policy> selected = new ArrayList<>();
        for (String id : policyIds) {
            selected.add(policyStore.get(id).orElseThrow(() -> new PolicyNotFoundException(id)));
        }
        return selected;
    }

    /**
     * Payloads are normally base64. Anything that does not decode to clean
     * UTF-8 text is treated as the IaC text itself.
     */
    static String decodePayload(String payload) {
        if (payload == null) {
            return "";
        }
        String compact = payload.replaceAll("\\s+", "");
        if (compact.isEmpty()) {
            return payload;
        }
        try {
            byte[] bytes = Base64.getDecoder().decode(compact);
            String text = strictUtf8(bytes);
            if (looksLikeText(text)) {
                return text;
            }
        } catch (IllegalArgumentException | CharacterCodingException e) {
            log.debug("Payload is not base64, using it as plain text: {}", e.getMessage());
        }
        return payload;
    }

    private static String strictUtf8(byte[] bytes) throws CharacterCodingException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        return decoder.decode(ByteBuffer.wrap(bytes)).toString();
    }

    private static boolean looksLikeText(String text) {
        return text.chars().noneMatch(c -> Character.isISOControl(c) && c != '\n' && c != '\r' && c != '\t');
    }

    private static ResourceBreakdownItem toBreakdownItem(CostBreakdownEntry entry) {
        return new ResourceBreakdownItem(
                entry.resourceId(),
                entry.type(),
                entry.size(),
                entry.region(),
                entry.count(),
                entry.hourlyPrice(),
                roundCents(entry.monthlyCost()),
                entry.confidence().getValue(),
                entry.priceSource().getValue(),
                entry.notes()
        );
    }

    private static double roundCents(double amount) {
        return Math.round(amount * 100.0) / 100.0;
    }
}
