package com.finopsguard.api;

import com.finopsguard.policy.Policy;
import com.finopsguard.policy.PolicyNotFoundException;
import com.finopsguard.policy.PolicyStore;
import com.finopsguard.policy.ViolationMode;
import com.finopsguard.policy.dsl.PolicyDslParser;
import com.finopsguard.policy.dsl.RuleExpressionParser;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for managing the policy registry.
 *
 * A policy is submitted either as a DSL definition ({@code dsl}) or as plain
 * fields with an optional {@code rule} expression string.
 */
@RestController
@RequestMapping("/api/v1/policies")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Policies", description = "Policy registry management")
public class PolicyController {

    private final PolicyStore policyStore;
    private final PolicyDslParser policyDslParser;

    @GetMapping
    @Operation(summary = "List registered policies")
    public ResponseEntity<List<PolicyView>> listPolicies() {
        return ResponseEntity.ok(policyStore.list().stream().map(PolicyView::from).toList());
    }

    @GetMapping("/{policyId}")
    @Operation(summary = "Get a policy by id")
    public ResponseEntity<PolicyView> getPolicy(@PathVariable String policyId) {
        return policyStore.get(policyId)
                .map(PolicyView::from)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new PolicyNotFoundException(policyId));
    }

    @PostMapping
    @Operation(summary = "Register a policy")
    public ResponseEntity<PolicyView> createPolicy(@Valid @RequestBody PolicyRequest request) {
        Policy policy = toPolicy(request);
        policy.validate();
        Policy created = policyStore.add(policy);
        return ResponseEntity.status(HttpStatus.CREATED).body(PolicyView.from(created));
    }

    @PutMapping("/{policyId}")
    @Operation(summary = "Replace a policy")
    public ResponseEntity<PolicyView> updatePolicy(
            @PathVariable String policyId,
            @Valid @RequestBody PolicyRequest request
    ) {
        Policy policy = toPolicy(request);
        policy.validate();
        return ResponseEntity.ok(PolicyView.from(policyStore.update(policyId, policy)));
    }

    @DeleteMapping("/{policyId}")
    @Operation(summary = "Delete a policy")
    public ResponseEntity<Void> deletePolicy(@PathVariable String policyId) {
        policyStore.remove(policyId);
        return ResponseEntity.noContent().build();
    }

    private Policy toPolicy(PolicyRequest request) {
        if (request.dsl() != null && !request.dsl().isBlank()) {
            Policy parsed = policyDslParser.parseSingle(request.dsl());
            return request.id() == null || request.id().isBlank()
                    ? parsed
                    : parsed.toBuilder().id(request.id()).build();
        }
        return Policy.builder()
                .id(request.id())
                .name(request.name() != null ? request.name() : request.id())
                .description(request.description())
                .budget(request.budget())
                .expression(request.rule() == null || request.rule().isBlank()
                        ? null
                        : RuleExpressionParser.parse(request.rule()))
                .onViolation(request.onViolation() == null
                        ? ViolationMode.ADVISORY
                        : ViolationMode.fromValue(request.onViolation()))
                .enabled(request.enabled() == null || request.enabled())
                .build();
    }

    public record PolicyRequest(
            String id,
            String name,
            String description,
            @PositiveOrZero Double budget,
            String rule,
            String onViolation,
            Boolean enabled,
            String dsl
    ) {}

    public record PolicyView(
            String id,
            String name,
            String description,
            Double budget,
            String rule,
            String onViolation,
            boolean enabled
    ) {
        static PolicyView from(Policy policy) {
            return new PolicyView(
                    policy.getId(),
                    policy.getName(),
                    policy.getDescription(),
                    policy.getBudget(),
                    policy.getExpression() != null ? policy.getExpression().toDsl() : null,
                    policy.getOnViolation().getValue(),
                    policy.isEnabled()
            );
        }
    }
}
