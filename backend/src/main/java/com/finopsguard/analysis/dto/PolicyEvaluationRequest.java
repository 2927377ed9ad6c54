package com.finopsguard.analysis.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Evaluate a single policy against an IaC change.
 *
 * Either {@code policyId} names a registered policy or {@code policyDsl}
 * carries an ad-hoc definition. {@code mode} ({@code advisory} or
 * {@code blocking}) overrides the policy's own violation mode.
 */
public record PolicyEvaluationRequest(
        @NotBlank String iacType,
        @NotBlank String iacPayload,
        @NotBlank String environment,
        String policyId,
        String policyDsl,
        String mode
) {}
