package com.finopsguard.analysis.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Cost impact check for one IaC change.
 *
 * @param iacType {@code terraform} or {@code ansible} (aliases tf, hcl, yaml, yml)
 * @param iacPayload base64-encoded IaC text; plain text is accepted as well
 * @param environment deployment environment, e.g. dev, staging, prod
 * @param policyIds policies to evaluate; all enabled policies when empty
 */
public record CheckRequest(
        @NotBlank String iacType,
        @NotBlank String iacPayload,
        @NotBlank String environment,
        @Valid BudgetRules budgetRules,
        List<String> policyIds
) {}
