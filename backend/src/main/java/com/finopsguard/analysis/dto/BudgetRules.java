package com.finopsguard.analysis.dto;

import jakarta.validation.constraints.PositiveOrZero;

public record BudgetRules(
        @PositiveOrZero Double monthlyBudget
) {}
