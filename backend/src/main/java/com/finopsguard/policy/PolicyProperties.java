package com.finopsguard.policy;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Policy settings bound from {@code finopsguard.policy.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "finopsguard.policy")
public class PolicyProperties {

    /** Register the built-in policies at startup. */
    private boolean seedDefaults = true;

    /** Budget of the built-in {@code default_monthly_budget} policy. */
    private double defaultMonthlyBudget = 1000.0;
}
