package com.finopsguard.simulation;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Cost simulation settings bound from {@code finopsguard.simulation.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "finopsguard.simulation")
public class SimulationProperties {

    /** Upper bound on concurrent price lookups. */
    private int pricingConcurrency = 8;

    /** Overall budget for pricing one model. */
    private Duration timeout = Duration.ofSeconds(30);
}
