package com.finopsguard.config;

import com.finopsguard.simulation.SimulationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class AsyncConfig {

    @Bean(name = "pricingExecutor")
    public Executor pricingExecutor(SimulationProperties properties) {
        int concurrency = Math.max(1, properties.getPricingConcurrency());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency); // bounded: at most N lookups in flight
        executor.setMaxPoolSize(concurrency);
        executor.setThreadNamePrefix("pricing-");
        executor.initialize();
        return executor;
    }
}
