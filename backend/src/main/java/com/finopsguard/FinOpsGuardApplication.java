package com.finopsguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * FinOpsGuard cost and policy gate.
 *
 * Estimates the monthly cost of Terraform and Ansible changes before they are
 * applied, and evaluates budget and resource policies against the estimate.
 */
@SpringBootApplication
@EnableCaching
@EnableScheduling
public class FinOpsGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(FinOpsGuardApplication.class, args);
    }
}
