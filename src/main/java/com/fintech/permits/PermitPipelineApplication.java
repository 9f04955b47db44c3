package com.fintech.permits;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Permit Payment Pipeline
 * <p>
 * Takes vehicle permit applications from "payment order created" to "permit ready".
 * <p>
 * Key Features:
 * - Idempotent webhook ingestion driving the payment state machine
 * - Scheduled recovery of payments stuck between gateway and local state
 * - Durable, prioritized permit generation queue with a bounded worker pool
 * - Queue metrics time series and exactly-once expiration reminders
 */
@SpringBootApplication
@EnableScheduling
@EnableRetry
@ConfigurationPropertiesScan
public class PermitPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(PermitPipelineApplication.class, args);
    }
}
