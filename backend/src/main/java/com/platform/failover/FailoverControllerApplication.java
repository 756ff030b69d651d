package com.platform.failover;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Region Failover Controller
 * 
 * Tracks SLO error budgets and region health for a fleet of multi-region services and
 * drives safe, resumable failover between regions:
 * - Health probes per (service, region)
 * - Burn-rate based failure detection with hysteresis
 * - Per-service failover coordination with manual override gate
 * - Step execution with retry, timeout and compensation
 */
@SpringBootApplication
@EnableScheduling
public class FailoverControllerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FailoverControllerApplication.class, args);
    }
}
