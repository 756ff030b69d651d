package com.platform.failover.config;

import com.platform.failover.model.FailoverThresholds;
import com.platform.failover.model.ProbeType;
import com.platform.failover.model.RegionRole;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fleet configuration bound from {@code failover.*}.
 * Raw and mutable; {@link FleetConfigurationLoader} validates and freezes it into a {@link Fleet}.
 */
@Data
@ConfigurationProperties(prefix = "failover")
public class FleetProperties {
    
    /**
     * Thresholds applied to every service unless overridden per service.
     */
    private ThresholdProperties defaults = ThresholdProperties.standard();
    
    private List<ServiceProperties> services = new ArrayList<>();
    
    private OverrideProperties overrides = new OverrideProperties();
    
    private InfrastructureProperties infrastructure = new InfrastructureProperties();
    
    private DecisionProperties decision = new DecisionProperties();
    
    private PersistenceProperties persistence = new PersistenceProperties();
    
    @Data
    public static class ServiceProperties {
        private String id;
        
        /**
         * Target success ratio, e.g. 0.999.
         */
        private Double sloTarget;
        
        /**
         * Successful samples slower than this still count against the error budget.
         */
        private Duration latencyCeiling;
        
        private Duration rto;
        
        /**
         * Maximum tolerated replication lag of a failover target.
         */
        private Duration rpo;
        
        /**
         * Candidate regions in failover priority order.
         */
        private List<RegionProperties> regions = new ArrayList<>();
        
        /**
         * Per-service threshold overrides; unset fields inherit the defaults.
         */
        private ThresholdProperties thresholds = new ThresholdProperties();
    }
    
    @Data
    public static class RegionProperties {
        private String id;
        private RegionRole role = RegionRole.STANDBY;
        private HealthProperties health = new HealthProperties();
    }
    
    @Data
    public static class HealthProperties {
        private ProbeType type = ProbeType.HTTP;
        private String url;
        private String host;
        private Integer port;
        private int expectedStatus = 200;
        private String expectedContent;
    }
    
    @Data
    public static class ThresholdProperties {
        private Duration probeInterval;
        private Duration probeTimeout;
        private Integer failuresToDegrade;
        private Duration failureInterval;
        private Integer successesToRecover;
        private Double suspectBurnRate;
        private Double hardBurnRate;
        private Duration shortWindow;
        private Duration longWindow;
        private Integer maxStepAttempts;
        private Duration initialBackoff;
        private Double backoffMultiplier;
        private Duration maxBackoff;
        private Duration stepTimeout;
        private Integer verificationProbes;
        private Duration verificationInterval;
        
        public static ThresholdProperties standard() {
            FailoverThresholds d = FailoverThresholds.defaults();
            ThresholdProperties p = new ThresholdProperties();
            p.setProbeInterval(d.probeInterval());
            p.setProbeTimeout(d.probeTimeout());
            p.setFailuresToDegrade(d.failuresToDegrade());
            p.setFailureInterval(d.failureInterval());
            p.setSuccessesToRecover(d.successesToRecover());
            p.setSuspectBurnRate(d.suspectBurnRate());
            p.setHardBurnRate(d.hardBurnRate());
            p.setShortWindow(d.shortWindow());
            p.setLongWindow(d.longWindow());
            p.setMaxStepAttempts(d.maxStepAttempts());
            p.setInitialBackoff(d.initialBackoff());
            p.setBackoffMultiplier(d.backoffMultiplier());
            p.setMaxBackoff(d.maxBackoff());
            p.setStepTimeout(d.stepTimeout());
            p.setVerificationProbes(d.verificationProbes());
            p.setVerificationInterval(d.verificationInterval());
            return p;
        }
    }
    
    @Data
    public static class OverrideProperties {
        /**
         * Operator name to shared token. Override signals from anyone else are rejected.
         */
        private Map<String, String> operatorTokens = new HashMap<>();
    }
    
    @Data
    public static class InfrastructureProperties {
        /**
         * Base URL of the infrastructure API exposing promotion, routing, write control
         * and replication lag endpoints.
         */
        private String baseUrl = "http://localhost:8081";
        private Duration timeout = Duration.ofSeconds(10);
    }
    
    @Data
    public static class DecisionProperties {
        private Duration tickInterval = Duration.ofSeconds(5);
        private int queueCapacity = 1024;
        /**
         * How long a control signal (override, execution result) waits for queue space.
         */
        private Duration signalOfferTimeout = Duration.ofSeconds(2);
        private int workerThreads = 4;
        private int probeThreads = 8;
    }
    
    @Data
    public static class PersistenceProperties {
        /**
         * {@code jpa} or {@code memory}.
         */
        private String mode = "jpa";
    }
}
