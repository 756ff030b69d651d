package com.platform.failover.config;

import com.platform.failover.config.FleetProperties.HealthProperties;
import com.platform.failover.config.FleetProperties.RegionProperties;
import com.platform.failover.config.FleetProperties.ServiceProperties;
import com.platform.failover.config.FleetProperties.ThresholdProperties;
import com.platform.failover.error.ConfigurationException;
import com.platform.failover.model.FailoverThresholds;
import com.platform.failover.model.HealthEndpoint;
import com.platform.failover.model.ProbeType;
import com.platform.failover.model.RegionDefinition;
import com.platform.failover.model.RegionRole;
import com.platform.failover.model.ServiceDefinition;
import com.platform.failover.model.SloTarget;
import com.platform.failover.observability.StructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Validates the bound fleet configuration and freezes it into a {@link Fleet}.
 * 
 * All problems are collected and reported together; any problem fails context
 * startup before probes are scheduled.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(FleetProperties.class)
public class FleetConfigurationLoader {
    
    @Bean
    public Fleet fleet(FleetProperties properties, StructuredLogger structuredLogger) {
        Fleet fleet = load(properties);
        structuredLogger.lifecycle().fleetLoaded(fleet.services().size(), fleet.regionCount());
        log.info("Loaded fleet with {} services and {} regions", fleet.services().size(), fleet.regionCount());
        return fleet;
    }
    
    public static Fleet load(FleetProperties properties) {
        List<String> problems = new ArrayList<>();
        List<ServiceDefinition> services = new ArrayList<>();
        Set<String> serviceIds = new HashSet<>();
        
        if (properties.getServices().isEmpty()) {
            problems.add("no services configured");
        }
        
        for (ServiceProperties service : properties.getServices()) {
            String sid = service.getId();
            if (isBlank(sid)) {
                problems.add("service without id");
                continue;
            }
            if (!serviceIds.add(sid)) {
                problems.add("duplicate service id '" + sid + "'");
                continue;
            }
            
            int before = problems.size();
            FailoverThresholds thresholds = resolveThresholds(sid, properties.getDefaults(), service.getThresholds(), problems);
            List<RegionDefinition> regions = resolveRegions(sid, service.getRegions(), problems);
            validateTargets(sid, service, problems);
            
            if (problems.size() == before) {
                services.add(new ServiceDefinition(
                    sid,
                    regions,
                    new SloTarget(service.getSloTarget(), service.getLatencyCeiling()),
                    service.getRto(),
                    service.getRpo(),
                    thresholds
                ));
            }
        }
        
        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
        return new Fleet(services);
    }
    
    private static void validateTargets(String sid, ServiceProperties service, List<String> problems) {
        Double target = service.getSloTarget();
        if (target == null || target <= 0.0 || target >= 1.0) {
            problems.add(sid + ": slo-target must be strictly between 0 and 1, was " + target);
        }
        requirePositive(sid, "rto", service.getRto(), problems);
        requirePositive(sid, "rpo", service.getRpo(), problems);
        if (service.getLatencyCeiling() != null && !isPositive(service.getLatencyCeiling())) {
            problems.add(sid + ": latency-ceiling must be positive");
        }
    }
    
    private static List<RegionDefinition> resolveRegions(String sid, List<RegionProperties> regions,
                                                         List<String> problems) {
        List<RegionDefinition> resolved = new ArrayList<>();
        if (regions.isEmpty()) {
            problems.add(sid + ": no candidate regions");
            return resolved;
        }
        
        Set<String> regionIds = new HashSet<>();
        int primaries = 0;
        for (RegionProperties region : regions) {
            if (isBlank(region.getId())) {
                problems.add(sid + ": region without id");
                continue;
            }
            if (!regionIds.add(region.getId())) {
                problems.add(sid + ": duplicate region id '" + region.getId() + "'");
                continue;
            }
            if (region.getRole() == null) {
                problems.add(sid + "/" + region.getId() + ": role is required");
                continue;
            }
            if (region.getRole() == RegionRole.PRIMARY) {
                primaries++;
            }
            HealthEndpoint endpoint = resolveEndpoint(sid, region, problems);
            if (endpoint != null) {
                resolved.add(new RegionDefinition(region.getId(), region.getRole(), endpoint));
            }
        }
        
        if (primaries != 1) {
            problems.add(sid + ": exactly one primary region required, found " + primaries);
        }
        if (regions.size() < 2) {
            problems.add(sid + ": at least one failover candidate besides the primary is required");
        }
        return resolved;
    }
    
    private static HealthEndpoint resolveEndpoint(String sid, RegionProperties region, List<String> problems) {
        HealthProperties health = region.getHealth();
        String where = sid + "/" + region.getId();
        if (health == null || health.getType() == null) {
            problems.add(where + ": health endpoint is required");
            return null;
        }
        if (health.getType() == ProbeType.HTTP) {
            if (isBlank(health.getUrl())) {
                problems.add(where + ": http health endpoint requires a url");
                return null;
            }
            return new HealthEndpoint(ProbeType.HTTP, health.getUrl(), null, 0,
                health.getExpectedStatus(), health.getExpectedContent());
        }
        if (isBlank(health.getHost()) || health.getPort() == null || health.getPort() <= 0) {
            problems.add(where + ": tcp health endpoint requires host and port");
            return null;
        }
        return HealthEndpoint.tcp(health.getHost(), health.getPort());
    }
    
    static FailoverThresholds resolveThresholds(String sid, ThresholdProperties defaults,
                                                ThresholdProperties override, List<String> problems) {
        ThresholdProperties o = override != null ? override : new ThresholdProperties();
        int before = problems.size();
        
        Duration probeInterval = pick(o, defaults, ThresholdProperties::getProbeInterval);
        Duration probeTimeout = pick(o, defaults, ThresholdProperties::getProbeTimeout);
        Integer failuresToDegrade = pick(o, defaults, ThresholdProperties::getFailuresToDegrade);
        Duration failureInterval = pick(o, defaults, ThresholdProperties::getFailureInterval);
        Integer successesToRecover = pick(o, defaults, ThresholdProperties::getSuccessesToRecover);
        Double suspectBurnRate = pick(o, defaults, ThresholdProperties::getSuspectBurnRate);
        Double hardBurnRate = pick(o, defaults, ThresholdProperties::getHardBurnRate);
        Duration shortWindow = pick(o, defaults, ThresholdProperties::getShortWindow);
        Duration longWindow = pick(o, defaults, ThresholdProperties::getLongWindow);
        Integer maxStepAttempts = pick(o, defaults, ThresholdProperties::getMaxStepAttempts);
        Duration initialBackoff = pick(o, defaults, ThresholdProperties::getInitialBackoff);
        Double backoffMultiplier = pick(o, defaults, ThresholdProperties::getBackoffMultiplier);
        Duration maxBackoff = pick(o, defaults, ThresholdProperties::getMaxBackoff);
        Duration stepTimeout = pick(o, defaults, ThresholdProperties::getStepTimeout);
        Integer verificationProbes = pick(o, defaults, ThresholdProperties::getVerificationProbes);
        Duration verificationInterval = pick(o, defaults, ThresholdProperties::getVerificationInterval);
        
        requirePositive(sid, "probe-interval", probeInterval, problems);
        requirePositive(sid, "probe-timeout", probeTimeout, problems);
        requirePositive(sid, "failure-interval", failureInterval, problems);
        requirePositive(sid, "short-window", shortWindow, problems);
        requirePositive(sid, "long-window", longWindow, problems);
        requirePositive(sid, "initial-backoff", initialBackoff, problems);
        requirePositive(sid, "max-backoff", maxBackoff, problems);
        requirePositive(sid, "step-timeout", stepTimeout, problems);
        requirePositive(sid, "verification-interval", verificationInterval, problems);
        
        if (failuresToDegrade == null || failuresToDegrade < 1) {
            problems.add(sid + ": failures-to-degrade must be at least 1");
        } else if (successesToRecover == null || successesToRecover <= failuresToDegrade) {
            problems.add(sid + ": successes-to-recover (" + successesToRecover
                + ") must be greater than failures-to-degrade (" + failuresToDegrade + ")");
        }
        if (suspectBurnRate == null || hardBurnRate == null || hardBurnRate <= suspectBurnRate) {
            problems.add(sid + ": hard-burn-rate must be greater than suspect-burn-rate");
        }
        if (maxStepAttempts == null || maxStepAttempts < 1) {
            problems.add(sid + ": max-step-attempts must be at least 1");
        }
        if (backoffMultiplier == null || backoffMultiplier < 1.0) {
            problems.add(sid + ": backoff-multiplier must be at least 1.0");
        }
        if (verificationProbes == null || verificationProbes < 1) {
            problems.add(sid + ": verification-probes must be at least 1");
        }
        if (isPositive(probeTimeout) && isPositive(probeInterval) && probeTimeout.compareTo(probeInterval) > 0) {
            problems.add(sid + ": probe-timeout must not exceed probe-interval");
        }
        
        if (problems.size() != before) {
            return null;
        }
        return new FailoverThresholds(
            probeInterval, probeTimeout, failuresToDegrade, failureInterval, successesToRecover,
            suspectBurnRate, hardBurnRate, shortWindow, longWindow, maxStepAttempts,
            initialBackoff, backoffMultiplier, maxBackoff, stepTimeout, verificationProbes,
            verificationInterval
        );
    }
    
    private static <T> T pick(ThresholdProperties override, ThresholdProperties defaults,
                              Function<ThresholdProperties, T> getter) {
        T value = getter.apply(override);
        return value != null ? value : getter.apply(defaults);
    }
    
    private static void requirePositive(String sid, String name, Duration value, List<String> problems) {
        if (!isPositive(value)) {
            problems.add(sid + ": " + name + " must be a positive duration");
        }
    }
    
    private static boolean isPositive(Duration value) {
        return value != null && !value.isNegative() && !value.isZero();
    }
    
    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
