package com.platform.failover.api;

import com.platform.failover.coordinator.CoordinatorSnapshot;
import com.platform.failover.coordinator.OverrideType;
import com.platform.failover.model.ErrorBudget;
import com.platform.failover.model.Region;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request and response bodies of the operator API.
 */
public final class ApiModels {
    
    private ApiModels() {
    }
    
    public record ServiceStatus(
        String serviceId,
        String primary,
        CoordinatorSnapshot coordinator,
        List<Region> regions
    ) {}
    
    public record WindowStatus(
        String window,
        double compliance,
        double burnRate,
        ErrorBudget errorBudget
    ) {}
    
    public record SloStatus(
        String serviceId,
        String regionId,
        double target,
        List<WindowStatus> windows
    ) {}
    
    @Data
    @NoArgsConstructor
    public static class OverrideRequest {
        @NotNull
        private OverrideType type;
        
        private String targetRegion;
        
        @NotBlank
        private String operator;
        
        @NotBlank
        private String reason;
    }
    
    public record OverrideAccepted(
        String serviceId,
        OverrideType type,
        String operator,
        String message
    ) {}
}
