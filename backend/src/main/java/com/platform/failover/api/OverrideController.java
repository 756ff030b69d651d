package com.platform.failover.api;

import com.platform.failover.api.ApiModels.OverrideAccepted;
import com.platform.failover.api.ApiModels.OverrideRequest;
import com.platform.failover.config.Fleet;
import com.platform.failover.config.OverrideAuthorizer;
import com.platform.failover.coordinator.DecisionLoopManager;
import com.platform.failover.coordinator.OverrideSignal;
import com.platform.failover.error.ErrorCode;
import com.platform.failover.error.ValidationException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Manual override gate. Accepted signals are queued to the service's coordinator, which
 * applies or rejects them according to its current state.
 */
@Slf4j
@RestController
@RequestMapping("/api/services/{serviceId}/overrides")
@RequiredArgsConstructor
public class OverrideController {
    
    static final String TOKEN_HEADER = "X-Operator-Token";
    
    private final Fleet fleet;
    private final OverrideAuthorizer authorizer;
    private final DecisionLoopManager loopManager;
    
    @PostMapping
    public ResponseEntity<OverrideAccepted> submit(@PathVariable String serviceId,
                                                   @RequestHeader(TOKEN_HEADER) String token,
                                                   @Valid @RequestBody OverrideRequest request) {
        fleet.service(serviceId);
        authorizer.authorize(request.getOperator(), token);
        
        OverrideSignal signal = new OverrideSignal(request.getType(), serviceId, request.getTargetRegion(),
            request.getOperator(), request.getReason(), token);
        log.info("Override {} for {} submitted by {}", request.getType(), serviceId, request.getOperator());
        
        if (!loopManager.submitOverride(signal)) {
            throw new ValidationException(ErrorCode.OVERRIDE_REJECTED,
                "Decision queue of " + serviceId + " is full, override not queued");
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new OverrideAccepted(
            serviceId, request.getType(), request.getOperator(),
            "Override queued; the coordinator applies it in order"));
    }
}
