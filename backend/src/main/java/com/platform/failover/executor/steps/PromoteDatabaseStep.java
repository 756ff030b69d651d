package com.platform.failover.executor.steps;

import com.platform.failover.connectors.DatabasePromotionApi;
import com.platform.failover.connectors.PromotionResult;
import com.platform.failover.error.ConflictException;
import com.platform.failover.executor.FailoverStep;
import com.platform.failover.executor.StepResult;
import com.platform.failover.model.FailoverEvent;
import com.platform.failover.model.Region;
import com.platform.failover.model.RegionState;
import com.platform.failover.state.RegionStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Promotes the target region's database. The target is held in {@code PROMOTING} while the
 * call is outstanding and ends {@code PROMOTED} or {@code FAILED}.
 */
@Slf4j
@Order(2)
@Component
public class PromoteDatabaseStep implements FailoverStep {
    
    public static final String NAME = "promote-database";
    
    private final DatabasePromotionApi promotionApi;
    private final RegionStateStore stateStore;
    
    public PromoteDatabaseStep(DatabasePromotionApi promotionApi, RegionStateStore stateStore) {
        this.promotionApi = promotionApi;
        this.stateStore = stateStore;
    }
    
    @Override
    public String name() {
        return NAME;
    }
    
    @Override
    public StepResult execute(FailoverEvent event) {
        String serviceId = event.getServiceId();
        String target = event.getToRegion();
        
        if (stateStore.get(serviceId, target).state() == RegionState.PROMOTED) {
            return StepResult.succeeded(target + " already promoted");
        }
        markPromoting(serviceId, target);
        
        PromotionResult result;
        try {
            result = promotionApi.promote(serviceId, target);
        } catch (RuntimeException e) {
            settle(serviceId, target, RegionState.FAILED);
            throw e;
        }
        
        if (!result.isSuccess()) {
            settle(serviceId, target, RegionState.FAILED);
            return StepResult.failed("promotion of " + target + " reported " + result);
        }
        settle(serviceId, target, RegionState.PROMOTED);
        return StepResult.succeeded("promotion of " + target + ": " + result);
    }
    
    @Override
    public StepResult compensate(FailoverEvent event) {
        String serviceId = event.getServiceId();
        String target = event.getToRegion();
        
        promotionApi.demote(serviceId, target);
        
        Region current = stateStore.get(serviceId, target);
        if (current.state() == RegionState.PROMOTED) {
            stateStore.compareAndSetState(serviceId, target, RegionState.PROMOTED, RegionState.HEALTHY);
        } else if (current.state() == RegionState.PROMOTING) {
            stateStore.compareAndSetState(serviceId, target, RegionState.PROMOTING, RegionState.FAILED);
        }
        return StepResult.succeeded(target + " demoted");
    }
    
    private void markPromoting(String serviceId, String target) {
        for (int attempt = 0; attempt < 2; attempt++) {
            Region current = stateStore.get(serviceId, target);
            if (current.state() == RegionState.PROMOTING) {
                return;
            }
            try {
                stateStore.compareAndSetState(serviceId, target, current.state(), RegionState.PROMOTING);
                return;
            } catch (ConflictException e) {
                log.debug("Conflict marking {}/{} promoting, re-reading", serviceId, target);
            }
        }
        throw new ConflictException(serviceId + "/" + target, "any", RegionState.PROMOTING);
    }
    
    private void settle(String serviceId, String target, RegionState outcome) {
        try {
            stateStore.compareAndSetState(serviceId, target, RegionState.PROMOTING, outcome);
        } catch (ConflictException e) {
            log.warn("Could not mark {}/{} {}: {}", serviceId, target, outcome, e.getMessage());
        }
    }
}
