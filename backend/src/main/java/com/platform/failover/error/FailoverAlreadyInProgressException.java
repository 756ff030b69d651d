package com.platform.failover.error;

/**
 * Refusal to open a second live FailoverEvent for a service.
 */
public class FailoverAlreadyInProgressException extends FailoverControllerException {
    
    private final String serviceId;
    private final String liveEventId;
    
    public FailoverAlreadyInProgressException(String serviceId, String liveEventId) {
        super(ErrorCode.FAILOVER_ALREADY_LIVE,
            String.format("Service %s already has live failover %s", serviceId, liveEventId));
        this.serviceId = serviceId;
        this.liveEventId = liveEventId;
    }
    
    public String getServiceId() {
        return serviceId;
    }
    
    public String getLiveEventId() {
        return liveEventId;
    }
}
