package com.platform.failover.error;

/**
 * Exception for resource not found errors.
 */
public class ResourceNotFoundException extends FailoverControllerException {
    
    private final String resourceType;
    private final String resourceId;
    
    public ResourceNotFoundException(ErrorCode errorCode, String resourceType, String resourceId) {
        super(errorCode, String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
    
    public static ResourceNotFoundException service(String serviceId) {
        return new ResourceNotFoundException(ErrorCode.SERVICE_NOT_FOUND, "Service", serviceId);
    }
    
    public static ResourceNotFoundException region(String serviceId, String regionId) {
        return new ResourceNotFoundException(ErrorCode.REGION_NOT_FOUND, "Region", serviceId + "/" + regionId);
    }
    
    public static ResourceNotFoundException failoverEvent(String eventId) {
        return new ResourceNotFoundException(ErrorCode.FAILOVER_EVENT_NOT_FOUND, "Failover event", eventId);
    }
    
    public String getResourceType() {
        return resourceType;
    }
    
    public String getResourceId() {
        return resourceId;
    }
}
