package com.platform.failover.error;

/**
 * Exception for calls to the promotion, routing, write-control or replication APIs.
 */
public class InfrastructureApiException extends FailoverControllerException {
    
    private final String operation;
    private final int statusCode;
    
    public InfrastructureApiException(String operation, int statusCode, String message) {
        super(ErrorCode.INFRASTRUCTURE_API_ERROR,
            String.format("%s failed (status %d): %s", operation, statusCode, message));
        this.operation = operation;
        this.statusCode = statusCode;
    }
    
    public InfrastructureApiException(String operation, String message, Throwable cause) {
        super(ErrorCode.INFRASTRUCTURE_API_ERROR, String.format("%s failed: %s", operation, message), cause);
        this.operation = operation;
        this.statusCode = -1;
    }
    
    public String getOperation() {
        return operation;
    }
    
    public int getStatusCode() {
        return statusCode;
    }
}
