package com.platform.failover.error;

/**
 * Standardized error codes for the failover controller.
 * 
 * Format: CP-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors
 * - 2xx: Authorization errors
 * - 3xx: Resource errors (not found, conflict)
 * - 4xx: External system errors (probes, infrastructure APIs)
 * - 5xx: Failover domain errors
 * - 9xx: Internal errors
 */
public enum ErrorCode {
    
    // ==================== Validation Errors (1xx) ====================
    
    VALIDATION_ERROR("CP-100", "Validation error", ErrorCategory.RECOVERABLE),
    INVALID_REQUEST("CP-101", "Invalid request format", ErrorCategory.RECOVERABLE),
    INVALID_FIELD_VALUE("CP-103", "Invalid field value", ErrorCategory.RECOVERABLE),
    
    // ==================== Auth Errors (2xx) ====================
    
    UNAUTHORIZED_OVERRIDE("CP-201", "Override signal not authorized", ErrorCategory.RECOVERABLE),
    
    // ==================== Resource Errors (3xx) ====================
    
    RESOURCE_NOT_FOUND("CP-300", "Resource not found", ErrorCategory.RECOVERABLE),
    SERVICE_NOT_FOUND("CP-301", "Service not found", ErrorCategory.RECOVERABLE),
    REGION_NOT_FOUND("CP-302", "Region not found", ErrorCategory.RECOVERABLE),
    FAILOVER_EVENT_NOT_FOUND("CP-303", "Failover event not found", ErrorCategory.RECOVERABLE),
    FAILOVER_ALREADY_LIVE("CP-310", "A failover is already live for this service", ErrorCategory.RECOVERABLE),
    OPTIMISTIC_LOCK_FAILURE("CP-312", "Concurrent modification", ErrorCategory.RECOVERABLE),
    
    // ==================== External System Errors (4xx) ====================
    
    PROBE_TIMEOUT("CP-400", "Health probe timed out", ErrorCategory.RECOVERABLE),
    PROBE_FAILURE("CP-401", "Health probe failed", ErrorCategory.RECOVERABLE),
    INFRASTRUCTURE_API_ERROR("CP-410", "Infrastructure API error", ErrorCategory.RECOVERABLE),
    NOTIFICATION_FAILED("CP-420", "Event notification failed", ErrorCategory.RECOVERABLE),
    
    // ==================== Failover Errors (5xx - Domain) ====================
    
    EXECUTOR_STEP_FAILED("CP-500", "Failover step failed", ErrorCategory.RECOVERABLE),
    ROLLBACK_FAILED("CP-501", "Failover rollback failed", ErrorCategory.FATAL),
    OVERRIDE_REJECTED("CP-510", "Override not applicable in current state", ErrorCategory.RECOVERABLE),
    STATE_TRANSITION_INVALID("CP-520", "Invalid state transition", ErrorCategory.RECOVERABLE),
    
    // ==================== Internal Errors (9xx) ====================
    
    INTERNAL_ERROR("CP-900", "Internal server error", ErrorCategory.FATAL),
    CONFIGURATION_ERROR("CP-902", "Configuration error", ErrorCategory.FATAL),
    SERIALIZATION_ERROR("CP-903", "Serialization error", ErrorCategory.RECOVERABLE);
    
    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;
    
    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    public ErrorCategory getCategory() {
        return category;
    }
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
    
    public boolean isRecoverable() {
        return category == ErrorCategory.RECOVERABLE;
    }
    
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - caller can retry or fix the request.
         */
        RECOVERABLE,
        
        /**
         * Fatal errors - requires human intervention.
         */
        FATAL
    }
}
