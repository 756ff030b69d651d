package com.platform.failover.error;

/**
 * Exception for validation errors.
 */
public class ValidationException extends FailoverControllerException {
    
    private final String field;
    
    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
        this.field = null;
    }
    
    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
        this.field = null;
    }
    
    public ValidationException(String field, String message) {
        super(ErrorCode.INVALID_FIELD_VALUE, 
            String.format("Invalid value for field '%s': %s", field, message));
        this.field = field;
    }
    
    public String getField() {
        return field;
    }
}
