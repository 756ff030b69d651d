package com.platform.failover.error;

public class UnauthorizedOverrideException extends FailoverControllerException {
    
    private final String operator;
    
    public UnauthorizedOverrideException(String operator) {
        super(ErrorCode.UNAUTHORIZED_OVERRIDE,
            String.format("Operator '%s' is not authorized to send override signals", operator));
        this.operator = operator;
    }
    
    public String getOperator() {
        return operator;
    }
}
