package com.platform.failover.error;

/**
 * Root of the controller's unchecked exceptions. The {@link ErrorCode} decides
 * the HTTP status and whether an operator has to step in.
 */
public abstract class FailoverControllerException extends RuntimeException {

    private final ErrorCode errorCode;

    protected FailoverControllerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected FailoverControllerException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Fatal codes leave a service in a state automation will not touch again.
     */
    public boolean requiresOperator() {
        return errorCode.isFatal();
    }
}
