package com.xksgroup.conversionengine.exception;

/**
 * Base of every typed failure the engine reports to its callers.
 */
public abstract class ConversionEngineException extends RuntimeException {

    private final ErrorCode errorCode;

    protected ConversionEngineException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Extra structured data for the error body, or null.
     */
    public Object getDetails() {
        return null;
    }
}
