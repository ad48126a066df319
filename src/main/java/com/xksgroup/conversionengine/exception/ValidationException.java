package com.xksgroup.conversionengine.exception;

public class ValidationException extends ConversionEngineException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }
}
