package com.xksgroup.conversionengine.exception;

public class ConflictException extends ConversionEngineException {

    public ConflictException(String message) {
        super(ErrorCode.CONFLICT, message);
    }
}
