package com.xksgroup.conversionengine.exception;

public class NotFoundException extends ConversionEngineException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
