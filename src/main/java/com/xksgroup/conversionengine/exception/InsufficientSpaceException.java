package com.xksgroup.conversionengine.exception;

import com.xksgroup.conversionengine.model.SpaceCheckResult;

public class InsufficientSpaceException extends ConversionEngineException {

    private final SpaceCheckResult checkResult;

    public InsufficientSpaceException(SpaceCheckResult checkResult) {
        super(ErrorCode.INSUFFICIENT_SPACE, checkResult.getMessage());
        this.checkResult = checkResult;
    }

    public SpaceCheckResult getCheckResult() {
        return checkResult;
    }

    @Override
    public Object getDetails() {
        return checkResult;
    }
}
