package com.xksgroup.conversionengine.exception;

import java.util.Map;

public class OutOfRangeException extends ValidationException {

    private final String field;
    private final long value;
    private final long min;
    private final long max;

    public OutOfRangeException(String field, long value, long min, long max) {
        super(String.format("%s must be between %d and %d, got %d", field, min, max, value));
        this.field = field;
        this.value = value;
        this.min = min;
        this.max = max;
    }

    public long getValue() {
        return value;
    }

    @Override
    public Object getDetails() {
        return Map.of("field", field, "value", value, "min", min, "max", max);
    }
}
