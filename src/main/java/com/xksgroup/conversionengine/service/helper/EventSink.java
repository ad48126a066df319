package com.xksgroup.conversionengine.service.helper;

import com.xksgroup.conversionengine.model.event.EventEnvelope;

import java.io.IOException;

/**
 * One physical transport endpoint the hub can write to.
 */
public interface EventSink {

    void send(EventEnvelope envelope) throws IOException;

    void close();
}
