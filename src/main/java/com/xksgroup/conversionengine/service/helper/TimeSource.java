package com.xksgroup.conversionengine.service.helper;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Timestamps for task and event records. Values never go backwards, even if the
 * wall clock is adjusted while the service is running.
 */
@Component
public class TimeSource {

    private final Clock clock;
    private final AtomicReference<LocalDateTime> last = new AtomicReference<>(LocalDateTime.MIN);

    @Autowired
    public TimeSource() {
        this(Clock.systemDefaultZone());
    }

    public TimeSource(Clock clock) {
        this.clock = clock;
    }

    public LocalDateTime now() {
        LocalDateTime candidate = LocalDateTime.now(clock);
        return last.updateAndGet(previous -> candidate.isAfter(previous) ? candidate : previous);
    }
}
