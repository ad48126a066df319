package com.xksgroup.conversionengine.client;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Exponential backoff between reconnect attempts, capped per attempt and in number.
 */
@Value
@Builder
public class ReconnectPolicy {

    @Builder.Default
    Duration initialDelay = Duration.ofSeconds(1);
    @Builder.Default
    double multiplier = 2.0;
    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(30);
    @Builder.Default
    int maxAttempts = 5;

    public static ReconnectPolicy defaults() {
        return ReconnectPolicy.builder().build();
    }

    /**
     * Delay before the given attempt, counting from 1.
     */
    public Duration delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt starts at 1");
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        return Duration.ofMillis((long) Math.min(millis, maxDelay.toMillis()));
    }

    public boolean allowsAttempt(int attempt) {
        return attempt <= maxAttempts;
    }
}
