package com.xksgroup.conversionengine.service.helper;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class BackgroundSupervisorTest {

    private final BackgroundSupervisor supervisor = new BackgroundSupervisor();

    @AfterEach
    void tearDown() {
        supervisor.shutdown();
    }

    @Test
    void failingJobKeepsItsScheduleAndIsReported() {
        AtomicInteger runs = new AtomicInteger();
        supervisor.scheduleWithFixedDelay("flaky", () -> {
            runs.incrementAndGet();
            throw new IllegalStateException("disk walk failed");
        }, 0, 10);

        await().atMost(Duration.ofSeconds(5)).until(() -> runs.get() >= 3);

        assertThat(supervisor.lastFailures()).containsKey("flaky");
        assertThat(supervisor.lastFailures().get("flaky")).hasMessage("disk walk failed");
    }

    @Test
    void successfulRunClearsPreviousFailure() {
        AtomicInteger runs = new AtomicInteger();
        supervisor.scheduleWithFixedDelay("recovering", () -> {
            if (runs.incrementAndGet() == 1) {
                throw new IllegalStateException("first run fails");
            }
        }, 0, 10);

        await().atMost(Duration.ofSeconds(5)).until(() -> runs.get() >= 3);

        assertThat(supervisor.lastFailures()).doesNotContainKey("recovering");
    }

    @Test
    void submittedJobRunsOnce() {
        AtomicInteger runs = new AtomicInteger();

        supervisor.submit("once", runs::incrementAndGet);

        await().atMost(Duration.ofSeconds(5)).until(() -> runs.get() == 1);
    }

    @Test
    void shutdownReturnsFailedJobs() {
        AtomicInteger runs = new AtomicInteger();
        supervisor.submit("broken", () -> {
            runs.incrementAndGet();
            throw new IllegalArgumentException("bad");
        });
        await().atMost(Duration.ofSeconds(5)).until(() -> supervisor.lastFailures().containsKey("broken"));

        assertThat(supervisor.shutdown()).containsOnlyKeys("broken");
    }
}
