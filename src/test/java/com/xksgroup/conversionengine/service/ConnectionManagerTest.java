package com.xksgroup.conversionengine.service;

import com.xksgroup.conversionengine.exception.NotFoundException;
import com.xksgroup.conversionengine.model.event.EventEnvelope;
import com.xksgroup.conversionengine.service.helper.BackgroundSupervisor;
import com.xksgroup.conversionengine.service.helper.IdGenerator;
import com.xksgroup.conversionengine.service.helper.TimeSource;
import com.xksgroup.conversionengine.support.MutableClock;
import com.xksgroup.conversionengine.support.RecordingSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class ConnectionManagerTest {

    @Mock
    private BackgroundSupervisor supervisor;

    private MutableClock clock;
    private BroadcastHub hub;
    private ConnectionManager manager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-01T12:00:00Z"));
        TimeSource timeSource = new TimeSource(clock);
        hub = new BroadcastHub(Runnable::run, timeSource, 16);
        manager = new ConnectionManager(hub, new IdGenerator(), timeSource, supervisor, 0, 90_000);
    }

    @Test
    void openGreetsClientWithItsConnectionId() {
        RecordingSink sink = new RecordingSink();

        String connectionId = manager.open("alice", sink);

        assertThat(connectionId).startsWith("conn-");
        assertThat(sink.types()).containsExactly(EventEnvelope.CONNECTED);
        assertThat(sink.received.get(0).payload()).isEqualTo(Map.of("connectionId", connectionId));
        assertThat(hub.members("user:alice")).containsExactly(connectionId);
    }

    @Test
    void heartbeatPingsLiveConnections() {
        RecordingSink sink = new RecordingSink();
        manager.open(null, sink);

        manager.heartbeat();

        assertThat(sink.types()).containsExactly(EventEnvelope.CONNECTED, EventEnvelope.PING);
    }

    @Test
    void connectionsThatStopAnsweringAreRemoved() {
        RecordingSink silent = new RecordingSink();
        RecordingSink chatty = new RecordingSink();
        String silentId = manager.open(null, silent);
        String chattyId = manager.open(null, chatty);

        clock.advance(Duration.ofSeconds(60));
        manager.recordPong(chattyId);
        clock.advance(Duration.ofSeconds(40));
        manager.heartbeat();

        assertThat(hub.connection(silentId)).isEmpty();
        assertThat(silent.closed).isTrue();
        assertThat(hub.connection(chattyId)).isPresent();
        assertThat(chatty.types()).endsWith(EventEnvelope.PING);
    }

    @Test
    void joinLeaveAndCloseGoThroughTheHub() {
        String connectionId = manager.open(null, new RecordingSink());

        manager.join(connectionId, "task:t1");
        assertThat(hub.members("task:t1")).containsExactly(connectionId);
        manager.leave(connectionId, "task:t1");
        assertThat(hub.members("task:t1")).isEmpty();

        manager.close(connectionId);
        assertThatThrownBy(() -> manager.close(connectionId)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> manager.recordPong(connectionId)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void heartbeatIsScheduledOnlyWithPositiveInterval() {
        manager.init();
        verifyNoInteractions(supervisor);

        ConnectionManager scheduled = new ConnectionManager(hub, new IdGenerator(), new TimeSource(clock), supervisor,
                30_000, 90_000);
        scheduled.init();
        verify(supervisor).scheduleWithFixedDelay(eq("connection-heartbeat"), any(Runnable.class), eq(30_000L), eq(30_000L));
    }
}
