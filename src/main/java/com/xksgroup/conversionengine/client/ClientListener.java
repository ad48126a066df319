package com.xksgroup.conversionengine.client;

import com.xksgroup.conversionengine.model.dto.TaskSnapshotDto;
import com.xksgroup.conversionengine.model.event.EventEnvelope;

import java.util.List;

/**
 * Callbacks from {@link ReconnectingClient}. All of them run on the client's own thread.
 */
public interface ClientListener {

    default void onStateChanged(ConnectionState previous, ConnectionState current) {
    }

    default void onEvent(EventEnvelope envelope) {
    }

    /**
     * Active tasks fetched right after a (re)connection, once group memberships are
     * restored.
     */
    default void onResync(List<TaskSnapshotDto> activeTasks) {
    }

    default void onReconnectFailed(int attempts, Throwable lastError) {
    }
}
