package com.xksgroup.conversionengine.client;

import com.xksgroup.conversionengine.model.dto.TaskSnapshotDto;
import com.xksgroup.conversionengine.model.event.EventEnvelope;

import java.io.IOException;
import java.util.List;

/**
 * Wire access used by {@link ReconnectingClient}: one downstream event stream plus the
 * small upstream calls.
 */
public interface EventStreamTransport {

    interface StreamListener {

        void onEnvelope(EventEnvelope envelope);

        /**
         * @param error null when the server ended the stream normally
         */
        void onClosed(Throwable error);
    }

    interface StreamHandle {
        void close();
    }

    StreamHandle openStream(StreamListener listener) throws IOException;

    void joinGroup(String connectionId, String group) throws IOException;

    void leaveGroup(String connectionId, String group) throws IOException;

    void pong(String connectionId) throws IOException;

    List<TaskSnapshotDto> fetchActiveTasks() throws IOException;
}
