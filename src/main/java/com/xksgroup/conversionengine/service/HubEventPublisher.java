package com.xksgroup.conversionengine.service;

import com.xksgroup.conversionengine.model.SpaceUsageSnapshot;
import com.xksgroup.conversionengine.model.Task;
import com.xksgroup.conversionengine.model.event.EngineEvent;
import com.xksgroup.conversionengine.model.event.EventEnvelope;
import com.xksgroup.conversionengine.service.helper.TimeSource;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Turns engine events into envelopes and decides which groups hear about them.
 */
@Component
@RequiredArgsConstructor
public class HubEventPublisher implements EngineEventPublisher {

    private final BroadcastHub hub;
    private final TimeSource timeSource;

    @Override
    public void publish(EngineEvent event) {
        hub.publish(groupsFor(event), EventEnvelope.from(event));
    }

    @Override
    public void publishSpaceStatus(SpaceUsageSnapshot snapshot, boolean configurationChange) {
        EngineEvent event = EngineEvent.forSpace(snapshot, timeSource.now());
        Set<String> targets = new LinkedHashSet<>();
        targets.add(BroadcastHub.SPACE_MONITOR);
        if (configurationChange) {
            targets.add(BroadcastHub.ALL);
        }
        hub.publish(targets, EventEnvelope.from(event));
    }

    static Set<String> groupsFor(EngineEvent event) {
        Set<String> targets = new LinkedHashSet<>();
        if (!event.isTaskEvent()) {
            targets.add(BroadcastHub.SPACE_MONITOR);
            return targets;
        }

        Task task = event.task();
        targets.add(BroadcastHub.taskGroup(event.taskId()));
        if (task != null && task.getOwnerId() != null && !task.getOwnerId().isBlank()) {
            targets.add(BroadcastHub.userGroup(task.getOwnerId()));
        }
        if (isGlobal(event)) {
            targets.add(BroadcastHub.ALL);
        }
        return targets;
    }

    private static boolean isGlobal(EngineEvent event) {
        return switch (event.type()) {
            case CREATED, COMPLETED, DELETED -> true;
            case STATUS_CHANGED -> event.task() != null && event.task().getStatus().isTerminal();
            case PROGRESS_UPDATED, SPACE_STATUS_CHANGED -> false;
        };
    }
}
