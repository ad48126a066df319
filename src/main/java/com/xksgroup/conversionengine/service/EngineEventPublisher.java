package com.xksgroup.conversionengine.service;

import com.xksgroup.conversionengine.model.SpaceUsageSnapshot;
import com.xksgroup.conversionengine.model.event.EngineEvent;

/**
 * Outbound side of the engine. Implementations must not block the caller: the registry
 * publishes while holding a task lock.
 */
public interface EngineEventPublisher {

    void publish(EngineEvent event);

    /**
     * @param configurationChange true when the budget itself changed, so every
     *                            connected client hears about it
     */
    void publishSpaceStatus(SpaceUsageSnapshot snapshot, boolean configurationChange);
}
