package com.xksgroup.conversionengine.service.helper;

import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class IdGenerator {

    public String newTaskId() {
        return "task-" + UUID.randomUUID();
    }

    public String newConnectionId() {
        return "conn-" + UUID.randomUUID();
    }

    public String newReservationId() {
        return "rsv-" + UUID.randomUUID();
    }
}
