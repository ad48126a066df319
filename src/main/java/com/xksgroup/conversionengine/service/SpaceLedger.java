package com.xksgroup.conversionengine.service;

import com.xksgroup.conversionengine.exception.InsufficientSpaceException;
import com.xksgroup.conversionengine.model.SpaceCheckResult;
import com.xksgroup.conversionengine.service.helper.IdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Bytes promised to admitted tasks that the directory walk may not see yet. The
 * check and the reservation happen under one lock, so two admissions can never both
 * spend the same free space.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpaceLedger {

    private final IdGenerator idGenerator;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Long> reservations = new HashMap<>();
    private final Map<String, String> taskBindings = new HashMap<>();
    private long pendingBytes;

    /**
     * Runs {@code check} and, if it passes, records a reservation of {@code bytes}.
     * The check sees the pending total as it is inside the lock.
     *
     * @return reservation id to pass to {@link #bind} or {@link #release}
     * @throws InsufficientSpaceException when the check fails
     */
    public String reserve(long bytes, Supplier<SpaceCheckResult> check) {
        if (bytes < 0) {
            throw new IllegalArgumentException("Cannot reserve a negative amount: " + bytes);
        }
        lock.lock();
        try {
            SpaceCheckResult result = check.get();
            if (!result.isHasEnoughSpace()) {
                throw new InsufficientSpaceException(result);
            }
            String reservationId = idGenerator.newReservationId();
            reservations.put(reservationId, bytes);
            pendingBytes += bytes;
            log.debug("Reserved {} bytes as {} (pending total {})", bytes, reservationId, pendingBytes);
            return reservationId;
        } finally {
            lock.unlock();
        }
    }

    public void bind(String reservationId, String taskId) {
        lock.lock();
        try {
            if (reservations.containsKey(reservationId)) {
                taskBindings.put(taskId, reservationId);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return bytes released, 0 if the reservation was already gone
     */
    public long release(String reservationId) {
        lock.lock();
        try {
            Long bytes = reservations.remove(reservationId);
            if (bytes == null) {
                return 0;
            }
            taskBindings.values().remove(reservationId);
            pendingBytes -= bytes;
            log.debug("Released {} bytes from {} (pending total {})", bytes, reservationId, pendingBytes);
            return bytes;
        } finally {
            lock.unlock();
        }
    }

    public long releaseForTask(String taskId) {
        lock.lock();
        try {
            String reservationId = taskBindings.remove(taskId);
            return reservationId != null ? release(reservationId) : 0;
        } finally {
            lock.unlock();
        }
    }

    public long pendingBytes() {
        lock.lock();
        try {
            return pendingBytes;
        } finally {
            lock.unlock();
        }
    }

    public int reservationCount() {
        lock.lock();
        try {
            return reservations.size();
        } finally {
            lock.unlock();
        }
    }
}
