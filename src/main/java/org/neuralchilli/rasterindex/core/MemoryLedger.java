package org.neuralchilli.rasterindex.core;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Per-task memory reservations in megabytes.
 *
 * Releasing is keyed by task, so a reservation can only be released once and
 * the total can never go negative. When the last reservation is released the
 * total is reset to exactly zero, dropping floating point residue.
 *
 * Not thread-safe: owned by the scheduler loop.
 */
public final class MemoryLedger {

    private final Map<UUID, Double> reservations = new HashMap<>();
    private double usage;

    /**
     * @throws IllegalStateException if the task already holds a reservation
     */
    public void reserve(UUID taskId, double megabytes) {
        if (megabytes < 0) {
            throw new IllegalArgumentException("Reserved memory must be >= 0");
        }
        if (reservations.putIfAbsent(taskId, megabytes) != null) {
            throw new IllegalStateException("Memory already reserved for task: " + taskId);
        }
        usage += megabytes;
    }

    /**
     * Release a task's reservation.
     *
     * @return megabytes released, 0 if the task held none
     */
    public double release(UUID taskId) {
        Double released = reservations.remove(taskId);
        if (released == null) {
            return 0;
        }

        if (reservations.isEmpty()) {
            usage = 0;
        } else {
            usage = Math.max(0, usage - released);
        }
        return released;
    }

    public double usage() {
        return usage;
    }

    public boolean holds(UUID taskId) {
        return reservations.containsKey(taskId);
    }

    public int reservationCount() {
        return reservations.size();
    }
}
