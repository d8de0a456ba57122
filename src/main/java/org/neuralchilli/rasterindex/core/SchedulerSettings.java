package org.neuralchilli.rasterindex.core;

import java.time.Duration;

/**
 * Admission limits for one scheduler run.
 */
public record SchedulerSettings(
        double memoryBudgetMb,
        int maxActiveTasks,
        Duration pollInterval,
        BackpressurePolicy backpressure
) {
    public static final double DEFAULT_MEMORY_BUDGET_MB = 1024;
    public static final int DEFAULT_MAX_ACTIVE_TASKS = 5;
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(500);

    public SchedulerSettings {
        if (memoryBudgetMb <= 0) {
            throw new IllegalArgumentException("Memory budget must be > 0, got: " + memoryBudgetMb);
        }
        if (maxActiveTasks < 1) {
            throw new IllegalArgumentException("Max active tasks must be >= 1, got: " + maxActiveTasks);
        }
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive");
        }
        if (backpressure == null) {
            backpressure = BackpressurePolicy.LOOSE;
        }
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(
                DEFAULT_MEMORY_BUDGET_MB,
                DEFAULT_MAX_ACTIVE_TASKS,
                DEFAULT_POLL_INTERVAL,
                BackpressurePolicy.LOOSE
        );
    }

    public SchedulerSettings withLimits(double memoryBudgetMb, int maxActiveTasks) {
        return new SchedulerSettings(memoryBudgetMb, maxActiveTasks, pollInterval, backpressure);
    }

    public SchedulerSettings withPollInterval(Duration interval) {
        return new SchedulerSettings(memoryBudgetMb, maxActiveTasks, interval, backpressure);
    }

    public SchedulerSettings withBackpressure(BackpressurePolicy policy) {
        return new SchedulerSettings(memoryBudgetMb, maxActiveTasks, pollInterval, policy);
    }
}
