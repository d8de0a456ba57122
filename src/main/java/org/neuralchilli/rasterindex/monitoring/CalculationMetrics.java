package org.neuralchilli.rasterindex.monitoring;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters and timings for calculation runs.
 *
 * Tracks:
 * - admission outcomes (admitted, rejected over budget, unresolvable formulas)
 * - calculation outcomes (success, error, exception)
 * - save outcomes (saved, failed, abandoned)
 * - backpressure waits
 * - calculation and save durations
 *
 * Updated from the scheduler loop and the worker threads concurrently.
 */
@ApplicationScoped
public class CalculationMetrics {

    private static final Logger log = LoggerFactory.getLogger(CalculationMetrics.class);

    public static final String CALCULATION = "calculation";
    public static final String SAVE = "save";

    // Admission
    private final LongAdder tasksAdmitted = new LongAdder();
    private final LongAdder tasksRejected = new LongAdder();
    private final LongAdder tasksUnresolvable = new LongAdder();

    // Calculation
    private final LongAdder calculationsSucceeded = new LongAdder();
    private final LongAdder calculationsFailed = new LongAdder();
    private final LongAdder calculationsExcepted = new LongAdder();

    // Saving
    private final LongAdder savesSucceeded = new LongAdder();
    private final LongAdder savesFailed = new LongAdder();
    private final LongAdder savesAbandoned = new LongAdder();

    // Scheduler
    private final LongAdder backpressureWaits = new LongAdder();

    private final Map<String, TimingStats> timingStats = new ConcurrentHashMap<>();

    public void recordAdmitted() {
        tasksAdmitted.increment();
    }

    public void recordRejected() {
        tasksRejected.increment();
    }

    public void recordUnresolvable() {
        tasksUnresolvable.increment();
    }

    public void recordCalculationSucceeded() {
        calculationsSucceeded.increment();
    }

    public void recordCalculationFailed() {
        calculationsFailed.increment();
    }

    public void recordCalculationExcepted() {
        calculationsExcepted.increment();
    }

    public void recordSaveSucceeded() {
        savesSucceeded.increment();
    }

    public void recordSaveFailed() {
        savesFailed.increment();
    }

    public void recordSaveAbandoned() {
        savesAbandoned.increment();
    }

    public void recordBackpressureWait() {
        backpressureWaits.increment();
    }

    /**
     * Percentage of finished calculations that succeeded.
     */
    public double getCalculationSuccessRate() {
        long succeeded = calculationsSucceeded.sum();
        long total = succeeded + calculationsFailed.sum() + calculationsExcepted.sum();
        return total > 0 ? (succeeded * 100.0) / total : 0.0;
    }

    /**
     * Start timing an operation.
     *
     * @param operation Operation name
     * @return Timer handle to stop timing
     */
    public Timer startTimer(String operation) {
        return new Timer(operation, Instant.now());
    }

    /**
     * Timer handle for operation timing.
     */
    public class Timer {
        private final String operation;
        private final Instant start;

        private Timer(String operation, Instant start) {
            this.operation = operation;
            this.start = start;
        }

        /**
         * Stop timing and record duration.
         *
         * @return the measured duration
         */
        public Duration stop() {
            Duration duration = Duration.between(start, Instant.now());
            recordTiming(operation, duration);
            return duration;
        }
    }

    private void recordTiming(String operation, Duration duration) {
        timingStats.compute(operation, (key, stats) -> {
            if (stats == null) {
                stats = new TimingStats();
            }
            stats.record(duration);
            return stats;
        });
    }

    public TimingStats getTimingStats(String operation) {
        return timingStats.getOrDefault(operation, new TimingStats());
    }

    /**
     * Statistics for operation timing.
     */
    public static class TimingStats {
        private final LongAdder count = new LongAdder();
        private final LongAdder totalNanos = new LongAdder();
        private final AtomicLong minNanos = new AtomicLong(Long.MAX_VALUE);
        private final AtomicLong maxNanos = new AtomicLong(0);

        void record(Duration duration) {
            long nanos = duration.toNanos();
            count.increment();
            totalNanos.add(nanos);
            minNanos.updateAndGet(current -> Math.min(current, nanos));
            maxNanos.updateAndGet(current -> Math.max(current, nanos));
        }

        public long getCount() {
            return count.sum();
        }

        public Duration getTotal() {
            return Duration.ofNanos(totalNanos.sum());
        }

        public Duration getAverage() {
            long cnt = count.sum();
            return cnt > 0 ? Duration.ofNanos(totalNanos.sum() / cnt) : Duration.ZERO;
        }

        public Duration getMin() {
            long min = minNanos.get();
            return min < Long.MAX_VALUE ? Duration.ofNanos(min) : Duration.ZERO;
        }

        public Duration getMax() {
            return Duration.ofNanos(maxNanos.get());
        }

        @Override
        public String toString() {
            return String.format(
                    "TimingStats[count=%d, avg=%dms, min=%dms, max=%dms]",
                    getCount(),
                    getAverage().toMillis(),
                    getMin().toMillis(),
                    getMax().toMillis()
            );
        }
    }

    public MetricsReport getReport() {
        return new MetricsReport(
                tasksAdmitted.sum(),
                tasksRejected.sum(),
                tasksUnresolvable.sum(),
                calculationsSucceeded.sum(),
                calculationsFailed.sum(),
                calculationsExcepted.sum(),
                savesSucceeded.sum(),
                savesFailed.sum(),
                savesAbandoned.sum(),
                backpressureWaits.sum(),
                TimingSummary.of(getTimingStats(CALCULATION)),
                TimingSummary.of(getTimingStats(SAVE))
        );
    }

    /**
     * Count and total duration of one timed operation.
     */
    public record TimingSummary(long count, Duration total) {

        static TimingSummary of(TimingStats stats) {
            return new TimingSummary(stats.getCount(), stats.getTotal());
        }

        public Duration average() {
            return count > 0 ? total.dividedBy(count) : Duration.ZERO;
        }

        TimingSummary minus(TimingSummary earlier) {
            return new TimingSummary(count - earlier.count, total.minus(earlier.total));
        }
    }

    /**
     * Metrics snapshot.
     */
    public record MetricsReport(
            long tasksAdmitted,
            long tasksRejected,
            long tasksUnresolvable,
            long calculationsSucceeded,
            long calculationsFailed,
            long calculationsExcepted,
            long savesSucceeded,
            long savesFailed,
            long savesAbandoned,
            long backpressureWaits,
            TimingSummary calculationTiming,
            TimingSummary saveTiming
    ) {

        /**
         * Activity between {@code earlier} and this snapshot. Runs overlapping
         * that window are counted too.
         */
        public MetricsReport since(MetricsReport earlier) {
            return new MetricsReport(
                    tasksAdmitted - earlier.tasksAdmitted,
                    tasksRejected - earlier.tasksRejected,
                    tasksUnresolvable - earlier.tasksUnresolvable,
                    calculationsSucceeded - earlier.calculationsSucceeded,
                    calculationsFailed - earlier.calculationsFailed,
                    calculationsExcepted - earlier.calculationsExcepted,
                    savesSucceeded - earlier.savesSucceeded,
                    savesFailed - earlier.savesFailed,
                    savesAbandoned - earlier.savesAbandoned,
                    backpressureWaits - earlier.backpressureWaits,
                    calculationTiming.minus(earlier.calculationTiming),
                    saveTiming.minus(earlier.saveTiming)
            );
        }

        public double calculationSuccessRate() {
            long total = calculationsSucceeded + calculationsFailed + calculationsExcepted;
            return total > 0 ? (calculationsSucceeded * 100.0) / total : 0.0;
        }

        public Duration averageCalculationTime() {
            return calculationTiming.average();
        }

        public Duration averageSaveTime() {
            return saveTiming.average();
        }

        @Override
        public String toString() {
            return String.format("""
                Admission:
                  Admitted: %d, Rejected: %d, Unresolvable: %d
                  Backpressure waits: %d

                Calculation:
                  Success Rate: %.1f%%
                  Succeeded: %d, Failed: %d, Exceptions: %d
                  Avg Time: %dms

                Saving:
                  Saved: %d, Failed: %d, Abandoned: %d
                  Avg Time: %dms
                """,
                    tasksAdmitted, tasksRejected, tasksUnresolvable,
                    backpressureWaits,
                    calculationSuccessRate(),
                    calculationsSucceeded, calculationsFailed, calculationsExcepted,
                    averageCalculationTime().toMillis(),
                    savesSucceeded, savesFailed, savesAbandoned,
                    averageSaveTime().toMillis()
            );
        }
    }

    /**
     * Reset all metrics (useful for testing).
     */
    public void reset() {
        tasksAdmitted.reset();
        tasksRejected.reset();
        tasksUnresolvable.reset();
        calculationsSucceeded.reset();
        calculationsFailed.reset();
        calculationsExcepted.reset();
        savesSucceeded.reset();
        savesFailed.reset();
        savesAbandoned.reset();
        backpressureWaits.reset();
        timingStats.clear();
        log.info("Calculation metrics reset");
    }

    /**
     * Log the activity since {@code baseline} was taken.
     */
    public void logReportSince(MetricsReport baseline) {
        log.info("Calculation metrics for this run:\n{}", getReport().since(baseline));
    }
}
