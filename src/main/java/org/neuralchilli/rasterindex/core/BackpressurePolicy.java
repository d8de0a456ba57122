package org.neuralchilli.rasterindex.core;

/**
 * When the scheduler stops admitting new tasks and waits.
 */
public enum BackpressurePolicy {

    /**
     * Wait only while the memory budget and the concurrency cap are both reached,
     * and stop waiting as soon as any task completes. Memory may overshoot transiently.
     */
    LOOSE {
        @Override
        public boolean mustWait(double memoryUsage, double memoryBudget, int activeTasks, int maxActiveTasks) {
            return memoryUsage >= memoryBudget && activeTasks >= maxActiveTasks;
        }
    },

    /**
     * Wait while either limit is reached, until enough work has been retired.
     */
    STRICT {
        @Override
        public boolean mustWait(double memoryUsage, double memoryBudget, int activeTasks, int maxActiveTasks) {
            return memoryUsage >= memoryBudget || activeTasks >= maxActiveTasks;
        }
    };

    public abstract boolean mustWait(double memoryUsage, double memoryBudget, int activeTasks, int maxActiveTasks);
}
