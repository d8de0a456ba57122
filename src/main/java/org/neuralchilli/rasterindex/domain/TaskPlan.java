package org.neuralchilli.rasterindex.domain;

/**
 * One generated unit of work: either a task ready for admission, or a
 * pair whose formula could not be resolved and is already finished.
 */
public sealed interface TaskPlan {

    String index();

    /**
     * Task ready for admission control
     */
    record Ready(CalculationTask task) implements TaskPlan {
        @Override
        public String index() {
            return task.index();
        }
    }

    /**
     * Pair that failed before a task could be built
     */
    record Unresolvable(TaskResult result) implements TaskPlan {
        @Override
        public String index() {
            return result.index();
        }
    }

    static TaskPlan ready(CalculationTask task) {
        return new Ready(task);
    }

    static TaskPlan unresolvable(TaskResult result) {
        return new Unresolvable(result);
    }
}
