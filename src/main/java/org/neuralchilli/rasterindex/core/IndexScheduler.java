package org.neuralchilli.rasterindex.core;

import org.neuralchilli.rasterindex.domain.CalculationTask;
import org.neuralchilli.rasterindex.domain.SaveRecord;
import org.neuralchilli.rasterindex.domain.SaveRequest;
import org.neuralchilli.rasterindex.domain.TaskPlan;
import org.neuralchilli.rasterindex.domain.TaskResult;
import org.neuralchilli.rasterindex.monitoring.CalculationMetrics;
import org.neuralchilli.rasterindex.worker.ComputeBackend;
import org.neuralchilli.rasterindex.worker.SaveWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Admits calculation tasks under a memory budget and a concurrency cap, routes
 * successful outputs to the save worker and collects one result per task.
 *
 * Every piece of scheduler state is owned by the thread calling {@link #run}.
 * Compute threads hand finished calculations back through a completion channel;
 * the save worker hands save records back through its own buffer. Both are only
 * read during a sweep:
 * <ol>
 *   <li>reap: finished calculations leave the active set; failures release memory
 *       and are recorded, successes are queued for saving with memory still held</li>
 *   <li>flush: the save queue goes to the save worker in one batch</li>
 *   <li>drain: save records are recorded and their memory released</li>
 * </ol>
 *
 * One instance per run.
 */
public class IndexScheduler {

    private static final Logger log = LoggerFactory.getLogger(IndexScheduler.class);

    static final String SAVE_WORKER_STOPPED = "save worker stopped";

    private final SchedulerSettings settings;
    private final ComputeBackend computeBackend;
    private final SaveWorker saveWorker;
    private final CalculationMetrics metrics;

    private final MemoryLedger memory = new MemoryLedger();
    private final CompletionChannel<FinishedCalculation> completions = new CompletionChannel<>();
    private final Map<UUID, CalculationTask> active = new LinkedHashMap<>();
    private final Map<UUID, SaveRequest> awaitingSave = new LinkedHashMap<>();
    private final List<SaveRequest> saveQueue = new ArrayList<>();
    private final List<TaskResult> results = new ArrayList<>();

    private int total;
    private int generated;
    private double progress;
    private boolean started = false;

    public IndexScheduler(
            SchedulerSettings settings,
            ComputeBackend computeBackend,
            SaveWorker saveWorker,
            CalculationMetrics metrics
    ) {
        this.settings = settings;
        this.computeBackend = computeBackend;
        this.saveWorker = saveWorker;
        this.metrics = metrics;
    }

    /**
     * Calculation handed back from a compute thread.
     */
    record FinishedCalculation(CalculationTask task, TaskResult result) {
    }

    /**
     * Admit every planned task and block until each one has a final result.
     *
     * @param plans lazily generated work, consumed once
     * @param total number of plans, used for progress reporting
     * @return one result per plan, in the order they were finalized
     */
    public List<TaskResult> run(Iterator<TaskPlan> plans, int total) throws InterruptedException {
        if (started) {
            throw new IllegalStateException("Scheduler instance has already been run");
        }
        started = true;
        this.total = total;

        log.info("Scheduling {} tasks: memory budget {} MB, max {} active, {} backpressure",
                total, settings.memoryBudgetMb(), settings.maxActiveTasks(), settings.backpressure());

        while (plans.hasNext()) {
            TaskPlan plan = plans.next();
            generated++;

            if (plan instanceof TaskPlan.Unresolvable unresolvable) {
                metrics.recordUnresolvable();
                log.warn("Task for index {} could not be built: {}",
                        unresolvable.index(), unresolvable.result().message());
                record(unresolvable.result());
                continue;
            }

            admit(((TaskPlan.Ready) plan).task());
            sweep();
            awaitCapacity();
        }

        // All tasks generated; let the active ones finish
        while (!active.isEmpty()) {
            completions.await(settings.pollInterval());
            sweep();
        }

        while (results.size() < generated) {
            saveWorker.awaitSaved(settings.pollInterval());
            sweep();
        }

        log.info("All {} tasks finished, {} MB still reserved", results.size(), memory.usage());
        return Collections.unmodifiableList(results);
    }

    private void admit(CalculationTask task) {
        if (task.estimatedMemoryMb() > settings.memoryBudgetMb()) {
            metrics.recordRejected();
            log.warn("Task {} for {} needs {} MB, exceeding the maximum memory usage of {} MB",
                    task.description(), task.raster().name(),
                    String.format("%.2f", task.estimatedMemoryMb()), settings.memoryBudgetMb());
            record(TaskResult.rejected(task));
            return;
        }

        memory.reserve(task.id(), task.estimatedMemoryMb());
        active.put(task.id(), task);
        metrics.recordAdmitted();
        log.debug("Admitted {} for {}: {} MB reserved, {} active",
                task.description(), task.raster().name(), memory.usage(), active.size());

        CompletableFuture<TaskResult> future;
        try {
            future = computeBackend.submit(task);
        } catch (RuntimeException e) {
            log.error("Could not submit {} for {}", task.description(), task.raster().name(), e);
            completions.publish(new FinishedCalculation(task, failedSubmission(task, e)));
            return;
        }

        future.whenComplete((result, error) -> completions.publish(new FinishedCalculation(
                task,
                error == null && result != null ? result : failedSubmission(task, error)
        )));
    }

    private static TaskResult failedSubmission(CalculationTask task, Throwable error) {
        String message;
        if (error == null) {
            message = "Compute backend returned no result";
        } else {
            Throwable cause = error.getCause() != null ? error.getCause() : error;
            message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        }
        return TaskResult.exception(task.source(), task.index(), message, 0);
    }

    void sweep() {
        reap();
        flush();
        drain();
        abandonIfSaveWorkerStopped();
    }

    private void reap() {
        for (FinishedCalculation finished : completions.drain()) {
            CalculationTask task = finished.task();
            if (active.remove(task.id()) == null) {
                continue;
            }

            TaskResult result = finished.result();
            if (result.isSuccess()) {
                SaveRequest request = new SaveRequest(task, result);
                saveQueue.add(request);
                awaitingSave.put(task.id(), request);
                log.debug("Task {} for {} moved to the save queue", task.description(), task.raster().name());
            } else {
                memory.release(task.id());
                record(result);
            }
        }
    }

    private void flush() {
        if (saveQueue.isEmpty()) {
            return;
        }
        saveWorker.submitAll(List.copyOf(saveQueue));
        saveQueue.clear();
    }

    private void drain() {
        for (SaveRecord saved : saveWorker.drainSaved()) {
            if (awaitingSave.remove(saved.taskId()) == null) {
                continue;
            }
            record(saved.result());
            memory.release(saved.taskId());
        }
    }

    private void abandonIfSaveWorkerStopped() {
        if (awaitingSave.isEmpty() || saveWorker.isRunning()) {
            return;
        }

        log.error("Save worker is not running, {} outputs will not be saved", awaitingSave.size());
        for (SaveRequest request : List.copyOf(awaitingSave.values())) {
            CalculationTask task = request.task();
            awaitingSave.remove(task.id());
            metrics.recordSaveAbandoned();
            record(request.result().withSaveFailure(SAVE_WORKER_STOPPED));
            memory.release(task.id());
        }
    }

    private void awaitCapacity() throws InterruptedException {
        BackpressurePolicy policy = settings.backpressure();
        if (!mustWait()) {
            return;
        }

        metrics.recordBackpressureWait();
        log.debug("Backpressure: {} MB reserved, {} active", memory.usage(), active.size());

        if (policy == BackpressurePolicy.LOOSE) {
            // Any finished calculation unblocks admission, even if still over budget
            while (mustWait() && completions.isEmpty()) {
                completions.await(settings.pollInterval());
            }
            return;
        }

        while (mustWait()) {
            if (!active.isEmpty()) {
                completions.await(settings.pollInterval());
            } else {
                saveWorker.awaitSaved(settings.pollInterval());
            }
            sweep();
        }
    }

    private boolean mustWait() {
        return settings.backpressure().mustWait(
                memory.usage(),
                settings.memoryBudgetMb(),
                active.size(),
                settings.maxActiveTasks()
        );
    }

    private void record(TaskResult result) {
        results.add(result);
        if (total > 0) {
            progress = Math.round(results.size() * 1000.0 / total) / 10.0;
        }
        log.info("Progress: {}%", progress);
    }

    public double memoryUsage() {
        return memory.usage();
    }

    public double progress() {
        return progress;
    }

    public int activeCount() {
        return active.size();
    }
}
