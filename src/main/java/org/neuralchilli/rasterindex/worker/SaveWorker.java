package org.neuralchilli.rasterindex.worker;

import org.neuralchilli.rasterindex.core.CompletionChannel;
import org.neuralchilli.rasterindex.domain.CalculationTask;
import org.neuralchilli.rasterindex.domain.SaveRecord;
import org.neuralchilli.rasterindex.domain.SaveRequest;
import org.neuralchilli.rasterindex.domain.TaskResult;
import org.neuralchilli.rasterindex.monitoring.CalculationMetrics;
import org.neuralchilli.rasterindex.raster.StorageConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Background pipeline that persists staged calculation outputs.
 *
 * One dedicated thread takes requests from a work queue, blocking on a condition
 * while it is empty. Every outcome, saved or failed, goes into a separately
 * locked completion buffer that the scheduler empties with {@link #drainSaved()}.
 * Submitters, the worker loop and the scheduler never contend on the same lock.
 *
 * Stopping wakes the loop; a request already taken is finished, requests still
 * queued are dropped.
 */
public class SaveWorker {

    private static final Logger log = LoggerFactory.getLogger(SaveWorker.class);

    private final StorageConverter storageConverter;
    private final CalculationMetrics metrics;

    private final Lock queueLock = new ReentrantLock();
    private final Condition workAvailable = queueLock.newCondition();
    private final Deque<SaveRequest> queue = new ArrayDeque<>();

    private final CompletionChannel<SaveRecord> saved = new CompletionChannel<>();

    private ExecutorService executorService;
    private volatile boolean running = false;
    private volatile boolean loopExited = false;

    public SaveWorker(StorageConverter storageConverter, CalculationMetrics metrics) {
        this.storageConverter = storageConverter;
        this.metrics = metrics;
    }

    public synchronized void start() {
        if (running) {
            log.warn("Save worker already running");
            return;
        }

        running = true;
        loopExited = false;
        executorService = Executors.newSingleThreadExecutor(new NamedThreadFactory("raster-save"));
        executorService.submit(this::workerLoop);
    }

    /**
     * Queue one staged output for persistence and wake the worker.
     */
    public void submit(SaveRequest request) {
        submitAll(List.of(request));
    }

    /**
     * Queue a batch of staged outputs and wake the worker.
     */
    public void submitAll(Collection<SaveRequest> requests) {
        if (requests.isEmpty()) {
            return;
        }

        queueLock.lock();
        try {
            queue.addAll(requests);
            workAvailable.signal();
        } finally {
            queueLock.unlock();
        }
    }

    /**
     * Atomically take every save record produced since the last call.
     * Each record is returned exactly once, in completion order.
     */
    public List<SaveRecord> drainSaved() {
        return saved.drain();
    }

    /**
     * Wait up to {@code timeout} for at least one save record to be available.
     */
    public boolean awaitSaved(Duration timeout) throws InterruptedException {
        return saved.await(timeout);
    }

    /**
     * True while the worker loop is able to take new requests.
     */
    public boolean isRunning() {
        return running && !loopExited;
    }

    public int queuedCount() {
        queueLock.lock();
        try {
            return queue.size();
        } finally {
            queueLock.unlock();
        }
    }

    private void workerLoop() {
        log.info("Save worker started");

        try {
            while (true) {
                SaveRequest next;

                queueLock.lock();
                try {
                    while (queue.isEmpty() && running) {
                        workAvailable.await();
                    }

                    if (!running) {
                        if (!queue.isEmpty()) {
                            log.warn("Save worker stopped with {} unsaved outputs, dropping them", queue.size());
                            queue.clear();
                        }
                        break;
                    }

                    next = queue.poll();
                } finally {
                    queueLock.unlock();
                }

                save(next);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Save worker interrupted, exiting");
        } finally {
            loopExited = true;
        }

        log.info("Save worker stopped");
    }

    private void save(SaveRequest request) {
        CalculationTask task = request.task();
        log.debug("Saving task: {} for {}", task.description(), task.raster().name());
        CalculationMetrics.Timer timer = metrics.startTimer(CalculationMetrics.SAVE);

        TaskResult result;
        try {
            storageConverter.convert(task.stagingPath(), task.outputFile());
            result = request.result().withSaved(task.outputFile());
            metrics.recordSaveSucceeded();
            log.info("Successfully saved task: {} to {}", task.description(), task.outputFile());
        } catch (Exception e) {
            releaseStaged(task);
            metrics.recordSaveFailed();
            log.error("Error saving task {} to {}", task.description(), task.outputFile(), e);
            result = request.result().withSaveFailure(e.getMessage() != null ? e.getMessage() : e.getClass().getName());
        } finally {
            timer.stop();
        }

        saved.publish(SaveRecord.of(request, result));
    }

    private void releaseStaged(CalculationTask task) {
        try {
            storageConverter.release(task.stagingPath());
        } catch (RuntimeException e) {
            log.warn("Could not release staged output {}", task.stagingPath(), e);
        }
    }

    /**
     * Stop the worker and wait up to {@code timeout} for the request in progress.
     */
    public void stop(Duration timeout) {
        synchronized (this) {
            if (!running) {
                return;
            }
            log.info("Stopping save worker...");
        }

        queueLock.lock();
        try {
            running = false;
            workAvailable.signalAll();
        } finally {
            queueLock.unlock();
        }

        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Save worker did not finish within {}ms, forcing shutdown", timeout.toMillis());
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
