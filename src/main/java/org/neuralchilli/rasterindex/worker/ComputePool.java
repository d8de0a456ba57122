package org.neuralchilli.rasterindex.worker;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.rasterindex.domain.CalculationTask;
import org.neuralchilli.rasterindex.domain.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-size thread pool that evaluates calculation tasks.
 *
 * Each submission gets its own future; the scheduler is notified when it
 * completes instead of polling task progress.
 */
@ApplicationScoped
public class ComputePool implements ComputeBackend {

    private static final Logger log = LoggerFactory.getLogger(ComputePool.class);

    @Inject
    CalculationTaskExecutor taskExecutor;

    @ConfigProperty(name = "raster-index.compute-threads", defaultValue = "4")
    int computeThreads;

    private ExecutorService executorService;
    private volatile boolean running = false;
    private int threads;

    public ComputePool() {
    }

    ComputePool(CalculationTaskExecutor taskExecutor) {
        this.taskExecutor = taskExecutor;
    }

    void onStart(@Observes StartupEvent event) {
        start(computeThreads);
    }

    void onStop(@Observes ShutdownEvent event) {
        stop();
    }

    /**
     * Start the pool with the specified thread count.
     *
     * @param threads Number of compute threads to create
     */
    public synchronized void start(int threads) {
        if (running) {
            log.warn("Compute pool already running");
            return;
        }
        if (threads < 1) {
            throw new IllegalArgumentException("Compute threads must be >= 1, got: " + threads);
        }

        this.threads = threads;
        this.executorService = new ThreadPoolExecutor(
                threads,
                threads,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("raster-compute")
        );
        this.running = true;

        log.info("Compute pool started: {} threads", threads);
    }

    @Override
    public CompletableFuture<TaskResult> submit(CalculationTask task) {
        if (!running) {
            throw new IllegalStateException("Compute pool is not running");
        }

        log.debug("Submitting {} for {}", task.description(), task.raster().name());
        return CompletableFuture.supplyAsync(() -> taskExecutor.execute(task), executorService);
    }

    /**
     * Stop the pool gracefully.
     * Allows in-flight calculations to complete.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        log.info("Stopping compute pool gracefully...");
        running = false;

        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(60, TimeUnit.SECONDS)) {
                log.warn("Compute pool did not terminate in 60 seconds, forcing shutdown");
                executorService.shutdownNow();
                if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                    log.error("Compute pool did not terminate after forced shutdown");
                }
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }

        log.info("Compute pool stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public int threads() {
        return threads;
    }
}
