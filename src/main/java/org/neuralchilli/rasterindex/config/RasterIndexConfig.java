package org.neuralchilli.rasterindex.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import org.neuralchilli.rasterindex.core.BackpressurePolicy;

import java.time.Duration;

@ConfigMapping(prefix = "raster-index")
public interface RasterIndexConfig {

    /**
     * Memory budget in MB used when a request does not set one.
     */
    @WithName("memory-budget-mb")
    @WithDefault("1024")
    double memoryBudgetMb();

    /**
     * Concurrency cap used when a request does not set one.
     */
    @WithName("max-active-tasks")
    @WithDefault("5")
    int maxActiveTasks();

    @WithName("compute-threads")
    @WithDefault("4")
    int computeThreads();

    @WithName("poll-interval")
    @WithDefault("500ms")
    Duration pollInterval();

    @WithName("backpressure")
    @WithDefault("loose")
    BackpressurePolicy backpressure();

    /**
     * Classpath resource or file path of the formula library.
     */
    @WithName("formulas")
    @WithDefault("formulas.yml")
    String formulas();

    @WithName("output-dir")
    @WithDefault("./output")
    String outputDir();

    @WithName("save-shutdown-timeout")
    @WithDefault("30s")
    Duration saveShutdownTimeout();
}
