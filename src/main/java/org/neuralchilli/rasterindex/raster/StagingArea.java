package org.neuralchilli.rasterindex.raster;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory store of evaluated outputs waiting to be persisted,
 * keyed by staging path.
 */
@ApplicationScoped
public class StagingArea {

    private final Map<String, StagedRaster> staged = new ConcurrentHashMap<>();

    /**
     * Single-band output of one evaluation.
     */
    public record StagedRaster(int width, int height, float[] data) {
        public StagedRaster {
            if (data == null || data.length != width * height) {
                throw new IllegalArgumentException("Staged data must hold width * height samples");
            }
        }
    }

    public void put(String stagingPath, StagedRaster raster) {
        staged.put(stagingPath, raster);
    }

    public Optional<StagedRaster> get(String stagingPath) {
        return Optional.ofNullable(staged.get(stagingPath));
    }

    /**
     * Unlink a staged output. Unknown paths are ignored.
     */
    public void remove(String stagingPath) {
        staged.remove(stagingPath);
    }

    public boolean contains(String stagingPath) {
        return staged.containsKey(stagingPath);
    }

    public int size() {
        return staged.size();
    }
}
