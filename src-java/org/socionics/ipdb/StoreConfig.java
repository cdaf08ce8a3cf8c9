package org.socionics.ipdb;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

import org.socionics.ipdb.backend.BackendKind;

/**
 * Configuration of a {@link PersonalityStore}.
 *
 * <p>This is an immutable record of the settings a store was built with.
 * Use {@link PersonalityStore#builder()} to construct stores.</p>
 */
public final class StoreConfig {

    public static final int DEFAULT_DIMENSIONS = 384;
    public static final int DEFAULT_CAPACITY = 100_000;
    public static final int DEFAULT_M = 16;
    public static final int DEFAULT_EF_CONSTRUCTION = 200;
    public static final int DEFAULT_EF_SEARCH = 50;
    public static final int DEFAULT_EXACT_SEARCH_THRESHOLD = 2_000;

    public static final String DEFAULT_ANALYTICAL_FILE = "ipdb.duckdb";
    public static final String DEFAULT_LIGHTWEIGHT_FILE = "ipdb.sqlite";
    public static final String DEFAULT_FALLBACK_FILE = "ipdb_fallback.json";

    private final Path dataDir;
    private final List<BackendKind> backends;
    private final int dimensions;
    private final int capacity;
    private final int m;
    private final int efConstruction;
    private final int efSearch;
    private final int exactSearchThreshold;
    private final String analyticalFile;
    private final String lightweightFile;
    private final String fallbackFile;
    private final Clock clock;

    StoreConfig(Path dataDir, List<BackendKind> backends, int dimensions, int capacity,
                int m, int efConstruction, int efSearch, int exactSearchThreshold,
                String analyticalFile, String lightweightFile, String fallbackFile, Clock clock) {
        this.dataDir = dataDir;
        this.backends = List.copyOf(backends);
        this.dimensions = dimensions;
        this.capacity = capacity;
        this.m = m;
        this.efConstruction = efConstruction;
        this.efSearch = efSearch;
        this.exactSearchThreshold = exactSearchThreshold;
        this.analyticalFile = analyticalFile;
        this.lightweightFile = lightweightFile;
        this.fallbackFile = fallbackFile;
        this.clock = clock;
    }

    public Path getDataDir() { return dataDir; }

    /** Native backends in the order they are probed. The fallback always comes last. */
    public List<BackendKind> getBackends() { return backends; }

    public int getDimensions() { return dimensions; }
    public int getCapacity() { return capacity; }
    public int getM() { return m; }
    public int getEfConstruction() { return efConstruction; }
    public int getEfSearch() { return efSearch; }
    public int getExactSearchThreshold() { return exactSearchThreshold; }
    public String getAnalyticalFile() { return analyticalFile; }
    public String getLightweightFile() { return lightweightFile; }
    public String getFallbackFile() { return fallbackFile; }
    public Clock getClock() { return clock; }

    /**
     * Database or snapshot file used by a backend.
     */
    public Path fileFor(BackendKind kind) {
        switch (kind) {
            case ANALYTICAL: return dataDir.resolve(analyticalFile);
            case LIGHTWEIGHT: return dataDir.resolve(lightweightFile);
            default: return dataDir.resolve(fallbackFile);
        }
    }

    @Override
    public String toString() {
        return "StoreConfig{" +
               "dataDir=" + dataDir +
               ", backends=" + backends +
               ", dimensions=" + dimensions +
               ", capacity=" + capacity +
               ", m=" + m +
               ", efConstruction=" + efConstruction +
               ", efSearch=" + efSearch +
               ", exactSearchThreshold=" + exactSearchThreshold +
               '}';
    }
}
