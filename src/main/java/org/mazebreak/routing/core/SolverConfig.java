package org.mazebreak.routing.core;

import lombok.Builder;
import lombok.Value;

import java.util.Locale;

/**
 * Solver-wide defaults. Individual {@link SolveRequest}s may override mode and policy.
 */
@Value
@Builder
public class SolverConfig {
    public static final String PROP_EXECUTION_MODE = "mazebreak.solver.executionMode";
    public static final String PROP_DIRECT_PATH_POLICY = "mazebreak.solver.directPathPolicy";
    public static final String PROP_PARALLELISM = "mazebreak.solver.parallelism";
    public static final String PROP_MAX_GRID_CELLS = "mazebreak.solver.maxGridCells";

    /** Scheduling of frontier runs and wall probes. */
    @Builder.Default
    ExecutionMode executionMode = ExecutionMode.SEQUENTIAL;

    /** Whether a floor-only corner-to-corner route may be returned. */
    @Builder.Default
    DirectPathPolicy directPathPolicy = DirectPathPolicy.REQUIRE_BREACH;

    /** Worker count for {@link ExecutionMode#PARALLEL}. Non-positive means available processors. */
    @Builder.Default
    int parallelism = 0;

    /** Largest accepted {@code height * width}. Non-positive means unbounded. */
    @Builder.Default
    int maxGridCells = 0;

    /**
     * Loads configuration from JVM system properties, falling back to builder defaults
     * for missing or malformed values.
     */
    public static SolverConfig defaults() {
        SolverConfigBuilder builder = SolverConfig.builder();
        ExecutionMode mode = readEnum(PROP_EXECUTION_MODE, ExecutionMode.class);
        if (mode != null) {
            builder.executionMode(mode);
        }
        DirectPathPolicy policy = readEnum(PROP_DIRECT_PATH_POLICY, DirectPathPolicy.class);
        if (policy != null) {
            builder.directPathPolicy(policy);
        }
        return builder
                .parallelism(readInt(PROP_PARALLELISM))
                .maxGridCells(readInt(PROP_MAX_GRID_CELLS))
                .build();
    }

    /**
     * Worker count to use when a pool is created.
     */
    int effectiveParallelism() {
        return parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
    }

    private static int readInt(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(raw.strip());
        } catch (NumberFormatException ex) {
            return 0;
        }
    }

    private static <E extends Enum<E>> E readEnum(String property, Class<E> type) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Enum.valueOf(type, raw.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
