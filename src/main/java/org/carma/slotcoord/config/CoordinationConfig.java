package org.carma.slotcoord.config;

import org.carma.slotcoord.mechanism.ReplacementPolicy;

import java.util.*;

/**
 * Run parameters for a coordination run.
 *
 * Loaded from YAML by {@link CoordinationConfigLoader}; every field has a
 * usable default so a minimal file only needs {@code numStations} and
 * {@code numSlots}.
 *
 * <pre>
 * numStations: 3
 * numSlots: 8
 * maxRounds: 200
 * stationOrder: ROTATING
 * replacementPolicy: LOWEST_HEAT
 * demand:
 *   refresh: EVERY_K_ROUNDS
 *   interval: 5
 * recordStore: success_records.json
 * </pre>
 */
public class CoordinationConfig {

    public static final int DEFAULT_MAX_ROUNDS = 200;
    public static final long DEFAULT_QUERY_TIMEOUT_MS = 30_000;
    public static final int DEFAULT_CONVERGENCE_THRESHOLD = 10;

    public int numStations = 2;
    public int numSlots = 8;
    public int maxRounds = DEFAULT_MAX_ROUNDS;
    public List<String> stationIds;                 // defaults to AP1..APn
    public DemandConfig demand = new DemandConfig();
    public ReplacementPolicy.Kind replacementPolicy = ReplacementPolicy.Kind.LOWEST_HEAT;
    public StationOrder stationOrder = StationOrder.FIXED;
    public long queryTimeoutMs = DEFAULT_QUERY_TIMEOUT_MS;
    public int convergenceThreshold = DEFAULT_CONVERGENCE_THRESHOLD;
    public boolean stopOnConvergence = false;
    public String recordStore = "success_records.json";
    public Long seed;                               // null = nondeterministic
    public SimulationConfig simulation = new SimulationConfig();

    /**
     * Demand generation settings.
     */
    public static class DemandConfig {
        public DemandRefreshPolicy refresh = DemandRefreshPolicy.ON_SUCCESS;
        public int interval = 1;
        public Map<String, Integer> fixed;           // overrides random generation when set
    }

    /**
     * Behaviour of the built-in simulated decision sources.
     */
    public static class SimulationConfig {
        public double malformedRate = 0.0;
        public double failureRate = 0.0;
        public double noiseRate = 0.2;
    }

    // ========================================================================
    // Derived Values
    // ========================================================================

    /**
     * Configured station ids, or {@code AP1..APn}.
     */
    public List<String> resolveStationIds() {
        if (stationIds != null && !stationIds.isEmpty()) {
            return new ArrayList<>(stationIds);
        }
        List<String> ids = new ArrayList<>();
        for (int i = 1; i <= numStations; i++) {
            ids.add("AP" + i);
        }
        return ids;
    }

    public Random newRandom() {
        return seed != null ? new Random(seed) : new Random();
    }

    // ========================================================================
    // Validation
    // ========================================================================

    /**
     * @throws ConfigurationException listing every problem found
     */
    public CoordinationConfig validate() {
        List<String> errors = new ArrayList<>();

        if (numSlots < 1) errors.add("numSlots must be >= 1, got " + numSlots);
        if (numStations < 1) errors.add("numStations must be >= 1, got " + numStations);
        if (numStations > numSlots) {
            errors.add("numStations (" + numStations + ") must not exceed numSlots (" + numSlots + ")");
        }
        if (maxRounds < 1) errors.add("maxRounds must be >= 1, got " + maxRounds);
        if (queryTimeoutMs <= 0) errors.add("queryTimeoutMs must be > 0, got " + queryTimeoutMs);
        if (convergenceThreshold < 1) {
            errors.add("convergenceThreshold must be >= 1, got " + convergenceThreshold);
        }

        if (stationIds != null && !stationIds.isEmpty()) {
            if (stationIds.size() != numStations) {
                errors.add("stationIds lists " + stationIds.size() + " stations but numStations is " + numStations);
            }
            if (new HashSet<>(stationIds).size() != stationIds.size()) {
                errors.add("stationIds contains duplicates: " + stationIds);
            }
        }

        if (demand == null) {
            errors.add("demand section must not be null");
        } else {
            if (demand.refresh == null) errors.add("demand.refresh must be set");
            if (demand.interval < 1) errors.add("demand.interval must be >= 1, got " + demand.interval);
            if (demand.fixed != null) {
                Set<String> expected = new HashSet<>(resolveStationIds());
                if (!expected.equals(demand.fixed.keySet())) {
                    errors.add("demand.fixed must cover exactly " + expected + ", got " + demand.fixed.keySet());
                }
                for (Map.Entry<String, Integer> entry : demand.fixed.entrySet()) {
                    if (entry.getValue() == null || entry.getValue() < 1) {
                        errors.add("demand.fixed." + entry.getKey() + " must be >= 1, got " + entry.getValue());
                    }
                }
            }
        }

        if (simulation != null) {
            checkRate(errors, "simulation.malformedRate", simulation.malformedRate);
            checkRate(errors, "simulation.failureRate", simulation.failureRate);
            checkRate(errors, "simulation.noiseRate", simulation.noiseRate);
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }
        return this;
    }

    private static void checkRate(List<String> errors, String name, double rate) {
        if (rate < 0.0 || rate > 1.0) {
            errors.add(name + " must be within [0, 1], got " + rate);
        }
    }

    @Override
    public String toString() {
        return String.format("CoordinationConfig[stations=%d, slots=%d, maxRounds=%d, order=%s, policy=%s]",
            numStations, numSlots, maxRounds, stationOrder, replacementPolicy);
    }
}
