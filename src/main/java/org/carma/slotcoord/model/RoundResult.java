package org.carma.slotcoord.model;

import java.util.*;

/**
 * Everything one round produced.
 *
 * Shortfall is reported per station so a scarcity shortfall is visible
 * without inferring it from set sizes.
 */
public class RoundResult {

    private final int round;
    private final Demand demand;
    private final Map<String, ValidatedSet> candidates;
    private final Allocation allocation;
    private final Feedback feedback;
    private final int rawConflictCount;
    private final List<String> fallbackStations;
    private final SuccessRecord successRecord;
    private final String persistenceError;

    public RoundResult(int round, Demand demand, Map<String, ValidatedSet> candidates,
                       Allocation allocation, Feedback feedback, int rawConflictCount,
                       List<String> fallbackStations, SuccessRecord successRecord,
                       String persistenceError) {
        this.round = round;
        this.demand = demand;
        this.candidates = Collections.unmodifiableMap(new LinkedHashMap<>(candidates));
        this.allocation = allocation;
        this.feedback = feedback;
        this.rawConflictCount = rawConflictCount;
        this.fallbackStations = List.copyOf(fallbackStations);
        this.successRecord = successRecord;
        this.persistenceError = persistenceError;
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public int getRound() { return round; }
    public Demand getDemand() { return demand; }
    public Map<String, ValidatedSet> getCandidates() { return candidates; }
    public Allocation getAllocation() { return allocation; }
    public Feedback getFeedback() { return feedback; }
    public int getRawConflictCount() { return rawConflictCount; }
    public List<String> getFallbackStations() { return fallbackStations; }

    public Optional<SuccessRecord> getSuccessRecord() {
        return Optional.ofNullable(successRecord);
    }

    public Optional<String> getPersistenceError() {
        return Optional.ofNullable(persistenceError);
    }

    // ========================================================================
    // Computed Properties
    // ========================================================================

    public boolean isSuccess() {
        return successRecord != null;
    }

    public double getUtilization() {
        return feedback.utilizationRate();
    }

    public int getShortfall(String stationId) {
        return allocation.getShortfall(stationId);
    }

    public Map<String, Integer> getShortfalls() {
        return allocation.getShortfalls();
    }

    public int getTotalShortfall() {
        return allocation.getTotalShortfall();
    }

    @Override
    public String toString() {
        return String.format("Round %d: %s, conflicts=%d, utilization=%.0f%%%s",
            round, allocation, rawConflictCount, getUtilization() * 100,
            isSuccess() ? ", SUCCESS" : "");
    }
}
