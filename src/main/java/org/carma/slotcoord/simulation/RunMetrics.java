package org.carma.slotcoord.simulation;

import org.carma.slotcoord.model.RoundResult;

import java.util.*;

/**
 * Tracks round outcomes over a run and detects convergence.
 *
 * A run is converged once {@code convergenceThreshold} consecutive rounds
 * finished without raw conflicts.
 */
public class RunMetrics {

    private final int convergenceThreshold;
    private final List<Double> utilizationHistory;
    private final List<Integer> conflictHistory;
    private final List<Integer> shortfallHistory;
    private final List<Integer> fallbackHistory;
    private final List<String> persistenceErrors;
    private int successCount;
    private int conflictFreeStreak;
    private int longestStreak;
    private final long startTimeMs;

    public RunMetrics(int convergenceThreshold) {
        if (convergenceThreshold < 1) {
            throw new IllegalArgumentException("Convergence threshold must be >= 1, got " + convergenceThreshold);
        }
        this.convergenceThreshold = convergenceThreshold;
        this.utilizationHistory = new ArrayList<>();
        this.conflictHistory = new ArrayList<>();
        this.shortfallHistory = new ArrayList<>();
        this.fallbackHistory = new ArrayList<>();
        this.persistenceErrors = new ArrayList<>();
        this.startTimeMs = System.currentTimeMillis();
    }

    // ========================================================================
    // Recording
    // ========================================================================

    public void recordRound(RoundResult result) {
        utilizationHistory.add(result.getUtilization());
        conflictHistory.add(result.getRawConflictCount());
        shortfallHistory.add(result.getTotalShortfall());
        fallbackHistory.add(result.getFallbackStations().size());
        result.getPersistenceError().ifPresent(persistenceErrors::add);
        if (result.isSuccess()) {
            successCount++;
        }
        if (result.getRawConflictCount() == 0) {
            conflictFreeStreak++;
            longestStreak = Math.max(longestStreak, conflictFreeStreak);
        } else {
            conflictFreeStreak = 0;
        }
    }

    // ========================================================================
    // Analysis
    // ========================================================================

    public int getRoundCount() {
        return utilizationHistory.size();
    }

    public int getSuccessCount() {
        return successCount;
    }

    public int getTotalConflicts() {
        return conflictHistory.stream().mapToInt(Integer::intValue).sum();
    }

    public int getTotalShortfall() {
        return shortfallHistory.stream().mapToInt(Integer::intValue).sum();
    }

    public int getTotalFallbacks() {
        return fallbackHistory.stream().mapToInt(Integer::intValue).sum();
    }

    public double getAverageUtilization() {
        return utilizationHistory.stream().mapToDouble(Double::doubleValue).average().orElse(0);
    }

    public double getBestUtilization() {
        return utilizationHistory.stream().mapToDouble(Double::doubleValue).max().orElse(0);
    }

    public int getConflictFreeStreak() {
        return conflictFreeStreak;
    }

    public int getLongestStreak() {
        return longestStreak;
    }

    public boolean isConverged() {
        return conflictFreeStreak >= convergenceThreshold;
    }

    public List<Double> getUtilizationHistory() {
        return new ArrayList<>(utilizationHistory);
    }

    public List<String> getPersistenceErrors() {
        return new ArrayList<>(persistenceErrors);
    }

    public long getElapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    // ========================================================================
    // Reporting
    // ========================================================================

    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Rounds played:        %d%n", getRoundCount()));
        sb.append(String.format("Successful rounds:    %d%n", successCount));
        sb.append(String.format("Raw conflicts:        %d%n", getTotalConflicts()));
        sb.append(String.format("Slot shortfall:       %d%n", getTotalShortfall()));
        sb.append(String.format("Fallback proposals:   %d%n", getTotalFallbacks()));
        sb.append(String.format("Average utilization:  %.1f%%%n", getAverageUtilization() * 100));
        sb.append(String.format("Best utilization:     %.1f%%%n", getBestUtilization() * 100));
        sb.append(String.format("Conflict-free streak: %d (longest %d, converged=%s)%n",
            conflictFreeStreak, longestStreak, isConverged()));
        sb.append(String.format("Elapsed:              %.2fs%n", getElapsedMs() / 1000.0));
        if (!persistenceErrors.isEmpty()) {
            sb.append(String.format("Persistence errors:   %d%n", persistenceErrors.size()));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("RunMetrics[rounds=%d, successes=%d, avgUtil=%.2f, streak=%d]",
            getRoundCount(), successCount, getAverageUtilization(), conflictFreeStreak);
    }
}
