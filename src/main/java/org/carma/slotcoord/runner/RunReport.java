package org.carma.slotcoord.runner;

import org.carma.slotcoord.model.RoundResult;
import org.carma.slotcoord.model.SuccessRecord;
import org.carma.slotcoord.simulation.RunMetrics;

import java.util.*;

/**
 * Outcome of a whole run: every round result, the records it produced and
 * why it stopped.
 */
public class RunReport {

    private final List<RoundResult> rounds;
    private final RunMetrics metrics;
    private final String terminationReason;
    private final int storedRecords;
    private final Map<Integer, Integer> finalHeat;

    public RunReport(List<RoundResult> rounds, RunMetrics metrics, String terminationReason,
                     int storedRecords, Map<Integer, Integer> finalHeat) {
        this.rounds = List.copyOf(rounds);
        this.metrics = metrics;
        this.terminationReason = terminationReason;
        this.storedRecords = storedRecords;
        this.finalHeat = Collections.unmodifiableMap(new TreeMap<>(finalHeat));
    }

    public List<RoundResult> getRounds() {
        return rounds;
    }

    public int getRoundsPlayed() {
        return rounds.size();
    }

    public RunMetrics getMetrics() {
        return metrics;
    }

    public String getTerminationReason() {
        return terminationReason;
    }

    /**
     * Records in the store after the run, including ones loaded at startup.
     */
    public int getStoredRecords() {
        return storedRecords;
    }

    public Map<Integer, Integer> getFinalHeat() {
        return finalHeat;
    }

    /**
     * Success records created during this run, in order.
     */
    public List<SuccessRecord> getNewRecords() {
        List<SuccessRecord> records = new ArrayList<>();
        for (RoundResult result : rounds) {
            result.getSuccessRecord().ifPresent(records::add);
        }
        return records;
    }

    public List<String> getPersistenceErrors() {
        List<String> errors = new ArrayList<>();
        for (RoundResult result : rounds) {
            result.getPersistenceError().ifPresent(errors::add);
        }
        return errors;
    }

    public boolean isConverged() {
        return metrics.isConverged();
    }

    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append("=".repeat(60)).append("\n");
        sb.append("SLOT COORDINATION RUN\n");
        sb.append("=".repeat(60)).append("\n");
        sb.append(String.format("Terminated:           %s%n", terminationReason));
        sb.append(metrics.summary());
        sb.append(String.format("New success records:  %d (store holds %d)%n",
            getNewRecords().size(), storedRecords));
        sb.append(String.format("Final heat:           %s%n", finalHeat));
        for (String error : getPersistenceErrors()) {
            sb.append("  persistence: ").append(error).append("\n");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("RunReport[rounds=%d, successes=%d, reason=%s]",
            rounds.size(), metrics.getSuccessCount(), terminationReason);
    }
}
