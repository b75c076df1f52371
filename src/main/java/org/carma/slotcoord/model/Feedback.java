package org.carma.slotcoord.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only snapshot of one round, exposed to decision sources for the next one.
 *
 * @param conflictSlots slots contested by two or more stations before resolution
 * @param conflictDetails contested slot to the stations that wanted it
 * @param idleSlots slots no station proposed
 * @param usedSlots slots present in the final allocation
 * @param utilizationRate {@code |usedSlots| / numSlots}
 * @param heatRanking the whole domain, coolest first
 */
public record Feedback(
        List<Integer> conflictSlots,
        Map<Integer, List<String>> conflictDetails,
        List<Integer> idleSlots,
        List<Integer> usedSlots,
        double utilizationRate,
        List<Integer> heatRanking
) {

    public Feedback {
        conflictSlots = List.copyOf(conflictSlots);
        conflictDetails = Collections.unmodifiableMap(new TreeMap<>(conflictDetails));
        idleSlots = List.copyOf(idleSlots);
        usedSlots = List.copyOf(usedSlots);
        heatRanking = List.copyOf(heatRanking);
    }

    public boolean isFullyUtilized() {
        return utilizationRate >= 1.0;
    }

    @Override
    public String toString() {
        return String.format("Feedback[conflicts=%s, idle=%s, utilization=%.0f%%]",
            conflictSlots, idleSlots, utilizationRate * 100);
    }
}
