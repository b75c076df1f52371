package org.carma.slotcoord.model;

import java.util.List;

/**
 * A proposal repaired to exactly the entitled number of slots.
 *
 * @param slots sorted slots, in range; unique unless {@code degenerate}
 * @param fallback true when any slot came from heat-aware or random backfill
 * @param degenerate true when the domain was too small and duplicates were reintroduced
 */
public record ValidatedSet(List<Integer> slots, boolean fallback, boolean degenerate) {

    public ValidatedSet {
        slots = List.copyOf(slots);
    }

    public int size() {
        return slots.size();
    }
}
