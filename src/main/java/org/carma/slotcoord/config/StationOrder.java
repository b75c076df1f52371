package org.carma.slotcoord.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Order in which stations are queried and resolved each round.
 */
public enum StationOrder {

    /** Configured order every round; the first station always moves first. */
    FIXED,

    /** First mover advances by one station each round. */
    ROTATING;

    /**
     * Station order for a 1-based round number.
     */
    public List<String> orderFor(List<String> stations, int round) {
        List<String> ordered = new ArrayList<>(stations);
        if (this == ROTATING && !ordered.isEmpty()) {
            Collections.rotate(ordered, -((round - 1) % ordered.size()));
        }
        return ordered;
    }
}
