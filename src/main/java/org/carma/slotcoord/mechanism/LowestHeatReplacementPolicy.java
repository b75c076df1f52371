package org.carma.slotcoord.mechanism;

import org.carma.slotcoord.model.ResourcePool;

import java.util.Collections;
import java.util.List;

/**
 * Coolest candidate, lowest index on ties. Same pool state, same answer.
 */
public class LowestHeatReplacementPolicy implements ReplacementPolicy {

    @Override
    public int pickReplacement(List<Integer> candidates, ResourcePool pool) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("No candidates to pick from");
        }
        return Collections.min(candidates, pool.coolestFirst());
    }

    @Override
    public String toString() {
        return "LowestHeatReplacementPolicy";
    }
}
