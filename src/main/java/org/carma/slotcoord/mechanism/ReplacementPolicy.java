package org.carma.slotcoord.mechanism;

import org.carma.slotcoord.model.ResourcePool;

import java.util.List;
import java.util.Random;

/**
 * Chooses which free slot replaces a collided one.
 */
public interface ReplacementPolicy {

    /**
     * @param candidates free slots, never empty
     * @param pool pool whose heat may inform the choice
     * @return one element of {@code candidates}
     */
    int pickReplacement(List<Integer> candidates, ResourcePool pool);

    /**
     * Policy names accepted in configuration.
     */
    enum Kind {
        LOWEST_HEAT,
        RANDOM;

        public ReplacementPolicy create(Random random) {
            switch (this) {
                case RANDOM:
                    return new RandomReplacementPolicy(random);
                case LOWEST_HEAT:
                default:
                    return new LowestHeatReplacementPolicy();
            }
        }
    }
}
