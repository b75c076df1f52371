package org.carma.slotcoord.mechanism;

import org.carma.slotcoord.model.ResourcePool;

import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Uniform choice among the free slots, ignoring heat.
 */
public class RandomReplacementPolicy implements ReplacementPolicy {

    private final Random random;

    public RandomReplacementPolicy(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public int pickReplacement(List<Integer> candidates, ResourcePool pool) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("No candidates to pick from");
        }
        return candidates.get(random.nextInt(candidates.size()));
    }

    @Override
    public String toString() {
        return "RandomReplacementPolicy";
    }
}
