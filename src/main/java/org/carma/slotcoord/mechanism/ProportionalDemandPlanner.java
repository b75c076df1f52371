package org.carma.slotcoord.mechanism;

import org.carma.slotcoord.config.ConfigurationException;
import org.carma.slotcoord.model.Demand;

import java.util.*;

/**
 * Random traffic weights stretched or squeezed to cover the whole pool.
 *
 * Each station draws a base weight in {@code [minBase, maxBase]}. When the
 * bases fit in the pool, the remainder is shared out in proportion to the
 * bases; otherwise the bases are scaled down (floor, minimum 1). Rounding
 * drift is corrected one unit at a time on randomly chosen stations, so the
 * result always sums to exactly {@code numSlots} with every value >= 1.
 */
public class ProportionalDemandPlanner implements DemandPlanner {

    public static final int DEFAULT_MIN_BASE = 1;
    public static final int DEFAULT_MAX_BASE = 4;

    private final Random random;
    private final int minBase;
    private final int maxBase;

    public ProportionalDemandPlanner(Random random) {
        this(random, DEFAULT_MIN_BASE, DEFAULT_MAX_BASE);
    }

    public ProportionalDemandPlanner(Random random, int minBase, int maxBase) {
        if (minBase < 1 || maxBase < minBase) {
            throw new IllegalArgumentException(
                "Base range must satisfy 1 <= min <= max, got [" + minBase + ", " + maxBase + "]");
        }
        this.random = random;
        this.minBase = minBase;
        this.maxBase = maxBase;
    }

    @Override
    public Demand generateDemand(List<String> stationIds, int numSlots) {
        int n = stationIds.size();
        if (n < 1) {
            throw new ConfigurationException("At least one station is required");
        }
        if (n > numSlots) {
            throw new ConfigurationException(
                "Cannot give " + n + " stations at least one slot each from " + numSlots + " slots");
        }

        int[] base = new int[n];
        for (int i = 0; i < n; i++) {
            base[i] = minBase + random.nextInt(maxBase - minBase + 1);
        }
        int total = Arrays.stream(base).sum();

        int[] values = total <= numSlots
            ? distributeRemainder(base, total, numSlots)
            : scaleDown(base, total, numSlots);

        return Demand.of(stationIds, values);
    }

    // ========================================================================
    // Expansion: bases fit, hand out the remainder
    // ========================================================================

    private int[] distributeRemainder(int[] base, int total, int numSlots) {
        int n = base.length;
        int remainder = numSlots - total;
        int[] additions = new int[n];
        for (int i = 0; i < n; i++) {
            additions[i] = (int) Math.round(remainder * (double) base[i] / total);
        }

        int drift = remainder - Arrays.stream(additions).sum();
        while (drift != 0) {
            if (drift > 0) {
                additions[random.nextInt(n)]++;
                drift--;
            } else {
                int idx = pickWhere(additions, 0);
                additions[idx]--;
                drift++;
            }
        }

        int[] result = new int[n];
        for (int i = 0; i < n; i++) {
            result[i] = base[i] + additions[i];
        }
        return result;
    }

    // ========================================================================
    // Contraction: bases overflow the pool
    // ========================================================================

    private int[] scaleDown(int[] base, int total, int numSlots) {
        int n = base.length;
        int[] scaled = new int[n];
        for (int i = 0; i < n; i++) {
            scaled[i] = Math.max(1, (int) Math.floor((double) base[i] * numSlots / total));
        }

        int drift = numSlots - Arrays.stream(scaled).sum();
        while (drift != 0) {
            if (drift > 0) {
                scaled[random.nextInt(n)]++;
                drift--;
            } else {
                int idx = pickWhere(scaled, 1);
                scaled[idx]--;
                drift++;
            }
        }
        return scaled;
    }

    /**
     * Random index whose value is strictly above {@code floor}.
     */
    private int pickWhere(int[] values, int floor) {
        List<Integer> eligible = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (values[i] > floor) eligible.add(i);
        }
        if (eligible.isEmpty()) {
            throw new IllegalStateException("No station can give up a slot: " + Arrays.toString(values));
        }
        return eligible.get(random.nextInt(eligible.size()));
    }

    @Override
    public String toString() {
        return String.format("ProportionalDemandPlanner[base=%d..%d]", minBase, maxBase);
    }
}
