package org.carma.slotcoord.model;

import java.util.*;

/**
 * Owns the slot domain {@code [0, numSlots)} together with the counters that
 * accumulate across rounds.
 *
 * The pool tracks:
 * - Heat: how many times each slot ended up in a final allocation
 * - Conflict history: how many rounds each slot was contested pre-resolution
 *
 * Both counters only ever grow. Slots that were never touched read as zero.
 * The pool never mutates the collections passed into it.
 */
public class ResourcePool {

    private final int numSlots;
    private final Map<Integer, Integer> heat;
    private final Map<Integer, Integer> conflictHistory;

    public ResourcePool(int numSlots) {
        if (numSlots < 1) {
            throw new IllegalArgumentException("Pool needs at least one slot, got " + numSlots);
        }
        this.numSlots = numSlots;
        this.heat = new HashMap<>();
        this.conflictHistory = new HashMap<>();
    }

    // ========================================================================
    // Domain Queries
    // ========================================================================

    public int getNumSlots() {
        return numSlots;
    }

    public boolean contains(int slot) {
        return slot >= 0 && slot < numSlots;
    }

    public int getHeat(int slot) {
        return heat.getOrDefault(slot, 0);
    }

    public int getConflictCount(int slot) {
        return conflictHistory.getOrDefault(slot, 0);
    }

    /**
     * Heat of every slot in the domain, including untouched ones.
     */
    public Map<Integer, Integer> getHeatMap() {
        Map<Integer, Integer> snapshot = new TreeMap<>();
        for (int slot = 0; slot < numSlots; slot++) {
            snapshot.put(slot, getHeat(slot));
        }
        return snapshot;
    }

    /**
     * Only slots that have been contested at least once.
     */
    public Map<Integer, Integer> getConflictHistory() {
        return new TreeMap<>(conflictHistory);
    }

    /**
     * Whole domain ordered coolest first, ties by ascending index.
     */
    public List<Integer> heatRanking() {
        return coolestSlots(numSlots, Collections.emptySet());
    }

    /**
     * Returns up to {@code n} slots outside {@code excluding}, ordered by
     * ascending heat with ties broken by ascending index. When fewer than
     * {@code n} slots remain, all of them are returned and the caller has to
     * deal with the shortfall.
     */
    public List<Integer> coolestSlots(int n, Collection<Integer> excluding) {
        if (n <= 0) return new ArrayList<>();
        Set<Integer> excluded = new HashSet<>(excluding);
        List<Integer> candidates = new ArrayList<>();
        for (int slot = 0; slot < numSlots; slot++) {
            if (!excluded.contains(slot)) {
                candidates.add(slot);
            }
        }
        candidates.sort(coolestFirst());
        return new ArrayList<>(candidates.subList(0, Math.min(n, candidates.size())));
    }

    /**
     * Ordering used everywhere a deterministic "coolest" choice is needed.
     */
    public Comparator<Integer> coolestFirst() {
        return Comparator.<Integer>comparingInt(this::getHeat).thenComparingInt(Integer::intValue);
    }

    // ========================================================================
    // Counter Updates
    // ========================================================================

    /**
     * Increment heat once per (station, slot) pair of a final allocation.
     */
    public void recordUsage(Map<String, List<Integer>> allocation) {
        for (List<Integer> slots : allocation.values()) {
            for (Integer slot : slots) {
                if (contains(slot)) {
                    heat.merge(slot, 1, Integer::sum);
                }
            }
        }
    }

    /**
     * Increment conflict history for every slot wanted by more than one
     * station in the pre-resolution proposals.
     *
     * @return number of contested slots this round
     */
    public int recordConflicts(Map<String, List<Integer>> rawProposals) {
        Map<Integer, List<String>> contenders = contenders(rawProposals);
        for (Integer slot : contenders.keySet()) {
            conflictHistory.merge(slot, 1, Integer::sum);
        }
        return contenders.size();
    }

    // ========================================================================
    // Feedback
    // ========================================================================

    /**
     * Builds the read-only round snapshot handed to decision sources.
     *
     * @param rawProposals pre-resolution sets, used for conflicts and idle slots
     * @param finalAllocation resolved allocation, used for utilization
     */
    public Feedback feedback(Map<String, List<Integer>> rawProposals,
                             Map<String, List<Integer>> finalAllocation) {
        Map<Integer, List<String>> contenders = contenders(rawProposals);

        Set<Integer> proposed = new HashSet<>();
        rawProposals.values().forEach(proposed::addAll);
        List<Integer> idle = new ArrayList<>();
        for (int slot = 0; slot < numSlots; slot++) {
            if (!proposed.contains(slot)) idle.add(slot);
        }

        Set<Integer> used = new TreeSet<>();
        for (List<Integer> slots : finalAllocation.values()) {
            for (Integer slot : slots) {
                if (contains(slot)) used.add(slot);
            }
        }

        return new Feedback(
            new ArrayList<>(contenders.keySet()),
            contenders,
            idle,
            new ArrayList<>(used),
            (double) used.size() / numSlots,
            heatRanking());
    }

    private Map<Integer, List<String>> contenders(Map<String, List<Integer>> proposals) {
        Map<Integer, List<String>> users = new TreeMap<>();
        for (Map.Entry<String, List<Integer>> entry : proposals.entrySet()) {
            for (Integer slot : new LinkedHashSet<>(entry.getValue())) {
                users.computeIfAbsent(slot, k -> new ArrayList<>()).add(entry.getKey());
            }
        }
        users.values().removeIf(stations -> stations.size() < 2);
        return users;
    }

    // ========================================================================
    // Object Methods
    // ========================================================================

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ResourcePool[\n");
        for (int slot = 0; slot < numSlots; slot++) {
            sb.append(String.format("  slot %d: heat=%d, conflicts=%d%n",
                slot, getHeat(slot), getConflictCount(slot)));
        }
        sb.append("]");
        return sb.toString();
    }
}
