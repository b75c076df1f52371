package org.carma.slotcoord.model;

import java.util.*;

/**
 * Final slot assignment of one round.
 *
 * Contains:
 * - Resolved slots per station, in resolution order
 * - Requested size per station, so shortfalls are explicit
 * - Number of collisions each station hit during resolution
 */
public class Allocation {

    private final LinkedHashMap<String, List<Integer>> slots;
    private final Map<String, Integer> requested;
    private final Map<String, Integer> collisions;

    public Allocation() {
        this.slots = new LinkedHashMap<>();
        this.requested = new HashMap<>();
        this.collisions = new HashMap<>();
    }

    // ========================================================================
    // Builder-style setters
    // ========================================================================

    public Allocation assign(String stationId, List<Integer> stationSlots, int requestedSize) {
        slots.put(stationId, List.copyOf(stationSlots));
        requested.put(stationId, requestedSize);
        return this;
    }

    public Allocation setCollisions(String stationId, int count) {
        collisions.put(stationId, count);
        return this;
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public List<Integer> getSlots(String stationId) {
        return slots.getOrDefault(stationId, List.of());
    }

    public List<String> getStations() {
        return new ArrayList<>(slots.keySet());
    }

    public int getRequested(String stationId) {
        return requested.getOrDefault(stationId, 0);
    }

    public int getCollisions(String stationId) {
        return collisions.getOrDefault(stationId, 0);
    }

    /**
     * Slots the station asked for but could not get.
     */
    public int getShortfall(String stationId) {
        return Math.max(0, getRequested(stationId) - getSlots(stationId).size());
    }

    public Map<String, Integer> getShortfalls() {
        Map<String, Integer> result = new LinkedHashMap<>();
        for (String station : slots.keySet()) {
            result.put(station, getShortfall(station));
        }
        return result;
    }

    /**
     * Station to slots, in resolution order.
     */
    public Map<String, List<Integer>> asMap() {
        return Collections.unmodifiableMap(slots);
    }

    // ========================================================================
    // Computed Properties
    // ========================================================================

    public int getTotalAllocated() {
        return slots.values().stream().mapToInt(List::size).sum();
    }

    public int getTotalShortfall() {
        return slots.keySet().stream().mapToInt(this::getShortfall).sum();
    }

    public boolean hasShortfall() {
        return getTotalShortfall() > 0;
    }

    /**
     * True when no slot is held by two stations and no station holds a slot twice.
     */
    public boolean isDisjoint() {
        Set<Integer> seen = new HashSet<>();
        for (List<Integer> stationSlots : slots.values()) {
            for (Integer slot : stationSlots) {
                if (!seen.add(slot)) return false;
            }
        }
        return true;
    }

    // ========================================================================
    // Object Methods
    // ========================================================================

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Allocation[");
        boolean first = true;
        for (Map.Entry<String, List<Integer>> entry : slots.entrySet()) {
            if (!first) sb.append(" | ");
            sb.append(entry.getKey()).append(": ").append(entry.getValue());
            int shortfall = getShortfall(entry.getKey());
            if (shortfall > 0) {
                sb.append(" (short ").append(shortfall).append(")");
            }
            first = false;
        }
        sb.append("]");
        return sb.toString();
    }
}
