package org.carma.slotcoord.model;

import java.util.*;

/**
 * Slot entitlement per station for the current demand epoch.
 *
 * Iteration order is the station order the demand was built with. Every
 * entitlement is at least one slot.
 */
public final class Demand {

    private final LinkedHashMap<String, Integer> entitlements;

    public Demand(Map<String, Integer> entitlements) {
        if (entitlements.isEmpty()) {
            throw new IllegalArgumentException("Demand needs at least one station");
        }
        for (Map.Entry<String, Integer> entry : entitlements.entrySet()) {
            Integer value = entry.getValue();
            if (value == null || value < 1) {
                throw new IllegalArgumentException(
                    "Demand for " + entry.getKey() + " must be >= 1, got " + value);
            }
        }
        this.entitlements = new LinkedHashMap<>(entitlements);
    }

    /**
     * Build from parallel station/value lists.
     */
    public static Demand of(List<String> stationIds, int[] values) {
        if (stationIds.size() != values.length) {
            throw new IllegalArgumentException("Expected " + stationIds.size() + " values, got " + values.length);
        }
        Map<String, Integer> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(stationIds.get(i), values[i]);
        }
        return new Demand(map);
    }

    public int get(String stationId) {
        Integer value = entitlements.get(stationId);
        if (value == null) {
            throw new IllegalArgumentException("No demand for station " + stationId);
        }
        return value;
    }

    public List<String> stations() {
        return new ArrayList<>(entitlements.keySet());
    }

    public int total() {
        return entitlements.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int size() {
        return entitlements.size();
    }

    public Map<String, Integer> asMap() {
        return Collections.unmodifiableMap(entitlements);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Demand)) return false;
        return entitlements.equals(((Demand) o).entitlements);
    }

    @Override
    public int hashCode() {
        return entitlements.hashCode();
    }

    @Override
    public String toString() {
        return "Demand" + entitlements;
    }
}
