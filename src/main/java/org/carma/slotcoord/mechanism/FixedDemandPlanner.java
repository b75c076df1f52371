package org.carma.slotcoord.mechanism;

import org.carma.slotcoord.config.ConfigurationException;
import org.carma.slotcoord.model.Demand;

import java.util.*;

/**
 * Always hands out the same preset demand.
 *
 * The preset may oversubscribe the pool; the resolver then leaves some
 * stations short. Stations must match the run's stations exactly.
 */
public class FixedDemandPlanner implements DemandPlanner {

    private final Demand demand;

    public FixedDemandPlanner(Demand demand) {
        this.demand = Objects.requireNonNull(demand, "demand");
    }

    public FixedDemandPlanner(Map<String, Integer> entitlements) {
        this(new Demand(entitlements));
    }

    @Override
    public Demand generateDemand(List<String> stationIds, int numSlots) {
        List<String> errors = checkStations(stationIds, numSlots);
        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }
        Map<String, Integer> ordered = new LinkedHashMap<>();
        for (String station : stationIds) {
            ordered.put(station, demand.get(station));
        }
        return new Demand(ordered);
    }

    @Override
    public List<String> checkStations(List<String> stationIds, int numSlots) {
        List<String> errors = new ArrayList<>();
        if (stationIds.size() > numSlots) {
            errors.add("Cannot give " + stationIds.size() + " stations at least one slot each from "
                + numSlots + " slots");
        }
        if (!new HashSet<>(stationIds).equals(new HashSet<>(demand.stations()))) {
            errors.add("Fixed demand covers " + demand.stations() + " but stations are " + stationIds);
        }
        return errors;
    }

    @Override
    public String toString() {
        return "FixedDemandPlanner[" + demand + "]";
    }
}
