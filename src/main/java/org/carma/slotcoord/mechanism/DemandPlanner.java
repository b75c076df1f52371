package org.carma.slotcoord.mechanism;

import org.carma.slotcoord.model.Demand;

import java.util.List;

/**
 * Decides how many slots each station may request for the coming rounds.
 */
public interface DemandPlanner {

    /**
     * Generate an entitlement for every station, in the given station order.
     *
     * @param stationIds stations taking part, in coordination order
     * @param numSlots size of the slot domain
     * @return demand with one entry per station, every value at least 1
     * @throws org.carma.slotcoord.config.ConfigurationException if the stations cannot all be served
     */
    Demand generateDemand(List<String> stationIds, int numSlots);

    /**
     * Problems that would make {@link #generateDemand} fail for these
     * stations. Checked once when a coordinator is built.
     *
     * @return error messages, empty if the planner can serve the stations
     */
    default List<String> checkStations(List<String> stationIds, int numSlots) {
        return List.of();
    }
}
