package org.carma.slotcoord.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A round that reached full utilization with zero raw conflicts.
 *
 * @param demand entitlements the round was negotiated under
 * @param allocation resolved slots per station
 * @param roundsToSuccess rounds spent under this demand, including the successful one
 * @param round run-wide round number
 * @param timestamp local time, {@code yyyy-MM-dd HH:mm:ss}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SuccessRecord(
        Map<String, Integer> demand,
        Map<String, List<Integer>> allocation,
        int roundsToSuccess,
        int round,
        String timestamp
) {

    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public SuccessRecord {
        demand = demand == null ? Map.of() : new LinkedHashMap<>(demand);
        allocation = allocation == null ? Map.of() : new LinkedHashMap<>(allocation);
    }

    public static SuccessRecord of(Demand demand, Allocation allocation,
                                   int roundsToSuccess, int round, LocalDateTime at) {
        return new SuccessRecord(demand.asMap(), allocation.asMap(), roundsToSuccess, round,
            TIMESTAMP_FORMAT.format(at));
    }
}
