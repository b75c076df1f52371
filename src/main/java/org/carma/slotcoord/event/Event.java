package org.carma.slotcoord.event;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Base interface for round lifecycle events.
 * Events give observers an audit trail without coupling them to the coordinator.
 */
public sealed interface Event permits
        Event.DemandGeneratedEvent,
        Event.ProposalFallbackEvent,
        Event.RoundResolvedEvent,
        Event.SuccessRecordedEvent,
        Event.PersistenceFailedEvent,
        Event.RunTerminatedEvent {

    Instant timestamp();
    String eventType();

    // ========================================================================
    // Event Types
    // ========================================================================

    /**
     * New entitlements for the coming rounds.
     */
    record DemandGeneratedEvent(
            Instant timestamp,
            int round,
            Map<String, Integer> demand
    ) implements Event {
        public String eventType() { return "DEMAND_GENERATED"; }
    }

    /**
     * A station's reply was unusable, failed or timed out and backfill took over.
     */
    record ProposalFallbackEvent(
            Instant timestamp,
            int round,
            String stationId,
            String reason
    ) implements Event {
        public String eventType() { return "PROPOSAL_FALLBACK"; }
    }

    /**
     * A round finished resolution and the pool was updated.
     */
    record RoundResolvedEvent(
            Instant timestamp,
            int round,
            Map<String, List<Integer>> allocation,
            List<Integer> conflictSlots,
            Map<String, Integer> shortfalls,
            double utilizationRate
    ) implements Event {
        public String eventType() { return "ROUND_RESOLVED"; }
    }

    /**
     * A round achieved full utilization with no raw conflicts.
     */
    record SuccessRecordedEvent(
            Instant timestamp,
            int round,
            int roundsToSuccess,
            int totalRecords
    ) implements Event {
        public String eventType() { return "SUCCESS_RECORDED"; }
    }

    /**
     * The success record could not be written; the run continues.
     */
    record PersistenceFailedEvent(
            Instant timestamp,
            int round,
            String error
    ) implements Event {
        public String eventType() { return "PERSISTENCE_FAILED"; }
    }

    /**
     * The coordinator stopped issuing rounds.
     */
    record RunTerminatedEvent(
            Instant timestamp,
            int roundsPlayed,
            String reason
    ) implements Event {
        public String eventType() { return "RUN_TERMINATED"; }
    }
}
