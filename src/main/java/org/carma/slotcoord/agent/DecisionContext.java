package org.carma.slotcoord.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.carma.slotcoord.model.Feedback;

import java.util.*;

/**
 * Request payload for one station's query.
 *
 * @param stationId the station being asked
 * @param round run-wide round number, 1-based
 * @param entitled how many slots the station should propose
 * @param numSlots domain size
 * @param demand every station's entitlement this round
 * @param heatRanking domain ordered coolest first
 * @param heat usage count per slot
 * @param conflictHistory contested-round count per slot (only contested slots)
 * @param claimedSlots sets provisionally claimed by stations queried earlier this round
 * @param lastFeedback previous round's feedback, null on the first round
 */
public record DecisionContext(
        String stationId,
        int round,
        int entitled,
        int numSlots,
        Map<String, Integer> demand,
        List<Integer> heatRanking,
        Map<Integer, Integer> heat,
        Map<Integer, Integer> conflictHistory,
        Map<String, List<Integer>> claimedSlots,
        Feedback lastFeedback
) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public DecisionContext {
        demand = Collections.unmodifiableMap(new LinkedHashMap<>(demand));
        heatRanking = List.copyOf(heatRanking);
        heat = Collections.unmodifiableMap(new TreeMap<>(heat));
        conflictHistory = Collections.unmodifiableMap(new TreeMap<>(conflictHistory));
        claimedSlots = Collections.unmodifiableMap(new LinkedHashMap<>(claimedSlots));
    }

    /**
     * Union of every slot claimed earlier in this round.
     */
    public Set<Integer> claimedSlotSet() {
        Set<Integer> all = new TreeSet<>();
        claimedSlots.values().forEach(all::addAll);
        return all;
    }

    /**
     * JSON rendering handed to text-based decision sources.
     */
    public String toPayload() {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("station", stationId);
        root.put("round", round);
        root.put("entitled", entitled);
        root.put("numSlots", numSlots);
        root.set("demand", MAPPER.valueToTree(demand));
        root.set("heatRanking", MAPPER.valueToTree(heatRanking));
        root.set("heat", MAPPER.valueToTree(heat));
        root.set("conflictHistory", MAPPER.valueToTree(conflictHistory));
        root.set("claimedSlots", MAPPER.valueToTree(claimedSlots));
        if (lastFeedback != null) {
            ObjectNode feedback = root.putObject("lastFeedback");
            feedback.set("conflictSlots", MAPPER.valueToTree(lastFeedback.conflictSlots()));
            feedback.set("conflictDetails", MAPPER.valueToTree(lastFeedback.conflictDetails()));
            feedback.set("idleSlots", MAPPER.valueToTree(lastFeedback.idleSlots()));
            feedback.put("utilizationRate", lastFeedback.utilizationRate());
        } else {
            root.putNull("lastFeedback");
        }
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render decision context", e);
        }
    }
}
