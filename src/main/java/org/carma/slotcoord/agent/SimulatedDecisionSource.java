package org.carma.slotcoord.agent;

import java.io.IOException;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Stand-in for an LLM agent, for demos and soak runs without API keys.
 *
 * The simulated agent reads the context like a cooperative model would:
 * it skips slots already claimed this round and prefers cool slots. To
 * exercise the engine's recovery paths it can also:
 * - pick a random slot instead of a cool one ({@code noiseRate})
 * - return text the parser cannot use ({@code malformedRate})
 * - throw as if the transport failed ({@code failureRate})
 *
 * Well-formed replies come in the loose dialects real models produce:
 * prose around the object, single quotes, bare keys, full-width commas.
 */
public class SimulatedDecisionSource implements DecisionSource {

    private static final String[] MALFORMED_REPLIES = {
        "I would take the first and the last slot this time.",
        "{slots: [1, 2",
        "```json\n[3, 4]\n```",
        "{\"reason\": \"need more information\"}",
    };

    /**
     * Behaviour knobs.
     */
    public static class Behavior {
        private double noiseRate = 0.2;
        private double malformedRate = 0.0;
        private double failureRate = 0.0;

        public Behavior noiseRate(double rate) {
            this.noiseRate = rate;
            return this;
        }

        public Behavior malformedRate(double rate) {
            this.malformedRate = rate;
            return this;
        }

        public Behavior failureRate(double rate) {
            this.failureRate = rate;
            return this;
        }

        public static Behavior cooperative() {
            return new Behavior().noiseRate(0.0);
        }

        public static Behavior unreliable() {
            return new Behavior().noiseRate(0.3).malformedRate(0.15).failureRate(0.05);
        }
    }

    private final String name;
    private final Behavior behavior;
    private final Random random;

    public SimulatedDecisionSource(String name, Behavior behavior, Random random) {
        this.name = name;
        this.behavior = behavior;
        this.random = random;
    }

    @Override
    public String propose(DecisionContext context) throws Exception {
        if (random.nextDouble() < behavior.failureRate) {
            throw new IOException(name + ": simulated provider failure");
        }
        if (random.nextDouble() < behavior.malformedRate) {
            return MALFORMED_REPLIES[random.nextInt(MALFORMED_REPLIES.length)];
        }
        return render(choose(context));
    }

    // ========================================================================
    // Choice
    // ========================================================================

    private List<Integer> choose(DecisionContext context) {
        Set<Integer> claimed = context.claimedSlotSet();
        List<Integer> picks = new ArrayList<>();
        for (Integer slot : context.heatRanking()) {
            if (picks.size() >= context.entitled()) break;
            if (!claimed.contains(slot)) picks.add(slot);
        }
        for (int i = 0; i < picks.size(); i++) {
            if (random.nextDouble() < behavior.noiseRate) {
                picks.set(i, random.nextInt(context.numSlots()));
            }
        }
        return picks;
    }

    private String render(List<Integer> slots) {
        String list = slots.stream().map(String::valueOf).collect(Collectors.joining(", "));
        switch (random.nextInt(4)) {
            case 0:
                return "{\"slots\": [" + list + "], \"reason\": \"coolest unclaimed slots\"}";
            case 1:
                return "Based on the heat ranking I choose: {'slots': [" + list + "], 'reason': 'low heat'}";
            case 2:
                return "{channels: [" + list + "], reason: \"avoid claimed\"}";
            default:
                return "Proposal -> {\"slots\"：[" + list.replace(", ", "，") + "]}";
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return String.format("SimulatedDecisionSource[%s, noise=%.2f, malformed=%.2f, failure=%.2f]",
            name, behavior.noiseRate, behavior.malformedRate, behavior.failureRate);
    }
}
