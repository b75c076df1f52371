package org.carma.slotcoord.agent;

import java.io.IOException;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Replays a fixed script of replies, one step per query.
 *
 * Once the script is exhausted the last step repeats; an empty script
 * answers with an empty reply. Every context received is kept for
 * inspection.
 *
 * <pre>
 * ScriptedDecisionSource source = new ScriptedDecisionSource("AP1")
 *     .replySlots(0, 1)
 *     .reply("sorry, no idea")
 *     .fail("connection reset");
 * </pre>
 */
public class ScriptedDecisionSource implements DecisionSource {

    /**
     * One scripted answer.
     */
    @FunctionalInterface
    public interface Step {
        String answer(DecisionContext context) throws Exception;
    }

    private final String name;
    private final List<Step> steps;
    private final List<DecisionContext> received;
    private int cursor;

    public ScriptedDecisionSource(String name) {
        this.name = name;
        this.steps = new ArrayList<>();
        this.received = Collections.synchronizedList(new ArrayList<>());
    }

    // ========================================================================
    // Script Building
    // ========================================================================

    public ScriptedDecisionSource reply(String text) {
        steps.add(context -> text);
        return this;
    }

    /**
     * Well-formed JSON reply proposing the given slots.
     */
    public ScriptedDecisionSource replySlots(int... slots) {
        String list = Arrays.stream(slots).mapToObj(String::valueOf).collect(Collectors.joining(", "));
        return reply("{\"slots\": [" + list + "], \"reason\": \"scripted\"}");
    }

    public ScriptedDecisionSource fail(String message) {
        steps.add(context -> {
            throw new IOException(message);
        });
        return this;
    }

    public ScriptedDecisionSource step(Step step) {
        steps.add(step);
        return this;
    }

    // ========================================================================
    // DecisionSource
    // ========================================================================

    @Override
    public String propose(DecisionContext context) throws Exception {
        received.add(context);
        Step step;
        synchronized (this) {
            if (steps.isEmpty()) return "";
            step = steps.get(Math.min(cursor, steps.size() - 1));
            cursor++;
        }
        return step.answer(context);
    }

    @Override
    public String getName() {
        return name;
    }

    public List<DecisionContext> getReceived() {
        return new ArrayList<>(received);
    }

    public int getCallCount() {
        return received.size();
    }

    @Override
    public String toString() {
        return String.format("ScriptedDecisionSource[%s, steps=%d, calls=%d]", name, steps.size(), received.size());
    }
}
