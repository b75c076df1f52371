package org.carma.slotcoord.agent;

/**
 * External collaborator that proposes slots for one station.
 *
 * This is the seam where an LLM-backed agent plugs in. The engine assumes
 * nothing about the reply beyond it being text that hopefully contains a
 * JSON-like object with a list of slot indices, e.g.
 * <pre>
 * Taking the coolest edge slots: {"slots": [0, 7], "reason": "low heat"}
 * </pre>
 *
 * Implementations may block, throw, or return garbage; the coordinator
 * bounds each call with a timeout and falls back on any failure. A long
 * running call should respond to thread interruption.
 */
public interface DecisionSource {

    /**
     * Ask for a slot proposal.
     *
     * @param context state the station may base its choice on
     * @return free-form reply text
     * @throws Exception on any transport or provider failure
     */
    String propose(DecisionContext context) throws Exception;

    /**
     * Name for logs.
     */
    String getName();
}
