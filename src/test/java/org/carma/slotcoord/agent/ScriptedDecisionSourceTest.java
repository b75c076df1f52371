package org.carma.slotcoord.agent;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ScriptedDecisionSourceTest {

    private static DecisionContext context(int round) {
        return new DecisionContext("AP1", round, 1, 4, Map.of("AP1", 1),
            List.of(0, 1, 2, 3), Map.of(), Map.of(), Map.of(), null);
    }

    @Test
    void repliesInOrderThenRepeatsTheLastStep() throws Exception {
        ScriptedDecisionSource source = new ScriptedDecisionSource("AP1")
            .replySlots(0, 2)
            .reply("no idea");

        assertThat(source.propose(context(1))).isEqualTo("{\"slots\": [0, 2], \"reason\": \"scripted\"}");
        assertThat(source.propose(context(2))).isEqualTo("no idea");
        assertThat(source.propose(context(3))).isEqualTo("no idea");
        assertThat(source.getCallCount()).isEqualTo(3);
        assertThat(source.getReceived()).extracting(DecisionContext::round).containsExactly(1, 2, 3);
    }

    @Test
    void failStepThrows() {
        ScriptedDecisionSource source = new ScriptedDecisionSource("AP1").fail("connection reset");

        assertThatThrownBy(() -> source.propose(context(1)))
            .isInstanceOf(IOException.class)
            .hasMessage("connection reset");
    }

    @Test
    void emptyScriptRepliesWithNothing() throws Exception {
        assertThat(new ScriptedDecisionSource("AP1").propose(context(1))).isEmpty();
    }

    @Test
    void stepSeesTheContext() throws Exception {
        ScriptedDecisionSource source = new ScriptedDecisionSource("AP1")
            .step(ctx -> "{\"slots\": [" + ctx.heatRanking().get(0) + "]}");

        assertThat(source.propose(context(1))).isEqualTo("{\"slots\": [0]}");
    }
}
