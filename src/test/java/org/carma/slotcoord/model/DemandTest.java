package org.carma.slotcoord.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class DemandTest {

    @Test
    void keepsStationOrderAndTotals() {
        Demand demand = Demand.of(List.of("AP2", "AP1"), new int[] {3, 5});

        assertThat(demand.stations()).containsExactly("AP2", "AP1");
        assertThat(demand.total()).isEqualTo(8);
        assertThat(demand.get("AP1")).isEqualTo(5);
    }

    @Test
    void rejectsEntitlementBelowOne() {
        assertThatThrownBy(() -> new Demand(Map.of("AP1", 0)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("AP1");
    }

    @Test
    void unknownStationIsAnError() {
        Demand demand = new Demand(Map.of("AP1", 2));

        assertThatThrownBy(() -> demand.get("AP9")).isInstanceOf(IllegalArgumentException.class);
    }
}
