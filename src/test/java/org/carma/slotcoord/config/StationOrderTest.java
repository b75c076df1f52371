package org.carma.slotcoord.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StationOrderTest {

    private static final List<String> STATIONS = List.of("A", "B", "C");

    @Test
    void fixedOrderNeverChanges() {
        assertThat(StationOrder.FIXED.orderFor(STATIONS, 1)).containsExactly("A", "B", "C");
        assertThat(StationOrder.FIXED.orderFor(STATIONS, 5)).containsExactly("A", "B", "C");
    }

    @Test
    void rotatingOrderAdvancesFirstMover() {
        assertThat(StationOrder.ROTATING.orderFor(STATIONS, 1)).containsExactly("A", "B", "C");
        assertThat(StationOrder.ROTATING.orderFor(STATIONS, 2)).containsExactly("B", "C", "A");
        assertThat(StationOrder.ROTATING.orderFor(STATIONS, 3)).containsExactly("C", "A", "B");
        assertThat(StationOrder.ROTATING.orderFor(STATIONS, 4)).containsExactly("A", "B", "C");
    }
}
