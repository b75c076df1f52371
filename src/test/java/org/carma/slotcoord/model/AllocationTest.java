package org.carma.slotcoord.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AllocationTest {

    @Test
    void shortfallIsRequestedMinusGranted() {
        Allocation allocation = new Allocation()
            .assign("A", List.of(0, 1), 2)
            .assign("B", List.of(2), 3);

        assertThat(allocation.getShortfall("A")).isZero();
        assertThat(allocation.getShortfall("B")).isEqualTo(2);
        assertThat(allocation.getTotalShortfall()).isEqualTo(2);
        assertThat(allocation.hasShortfall()).isTrue();
        assertThat(allocation.getTotalAllocated()).isEqualTo(3);
        assertThat(allocation.toString()).contains("B: [2] (short 2)");
    }

    @Test
    void detectsOverlap() {
        Allocation disjoint = new Allocation().assign("A", List.of(0), 1).assign("B", List.of(1), 1);
        Allocation overlapping = new Allocation().assign("A", List.of(0), 1).assign("B", List.of(0), 1);

        assertThat(disjoint.isDisjoint()).isTrue();
        assertThat(overlapping.isDisjoint()).isFalse();
    }

    @Test
    void keepsResolutionOrder() {
        Allocation allocation = new Allocation()
            .assign("C", List.of(0), 1)
            .assign("A", List.of(1), 1);

        assertThat(allocation.getStations()).containsExactly("C", "A");
        assertThat(allocation.asMap().keySet()).containsExactly("C", "A");
    }
}
