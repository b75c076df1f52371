package org.carma.slotcoord.model;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

class ResourcePoolTest {

    @Test
    void rejectsEmptyDomain() {
        assertThatThrownBy(() -> new ResourcePool(0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void untouchedSlotsReadAsZero() {
        ResourcePool pool = new ResourcePool(4);

        assertThat(pool.getHeat(3)).isZero();
        assertThat(pool.getConflictCount(3)).isZero();
        assertThat(pool.getHeatMap()).containsExactly(
            entry(0, 0), entry(1, 0), entry(2, 0), entry(3, 0));
        assertThat(pool.getConflictHistory()).isEmpty();
    }

    @Test
    void coolestSlotsOrdersByHeatThenIndex() {
        ResourcePool pool = new ResourcePool(6);
        pool.recordUsage(Map.of("A", List.of(0, 1), "B", List.of(1, 2)));
        pool.recordUsage(Map.of("A", List.of(1)));

        // heat: 0->1, 1->3, 2->1, rest 0
        assertThat(pool.heatRanking()).containsExactly(3, 4, 5, 0, 2, 1);
        assertThat(pool.coolestSlots(2, Set.of(3))).containsExactly(4, 5);
        assertThat(pool.coolestSlots(2, Set.of(3))).isEqualTo(pool.coolestSlots(2, Set.of(3)));
    }

    @Test
    void coolestSlotsReturnsWhatIsLeftWhenShort() {
        ResourcePool pool = new ResourcePool(3);

        assertThat(pool.coolestSlots(5, List.of(1))).containsExactly(0, 2);
        assertThat(pool.coolestSlots(0, List.of())).isEmpty();
    }

    @Test
    void recordConflictsCountsSlotsWantedByMoreThanOneStation() {
        ResourcePool pool = new ResourcePool(8);
        Map<String, List<Integer>> raw = new LinkedHashMap<>();
        raw.put("A", List.of(0, 1, 2));
        raw.put("B", List.of(1, 2, 3));
        raw.put("C", List.of(2, 7));

        int contested = pool.recordConflicts(raw);

        assertThat(contested).isEqualTo(2);
        assertThat(pool.getConflictHistory()).containsExactly(entry(1, 1), entry(2, 1));
    }

    @Test
    void duplicateSlotWithinOneStationIsNotAConflict() {
        ResourcePool pool = new ResourcePool(4);

        assertThat(pool.recordConflicts(Map.of("A", List.of(1, 1)))).isZero();
    }

    @Test
    void feedbackReportsConflictsIdleSlotsAndUtilization() {
        ResourcePool pool = new ResourcePool(8);
        Map<String, List<Integer>> raw = new LinkedHashMap<>();
        raw.put("A", List.of(0, 1, 2));
        raw.put("B", List.of(1, 3, 5));
        Map<String, List<Integer>> resolved = new LinkedHashMap<>();
        resolved.put("A", List.of(0, 1, 2));
        resolved.put("B", List.of(3, 4, 5));

        Feedback feedback = pool.feedback(raw, resolved);

        assertThat(feedback.conflictSlots()).containsExactly(1);
        assertThat(feedback.conflictDetails()).containsEntry(1, List.of("A", "B"));
        assertThat(feedback.idleSlots()).containsExactly(4, 6, 7);
        assertThat(feedback.usedSlots()).containsExactly(0, 1, 2, 3, 4, 5);
        assertThat(feedback.utilizationRate()).isEqualTo(0.75);
        assertThat(feedback.isFullyUtilized()).isFalse();
    }

    @Test
    void neverMutatesCallerCollections() {
        ResourcePool pool = new ResourcePool(4);
        List<Integer> excluded = new ArrayList<>(List.of(0));
        Map<String, List<Integer>> allocation = new HashMap<>();
        allocation.put("A", new ArrayList<>(List.of(0, 1)));

        pool.coolestSlots(2, excluded);
        pool.recordUsage(allocation);
        pool.recordConflicts(allocation);

        assertThat(excluded).containsExactly(0);
        assertThat(allocation.get("A")).containsExactly(0, 1);
    }
}
