package org.carma.slotcoord.mechanism;

import org.carma.slotcoord.mechanism.ConflictResolver.Candidate;
import org.carma.slotcoord.model.Allocation;
import org.carma.slotcoord.model.ResourcePool;
import org.carma.slotcoord.model.ValidatedSet;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

class ConflictResolverTest {

    @Test
    void replacesCollisionWithCoolestSlotOutsideOwnCandidates() {
        ResourcePool pool = new ResourcePool(8);
        // heat: 4 -> 1, 5 -> 0, 6 -> 2, 7 -> 2
        pool.recordUsage(Map.of("x", List.of(4, 6, 7)));
        pool.recordUsage(Map.of("x", List.of(6, 7)));
        ConflictResolver resolver = new ConflictResolver(pool, new LowestHeatReplacementPolicy());

        Allocation allocation = resolver.resolve(List.of(
            new Candidate("A", List.of(0, 1, 2)),
            new Candidate("B", List.of(1, 3, 5))));

        assertThat(allocation.getSlots("A")).containsExactly(0, 1, 2);
        assertThat(allocation.getSlots("B")).containsExactly(3, 4, 5);
        assertThat(allocation.getCollisions("B")).isEqualTo(1);
        assertThat(allocation.getShortfall("B")).isZero();
    }

    @Test
    void firstStationWinsContestedSlots() {
        ResourcePool pool = new ResourcePool(4);
        ConflictResolver resolver = new ConflictResolver(pool, new LowestHeatReplacementPolicy());
        Map<String, ValidatedSet> sets = new LinkedHashMap<>();
        sets.put("B", new ValidatedSet(List.of(0, 1), false, false));
        sets.put("A", new ValidatedSet(List.of(0, 1), false, false));

        Allocation allocation = resolver.resolve(sets);

        assertThat(allocation.getStations()).containsExactly("B", "A");
        assertThat(allocation.getSlots("B")).containsExactly(0, 1);
        assertThat(allocation.getSlots("A")).containsExactly(2, 3);
    }

    @Test
    void leavesStationShortWhenPoolIsExhausted() {
        ResourcePool pool = new ResourcePool(4);
        ConflictResolver resolver = new ConflictResolver(pool, new LowestHeatReplacementPolicy());

        Allocation allocation = resolver.resolve(List.of(
            new Candidate("A", List.of(0, 1)),
            new Candidate("B", List.of(1, 2)),
            new Candidate("C", List.of(2, 3))));

        assertThat(allocation.isDisjoint()).isTrue();
        assertThat(allocation.getTotalAllocated()).isEqualTo(4);
        assertThat(allocation.getTotalShortfall()).isEqualTo(2);
        assertThat(allocation.getSlots("C")).isEmpty();
        assertThat(allocation.getShortfall("C")).isEqualTo(2);
    }

    @Test
    void degenerateDuplicatesAreResolvedToo() {
        ResourcePool pool = new ResourcePool(3);
        ConflictResolver resolver = new ConflictResolver(pool, new LowestHeatReplacementPolicy());

        Allocation allocation = resolver.resolve(List.of(new Candidate("A", List.of(0, 0, 1, 2, 2))));

        assertThat(allocation.getSlots("A")).containsExactly(0, 1, 2);
        assertThat(allocation.getShortfall("A")).isEqualTo(2);
    }

    @Test
    void allocationsAreAlwaysDisjoint() {
        Random random = new Random(3);
        for (ReplacementPolicy policy : List.of(new LowestHeatReplacementPolicy(), new RandomReplacementPolicy(random))) {
            for (int trial = 0; trial < 300; trial++) {
                int numSlots = 1 + random.nextInt(10);
                ResourcePool pool = new ResourcePool(numSlots);
                ConflictResolver resolver = new ConflictResolver(pool, policy);
                List<Candidate> candidates = new ArrayList<>();
                int stations = 1 + random.nextInt(numSlots);
                for (int s = 0; s < stations; s++) {
                    List<Integer> slots = new ArrayList<>();
                    int size = 1 + random.nextInt(numSlots);
                    for (int i = 0; i < size; i++) slots.add(random.nextInt(numSlots));
                    candidates.add(new Candidate("S" + s, slots));
                }

                Allocation allocation = resolver.resolve(candidates);
                pool.recordUsage(allocation.asMap());

                assertThat(allocation.isDisjoint()).isTrue();
                assertThat(allocation.getStations()).hasSize(stations);
                for (Candidate candidate : candidates) {
                    assertThat(allocation.getSlots(candidate.stationId()))
                        .isSorted()
                        .allMatch(pool::contains)
                        .hasSizeLessThanOrEqualTo(candidate.slots().size());
                }
            }
        }
    }

    @Test
    void randomPolicyPicksAFreeSlot() {
        ResourcePool pool = new ResourcePool(6);
        ConflictResolver resolver = new ConflictResolver(pool, new RandomReplacementPolicy(new Random(11)));

        Allocation allocation = resolver.resolve(List.of(
            new Candidate("A", List.of(0, 1)),
            new Candidate("B", List.of(0))));

        assertThat(allocation.getSlots("B")).hasSize(1);
        assertThat(allocation.getSlots("B").get(0)).isIn(2, 3, 4, 5);
    }

    @Test
    void rejectsStationListedTwice() {
        ConflictResolver resolver = new ConflictResolver(new ResourcePool(4), new LowestHeatReplacementPolicy());

        assertThatThrownBy(() -> resolver.resolve(List.of(
            new Candidate("A", List.of(0)),
            new Candidate("A", List.of(1)))))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void leavesPoolUntouched() {
        ResourcePool pool = new ResourcePool(4);
        new ConflictResolver(pool, new LowestHeatReplacementPolicy())
            .resolve(List.of(new Candidate("A", List.of(0, 1))));

        assertThat(pool.getHeatMap().values()).containsOnly(0);
    }
}
