package org.carma.slotcoord.mechanism;

import org.carma.slotcoord.model.RawProposal;
import org.carma.slotcoord.model.ResourcePool;
import org.carma.slotcoord.model.ValidatedSet;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

class ProposalValidatorTest {

    private final ProposalValidator validator = new ProposalValidator(new Random(7));

    @Test
    void dropsDuplicatesAndOutOfRangeThenBackfillsCoolest() {
        ResourcePool pool = new ResourcePool(8);

        ValidatedSet set = validator.validate(RawProposal.of(List.of(1, 2, 2, 9)), 3, pool);

        assertThat(set.slots()).containsExactly(0, 1, 2);
        assertThat(set.fallback()).isTrue();
        assertThat(set.degenerate()).isFalse();
    }

    @Test
    void backfillPrefersCoolSlots() {
        ResourcePool pool = new ResourcePool(6);
        pool.recordUsage(Map.of("A", List.of(0, 1, 2)));

        ValidatedSet set = validator.validate(RawProposal.of(List.of(5)), 3, pool);

        assertThat(set.slots()).containsExactly(3, 4, 5);
    }

    @Test
    void wellFormedSetPassesThroughSorted() {
        ResourcePool pool = new ResourcePool(8);

        ValidatedSet first = validator.validate(RawProposal.of(List.of(6, 2, 4)), 3, pool);
        ValidatedSet again = validator.validate(RawProposal.of(new ArrayList<>(first.slots())), 3, pool);

        assertThat(first.slots()).containsExactly(2, 4, 6);
        assertThat(first.fallback()).isFalse();
        assertThat(again.slots()).isEqualTo(first.slots());
    }

    @Test
    void truncatesLongProposalsToLowestIndices() {
        ResourcePool pool = new ResourcePool(8);

        ValidatedSet set = validator.validate(RawProposal.of(List.of(7, 1, 5, 3)), 2, pool);

        assertThat(set.slots()).containsExactly(1, 3);
    }

    @Test
    void coercesNumericStringsAndTruncatesFractions() {
        ResourcePool pool = new ResourcePool(8);

        ValidatedSet set = validator.validate(RawProposal.of(List.of("5", "3.0", 2.9, -0.5, "x", true)), 4, pool);

        assertThat(set.slots()).containsExactly(0, 2, 3, 5);
    }

    @Test
    void coerceRejectsNonNumbers() {
        assertThat(ProposalValidator.coerce("7.9")).isEqualTo(7);
        assertThat(ProposalValidator.coerce(4L)).isEqualTo(4);
        assertThat(ProposalValidator.coerce("seven")).isNull();
        assertThat(ProposalValidator.coerce(null)).isNull();
        assertThat(ProposalValidator.coerce(List.of(1))).isNull();
        assertThat(ProposalValidator.coerce(Double.NaN)).isNull();
    }

    @Test
    void unusableProposalIsFullyBackfilled() {
        ResourcePool pool = new ResourcePool(5);

        ValidatedSet set = validator.validate(RawProposal.unusable("timeout"), 2, pool);

        assertThat(set.slots()).containsExactly(0, 1);
        assertThat(set.fallback()).isTrue();
    }

    @Test
    void alwaysReturnsExactlyTheEntitlement() {
        ResourcePool pool = new ResourcePool(6);
        Random random = new Random(42);
        for (int trial = 0; trial < 500; trial++) {
            List<Object> entries = new ArrayList<>();
            int size = random.nextInt(10);
            for (int i = 0; i < size; i++) {
                switch (random.nextInt(4)) {
                    case 0: entries.add(random.nextInt(12) - 3); break;
                    case 1: entries.add(String.valueOf(random.nextInt(8))); break;
                    case 2: entries.add(random.nextDouble() * 8); break;
                    default: entries.add("junk"); break;
                }
            }
            int expected = 1 + random.nextInt(6);

            ValidatedSet set = validator.validate(RawProposal.of(entries), expected, pool);

            assertThat(set.slots()).hasSize(expected).doesNotHaveDuplicates().isSorted();
            assertThat(set.slots()).allMatch(pool::contains);
        }
    }

    @Test
    void entitlementBeyondDomainIsDegenerate() {
        ResourcePool pool = new ResourcePool(3);

        ValidatedSet set = validator.validate(RawProposal.of(List.of(0)), 5, pool);

        assertThat(set.size()).isEqualTo(5);
        assertThat(set.degenerate()).isTrue();
        assertThat(set.slots()).contains(0, 1, 2).allMatch(pool::contains);
    }

    @Test
    void rejectsNonPositiveEntitlement() {
        assertThatThrownBy(() -> validator.validate(RawProposal.of(List.of(1)), 0, new ResourcePool(4)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
