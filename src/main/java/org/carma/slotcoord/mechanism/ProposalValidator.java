package org.carma.slotcoord.mechanism;

import org.carma.slotcoord.model.RawProposal;
import org.carma.slotcoord.model.ResourcePool;
import org.carma.slotcoord.model.ValidatedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.*;

/**
 * Repairs a raw proposal into exactly the entitled number of legal slots.
 *
 * Order of operations:
 * 1. Coerce entries to ints, dropping junk and out-of-range values
 * 2. Deduplicate, keeping first occurrence
 * 3. Backfill if short: coolest slots first, then random unused slots, and
 *    only if the domain is exhausted, random slots with replacement
 * 4. Truncate if long: sort, keep the lowest {@code expected}
 * 5. Return sorted
 *
 * An unusable proposal skips straight to step 3. Validation never fails on
 * proposal content.
 */
public class ProposalValidator {

    private static final Logger log = LoggerFactory.getLogger(ProposalValidator.class);

    private final Random random;

    public ProposalValidator(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * @param raw proposal as parsed from the reply, possibly unusable
     * @param expected entitled slot count, at least 1
     * @param pool pool providing domain and heat
     */
    public ValidatedSet validate(RawProposal raw, int expected, ResourcePool pool) {
        if (expected < 1) {
            throw new IllegalArgumentException("Expected slot count must be >= 1, got " + expected);
        }

        LinkedHashSet<Integer> surviving = new LinkedHashSet<>();
        if (raw != null && raw.isUsable()) {
            for (Object entry : raw.getEntries()) {
                Integer slot = coerce(entry);
                if (slot != null && pool.contains(slot)) {
                    surviving.add(slot);
                }
            }
        }

        List<Integer> result = new ArrayList<>(surviving);
        boolean fallback = false;
        boolean degenerate = false;

        if (result.size() < expected) {
            fallback = true;
            result.addAll(pool.coolestSlots(expected - result.size(), result));

            if (result.size() < expected) {
                List<Integer> unused = new ArrayList<>();
                for (int slot = 0; slot < pool.getNumSlots(); slot++) {
                    if (!result.contains(slot)) unused.add(slot);
                }
                Collections.shuffle(unused, random);
                int take = Math.min(expected - result.size(), unused.size());
                result.addAll(unused.subList(0, take));
            }

            if (result.size() < expected) {
                degenerate = true;
                log.warn("Entitlement {} exceeds the {}-slot domain, reusing slots",
                    expected, pool.getNumSlots());
                while (result.size() < expected) {
                    result.add(random.nextInt(pool.getNumSlots()));
                }
            }
        } else if (result.size() > expected) {
            Collections.sort(result);
            result = new ArrayList<>(result.subList(0, expected));
        }

        Collections.sort(result);
        return new ValidatedSet(result, fallback, degenerate);
    }

    /**
     * Integral numbers pass, fractional numbers truncate toward zero, numeric
     * strings are parsed the same way. Anything else is null.
     */
    static Integer coerce(Object entry) {
        if (entry instanceof Integer) {
            return (Integer) entry;
        }
        if (entry instanceof Number) {
            return fromDouble(((Number) entry).doubleValue());
        }
        if (entry instanceof String) {
            String text = ((String) entry).trim();
            if (text.isEmpty()) return null;
            try {
                return fromDouble(new BigDecimal(text).doubleValue());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Integer fromDouble(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) return null;
        if (value >= Integer.MAX_VALUE || value <= Integer.MIN_VALUE) return null;
        return (int) value;
    }
}
