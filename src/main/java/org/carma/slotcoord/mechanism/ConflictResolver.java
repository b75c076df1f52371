package org.carma.slotcoord.mechanism;

import org.carma.slotcoord.model.Allocation;
import org.carma.slotcoord.model.ResourcePool;
import org.carma.slotcoord.model.ValidatedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Turns per-station candidate sets into a pairwise-disjoint allocation.
 *
 * Stations are processed in the order given. Each one keeps the candidates
 * nobody before it reserved; every collision is swapped for a free slot
 * picked by the {@link ReplacementPolicy}, preferring slots the station did
 * not already ask for. When the domain runs dry the station is left short.
 *
 * Earlier stations win. Fairness across rounds is the caller's job (see
 * {@link org.carma.slotcoord.config.StationOrder#ROTATING}).
 */
public class ConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    /**
     * One station's entry in the resolution order.
     */
    public record Candidate(String stationId, List<Integer> slots) {
        public Candidate {
            Objects.requireNonNull(stationId, "stationId");
            slots = List.copyOf(slots);
        }
    }

    private final ResourcePool pool;
    private final ReplacementPolicy policy;

    public ConflictResolver(ResourcePool pool, ReplacementPolicy policy) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * Resolve validated sets; the map's iteration order is the resolution order.
     */
    public Allocation resolve(Map<String, ValidatedSet> orderedSets) {
        List<Candidate> candidates = new ArrayList<>();
        for (Map.Entry<String, ValidatedSet> entry : orderedSets.entrySet()) {
            candidates.add(new Candidate(entry.getKey(), entry.getValue().slots()));
        }
        return resolve(candidates);
    }

    /**
     * Sequential greedy reservation.
     */
    public Allocation resolve(List<Candidate> orderedCandidates) {
        Set<String> seenStations = new HashSet<>();
        Set<Integer> reserved = new HashSet<>();
        Allocation allocation = new Allocation();

        for (Candidate candidate : orderedCandidates) {
            if (!seenStations.add(candidate.stationId())) {
                throw new IllegalArgumentException("Station listed twice: " + candidate.stationId());
            }

            List<Integer> wanted = candidate.slots();
            LinkedHashSet<Integer> kept = new LinkedHashSet<>();
            int collisions = 0;

            for (int i = 0; i < wanted.size(); i++) {
                int slot = wanted.get(i);
                if (pool.contains(slot) && !reserved.contains(slot) && !kept.contains(slot)) {
                    kept.add(slot);
                    continue;
                }

                collisions++;
                Set<Integer> stillWanted = new HashSet<>(wanted.subList(i + 1, wanted.size()));
                List<Integer> free = new ArrayList<>();
                List<Integer> preferred = new ArrayList<>();
                for (int s = 0; s < pool.getNumSlots(); s++) {
                    if (reserved.contains(s) || kept.contains(s)) continue;
                    free.add(s);
                    if (!stillWanted.contains(s)) preferred.add(s);
                }

                List<Integer> pickFrom = preferred.isEmpty() ? free : preferred;
                if (pickFrom.isEmpty()) {
                    continue;
                }
                int replacement = policy.pickReplacement(pickFrom, pool);
                log.debug("{}: slot {} collided, replaced with {}", candidate.stationId(), slot, replacement);
                kept.add(replacement);
            }

            List<Integer> finalSlots = new ArrayList<>(kept);
            Collections.sort(finalSlots);
            allocation.assign(candidate.stationId(), finalSlots, wanted.size())
                .setCollisions(candidate.stationId(), collisions);
            reserved.addAll(kept);

            int shortfall = wanted.size() - finalSlots.size();
            if (shortfall > 0) {
                log.info("{} short by {} slot(s): pool exhausted after {} reserved",
                    candidate.stationId(), shortfall, reserved.size());
            }
        }

        return allocation;
    }
}
