package org.carma.slotcoord.runner;

import org.carma.slotcoord.agent.DecisionContext;
import org.carma.slotcoord.agent.DecisionSource;
import org.carma.slotcoord.config.ConfigurationException;
import org.carma.slotcoord.config.DemandRefreshPolicy;
import org.carma.slotcoord.config.StationOrder;
import org.carma.slotcoord.event.Event.*;
import org.carma.slotcoord.event.EventBus;
import org.carma.slotcoord.mechanism.*;
import org.carma.slotcoord.model.*;
import org.carma.slotcoord.simulation.RunMetrics;
import org.carma.slotcoord.store.InMemorySuccessRecordStore;
import org.carma.slotcoord.store.SuccessRecordStore;
import org.carma.slotcoord.store.SuccessRecordStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs coordination rounds end to end.
 *
 * Per round:
 * 1. Generate demand if none is current or the refresh policy says so
 * 2. Query every station in the round's order; each sees the sets claimed
 *    by the stations before it
 * 3. Parse and validate each reply (any failure falls back to backfill)
 * 4. Resolve collisions into a disjoint allocation and update the pool
 * 5. On full utilization with no raw conflicts, persist a success record
 *    and regenerate demand
 *
 * The round loop is single threaded. Each query runs on the coordinator's
 * executor so it can be bounded by a timeout; a timed-out query is
 * cancelled and the station falls back.
 */
public class RoundCoordinator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RoundCoordinator.class);

    public static final String REASON_MAX_ROUNDS = "max rounds reached";
    public static final String REASON_CANCELLED = "cancelled";
    public static final String REASON_CONVERGED = "converged";
    public static final String REASON_CLOSED = "closed";

    private final ResourcePool pool;
    private final Map<String, DecisionSource> sources;
    private final List<String> stationIds;
    private final DemandPlanner demandPlanner;
    private final ProposalParser parser;
    private final ProposalValidator validator;
    private final ConflictResolver resolver;
    private final SuccessRecordStore store;
    private final EventBus eventBus;
    private final StationOrder stationOrder;
    private final DemandRefreshPolicy refreshPolicy;
    private final int refreshInterval;
    private final long queryTimeoutMs;
    private final int maxRounds;
    private final boolean stopOnConvergence;
    private final Clock clock;
    private final ExecutorService executor;
    private final RunMetrics metrics;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<RoundResult> history = new ArrayList<>();
    private volatile CoordinatorState state = CoordinatorState.IDLE;
    private String terminationReason;
    private Demand currentDemand;
    private boolean demandFresh;
    private int roundsPlayed;
    private int roundsUnderDemand;
    private Feedback lastFeedback;

    private RoundCoordinator(Builder builder) {
        this.pool = builder.pool;
        this.sources = new LinkedHashMap<>(builder.sources);
        this.stationIds = List.copyOf(builder.sources.keySet());
        this.demandPlanner = builder.demandPlanner;
        this.parser = builder.parser;
        this.validator = builder.validator;
        this.resolver = new ConflictResolver(pool, builder.replacementPolicy);
        this.store = builder.store;
        this.eventBus = builder.eventBus;
        this.stationOrder = builder.stationOrder;
        this.refreshPolicy = builder.refreshPolicy;
        this.refreshInterval = builder.refreshInterval;
        this.queryTimeoutMs = builder.queryTimeoutMs;
        this.maxRounds = builder.maxRounds;
        this.stopOnConvergence = builder.stopOnConvergence;
        this.clock = builder.clock;
        this.metrics = new RunMetrics(builder.convergenceThreshold);

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "slot-query-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // ========================================================================
    // Run Loop
    // ========================================================================

    /**
     * Play rounds until max rounds, cancellation or (if enabled) convergence.
     */
    public RunReport run() {
        log.info("Starting run: {} stations, {} slots, up to {} rounds",
            stationIds.size(), pool.getNumSlots(), maxRounds);
        while (state != CoordinatorState.TERMINATED) {
            if (cancelled.get()) {
                terminate(REASON_CANCELLED);
                break;
            }
            runRound();
        }
        return report();
    }

    /**
     * Play exactly one round.
     *
     * @throws IllegalStateException if the coordinator has terminated
     */
    public RoundResult runRound() {
        if (state != CoordinatorState.TERMINATED && cancelled.get()) {
            terminate(REASON_CANCELLED);
        }
        if (state == CoordinatorState.TERMINATED) {
            throw new IllegalStateException("Coordinator terminated: " + terminationReason);
        }

        int round = roundsPlayed + 1;
        if (currentDemand == null || (!demandFresh && refreshPolicy.isDue(round, refreshInterval))) {
            regenerateDemand(round);
        }
        demandFresh = false;
        roundsUnderDemand++;
        Demand demand = currentDemand;

        // Negotiate
        state = CoordinatorState.NEGOTIATING;
        Map<String, ValidatedSet> candidates = new LinkedHashMap<>();
        Map<String, List<Integer>> claimed = new LinkedHashMap<>();
        List<String> fallbacks = new ArrayList<>();

        for (String stationId : stationOrder.orderFor(stationIds, round)) {
            int entitled = demand.get(stationId);
            DecisionContext context = new DecisionContext(
                stationId, round, entitled, pool.getNumSlots(), demand.asMap(),
                pool.heatRanking(), pool.getHeatMap(), pool.getConflictHistory(),
                claimed, lastFeedback);

            RawProposal raw = query(sources.get(stationId), context);
            ValidatedSet set = validator.validate(raw, entitled, pool);
            log.debug("Round {} {}: {} -> {}", round, stationId, raw, set.slots());

            if (!raw.isUsable() || set.fallback()) {
                String reason = raw.isUsable()
                    ? "backfilled to " + entitled + " slot(s) from " + raw.getEntries()
                    : raw.getReason();
                log.warn("Round {} {}: falling back ({})", round, stationId, reason);
                fallbacks.add(stationId);
                eventBus.publish(new ProposalFallbackEvent(clock.instant(), round, stationId, reason));
            }

            candidates.put(stationId, set);
            claimed.put(stationId, set.slots());
        }

        // Resolve
        Allocation allocation = resolver.resolve(candidates);
        state = CoordinatorState.RESOLVED;
        int rawConflicts = pool.recordConflicts(claimed);
        pool.recordUsage(allocation.asMap());
        Feedback feedback = pool.feedback(claimed, allocation.asMap());
        eventBus.publish(new RoundResolvedEvent(clock.instant(), round, allocation.asMap(),
            feedback.conflictSlots(), allocation.getShortfalls(), feedback.utilizationRate()));

        // Record
        state = CoordinatorState.RECORDED;
        SuccessRecord record = null;
        String persistenceError = null;
        if (rawConflicts == 0 && feedback.isFullyUtilized()) {
            record = SuccessRecord.of(demand, allocation, roundsUnderDemand, round, LocalDateTime.now(clock));
            try {
                store.append(record);
                log.info("Round {}: success after {} round(s) under demand {}", round, roundsUnderDemand, demand);
                eventBus.publish(new SuccessRecordedEvent(clock.instant(), round, roundsUnderDemand, store.size()));
            } catch (SuccessRecordStoreException e) {
                persistenceError = e.getMessage();
                log.error("Round {}: success record not persisted", round, e);
                eventBus.publish(new PersistenceFailedEvent(clock.instant(), round, persistenceError));
            }
        }

        RoundResult result = new RoundResult(round, demand, candidates, allocation, feedback,
            rawConflicts, fallbacks, record, persistenceError);
        log.info("{}", result);

        history.add(result);
        metrics.recordRound(result);
        lastFeedback = feedback;
        roundsPlayed = round;

        if (roundsPlayed >= maxRounds) {
            terminate(REASON_MAX_ROUNDS);
        } else if (stopOnConvergence && metrics.isConverged()) {
            terminate(REASON_CONVERGED);
        } else {
            // demand for a round that will not run is never generated
            if (result.isSuccess()) {
                regenerateDemand(round + 1);
                demandFresh = true;
            }
            state = CoordinatorState.IDLE;
        }
        return result;
    }

    private void regenerateDemand(int forRound) {
        currentDemand = demandPlanner.generateDemand(stationIds, pool.getNumSlots());
        roundsUnderDemand = 0;
        state = CoordinatorState.DEMAND_GENERATED;
        log.info("Demand for round {}: {}", forRound, currentDemand);
        eventBus.publish(new DemandGeneratedEvent(clock.instant(), forRound, currentDemand.asMap()));
    }

    /**
     * Ask one station, bounded by the query timeout. Failures come back as
     * an unusable proposal carrying the reason.
     */
    private RawProposal query(DecisionSource source, DecisionContext context) {
        Future<String> future = executor.submit(() -> source.propose(context));
        try {
            String reply = future.get(queryTimeoutMs, TimeUnit.MILLISECONDS);
            return parser.parse(reply);
        } catch (TimeoutException e) {
            future.cancel(true);
            return RawProposal.unusable(source.getName() + " timed out after " + queryTimeoutMs + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return RawProposal.unusable(source.getName() + " failed: " + cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return RawProposal.unusable(source.getName() + " interrupted");
        }
    }

    private void terminate(String reason) {
        if (state == CoordinatorState.TERMINATED) return;
        state = CoordinatorState.TERMINATED;
        terminationReason = reason;
        log.info("Run terminated after {} round(s): {}", roundsPlayed, reason);
        eventBus.publish(new RunTerminatedEvent(clock.instant(), roundsPlayed, reason));
    }

    // ========================================================================
    // Control
    // ========================================================================

    /**
     * Request termination; takes effect before the next round starts.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public RunReport report() {
        return new RunReport(history, metrics, terminationReason, store.size(), pool.getHeatMap());
    }

    @Override
    public void close() {
        terminate(REASON_CLOSED);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public CoordinatorState getState() { return state; }
    public Optional<String> getTerminationReason() { return Optional.ofNullable(terminationReason); }
    public Demand getCurrentDemand() { return currentDemand; }
    public int getRoundsPlayed() { return roundsPlayed; }
    public List<RoundResult> getHistory() { return new ArrayList<>(history); }
    public RunMetrics getMetrics() { return metrics; }
    public ResourcePool getPool() { return pool; }
    public List<String> getStationIds() { return stationIds; }

    @Override
    public String toString() {
        return String.format("RoundCoordinator[stations=%s, slots=%d, round=%d, state=%s]",
            stationIds, pool.getNumSlots(), roundsPlayed, state);
    }

    // ========================================================================
    // Builder
    // ========================================================================

    /**
     * Builder for RoundCoordinator. Stations are queried in the order they
     * are added.
     */
    public static class Builder {
        private final ResourcePool pool;
        private final Map<String, DecisionSource> sources = new LinkedHashMap<>();
        private final List<String> duplicates = new ArrayList<>();
        private Random random = new Random();
        private DemandPlanner demandPlanner;
        private ProposalParser parser;
        private ProposalValidator validator;
        private ReplacementPolicy replacementPolicy = new LowestHeatReplacementPolicy();
        private SuccessRecordStore store = new InMemorySuccessRecordStore();
        private EventBus eventBus = new EventBus(false);
        private StationOrder stationOrder = StationOrder.FIXED;
        private DemandRefreshPolicy refreshPolicy = DemandRefreshPolicy.ON_SUCCESS;
        private int refreshInterval = 1;
        private long queryTimeoutMs = 30_000;
        private int maxRounds = 200;
        private int convergenceThreshold = 10;
        private boolean stopOnConvergence = false;
        private Clock clock = Clock.systemDefaultZone();

        public Builder(ResourcePool pool) {
            this.pool = Objects.requireNonNull(pool, "pool");
        }

        public Builder station(String stationId, DecisionSource source) {
            Objects.requireNonNull(source, "source");
            if (sources.putIfAbsent(stationId, source) != null) {
                duplicates.add(stationId);
            }
            return this;
        }

        /**
         * Seeds the default planner and validator.
         */
        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        public Builder demandPlanner(DemandPlanner planner) {
            this.demandPlanner = planner;
            return this;
        }

        public Builder parser(ProposalParser parser) {
            this.parser = parser;
            return this;
        }

        public Builder validator(ProposalValidator validator) {
            this.validator = validator;
            return this;
        }

        public Builder replacementPolicy(ReplacementPolicy policy) {
            this.replacementPolicy = policy;
            return this;
        }

        public Builder store(SuccessRecordStore store) {
            this.store = store;
            return this;
        }

        public Builder eventBus(EventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        public Builder stationOrder(StationOrder order) {
            this.stationOrder = order;
            return this;
        }

        public Builder demandRefresh(DemandRefreshPolicy policy, int interval) {
            this.refreshPolicy = policy;
            this.refreshInterval = interval;
            return this;
        }

        public Builder queryTimeoutMs(long timeoutMs) {
            this.queryTimeoutMs = timeoutMs;
            return this;
        }

        public Builder maxRounds(int maxRounds) {
            this.maxRounds = maxRounds;
            return this;
        }

        public Builder convergence(int threshold, boolean stopOnConvergence) {
            this.convergenceThreshold = threshold;
            this.stopOnConvergence = stopOnConvergence;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * @throws ConfigurationException listing every problem found
         */
        public RoundCoordinator build() {
            List<String> errors = new ArrayList<>();
            if (sources.isEmpty()) errors.add("At least one station is required");
            if (!duplicates.isEmpty()) errors.add("Duplicate station ids: " + duplicates);
            if (sources.size() > pool.getNumSlots()) {
                errors.add("numStations (" + sources.size() + ") must not exceed numSlots ("
                    + pool.getNumSlots() + ")");
            }
            if (maxRounds < 1) errors.add("maxRounds must be >= 1, got " + maxRounds);
            if (queryTimeoutMs <= 0) errors.add("queryTimeoutMs must be > 0, got " + queryTimeoutMs);
            if (refreshInterval < 1) errors.add("demand refresh interval must be >= 1, got " + refreshInterval);
            if (convergenceThreshold < 1) {
                errors.add("convergenceThreshold must be >= 1, got " + convergenceThreshold);
            }
            if (demandPlanner == null) demandPlanner = new ProportionalDemandPlanner(random);
            if (!sources.isEmpty()) {
                errors.addAll(demandPlanner.checkStations(List.copyOf(sources.keySet()), pool.getNumSlots()));
            }
            if (!errors.isEmpty()) {
                throw new ConfigurationException(errors);
            }

            if (parser == null) parser = new ProposalParser();
            if (validator == null) validator = new ProposalValidator(random);
            return new RoundCoordinator(this);
        }
    }
}
