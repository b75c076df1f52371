package org.carma.slotcoord.runner;

import org.carma.slotcoord.agent.SimulatedDecisionSource;
import org.carma.slotcoord.config.ConfigurationException;
import org.carma.slotcoord.config.CoordinationConfig;
import org.carma.slotcoord.config.CoordinationConfigLoader;
import org.carma.slotcoord.event.EventBus;
import org.carma.slotcoord.mechanism.FixedDemandPlanner;
import org.carma.slotcoord.mechanism.ProportionalDemandPlanner;
import org.carma.slotcoord.mechanism.ProposalValidator;
import org.carma.slotcoord.model.ResourcePool;
import org.carma.slotcoord.store.JsonSuccessRecordStore;
import org.carma.slotcoord.store.SuccessRecordStore;
import org.carma.slotcoord.store.SuccessRecordStoreException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Random;

/**
 * Runs a coordination scenario with simulated stations.
 *
 * Usage: {@code SlotCoordinationRunner [config.yaml]}. Without an argument
 * the classpath {@code coordination.yaml} is used.
 */
public class SlotCoordinationRunner {

    private static final String SEP = "=".repeat(60);

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * @return process exit status: 0 on a completed run, 1 on bad
     *         configuration, 2 when the config or record store cannot be read
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        CoordinationConfig config;
        try {
            CoordinationConfigLoader loader = new CoordinationConfigLoader();
            config = args.length > 0 ? loader.load(Paths.get(args[0])) : loader.loadDefault();
        } catch (ConfigurationException e) {
            err.println("Invalid configuration:");
            e.getErrors().forEach(error -> err.println("  - " + error));
            return 1;
        } catch (IOException e) {
            err.println("ERROR: " + e.getMessage());
            return 2;
        }

        SuccessRecordStore store;
        try {
            store = JsonSuccessRecordStore.open(Path.of(config.recordStore));
        } catch (SuccessRecordStoreException e) {
            err.println("ERROR: " + e.getMessage());
            return 2;
        }

        out.println(SEP);
        out.println("SLOT COORDINATION: " + config);
        out.println(SEP);

        try (RoundCoordinator coordinator = create(config, store, new EventBus(false))) {
            RunReport report = coordinator.run();
            out.println(report.summary());
        } catch (ConfigurationException e) {
            err.println("Invalid configuration:");
            e.getErrors().forEach(error -> err.println("  - " + error));
            return 1;
        }
        return 0;
    }

    /**
     * Wire a coordinator for {@code config} with one simulated source per station.
     */
    public static RoundCoordinator create(CoordinationConfig config, SuccessRecordStore store, EventBus eventBus) {
        Random random = config.newRandom();
        SimulatedDecisionSource.Behavior behavior = new SimulatedDecisionSource.Behavior()
            .noiseRate(config.simulation.noiseRate)
            .malformedRate(config.simulation.malformedRate)
            .failureRate(config.simulation.failureRate);

        RoundCoordinator.Builder builder = new RoundCoordinator.Builder(new ResourcePool(config.numSlots))
            .random(random)
            .demandPlanner(config.demand.fixed != null
                ? new FixedDemandPlanner(config.demand.fixed)
                : new ProportionalDemandPlanner(random))
            .validator(new ProposalValidator(random))
            .replacementPolicy(config.replacementPolicy.create(random))
            .store(store)
            .eventBus(eventBus)
            .stationOrder(config.stationOrder)
            .demandRefresh(config.demand.refresh, config.demand.interval)
            .queryTimeoutMs(config.queryTimeoutMs)
            .maxRounds(config.maxRounds)
            .convergence(config.convergenceThreshold, config.stopOnConvergence);

        for (String stationId : config.resolveStationIds()) {
            builder.station(stationId, new SimulatedDecisionSource(stationId, behavior, new Random(random.nextLong())));
        }
        return builder.build();
    }
}
