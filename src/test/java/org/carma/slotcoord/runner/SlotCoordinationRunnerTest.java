package org.carma.slotcoord.runner;

import org.carma.slotcoord.config.CoordinationConfig;
import org.carma.slotcoord.config.CoordinationConfigLoader;
import org.carma.slotcoord.event.Event.ProposalFallbackEvent;
import org.carma.slotcoord.event.EventBus;
import org.carma.slotcoord.model.RoundResult;
import org.carma.slotcoord.store.InMemorySuccessRecordStore;
import org.carma.slotcoord.store.JsonSuccessRecordStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class SlotCoordinationRunnerTest {

    private final CoordinationConfigLoader loader = new CoordinationConfigLoader();

    @Test
    void unreliableAgentsStillGetDisjointFullAllocations() {
        CoordinationConfig config = loader.loadString(String.join("\n",
            "numStations: 4",
            "numSlots: 10",
            "maxRounds: 60",
            "seed: 2024",
            "stationOrder: ROTATING",
            "demand:",
            "  refresh: EVERY_K_ROUNDS",
            "  interval: 7",
            "simulation:",
            "  noiseRate: 0.3",
            "  malformedRate: 0.2",
            "  failureRate: 0.1"));
        EventBus eventBus = new EventBus();
        InMemorySuccessRecordStore store = new InMemorySuccessRecordStore();

        try (RoundCoordinator coordinator = SlotCoordinationRunner.create(config, store, eventBus)) {
            RunReport report = coordinator.run();

            assertThat(report.getRoundsPlayed()).isEqualTo(60);
            for (RoundResult result : report.getRounds()) {
                assertThat(result.getAllocation().isDisjoint()).isTrue();
                assertThat(result.getDemand().total()).isEqualTo(10);
                // generated demand never oversubscribes, so nobody is left short
                assertThat(result.getTotalShortfall()).isZero();
                assertThat(result.getUtilization()).isEqualTo(1.0);
            }
            assertThat(eventBus.getEventCount(ProposalFallbackEvent.class)).isPositive();
            assertThat(store.getRecords()).hasSize(report.getMetrics().getSuccessCount());
        }
    }

    @Test
    void sameSeedSameRun() {
        String yaml = "numStations: 3\nnumSlots: 8\nmaxRounds: 15\nseed: 7\n";

        RunReport first;
        RunReport second;
        try (RoundCoordinator coordinator = SlotCoordinationRunner.create(
                loader.loadString(yaml), new InMemorySuccessRecordStore(), new EventBus(false))) {
            first = coordinator.run();
        }
        try (RoundCoordinator coordinator = SlotCoordinationRunner.create(
                loader.loadString(yaml), new InMemorySuccessRecordStore(), new EventBus(false))) {
            second = coordinator.run();
        }

        assertThat(second.getFinalHeat()).isEqualTo(first.getFinalHeat());
        assertThat(second.getMetrics().getSuccessCount()).isEqualTo(first.getMetrics().getSuccessCount());
    }

    @Test
    void mainRunPrintsReportAndPersistsRecords(@TempDir Path dir) throws IOException {
        Path records = dir.resolve("records.json");
        Path configFile = dir.resolve("run.yaml");
        Files.writeString(configFile, String.join("\n",
            "numStations: 2",
            "numSlots: 4",
            "maxRounds: 20",
            "seed: 1",
            "recordStore: " + records.toAbsolutePath(),
            "simulation:",
            "  noiseRate: 0.0"));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();

        int status = SlotCoordinationRunner.run(new String[] {configFile.toString()},
            new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));

        assertThat(status).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("SLOT COORDINATION RUN", "Rounds played:        20");
        assertThat(JsonSuccessRecordStore.open(records).getRecords()).isNotEmpty();
    }

    @Test
    void invalidConfigExitsWithStatusOne(@TempDir Path dir) throws IOException {
        Path configFile = dir.resolve("bad.yaml");
        Files.writeString(configFile, "numStations: 5\nnumSlots: 4\n");
        ByteArrayOutputStream err = new ByteArrayOutputStream();

        int status = SlotCoordinationRunner.run(new String[] {configFile.toString()},
            new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));

        assertThat(status).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("numStations (5) must not exceed numSlots (4)");
    }

    @Test
    void missingConfigFileExitsWithStatusTwo(@TempDir Path dir) {
        ByteArrayOutputStream err = new ByteArrayOutputStream();

        int status = SlotCoordinationRunner.run(new String[] {dir.resolve("absent.yaml").toString()},
            new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));

        assertThat(status).isEqualTo(2);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("not found");
    }
}
