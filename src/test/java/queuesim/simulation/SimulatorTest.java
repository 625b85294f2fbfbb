package queuesim.simulation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import queuesim.discipline.DisciplineConfig;
import queuesim.discipline.DisciplineType;
import queuesim.discipline.FcfsDiscipline;
import queuesim.discipline.PriorityDiscipline;
import queuesim.discipline.QueueingDiscipline;
import queuesim.metrics.Metrics;
import queuesim.packet.Packet;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimulatorTest {

    private Simulator simulator;

    @BeforeEach
    void setUp() {
        simulator = new Simulator();
    }

    @Test
    void shouldSkipIdleTimeToNextArrival() {
        Packet early = new Packet(1, 0.0, 1, 1.0);
        Packet late = new Packet(2, 10.0, 1, 1.0);
        FcfsDiscipline fcfs = new FcfsDiscipline();

        simulator.run(List.of(early, late), fcfs);

        assertEquals(10.0, late.startTime().getAsDouble());
        assertEquals(11.0, fcfs.currentTime());
        assertEquals(0.0, late.waitingTime().getAsDouble());
    }

    @Test
    void shouldAcceptUnsortedInput() {
        Packet second = new Packet(2, 5.0, 1, 1.0);
        Packet first = new Packet(1, 1.0, 1, 1.0);
        FcfsDiscipline fcfs = new FcfsDiscipline();

        simulator.run(List.of(second, first), fcfs);

        assertEquals(List.of(first, second), fcfs.processedPackets());
        assertEquals(1.0, first.startTime().getAsDouble());
    }

    @Test
    void shouldKeepInputOrderForSimultaneousArrivals() {
        List<Packet> packets = new ArrayList<>();
        for (int id = 9; id >= 0; id--) {
            packets.add(new Packet(id, 0.0, 1, 0.5));
        }
        FcfsDiscipline fcfs = new FcfsDiscipline();

        simulator.run(packets, fcfs);

        assertEquals(packets, fcfs.processedPackets());
    }

    @Test
    void shouldReturnZeroMetricsForEmptyInput() {
        Metrics metrics = simulator.run(List.of(), new FcfsDiscipline());

        assertEquals(0, metrics.processedCount());
        assertEquals(0.0, metrics.throughput());
        assertEquals(0.0, metrics.dropRate());
        assertEquals(1.0, metrics.packetFairnessIndex());
    }

    @Test
    void shouldAdmitArrivalsDuringServiceBeforeNextSelection() {
        // Given - a high priority packet arrives while a low priority one is in service
        Packet low1 = new Packet(1, 0.0, 1, 2.0);
        Packet low2 = new Packet(2, 0.0, 1, 2.0);
        Packet high = new Packet(3, 1.0, 3, 1.0);
        PriorityDiscipline pq = new PriorityDiscipline();

        // When
        simulator.run(List.of(low1, low2, high), pq);

        // Then - service is not preempted, but the next pick sees the new arrival
        assertEquals(List.of(low1, high, low2), pq.processedPackets());
        assertEquals(2.0, high.startTime().getAsDouble());
    }

    @Test
    void shouldStarveLowPriorityUnderSustainedHighPriorityLoad() {
        List<Packet> packets = new ArrayList<>();
        packets.add(new Packet(0, 0.0, 1, 1.0));
        for (int i = 1; i <= 10; i++) {
            packets.add(new Packet(i, i - 1.0, 3, 1.0));
        }
        Packet low = packets.get(0);
        PriorityDiscipline pq = new PriorityDiscipline();

        simulator.run(packets, pq);

        assertEquals(10.0, low.startTime().getAsDouble());
    }

    @Test
    void shouldTailDropBurstUnderFcfs() {
        // Given - 100 packets burst at t=0 into a 20-packet buffer
        List<Packet> packets = new ArrayList<>();
        for (int id = 0; id < 100; id++) {
            int priority = id % 10 < 6 ? 1 : id % 10 < 9 ? 2 : 3;
            packets.add(new Packet(id, 0.0, priority, 0.5));
        }
        FcfsDiscipline fcfs = new FcfsDiscipline(20);

        // When
        Metrics metrics = simulator.run(packets, fcfs);

        // Then - the first 20 arrivals are served, the rest are dropped
        assertEquals(20, metrics.processedCount());
        assertEquals(80, metrics.droppedCount());
        assertEquals(0.8, metrics.dropRate(), 1e-9);
        assertTrue(fcfs.droppedPackets().stream().allMatch(p -> p.id() >= 20));
        assertTrue(fcfs.processedPackets().stream().allMatch(p -> p.id() < 20));
    }

    @Test
    void shouldProduceIdenticalTimelinesForIdenticalInput() {
        List<Packet> packets = new ArrayList<>();
        for (int id = 0; id < 40; id++) {
            packets.add(new Packet(id, id * 0.3, 1 + id % 3, 0.5 + (id % 4) * 0.25));
        }

        for (DisciplineType type : DisciplineType.values()) {
            QueueingDiscipline first = type.create(DisciplineConfig.withCapacity(8));
            QueueingDiscipline second = type.create(DisciplineConfig.withCapacity(8));

            Metrics a = simulator.run(ExperimentRunner.copyOf(packets), first);
            Metrics b = simulator.run(ExperimentRunner.copyOf(packets), second);

            assertEquals(a, b, type.name());
            assertEquals(ids(first.processedPackets()), ids(second.processedPackets()), type.name());
        }
    }

    @Test
    void shouldConserveOfferedPacketsForEveryDiscipline() {
        List<Packet> packets = new ArrayList<>();
        for (int id = 0; id < 50; id++) {
            packets.add(new Packet(id, id * 0.2, 1 + id % 3, 1.0));
        }

        for (DisciplineType type : DisciplineType.values()) {
            QueueingDiscipline discipline = type.create(DisciplineConfig.withCapacity(6));
            Metrics metrics = simulator.run(ExperimentRunner.copyOf(packets), discipline);

            assertEquals(50, metrics.offeredCount(), type.name());
            assertTrue(discipline.isEmpty(), type.name());
            for (Packet packet : discipline.processedPackets()) {
                assertTrue(packet.startTime().getAsDouble() >= packet.arrivalTime(), type.name());
                assertTrue(packet.finishTime().getAsDouble() > packet.startTime().getAsDouble(), type.name());
            }
        }
    }

    @Test
    void shouldServeEveryPacketWhenUnbounded() {
        List<Packet> packets = new ArrayList<>();
        for (int id = 0; id < 30; id++) {
            packets.add(new Packet(id, 0.0, 1 + id % 3, 1.0));
        }

        for (DisciplineType type : DisciplineType.values()) {
            Metrics metrics = simulator.run(ExperimentRunner.copyOf(packets), type.create(DisciplineConfig.defaults()));

            assertEquals(30, metrics.processedCount(), type.name());
            assertEquals(0, metrics.droppedCount(), type.name());
        }
    }

    @Test
    void shouldResetDisciplineBetweenRuns() {
        FcfsDiscipline fcfs = new FcfsDiscipline();
        simulator.run(List.of(new Packet(1, 0.0, 1, 1.0)), fcfs);

        Metrics metrics = simulator.run(List.of(new Packet(2, 0.0, 1, 1.0)), fcfs);

        assertEquals(1, metrics.processedCount());
        assertEquals(1.0, fcfs.currentTime());
    }

    @Test
    void shouldRejectNullArguments() {
        assertThrows(IllegalArgumentException.class, () -> simulator.run(null, new FcfsDiscipline()));
        assertThrows(IllegalArgumentException.class, () -> simulator.run(List.of(), null));
    }

    @Test
    void shouldCountSteps() {
        simulator.run(List.of(new Packet(1, 0.0, 1, 1.0), new Packet(2, 5.0, 1, 1.0)), new FcfsDiscipline());

        // serve, idle skip, serve
        assertEquals(3, simulator.getSteps());
    }

    private static List<Integer> ids(List<Packet> packets) {
        return packets.stream().map(Packet::id).toList();
    }
}
