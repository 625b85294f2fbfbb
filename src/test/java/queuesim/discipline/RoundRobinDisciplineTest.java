package queuesim.discipline;

import org.junit.jupiter.api.Test;
import queuesim.packet.Packet;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RoundRobinDisciplineTest {

    @Test
    void shouldPlacePacketsByIdModuloQueueCount() {
        RoundRobinDiscipline rr = new RoundRobinDiscipline(3, 0.5);

        rr.admit(new Packet(0, 0.0, 1, 1.0));
        rr.admit(new Packet(1, 1.0, 1, 1.0));
        rr.admit(new Packet(2, 2.0, 1, 1.0));
        rr.admit(new Packet(3, 3.0, 1, 1.0));

        assertEquals(2, rr.queueSize(0));
        assertEquals(1, rr.queueSize(1));
        assertEquals(1, rr.queueSize(2));
        assertEquals(4, rr.size());
    }

    @Test
    void shouldAlternateBetweenQueues() {
        RoundRobinDiscipline rr = new RoundRobinDiscipline(2, 0.5);
        rr.admit(new Packet(0, 0.0, 1, 1.0));
        rr.admit(new Packet(1, 0.0, 1, 1.0));
        rr.admit(new Packet(2, 0.0, 1, 1.0));
        rr.admit(new Packet(3, 0.0, 1, 1.0));

        assertEquals(0, rr.processNext().orElseThrow().id());
        assertEquals(1, rr.processNext().orElseThrow().id());
        assertEquals(2, rr.processNext().orElseThrow().id());
        assertEquals(3, rr.processNext().orElseThrow().id());
    }

    @Test
    void shouldVisitEveryNonEmptyQueueBeforeRevisiting() {
        // Given - each of the 3 queues holds at least one packet
        RoundRobinDiscipline rr = new RoundRobinDiscipline(3, 0.5);
        for (int id = 0; id < 9; id++) {
            rr.admit(new Packet(id, 0.0, 1, 1.0));
        }

        // When / Then - every window of 3 services touches 3 distinct queues
        List<Integer> servedQueues = new ArrayList<>();
        while (!rr.isEmpty()) {
            servedQueues.add(rr.processNext().orElseThrow().id() % 3);
        }
        for (int start = 0; start + 3 <= servedQueues.size(); start += 3) {
            Set<Integer> window = new HashSet<>(servedQueues.subList(start, start + 3));
            assertEquals(3, window.size());
        }
    }

    @Test
    void shouldSkipEmptyQueues() {
        RoundRobinDiscipline rr = new RoundRobinDiscipline(3, 0.5);
        rr.admit(new Packet(0, 0.0, 1, 1.0));
        rr.admit(new Packet(2, 0.0, 1, 1.0));
        rr.admit(new Packet(3, 0.0, 1, 1.0));
        rr.admit(new Packet(5, 0.0, 1, 1.0));

        List<Integer> order = new ArrayList<>();
        while (!rr.isEmpty()) {
            order.add(rr.processNext().orElseThrow().id());
        }

        assertEquals(List.of(0, 2, 3, 5), order);
    }

    @Test
    void shouldMovePointerPastServedQueue() {
        RoundRobinDiscipline rr = new RoundRobinDiscipline(3, 0.5);
        rr.admit(new Packet(2, 0.0, 1, 1.0));

        rr.processNext();

        assertEquals(0, rr.pointer());
    }

    @Test
    void shouldServiceWholePacketRegardlessOfQuantum() {
        RoundRobinDiscipline rr = new RoundRobinDiscipline(3, 0.5);
        Packet big = new Packet(0, 0.0, 1, 2.0);
        rr.admit(big);

        rr.processNext();

        assertEquals(2.0, big.finishTime().getAsDouble() - big.startTime().getAsDouble());
        assertTrue(rr.isEmpty());
    }

    @Test
    void shouldHandleNegativeIds() {
        RoundRobinDiscipline rr = new RoundRobinDiscipline(3, 0.5);

        rr.admit(new Packet(-1, 0.0, 1, 1.0));

        assertEquals(1, rr.queueSize(2));
    }

    @Test
    void shouldTailDropAcrossAllQueuesWhenBounded() {
        RoundRobinDiscipline rr = new RoundRobinDiscipline(3, 0.5, OptionalInt.of(2));

        assertTrue(rr.admit(new Packet(0, 0.0, 1, 1.0)));
        assertTrue(rr.admit(new Packet(1, 0.0, 1, 1.0)));
        assertFalse(rr.admit(new Packet(2, 0.0, 1, 1.0)));
        assertEquals(1, rr.droppedPackets().size());
    }

    @Test
    void shouldRejectInvalidConstruction() {
        assertThrows(IllegalArgumentException.class, () -> new RoundRobinDiscipline(0, 0.5));
        assertThrows(IllegalArgumentException.class, () -> new RoundRobinDiscipline(-2, 0.5));
        assertThrows(IllegalArgumentException.class, () -> new RoundRobinDiscipline(3, 0.0));
    }

    @Test
    void shouldResetPointerAndQueues() {
        RoundRobinDiscipline rr = new RoundRobinDiscipline(3, 0.5);
        rr.admit(new Packet(1, 0.0, 1, 1.0));
        rr.admit(new Packet(4, 0.0, 1, 1.0));
        rr.processNext();

        rr.reset();

        assertEquals(0, rr.pointer());
        assertEquals(0, rr.size());
        assertEquals(0, rr.queueSize(1));
    }
}
