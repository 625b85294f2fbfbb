package queuesim.discipline;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import queuesim.packet.Packet;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PriorityDisciplineTest {

    private PriorityDiscipline pq;

    @BeforeEach
    void setUp() {
        pq = new PriorityDiscipline();
    }

    @Test
    void shouldProcessHighestPriorityFirst() {
        pq.admit(new Packet(1, 0.0, 1, 1.0));
        pq.admit(new Packet(2, 1.0, 3, 1.0));
        pq.admit(new Packet(3, 2.0, 2, 1.0));

        assertEquals(3, pq.processNext().orElseThrow().priority());
        assertEquals(2, pq.processNext().orElseThrow().priority());
        assertEquals(1, pq.processNext().orElseThrow().priority());
    }

    @Test
    void shouldBreakTiesByEarlierArrival() {
        pq.admit(new Packet(1, 2.0, 2, 1.0));
        pq.admit(new Packet(2, 0.5, 2, 1.0));
        pq.admit(new Packet(3, 1.0, 2, 1.0));

        assertEquals(2, pq.processNext().orElseThrow().id());
        assertEquals(3, pq.processNext().orElseThrow().id());
        assertEquals(1, pq.processNext().orElseThrow().id());
    }

    @Test
    void shouldKeepAdmissionOrderForIdenticalKeys() {
        for (int id = 0; id < 5; id++) {
            pq.admit(new Packet(id, 0.0, 1, 1.0));
        }

        for (int id = 0; id < 5; id++) {
            assertEquals(id, pq.processNext().orElseThrow().id());
        }
    }

    @Test
    void shouldBeUnboundedByDefault() {
        for (int id = 0; id < 1000; id++) {
            assertTrue(pq.admit(new Packet(id, 0.0, 1 + id % 3, 1.0)));
        }

        assertEquals(1000, pq.size());
        assertTrue(pq.droppedPackets().isEmpty());
    }

    @Test
    void shouldTailDropWhenBoundedAndFull() {
        PriorityDiscipline bounded = new PriorityDiscipline(2);
        bounded.admit(new Packet(1, 0.0, 1, 1.0));
        bounded.admit(new Packet(2, 0.0, 1, 1.0));
        Packet urgent = new Packet(3, 0.0, 5, 1.0);

        assertFalse(bounded.admit(urgent));
        assertEquals(List.of(urgent), bounded.droppedPackets());
    }

    @Test
    void shouldReturnEmptyWhenNothingQueued() {
        assertTrue(pq.processNext().isEmpty());
    }
}
