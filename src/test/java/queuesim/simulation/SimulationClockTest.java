package queuesim.simulation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimulationClockTest {

    private SimulationClock clock;

    @BeforeEach
    void setUp() {
        clock = new SimulationClock();
    }

    @Test
    void shouldStartAtZero() {
        assertEquals(0.0, clock.now());
    }

    @Test
    void shouldAdvanceByDuration() {
        assertEquals(1.5, clock.advanceBy(1.5));
        assertEquals(2.0, clock.advanceBy(0.5));
        assertEquals(2.0, clock.now());
    }

    @Test
    void shouldJumpForwardButNeverBackward() {
        clock.advanceTo(10.0);
        assertEquals(10.0, clock.now());

        clock.advanceTo(4.0);
        assertEquals(10.0, clock.now());
    }

    @Test
    void shouldResetToZero() {
        clock.advanceBy(3.0);
        clock.reset();

        assertEquals(0.0, clock.now());
    }

    @Test
    void shouldRejectInvalidDurations() {
        assertThrows(IllegalArgumentException.class, () -> clock.advanceBy(-1.0));
        assertThrows(IllegalArgumentException.class, () -> clock.advanceBy(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> clock.advanceTo(Double.POSITIVE_INFINITY));
    }
}
