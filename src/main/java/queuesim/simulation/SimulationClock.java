package queuesim.simulation;

/**
 * Logical clock for a simulation run, in simulated seconds.
 *
 * The clock only moves when it is told to: by a service duration or by a jump to the
 * next arrival. It never reads wall time and never runs backwards.
 */
public final class SimulationClock {

    private double now = 0.0;

    /**
     * Gets the current simulated time without advancing it.
     */
    public double now() {
        return now;
    }

    /**
     * Advances the clock by the given duration and returns the new time.
     *
     * @param duration non-negative amount of simulated time
     * @return the new current time
     */
    public double advanceBy(double duration) {
        if (!Double.isFinite(duration) || duration < 0.0) {
            throw new IllegalArgumentException("Duration must be a non-negative finite value, got: " + duration);
        }
        now += duration;
        return now;
    }

    /**
     * Moves the clock forward to the given time. Earlier times are ignored.
     *
     * @param time the target time
     */
    public void advanceTo(double time) {
        if (!Double.isFinite(time)) {
            throw new IllegalArgumentException("Time must be finite, got: " + time);
        }
        if (time > now) {
            now = time;
        }
    }

    /**
     * Resets the clock to 0 for a new run.
     */
    public void reset() {
        now = 0.0;
    }
}
