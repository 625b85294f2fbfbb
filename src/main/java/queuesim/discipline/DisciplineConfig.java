package queuesim.discipline;

import java.util.OptionalInt;

/**
 * Construction parameters shared by the queueing disciplines.
 * Immutable configuration object with builder pattern support.
 */
public final class DisciplineConfig {

    private final OptionalInt capacity;
    private final int roundRobinQueues;
    private final double timeQuantum;
    private final FairQueueMode fairQueueMode;

    private DisciplineConfig(Builder builder) {
        this.capacity = builder.capacity;
        this.roundRobinQueues = builder.roundRobinQueues;
        this.timeQuantum = builder.timeQuantum;
        this.fairQueueMode = builder.fairQueueMode;

        validate();
    }

    private void validate() {
        if (capacity.isPresent() && capacity.getAsInt() < 1) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity.getAsInt());
        }
        if (roundRobinQueues <= 0) {
            throw new IllegalArgumentException("roundRobinQueues must be positive, got: " + roundRobinQueues);
        }
        if (!Double.isFinite(timeQuantum) || timeQuantum <= 0.0) {
            throw new IllegalArgumentException("timeQuantum must be positive, got: " + timeQuantum);
        }
        if (fairQueueMode == null) {
            throw new IllegalArgumentException("fairQueueMode cannot be null");
        }
    }

    /**
     * Maximum number of queued packets, or empty when unbounded.
     */
    public OptionalInt capacity() {
        return capacity;
    }

    public int roundRobinQueues() {
        return roundRobinQueues;
    }

    public double timeQuantum() {
        return timeQuantum;
    }

    public FairQueueMode fairQueueMode() {
        return fairQueueMode;
    }

    /**
     * Creates a builder with default values.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a configuration with default values: unbounded, 3 round-robin queues,
     * a 0.5 time quantum and virtual-finish-time fair queueing.
     */
    public static DisciplineConfig defaults() {
        return builder().build();
    }

    /**
     * Creates a default configuration with the given capacity bound.
     */
    public static DisciplineConfig withCapacity(int capacity) {
        return builder().capacity(capacity).build();
    }

    @Override
    public String toString() {
        return String.format("DisciplineConfig{capacity=%s, roundRobinQueues=%d, timeQuantum=%.2f, fairQueueMode=%s}",
                capacity.isPresent() ? String.valueOf(capacity.getAsInt()) : "unbounded",
                roundRobinQueues, timeQuantum, fairQueueMode);
    }

    /**
     * Builder for DisciplineConfig with fluent API.
     */
    public static final class Builder {
        private OptionalInt capacity = OptionalInt.empty();
        private int roundRobinQueues = 3;
        private double timeQuantum = 0.5;
        private FairQueueMode fairQueueMode = FairQueueMode.VIRTUAL_FINISH_TIME;

        public Builder capacity(int capacity) {
            this.capacity = OptionalInt.of(capacity);
            return this;
        }

        public Builder unbounded() {
            this.capacity = OptionalInt.empty();
            return this;
        }

        public Builder roundRobinQueues(int roundRobinQueues) {
            this.roundRobinQueues = roundRobinQueues;
            return this;
        }

        public Builder timeQuantum(double timeQuantum) {
            this.timeQuantum = timeQuantum;
            return this;
        }

        public Builder fairQueueMode(FairQueueMode fairQueueMode) {
            this.fairQueueMode = fairQueueMode;
            return this;
        }

        public DisciplineConfig build() {
            return new DisciplineConfig(this);
        }
    }
}
