package queuesim.discipline;

import queuesim.metrics.Metrics;
import queuesim.metrics.MetricsCalculator;
import queuesim.packet.Packet;
import queuesim.simulation.SimulationClock;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.SortedMap;
import java.util.logging.Logger;

/**
 * Shared state and service bookkeeping for the queueing disciplines.
 *
 * Subclasses decide admission ({@link #enqueue(Packet)}) and selection ({@link #dequeueNext()});
 * this class owns the clock, the capacity bound and the processed and dropped collections.
 */
public abstract class AbstractQueueingDiscipline implements QueueingDiscipline {

    private static final Logger logger = Logger.getLogger(AbstractQueueingDiscipline.class.getName());

    private final DisciplineType type;
    private final OptionalInt capacity;
    private final SimulationClock clock = new SimulationClock();
    private final List<Packet> processed = new ArrayList<>();
    private final List<Packet> dropped = new ArrayList<>();

    protected AbstractQueueingDiscipline(DisciplineType type, OptionalInt capacity) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.capacity = Objects.requireNonNull(capacity, "capacity cannot be null");
        if (capacity.isPresent() && capacity.getAsInt() < 1) {
            throw new IllegalArgumentException("Capacity must be positive, got: " + capacity.getAsInt());
        }
    }

    /**
     * Queues or drops the arriving packet according to this discipline's policy.
     *
     * @return true if the packet was queued
     */
    protected abstract boolean enqueue(Packet packet);

    /**
     * Removes the packet to be serviced next and updates any selection state.
     *
     * @return the selected packet, or null if nothing is queued
     */
    protected abstract Packet dequeueNext();

    /**
     * Clears the subclass's queues and accumulators.
     */
    protected abstract void clearQueues();

    @Override
    public String name() {
        return type.displayName();
    }

    @Override
    public DisciplineType type() {
        return type;
    }

    public OptionalInt capacity() {
        return capacity;
    }

    /**
     * True when a capacity bound is set and the queued packets have reached it.
     */
    protected boolean isFull() {
        return capacity.isPresent() && size() >= capacity.getAsInt();
    }

    @Override
    public final boolean admit(Packet packet) {
        if (packet == null) {
            throw new IllegalArgumentException("Packet cannot be null");
        }
        boolean queued = enqueue(packet);
        if (queued) {
            logger.fine(() -> String.format("%s t=%.3f admitted packet %d (flow %d), queued=%d",
                    name(), clock.now(), packet.id(), packet.flowId(), size()));
        }
        return queued;
    }

    @Override
    public final Optional<Packet> processNext() {
        Packet packet = dequeueNext();
        if (packet == null) {
            return Optional.empty();
        }
        if (!packet.isStarted()) {
            packet.markStarted(clock.now());
        }
        packet.markFinished(clock.advanceBy(packet.serviceTime()));
        processed.add(packet);
        logger.fine(() -> String.format("%s serviced packet %d (flow %d), finished at t=%.3f",
                name(), packet.id(), packet.flowId(), clock.now()));
        return Optional.of(packet);
    }

    /**
     * Records a packet as dropped. Used both for rejected arrivals and for evicted packets.
     */
    protected void drop(Packet packet) {
        dropped.add(packet);
        logger.fine(() -> String.format("%s t=%.3f dropped packet %d (flow %d)",
                name(), clock.now(), packet.id(), packet.flowId()));
    }

    @Override
    public double currentTime() {
        return clock.now();
    }

    @Override
    public void advanceTo(double time) {
        clock.advanceTo(time);
    }

    @Override
    public List<Packet> processedPackets() {
        return Collections.unmodifiableList(processed);
    }

    @Override
    public List<Packet> droppedPackets() {
        return Collections.unmodifiableList(dropped);
    }

    @Override
    public SortedMap<Integer, List<Packet>> processedByFlow() {
        return MetricsCalculator.groupByFlow(processed);
    }

    @Override
    public SortedMap<Integer, List<Packet>> droppedByFlow() {
        return MetricsCalculator.groupByFlow(dropped);
    }

    @Override
    public final void reset() {
        clearQueues();
        clock.reset();
        processed.clear();
        dropped.clear();
    }

    @Override
    public Metrics metrics() {
        return MetricsCalculator.calculate(processed, dropped, clock.now());
    }

    @Override
    public String toString() {
        return name() + "[queued=" + size() + ", processed=" + processed.size() + ", dropped=" + dropped.size() + "]";
    }
}
