package queuesim.packet;

import java.util.Comparator;
import java.util.OptionalDouble;

/**
 * A packet offered to a queueing discipline.
 *
 * The arrival descriptor (id, arrival time, priority, size, service time) is immutable.
 * The timing outcome (start and finish time) is written exactly once, when a discipline
 * services the packet. The priority doubles as the flow identifier.
 */
public final class Packet {

    /**
     * Selection order for priority-based disciplines: higher priority first,
     * ties broken by earlier arrival.
     */
    public static final Comparator<Packet> PRIORITY_ORDER = Comparator
            .comparingInt(Packet::priority).reversed()
            .thenComparingDouble(Packet::arrivalTime);

    private final int id;
    private final double arrivalTime;
    private final int priority;
    private final int size;
    private final double serviceTime;

    private Double startTime;
    private Double finishTime;

    /**
     * Creates a packet with its arrival descriptor.
     *
     * @param id unique identifier
     * @param arrivalTime logical arrival time in seconds (non-negative)
     * @param priority priority and flow identifier (positive)
     * @param size size in bytes (non-negative, informational only)
     * @param serviceTime time needed to service the packet (positive)
     * @throws IllegalArgumentException if any argument is out of range
     */
    public Packet(int id, double arrivalTime, int priority, int size, double serviceTime) {
        if (!Double.isFinite(arrivalTime) || arrivalTime < 0.0) {
            throw new IllegalArgumentException("Arrival time must be a non-negative finite value, got: " + arrivalTime);
        }
        if (priority <= 0) {
            throw new IllegalArgumentException("Priority must be positive, got: " + priority);
        }
        if (size < 0) {
            throw new IllegalArgumentException("Size cannot be negative, got: " + size);
        }
        if (!Double.isFinite(serviceTime) || serviceTime <= 0.0) {
            throw new IllegalArgumentException("Service time must be a positive finite value, got: " + serviceTime);
        }
        this.id = id;
        this.arrivalTime = arrivalTime;
        this.priority = priority;
        this.size = size;
        this.serviceTime = serviceTime;
    }

    /**
     * Creates a packet with the default size of 1000 bytes.
     */
    public Packet(int id, double arrivalTime, int priority, double serviceTime) {
        this(id, arrivalTime, priority, 1000, serviceTime);
    }

    public int id() {
        return id;
    }

    public double arrivalTime() {
        return arrivalTime;
    }

    public int priority() {
        return priority;
    }

    /**
     * The flow this packet belongs to. Flows are keyed by priority.
     */
    public int flowId() {
        return priority;
    }

    public int size() {
        return size;
    }

    public double serviceTime() {
        return serviceTime;
    }

    public boolean isStarted() {
        return startTime != null;
    }

    public boolean isFinished() {
        return finishTime != null;
    }

    public OptionalDouble startTime() {
        return startTime == null ? OptionalDouble.empty() : OptionalDouble.of(startTime);
    }

    public OptionalDouble finishTime() {
        return finishTime == null ? OptionalDouble.empty() : OptionalDouble.of(finishTime);
    }

    /**
     * Records the time service began.
     *
     * @throws IllegalStateException if the start time was already set
     */
    public void markStarted(double time) {
        if (startTime != null) {
            throw new IllegalStateException("Packet " + id + " already started at " + startTime);
        }
        this.startTime = time;
    }

    /**
     * Records the time service completed.
     *
     * @throws IllegalStateException if the packet was never started or already finished
     */
    public void markFinished(double time) {
        if (startTime == null) {
            throw new IllegalStateException("Packet " + id + " cannot finish before it starts");
        }
        if (finishTime != null) {
            throw new IllegalStateException("Packet " + id + " already finished at " + finishTime);
        }
        this.finishTime = time;
    }

    /**
     * Total time in the system: finish minus arrival. Empty until the packet has finished.
     */
    public OptionalDouble latency() {
        return finishTime == null ? OptionalDouble.empty() : OptionalDouble.of(finishTime - arrivalTime);
    }

    /**
     * Time spent queued before service began. Empty until the packet has started.
     */
    public OptionalDouble waitingTime() {
        return startTime == null ? OptionalDouble.empty() : OptionalDouble.of(startTime - arrivalTime);
    }

    /**
     * Returns a fresh packet with the same arrival descriptor and no timing outcome.
     */
    public Packet copy() {
        return new Packet(id, arrivalTime, priority, size, serviceTime);
    }

    @Override
    public String toString() {
        return String.format("Packet[id=%d, arrival=%.2f, priority=%d, size=%d, service=%.2f]",
                id, arrivalTime, priority, size, serviceTime);
    }
}
