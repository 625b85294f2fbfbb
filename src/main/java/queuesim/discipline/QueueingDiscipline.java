package queuesim.discipline;

import queuesim.metrics.Metrics;
import queuesim.packet.Packet;

import java.util.List;
import java.util.Optional;
import java.util.SortedMap;

/**
 * A queueing discipline: the admission, selection and eviction policy of one
 * finite or unbounded buffer in front of a single server.
 *
 * A discipline owns its queues, its logical clock and the processed and dropped
 * collections. It is driven one step at a time by the simulator and is single-threaded.
 */
public interface QueueingDiscipline {

    /**
     * Human-readable name used in reports.
     */
    String name();

    DisciplineType type();

    /**
     * Offers an arriving packet to the discipline. The discipline may queue it, drop it,
     * or queue it while evicting another packet, depending on its policy.
     *
     * @param packet the arriving packet
     * @return true if the offered packet was queued, false if it was dropped
     */
    boolean admit(Packet packet);

    /**
     * Selects the next packet and services it to completion: sets its start time
     * (if unset), advances the clock by its service time, sets its finish time and
     * appends it to the processed list.
     *
     * @return the serviced packet, or empty if nothing is queued
     */
    Optional<Packet> processNext();

    boolean isEmpty();

    /**
     * Number of packets currently queued across all internal queues.
     */
    int size();

    /**
     * Current simulated time of this discipline's clock.
     */
    double currentTime();

    /**
     * Moves the clock forward to the given time while the server is idle.
     */
    void advanceTo(double time);

    /**
     * Packets serviced so far, in service order.
     */
    List<Packet> processedPackets();

    /**
     * Packets dropped so far, in drop order.
     */
    List<Packet> droppedPackets();

    /**
     * Processed packets grouped by flow id.
     */
    SortedMap<Integer, List<Packet>> processedByFlow();

    /**
     * Dropped packets grouped by flow id.
     */
    SortedMap<Integer, List<Packet>> droppedByFlow();

    /**
     * Clears queues, clock, collections and any fairness accumulators for a new run.
     */
    void reset();

    /**
     * Computes metrics over the current processed and dropped collections.
     */
    Metrics metrics();
}
