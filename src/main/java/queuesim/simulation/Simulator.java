package queuesim.simulation;

import queuesim.discipline.QueueingDiscipline;
import queuesim.metrics.Metrics;
import queuesim.packet.Packet;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

/**
 * Simulator drives one queueing discipline through a packet stream in logical time.
 *
 * Each step follows the same order:
 * 1. Admit every packet whose arrival time has been reached
 * 2. If anything is queued, service exactly one packet (the clock advances by its service time)
 * 3. Otherwise jump the clock to the next arrival
 *
 * The loop ends once the input is exhausted and the discipline is empty. There is no wall
 * clock and no concurrency, so the same input always produces the same timeline.
 */
public class Simulator {

    private static final Logger logger = Logger.getLogger(Simulator.class.getName());

    private long steps = 0;

    /**
     * Runs the packets through the discipline and returns the resulting metrics.
     *
     * The discipline is reset first. The packets are serviced in place, so callers that
     * compare several disciplines must give each one its own copies.
     *
     * @param packets the packet stream, in any order
     * @param discipline the discipline to drive
     * @return metrics computed from the discipline's processed and dropped packets
     */
    public Metrics run(List<Packet> packets, QueueingDiscipline discipline) {
        if (packets == null) {
            throw new IllegalArgumentException("Packets cannot be null");
        }
        if (discipline == null) {
            throw new IllegalArgumentException("Discipline cannot be null");
        }

        // List.sort is stable: packets arriving together keep their input order.
        List<Packet> arrivals = new ArrayList<>(packets);
        arrivals.sort(Comparator.comparingDouble(Packet::arrivalTime));

        discipline.reset();
        steps = 0;
        logger.info(() -> "Starting " + discipline.name() + " with " + arrivals.size() + " packets");

        int cursor = 0;
        while (cursor < arrivals.size() || !discipline.isEmpty()) {
            while (cursor < arrivals.size() && arrivals.get(cursor).arrivalTime() <= discipline.currentTime()) {
                discipline.admit(arrivals.get(cursor));
                cursor++;
            }

            if (!discipline.isEmpty()) {
                discipline.processNext();
            } else if (cursor < arrivals.size()) {
                discipline.advanceTo(arrivals.get(cursor).arrivalTime());
            }
            steps++;
        }

        Metrics metrics = discipline.metrics();
        logger.info(() -> String.format("Finished %s at t=%.3f: processed=%d, dropped=%d",
                discipline.name(), discipline.currentTime(), metrics.processedCount(), metrics.droppedCount()));
        return metrics;
    }

    /**
     * Number of loop iterations taken by the last run.
     */
    public long getSteps() {
        return steps;
    }
}
