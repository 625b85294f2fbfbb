package queuesim.simulation;

import queuesim.discipline.QueueingDiscipline;
import queuesim.metrics.Metrics;
import queuesim.packet.Packet;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Runs the same packet stream through several disciplines for comparison.
 * Every discipline gets its own deep copy of the stream, so runs never share packet state.
 */
public class ExperimentRunner {

    private static final Logger logger = Logger.getLogger(ExperimentRunner.class.getName());

    private final Simulator simulator;

    public ExperimentRunner() {
        this(new Simulator());
    }

    public ExperimentRunner(Simulator simulator) {
        if (simulator == null) {
            throw new IllegalArgumentException("Simulator cannot be null");
        }
        this.simulator = simulator;
    }

    /**
     * Runs each discipline over a fresh copy of the packets.
     *
     * @param packets the shared packet stream; never mutated
     * @param disciplines the disciplines to compare, in report order
     * @return metrics keyed by discipline name, in the order the disciplines were given
     * @throws IllegalArgumentException if two disciplines share a name
     */
    public Map<String, Metrics> compare(List<Packet> packets, List<? extends QueueingDiscipline> disciplines) {
        if (packets == null || disciplines == null) {
            throw new IllegalArgumentException("Packets and disciplines cannot be null");
        }
        logger.info(() -> "Comparing " + disciplines.size() + " disciplines over " + packets.size() + " packets");

        Map<String, Metrics> results = new LinkedHashMap<>();
        for (QueueingDiscipline discipline : disciplines) {
            if (results.containsKey(discipline.name())) {
                throw new IllegalArgumentException("Duplicate discipline name: " + discipline.name());
            }
            results.put(discipline.name(), simulator.run(copyOf(packets), discipline));
        }
        return results;
    }

    /**
     * Deep copy of the packets with cleared timing outcomes.
     */
    public static List<Packet> copyOf(List<Packet> packets) {
        return packets.stream().map(Packet::copy).toList();
    }
}
