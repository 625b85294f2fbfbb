package queuesim.traffic;

import queuesim.packet.Packet;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Generates packet streams from a {@link TrafficProfile}.
 *
 * The generator owns its random source and its id counter: two generators built with
 * the same seed produce identical streams, and consecutive calls on one generator
 * continue the id sequence.
 */
public class TrafficGenerator {

    private final Random random;
    private int nextPacketId = 0;

    /**
     * @param random seeded random generator for deterministic behavior
     */
    public TrafficGenerator(Random random) {
        if (random == null) {
            throw new IllegalArgumentException("Random cannot be null");
        }
        this.random = random;
    }

    public static TrafficGenerator seeded(long seed) {
        return new TrafficGenerator(new Random(seed));
    }

    /**
     * Generates {@code profile.packetCount()} packets in non-decreasing arrival order.
     */
    public List<Packet> generate(TrafficProfile profile) {
        List<Packet> packets = new ArrayList<>(profile.packetCount());
        double time = 0.0;
        for (int i = 0; i < profile.packetCount(); i++) {
            time += nextGap(profile, i);
            int priority = pickPriority(profile.priorityWeights());
            SizeBand band = pickBand(profile.sizeBands());
            int size = band.minBytes() + random.nextInt(band.maxBytes() - band.minBytes() + 1);
            double serviceTime = uniform(profile.minServiceTime(), profile.maxServiceTime());
            packets.add(new Packet(nextPacketId++, time, priority, size, serviceTime));
        }
        return packets;
    }

    private double nextGap(TrafficProfile profile, int index) {
        if (profile.model() == TrafficModel.POISSON) {
            return exponential(profile.arrivalRate());
        }
        int burst = profile.burstSize();
        // A burst opens after an idle gap worth a whole burst at the mean rate; its packets follow closely.
        return index % burst == 0
                ? exponential(profile.arrivalRate() / burst)
                : exponential(profile.arrivalRate() * burst);
    }

    private int pickPriority(Map<Integer, Double> weights) {
        double total = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        double target = random.nextDouble() * total;
        int chosen = -1;
        for (Map.Entry<Integer, Double> entry : weights.entrySet()) {
            if (entry.getValue() <= 0.0) {
                continue;
            }
            chosen = entry.getKey();
            target -= entry.getValue();
            if (target < 0.0) {
                break;
            }
        }
        return chosen;
    }

    private SizeBand pickBand(List<SizeBand> bands) {
        double total = bands.stream().mapToDouble(SizeBand::weight).sum();
        double target = random.nextDouble() * total;
        SizeBand chosen = null;
        for (SizeBand band : bands) {
            if (band.weight() <= 0.0) {
                continue;
            }
            chosen = band;
            target -= band.weight();
            if (target < 0.0) {
                break;
            }
        }
        return chosen;
    }

    double exponential(double rate) {
        return -Math.log(1.0 - random.nextDouble()) / rate;
    }

    double uniform(double min, double max) {
        return min + (max - min) * random.nextDouble();
    }

    int uniformInt(int min, int max) {
        return min + random.nextInt(max - min + 1);
    }

    /**
     * Next id this generator will assign.
     */
    public int nextPacketId() {
        return nextPacketId;
    }

    Packet packet(double arrivalTime, int flowId, int size, double serviceTime) {
        return new Packet(nextPacketId++, arrivalTime, flowId, size, serviceTime);
    }
}
