package queuesim.metrics;

import queuesim.packet.Packet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Derives {@link Metrics} from the processed and dropped packets of a finished run.
 * Pure functions only; nothing here mutates the packets.
 */
public final class MetricsCalculator {

    private MetricsCalculator() {}

    /**
     * Computes the metrics of a run.
     *
     * @param processed serviced packets; every one must have start and finish times
     * @param dropped dropped packets
     * @param finalTime the clock value when the run ended
     */
    public static Metrics calculate(List<Packet> processed, List<Packet> dropped, double finalTime) {
        List<Double> latencies = new ArrayList<>(processed.size());
        double latencySum = 0.0;
        double waitingSum = 0.0;
        for (Packet packet : processed) {
            double latency = packet.latency().orElseThrow(
                    () -> new IllegalStateException("Processed packet " + packet.id() + " has no finish time"));
            latencies.add(latency);
            latencySum += latency;
            waitingSum += packet.waitingTime().orElseThrow(
                    () -> new IllegalStateException("Processed packet " + packet.id() + " has no start time"));
        }

        int processedCount = processed.size();
        int droppedCount = dropped.size();
        int offered = processedCount + droppedCount;

        double averageLatency = processedCount > 0 ? latencySum / processedCount : 0.0;
        double averageWaiting = processedCount > 0 ? waitingSum / processedCount : 0.0;
        double throughput = finalTime > 0.0 ? processedCount / finalTime : 0.0;
        double dropRate = offered > 0 ? (double) droppedCount / offered : 0.0;

        List<FlowStats> flows = flowStats(processed, dropped);
        List<Double> flowLatencies = new ArrayList<>();
        List<Double> flowRatios = new ArrayList<>();
        for (FlowStats flow : flows) {
            if (flow.processed() > 0) {
                flowLatencies.add(flow.averageLatency());
            }
            flowRatios.add(flow.throughputRatio());
        }
        double flowLatencyFairness = JainFairness.index(flowLatencies);
        double flowThroughputFairness = JainFairness.index(flowRatios);

        // Without drops every ratio is 1, so latency is the only informative basis.
        FlowFairnessBasis basis = droppedCount > 0 ? FlowFairnessBasis.THROUGHPUT_RATIO : FlowFairnessBasis.AVERAGE_LATENCY;
        double flowFairness = basis == FlowFairnessBasis.THROUGHPUT_RATIO ? flowThroughputFairness : flowLatencyFairness;

        return new Metrics(
                averageLatency,
                averageWaiting,
                throughput,
                processedCount,
                droppedCount,
                dropRate,
                JainFairness.index(latencies),
                flowFairness,
                basis,
                flowLatencyFairness,
                flowThroughputFairness,
                flows);
    }

    /**
     * Per-flow breakdown over every flow that appears in either collection, ordered by flow id.
     */
    public static List<FlowStats> flowStats(List<Packet> processed, List<Packet> dropped) {
        SortedMap<Integer, List<Packet>> processedByFlow = groupByFlow(processed);
        SortedMap<Integer, List<Packet>> droppedByFlow = groupByFlow(dropped);
        SortedSet<Integer> flowIds = new TreeSet<>(processedByFlow.keySet());
        flowIds.addAll(droppedByFlow.keySet());

        List<FlowStats> stats = new ArrayList<>(flowIds.size());
        for (int flowId : flowIds) {
            List<Packet> served = processedByFlow.getOrDefault(flowId, List.of());
            int droppedCount = droppedByFlow.getOrDefault(flowId, List.of()).size();
            double latency = served.stream()
                    .mapToDouble(p -> p.latency().orElse(0.0))
                    .average()
                    .orElse(0.0);
            double ratio = (double) served.size() / (served.size() + droppedCount);
            stats.add(new FlowStats(flowId, served.size(), droppedCount, latency, ratio));
        }
        return stats;
    }

    /**
     * Groups packets by flow id, preserving their order within each flow.
     */
    public static SortedMap<Integer, List<Packet>> groupByFlow(List<Packet> packets) {
        TreeMap<Integer, List<Packet>> grouped = new TreeMap<>();
        for (Packet packet : packets) {
            grouped.computeIfAbsent(packet.flowId(), k -> new ArrayList<>()).add(packet);
        }
        grouped.replaceAll((flowId, list) -> Collections.unmodifiableList(list));
        return Collections.unmodifiableSortedMap(grouped);
    }
}
