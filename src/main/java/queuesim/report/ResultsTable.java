package queuesim.report;

import queuesim.metrics.FlowStats;
import queuesim.metrics.Metrics;

import java.util.Map;

/**
 * Plain-text rendering of a discipline comparison.
 */
public final class ResultsTable {

    private static final String RULE = "=".repeat(112);

    private ResultsTable() {}

    /**
     * Renders one row per discipline with latency, waiting time, throughput, drop rate
     * and both fairness indices.
     */
    public static String render(Map<String, Metrics> results) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n');
        sb.append(String.format("%-22s %-13s %-13s %-12s %-10s %-10s %-10s %-10s%n",
                "Discipline", "Avg Latency", "Avg Waiting", "Throughput", "Processed", "Dropped", "Pkt Fair", "Flow Fair"));
        sb.append("-".repeat(112)).append('\n');
        results.forEach((name, m) -> sb.append(String.format("%-22s %-13.4f %-13.4f %-12.4f %-10d %-10s %-10.4f %-10.4f%n",
                name, m.averageLatency(), m.averageWaitingTime(), m.throughput(), m.processedCount(),
                String.format("%d (%.1f%%)", m.droppedCount(), m.dropRate() * 100), m.packetFairnessIndex(), m.flowFairnessIndex())));
        sb.append(RULE).append('\n');
        sb.append("Pkt Fair = Jain's index over packet latencies; Flow Fair = Jain's index per flow (range 0-1)\n");
        return sb.toString();
    }

    /**
     * Renders the per-flow drop breakdown of one discipline.
     */
    public static String renderFlows(String discipline, Metrics metrics) {
        StringBuilder sb = new StringBuilder();
        sb.append(discipline).append(" by flow:\n");
        for (FlowStats flow : metrics.flows()) {
            sb.append(String.format("  Flow %-3d processed %4d, dropped %4d/%-4d (%.1f%%), avg latency %.3f%n",
                    flow.flowId(), flow.processed(), flow.dropped(), flow.offered(),
                    (1.0 - flow.throughputRatio()) * 100, flow.averageLatency()));
        }
        return sb.toString();
    }
}
