package queuesim.metrics;

import java.util.List;

/**
 * Immutable summary of a simulation run.
 *
 * @param averageLatency mean of finish - arrival over processed packets
 * @param averageWaitingTime mean of start - arrival over processed packets
 * @param throughput processed packets per unit of simulated time
 * @param processedCount packets serviced
 * @param droppedCount packets dropped
 * @param dropRate dropped / (processed + dropped)
 * @param packetFairnessIndex Jain's index over individual packet latencies
 * @param flowFairnessIndex the per-flow index reported for comparison, see {@code flowFairnessBasis}
 * @param flowFairnessBasis which per-flow index {@code flowFairnessIndex} holds
 * @param flowLatencyFairness Jain's index over per-flow average latency
 * @param flowThroughputFairness Jain's index over per-flow processed / offered ratio
 * @param flows per-flow breakdown, ordered by flow id
 */
public record Metrics(double averageLatency,
                      double averageWaitingTime,
                      double throughput,
                      int processedCount,
                      int droppedCount,
                      double dropRate,
                      double packetFairnessIndex,
                      double flowFairnessIndex,
                      FlowFairnessBasis flowFairnessBasis,
                      double flowLatencyFairness,
                      double flowThroughputFairness,
                      List<FlowStats> flows) {

    public Metrics {
        flows = List.copyOf(flows);
    }

    public int offeredCount() {
        return processedCount + droppedCount;
    }
}
