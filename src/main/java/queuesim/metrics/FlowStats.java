package queuesim.metrics;

/**
 * Outcome of one flow in a run.
 *
 * @param flowId the flow (priority) identifier
 * @param processed packets of this flow that were serviced
 * @param dropped packets of this flow that were dropped
 * @param averageLatency mean latency of the serviced packets, 0 if none
 * @param throughputRatio processed / offered, where offered = processed + dropped
 */
public record FlowStats(int flowId, int processed, int dropped, double averageLatency, double throughputRatio) {

    public FlowStats {
        if (processed < 0 || dropped < 0) {
            throw new IllegalArgumentException("Packet counts cannot be negative");
        }
    }

    public int offered() {
        return processed + dropped;
    }
}
