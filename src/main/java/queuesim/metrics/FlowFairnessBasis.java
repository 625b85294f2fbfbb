package queuesim.metrics;

/**
 * Quantity the per-flow fairness index is computed over.
 */
public enum FlowFairnessBasis {
    /** Jain's index over each flow's average latency. */
    AVERAGE_LATENCY,
    /** Jain's index over each flow's processed / offered ratio. */
    THROUGHPUT_RATIO
}
