package queuesim.report;

import queuesim.metrics.Metrics;

import java.util.Objects;

/**
 * Metrics of one discipline in a comparison.
 */
public record DisciplineResult(String discipline, Metrics metrics) {

    public DisciplineResult {
        Objects.requireNonNull(discipline, "discipline cannot be null");
        Objects.requireNonNull(metrics, "metrics cannot be null");
    }
}
