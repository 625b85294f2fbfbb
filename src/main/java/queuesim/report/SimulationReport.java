package queuesim.report;

import queuesim.metrics.Metrics;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything needed to reproduce and compare one experiment.
 *
 * @param seed seed of the traffic generator
 * @param traffic description of the traffic (profile or scenario name)
 * @param packetCount packets offered to each discipline
 * @param capacity buffer bound, or null when unbounded
 * @param results per-discipline metrics, in comparison order
 */
public record SimulationReport(long seed, String traffic, int packetCount, Integer capacity,
                               List<DisciplineResult> results) {

    public SimulationReport {
        Objects.requireNonNull(traffic, "traffic cannot be null");
        results = List.copyOf(results);
    }

    /**
     * Builds a report from the ordered output of an experiment.
     */
    public static SimulationReport of(long seed, String traffic, int packetCount, Integer capacity,
                                      Map<String, Metrics> metricsByDiscipline) {
        List<DisciplineResult> results = new ArrayList<>();
        metricsByDiscipline.forEach((name, metrics) -> results.add(new DisciplineResult(name, metrics)));
        return new SimulationReport(seed, traffic, packetCount, capacity, results);
    }
}
