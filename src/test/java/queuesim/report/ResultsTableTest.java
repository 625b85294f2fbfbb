package queuesim.report;

import org.junit.jupiter.api.Test;
import queuesim.metrics.FlowFairnessBasis;
import queuesim.metrics.FlowStats;
import queuesim.metrics.Metrics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResultsTableTest {

    private static Metrics metrics(int processed, int dropped) {
        double dropRate = (double) dropped / (processed + dropped);
        return new Metrics(1.25, 0.5, 2.0, processed, dropped, dropRate, 0.9, 0.8,
                FlowFairnessBasis.THROUGHPUT_RATIO, 0.95, 0.8,
                List.of(new FlowStats(1, processed, dropped, 1.25, 1.0 - dropRate)));
    }

    @Test
    void shouldRenderOneRowPerDisciplineInOrder() {
        Map<String, Metrics> results = new LinkedHashMap<>();
        results.put("FCFS", metrics(10, 0));
        results.put("LAS Queue", metrics(8, 2));

        String table = ResultsTable.render(results);

        assertTrue(table.contains("Discipline"));
        assertTrue(table.indexOf("FCFS") < table.indexOf("LAS Queue"));
        assertTrue(table.contains("2 (20.0%)"));
        assertTrue(table.contains("1.2500"));
    }

    @Test
    void shouldRenderFlowBreakdown() {
        String flows = ResultsTable.renderFlows("Fair Queue", metrics(6, 24));

        assertTrue(flows.startsWith("Fair Queue by flow:"));
        assertTrue(flows.contains("Flow 1"));
        assertTrue(flows.contains("(80.0%)"));
    }
}
