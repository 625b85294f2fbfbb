package queuesim.traffic;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Parameters of a generated packet stream.
 * Immutable configuration object with builder pattern support.
 */
public final class TrafficProfile {

    private final int packetCount;
    private final double arrivalRate;
    private final SortedMap<Integer, Double> priorityWeights;
    private final List<SizeBand> sizeBands;
    private final double minServiceTime;
    private final double maxServiceTime;
    private final TrafficModel model;
    private final int burstSize;

    private TrafficProfile(Builder builder) {
        this.packetCount = builder.packetCount;
        this.arrivalRate = builder.arrivalRate;
        this.priorityWeights = Collections.unmodifiableSortedMap(new TreeMap<>(builder.priorityWeights));
        this.sizeBands = List.copyOf(builder.sizeBands);
        this.minServiceTime = builder.minServiceTime;
        this.maxServiceTime = builder.maxServiceTime;
        this.model = builder.model;
        this.burstSize = builder.burstSize;

        validate();
    }

    private void validate() {
        if (packetCount < 0) {
            throw new IllegalArgumentException("packetCount cannot be negative");
        }
        if (!Double.isFinite(arrivalRate) || arrivalRate <= 0.0) {
            throw new IllegalArgumentException("arrivalRate must be positive");
        }
        if (priorityWeights.isEmpty()) {
            throw new IllegalArgumentException("priorityWeights cannot be empty");
        }
        for (Map.Entry<Integer, Double> entry : priorityWeights.entrySet()) {
            if (entry.getKey() <= 0) {
                throw new IllegalArgumentException("Priorities must be positive, got: " + entry.getKey());
            }
            if (entry.getValue() == null || !Double.isFinite(entry.getValue()) || entry.getValue() < 0.0) {
                throw new IllegalArgumentException("Priority weights must be non-negative");
            }
        }
        if (priorityWeights.values().stream().mapToDouble(Double::doubleValue).sum() <= 0.0) {
            throw new IllegalArgumentException("At least one priority weight must be positive");
        }
        if (sizeBands.isEmpty() || sizeBands.stream().mapToDouble(SizeBand::weight).sum() <= 0.0) {
            throw new IllegalArgumentException("sizeBands must contain a positive weight");
        }
        if (!Double.isFinite(minServiceTime) || minServiceTime <= 0.0 || maxServiceTime < minServiceTime) {
            throw new IllegalArgumentException("Service time range must satisfy 0 < min <= max");
        }
        if (model == null) {
            throw new IllegalArgumentException("model cannot be null");
        }
        if (burstSize <= 0) {
            throw new IllegalArgumentException("burstSize must be positive");
        }
    }

    public int packetCount() {
        return packetCount;
    }

    public double arrivalRate() {
        return arrivalRate;
    }

    public SortedMap<Integer, Double> priorityWeights() {
        return priorityWeights;
    }

    public List<SizeBand> sizeBands() {
        return sizeBands;
    }

    public double minServiceTime() {
        return minServiceTime;
    }

    public double maxServiceTime() {
        return maxServiceTime;
    }

    public TrafficModel model() {
        return model;
    }

    public int burstSize() {
        return burstSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TrafficProfile defaults() {
        return builder().build();
    }

    @Override
    public String toString() {
        return String.format("TrafficProfile{packets=%d, rate=%.2f, model=%s, priorities=%s, service=[%.2f, %.2f]}",
                packetCount, arrivalRate, model, priorityWeights, minServiceTime, maxServiceTime);
    }

    /**
     * Builder for TrafficProfile with fluent API.
     */
    public static final class Builder {
        private int packetCount = 100;
        private double arrivalRate = 1.0;
        private Map<Integer, Double> priorityWeights = Map.of(1, 0.5, 2, 0.3, 3, 0.2);
        private List<SizeBand> sizeBands = List.of(
                new SizeBand(500, 1000, 0.3),
                new SizeBand(1000, 2000, 0.5),
                new SizeBand(2000, 5000, 0.2));
        private double minServiceTime = 0.5;
        private double maxServiceTime = 2.0;
        private TrafficModel model = TrafficModel.POISSON;
        private int burstSize = 10;

        public Builder packetCount(int packetCount) {
            this.packetCount = packetCount;
            return this;
        }

        public Builder arrivalRate(double arrivalRate) {
            this.arrivalRate = arrivalRate;
            return this;
        }

        public Builder priorityWeights(Map<Integer, Double> priorityWeights) {
            this.priorityWeights = priorityWeights;
            return this;
        }

        public Builder sizeBands(List<SizeBand> sizeBands) {
            this.sizeBands = sizeBands;
            return this;
        }

        public Builder serviceTimeRange(double min, double max) {
            this.minServiceTime = min;
            this.maxServiceTime = max;
            return this;
        }

        public Builder model(TrafficModel model) {
            this.model = model;
            return this;
        }

        public Builder burstSize(int burstSize) {
            this.burstSize = burstSize;
            return this;
        }

        public TrafficProfile build() {
            if (priorityWeights == null || sizeBands == null) {
                throw new IllegalArgumentException("priorityWeights and sizeBands cannot be null");
            }
            return new TrafficProfile(this);
        }
    }
}
