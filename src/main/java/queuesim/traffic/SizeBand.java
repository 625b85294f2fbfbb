package queuesim.traffic;

/**
 * A weighted range of packet sizes in bytes, both bounds inclusive.
 */
public record SizeBand(int minBytes, int maxBytes, double weight) {

    public SizeBand {
        if (minBytes < 0 || maxBytes < minBytes) {
            throw new IllegalArgumentException("Invalid size band: " + minBytes + "-" + maxBytes);
        }
        if (!Double.isFinite(weight) || weight < 0.0) {
            throw new IllegalArgumentException("Size band weight must be non-negative, got: " + weight);
        }
    }
}
