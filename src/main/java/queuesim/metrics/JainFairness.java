package queuesim.metrics;

import java.util.Collection;

/**
 * Jain's fairness index: {@code (Σx)² / (n · Σx²)}, 1.0 when all values are equal.
 */
public final class JainFairness {

    private JainFairness() {}

    /**
     * Computes the index over the given non-negative values.
     *
     * @return 1.0 when there are fewer than two values, 0.0 when every value is zero,
     *         otherwise a value in (0, 1]
     */
    public static double index(Collection<Double> values) {
        int n = values.size();
        if (n <= 1) {
            return 1.0;
        }
        double sum = 0.0;
        double sumOfSquares = 0.0;
        for (double value : values) {
            sum += value;
            sumOfSquares += value * value;
        }
        if (sumOfSquares == 0.0) {
            return 0.0;
        }
        // Rounding can push a perfectly fair set a hair above 1.
        return Math.min(1.0, (sum * sum) / (n * sumOfSquares));
    }
}
