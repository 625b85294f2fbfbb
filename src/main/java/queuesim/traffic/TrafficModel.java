package queuesim.traffic;

/**
 * Shape of the arrival process.
 */
public enum TrafficModel {
    /** Exponential inter-arrival gaps at the configured rate. */
    POISSON,
    /** Groups of closely spaced packets separated by longer exponential idle gaps. */
    BURSTY;

    /**
     * Parses a model from its name, case-insensitively.
     *
     * @throws IllegalArgumentException if the name matches no model
     */
    public static TrafficModel fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Traffic model cannot be null");
        }
        for (TrafficModel model : values()) {
            if (model.name().equalsIgnoreCase(name.trim())) {
                return model;
            }
        }
        throw new IllegalArgumentException("Unknown traffic model: " + name);
    }
}
