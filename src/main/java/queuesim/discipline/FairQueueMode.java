package queuesim.discipline;

/**
 * Fairness bookkeeping used by {@link FairQueueDiscipline}.
 */
public enum FairQueueMode {
    /**
     * Global virtual clock plus a last virtual finish time per flow. The flow whose head
     * packet has the smallest candidate finish time is served, approximating bit-by-bit
     * round robin.
     */
    VIRTUAL_FINISH_TIME("vft"),

    /**
     * Each flow accumulates its own granted service. The flow with the smallest total is
     * served, which rotates strictly among active flows.
     */
    VIRTUAL_ROUND_ROBIN("vrr");

    private final String shortName;

    FairQueueMode(String shortName) {
        this.shortName = shortName;
    }

    public String shortName() {
        return shortName;
    }

    /**
     * Parses a mode from its short name ("vft", "vrr") or enum name.
     *
     * @throws IllegalArgumentException if the name matches no mode
     */
    public static FairQueueMode fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Fair queue mode cannot be null");
        }
        for (FairQueueMode mode : values()) {
            if (mode.shortName.equalsIgnoreCase(name) || mode.name().equalsIgnoreCase(name)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown fair queue mode: " + name);
    }
}
