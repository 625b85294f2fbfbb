package queuesim.discipline;

import java.util.Objects;

/**
 * The closed set of queueing disciplines. {@link #create(DisciplineConfig)} is the single
 * place where a variant is chosen.
 */
public enum DisciplineType {
    FCFS("fcfs", "FCFS"),
    PRIORITY("priority", "Priority Queue"),
    ROUND_ROBIN("rr", "Round-Robin"),
    FAIR_QUEUE("fq", "Fair Queue"),
    LAS("las", "LAS Queue");

    private final String shortName;
    private final String displayName;

    DisciplineType(String shortName, String displayName) {
        this.shortName = shortName;
        this.displayName = displayName;
    }

    public String shortName() {
        return shortName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Creates a fresh discipline of this type.
     *
     * @param config construction parameters
     * @return a new discipline in its initial state
     */
    public QueueingDiscipline create(DisciplineConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        return switch (this) {
            case FCFS -> new FcfsDiscipline(config.capacity());
            case PRIORITY -> new PriorityDiscipline(config.capacity());
            case ROUND_ROBIN -> new RoundRobinDiscipline(config.roundRobinQueues(), config.timeQuantum(), config.capacity());
            case FAIR_QUEUE -> new FairQueueDiscipline(config.fairQueueMode(), config.capacity());
            case LAS -> new LasDiscipline(config.capacity());
        };
    }

    /**
     * Parses a type from its short name ("fcfs", "priority", "rr", "fq", "las") or enum name.
     *
     * @throws IllegalArgumentException if the name matches no type
     */
    public static DisciplineType fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Discipline name cannot be null");
        }
        String trimmed = name.trim();
        for (DisciplineType type : values()) {
            if (type.shortName.equalsIgnoreCase(trimmed) || type.name().equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown discipline: " + name);
    }
}
