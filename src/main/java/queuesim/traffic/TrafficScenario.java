package queuesim.traffic;

import queuesim.packet.Packet;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Canned traffic mixes modelled on everyday applications, each with the buffer size it is
 * usually studied with. Flow ids stand for users, streams or transfers.
 */
public enum TrafficScenario {

    /** Three users sending short bursts of small text messages. */
    MESSAGE_TEXTING(15) {
        @Override
        void emit(TrafficGenerator gen, List<Packet> out) {
            for (int user = 1; user <= 3; user++) {
                int messages = gen.uniformInt(5, 15);
                double base = gen.uniform(0.0, 2.0);
                for (int msg = 0; msg < messages; msg++) {
                    double arrival = base + msg * gen.uniform(0.1, 0.5);
                    out.add(gen.packet(arrival, user, gen.uniformInt(100, 500), gen.uniform(0.01, 0.05)));
                }
            }
        }
    },

    /** An HD stream (flow 1) and an SD stream (flow 2) of regularly spaced video chunks. */
    VIDEO_STREAMING(25) {
        @Override
        void emit(TrafficGenerator gen, List<Packet> out) {
            for (int i = 0; i < 50; i++) {
                out.add(gen.packet(i * 0.1, 1, gen.uniformInt(3000, 5000), gen.uniform(0.3, 0.5)));
            }
            for (int i = 0; i < 30; i++) {
                out.add(gen.packet(i * 0.15 + 0.05, 2, gen.uniformInt(1000, 2000), gen.uniform(0.1, 0.2)));
            }
        }
    },

    /** Three conference participants, each with frequent audio and sparser video packets. */
    ONLINE_MEETING(30) {
        @Override
        void emit(TrafficGenerator gen, List<Packet> out) {
            for (int participant = 1; participant <= 3; participant++) {
                for (int i = 0; i < 30; i++) {
                    out.add(gen.packet(i * 0.05 + participant * 0.01, participant,
                            gen.uniformInt(200, 400), gen.uniform(0.02, 0.05)));
                }
                for (int i = 0; i < 15; i++) {
                    out.add(gen.packet(i * 0.2 + participant * 0.02, participant,
                            gen.uniformInt(1500, 3000), gen.uniform(0.1, 0.2)));
                }
            }
        }
    },

    /** One aggressive bulk download (flow 1) competing with two light background flows. */
    FILE_DOWNLOAD(20) {
        @Override
        void emit(TrafficGenerator gen, List<Packet> out) {
            for (int i = 0; i < 60; i++) {
                out.add(gen.packet(i * 0.05, 1, gen.uniformInt(4000, 5000), gen.uniform(0.4, 0.6)));
            }
            for (int i = 0; i < 15; i++) {
                out.add(gen.packet(i * 0.3 + 0.1, 2, gen.uniformInt(500, 1000), gen.uniform(0.05, 0.1)));
            }
            for (int i = 0; i < 10; i++) {
                out.add(gen.packet(i * 0.4 + 0.2, 3, gen.uniformInt(500, 1000), gen.uniform(0.05, 0.1)));
            }
        }
    },

    /** Two continuous downloads (flows 1-2) and ten short web requests (flows 3-12). */
    MICE_AND_ELEPHANTS(25) {
        @Override
        void emit(TrafficGenerator gen, List<Packet> out) {
            for (int i = 0; i < 40; i++) {
                out.add(gen.packet(i * 0.08, 1, gen.uniformInt(4000, 5000), gen.uniform(0.4, 0.6)));
            }
            for (int i = 0; i < 35; i++) {
                out.add(gen.packet(i * 0.09 + 0.5, 2, gen.uniformInt(4000, 5000), gen.uniform(0.4, 0.6)));
            }
            for (int mouse = 3; mouse <= 12; mouse++) {
                int packets = gen.uniformInt(2, 4);
                double start = gen.uniform(0.2, 2.5);
                for (int i = 0; i < packets; i++) {
                    out.add(gen.packet(start + i * 0.02, mouse, gen.uniformInt(200, 500), gen.uniform(0.02, 0.05)));
                }
            }
        }
    };

    private final int suggestedCapacity;

    TrafficScenario(int suggestedCapacity) {
        this.suggestedCapacity = suggestedCapacity;
    }

    /**
     * Buffer size this scenario is normally run with.
     */
    public int suggestedCapacity() {
        return suggestedCapacity;
    }

    abstract void emit(TrafficGenerator generator, List<Packet> out);

    /**
     * Generates this scenario's packets, sorted by arrival time.
     */
    public List<Packet> generate(TrafficGenerator generator) {
        List<Packet> packets = new ArrayList<>();
        emit(generator, packets);
        packets.sort(Comparator.comparingDouble(Packet::arrivalTime));
        return packets;
    }

    /**
     * Parses a scenario from its name, accepting dashes for underscores.
     *
     * @throws IllegalArgumentException if the name matches no scenario
     */
    public static TrafficScenario fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Scenario name cannot be null");
        }
        String normalized = name.trim().replace('-', '_');
        for (TrafficScenario scenario : values()) {
            if (scenario.name().equalsIgnoreCase(normalized)) {
                return scenario;
            }
        }
        throw new IllegalArgumentException("Unknown scenario: " + name);
    }
}
