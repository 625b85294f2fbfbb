package queuesim.cmd;

import queuesim.discipline.DisciplineConfig;
import queuesim.discipline.DisciplineType;
import queuesim.discipline.FairQueueMode;
import queuesim.discipline.QueueingDiscipline;
import queuesim.metrics.Metrics;
import queuesim.packet.Packet;
import queuesim.report.JsonReportCodec;
import queuesim.report.ResultsTable;
import queuesim.report.SimulationReport;
import queuesim.simulation.ExperimentRunner;
import queuesim.traffic.TrafficGenerator;
import queuesim.traffic.TrafficModel;
import queuesim.traffic.TrafficProfile;
import queuesim.traffic.TrafficScenario;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command-line entry point: generates traffic, runs the chosen disciplines over it and
 * prints the comparison, optionally saving a JSON report.
 */
public class SimulationApplication {

    private static final List<DisciplineType> DEFAULT_DISCIPLINES = List.of(DisciplineType.values());

    private final long seed;
    private final Integer capacity;
    private final TrafficScenario scenario;
    private final TrafficProfile profile;
    private final DisciplineConfig disciplineConfig;
    private final List<DisciplineType> disciplines;
    private final Path reportPath;

    public SimulationApplication(int packetCount, double arrivalRate, long seed, Integer capacity,
                                 TrafficModel trafficModel, TrafficScenario scenario, FairQueueMode fairQueueMode,
                                 List<DisciplineType> disciplines, Path reportPath) {
        if (disciplines == null || disciplines.isEmpty()) {
            throw new IllegalArgumentException("At least one discipline is required");
        }
        this.seed = seed;
        this.capacity = capacity;
        this.scenario = scenario;
        this.disciplines = List.copyOf(disciplines);
        this.reportPath = reportPath;

        // Both builders validate, so bad option values fail here rather than mid-run.
        this.profile = scenario != null ? null : TrafficProfile.builder()
                .packetCount(packetCount)
                .arrivalRate(arrivalRate)
                .model(trafficModel)
                .build();
        Integer bound = capacity != null || scenario == null ? capacity : Integer.valueOf(scenario.suggestedCapacity());
        DisciplineConfig.Builder config = DisciplineConfig.builder().fairQueueMode(fairQueueMode);
        if (bound != null) {
            config.capacity(bound);
        }
        this.disciplineConfig = config.build();
    }

    public static SimulationApplication fromArgs(String[] args) {
        int packets = 100;
        double rate = 2.0;
        long seed = 42L;
        Integer capacity = null;
        TrafficModel model = TrafficModel.POISSON;
        TrafficScenario scenario = null;
        FairQueueMode mode = FairQueueMode.VIRTUAL_FINISH_TIME;
        List<DisciplineType> disciplines = DEFAULT_DISCIPLINES;
        Path report = null;
        for (String arg : args) {
            if (arg.startsWith("--packets=")) packets = Integer.parseInt(arg.substring(10));
            else if (arg.startsWith("--rate=")) rate = Double.parseDouble(arg.substring(7));
            else if (arg.startsWith("--seed=")) seed = Long.parseLong(arg.substring(7));
            else if (arg.startsWith("--capacity=")) capacity = Integer.parseInt(arg.substring(11));
            else if (arg.startsWith("--traffic=")) model = TrafficModel.fromName(arg.substring(10));
            else if (arg.startsWith("--scenario=")) scenario = TrafficScenario.fromName(arg.substring(11));
            else if (arg.startsWith("--fq-mode=")) mode = FairQueueMode.fromName(arg.substring(10));
            else if (arg.startsWith("--disciplines=")) {
                disciplines = Arrays.stream(arg.substring(14).split(","))
                        .filter(s -> !s.isBlank())
                        .map(DisciplineType::fromName)
                        .toList();
            }
            else if (arg.startsWith("--report=")) report = Path.of(arg.substring(9));
            else throw new IllegalArgumentException("Unknown option: " + arg);
        }
        return new SimulationApplication(packets, rate, seed, capacity, model, scenario, mode, disciplines, report);
    }

    /**
     * Generates the traffic, runs the comparison and returns the report.
     */
    public SimulationReport run() {
        TrafficGenerator generator = TrafficGenerator.seeded(seed);
        List<Packet> packets;
        String traffic;
        if (scenario != null) {
            packets = scenario.generate(generator);
            traffic = scenario.name();
        } else {
            packets = generator.generate(profile);
            traffic = profile.toString();
        }

        List<QueueingDiscipline> instances = disciplines.stream()
                .map(type -> type.create(disciplineConfig))
                .toList();

        Map<String, Metrics> results = new ExperimentRunner().compare(packets, instances);
        Integer bound = disciplineConfig.capacity().isPresent() ? Integer.valueOf(disciplineConfig.capacity().getAsInt()) : null;
        return SimulationReport.of(seed, traffic, packets.size(), bound, results);
    }

    public Path getReportPath() {
        return reportPath;
    }

    public List<DisciplineType> getDisciplines() {
        return disciplines;
    }

    public Integer getCapacity() {
        return capacity;
    }

    public static void main(String[] args) {
        if (Arrays.asList(args).contains("--help")) {
            printUsage();
            return;
        }

        SimulationApplication app;
        try {
            app = fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            printUsage();
            System.exit(1);
            return;
        }

        SimulationReport report = app.run();
        System.out.println("Traffic: " + report.traffic());
        System.out.println("Packets: " + report.packetCount() + ", capacity: "
                + (report.capacity() == null ? "unbounded" : report.capacity()) + ", seed: " + report.seed());
        Map<String, Metrics> results = new LinkedHashMap<>();
        report.results().forEach(r -> results.put(r.discipline(), r.metrics()));
        System.out.print(ResultsTable.render(results));
        if (report.capacity() != null) {
            results.forEach((name, metrics) -> System.out.print(ResultsTable.renderFlows(name, metrics)));
        }

        if (app.getReportPath() != null) {
            try {
                new JsonReportCodec().write(report, app.getReportPath());
                System.out.println("Report saved to: " + app.getReportPath());
            } catch (IOException e) {
                System.err.println("Failed to write report: " + e.getMessage());
                System.exit(1);
            }
        }
    }

    private static void printUsage() {
        System.out.println("Queueing discipline simulator");
        System.out.println("Usage: SimulationApplication [options]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --packets=<n>          Number of generated packets (default: 100)");
        System.out.println("  --rate=<r>             Mean arrival rate in packets/second (default: 2.0)");
        System.out.println("  --seed=<n>             Random seed for reproducible traffic (default: 42)");
        System.out.println("  --capacity=<n>         Buffer bound in packets (default: unbounded)");
        System.out.println("  --traffic=<model>      poisson|bursty (default: poisson)");
        System.out.println("  --scenario=<name>      message_texting|video_streaming|online_meeting|file_download|mice_and_elephants");
        System.out.println("  --disciplines=<list>   Comma-separated: fcfs,priority,rr,fq,las (default: all)");
        System.out.println("  --fq-mode=<mode>       vft|vrr fair queue bookkeeping (default: vft)");
        System.out.println("  --report=<file.json>   Write a JSON report");
        System.out.println("  --help                 Show this help message");
    }
}
