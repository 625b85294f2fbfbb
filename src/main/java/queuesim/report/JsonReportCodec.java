package queuesim.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public final class JsonReportCodec implements ReportCodec {

    private final ObjectMapper objectMapper;

    public JsonReportCodec() {
        this.objectMapper = createConfiguredObjectMapper();
    }

    /**
     * Creates an ObjectMapper for the report records.
     * Jackson maps records by their components, so no annotations are needed.
     */
    public static ObjectMapper createConfiguredObjectMapper() {
        return new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public byte[] encode(SimulationReport report) {
        if (report == null) {
            throw new ReportCodecException("Cannot encode null report");
        }
        try {
            return objectMapper.writeValueAsBytes(report);
        } catch (Exception e) {
            throw new ReportCodecException("Failed to encode report", e);
        }
    }

    @Override
    public SimulationReport decode(byte[] data) {
        try {
            return objectMapper.readValue(data, SimulationReport.class);
        } catch (Exception e) {
            throw new ReportCodecException("Failed to decode report", e);
        }
    }

    /**
     * Encodes the report and writes it to the given file, creating parent directories.
     */
    public void write(SimulationReport report, Path file) throws IOException {
        byte[] bytes = encode(report);
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(file, bytes);
    }
}
