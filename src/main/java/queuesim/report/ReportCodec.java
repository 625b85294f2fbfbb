package queuesim.report;

public interface ReportCodec {

    /**
     * Encodes a report into bytes.
     *
     * @param report the report to encode
     * @return the encoded report
     * @throws ReportCodecException if encoding fails or report is null
     */
    byte[] encode(SimulationReport report);

    /**
     * Decodes bytes produced by {@link #encode(SimulationReport)}.
     *
     * @param data the encoded report
     * @return the decoded report
     * @throws ReportCodecException if decoding fails
     */
    SimulationReport decode(byte[] data);
}
