package queuesim.report;

/**
 * Thrown when a report cannot be encoded or decoded.
 */
public class ReportCodecException extends RuntimeException {

    public ReportCodecException(String message) {
        super(message);
    }

    public ReportCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
