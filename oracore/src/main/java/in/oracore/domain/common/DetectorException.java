package in.oracore.domain.common;

/**
 * A detector threw or overran its time budget while evaluating one bar.
 */
public class DetectorException extends RuntimeException {
    private final String detectorKey;

    public DetectorException(String detectorKey, String message, Throwable cause) {
        super("Detector " + detectorKey + ": " + message, cause);
        this.detectorKey = detectorKey;
    }

    public String getDetectorKey() {
        return detectorKey;
    }
}
