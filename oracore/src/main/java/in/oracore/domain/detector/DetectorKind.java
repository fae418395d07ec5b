package in.oracore.domain.detector;

/**
 * Closed set of detector families.
 */
public enum DetectorKind {
    /** Deterministic rule over indicator values. */
    RULE,
    /** Wraps an injected scoring model. */
    MODEL;

    public static DetectorKind fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Detector kind is null");
        }
        return switch (code.trim().toLowerCase()) {
            case "rule" -> RULE;
            case "model", "ml" -> MODEL;
            default -> throw new IllegalArgumentException("Unknown detector kind: " + code);
        };
    }
}
