package in.oracore.domain.signal;

/**
 * Which part of the US equity trading day a bar belongs to.
 */
public enum SessionFlag {
    PRE,
    REGULAR,
    AFTER
}
