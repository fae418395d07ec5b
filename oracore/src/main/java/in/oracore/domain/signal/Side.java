package in.oracore.domain.signal;

public enum Side {
    LONG,
    SHORT
}
