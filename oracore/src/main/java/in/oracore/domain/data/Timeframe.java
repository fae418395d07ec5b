package in.oracore.domain.data;

import java.time.Duration;
import java.time.Instant;

/**
 * Bar timeframes supported by the pipeline.
 *
 * Buckets are aligned to the unix epoch in UTC, so a 1d bar opens at UTC midnight
 * and a 1h bar opens on the hour.
 */
public enum Timeframe {
    MINUTE_1("1m", 1),
    MINUTE_5("5m", 5),
    MINUTE_15("15m", 15),
    HOUR_1("1h", 60),
    HOUR_4("4h", 240),
    HOUR_5("5h", 300),
    DAY_1("1d", 1440);

    private final String code;
    private final int minutes;

    Timeframe(String code, int minutes) {
        this.code = code;
        this.minutes = minutes;
    }

    public String code() {
        return code;
    }

    public int minutes() {
        return minutes;
    }

    public Duration width() {
        return Duration.ofMinutes(minutes);
    }

    /**
     * Floor a timestamp to the open of the bucket that contains it.
     */
    public Instant floor(Instant ts) {
        long widthMs = width().toMillis();
        long epochMs = ts.toEpochMilli();
        return Instant.ofEpochMilli(Math.floorDiv(epochMs, widthMs) * widthMs);
    }

    /**
     * True when every bucket of this timeframe is an exact union of {@code finer} buckets.
     */
    public boolean isMultipleOf(Timeframe finer) {
        return minutes >= finer.minutes && minutes % finer.minutes == 0;
    }

    public boolean isFinerThan(Timeframe other) {
        return minutes < other.minutes;
    }

    /**
     * Parse a timeframe code such as {@code 15m} or {@code 1d}.
     *
     * @throws IllegalArgumentException for unknown codes
     */
    public static Timeframe fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Timeframe code is null");
        }
        String normalized = code.trim().toLowerCase();
        for (Timeframe tf : values()) {
            if (tf.code.equals(normalized)) {
                return tf;
            }
        }
        throw new IllegalArgumentException("Unknown timeframe: " + code);
    }

    @Override
    public String toString() {
        return code;
    }
}
