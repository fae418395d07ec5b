package in.oracore.domain.outcome;

import in.oracore.domain.data.Timeframe;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Forward window used for labeling: {@code bars} bars of {@code timeframe} after a signal.
 *
 * The window is read from the horizon's own stream, so it moves in whole buckets of that
 * timeframe. When the signal fired on a finer stream, the coarse bucket holding the signal bar
 * is never observed, and the last bar may close after {@link #targetEnd} by up to one bucket
 * less one signal bar. A 1m signal at 14:32 with horizon {@code 15m:2} reads the 14:45 and
 * 15:00 bars: nothing from 14:33 to 14:44 counts, and the 15:00 bar runs to 15:15.
 */
public record Horizon(Timeframe timeframe, int bars) {

    public Horizon {
        Objects.requireNonNull(timeframe, "timeframe");
        if (bars <= 0) {
            throw new IllegalArgumentException("Horizon bars must be positive: " + bars);
        }
    }

    /**
     * Parse {@code "15m:4"} style horizon codes.
     */
    public static Horizon parse(String code) {
        String[] parts = code.split(":");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Horizon must look like '<timeframe>:<bars>': " + code);
        }
        try {
            return new Horizon(Timeframe.fromCode(parts[0]), Integer.parseInt(parts[1].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Horizon bars is not a number: " + code, e);
        }
    }

    public Instant targetEnd(Instant firedAt) {
        return firedAt.plus(timeframe.width().multipliedBy(bars));
    }

    /**
     * Grid timestamps of {@code timeframe} lying in {@code (firedAt, targetEnd]}, the first being
     * the bucket boundary after {@code firedAt}. There are exactly {@code bars} of them.
     */
    public List<Instant> expectedBarTimes(Instant firedAt) {
        List<Instant> times = new ArrayList<>(bars);
        Instant ts = timeframe.floor(firedAt).plus(timeframe.width());
        for (int i = 0; i < bars; i++) {
            times.add(ts);
            ts = ts.plus(timeframe.width());
        }
        return times;
    }

    public String code() {
        return timeframe.code() + ":" + bars;
    }

    @Override
    public String toString() {
        return code();
    }
}
