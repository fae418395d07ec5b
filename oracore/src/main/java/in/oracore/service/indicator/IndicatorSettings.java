package in.oracore.service.indicator;

import java.util.Set;
import java.util.TreeSet;

/**
 * Stream-independent indicator settings.
 *
 * @param relVolumeWindow  bars averaged for relative volume
 * @param channelLookbacks lookbacks for which prior max-high and prior mean-volume are tracked
 */
public record IndicatorSettings(int relVolumeWindow, Set<Integer> channelLookbacks) {

    public static final int DEFAULT_REL_VOLUME_WINDOW = 20;

    /** Longest indicator window (SMA/EMA 200). Replaying this many bars warms every value. */
    public static final int WARMUP_BARS = 250;

    public IndicatorSettings {
        if (relVolumeWindow <= 0) {
            throw new IllegalArgumentException("relVolumeWindow must be positive");
        }
        channelLookbacks = Set.copyOf(new TreeSet<>(channelLookbacks));
        for (int lookback : channelLookbacks) {
            if (lookback <= 0) {
                throw new IllegalArgumentException("Channel lookback must be positive: " + lookback);
            }
        }
    }

    public static IndicatorSettings defaults() {
        return new IndicatorSettings(DEFAULT_REL_VOLUME_WINDOW, Set.of());
    }

    public IndicatorSettings withLookbacks(Set<Integer> lookbacks) {
        Set<Integer> merged = new TreeSet<>(channelLookbacks);
        merged.addAll(lookbacks);
        return new IndicatorSettings(relVolumeWindow, merged);
    }

    public int warmupBars() {
        int longestChannel = channelLookbacks.stream().mapToInt(Integer::intValue).max().orElse(0);
        return Math.max(WARMUP_BARS, longestChannel + 1);
    }
}
