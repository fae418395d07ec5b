package in.oracore.config;

import java.time.Duration;

/**
 * Baseline sampling settings.
 *
 * @param window stored history (ending now) sampled on each run
 */
public record BaselineConfig(
        boolean enabled,
        double samplingRate,
        int minSpacingBars,
        long seed,
        Duration window) {
}
