package in.oracore.domain.signal;

import in.oracore.domain.data.Timeframe;

import java.time.Instant;

/**
 * Natural key of a signal. At most one signal exists per key.
 */
public record SignalKey(
        String symbol,
        Timeframe timeframe,
        Instant firedAt,
        String detectorId,
        String detectorVersion) {
}
