package in.oracore.domain.baseline;

import in.oracore.domain.data.Timeframe;
import in.oracore.domain.signal.FeatureSnapshot;

import java.time.Instant;

/**
 * Negative training sample: a bar where no detector fired, with its feature snapshot.
 */
public record Baseline(
        Long id,
        String symbol,
        Timeframe timeframe,
        Instant timestamp,
        int labelVersion,
        FeatureSnapshot features,
        Instant createdAt) {
}
