package in.oracore.service.baseline;

import in.oracore.domain.data.Timeframe;

import java.time.Instant;

/**
 * How far detection has got on a stream.
 *
 * Every stored bar with {@code ts < detectionFrontier} has been through every detector and any
 * signal it produced is already stored. Bars at or past the frontier may still fire.
 */
@FunctionalInterface
public interface DetectionProgress {

    Instant detectionFrontier(String symbol, Timeframe timeframe);
}
