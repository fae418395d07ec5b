package in.oracore.service.detector;

import in.oracore.domain.data.StreamKey;

import java.time.Instant;

/**
 * A detector that threw or timed out on one bar. The bar is skipped for that detector only.
 */
public record DetectorFailure(String detectorKey, StreamKey stream, Instant barTimestamp, String reason) {
}
