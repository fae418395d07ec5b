package in.oracore.service.detector;

import in.oracore.domain.signal.Signal;

import java.util.List;

/**
 * Outcome of running every detector on one bar.
 *
 * @param emitted    signals newly written by this evaluation
 * @param duplicates firings whose signal already existed
 */
public record DetectionResult(List<Signal> emitted, int duplicates, List<DetectorFailure> failures) {

    public static final DetectionResult EMPTY = new DetectionResult(List.of(), 0, List.of());
}
