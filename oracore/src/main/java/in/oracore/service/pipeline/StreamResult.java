package in.oracore.service.pipeline;

import in.oracore.domain.signal.Signal;
import in.oracore.service.detector.DetectorFailure;

import java.util.List;

/**
 * What one symbol's task did in a detection cycle.
 *
 * @param error null on success, otherwise why the stream failed this cycle
 */
public record StreamResult(
        String symbol,
        int barsIngested,
        int barsAggregated,
        List<Signal> signals,
        int duplicateSignals,
        List<DetectorFailure> detectorFailures,
        String error) {

    public static StreamResult failed(String symbol, String error) {
        return new StreamResult(symbol, 0, 0, List.of(), 0, List.of(), error);
    }

    public boolean isFailed() {
        return error != null;
    }
}
