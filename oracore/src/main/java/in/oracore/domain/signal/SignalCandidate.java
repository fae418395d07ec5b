package in.oracore.domain.signal;

import java.util.Map;

/**
 * What a detector returns when it fires: direction, a continuous score, and any
 * detector-specific values to append to the feature snapshot.
 */
public record SignalCandidate(Side side, double score, Map<String, Double> extraFeatures) {

    public SignalCandidate {
        extraFeatures = extraFeatures == null ? Map.of() : Map.copyOf(extraFeatures);
    }

    public static SignalCandidate of(Side side, double score) {
        return new SignalCandidate(side, score, Map.of());
    }
}
