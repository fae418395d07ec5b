package in.oracore.service.detector;

import in.oracore.domain.common.ConfigValidationException;
import in.oracore.domain.detector.DetectorDefinition;
import in.oracore.domain.detector.DetectorKind;
import in.oracore.domain.signal.Side;
import in.oracore.domain.signal.SignalCandidate;
import in.oracore.service.indicator.IndicatorSnapshot;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Price/volume breakout.
 *
 * Breakout state at a bar: close above the max high of the preceding {@code lookback} bars
 * and volume above {@code volume_multiplier} times their mean volume. The detector fires
 * only on the first bar of a run, when the state holds now and did not hold on the
 * previous bar.
 */
public final class BreakoutDetector implements Detector {
    public static final String TYPE = "breakout";

    private final DetectorDefinition definition;
    private final int lookback;
    private final double volumeMultiplier;
    private final int volumeLookback;

    public BreakoutDetector(DetectorDefinition definition) {
        if (definition.kind() != DetectorKind.RULE) {
            throw new ConfigValidationException("Breakout detector " + definition.key() + " must be a rule detector");
        }
        this.definition = definition;
        this.lookback = definition.intParam("lookback", 10);
        this.volumeMultiplier = definition.doubleParam("volume_multiplier", 1.5);
        this.volumeLookback = definition.intParam("volume_lookback", lookback);

        if (lookback < 1 || volumeLookback < 1) {
            throw new ConfigValidationException("Breakout detector " + definition.key() + ": lookbacks must be >= 1");
        }
        if (volumeMultiplier <= 0) {
            throw new ConfigValidationException("Breakout detector " + definition.key() + ": volume_multiplier must be > 0");
        }
    }

    @Override
    public DetectorDefinition definition() {
        return definition;
    }

    @Override
    public Set<Integer> requiredLookbacks() {
        return lookback == volumeLookback ? Set.of(lookback) : Set.of(lookback, volumeLookback);
    }

    @Override
    public Optional<SignalCandidate> evaluate(DetectionContext context) {
        IndicatorSnapshot now = context.current();
        if (!Boolean.TRUE.equals(inBreakout(now))) {
            return Optional.empty();
        }
        if (context.previous() != null && Boolean.TRUE.equals(inBreakout(context.previous()))) {
            return Optional.empty();
        }

        double priorHigh = now.priorHigh(lookback);
        double avgVolume = now.priorMeanVolume(volumeLookback);
        double score = (now.close() / priorHigh - 1.0) + (now.volume() / (volumeMultiplier * avgVolume) - 1.0);

        return Optional.of(new SignalCandidate(Side.LONG, score, Map.of(
            "breakout_prior_high", priorHigh,
            "breakout_avg_volume", avgVolume)));
    }

    /**
     * @return null when the inputs are not warm yet
     */
    private Boolean inBreakout(IndicatorSnapshot snapshot) {
        Double priorHigh = snapshot.priorHigh(lookback);
        Double avgVolume = snapshot.priorMeanVolume(volumeLookback);
        if (priorHigh == null || avgVolume == null) {
            return null;
        }
        return snapshot.close() > priorHigh && snapshot.volume() > volumeMultiplier * avgVolume;
    }
}
