package in.oracore.service.detector;

import in.oracore.domain.common.ConfigValidationException;
import in.oracore.domain.detector.DetectorDefinition;
import in.oracore.domain.detector.DetectorKind;
import in.oracore.domain.signal.Side;
import in.oracore.domain.signal.SignalCandidate;
import in.oracore.service.indicator.IndicatorSnapshot;

import java.util.Map;
import java.util.Optional;

/**
 * Capitulation-style volume flush: relative volume at or above {@code min_ratio} on a down
 * bar. Fires SHORT on the first bar of such a run.
 */
public final class VolumeFlushDetector implements Detector {
    public static final String TYPE = "volume_flush";

    private final DetectorDefinition definition;
    private final double minRatio;

    public VolumeFlushDetector(DetectorDefinition definition) {
        if (definition.kind() != DetectorKind.RULE) {
            throw new ConfigValidationException("Volume flush detector " + definition.key() + " must be a rule detector");
        }
        this.definition = definition;
        this.minRatio = definition.doubleParam("min_ratio", 3.0);
        if (minRatio <= 0) {
            throw new ConfigValidationException("Volume flush detector " + definition.key() + ": min_ratio must be > 0");
        }
    }

    @Override
    public DetectorDefinition definition() {
        return definition;
    }

    @Override
    public Optional<SignalCandidate> evaluate(DetectionContext context) {
        IndicatorSnapshot now = context.current();
        if (!Boolean.TRUE.equals(flushing(now))) {
            return Optional.empty();
        }
        if (context.previous() != null && Boolean.TRUE.equals(flushing(context.previous()))) {
            return Optional.empty();
        }
        double score = now.relVolume() / minRatio - 1.0;
        return Optional.of(new SignalCandidate(Side.SHORT, score, Map.of("flush_ratio", now.relVolume())));
    }

    private Boolean flushing(IndicatorSnapshot snapshot) {
        if (snapshot.relVolume() == null) {
            return null;
        }
        return snapshot.relVolume() >= minRatio && snapshot.close() < snapshot.open();
    }
}
