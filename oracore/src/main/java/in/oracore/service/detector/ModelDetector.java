package in.oracore.service.detector;

import in.oracore.domain.common.ConfigValidationException;
import in.oracore.domain.detector.DetectorDefinition;
import in.oracore.domain.detector.DetectorKind;
import in.oracore.domain.signal.Side;
import in.oracore.domain.signal.SignalCandidate;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fires when an injected scoring model is confident enough about the current bar.
 * Not evaluable until every feature in the vector has warmed up.
 */
public final class ModelDetector implements Detector {
    public static final String TYPE = "model";

    private final DetectorDefinition definition;
    private final ScoringModel model;
    private final double confidenceMin;
    private final Side side;

    public ModelDetector(DetectorDefinition definition, ScoringModel model) {
        if (definition.kind() != DetectorKind.MODEL) {
            throw new ConfigValidationException("Model detector " + definition.key() + " must be a model detector");
        }
        this.definition = definition;
        this.model = Objects.requireNonNull(model, "model");
        this.confidenceMin = definition.doubleParam("confidence_min", 0.75);
        if (confidenceMin < 0 || confidenceMin > 1) {
            throw new ConfigValidationException("Model detector " + definition.key() + ": confidence_min must be in [0, 1]");
        }
        try {
            this.side = Side.valueOf(definition.stringParam("side", "LONG").toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ConfigValidationException("Model detector " + definition.key() + ": side must be LONG or SHORT", e);
        }
    }

    @Override
    public DetectorDefinition definition() {
        return definition;
    }

    @Override
    public Optional<SignalCandidate> evaluate(DetectionContext context) {
        double[] features = context.current().featureVector();
        if (features == null) {
            return Optional.empty();
        }

        ModelScore score = model.score(features);
        if (score.probability() < confidenceMin) {
            return Optional.empty();
        }

        Map<String, Double> extra = new HashMap<>();
        extra.put("model_probability", score.probability());
        extra.put("model_version", (double) model.modelVersion());
        if (score.targetReturn() != null) {
            extra.put("model_target_return", score.targetReturn());
        }
        return Optional.of(new SignalCandidate(side, score.probability(), extra));
    }
}
