package in.oracore.service.detector;

import in.oracore.config.DetectorConfig;
import in.oracore.domain.common.ConfigValidationException;
import in.oracore.domain.detector.DetectorDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the closed set of detector implementations from configuration.
 */
public final class DetectorFactory {

    private final Map<String, ScoringModel> models;

    /**
     * @param models scoring models available to {@code model} detectors, by name
     */
    public DetectorFactory(Map<String, ScoringModel> models) {
        this.models = Map.copyOf(models);
    }

    public Detector create(DetectorConfig config) {
        DetectorDefinition definition = config.definition();
        return switch (config.type()) {
            case BreakoutDetector.TYPE -> new BreakoutDetector(definition);
            case Breakout20Detector.TYPE -> new Breakout20Detector(definition);
            case VolumeFlushDetector.TYPE -> new VolumeFlushDetector(definition);
            case ModelDetector.TYPE -> {
                String modelName = definition.stringParam("model", null);
                if (modelName == null) {
                    throw new ConfigValidationException("Model detector " + definition.key() + " has no 'model' parameter");
                }
                ScoringModel model = models.get(modelName);
                if (model == null) {
                    throw new ConfigValidationException(
                        "Model detector " + definition.key() + " references unknown model '" + modelName + "'");
                }
                yield new ModelDetector(definition, model);
            }
            default -> throw new ConfigValidationException(
                "Unknown detector type '" + config.type() + "' for " + definition.key());
        };
    }

    public List<Detector> createAll(List<DetectorConfig> configs) {
        List<Detector> detectors = new ArrayList<>(configs.size());
        for (DetectorConfig config : configs) {
            detectors.add(create(config));
        }
        return detectors;
    }
}
