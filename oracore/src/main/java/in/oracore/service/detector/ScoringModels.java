package in.oracore.service.detector;

import in.oracore.domain.common.ConfigValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.ServiceLoader;

/**
 * Collects the scoring models available to this process.
 */
public final class ScoringModels {
    private static final Logger log = LoggerFactory.getLogger(ScoringModels.class);

    /**
     * Models from every {@link ScoringModelProvider} on the classpath. Empty when none is installed,
     * in which case any configured model detector fails validation.
     */
    public static Map<String, ScoringModel> discover() {
        Map<String, ScoringModel> models = merge(ServiceLoader.load(ScoringModelProvider.class));
        if (models.isEmpty()) {
            log.info("No scoring model providers installed; model detectors are unavailable");
        }
        return models;
    }

    static Map<String, ScoringModel> merge(Iterable<? extends ScoringModelProvider> providers) {
        Map<String, ScoringModel> merged = new LinkedHashMap<>();
        for (ScoringModelProvider provider : providers) {
            for (Map.Entry<String, ScoringModel> e : provider.models().entrySet()) {
                if (merged.putIfAbsent(e.getKey(), e.getValue()) != null) {
                    throw new ConfigValidationException("Scoring model '" + e.getKey() + "' is provided twice");
                }
                log.info("✓ Scoring model '{}' v{} from {}", e.getKey(), e.getValue().modelVersion(),
                    provider.getClass().getName());
            }
        }
        return Map.copyOf(merged);
    }

    private ScoringModels() {}
}
