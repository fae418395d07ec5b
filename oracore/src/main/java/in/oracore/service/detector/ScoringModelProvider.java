package in.oracore.service.detector;

import java.util.Map;

/**
 * Supplies pretrained scoring models to {@code model} detectors.
 *
 * Implementations are found with {@link java.util.ServiceLoader}: list the class in
 * {@code META-INF/services/in.oracore.service.detector.ScoringModelProvider} on the classpath.
 */
@FunctionalInterface
public interface ScoringModelProvider {

    /**
     * @return models by the name a detector's {@code model} parameter refers to
     */
    Map<String, ScoringModel> models();
}
