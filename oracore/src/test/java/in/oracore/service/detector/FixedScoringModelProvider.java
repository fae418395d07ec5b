package in.oracore.service.detector;

import java.util.Map;

/**
 * Registered through META-INF/services for the discovery tests.
 */
public final class FixedScoringModelProvider implements ScoringModelProvider {

    static final ScoringModel ALWAYS_CONFIDENT = new ScoringModel() {
        @Override
        public int modelVersion() {
            return 3;
        }

        @Override
        public ModelScore score(double[] features) {
            return new ModelScore(0.9, 0.01);
        }
    };

    @Override
    public Map<String, ScoringModel> models() {
        return Map.of("always_confident", ALWAYS_CONFIDENT);
    }
}
