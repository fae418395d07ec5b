package in.oracore.service.detector;

/**
 * Opaque pretrained model. Receives the feature vector in
 * {@link in.oracore.service.indicator.IndicatorSnapshot#FEATURE_NAMES} order.
 */
public interface ScoringModel {

    int modelVersion();

    ModelScore score(double[] features);
}
