package in.oracore.service.detector;

/**
 * @param probability  model confidence in [0, 1]
 * @param targetReturn expected forward return as a fraction, may be null
 */
public record ModelScore(double probability, Double targetReturn) {
}
