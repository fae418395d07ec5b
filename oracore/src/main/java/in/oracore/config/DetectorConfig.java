package in.oracore.config;

import in.oracore.domain.detector.DetectorDefinition;

/**
 * One configured detector: its implementation type plus its versioned definition.
 */
public record DetectorConfig(String type, DetectorDefinition definition) {
}
