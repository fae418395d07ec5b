package in.oracore.domain.signal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named indicator values captured at a bar, tagged with the feature schema version
 * so downstream consumers can tell layouts apart. Values may be null during warm-up.
 *
 * Version 2 added OBV, ATR percent, distance from and slope of the 20/50/200 SMAs, and the
 * 10-bar volume spike alongside the version 1 indicators.
 */
public record FeatureSnapshot(int schemaVersion, Map<String, Double> values) {

    public static final int CURRENT_SCHEMA_VERSION = 2;

    public FeatureSnapshot {
        values = values == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static FeatureSnapshot of(Map<String, Double> values) {
        return new FeatureSnapshot(CURRENT_SCHEMA_VERSION, values);
    }

    public Double get(String name) {
        return values.get(name);
    }

    public FeatureSnapshot with(Map<String, Double> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        Map<String, Double> merged = new LinkedHashMap<>(values);
        merged.putAll(extra);
        return new FeatureSnapshot(schemaVersion, merged);
    }
}
