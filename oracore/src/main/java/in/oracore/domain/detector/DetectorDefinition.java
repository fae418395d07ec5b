package in.oracore.domain.detector;

import in.oracore.domain.common.ConfigValidationException;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, versioned detector identity plus its parameters.
 *
 * A given (id, version) always means the same parameters; changing a parameter
 * requires a new version.
 */
public record DetectorDefinition(
        String id,
        String version,
        DetectorKind kind,
        String description,
        Map<String, Object> params,
        Instant registeredAt) {

    public DetectorDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(kind, "kind");
        params = params == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public DetectorDefinition(String id, String version, DetectorKind kind, String description,
                              Map<String, Object> params) {
        this(id, version, kind, description, params, null);
    }

    public String key() {
        return id + "@" + version;
    }

    public double doubleParam(String name, double defaultValue) {
        Object value = params.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw new ConfigValidationException(
            "Detector " + key() + ": parameter '" + name + "' must be a number, got " + value);
    }

    public int intParam(String name, int defaultValue) {
        Object value = params.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue())) {
            return n.intValue();
        }
        throw new ConfigValidationException(
            "Detector " + key() + ": parameter '" + name + "' must be an integer, got " + value);
    }

    public String stringParam(String name, String defaultValue) {
        Object value = params.get(name);
        return value == null ? defaultValue : value.toString();
    }

    /**
     * Same kind and same parameters. Numbers compare by value so {@code 10} and
     * {@code 10.0} read back from JSONB are equal.
     */
    public boolean sameDefinitionAs(DetectorDefinition other) {
        if (kind != other.kind || params.size() != other.params.size()) {
            return false;
        }
        for (Map.Entry<String, Object> e : params.entrySet()) {
            Object mine = e.getValue();
            Object theirs = other.params.get(e.getKey());
            if (mine instanceof Number a && theirs instanceof Number b) {
                if (Double.compare(a.doubleValue(), b.doubleValue()) != 0) {
                    return false;
                }
            } else if (!Objects.equals(mine, theirs)) {
                return false;
            }
        }
        return true;
    }
}
