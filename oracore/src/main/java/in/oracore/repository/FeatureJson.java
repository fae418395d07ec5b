package in.oracore.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.oracore.domain.signal.FeatureSnapshot;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSONB mapping for feature snapshots. Null feature values are kept as JSON nulls so
 * warm-up gaps stay visible to consumers.
 */
final class FeatureJson {
    private static final TypeReference<LinkedHashMap<String, Double>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    FeatureJson(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    String write(FeatureSnapshot snapshot) throws JsonProcessingException {
        return objectMapper.writeValueAsString(snapshot.values());
    }

    FeatureSnapshot read(String json, int schemaVersion) throws JsonProcessingException {
        Map<String, Double> values = json == null ? Map.of() : objectMapper.readValue(json, MAP_TYPE);
        return new FeatureSnapshot(schemaVersion, values);
    }
}
