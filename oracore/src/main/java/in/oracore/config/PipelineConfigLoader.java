package in.oracore.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.oracore.domain.common.ConfigValidationException;
import in.oracore.domain.detector.DetectorDefinition;
import in.oracore.domain.detector.DetectorKind;
import in.oracore.domain.data.Timeframe;
import in.oracore.domain.outcome.HitPriority;
import in.oracore.domain.outcome.Horizon;
import in.oracore.domain.outcome.OutcomeThresholds;
import in.oracore.service.indicator.IndicatorSettings;
import in.oracore.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Builds {@link PipelineConfig} from the JSON pipeline file plus environment overrides.
 *
 * The file comes from {@code PIPELINE_CONFIG} when set, else classpath {@code pipeline.json}.
 * Scalar settings (watchlist, timeframes, shards, timeouts, labeling and baseline knobs) can be
 * overridden per deployment through environment variables; detectors and horizons come only
 * from the file. Anything unparseable raises {@link ConfigValidationException}.
 */
public final class PipelineConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(PipelineConfigLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String DEFAULT_RESOURCE = "pipeline.json";

    private final Function<String, String> env;

    public PipelineConfigLoader() {
        this(key -> Env.get(key, null));
    }

    /**
     * @param env variable lookup returning null for unset keys
     */
    public PipelineConfigLoader(Function<String, String> env) {
        this.env = env;
    }

    public PipelineConfig load() {
        String path = env.apply("PIPELINE_CONFIG");
        if (path != null) {
            log.info("Loading pipeline config from {}", path);
            try (InputStream in = Files.newInputStream(Path.of(path))) {
                return load(in);
            } catch (IOException e) {
                throw new ConfigValidationException("Cannot read pipeline config " + path + ": " + e.getMessage(), e);
            }
        }

        log.info("Loading pipeline config from classpath {}", DEFAULT_RESOURCE);
        try (InputStream in = PipelineConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new ConfigValidationException("Pipeline config not found on classpath: " + DEFAULT_RESOURCE);
            }
            return load(in);
        } catch (IOException e) {
            throw new ConfigValidationException("Cannot read pipeline config " + DEFAULT_RESOURCE + ": " + e.getMessage(), e);
        }
    }

    public PipelineConfig load(InputStream in) {
        JsonNode root;
        try {
            root = MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigValidationException("Pipeline config is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigValidationException("Pipeline config must be a JSON object");
        }
        try {
            return build(root);
        } catch (IllegalArgumentException e) {
            throw new ConfigValidationException("Invalid pipeline config: " + e.getMessage(), e);
        }
    }

    private PipelineConfig build(JsonNode root) {
        List<String> watchlist = listOverride("WATCHLIST", strings(root.path("watchlist")));
        Timeframe base = Timeframe.fromCode(stringOverride("BASE_TIMEFRAME", root.path("baseTimeframe").asText("1m")));
        List<Timeframe> aggregates = listOverride("AGGREGATE_TIMEFRAMES", strings(root.path("aggregateTimeframes")))
            .stream().map(Timeframe::fromCode).toList();

        int shards = intOverride("WORKER_SHARDS", root.path("workerShards").asInt(4));
        long timeoutMs = longOverride("DETECTOR_TIMEOUT_MS", root.path("detectorTimeoutMs").asLong(2000));
        long backfillDays = longOverride("BACKFILL_DAYS", root.path("backfillDays").asLong(5));
        long cycleSeconds = longOverride("CYCLE_INTERVAL_SECONDS", root.path("cycleIntervalSeconds").asLong(60));
        int relVolumeWindow = root.path("indicators").path("relVolumeWindow")
            .asInt(IndicatorSettings.DEFAULT_REL_VOLUME_WINDOW);

        List<DetectorConfig> detectors = new ArrayList<>();
        for (JsonNode node : root.path("detectors")) {
            detectors.add(detector(node));
        }

        return new PipelineConfig(
            watchlist.stream().map(s -> s.trim().toUpperCase()).toList(),
            base,
            aggregates,
            shards,
            Duration.ofMillis(timeoutMs),
            Duration.ofDays(backfillDays),
            Duration.ofSeconds(cycleSeconds),
            relVolumeWindow,
            detectors,
            labeling(root.path("labeling")),
            baseline(root.path("baseline")));
    }

    private DetectorConfig detector(JsonNode node) {
        String id = required(node, "id");
        String version = required(node, "version");
        String type = required(node, "type");
        DetectorKind kind = DetectorKind.fromCode(node.path("kind").asText("rule"));

        Map<String, Object> params;
        try {
            params = MAPPER.convertValue(node.path("params").isMissingNode()
                ? MAPPER.createObjectNode() : node.path("params"), new TypeReference<Map<String, Object>>() {});
        } catch (IllegalArgumentException e) {
            throw new ConfigValidationException("Detector " + id + "@" + version + ": params must be an object", e);
        }

        DetectorDefinition definition = new DetectorDefinition(id, version, kind,
            node.path("description").asText(null), params);
        return new DetectorConfig(type, definition);
    }

    private LabelingConfig labeling(JsonNode node) {
        List<Horizon> horizons = strings(node.path("horizons")).stream().map(Horizon::parse).toList();

        JsonNode t = node.path("thresholds");
        OutcomeThresholds defaults = OutcomeThresholds.defaults();
        OutcomeThresholds thresholds = new OutcomeThresholds(
            decimal(t, "tp1", defaults.tp1()),
            decimal(t, "tp2", defaults.tp2()),
            decimal(t, "tp3", defaults.tp3()),
            decimal(t, "stop", defaults.stop()));

        String priority = stringOverride("HIT_PRIORITY", node.path("hitPriority").asText(HitPriority.STOP_FIRST.name()));
        int labelVersion = intOverride("LABEL_VERSION", node.path("labelVersion").asInt(1));
        long lookbackDays = longOverride("LABEL_LOOKBACK_DAYS", node.path("lookbackDays").asLong(10));
        long intervalSeconds = longOverride("LABEL_INTERVAL_SECONDS", node.path("intervalSeconds").asLong(300));

        return new LabelingConfig(horizons, thresholds, HitPriority.valueOf(priority.trim().toUpperCase()),
            labelVersion, Duration.ofDays(lookbackDays), Duration.ofSeconds(intervalSeconds));
    }

    private BaselineConfig baseline(JsonNode node) {
        boolean enabled = boolOverride("BASELINE_ENABLED", node.path("enabled").asBoolean(true));
        double rate = doubleOverride("BASELINE_SAMPLING_RATE", node.path("samplingRate").asDouble(0.02));
        int spacing = intOverride("BASELINE_MIN_SPACING_BARS", node.path("minSpacingBars").asInt(10));
        long seed = longOverride("BASELINE_SEED", node.path("seed").asLong(42));
        long windowDays = longOverride("BASELINE_WINDOW_DAYS", node.path("windowDays").asLong(5));
        return new BaselineConfig(enabled, rate, spacing, seed, Duration.ofDays(windowDays));
    }

    // ============================================================

    private static String required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isValueNode() || value.asText().isBlank()) {
            throw new ConfigValidationException("Detector entry is missing '" + field + "': " + node);
        }
        return value.asText().trim();
    }

    private static List<String> strings(JsonNode array) {
        if (array.isMissingNode() || array.isNull()) {
            return List.of();
        }
        if (!array.isArray()) {
            throw new ConfigValidationException("Expected a JSON array, got: " + array);
        }
        List<String> values = new ArrayList<>();
        array.forEach(n -> values.add(n.asText()));
        return values;
    }

    private static BigDecimal decimal(JsonNode node, String field, BigDecimal defaultValue) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.isNumber()) {
            throw new ConfigValidationException("Threshold '" + field + "' must be a number, got " + value);
        }
        return value.decimalValue();
    }

    private String stringOverride(String key, String fallback) {
        String value = env.apply(key);
        return value != null && !value.isBlank() ? value.trim() : fallback;
    }

    private List<String> listOverride(String key, List<String> fallback) {
        String value = env.apply(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return Arrays.stream(value.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
    }

    private int intOverride(String key, int fallback) {
        String value = env.apply(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigValidationException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    private long longOverride(String key, long fallback) {
        String value = env.apply(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigValidationException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    private double doubleOverride(String key, double fallback) {
        String value = env.apply(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigValidationException(key + " must be a number, got '" + value + "'", e);
        }
    }

    private boolean boolOverride(String key, boolean fallback) {
        String value = env.apply(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }
}
