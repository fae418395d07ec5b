package in.oracore.config;

import in.oracore.domain.common.ConfigValidationException;
import in.oracore.domain.data.Timeframe;
import in.oracore.domain.detector.DetectorKind;
import in.oracore.domain.outcome.HitPriority;
import in.oracore.domain.outcome.Horizon;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PipelineConfigLoaderTest {

    @Test
    void loadsTheBundledPipeline() {
        PipelineConfig config = new PipelineConfigLoader(Map.<String, String>of()::get).load();

        assertEquals(List.of("AAPL", "MSFT", "NVDA", "AMZN", "SPY", "QQQ"), config.watchlist());
        assertEquals(Timeframe.MINUTE_1, config.baseTimeframe());
        assertEquals(List.of(Timeframe.MINUTE_5, Timeframe.MINUTE_15, Timeframe.HOUR_1, Timeframe.HOUR_4, Timeframe.DAY_1),
            config.aggregateTimeframes());
        assertEquals(Duration.ofSeconds(2), config.detectorTimeout());
        assertEquals(Duration.ofDays(5), config.backfillWindow());
        assertEquals(3, config.detectors().size());

        DetectorConfig breakout = config.detectors().get(0);
        assertEquals("breakout", breakout.type());
        assertEquals("breakout_v1@1", breakout.definition().key());
        assertEquals(DetectorKind.RULE, breakout.definition().kind());
        assertEquals(10, breakout.definition().intParam("lookback", 0));
        DetectorConfig breakout20 = config.detectors().get(1);
        assertEquals("breakout20", breakout20.type());
        assertEquals(-1.0, breakout20.definition().doubleParam("vwap_min_pct", 0));

        LabelingConfig labeling = config.labeling();
        assertEquals(Horizon.parse("5m:6"), labeling.horizons().get(0));
        assertEquals(HitPriority.STOP_FIRST, labeling.hitPriority());
        assertEquals(0, new BigDecimal("0.03").compareTo(labeling.thresholds().tp3()));
        assertEquals(Duration.ofMinutes(5), labeling.interval());

        assertTrue(config.baseline().enabled());
        assertEquals(10, config.baseline().minSpacingBars());
    }

    @Test
    void environmentOverridesScalarSettings() {
        Map<String, String> env = Map.of(
            "WATCHLIST", " tsla, amd ,",
            "AGGREGATE_TIMEFRAMES", "5m,1h",
            "WORKER_SHARDS", "8",
            "HIT_PRIORITY", "target_first",
            "LABEL_VERSION", "3",
            "BASELINE_ENABLED", "false",
            "BASELINE_SAMPLING_RATE", "0.5");

        PipelineConfig config = new PipelineConfigLoader(env::get).load();

        assertEquals(List.of("TSLA", "AMD"), config.watchlist());
        assertEquals(List.of(Timeframe.MINUTE_5, Timeframe.HOUR_1), config.aggregateTimeframes());
        assertEquals(8, config.workerShards());
        assertEquals(HitPriority.TARGET_FIRST, config.labeling().hitPriority());
        assertEquals(3, config.labeling().labelVersion());
        assertFalse(config.baseline().enabled());
        assertEquals(0.5, config.baseline().samplingRate());
    }

    @Test
    void readsTheFileNamedByPipelineConfig(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("pipeline.json");
        Files.writeString(file, """
            {"watchlist": ["iwm"], "baseTimeframe": "5m", "aggregateTimeframes": ["15m"],
             "detectors": [{"id": "flush", "version": "2", "type": "volume_flush"}],
             "labeling": {"horizons": ["15m:4"]}}
            """);

        PipelineConfig config = new PipelineConfigLoader(Map.of("PIPELINE_CONFIG", file.toString())::get).load();

        assertEquals(List.of("IWM"), config.watchlist());
        assertEquals(Timeframe.MINUTE_5, config.baseTimeframe());
        assertEquals("flush@2", config.detectors().get(0).definition().key());
        assertTrue(config.detectors().get(0).definition().params().isEmpty());
        assertEquals(List.of(Timeframe.MINUTE_5, Timeframe.MINUTE_15), config.allTimeframes());
        // defaults fill the rest
        assertEquals(4, config.workerShards());
        assertEquals(1, config.labeling().labelVersion());
        assertEquals(0.02, config.baseline().samplingRate());
    }

    @Test
    void missingFileIsAConfigError() {
        assertThrows(ConfigValidationException.class,
            () -> new PipelineConfigLoader(Map.of("PIPELINE_CONFIG", "/nonexistent/pipeline.json")::get).load());
    }

    @Test
    void rejectsMalformedInput() {
        PipelineConfigLoader loader = new PipelineConfigLoader(Map.<String, String>of()::get);

        assertThrows(ConfigValidationException.class, () -> loader.load(json("{not json")));
        assertThrows(ConfigValidationException.class, () -> loader.load(json("[1, 2]")));

        ConfigValidationException badTf = assertThrows(ConfigValidationException.class,
            () -> loader.load(json("{\"baseTimeframe\": \"7m\"}")));
        assertTrue(badTf.getMessage().startsWith("Invalid pipeline config"));

        assertThrows(ConfigValidationException.class,
            () -> loader.load(json("{\"detectors\": [{\"version\": \"1\", \"type\": \"breakout\"}]}")));
        assertThrows(ConfigValidationException.class,
            () -> loader.load(json("{\"labeling\": {\"horizons\": [\"5m\"]}}")));
        assertThrows(ConfigValidationException.class,
            () -> loader.load(json("{\"labeling\": {\"thresholds\": {\"tp1\": \"high\"}}}")));
    }

    @Test
    void rejectsNonNumericOverrides() {
        PipelineConfigLoader loader = new PipelineConfigLoader(Map.of("WORKER_SHARDS", "many")::get);

        ConfigValidationException e = assertThrows(ConfigValidationException.class, loader::load);
        assertTrue(e.getMessage().contains("WORKER_SHARDS"));
    }

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
