package in.oracore.bootstrap;

import in.oracore.config.BaselineConfig;
import in.oracore.config.DetectorConfig;
import in.oracore.config.LabelingConfig;
import in.oracore.config.PipelineConfig;
import in.oracore.domain.common.ConfigValidationException;
import in.oracore.domain.data.Timeframe;
import in.oracore.domain.outcome.Horizon;
import in.oracore.domain.outcome.OutcomeThresholds;
import in.oracore.service.detector.DetectorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Startup configuration validator.
 *
 * Runs before any stream is processed. Every violation raises {@link ConfigValidationException}
 * and the process refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * Validate the pipeline configuration.
     *
     * @param factory used to build every configured detector once, which checks its parameters
     * @throws ConfigValidationException if the configuration is invalid
     */
    public static void validate(PipelineConfig config, DetectorFactory factory) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        validateStreams(config);
        validateDetectors(config.detectors(), factory);
        validateLabeling(config.labeling(), config.baseTimeframe());
        validateBaseline(config.baseline());

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static void validateStreams(PipelineConfig config) {
        if (config.watchlist().isEmpty()) {
            throw new ConfigValidationException("❌ INVALID CONFIG: watchlist is empty (set WATCHLIST or pipeline.json watchlist)");
        }
        if (config.workerShards() < 1) {
            throw new ConfigValidationException("❌ INVALID CONFIG: WORKER_SHARDS must be >= 1, got " + config.workerShards());
        }
        if (config.detectorTimeout().isNegative() || config.detectorTimeout().isZero()) {
            throw new ConfigValidationException("❌ INVALID CONFIG: DETECTOR_TIMEOUT_MS must be positive");
        }
        if (config.relVolumeWindow() < 1) {
            throw new ConfigValidationException("❌ INVALID CONFIG: indicators.relVolumeWindow must be >= 1");
        }

        Timeframe base = config.baseTimeframe();
        Set<Timeframe> seen = new HashSet<>();
        for (Timeframe target : config.aggregateTimeframes()) {
            if (!seen.add(target)) {
                throw new ConfigValidationException("❌ INVALID CONFIG: aggregate timeframe listed twice: " + target);
            }
            if (!base.isFinerThan(target) || !target.isMultipleOf(base)) {
                throw new ConfigValidationException("❌ INVALID CONFIG: aggregate timeframe " + target
                    + " must be a coarser multiple of base timeframe " + base);
            }
        }
        log.info("✓ Streams: {} symbols, base {}, aggregates {}, {} shards",
            config.watchlist().size(), base, config.aggregateTimeframes(), config.workerShards());
    }

    private static void validateDetectors(List<DetectorConfig> detectors, DetectorFactory factory) {
        if (detectors.isEmpty()) {
            throw new ConfigValidationException("❌ INVALID CONFIG: no detectors configured");
        }
        Set<String> keys = new HashSet<>();
        for (DetectorConfig detector : detectors) {
            String key = detector.definition().key();
            if (!keys.add(key)) {
                throw new ConfigValidationException("❌ INVALID CONFIG: detector configured twice: " + key);
            }
            factory.create(detector);
            log.info("✓ Detector {} ({}, {})", key, detector.type(), detector.definition().kind());
        }
    }

    private static void validateLabeling(LabelingConfig labeling, Timeframe base) {
        if (labeling.horizons().isEmpty()) {
            throw new ConfigValidationException("❌ INVALID CONFIG: no labeling horizons configured");
        }
        for (Horizon horizon : labeling.horizons()) {
            if (horizon.timeframe().isFinerThan(base)) {
                throw new ConfigValidationException("❌ INVALID CONFIG: horizon " + horizon
                    + " is finer than base timeframe " + base);
            }
        }
        if (labeling.labelVersion() < 1) {
            throw new ConfigValidationException("❌ INVALID CONFIG: LABEL_VERSION must be >= 1");
        }

        OutcomeThresholds t = labeling.thresholds();
        for (BigDecimal level : List.of(t.tp1(), t.tp2(), t.tp3(), t.stop())) {
            if (level.signum() <= 0) {
                throw new ConfigValidationException("❌ INVALID CONFIG: thresholds must be positive fractions: " + t);
            }
        }
        if (t.tp1().compareTo(t.tp2()) > 0 || t.tp2().compareTo(t.tp3()) > 0) {
            throw new ConfigValidationException("❌ INVALID CONFIG: targets must satisfy tp1 <= tp2 <= tp3: " + t);
        }
        log.info("✓ Labeling: horizons {}, priority {}, label version {}",
            labeling.horizons(), labeling.hitPriority(), labeling.labelVersion());
    }

    private static void validateBaseline(BaselineConfig baseline) {
        if (baseline.samplingRate() < 0 || baseline.samplingRate() > 1) {
            throw new ConfigValidationException("❌ INVALID CONFIG: BASELINE_SAMPLING_RATE must be in [0, 1], got "
                + baseline.samplingRate());
        }
        if (baseline.minSpacingBars() < 0) {
            throw new ConfigValidationException("❌ INVALID CONFIG: BASELINE_MIN_SPACING_BARS must be >= 0");
        }
        log.info("✓ Baseline sampling: enabled={}, rate={}, spacing={} bars",
            baseline.enabled(), baseline.samplingRate(), baseline.minSpacingBars());
    }

    private StartupConfigValidator() {}
}
