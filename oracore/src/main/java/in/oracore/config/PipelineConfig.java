package in.oracore.config;

import in.oracore.domain.data.Timeframe;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable pipeline configuration, built once at startup by {@link PipelineConfigLoader}.
 */
public record PipelineConfig(
        List<String> watchlist,
        Timeframe baseTimeframe,
        List<Timeframe> aggregateTimeframes,
        int workerShards,
        Duration detectorTimeout,
        Duration backfillWindow,
        Duration cycleInterval,
        int relVolumeWindow,
        List<DetectorConfig> detectors,
        LabelingConfig labeling,
        BaselineConfig baseline) {

    public PipelineConfig {
        watchlist = List.copyOf(watchlist);
        aggregateTimeframes = List.copyOf(aggregateTimeframes);
        detectors = List.copyOf(detectors);
    }

    /**
     * Base stream plus every aggregate, in processing order.
     */
    public List<Timeframe> allTimeframes() {
        List<Timeframe> all = new ArrayList<>();
        all.add(baseTimeframe);
        all.addAll(aggregateTimeframes);
        return all;
    }
}
