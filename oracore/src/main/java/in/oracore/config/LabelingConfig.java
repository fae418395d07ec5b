package in.oracore.config;

import in.oracore.domain.outcome.HitPriority;
import in.oracore.domain.outcome.Horizon;
import in.oracore.domain.outcome.OutcomeThresholds;

import java.time.Duration;
import java.util.List;

/**
 * Outcome labeling settings.
 *
 * @param lookback how far back each sweep looks for unlabeled signals
 * @param interval delay between sweeps in service mode
 */
public record LabelingConfig(
        List<Horizon> horizons,
        OutcomeThresholds thresholds,
        HitPriority hitPriority,
        int labelVersion,
        Duration lookback,
        Duration interval) {

    public LabelingConfig {
        horizons = List.copyOf(horizons);
    }
}
