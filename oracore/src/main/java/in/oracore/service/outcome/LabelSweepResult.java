package in.oracore.service.outcome;

import java.util.List;

/**
 * Summary of one labeling sweep.
 *
 * @param pending   labels deferred to a later sweep, as "signalId/horizon" strings
 * @param skipped   labels abandoned with their reason (data gap, horizon finer than the signal)
 * @param cancelled true when the sweep stopped early on interruption
 */
public record LabelSweepResult(int signalsScanned, int computed, List<String> pending,
                               List<String> skipped, boolean cancelled) {
}
