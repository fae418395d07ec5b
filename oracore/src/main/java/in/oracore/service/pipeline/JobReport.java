package in.oracore.service.pipeline;

import in.oracore.service.outcome.LabelSweepResult;

/**
 * Result of one full job run: a detection cycle, a label sweep and baseline sampling.
 *
 * @param labels         null when labeling did not run
 * @param baselineErrors streams whose baseline sampling failed
 */
public record JobReport(CycleSummary cycle, LabelSweepResult labels, int baselinesWritten,
                        int baselineErrors, RunStatus status) {
}
