package in.oracore.domain.outcome;

/**
 * Resolution when a single bar's range crosses both the stop and a pending target.
 * OHLC bars carry no intrabar ordering, so the choice is a labeling policy.
 */
public enum HitPriority {
    /** Count the stop, ignore the targets crossed on that bar. Conservative default. */
    STOP_FIRST,
    /** Count the targets crossed on that bar, and the stop as well. */
    TARGET_FIRST
}
