package in.oracore.domain.outcome;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Forward performance of one signal over one horizon under one label version.
 *
 * Returns are fractions of the entry price. Time-to-event fields are measured from
 * {@code firedAt} to the close of the crossing bar and are null when the level was not hit.
 */
public record Outcome(
        long signalId,
        Horizon horizon,
        int labelVersion,
        BigDecimal retClose,
        BigDecimal maxRunUp,
        BigDecimal maxDrawdown,
        boolean hitTp1,
        boolean hitTp2,
        boolean hitTp3,
        boolean hitStop,
        Duration tToTp1,
        Duration tToTp2,
        Duration tToTp3,
        Duration tToStop,
        Instant computedAt) {

    public OutcomeKey key() {
        return new OutcomeKey(signalId, horizon, labelVersion);
    }

    public record OutcomeKey(long signalId, Horizon horizon, int labelVersion) {
    }
}
