package in.oracore.domain.common;

import in.oracore.domain.outcome.Horizon;

/**
 * The horizon window of a signal is not complete yet. Nothing is written; the
 * labeler retries on its next sweep.
 */
public class LabelPendingException extends RuntimeException {
    private final long signalId;
    private final Horizon horizon;
    private final int available;
    private final int expected;

    public LabelPendingException(long signalId, Horizon horizon, int available, int expected) {
        super("Signal " + signalId + " horizon " + horizon + " pending: " + available + "/" + expected + " bars");
        this.signalId = signalId;
        this.horizon = horizon;
        this.available = available;
        this.expected = expected;
    }

    public long getSignalId() {
        return signalId;
    }

    public Horizon getHorizon() {
        return horizon;
    }

    public int getAvailable() {
        return available;
    }

    public int getExpected() {
        return expected;
    }
}
