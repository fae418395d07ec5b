package in.oracore.domain.data;

import java.time.Instant;

/**
 * One provider fetch for a stream: how many bars landed, how stale the newest one was,
 * and the error text when the fetch gave up.
 */
public record IngestionLogEntry(
        Long id,
        String source,
        String symbol,
        Timeframe timeframe,
        int barsWritten,
        Long lagMs,
        String error,
        Instant createdAt) {

    public boolean failed() {
        return error != null;
    }
}
