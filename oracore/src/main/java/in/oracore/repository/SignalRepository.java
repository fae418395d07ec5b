package in.oracore.repository;

import in.oracore.domain.data.Timeframe;
import in.oracore.domain.signal.Signal;
import in.oracore.domain.signal.SignalKey;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for signals. Rows are immutable: there is no update or delete.
 */
public interface SignalRepository {

    /**
     * Insert unless a signal with the same natural key exists.
     *
     * @return the inserted row with its id, or empty when the key already existed
     */
    Optional<Signal> insertIfAbsent(Signal signal);

    Optional<Signal> findByKey(SignalKey key);

    Optional<Signal> findById(long id);

    /**
     * Filtered listing, newest first. Null filters are ignored.
     */
    List<Signal> find(String symbol, Timeframe timeframe, Instant since, int limit);

    /**
     * Signals with {@code fired_at >= since}, oldest first.
     */
    List<Signal> findFiredSince(Instant since);

    /**
     * Every {@code fired_at} recorded for the stream, across all detectors.
     */
    List<Instant> findFiredTimestamps(String symbol, Timeframe timeframe, Instant from, Instant to);
}
