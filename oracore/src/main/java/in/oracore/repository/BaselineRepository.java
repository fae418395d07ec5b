package in.oracore.repository;

import in.oracore.domain.baseline.Baseline;
import in.oracore.domain.data.Timeframe;

import java.time.Instant;
import java.util.List;

/**
 * Repository for negative samples.
 */
public interface BaselineRepository {

    /**
     * @return true when the row was written, false when the key already existed
     */
    boolean insertIfAbsent(Baseline baseline);

    /**
     * Baselines of the stream and label version with {@code from <= ts < to}, ascending.
     */
    List<Baseline> find(String symbol, Timeframe timeframe, int labelVersion, Instant from, Instant to);
}
