package in.oracore.repository;

import in.oracore.domain.outcome.Horizon;
import in.oracore.domain.outcome.Outcome;

import java.util.List;

/**
 * Append-only repository for outcome labels.
 */
public interface OutcomeRepository {

    /**
     * @return true when the row was written, false when the key already existed
     */
    boolean insertIfAbsent(Outcome outcome);

    boolean exists(long signalId, Horizon horizon, int labelVersion);

    List<Outcome> findBySignal(long signalId);
}
