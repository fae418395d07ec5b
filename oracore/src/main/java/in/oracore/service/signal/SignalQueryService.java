package in.oracore.service.signal;

import in.oracore.domain.data.Timeframe;
import in.oracore.domain.outcome.Outcome;
import in.oracore.domain.signal.Signal;
import in.oracore.repository.OutcomeRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Read-only queries over signals and their outcomes.
 */
public final class SignalQueryService {
    public static final int DEFAULT_LIMIT = 500;
    public static final int MAX_LIMIT = 5000;

    private final SignalStore signalStore;
    private final OutcomeRepository outcomeRepo;

    public SignalQueryService(SignalStore signalStore, OutcomeRepository outcomeRepo) {
        this.signalStore = signalStore;
        this.outcomeRepo = outcomeRepo;
    }

    /**
     * Signals matching every non-null filter, newest first.
     */
    public List<Signal> querySignals(String symbol, Timeframe timeframe, Instant since) {
        return querySignals(symbol, timeframe, since, DEFAULT_LIMIT);
    }

    public List<Signal> querySignals(String symbol, Timeframe timeframe, Instant since, int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_LIMIT));
        String ticker = symbol == null || symbol.isBlank() ? null : symbol.trim().toUpperCase();
        return signalStore.query(ticker, timeframe, since, bounded);
    }

    public Optional<Signal> findSignal(long signalId) {
        return signalStore.findById(signalId);
    }

    /**
     * Outcomes of one signal across horizons and label versions, ordered by horizon then version.
     */
    public List<Outcome> queryOutcomes(long signalId) {
        return outcomeRepo.findBySignal(signalId).stream()
            .sorted(Comparator.comparingInt((Outcome o) -> o.horizon().timeframe().minutes())
                .thenComparingInt(o -> o.horizon().bars())
                .thenComparingInt(Outcome::labelVersion))
            .toList();
    }
}
