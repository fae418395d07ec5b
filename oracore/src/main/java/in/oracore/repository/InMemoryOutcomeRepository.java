package in.oracore.repository;

import in.oracore.domain.outcome.Horizon;
import in.oracore.domain.outcome.Outcome;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryOutcomeRepository implements OutcomeRepository {

    private final Map<Outcome.OutcomeKey, Outcome> outcomes = new ConcurrentHashMap<>();

    @Override
    public boolean insertIfAbsent(Outcome outcome) {
        return outcomes.putIfAbsent(outcome.key(), outcome) == null;
    }

    @Override
    public boolean exists(long signalId, Horizon horizon, int labelVersion) {
        return outcomes.containsKey(new Outcome.OutcomeKey(signalId, horizon, labelVersion));
    }

    @Override
    public List<Outcome> findBySignal(long signalId) {
        return outcomes.values().stream()
            .filter(o -> o.signalId() == signalId)
            .sorted(Comparator.comparing((Outcome o) -> o.horizon().timeframe())
                .thenComparingInt(o -> o.horizon().bars())
                .thenComparingInt(Outcome::labelVersion))
            .toList();
    }

    public int size() {
        return outcomes.size();
    }
}
