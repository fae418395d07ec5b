package in.oracore.repository;

import in.oracore.domain.data.Timeframe;
import in.oracore.domain.signal.Signal;
import in.oracore.domain.signal.SignalKey;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heap-backed SignalRepository. Insert-if-absent is atomic per key.
 */
public final class InMemorySignalRepository implements SignalRepository {

    private final Map<SignalKey, Signal> byKey = new ConcurrentHashMap<>();
    private final Map<Long, Signal> byId = new ConcurrentHashMap<>();
    private final Clock clock;
    private long nextId = 1;

    public InMemorySignalRepository() {
        this(Clock.systemUTC());
    }

    public InMemorySignalRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Optional<Signal> insertIfAbsent(Signal signal) {
        if (byKey.containsKey(signal.key())) {
            return Optional.empty();
        }
        Signal stored = signal.stored(nextId++, clock.instant());
        byKey.put(stored.key(), stored);
        byId.put(stored.id(), stored);
        return Optional.of(stored);
    }

    @Override
    public Optional<Signal> findByKey(SignalKey key) {
        return Optional.ofNullable(byKey.get(key));
    }

    @Override
    public Optional<Signal> findById(long id) {
        return Optional.ofNullable(byId.get(id));
    }

    @Override
    public List<Signal> find(String symbol, Timeframe timeframe, Instant since, int limit) {
        return byId.values().stream()
            .filter(s -> symbol == null || s.symbol().equals(symbol))
            .filter(s -> timeframe == null || s.timeframe() == timeframe)
            .filter(s -> since == null || !s.firedAt().isBefore(since))
            .sorted(Comparator.comparing(Signal::firedAt).reversed().thenComparing(Signal::id))
            .limit(limit)
            .toList();
    }

    @Override
    public List<Signal> findFiredSince(Instant since) {
        return byId.values().stream()
            .filter(s -> !s.firedAt().isBefore(since))
            .sorted(Comparator.comparing(Signal::firedAt).thenComparing(Signal::id))
            .toList();
    }

    @Override
    public List<Instant> findFiredTimestamps(String symbol, Timeframe timeframe, Instant from, Instant to) {
        return byId.values().stream()
            .filter(s -> s.symbol().equals(symbol) && s.timeframe() == timeframe)
            .map(Signal::firedAt)
            .filter(ts -> !ts.isBefore(from) && ts.isBefore(to))
            .distinct()
            .sorted()
            .toList();
    }

    public int size() {
        return byId.size();
    }
}
