package in.oracore.repository;

import in.oracore.domain.baseline.Baseline;
import in.oracore.domain.data.Timeframe;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

public final class InMemoryBaselineRepository implements BaselineRepository {

    private record Key(String symbol, Timeframe timeframe, Instant timestamp, int labelVersion) {
    }

    private final Map<Key, Baseline> baselines = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public boolean insertIfAbsent(Baseline baseline) {
        Key key = new Key(baseline.symbol(), baseline.timeframe(), baseline.timestamp(), baseline.labelVersion());
        Baseline stored = new Baseline(ids.incrementAndGet(), baseline.symbol(), baseline.timeframe(),
            baseline.timestamp(), baseline.labelVersion(), baseline.features(), baseline.createdAt());
        return baselines.putIfAbsent(key, stored) == null;
    }

    @Override
    public List<Baseline> find(String symbol, Timeframe timeframe, int labelVersion, Instant from, Instant to) {
        return baselines.values().stream()
            .filter(b -> b.symbol().equals(symbol) && b.timeframe() == timeframe && b.labelVersion() == labelVersion)
            .filter(b -> !b.timestamp().isBefore(from) && b.timestamp().isBefore(to))
            .sorted(Comparator.comparing(Baseline::timestamp))
            .toList();
    }
}
