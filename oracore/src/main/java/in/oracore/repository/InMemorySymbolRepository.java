package in.oracore.repository;

import in.oracore.domain.data.Symbol;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

public final class InMemorySymbolRepository implements SymbolRepository {

    private final Map<String, Symbol> byTicker = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public Symbol touch(String ticker, Instant seenAt) {
        return byTicker.compute(ticker, (t, existing) -> {
            if (existing == null) {
                return new Symbol(ids.incrementAndGet(), t, Symbol.DEFAULT_EXCHANGE,
                    Symbol.DEFAULT_ASSET_TYPE, Symbol.DEFAULT_CURRENCY, seenAt, seenAt);
            }
            Instant lastSeen = existing.lastSeen() == null || seenAt.isAfter(existing.lastSeen())
                ? seenAt
                : existing.lastSeen();
            return new Symbol(existing.id(), t, existing.exchange(), existing.assetType(),
                existing.currency(), existing.firstSeen(), lastSeen);
        });
    }

    @Override
    public Optional<Symbol> findByTicker(String ticker) {
        return Optional.ofNullable(byTicker.get(ticker));
    }

    @Override
    public List<Symbol> findAll() {
        List<Symbol> all = new ArrayList<>(byTicker.values());
        all.sort(Comparator.comparing(Symbol::ticker));
        return all;
    }
}
