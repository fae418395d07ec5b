package in.oracore.repository;

import in.oracore.domain.data.Symbol;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for instruments.
 */
public interface SymbolRepository {

    /**
     * Create the symbol on first observation and advance {@code last_seen}.
     * {@code last_seen} never moves backwards.
     */
    Symbol touch(String ticker, Instant seenAt);

    Optional<Symbol> findByTicker(String ticker);

    List<Symbol> findAll();
}
