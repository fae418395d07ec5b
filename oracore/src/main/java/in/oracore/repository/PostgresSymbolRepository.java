package in.oracore.repository;

import in.oracore.domain.data.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of SymbolRepository.
 */
public final class PostgresSymbolRepository implements SymbolRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresSymbolRepository.class);

    private final DataSource dataSource;

    public PostgresSymbolRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Symbol touch(String ticker, Instant seenAt) {
        String sql = """
            INSERT INTO symbols (ticker, exchange, asset_type, currency, first_seen, last_seen)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT (ticker, exchange)
            DO UPDATE SET last_seen = GREATEST(symbols.last_seen, EXCLUDED.last_seen)
            RETURNING id, ticker, exchange, asset_type, currency, first_seen, last_seen
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp ts = Timestamp.from(seenAt);
            ps.setString(1, ticker);
            ps.setString(2, Symbol.DEFAULT_EXCHANGE);
            ps.setString(3, Symbol.DEFAULT_ASSET_TYPE);
            ps.setString(4, Symbol.DEFAULT_CURRENCY);
            ps.setTimestamp(5, ts);
            ps.setTimestamp(6, ts);

            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return mapRow(rs);
            }

        } catch (SQLException e) {
            log.error("Failed to touch symbol {}: {}", ticker, e.getMessage());
            throw new RuntimeException("Failed to touch symbol", e);
        }
    }

    @Override
    public Optional<Symbol> findByTicker(String ticker) {
        String sql = """
            SELECT id, ticker, exchange, asset_type, currency, first_seen, last_seen
            FROM symbols WHERE ticker = ? AND exchange = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, ticker);
            ps.setString(2, Symbol.DEFAULT_EXCHANGE);

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }

        } catch (SQLException e) {
            log.error("Failed to find symbol {}: {}", ticker, e.getMessage());
            throw new RuntimeException("Failed to find symbol", e);
        }

        return Optional.empty();
    }

    @Override
    public List<Symbol> findAll() {
        String sql = """
            SELECT id, ticker, exchange, asset_type, currency, first_seen, last_seen
            FROM symbols ORDER BY ticker
            """;

        List<Symbol> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                result.add(mapRow(rs));
            }

        } catch (SQLException e) {
            log.error("Failed to list symbols: {}", e.getMessage());
            throw new RuntimeException("Failed to list symbols", e);
        }

        return result;
    }

    private Symbol mapRow(ResultSet rs) throws SQLException {
        Timestamp lastSeen = rs.getTimestamp("last_seen");
        return new Symbol(
            rs.getLong("id"),
            rs.getString("ticker"),
            rs.getString("exchange"),
            rs.getString("asset_type"),
            rs.getString("currency"),
            rs.getTimestamp("first_seen").toInstant(),
            lastSeen != null ? lastSeen.toInstant() : null
        );
    }
}
