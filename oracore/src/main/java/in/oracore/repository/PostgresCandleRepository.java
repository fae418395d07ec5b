package in.oracore.repository;

import in.oracore.domain.data.Candle;
import in.oracore.domain.data.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * PostgreSQL implementation of CandleRepository.
 */
public final class PostgresCandleRepository implements CandleRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresCandleRepository.class);

    private static final String COLUMNS =
        "symbol, timeframe, ts, open, high, low, close, volume, vwap, trade_count, source, is_adjusted";

    private static final String UPSERT_SQL = """
        INSERT INTO candles (symbol, timeframe, ts, open, high, low, close, volume, vwap, trade_count, source, is_adjusted)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (symbol, timeframe, ts)
        DO UPDATE SET
            open = EXCLUDED.open,
            high = EXCLUDED.high,
            low = EXCLUDED.low,
            close = EXCLUDED.close,
            volume = EXCLUDED.volume,
            vwap = EXCLUDED.vwap,
            trade_count = EXCLUDED.trade_count,
            source = EXCLUDED.source,
            is_adjusted = EXCLUDED.is_adjusted
        """;

    private final DataSource dataSource;

    public PostgresCandleRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void upsert(Candle candle) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {

            bind(ps, candle);
            ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Failed to upsert candle {} {} {}: {}",
                candle.symbol(), candle.timeframe(), candle.timestamp(), e.getMessage());
            throw new RuntimeException("Failed to upsert candle", e);
        }
    }

    @Override
    public void upsertBatch(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            return;
        }

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {

            conn.setAutoCommit(false);
            try {
                for (Candle candle : candles) {
                    bind(ps, candle);
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }

            log.debug("Upserted {} candles", candles.size());

        } catch (SQLException e) {
            log.error("Failed to upsert candle batch: {}", e.getMessage());
            throw new RuntimeException("Failed to upsert candle batch", e);
        }
    }

    @Override
    public List<Candle> findRange(String symbol, Timeframe timeframe, Instant from, Instant to) {
        String sql = "SELECT " + COLUMNS + """
             FROM candles
            WHERE symbol = ? AND timeframe = ? AND ts >= ? AND ts < ?
            ORDER BY ts ASC
            """;
        return query(sql, symbol, timeframe, from, to, "find candle range");
    }

    @Override
    public List<Candle> findAfter(String symbol, Timeframe timeframe, Instant after, Instant until) {
        String sql = "SELECT " + COLUMNS + """
             FROM candles
            WHERE symbol = ? AND timeframe = ? AND ts > ? AND ts <= ?
            ORDER BY ts ASC
            """;
        return query(sql, symbol, timeframe, after, until, "find candles after");
    }

    @Override
    public List<Candle> findRecentBefore(String symbol, Timeframe timeframe, Instant before, int limit) {
        String sql = "SELECT " + COLUMNS + """
             FROM candles
            WHERE symbol = ? AND timeframe = ? AND ts < ?
            ORDER BY ts DESC
            LIMIT ?
            """;

        List<Candle> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, symbol);
            ps.setString(2, timeframe.code());
            ps.setTimestamp(3, Timestamp.from(before));
            ps.setInt(4, limit);

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapRow(rs));
                }
            }

        } catch (SQLException e) {
            log.error("Failed to find recent candles: {}", e.getMessage());
            throw new RuntimeException("Failed to find recent candles", e);
        }

        Collections.reverse(result);
        return result;
    }

    @Override
    public Candle findLatest(String symbol, Timeframe timeframe) {
        return findEdge(symbol, timeframe, "DESC");
    }

    @Override
    public Candle findEarliest(String symbol, Timeframe timeframe) {
        return findEdge(symbol, timeframe, "ASC");
    }

    @Override
    public boolean existsAfter(String symbol, Timeframe timeframe, Instant after) {
        String sql = "SELECT 1 FROM candles WHERE symbol = ? AND timeframe = ? AND ts > ? LIMIT 1";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, symbol);
            ps.setString(2, timeframe.code());
            ps.setTimestamp(3, Timestamp.from(after));

            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }

        } catch (SQLException e) {
            log.error("Failed to check candles after {}: {}", after, e.getMessage());
            throw new RuntimeException("Failed to check candle existence", e);
        }
    }

    private Candle findEdge(String symbol, Timeframe timeframe, String direction) {
        String sql = "SELECT " + COLUMNS + " FROM candles WHERE symbol = ? AND timeframe = ? ORDER BY ts "
            + direction + " LIMIT 1";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, symbol);
            ps.setString(2, timeframe.code());

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return mapRow(rs);
                }
            }

        } catch (SQLException e) {
            log.error("Failed to find edge candle: {}", e.getMessage());
            throw new RuntimeException("Failed to find edge candle", e);
        }

        return null;
    }

    private List<Candle> query(String sql, String symbol, Timeframe timeframe, Instant a, Instant b, String what) {
        List<Candle> result = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, symbol);
            ps.setString(2, timeframe.code());
            ps.setTimestamp(3, Timestamp.from(a));
            ps.setTimestamp(4, Timestamp.from(b));

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapRow(rs));
                }
            }

        } catch (SQLException e) {
            log.error("Failed to {}: {}", what, e.getMessage());
            throw new RuntimeException("Failed to " + what, e);
        }

        return result;
    }

    private void bind(PreparedStatement ps, Candle candle) throws SQLException {
        ps.setString(1, candle.symbol());
        ps.setString(2, candle.timeframe().code());
        ps.setTimestamp(3, Timestamp.from(candle.timestamp()));
        ps.setBigDecimal(4, candle.open());
        ps.setBigDecimal(5, candle.high());
        ps.setBigDecimal(6, candle.low());
        ps.setBigDecimal(7, candle.close());
        ps.setLong(8, candle.volume());
        ps.setBigDecimal(9, candle.vwap());
        if (candle.tradeCount() != null) {
            ps.setLong(10, candle.tradeCount());
        } else {
            ps.setNull(10, Types.BIGINT);
        }
        ps.setString(11, candle.source());
        ps.setBoolean(12, candle.adjusted());
    }

    private Candle mapRow(ResultSet rs) throws SQLException {
        long tradeCount = rs.getLong("trade_count");
        Long tradeCountOrNull = rs.wasNull() ? null : tradeCount;

        return new Candle(
            rs.getString("symbol"),
            Timeframe.fromCode(rs.getString("timeframe")),
            rs.getTimestamp("ts").toInstant(),
            rs.getBigDecimal("open"),
            rs.getBigDecimal("high"),
            rs.getBigDecimal("low"),
            rs.getBigDecimal("close"),
            rs.getLong("volume"),
            rs.getBigDecimal("vwap"),
            tradeCountOrNull,
            rs.getString("source"),
            rs.getBoolean("is_adjusted")
        );
    }
}
