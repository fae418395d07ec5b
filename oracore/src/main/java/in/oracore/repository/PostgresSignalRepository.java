package in.oracore.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.oracore.domain.data.Timeframe;
import in.oracore.domain.signal.SessionFlag;
import in.oracore.domain.signal.Side;
import in.oracore.domain.signal.Signal;
import in.oracore.domain.signal.SignalKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of SignalRepository.
 *
 * Inserts use {@code ON CONFLICT DO NOTHING} on the natural key, so concurrent or repeated
 * writes of the same firing leave exactly one row.
 */
public final class PostgresSignalRepository implements SignalRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresSignalRepository.class);

    private static final String COLUMNS = """
        id, symbol, timeframe, fired_at, detector_id, detector_version, side, price_at_signal,
        bid, ask, spread, rel_volume, session, score, features::text AS features, features_version,
        data_freshness_ms, source_system, created_at
        """;

    private final DataSource dataSource;
    private final FeatureJson featureJson;

    public PostgresSignalRepository(DataSource dataSource) {
        this.dataSource = dataSource;
        this.featureJson = new FeatureJson(new ObjectMapper());
    }

    @Override
    public Optional<Signal> insertIfAbsent(Signal signal) {
        String sql = """
            INSERT INTO signals (
                symbol, timeframe, fired_at, detector_id, detector_version, side, price_at_signal,
                bid, ask, spread, rel_volume, session, score, features, features_version,
                data_freshness_ms, source_system
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?)
            ON CONFLICT (symbol, timeframe, fired_at, detector_id, detector_version) DO NOTHING
            RETURNING id, created_at
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            int idx = 1;
            ps.setString(idx++, signal.symbol());
            ps.setString(idx++, signal.timeframe().code());
            ps.setTimestamp(idx++, Timestamp.from(signal.firedAt()));
            ps.setString(idx++, signal.detectorId());
            ps.setString(idx++, signal.detectorVersion());
            ps.setString(idx++, signal.side().name());
            ps.setBigDecimal(idx++, signal.entryPrice());
            ps.setBigDecimal(idx++, signal.bid());
            ps.setBigDecimal(idx++, signal.ask());
            ps.setBigDecimal(idx++, signal.spread());
            setNullableDouble(ps, idx++, signal.relVolume());
            ps.setString(idx++, signal.session() != null ? signal.session().name() : null);
            setNullableDouble(ps, idx++, signal.score());
            ps.setString(idx++, featureJson.write(signal.features()));
            ps.setInt(idx++, signal.features().schemaVersion());
            if (signal.dataFreshnessMs() != null) {
                ps.setLong(idx++, signal.dataFreshnessMs());
            } else {
                ps.setNull(idx++, Types.BIGINT);
            }
            ps.setString(idx, signal.sourceSystem());

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(signal.stored(rs.getLong("id"), rs.getTimestamp("created_at").toInstant()));
                }
            }

        } catch (SQLException | JsonProcessingException e) {
            log.error("Failed to insert signal {}: {}", signal.key(), e.getMessage());
            throw new RuntimeException("Failed to insert signal", e);
        }

        return Optional.empty();
    }

    @Override
    public Optional<Signal> findByKey(SignalKey key) {
        String sql = "SELECT " + COLUMNS + """
            FROM signals
            WHERE symbol = ? AND timeframe = ? AND fired_at = ? AND detector_id = ? AND detector_version = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key.symbol());
            ps.setString(2, key.timeframe().code());
            ps.setTimestamp(3, Timestamp.from(key.firedAt()));
            ps.setString(4, key.detectorId());
            ps.setString(5, key.detectorVersion());

            List<Signal> rows = readAll(ps);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));

        } catch (SQLException e) {
            log.error("Failed to find signal {}: {}", key, e.getMessage());
            throw new RuntimeException("Failed to find signal", e);
        }
    }

    @Override
    public Optional<Signal> findById(long id) {
        String sql = "SELECT " + COLUMNS + " FROM signals WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, id);
            List<Signal> rows = readAll(ps);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));

        } catch (SQLException e) {
            log.error("Failed to find signal {}: {}", id, e.getMessage());
            throw new RuntimeException("Failed to find signal", e);
        }
    }

    @Override
    public List<Signal> find(String symbol, Timeframe timeframe, Instant since, int limit) {
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM signals WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        if (symbol != null) {
            sql.append(" AND symbol = ?");
            args.add(symbol);
        }
        if (timeframe != null) {
            sql.append(" AND timeframe = ?");
            args.add(timeframe.code());
        }
        if (since != null) {
            sql.append(" AND fired_at >= ?");
            args.add(Timestamp.from(since));
        }
        sql.append(" ORDER BY fired_at DESC, id ASC LIMIT ?");
        args.add(limit);

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            for (int i = 0; i < args.size(); i++) {
                ps.setObject(i + 1, args.get(i));
            }
            return readAll(ps);

        } catch (SQLException e) {
            log.error("Failed to query signals: {}", e.getMessage());
            throw new RuntimeException("Failed to query signals", e);
        }
    }

    @Override
    public List<Signal> findFiredSince(Instant since) {
        String sql = "SELECT " + COLUMNS + " FROM signals WHERE fired_at >= ? ORDER BY fired_at ASC, id ASC";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(since));
            return readAll(ps);

        } catch (SQLException e) {
            log.error("Failed to find signals since {}: {}", since, e.getMessage());
            throw new RuntimeException("Failed to find signals", e);
        }
    }

    @Override
    public List<Instant> findFiredTimestamps(String symbol, Timeframe timeframe, Instant from, Instant to) {
        String sql = """
            SELECT DISTINCT fired_at FROM signals
            WHERE symbol = ? AND timeframe = ? AND fired_at >= ? AND fired_at < ?
            ORDER BY fired_at
            """;

        List<Instant> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, symbol);
            ps.setString(2, timeframe.code());
            ps.setTimestamp(3, Timestamp.from(from));
            ps.setTimestamp(4, Timestamp.from(to));

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(rs.getTimestamp(1).toInstant());
                }
            }

        } catch (SQLException e) {
            log.error("Failed to find fired timestamps: {}", e.getMessage());
            throw new RuntimeException("Failed to find fired timestamps", e);
        }

        return result;
    }

    private List<Signal> readAll(PreparedStatement ps) throws SQLException {
        List<Signal> result = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                result.add(mapRow(rs));
            }
        }
        return result;
    }

    private Signal mapRow(ResultSet rs) throws SQLException {
        String session = rs.getString("session");
        long freshness = rs.getLong("data_freshness_ms");
        Long freshnessOrNull = rs.wasNull() ? null : freshness;

        try {
            return new Signal(
                rs.getLong("id"),
                rs.getString("symbol"),
                Timeframe.fromCode(rs.getString("timeframe")),
                rs.getTimestamp("fired_at").toInstant(),
                rs.getString("detector_id"),
                rs.getString("detector_version"),
                Side.valueOf(rs.getString("side")),
                rs.getBigDecimal("price_at_signal"),
                rs.getBigDecimal("bid"),
                rs.getBigDecimal("ask"),
                rs.getBigDecimal("spread"),
                getNullableDouble(rs, "rel_volume"),
                session != null ? SessionFlag.valueOf(session) : null,
                getNullableDouble(rs, "score"),
                featureJson.read(rs.getString("features"), rs.getInt("features_version")),
                freshnessOrNull,
                rs.getString("source_system"),
                rs.getTimestamp("created_at").toInstant()
            );
        } catch (JsonProcessingException e) {
            throw new SQLException("Unreadable features for signal " + rs.getLong("id"), e);
        }
    }

    private static void setNullableDouble(PreparedStatement ps, int idx, Double value) throws SQLException {
        if (value != null) {
            ps.setDouble(idx, value);
        } else {
            ps.setNull(idx, Types.DOUBLE);
        }
    }

    private static Double getNullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }
}
