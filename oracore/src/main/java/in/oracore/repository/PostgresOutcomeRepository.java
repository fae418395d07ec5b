package in.oracore.repository;

import in.oracore.domain.data.Timeframe;
import in.oracore.domain.outcome.Horizon;
import in.oracore.domain.outcome.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL implementation of OutcomeRepository. Rows are never updated; a new label
 * version produces new rows alongside the old ones.
 */
public final class PostgresOutcomeRepository implements OutcomeRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresOutcomeRepository.class);

    private final DataSource dataSource;

    public PostgresOutcomeRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public boolean insertIfAbsent(Outcome outcome) {
        String sql = """
            INSERT INTO outcomes (
                signal_id, horizon_tf, horizon_bars, label_version,
                ret_close, max_run_up, max_drawdown,
                hit_tp1, hit_tp2, hit_tp3, hit_stop,
                t_to_tp1_ms, t_to_tp2_ms, t_to_tp3_ms, t_to_stop_ms, computed_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (signal_id, horizon_tf, horizon_bars, label_version) DO NOTHING
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, outcome.signalId());
            ps.setString(2, outcome.horizon().timeframe().code());
            ps.setInt(3, outcome.horizon().bars());
            ps.setInt(4, outcome.labelVersion());
            ps.setBigDecimal(5, outcome.retClose());
            ps.setBigDecimal(6, outcome.maxRunUp());
            ps.setBigDecimal(7, outcome.maxDrawdown());
            ps.setBoolean(8, outcome.hitTp1());
            ps.setBoolean(9, outcome.hitTp2());
            ps.setBoolean(10, outcome.hitTp3());
            ps.setBoolean(11, outcome.hitStop());
            setDuration(ps, 12, outcome.tToTp1());
            setDuration(ps, 13, outcome.tToTp2());
            setDuration(ps, 14, outcome.tToTp3());
            setDuration(ps, 15, outcome.tToStop());
            ps.setTimestamp(16, Timestamp.from(outcome.computedAt()));

            return ps.executeUpdate() > 0;

        } catch (SQLException e) {
            log.error("Failed to insert outcome for signal {} {}: {}",
                outcome.signalId(), outcome.horizon(), e.getMessage());
            throw new RuntimeException("Failed to insert outcome", e);
        }
    }

    @Override
    public boolean exists(long signalId, Horizon horizon, int labelVersion) {
        String sql = """
            SELECT 1 FROM outcomes
            WHERE signal_id = ? AND horizon_tf = ? AND horizon_bars = ? AND label_version = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, signalId);
            ps.setString(2, horizon.timeframe().code());
            ps.setInt(3, horizon.bars());
            ps.setInt(4, labelVersion);

            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }

        } catch (SQLException e) {
            log.error("Failed to check outcome for signal {}: {}", signalId, e.getMessage());
            throw new RuntimeException("Failed to check outcome", e);
        }
    }

    @Override
    public List<Outcome> findBySignal(long signalId) {
        String sql = """
            SELECT signal_id, horizon_tf, horizon_bars, label_version,
                   ret_close, max_run_up, max_drawdown,
                   hit_tp1, hit_tp2, hit_tp3, hit_stop,
                   t_to_tp1_ms, t_to_tp2_ms, t_to_tp3_ms, t_to_stop_ms, computed_at
            FROM outcomes
            WHERE signal_id = ?
            ORDER BY horizon_tf, horizon_bars, label_version
            """;

        List<Outcome> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, signalId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapRow(rs));
                }
            }

        } catch (SQLException e) {
            log.error("Failed to find outcomes for signal {}: {}", signalId, e.getMessage());
            throw new RuntimeException("Failed to find outcomes", e);
        }

        return result;
    }

    private Outcome mapRow(ResultSet rs) throws SQLException {
        return new Outcome(
            rs.getLong("signal_id"),
            new Horizon(Timeframe.fromCode(rs.getString("horizon_tf")), rs.getInt("horizon_bars")),
            rs.getInt("label_version"),
            rs.getBigDecimal("ret_close"),
            rs.getBigDecimal("max_run_up"),
            rs.getBigDecimal("max_drawdown"),
            rs.getBoolean("hit_tp1"),
            rs.getBoolean("hit_tp2"),
            rs.getBoolean("hit_tp3"),
            rs.getBoolean("hit_stop"),
            getDuration(rs, "t_to_tp1_ms"),
            getDuration(rs, "t_to_tp2_ms"),
            getDuration(rs, "t_to_tp3_ms"),
            getDuration(rs, "t_to_stop_ms"),
            rs.getTimestamp("computed_at").toInstant()
        );
    }

    private static void setDuration(PreparedStatement ps, int idx, Duration value) throws SQLException {
        if (value != null) {
            ps.setLong(idx, value.toMillis());
        } else {
            ps.setNull(idx, Types.BIGINT);
        }
    }

    private static Duration getDuration(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Duration.ofMillis(millis);
    }
}
