package in.oracore.repository;

import in.oracore.domain.data.IngestionLogEntry;
import in.oracore.domain.data.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL implementation of IngestionLogRepository.
 */
public final class PostgresIngestionLogRepository implements IngestionLogRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresIngestionLogRepository.class);

    private final DataSource dataSource;

    public PostgresIngestionLogRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void append(IngestionLogEntry entry) {
        String sql = """
            INSERT INTO ingestion_log (source, symbol, timeframe, bars_written, lag_ms, error, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, entry.source());
            ps.setString(2, entry.symbol());
            ps.setString(3, entry.timeframe().code());
            ps.setInt(4, entry.barsWritten());
            if (entry.lagMs() != null) {
                ps.setLong(5, entry.lagMs());
            } else {
                ps.setNull(5, Types.BIGINT);
            }
            ps.setString(6, entry.error());
            ps.setTimestamp(7, Timestamp.from(entry.createdAt()));

            ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Failed to append ingestion log for {}: {}", entry.symbol(), e.getMessage());
            throw new RuntimeException("Failed to append ingestion log", e);
        }
    }

    @Override
    public List<IngestionLogEntry> findRecent(int limit) {
        String sql = """
            SELECT id, source, symbol, timeframe, bars_written, lag_ms, error, created_at
            FROM ingestion_log
            ORDER BY created_at DESC, id DESC
            LIMIT ?
            """;

        List<IngestionLogEntry> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    long lag = rs.getLong("lag_ms");
                    Long lagOrNull = rs.wasNull() ? null : lag;
                    result.add(new IngestionLogEntry(
                        rs.getLong("id"),
                        rs.getString("source"),
                        rs.getString("symbol"),
                        Timeframe.fromCode(rs.getString("timeframe")),
                        rs.getInt("bars_written"),
                        lagOrNull,
                        rs.getString("error"),
                        rs.getTimestamp("created_at").toInstant()
                    ));
                }
            }

        } catch (SQLException e) {
            log.error("Failed to read ingestion log: {}", e.getMessage());
            throw new RuntimeException("Failed to read ingestion log", e);
        }

        return result;
    }
}
