package in.oracore.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.oracore.domain.baseline.Baseline;
import in.oracore.domain.data.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL implementation of BaselineRepository.
 */
public final class PostgresBaselineRepository implements BaselineRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresBaselineRepository.class);

    private final DataSource dataSource;
    private final FeatureJson featureJson;

    public PostgresBaselineRepository(DataSource dataSource) {
        this.dataSource = dataSource;
        this.featureJson = new FeatureJson(new ObjectMapper());
    }

    @Override
    public boolean insertIfAbsent(Baseline baseline) {
        String sql = """
            INSERT INTO baselines (symbol, timeframe, ts, label_version, features, features_version)
            VALUES (?, ?, ?, ?, ?::jsonb, ?)
            ON CONFLICT (symbol, timeframe, ts, label_version) DO NOTHING
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, baseline.symbol());
            ps.setString(2, baseline.timeframe().code());
            ps.setTimestamp(3, Timestamp.from(baseline.timestamp()));
            ps.setInt(4, baseline.labelVersion());
            ps.setString(5, featureJson.write(baseline.features()));
            ps.setInt(6, baseline.features().schemaVersion());

            return ps.executeUpdate() > 0;

        } catch (SQLException | JsonProcessingException e) {
            log.error("Failed to insert baseline {} {} {}: {}",
                baseline.symbol(), baseline.timeframe(), baseline.timestamp(), e.getMessage());
            throw new RuntimeException("Failed to insert baseline", e);
        }
    }

    @Override
    public List<Baseline> find(String symbol, Timeframe timeframe, int labelVersion, Instant from, Instant to) {
        String sql = """
            SELECT id, symbol, timeframe, ts, label_version, features::text AS features, features_version, created_at
            FROM baselines
            WHERE symbol = ? AND timeframe = ? AND label_version = ? AND ts >= ? AND ts < ?
            ORDER BY ts
            """;

        List<Baseline> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, symbol);
            ps.setString(2, timeframe.code());
            ps.setInt(3, labelVersion);
            ps.setTimestamp(4, Timestamp.from(from));
            ps.setTimestamp(5, Timestamp.from(to));

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(new Baseline(
                        rs.getLong("id"),
                        rs.getString("symbol"),
                        Timeframe.fromCode(rs.getString("timeframe")),
                        rs.getTimestamp("ts").toInstant(),
                        rs.getInt("label_version"),
                        featureJson.read(rs.getString("features"), rs.getInt("features_version")),
                        rs.getTimestamp("created_at").toInstant()
                    ));
                }
            }

        } catch (SQLException | JsonProcessingException e) {
            log.error("Failed to find baselines for {} {}: {}", symbol, timeframe, e.getMessage());
            throw new RuntimeException("Failed to find baselines", e);
        }

        return result;
    }
}
