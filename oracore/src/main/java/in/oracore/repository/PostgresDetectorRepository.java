package in.oracore.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.oracore.domain.detector.DetectorDefinition;
import in.oracore.domain.detector.DetectorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PostgreSQL implementation of DetectorRepository. Params are stored as JSONB.
 */
public final class PostgresDetectorRepository implements DetectorRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresDetectorRepository.class);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public PostgresDetectorRepository(DataSource dataSource) {
        this.dataSource = dataSource;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public DetectorDefinition register(DetectorDefinition definition) {
        String sql = """
            INSERT INTO detectors (id, version, kind, description, params)
            VALUES (?, ?, ?, ?, ?::jsonb)
            ON CONFLICT (id, version) DO NOTHING
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, definition.id());
            ps.setString(2, definition.version());
            ps.setString(3, definition.kind().name());
            ps.setString(4, definition.description());
            ps.setString(5, objectMapper.writeValueAsString(definition.params()));

            int inserted = ps.executeUpdate();
            if (inserted > 0) {
                log.info("Registered detector {}", definition.key());
            }

        } catch (SQLException | JsonProcessingException e) {
            log.error("Failed to register detector {}: {}", definition.key(), e.getMessage());
            throw new RuntimeException("Failed to register detector", e);
        }

        return find(definition.id(), definition.version())
            .orElseThrow(() -> new IllegalStateException("Detector vanished after insert: " + definition.key()));
    }

    @Override
    public Optional<DetectorDefinition> find(String id, String version) {
        String sql = """
            SELECT id, version, kind, description, params::text AS params, registered_at
            FROM detectors WHERE id = ? AND version = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, id);
            ps.setString(2, version);

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }

        } catch (SQLException e) {
            log.error("Failed to find detector {}@{}: {}", id, version, e.getMessage());
            throw new RuntimeException("Failed to find detector", e);
        }

        return Optional.empty();
    }

    @Override
    public List<DetectorDefinition> findAll() {
        String sql = """
            SELECT id, version, kind, description, params::text AS params, registered_at
            FROM detectors ORDER BY id, version
            """;

        List<DetectorDefinition> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                result.add(mapRow(rs));
            }

        } catch (SQLException e) {
            log.error("Failed to list detectors: {}", e.getMessage());
            throw new RuntimeException("Failed to list detectors", e);
        }

        return result;
    }

    private DetectorDefinition mapRow(ResultSet rs) throws SQLException {
        Map<String, Object> params;
        try {
            params = objectMapper.readValue(rs.getString("params"), new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new SQLException("Unreadable params for detector " + rs.getString("id"), e);
        }

        return new DetectorDefinition(
            rs.getString("id"),
            rs.getString("version"),
            DetectorKind.valueOf(rs.getString("kind")),
            rs.getString("description"),
            params,
            rs.getTimestamp("registered_at").toInstant()
        );
    }
}
