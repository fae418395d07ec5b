package in.oracore.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Schema Migration - applies {@code db/schema.sql} on startup.
 *
 * The script only uses {@code IF NOT EXISTS} DDL, so running it against an up-to-date
 * database changes nothing. All statements run in one transaction.
 */
public final class SchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigration.class);

    public static final String DEFAULT_SCRIPT = "db/schema.sql";

    private final DataSource dataSource;
    private final String scriptResource;

    public SchemaMigration(DataSource dataSource) {
        this(dataSource, DEFAULT_SCRIPT);
    }

    public SchemaMigration(DataSource dataSource, String scriptResource) {
        this.dataSource = dataSource;
        this.scriptResource = scriptResource;
    }

    /**
     * Run the migration.
     *
     * @throws IllegalStateException if the script is missing or any statement fails
     */
    public void migrate() {
        log.info("[SCHEMA MIGRATION] Applying {}", scriptResource);
        List<String> statements = splitStatements(loadScript());

        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (Statement stmt = conn.createStatement()) {
                for (String sql : statements) {
                    stmt.execute(sql);
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
            log.info("[SCHEMA MIGRATION] ✓ {} statements applied", statements.size());

        } catch (SQLException e) {
            log.error("[SCHEMA MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new IllegalStateException("Schema migration failed", e);
        }
    }

    private String loadScript() {
        try (InputStream in = SchemaMigration.class.getClassLoader().getResourceAsStream(scriptResource)) {
            if (in == null) {
                throw new IllegalStateException("Schema script not found on classpath: " + scriptResource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read schema script " + scriptResource, e);
        }
    }

    /**
     * Split a plain DDL script on semicolons, dropping {@code --} comment lines.
     * Function bodies with embedded semicolons are not supported.
     */
    static List<String> splitStatements(String script) {
        StringBuilder cleaned = new StringBuilder();
        for (String line : script.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.startsWith("--")) continue;
            cleaned.append(line).append('\n');
        }

        List<String> statements = new ArrayList<>();
        for (String part : cleaned.toString().split(";")) {
            String sql = part.trim();
            if (!sql.isEmpty()) {
                statements.add(sql);
            }
        }
        return statements;
    }
}
