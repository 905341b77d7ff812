package storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the bookmark schema and records its version.
 * There is no migration path: a file written with another version is refused.
 */
public final class BookmarkSchema {

    private static final Logger log = LoggerFactory.getLogger(BookmarkSchema.class);

    // Current schema version - increment when schema changes
    public static final int CURRENT_VERSION = 1;

    private BookmarkSchema() {}

    /**
     * Initialize the schema on a freshly opened connection.
     *
     * @return {@code true} if the tables were created, {@code false} if they already existed
     * @throws SQLException if the stored version is not {@link #CURRENT_VERSION} or a statement fails
     */
    public static boolean initialize(Connection conn) throws SQLException {
        int version = getSchemaVersion(conn);

        if (version == 0) {
            createAllTables(conn);
            setSchemaVersion(conn, CURRENT_VERSION);
            log.info("Created bookmark schema v{}", CURRENT_VERSION);
            return true;
        }
        if (version != CURRENT_VERSION) {
            throw new SQLException("Unsupported bookmark schema version " + version
                    + " (expected " + CURRENT_VERSION + ")");
        }
        log.debug("Bookmark schema v{} up to date", version);
        return false;
    }

    /**
     * Get the current schema version (0 if none set).
     */
    static int getSchemaVersion(Connection conn) throws SQLException {
        try (ResultSet rs = conn.getMetaData().getTables(null, null, "schema_version", null)) {
            if (!rs.next()) {
                return 0;
            }
        }
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT MAX(version) FROM schema_version")) {
            if (rs.next()) {
                return rs.getInt(1);
            }
        }
        return 0;
    }

    private static void setSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_version (version, applied_at) VALUES (?, ?)")) {
            stmt.setInt(1, version);
            stmt.setLong(2, System.currentTimeMillis());
            stmt.executeUpdate();
        }
    }

    private static void createAllTables(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE IF NOT EXISTS schema_version ("
                    + "version INTEGER PRIMARY KEY, "
                    + "applied_at INTEGER NOT NULL)");

            stmt.execute("CREATE TABLE IF NOT EXISTS bookmarks ("
                    + "url TEXT PRIMARY KEY, "
                    + "title TEXT NOT NULL, "
                    + "description TEXT NOT NULL, "
                    + "imageUrl TEXT NOT NULL, "
                    + "publishedAt TEXT NOT NULL, "
                    + "source TEXT NOT NULL)");
        }
    }
}
