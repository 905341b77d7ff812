package storage;

import models.Article;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Persistent store for the reader's bookmarks, backed by a single SQLite file.
 *
 * <p>The connection is opened lazily on the first operation and kept until
 * {@link #close()}. Opening, schema setup and every statement run under one
 * lock, so racing first callers produce exactly one open and one schema setup,
 * and all of them see the same connection.</p>
 *
 * <p>All mutations are idempotent: adding an existing url replaces its fields,
 * removing an absent url changes nothing.</p>
 */
public class BookmarkStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BookmarkStore.class);

    public static final String FILE_NAME = "bookmarks.db";

    /**
     * Opens a JDBC connection for a url; swapped in tests to observe opens.
     */
    @FunctionalInterface
    interface ConnectionFactory {
        Connection open(String jdbcUrl) throws SQLException;
    }

    @FunctionalInterface
    private interface SqlFunction<T> {
        T apply(Connection connection) throws SQLException;
    }

    private final File dbFile;
    private final ConnectionFactory connectionFactory;
    private final Object lock = new Object();

    // guarded by lock
    private Connection connection;

    private final AtomicInteger initializations = new AtomicInteger();
    private final AtomicInteger schemaCreations = new AtomicInteger();

    /**
     * @param dataDir directory holding {@value #FILE_NAME}; created on first use if missing
     */
    public BookmarkStore(File dataDir) {
        this(dataDir, DriverManager::getConnection);
    }

    BookmarkStore(File dataDir, ConnectionFactory connectionFactory) {
        this.dbFile = new File(dataDir, FILE_NAME);
        this.connectionFactory = connectionFactory;
    }

    public File getDbFile() {
        return dbFile;
    }

    /**
     * Insert or replace a bookmark keyed by {@link Article#url}.
     *
     * @throws IllegalArgumentException if the article has no url
     */
    public void add(Article article) throws BookmarkStoreException {
        Objects.requireNonNull(article, "article");
        requireUrl(article.url);
        run("add", conn -> {
            insert(conn, article);
            return null;
        });
    }

    /**
     * Delete the bookmark for {@code url}; a missing bookmark is not an error.
     */
    public void remove(String url) throws BookmarkStoreException {
        run("remove", conn -> {
            delete(conn, url);
            return null;
        });
    }

    public boolean isBookmarked(String url) throws BookmarkStoreException {
        return run("lookup", conn -> exists(conn, url));
    }

    /**
     * All bookmarks, oldest first. Re-adding a url moves it to the end.
     */
    public List<Article> list() throws BookmarkStoreException {
        return run("list", conn -> {
            List<Article> out = new ArrayList<>();
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery(
                         "SELECT url, title, description, imageUrl, publishedAt, source "
                                 + "FROM bookmarks ORDER BY rowid")) {
                while (rs.next()) {
                    out.add(new Article(
                            rs.getString("title"),
                            rs.getString("description"),
                            rs.getString("url"),
                            rs.getString("imageUrl"),
                            rs.getString("publishedAt"),
                            rs.getString("source")));
                }
            }
            return out;
        });
    }

    /**
     * Flip the bookmark flag of an article.
     *
     * @return {@code true} if the article is bookmarked afterwards
     */
    public boolean toggle(Article article) throws BookmarkStoreException {
        Objects.requireNonNull(article, "article");
        requireUrl(article.url);
        return run("toggle", conn -> {
            if (exists(conn, article.url)) {
                delete(conn, article.url);
                return false;
            }
            insert(conn, article);
            return true;
        });
    }

    /**
     * Close the connection. A later operation opens it again.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (connection != null) {
                try {
                    connection.close();
                    log.debug("Closed bookmark database {}", dbFile.getAbsolutePath());
                } catch (SQLException e) {
                    log.warn("Error closing bookmark database: {}", e.getMessage());
                }
                connection = null;
            }
        }
    }

    int getInitializationCount() {
        return initializations.get();
    }

    int getSchemaCreationCount() {
        return schemaCreations.get();
    }

    private <T> T run(String operation, SqlFunction<T> function) throws BookmarkStoreException {
        synchronized (lock) {
            Connection conn = handle();
            try {
                return function.apply(conn);
            } catch (SQLException e) {
                throw new BookmarkStoreException(BookmarkStoreException.Kind.IO_FAILURE,
                        "Bookmark " + operation + " failed: " + e.getMessage(), e);
            }
        }
    }

    // caller holds lock
    private Connection handle() throws BookmarkStoreException {
        if (connection == null) {
            connection = open();
            initializations.incrementAndGet();
        }
        return connection;
    }

    private Connection open() throws BookmarkStoreException {
        File parentDir = dbFile.getParentFile();
        if (parentDir != null && !parentDir.isDirectory() && !parentDir.mkdirs()) {
            throw new BookmarkStoreException(BookmarkStoreException.Kind.INIT_FAILURE,
                    "Could not create data directory " + parentDir.getAbsolutePath(), null);
        }

        Connection conn = null;
        try {
            conn = connectionFactory.open("jdbc:sqlite:" + dbFile.getAbsolutePath());
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA synchronous=NORMAL");
            }

            conn.setAutoCommit(false);
            boolean created = BookmarkSchema.initialize(conn);
            conn.commit();
            conn.setAutoCommit(true);
            if (created) {
                schemaCreations.incrementAndGet();
            }

            log.debug("Opened bookmark database at {}", dbFile.getAbsolutePath());
            return conn;
        } catch (SQLException e) {
            if (conn != null) {
                try {
                    conn.close();
                } catch (SQLException closeEx) {
                    e.addSuppressed(closeEx);
                }
            }
            throw new BookmarkStoreException(BookmarkStoreException.Kind.INIT_FAILURE,
                    "Could not open bookmark database " + dbFile.getAbsolutePath() + ": " + e.getMessage(), e);
        }
    }

    private static void insert(Connection conn, Article article) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT OR REPLACE INTO bookmarks (url, title, description, imageUrl, publishedAt, source) "
                        + "VALUES (?, ?, ?, ?, ?, ?)")) {
            stmt.setString(1, article.url);
            stmt.setString(2, nullToEmpty(article.title));
            stmt.setString(3, nullToEmpty(article.description));
            stmt.setString(4, nullToEmpty(article.imageUrl));
            stmt.setString(5, nullToEmpty(article.publishedAt));
            stmt.setString(6, nullToEmpty(article.source));
            stmt.executeUpdate();
        }
    }

    private static void delete(Connection conn, String url) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM bookmarks WHERE url = ?")) {
            stmt.setString(1, url);
            stmt.executeUpdate();
        }
    }

    private static boolean exists(Connection conn, String url) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("SELECT 1 FROM bookmarks WHERE url = ?")) {
            stmt.setString(1, url);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static void requireUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Bookmark url must not be blank");
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
