package com.candlesync.dataservice.data.sqlite;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Store handle for the candle tables.
 *
 * One SQLite file ({@code trading_data.db}) in the data directory, with every
 * schema attached as its own file ({@code fronttest.db}, {@code public.db}, ...)
 * so that tables are addressed as {@code "schema"."es_1m"}.
 *
 * Opened once at process start and closed at exit. All statements go through
 * {@link #execute} or {@link #executeInTransaction}, which serialize on a single
 * lock, so the handle can be shared by workers processing different pairs.
 */
public class SqliteConnection implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SqliteConnection.class);

    public static final String MAIN_DB_FILE = "trading_data.db";

    private final File dbFile;
    private final File dataDir;
    private final Set<String> schemas;
    private Connection connection;
    private final Object lock = new Object();

    public SqliteConnection(Path dataDir, Collection<String> schemas) {
        this.dataDir = dataDir.toFile();
        this.dbFile = new File(this.dataDir, MAIN_DB_FILE);
        this.schemas = new LinkedHashSet<>();
        for (String schema : schemas) {
            this.schemas.add(CandleTable.requireValidSchema(schema));
        }
    }

    /**
     * File backing an attached schema.
     */
    public File schemaFile(String schema) {
        return new File(dataDir, schema + ".db");
    }

    private Connection getConnection() throws SQLException {
        if (connection == null || connection.isClosed()) {
            connection = createConnection();
        }
        return connection;
    }

    private Connection createConnection() throws SQLException {
        if (!dataDir.exists() && !dataDir.mkdirs()) {
            throw new SQLException("Cannot create data directory " + dataDir.getAbsolutePath());
        }

        String url = "jdbc:sqlite:" + dbFile.getAbsolutePath();
        Connection conn = DriverManager.getConnection(url);

        try (Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA journal_mode=WAL");
            stmt.execute("PRAGMA synchronous=NORMAL");
        }

        for (String schema : schemas) {
            try (PreparedStatement stmt = conn.prepareStatement("ATTACH DATABASE ? AS \"" + schema + "\"")) {
                stmt.setString(1, schemaFile(schema).getAbsolutePath());
                stmt.execute();
            }
        }

        log.debug("Opened SQLite store at {} with schemas {}", dbFile.getAbsolutePath(), schemas);
        return conn;
    }

    /**
     * Run a read or single statement while holding the store lock.
     */
    public <T> T execute(TransactionFunction<T> function) throws SQLException {
        synchronized (lock) {
            return function.apply(getConnection());
        }
    }

    /**
     * Execute a function within a transaction.
     * Commits on success, rolls back on failure so a batch is all-or-nothing.
     */
    public <T> T executeInTransaction(TransactionFunction<T> function) throws SQLException {
        synchronized (lock) {
            Connection conn = getConnection();
            boolean autoCommitOriginal = conn.getAutoCommit();
            try {
                conn.setAutoCommit(false);
                T result = function.apply(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackEx) {
                    log.warn("Rollback failed: {}", rollbackEx.getMessage());
                    e.addSuppressed(rollbackEx);
                }
                throw e;
            } finally {
                try {
                    conn.setAutoCommit(autoCommitOriginal);
                } catch (SQLException resetEx) {
                    log.warn("Could not restore auto-commit: {}", resetEx.getMessage());
                }
            }
        }
    }

    /**
     * Execute a void function within a transaction.
     */
    public void executeInTransaction(TransactionConsumer consumer) throws SQLException {
        executeInTransaction(conn -> {
            consumer.accept(conn);
            return null;
        });
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (connection != null) {
                try {
                    connection.close();
                    log.debug("Closed SQLite store at {}", dbFile.getAbsolutePath());
                } catch (SQLException e) {
                    log.warn("Error closing store {}: {}", dbFile.getAbsolutePath(), e.getMessage());
                }
                connection = null;
            }
        }
    }

    /**
     * Functional interface for operations returning a value.
     */
    @FunctionalInterface
    public interface TransactionFunction<T> {
        T apply(Connection connection) throws SQLException;
    }

    /**
     * Functional interface for operations with no return value.
     */
    @FunctionalInterface
    public interface TransactionConsumer {
        void accept(Connection connection) throws SQLException;
    }
}
