package com.ciflow.db;

import org.h2.jdbcx.JdbcConnectionPool;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * H2 connection pool plus schema bootstrap.
 *
 * <p>The schema is read from {@code schema.sql} on the classpath; statements are separated by
 * semicolons at the end of a line and {@code --} comment lines are ignored.</p>
 *
 * <p><b>Thread Safety:</b> {@link #getConnection()} may be called from any thread once
 * {@link #initialize()} returned. Callers close the connection to hand it back to the pool.</p>
 */
public class Database {
    private static final Logger logger = Logger.getLogger(Database.class.getName());

    public static final String DEFAULT_URL = "jdbc:h2:mem:ciflow;DB_CLOSE_DELAY=-1";
    private static final String DB_USER = "sa";
    private static final String DB_PASSWORD = "";
    private static final int POOL_SIZE = 10;
    private static final int CONNECTION_TIMEOUT_SECONDS = 30;
    private static final String SCHEMA_RESOURCE = "schema.sql";

    private final String url;
    private JdbcConnectionPool pool;
    private volatile boolean initialized = false;
    private volatile boolean closed = false;

    public Database() {
        this(DEFAULT_URL);
    }

    public Database(String url) {
        this.url = url;
    }

    public synchronized void initialize() throws SQLException {
        if (initialized) {
            logger.fine("Database already initialized");
            return;
        }

        logger.info("Initializing database pool for " + url);
        pool = JdbcConnectionPool.create(url, DB_USER, DB_PASSWORD);
        pool.setMaxConnections(POOL_SIZE);
        pool.setLoginTimeout(CONNECTION_TIMEOUT_SECONDS);

        initializeSchema();
        initialized = true;
        logger.info("Database initialization complete");
    }

    public Connection getConnection() throws SQLException {
        if (!initialized) {
            throw new SQLException("Database not initialized. Call initialize() first.");
        }
        if (closed) {
            throw new SQLException("Database has been closed");
        }
        return pool.getConnection();
    }

    private void initializeSchema() throws SQLException {
        String schema;
        try (InputStream in = Database.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new SQLException("Schema resource " + SCHEMA_RESOURCE + " not found on classpath");
            }
            schema = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SQLException("Failed to read schema resource", e);
        }

        int executedCount = 0;
        try (Connection conn = pool.getConnection();
             Statement stmt = conn.createStatement()) {
            StringBuilder currentStatement = new StringBuilder();
            for (String line : schema.split("\n")) {
                line = line.trim();
                if (line.startsWith("--") || line.isEmpty()) {
                    continue;
                }
                currentStatement.append(line).append(' ');
                if (line.endsWith(";")) {
                    String sql = currentStatement.toString().trim();
                    sql = sql.substring(0, sql.length() - 1).trim();
                    if (!sql.isEmpty()) {
                        stmt.execute(sql);
                        executedCount++;
                    }
                    currentStatement = new StringBuilder();
                }
            }
        }
        logger.fine("Executed " + executedCount + " schema statements");
    }

    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (pool != null) {
            int active = pool.getActiveConnections();
            if (active > 0) {
                logger.log(Level.WARNING, "Closing database with {0} active connections", active);
            }
            pool.dispose();
        }
        logger.info("Database shutdown complete");
    }

    public boolean isInitialized() {
        return initialized;
    }

    public boolean isClosed() {
        return closed;
    }

    public String getUrl() {
        return url;
    }
}
