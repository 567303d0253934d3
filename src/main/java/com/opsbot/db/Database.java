package com.opsbot.db;

import org.h2.jdbcx.JdbcConnectionPool;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.logging.Logger;

/**
 * Pooled connections to the H2 database holding the job and suppression tables.
 *
 * <p>The schema is applied from {@code schema.sql} on the classpath during
 * {@link #initialize()}; every statement in it is idempotent, so a restarted process
 * reuses the existing tables and the jobs in them.</p>
 */
public class Database {
    private static final Logger logger = Logger.getLogger(Database.class.getName());

    private static final String SCHEMA_RESOURCE = "/schema.sql";
    private static final String DB_USER = "sa";
    private static final String DB_PASSWORD = "";
    private static final int POOL_SIZE = 10;
    private static final int CONNECTION_TIMEOUT_SECONDS = 30;

    private final String url;
    private JdbcConnectionPool pool;
    private volatile boolean initialized = false;
    private volatile boolean closed = false;

    public Database(String url) {
        this.url = url;
    }

    public synchronized void initialize() throws SQLException {
        if (initialized) {
            logger.fine("Database already initialized");
            return;
        }

        logger.info("Initializing database connection pool for " + url);
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
        try (InputStream in = Database.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new SQLException("Schema resource not found: " + SCHEMA_RESOURCE);
            }
            schema = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SQLException("Failed to read schema resource", e);
        }

        try (Connection conn = pool.getConnection();
             Statement stmt = conn.createStatement()) {

            StringBuilder currentStatement = new StringBuilder();
            int executedCount = 0;

            for (String line : schema.split("\n")) {
                line = line.trim();
                if (line.startsWith("--") || line.isEmpty()) {
                    continue;
                }

                currentStatement.append(line).append(" ");

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

            logger.info("Executed " + executedCount + " schema statements");
        }
    }

    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (pool != null) {
            logger.info("Closing database connections (" + pool.getActiveConnections() + " active)");
            pool.dispose();
        }
    }

    public boolean isInitialized() {
        return initialized;
    }

    public boolean isClosed() {
        return closed;
    }
}
