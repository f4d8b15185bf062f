package com.workqueue.db;

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
 * Pooled access to the H2 database holding channels, jobs and cron entries.
 *
 * <p>Connections come from an H2 {@link JdbcConnectionPool}; closing a borrowed
 * connection returns it to the pool. {@link #initialize()} creates the pool and
 * runs the classpath resource {@code schema.sql}, whose statements are idempotent.</p>
 */
public class Database {
    private static final Logger logger = Logger.getLogger(Database.class.getName());
    private static final String SCHEMA_RESOURCE = "/schema.sql";
    private static final int CONNECTION_TIMEOUT_SECONDS = 30;

    private final String url;
    private final String user;
    private final String password;
    private final int poolSize;

    private volatile JdbcConnectionPool pool;
    private volatile boolean closed = false;

    /**
     * @param url      JDBC url, e.g. {@code jdbc:h2:./workqueue;AUTO_SERVER=TRUE}
     * @param user     database user
     * @param password database password
     * @param poolSize maximum number of pooled connections
     */
    public Database(String url, String user, String password, int poolSize) {
        this.url = url;
        this.user = user;
        this.password = password;
        this.poolSize = poolSize;
    }

    public synchronized void initialize() throws SQLException {
        if (pool != null) {
            logger.info("Database already initialized");
            return;
        }
        if (closed) {
            throw new SQLException("Database has been closed");
        }

        logger.info("Initializing database connection pool for " + url);
        JdbcConnectionPool created = JdbcConnectionPool.create(url, user, password);
        created.setMaxConnections(poolSize);
        created.setLoginTimeout(CONNECTION_TIMEOUT_SECONDS);

        try {
            initializeSchema(created);
        } catch (SQLException e) {
            created.dispose();
            throw e;
        }

        pool = created;
        logger.info("Database initialization complete (pool size " + poolSize + ")");
    }

    public Connection getConnection() throws SQLException {
        JdbcConnectionPool current = pool;
        if (current == null) {
            throw new SQLException("Database not initialized. Call initialize() first.");
        }
        if (closed) {
            throw new SQLException("Database has been closed");
        }
        return current.getConnection();
    }

    // Runs schema.sql statement by statement; a statement ends with a line ending in ';'
    private void initializeSchema(JdbcConnectionPool target) throws SQLException {
        String schema;
        try (InputStream in = Database.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new SQLException("Schema resource " + SCHEMA_RESOURCE + " not found on classpath");
            }
            schema = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SQLException("Failed to read schema resource", e);
        }

        int executedCount = 0;
        try (Connection conn = target.getConnection();
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
        JdbcConnectionPool current = pool;
        pool = null;
        if (current != null) {
            try {
                current.dispose();
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Error disposing connection pool", e);
            }
        }
        logger.info("Database shutdown complete");
    }

    public boolean isInitialized() {
        return pool != null;
    }

    public boolean isClosed() {
        return closed;
    }
}
