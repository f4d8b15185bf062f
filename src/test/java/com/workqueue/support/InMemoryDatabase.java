package com.workqueue.support;

import com.workqueue.db.Database;

import java.sql.SQLException;
import java.util.UUID;

/**
 * Private in-memory H2 databases for tests.
 */
public final class InMemoryDatabase {

    private InMemoryDatabase() {
    }

    /**
     * Create and initialize a database nobody else can see.
     */
    public static Database create() throws SQLException {
        String url = "jdbc:h2:mem:wq-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        Database database = new Database(url, "sa", "", 10);
        database.initialize();
        return database;
    }
}
