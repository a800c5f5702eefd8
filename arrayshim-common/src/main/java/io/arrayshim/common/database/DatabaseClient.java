package io.arrayshim.common.database;

/**
 * Opens sessions against the backing analytical database.
 */
@FunctionalInterface
public interface DatabaseClient {

    /**
     * Never throws for a refused or failed login; the failure is reported as a
     * {@link DatabaseConnection.Closed} carrying the database's error code and message.
     */
    DatabaseConnection connect(String username, String password);
}
