package io.arrayshim.common.database;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * {@link DatabaseClient} reaching the backing database through its JDBC driver.
 */
public class JdbcDatabaseClient implements DatabaseClient {

    private static final Logger logger = LoggerFactory.getLogger(JdbcDatabaseClient.class);

    private final String url;
    private final int fetchSize;

    public JdbcDatabaseClient(String url, int fetchSize) {
        this.url = url;
        this.fetchSize = fetchSize;
    }

    @Override
    public DatabaseConnection connect(String username, String password) {
        var properties = new Properties();
        if (username != null && !username.isEmpty()) {
            properties.setProperty("user", username);
        }
        if (password != null && !password.isEmpty()) {
            properties.setProperty("password", password);
        }
        try {
            return new DatabaseConnection.Open(DriverManager.getConnection(url, properties), fetchSize);
        } catch (SQLException e) {
            logger.atDebug().setCause(e).log("Connection to {} refused for {}", url, username);
            return new DatabaseConnection.Closed(e.getErrorCode(), String.valueOf(e.getMessage()));
        }
    }

    public String url() {
        return url;
    }
}
