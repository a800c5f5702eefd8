package io.arrayshim.common.database;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.ipc.ArrowReader;
import org.duckdb.DuckDBResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;

/**
 * Outcome of {@link DatabaseClient#connect}: either an open session or the reason the
 * session could not be opened.
 */
public interface DatabaseConnection extends AutoCloseable {

    Logger logger = LoggerFactory.getLogger(DatabaseConnection.class);

    boolean isOpen();

    @Override
    void close() throws SQLException;

    record Open(Connection connection, int fetchSize) implements DatabaseConnection {

        @Override
        public boolean isOpen() {
            return true;
        }

        /**
         * Runs {@code sql} and exposes its result as Arrow batches of at most
         * {@code fetchSize} rows. The returned reader owns the statement.
         * <p>
         * DuckDB results are read through DuckDB's Arrow export; other drivers go through
         * the arrow-jdbc adapter, which cannot convert array columns.
         */
        public ArrowReader runQuery(String sql, BufferAllocator allocator) throws SQLException {
            var statement = connection.createStatement();
            try {
                try {
                    statement.setFetchSize(fetchSize);
                } catch (SQLFeatureNotSupportedException e) {
                    logger.debug("Driver ignores fetch size hint: {}", e.getMessage());
                }
                var resultSet = statement.executeQuery(sql);
                if (resultSet instanceof DuckDBResultSet duckDBResultSet) {
                    return DuckDBArrowReader.export(allocator, statement, duckDBResultSet, fetchSize);
                }
                return new ResultSetArrowReader(allocator, statement, resultSet, fetchSize);
            } catch (SQLException | RuntimeException e) {
                statement.close();
                throw e;
            }
        }

        @Override
        public void close() throws SQLException {
            connection.close();
        }
    }

    record Closed(int code, String message) implements DatabaseConnection {

        @Override
        public boolean isOpen() {
            return false;
        }

        @Override
        public void close() {
        }
    }
}
