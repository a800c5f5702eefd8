package io.arrayshim.flight.context;

import io.arrayshim.common.database.DuckDBArrowReader;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.types.pojo.Schema;
import org.duckdb.DuckDBConnection;
import org.duckdb.DuckDBDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * An in-memory DuckDB database holding the tables clients query, with the Arrow schema of
 * each table.
 * <p>
 * The context is reference counted. It starts with the single reference owned by whoever
 * opened it; every {@link DeferredQuery} compiled against it holds one more. The database
 * is closed when the last reference is released, so replacing a context never breaks a
 * query compiled under it.
 */
public class QueryContext {

    private static final Logger logger = LoggerFactory.getLogger(QueryContext.class);

    private static final String LIST_TABLES_SQL = """
            SELECT table_name FROM information_schema.tables
            WHERE table_catalog = current_database() AND table_schema = 'main'
            ORDER BY table_name""";

    private final DuckDBConnection connection;
    private final List<TableInfo> tables;
    private final AtomicInteger references = new AtomicInteger(1);

    private QueryContext(DuckDBConnection connection, List<TableInfo> tables) {
        this.connection = connection;
        this.tables = tables;
    }

    /**
     * Opens a fresh in-memory database with streamed results enabled.
     */
    public static DuckDBConnection newConnection() throws SQLException {
        var properties = new Properties();
        properties.setProperty(DuckDBDriver.JDBC_STREAM_RESULTS, String.valueOf(true));
        return (DuckDBConnection) DriverManager.getConnection("jdbc:duckdb:", properties);
    }

    /**
     * Wraps {@code connection}, registering every table and view of its main schema. The
     * returned context owns the connection.
     */
    public static QueryContext open(DuckDBConnection connection) throws SQLException {
        var tables = new ArrayList<TableInfo>();
        var names = new ArrayList<String>();
        try (var statement = connection.createStatement();
             var resultSet = statement.executeQuery(LIST_TABLES_SQL)) {
            while (resultSet.next()) {
                names.add(resultSet.getString(1));
            }
        }
        for (var name : names) {
            tables.add(new TableInfo(name, exportedSchema(connection, "SELECT * FROM " + quoteIdentifier(name))));
        }
        logger.info("Query context opened with {} tables", tables.size());
        return new QueryContext(connection, List.copyOf(tables));
    }

    /**
     * Builds a context by running {@code statements} against a new in-memory database.
     */
    public static QueryContext fromStatements(String... statements) throws SQLException {
        var connection = newConnection();
        try {
            try (var statement = connection.createStatement()) {
                for (var sql : statements) {
                    statement.execute(sql);
                }
            }
            return open(connection);
        } catch (SQLException | RuntimeException e) {
            connection.close();
            throw e;
        }
    }

    public static String quoteIdentifier(String name) {
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }

    public List<TableInfo> tables() {
        return tables;
    }

    /**
     * Plans {@code sql} without running it.
     *
     * @throws EngineException if the statement cannot be prepared or its result schema
     *         cannot be exported
     * @throws IllegalStateException if the context has already been closed
     */
    public DeferredQuery compile(String sql) throws EngineException {
        if (!tryRetain()) {
            throw new IllegalStateException("query context is closed");
        }
        DuckDBConnection queryConnection = null;
        PreparedStatement statement = null;
        try {
            queryConnection = (DuckDBConnection) connection.duplicate();
            statement = queryConnection.prepareStatement(sql);
            var schema = exportedSchema(queryConnection, sql);
            return new DeferredQuery(this, sql, queryConnection, statement, schema);
        } catch (SQLException | RuntimeException e) {
            closeAfterFailure(statement, queryConnection);
            release();
            throw new EngineException(e.getMessage(), e);
        }
    }

    /**
     * Schema of the batches DuckDB exports for {@code sql}, the same ones a stream of its
     * result carries.
     */
    private static Schema exportedSchema(DuckDBConnection connection, String sql) throws SQLException {
        try (var allocator = new RootAllocator()) {
            return DuckDBArrowReader.schemaOf(connection, allocator, sql);
        }
    }

    boolean tryRetain() {
        while (true) {
            int current = references.get();
            if (current <= 0) {
                return false;
            }
            if (references.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    /**
     * Drops one reference; the last one closes the database.
     */
    public void release() {
        int remaining = references.decrementAndGet();
        if (remaining == 0) {
            try {
                connection.close();
                logger.debug("Query context closed");
            } catch (SQLException e) {
                logger.atError().setCause(e).log("Error closing query context");
            }
        } else if (remaining < 0) {
            throw new IllegalStateException("query context released more often than retained");
        }
    }

    public boolean isClosed() {
        return references.get() <= 0;
    }

    int references() {
        return references.get();
    }

    private static void closeAfterFailure(PreparedStatement statement, DuckDBConnection queryConnection) {
        try {
            if (statement != null) {
                statement.close();
            }
            if (queryConnection != null) {
                queryConnection.close();
            }
        } catch (SQLException e) {
            logger.atWarn().setCause(e).log("Error closing connection of failed query");
        }
    }
}
