package io.arrayshim.flight.context;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.ipc.ArrowReader;
import org.apache.arrow.vector.types.pojo.Schema;
import org.duckdb.DuckDBConnection;
import org.duckdb.DuckDBResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A compiled query with a known result schema, executed at most once on demand. Holds a
 * reference on the {@link QueryContext} it was compiled under until closed.
 */
public class DeferredQuery implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DeferredQuery.class);

    private final QueryContext context;
    private final String sql;
    private final DuckDBConnection connection;
    private final PreparedStatement statement;
    private final Schema schema;
    private final AtomicBoolean executed = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile ResultSet resultSet;

    DeferredQuery(QueryContext context, String sql, DuckDBConnection connection,
                  PreparedStatement statement, Schema schema) {
        this.context = context;
        this.sql = sql;
        this.connection = connection;
        this.statement = statement;
        this.schema = schema;
    }

    public Schema schema() {
        return schema;
    }

    public String sql() {
        return sql;
    }

    /**
     * Runs the query. Batches are produced lazily as the returned reader is advanced.
     */
    public ArrowReader execute(BufferAllocator allocator, int batchSize) throws EngineException {
        if (closed.get()) {
            throw new IllegalStateException("query already closed");
        }
        if (!executed.compareAndSet(false, true)) {
            throw new IllegalStateException("query already executed");
        }
        try {
            var rs = (DuckDBResultSet) statement.executeQuery();
            resultSet = rs;
            return (ArrowReader) rs.arrowExportStream(allocator, batchSize);
        } catch (SQLException | RuntimeException e) {
            throw new EngineException(e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            if (resultSet != null) {
                resultSet.close();
            }
            statement.close();
            connection.close();
        } catch (SQLException e) {
            logger.atWarn().setCause(e).log("Error closing query");
        } finally {
            context.release();
        }
    }
}
