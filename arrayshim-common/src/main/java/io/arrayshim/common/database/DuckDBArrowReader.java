package io.arrayshim.common.database;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowReader;
import org.apache.arrow.vector.types.pojo.Schema;
import org.duckdb.DuckDBResultSet;

import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Reads a DuckDB result through DuckDB's own Arrow export, so batches carry exactly the
 * types DuckDB produces, nested ones included. Closing the reader closes the result set
 * and its statement.
 */
public class DuckDBArrowReader extends ArrowReader {

    private final Statement statement;
    private final DuckDBResultSet resultSet;
    private final ArrowReader internal;
    private boolean sourceClosed = false;

    private DuckDBArrowReader(BufferAllocator allocator, Statement statement,
                              DuckDBResultSet resultSet, ArrowReader internal) {
        super(allocator);
        this.statement = statement;
        this.resultSet = resultSet;
        this.internal = internal;
    }

    /**
     * Wraps the result of a statement that has already been executed. On failure the
     * statement is closed.
     */
    public static DuckDBArrowReader export(BufferAllocator allocator, Statement statement,
                                           DuckDBResultSet resultSet, int batchSize) throws SQLException {
        try {
            var internal = (ArrowReader) resultSet.arrowExportStream(allocator, batchSize);
            return new DuckDBArrowReader(allocator, statement, resultSet, internal);
        } catch (SQLException | RuntimeException e) {
            statement.close();
            throw e;
        }
    }

    /**
     * Runs {@code sql} on a new statement of {@code connection}.
     */
    public static DuckDBArrowReader query(Connection connection, BufferAllocator allocator,
                                          String sql, int batchSize) throws SQLException {
        var statement = connection.createStatement();
        try {
            var resultSet = (DuckDBResultSet) statement.executeQuery(sql);
            return export(allocator, statement, resultSet, batchSize);
        } catch (SQLException | RuntimeException e) {
            statement.close();
            throw e;
        }
    }

    /**
     * The Arrow schema DuckDB exports for the result of {@code sql}, found by running it
     * with no rows.
     */
    public static Schema schemaOf(Connection connection, BufferAllocator allocator,
                                  String sql) throws SQLException {
        try (var reader = query(connection, allocator, "SELECT * FROM (" + stripTerminator(sql) + ") LIMIT 0", 1)) {
            return reader.getVectorSchemaRoot().getSchema();
        } catch (IOException e) {
            throw new SQLException(e.getMessage(), e);
        }
    }

    static String stripTerminator(String sql) {
        var end = sql.length();
        while (end > 0 && (Character.isWhitespace(sql.charAt(end - 1)) || sql.charAt(end - 1) == ';')) {
            end--;
        }
        return sql.substring(0, end);
    }

    @Override
    public boolean loadNextBatch() throws IOException {
        return internal.loadNextBatch();
    }

    @Override
    public long bytesRead() {
        return internal.bytesRead();
    }

    @Override
    public VectorSchemaRoot getVectorSchemaRoot() throws IOException {
        return internal.getVectorSchemaRoot();
    }

    @Override
    protected Schema readSchema() throws IOException {
        return internal.getVectorSchemaRoot().getSchema();
    }

    @Override
    protected void closeReadSource() throws IOException {
        // the C data exporter closes the reader it exports
        if (sourceClosed) {
            return;
        }
        sourceClosed = true;
        try {
            internal.close();
        } finally {
            try {
                resultSet.close();
                statement.close();
            } catch (SQLException e) {
                throw new IOException(e);
            }
        }
    }
}
