package io.arrayshim.common.database;

import org.apache.arrow.adapter.jdbc.ArrowVectorIterator;
import org.apache.arrow.adapter.jdbc.JdbcToArrow;
import org.apache.arrow.adapter.jdbc.JdbcToArrowConfig;
import org.apache.arrow.adapter.jdbc.JdbcToArrowConfigBuilder;
import org.apache.arrow.adapter.jdbc.JdbcToArrowUtils;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.VectorUnloader;
import org.apache.arrow.vector.ipc.ArrowReader;
import org.apache.arrow.vector.types.pojo.Schema;

import java.io.IOException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Adapts a JDBC result set to an {@link ArrowReader}, converting rows in batches through
 * the arrow-jdbc adapter.
 */
public class ResultSetArrowReader extends ArrowReader {

    private final Statement statement;
    private final ResultSet resultSet;
    private final Schema schema;
    private final ArrowVectorIterator iterator;
    private long bytesRead = 0;
    private boolean sourceClosed = false;

    public ResultSetArrowReader(BufferAllocator allocator, Statement statement,
                                ResultSet resultSet, int batchSize) throws SQLException {
        super(allocator);
        this.statement = statement;
        this.resultSet = resultSet;
        JdbcToArrowConfig config = new JdbcToArrowConfigBuilder(allocator, JdbcToArrowUtils.getUtcCalendar())
                .setTargetBatchSize(batchSize)
                .build();
        this.schema = JdbcToArrowUtils.jdbcToArrowSchema(resultSet.getMetaData(), config);
        try {
            this.iterator = JdbcToArrow.sqlToArrowVectorIterator(resultSet, config);
        } catch (IOException e) {
            throw new SQLException("Error reading result set", e);
        }
    }

    @Override
    public boolean loadNextBatch() throws IOException {
        prepareLoadNextBatch();
        if (!iterator.hasNext()) {
            return false;
        }
        try (VectorSchemaRoot root = iterator.next()) {
            var batch = new VectorUnloader(root).getRecordBatch();
            bytesRead += batch.computeBodyLength();
            loadRecordBatch(batch);
        } catch (RuntimeException e) {
            throw new IOException(e.getMessage(), e);
        }
        return true;
    }

    @Override
    public long bytesRead() {
        return bytesRead;
    }

    @Override
    protected void closeReadSource() throws IOException {
        // the C data exporter closes the reader it exports
        if (sourceClosed) {
            return;
        }
        sourceClosed = true;
        iterator.close();
        try {
            resultSet.close();
            statement.close();
        } catch (SQLException e) {
            throw new IOException(e);
        }
    }

    @Override
    protected Schema readSchema() {
        return schema;
    }
}
