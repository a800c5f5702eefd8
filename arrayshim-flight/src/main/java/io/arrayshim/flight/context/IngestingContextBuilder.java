package io.arrayshim.flight.context;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigObject;
import io.arrayshim.common.StartupScriptProvider;
import io.arrayshim.common.database.DatabaseCallExecutor;
import io.arrayshim.common.database.DatabaseClient;
import io.arrayshim.common.database.DatabaseConnection;
import org.apache.arrow.c.ArrowArrayStream;
import org.apache.arrow.c.Data;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.ipc.ArrowReader;
import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

/**
 * Builds a context by running each configured table query against the backing database
 * and materializing the results as DuckDB tables.
 * <p>
 * A table query the backing database rejects aborts the build. A result that cannot be
 * materialized is logged and its table left out.
 */
public class IngestingContextBuilder implements ContextBuilder {

    private static final Logger logger = LoggerFactory.getLogger(IngestingContextBuilder.class);

    public static final String TABLES_KEY = "tables";

    public record TableSource(String name, String query) {

        public static List<TableSource> fromConfig(Config config) {
            if (!config.hasPath(TABLES_KEY)) {
                return List.of();
            }
            List<? extends ConfigObject> entries = config.getObjectList(TABLES_KEY);
            return entries.stream()
                    .map(ConfigObject::toConfig)
                    .map(c -> new TableSource(c.getString("name"), c.getString("query")))
                    .toList();
        }
    }

    private final DatabaseClient databaseClient;
    private final DatabaseCallExecutor callExecutor;
    private final String username;
    private final String password;
    private final List<TableSource> tables;
    private final StartupScriptProvider startupScriptProvider;
    private final BufferAllocator allocator;

    public IngestingContextBuilder(DatabaseClient databaseClient,
                                   DatabaseCallExecutor callExecutor,
                                   String username,
                                   String password,
                                   List<TableSource> tables,
                                   StartupScriptProvider startupScriptProvider,
                                   BufferAllocator allocator) {
        this.databaseClient = databaseClient;
        this.callExecutor = callExecutor;
        this.username = username;
        this.password = password;
        this.tables = List.copyOf(tables);
        this.startupScriptProvider = startupScriptProvider;
        this.allocator = allocator;
    }

    @Override
    public QueryContext rebuild() throws Exception {
        return callExecutor.call(this::build);
    }

    private QueryContext build() throws Exception {
        long start = System.nanoTime();
        var target = QueryContext.newConnection();
        var success = false;
        try (var connection = databaseClient.connect(username, password)) {
            if (!(connection instanceof DatabaseConnection.Open open)) {
                var closed = (DatabaseConnection.Closed) connection;
                throw new SQLException("Unable to connect to backing database: " + closed.message(), null, closed.code());
            }
            for (int i = 0; i < tables.size(); i++) {
                load(open, target, tables.get(i), "_staging_" + i);
            }
            runStartupScript(target);
            var context = QueryContext.open(target);
            success = true;
            logger.info("Query context built in {} ms", Duration.ofNanos(System.nanoTime() - start).toMillis());
            return context;
        } finally {
            if (!success) {
                target.close();
            }
        }
    }

    private void load(DatabaseConnection.Open source, DuckDBConnection target,
                      TableSource table, String stagingName) throws SQLException {
        long start = System.nanoTime();
        ArrowReader result;
        try {
            result = source.runQuery(table.query(), allocator);
        } catch (RuntimeException e) {
            logger.atError().setCause(e).log("Skipping table {}: unable to convert result to Arrow", table.name());
            return;
        }
        try (var reader = result) {
            logger.info("Query for table {} returned in {} ms", table.name(),
                    Duration.ofNanos(System.nanoTime() - start).toMillis());
            try (var stream = ArrowArrayStream.allocateNew(allocator)) {
                Data.exportArrayStream(allocator, reader, stream);
                target.registerArrowStream(stagingName, stream);
                try (var statement = target.createStatement()) {
                    statement.execute("CREATE TABLE %s AS SELECT * FROM %s".formatted(
                            QueryContext.quoteIdentifier(table.name()), QueryContext.quoteIdentifier(stagingName)));
                    statement.execute("DROP VIEW IF EXISTS " + QueryContext.quoteIdentifier(stagingName));
                }
                logger.info("Table {} loaded in {} ms", table.name(),
                        Duration.ofNanos(System.nanoTime() - start).toMillis());
            } catch (SQLException | RuntimeException e) {
                logger.atError().setCause(e).log("Skipping table {}: unable to materialize result", table.name());
            }
        } catch (IOException e) {
            throw new SQLException("Error reading result for table " + table.name(), e);
        }
    }

    private void runStartupScript(DuckDBConnection target) throws Exception {
        var script = startupScriptProvider.getStartupScript();
        if (script == null || script.isBlank()) {
            return;
        }
        try (var statement = target.createStatement()) {
            statement.execute(script);
        }
        logger.info("Startup script executed");
    }
}
