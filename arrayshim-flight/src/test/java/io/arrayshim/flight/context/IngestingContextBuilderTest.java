package io.arrayshim.flight.context;

import io.arrayshim.common.ConfigBasedStartupScriptProvider;
import io.arrayshim.common.database.DatabaseCallExecutor;
import io.arrayshim.common.database.DatabaseClient;
import io.arrayshim.common.database.DatabaseConnection;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.AdditionalAnswers.delegatesTo;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;

public class IngestingContextBuilderTest {

    private static RootAllocator allocator;
    private static DatabaseCallExecutor callExecutor;

    /** Backing database stand-in: every login opens a fresh in-memory DuckDB. */
    private static final DatabaseClient DUCKDB_CLIENT = (username, password) -> {
        try {
            return new DatabaseConnection.Open(DriverManager.getConnection("jdbc:duckdb:"), 10);
        } catch (SQLException e) {
            return new DatabaseConnection.Closed(e.getErrorCode(), e.getMessage());
        }
    };

    @BeforeAll
    public static void setup() {
        allocator = new RootAllocator();
        callExecutor = new DatabaseCallExecutor(2);
    }

    @AfterAll
    public static void cleanup() {
        callExecutor.close();
        allocator.close();
    }

    private static ConfigBasedStartupScriptProvider script(String content) {
        var provider = new ConfigBasedStartupScriptProvider();
        provider.setConfig(content == null
                ? ConfigFactory.empty()
                : ConfigFactory.empty().withValue("content", ConfigValueFactory.fromAnyRef(content)));
        return provider;
    }

    private static long count(QueryContext context, String table) throws Exception {
        try (var query = context.compile("SELECT count(*) FROM " + table);
             var reader = query.execute(allocator, 10)) {
            assertTrue(reader.loadNextBatch());
            return ((BigIntVector) reader.getVectorSchemaRoot().getVector(0)).get(0);
        }
    }

    @Test
    public void testTablesAreMaterialized() throws Exception {
        var builder = new IngestingContextBuilder(DUCKDB_CLIENT, callExecutor, "svc", "pw",
                List.of(new IngestingContextBuilder.TableSource("numbers", "SELECT i FROM range(25) t(i)"),
                        new IngestingContextBuilder.TableSource("My Table", "SELECT 'a' AS s")),
                script("CREATE VIEW evens AS SELECT i FROM numbers WHERE i % 2 = 0"),
                allocator);
        var context = builder.rebuild();
        try {
            assertEquals(List.of("My Table", "evens", "numbers"),
                    context.tables().stream().map(TableInfo::name).toList());
            assertEquals(25, count(context, "numbers"));
            assertEquals(13, count(context, "evens"));
            assertEquals(1, count(context, "\"My Table\""));
        } finally {
            context.release();
        }
    }

    @Test
    public void testFailingQueryAbortsBuild() {
        var builder = new IngestingContextBuilder(DUCKDB_CLIENT, callExecutor, "svc", "pw",
                List.of(new IngestingContextBuilder.TableSource("ok", "SELECT 1 AS v"),
                        new IngestingContextBuilder.TableSource("broken", "SELECT * FROM no_such_array")),
                script(null), allocator);
        assertThrows(SQLException.class, builder::rebuild);
    }

    @Test
    public void testRefusedLogin() {
        DatabaseClient refusing = (username, password) -> new DatabaseConnection.Closed(401, "bad credentials");
        var builder = new IngestingContextBuilder(refusing, callExecutor, "svc", "wrong",
                List.of(), script(null), allocator);
        var e = assertThrows(SQLException.class, builder::rebuild);
        assertEquals(401, e.getErrorCode());
        assertTrue(e.getMessage().contains("bad credentials"));
    }

    @Test
    public void testTableSourcesFromConfig() {
        var config = ConfigFactory.parseString("""
                tables = [
                  { name = "a", query = "SELECT 1" }
                  { name = "b", query = "SELECT 2" }
                ]
                """);
        assertEquals(List.of(new IngestingContextBuilder.TableSource("a", "SELECT 1"),
                        new IngestingContextBuilder.TableSource("b", "SELECT 2")),
                IngestingContextBuilder.TableSource.fromConfig(config));
        assertEquals(List.of(), IngestingContextBuilder.TableSource.fromConfig(ConfigFactory.empty()));
    }

    @Test
    public void testListColumnsAreMaterialized() throws Exception {
        var builder = new IngestingContextBuilder(DUCKDB_CLIENT, callExecutor, "svc", "pw",
                List.of(new IngestingContextBuilder.TableSource("cells",
                        "SELECT i AS id, [i, i * 2] AS cell FROM range(3) t(i)")),
                script(null), allocator);
        var context = builder.rebuild();
        try {
            var table = context.tables().get(0);
            assertEquals("cells", table.name());
            assertEquals(ArrowType.ArrowTypeID.List, table.schema().findField("cell").getType().getTypeID());
            assertEquals(3, count(context, "cells"));
            try (var query = context.compile("SELECT cell[2] FROM cells WHERE id = 2");
                 var reader = query.execute(allocator, 10)) {
                assertTrue(reader.loadNextBatch());
                assertEquals(4, ((BigIntVector) reader.getVectorSchemaRoot().getVector(0)).get(0));
            }
        } finally {
            context.release();
        }
    }

    /** Hides DuckDB's result set type so results go through the generic JDBC adapter. */
    private static Connection plainJdbc(Connection duckdb) throws SQLException {
        var connection = mock(Connection.class, delegatesTo(duckdb));
        doAnswer(createStatement -> {
            var delegate = duckdb.createStatement();
            var statement = mock(Statement.class, delegatesTo(delegate));
            doAnswer(executeQuery -> mock(ResultSet.class, delegatesTo(delegate.executeQuery(executeQuery.getArgument(0)))))
                    .when(statement).executeQuery(anyString());
            return statement;
        }).when(connection).createStatement();
        return connection;
    }

    @Test
    public void testUnconvertibleResultIsSkipped() throws Exception {
        DatabaseClient genericJdbc = (username, password) -> {
            try {
                return new DatabaseConnection.Open(plainJdbc(DriverManager.getConnection("jdbc:duckdb:")), 10);
            } catch (SQLException e) {
                return new DatabaseConnection.Closed(e.getErrorCode(), e.getMessage());
            }
        };
        var builder = new IngestingContextBuilder(genericJdbc, callExecutor, "svc", "pw",
                List.of(new IngestingContextBuilder.TableSource("arrays", "SELECT [1, 2] AS cells"),
                        new IngestingContextBuilder.TableSource("scalars", "SELECT 2 AS v")),
                script(null), allocator);
        var context = builder.rebuild();
        try {
            assertEquals(List.of("scalars"), context.tables().stream().map(TableInfo::name).toList());
            assertEquals(1, count(context, "scalars"));
        } finally {
            context.release();
        }
    }
}
