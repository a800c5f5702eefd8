package io.arrayshim.flight.context;

import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class QueryContextTest {

    private static RootAllocator allocator;

    @BeforeAll
    public static void setup() {
        allocator = new RootAllocator();
    }

    @AfterAll
    public static void cleanup() {
        allocator.close();
    }

    @Test
    public void testTablesAndSchemas() throws Exception {
        var context = QueryContext.fromStatements(
                "CREATE TABLE b AS SELECT 1 AS id, 'x' AS name",
                "CREATE TABLE a AS SELECT 2.5::DOUBLE AS v",
                "CREATE VIEW c AS SELECT id FROM b");
        try {
            var names = context.tables().stream().map(TableInfo::name).toList();
            assertEquals(List.of("a", "b", "c"), names);
            var b = context.tables().get(1).schema();
            assertEquals(List.of("id", "name"), b.getFields().stream().map(f -> f.getName()).toList());
            assertEquals(new ArrowType.Int(32, true), b.getFields().get(0).getType());
        } finally {
            context.release();
        }
    }

    @Test
    public void testCompileAndExecute() throws Exception {
        var context = QueryContext.fromStatements();
        try (var query = context.compile("SELECT 1 AS one")) {
            assertEquals("one", query.schema().getFields().get(0).getName());
            assertEquals("SELECT 1 AS one", query.sql());
            try (var reader = query.execute(allocator, 1000)) {
                assertTrue(reader.loadNextBatch());
                var root = reader.getVectorSchemaRoot();
                assertEquals(1, root.getRowCount());
                assertEquals(1, ((IntVector) root.getVector(0)).get(0));
                assertFalse(reader.loadNextBatch());
            }
            assertThrows(IllegalStateException.class, () -> query.execute(allocator, 1000));
        } finally {
            context.release();
        }
    }

    @Test
    public void testCompileErrorKeepsEngineMessage() throws Exception {
        var context = QueryContext.fromStatements();
        try {
            var e = assertThrows(EngineException.class, () -> context.compile("SELECT * FROM missing_table"));
            assertNotNull(e.getMessage());
            assertTrue(e.getMessage().contains("missing_table"), e.getMessage());
            assertEquals(1, context.references());
        } finally {
            context.release();
        }
    }

    @Test
    public void testQueriesKeepContextOpen() throws Exception {
        var context = QueryContext.fromStatements("CREATE TABLE t AS SELECT 42 AS v");
        var query = context.compile("SELECT v FROM t");
        assertEquals(2, context.references());
        context.release();
        assertFalse(context.isClosed());
        try (var reader = query.execute(allocator, 10)) {
            assertTrue(reader.loadNextBatch());
            assertEquals(42, ((IntVector) reader.getVectorSchemaRoot().getVector(0)).get(0));
        }
        query.close();
        query.close();
        assertTrue(context.isClosed());
        assertThrows(IllegalStateException.class, () -> context.compile("SELECT 1"));
    }

    @Test
    public void testQuoteIdentifier() {
        assertEquals("\"my \"\"table\"\"\"", QueryContext.quoteIdentifier("my \"table\""));
    }

    @Test
    public void testListTable() throws Exception {
        var context = QueryContext.fromStatements("CREATE TABLE arr AS SELECT [1, 2, 3] AS cells, 'a' AS label");
        try {
            var schema = context.tables().get(0).schema();
            assertEquals(ArrowType.ArrowTypeID.List, schema.getFields().get(0).getType().getTypeID());
            assertEquals(new ArrowType.Int(32, true), schema.getFields().get(0).getChildren().get(0).getType());
        } finally {
            context.release();
        }
    }

    @Test
    public void testCompiledSchemaMatchesBatches() throws Exception {
        var context = QueryContext.fromStatements();
        var sql = "SELECT TIMESTAMP '2020-01-01 00:00:00' AS ts, DATE '2020-01-01' AS d, "
                + "12.345::DECIMAL(10, 3) AS amount, [[1], [2, 3]] AS nested;";
        try (var query = context.compile(sql);
             var reader = query.execute(allocator, 100)) {
            assertEquals(query.schema(), reader.getVectorSchemaRoot().getSchema());
            assertTrue(reader.loadNextBatch());
            assertEquals(1, reader.getVectorSchemaRoot().getRowCount());
        } finally {
            context.release();
        }
    }
}
