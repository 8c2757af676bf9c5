package se.alipsa.refbridge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.ConnectException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.util.HadoopInputFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import se.alipsa.refbridge.client.ReferenceConnectionException;
import se.alipsa.refbridge.client.ReferenceQueryException;
import se.alipsa.refbridge.client.StatementExecutor;
import se.alipsa.refbridge.data.RowBatch;
import se.alipsa.refbridge.expr.CallExpr;
import se.alipsa.refbridge.expr.ConstantExpr;
import se.alipsa.refbridge.expr.FieldAccessExpr;
import se.alipsa.refbridge.expr.FunctionSignature;
import se.alipsa.refbridge.plan.HashJoinNode;
import se.alipsa.refbridge.plan.JoinType;
import se.alipsa.refbridge.plan.PlanNode;
import se.alipsa.refbridge.plan.ProjectNode;
import se.alipsa.refbridge.plan.TableScanNode;
import se.alipsa.refbridge.plan.ValuesNode;
import se.alipsa.refbridge.type.Type;

class PrestoQueryRunnerTest {

  private static final Type INPUT = Type.row(List.of("a", "b"), List.of(Type.INTEGER, Type.INTEGER));
  private static final Type OUTPUT = Type.row(List.of("s"), List.of(Type.INTEGER));
  private static final String PATH_QUERY = "SELECT \"$path\" FROM ";

  @TempDir
  Path warehouse;

  private final List<String> statements = new ArrayList<>();

  /** Answers table set up statements and returns {@code result} for queries. */
  private StatementExecutor engine(List<RowBatch> result) {
    return (sql, session) -> {
      statements.add(sql);
      if (sql.startsWith(PATH_QUERY)) {
        Path dir = warehouse.resolve(sql.substring(PATH_QUERY.length()));
        try {
          Files.createDirectories(dir);
        } catch (IOException e) {
          throw new ReferenceQueryException("Cannot create " + dir, e);
        }
        Type location = Type.row(List.of("$path"), List.of(Type.VARCHAR));
        return List.of(RowBatch.of(location, List.of(List.of("file:" + dir.resolve("000000_0")))));
      }
      return sql.startsWith("SELECT") ? result : List.of();
    };
  }

  private static ValuesNode values(String id) {
    return new ValuesNode(id, List.of(RowBatch.of(INPUT, List.of(List.of(1, 2), List.of(3, 4)))));
  }

  private static ProjectNode sum(PlanNode source) {
    return new ProjectNode("9", List.of("s"), List.of(new CallExpr("plus", Type.INTEGER,
        new FieldAccessExpr("a", Type.INTEGER), new FieldAccessExpr("b", Type.INTEGER))), source);
  }

  @Test
  void materializesInputsThenRunsTheQuery() {
    List<RowBatch> result = List.of(RowBatch.of(OUTPUT, List.of(List.of(3), List.of(7))));
    PrestoQueryRunner runner = new PrestoQueryRunner(engine(result), new Configuration(false));

    ReferenceQueryResult<List<RowBatch>> outcome = runner.execute(sum(values("0")));

    assertTrue(outcome.isSuccess());
    assertEquals(result, outcome.rows().orElseThrow());
    assertEquals("DROP TABLE IF EXISTS t_0", statements.get(0));
    assertEquals("SELECT (a + b) as s FROM t_0", statements.get(statements.size() - 1));
    assertTrue(Files.exists(warehouse.resolve("t_0").resolve("t_0.parquet")));
  }

  @Test
  void rematerializesATableWithOnlyTheNewRows() throws IOException {
    PrestoQueryRunner runner = new PrestoQueryRunner(engine(List.of()), new Configuration(false));
    runner.execute(sum(values("0")));
    statements.clear();

    ValuesNode replacement = new ValuesNode("0", List.of(RowBatch.of(INPUT, List.of(List.of(5, 6)))));
    assertTrue(runner.execute(sum(replacement)).isSuccess());

    assertEquals(List.of("DROP TABLE IF EXISTS t_0",
        "CREATE TABLE t_0(a, b) WITH (format = 'PARQUET') AS SELECT cast(null as INTEGER), cast(null as INTEGER)",
        "SELECT \"$path\" FROM t_0", "DELETE FROM t_0", "SELECT (a + b) as s FROM t_0"), statements);
    List<List<Object>> rows = new ArrayList<>();
    Configuration conf = new Configuration(false);
    org.apache.hadoop.fs.Path file = new org.apache.hadoop.fs.Path(
        warehouse.resolve("t_0").resolve("t_0.parquet").toString());
    try (ParquetReader<GenericRecord> reader = AvroParquetReader
        .<GenericRecord>builder(HadoopInputFile.fromPath(file, conf)).withConf(conf).build()) {
      GenericRecord record;
      while ((record = reader.read()) != null) {
        rows.add(List.of(record.get("a"), record.get("b")));
      }
    }
    assertEquals(List.of(List.of(5, 6)), rows);
  }

  @Test
  void keepsNullArrayElementsInInputTables() {
    Type arrays = Type.row(List.of("xs"), List.of(Type.array(Type.INTEGER)));
    ValuesNode input = new ValuesNode("0", List.of(RowBatch.of(arrays,
        List.of(List.of(Arrays.asList(1, null, 3))))));
    ProjectNode plan = new ProjectNode("1", List.of("xs"), List.of(new FieldAccessExpr("xs",
        Type.array(Type.INTEGER))), input);
    PrestoQueryRunner runner = new PrestoQueryRunner(engine(List.of()), new Configuration(false));

    assertEquals(ReferenceQueryErrorCode.SUCCESS, runner.execute(plan).errorCode());
  }

  @Test
  void flattensResultsForComparison() {
    List<RowBatch> result = List.of(RowBatch.of(OUTPUT, List.of(List.of(3))), RowBatch.of(OUTPUT,
        List.of(List.of(7))));
    PrestoQueryRunner runner = new PrestoQueryRunner(engine(result), new Configuration(false));

    ReferenceQueryResult<List<List<Object>>> outcome = runner.executeAndMaterialize(sum(values("0")));
    assertEquals(List.of(List.of(3), List.of(7)), outcome.rows().orElseThrow());
  }

  @Test
  void reportsUnsupportedPlansWithoutTouchingTheEngine() {
    PrestoQueryRunner runner = new PrestoQueryRunner(engine(List.of()), new Configuration(false));
    ProjectNode plan = new ProjectNode("1", List.of("t"), List.of(new ConstantExpr(Type.TIMESTAMP, 0L)),
        values("0"));

    ReferenceQueryResult<List<RowBatch>> outcome = runner.execute(plan);

    assertEquals(ReferenceQueryErrorCode.REFERENCE_QUERY_UNSUPPORTED, outcome.errorCode());
    assertTrue(outcome.rows().isEmpty());
    assertTrue(statements.isEmpty());
    assertEquals(ReferenceQueryErrorCode.REFERENCE_QUERY_UNSUPPORTED,
        runner.executeAndMaterialize(plan).errorCode());
  }

  @Test
  void reportsEngineErrorsAsFailedQueries() {
    StatementExecutor failing = (sql, session) -> {
      throw new ReferenceQueryException("Presto query failed: 1 Table t_0 does not exist");
    };
    PrestoQueryRunner runner = new PrestoQueryRunner(failing, new Configuration(false));

    ReferenceQueryResult<List<RowBatch>> outcome = runner.execute(sum(values("0")));
    assertEquals(ReferenceQueryErrorCode.REFERENCE_QUERY_FAIL, outcome.errorCode());
  }

  @Test
  void propagatesConnectionFailures() {
    StatementExecutor unreachable = (sql, session) -> {
      throw new ReferenceConnectionException("Couldn't connect to server at http://localhost:8080",
          new ConnectException("Connection refused"));
    };
    PrestoQueryRunner runner = new PrestoQueryRunner(unreachable, new Configuration(false));
    assertThrows(ReferenceConnectionException.class, () -> runner.execute(sum(values("0"))));
  }

  @Test
  void collectsEachInputTableOnce() {
    FieldAccessExpr a = new FieldAccessExpr("a", Type.INTEGER);
    TableScanNode scan = new TableScanNode("1", "orders", INPUT, List.of());
    ValuesNode left = values("0");
    HashJoinNode join = new HashJoinNode("2", JoinType.INNER, false, List.of(a), List.of(a), null,
        left, new ProjectNode("3", List.of("a", "b"), List.of(a, new FieldAccessExpr("b", Type.INTEGER)),
            new HashJoinNode("4", JoinType.LEFT_SEMI_FILTER, false, List.of(a), List.of(a), null, scan, values("0"),
                INPUT)), INPUT);

    Map<String, PrestoQueryRunner.InputTable> tables = PrestoQueryRunner.inputTables(join);

    assertEquals(List.of("t_0", "orders"), new ArrayList<>(tables.keySet()));
    assertEquals(left.values(), tables.get("t_0").rows());
    assertEquals(INPUT, tables.get("orders").type());
  }

  @Test
  void describesEngineCapabilities() {
    PrestoQueryRunner runner = new PrestoQueryRunner(engine(List.of()), new Configuration(false));
    assertTrue(runner.supportsRowBatchResults());
    assertTrue(runner.supportedScalarTypes().contains(Type.TIMESTAMP));
    assertFalse(runner.supportedScalarTypes().contains(Type.DATE));
    assertEquals(new DataSpec(false, false), runner.aggregationFunctionDataSpecs().get("regr_slope"));
    assertEquals(new DataSpec(true, false), runner.aggregationFunctionDataSpecs().get("covar_samp"));
    assertFalse(runner.isSupported(FunctionSignature.of("bigint", "hyperloglog")));
    assertFalse(runner.isConstantExprSupported(new ConstantExpr(Type.JSON, "[]")));
  }

  @Test
  void passesSqlAndSessionThrough() throws ReferenceQueryException {
    List<String> sessions = new ArrayList<>();
    StatementExecutor recording = (sql, session) -> {
      sessions.add(session);
      return List.of();
    };
    PrestoQueryRunner runner = new PrestoQueryRunner(recording, new Configuration(false));
    runner.execute("SELECT 1");
    runner.execute("SELECT 1", "query_max_memory=1GB");
    assertEquals(List.of("", "query_max_memory=1GB"), sessions);
  }

  @Test
  void refusesWorkOnceClosed() {
    PrestoQueryRunner runner = new PrestoQueryRunner(engine(List.of()), new Configuration(false));
    runner.close();
    assertTrue(runner.isClosed());
    assertThrows(IllegalStateException.class, () -> runner.execute(sum(values("0"))));
    assertThrows(IllegalStateException.class, () -> runner.execute("SELECT 1"));
  }
}
