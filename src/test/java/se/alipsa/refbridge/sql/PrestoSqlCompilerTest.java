package se.alipsa.refbridge.sql;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import org.junit.jupiter.api.Test;
import se.alipsa.refbridge.data.RowBatch;
import se.alipsa.refbridge.expr.CallExpr;
import se.alipsa.refbridge.expr.ConstantExpr;
import se.alipsa.refbridge.expr.FieldAccessExpr;
import se.alipsa.refbridge.plan.AggregationNode;
import se.alipsa.refbridge.plan.AggregationNode.Aggregate;
import se.alipsa.refbridge.plan.HashJoinNode;
import se.alipsa.refbridge.plan.HiveInsertTarget;
import se.alipsa.refbridge.plan.JoinType;
import se.alipsa.refbridge.plan.NestedLoopJoinNode;
import se.alipsa.refbridge.plan.PartitionedWriteTarget.SortColumn;
import se.alipsa.refbridge.plan.PlanNode;
import se.alipsa.refbridge.plan.ProjectNode;
import se.alipsa.refbridge.plan.RowNumberNode;
import se.alipsa.refbridge.plan.SortOrder;
import se.alipsa.refbridge.plan.TableScanNode;
import se.alipsa.refbridge.plan.TableWriteNode;
import se.alipsa.refbridge.plan.TopNRowNumberNode;
import se.alipsa.refbridge.plan.ValuesNode;
import se.alipsa.refbridge.plan.WindowFrame;
import se.alipsa.refbridge.plan.WindowNode;
import se.alipsa.refbridge.type.Type;

class PrestoSqlCompilerTest {

  private static final FieldAccessExpr A = new FieldAccessExpr("a", Type.INTEGER);
  private static final FieldAccessExpr B = new FieldAccessExpr("b", Type.INTEGER);
  private static final FieldAccessExpr C = new FieldAccessExpr("c", Type.INTEGER);
  private static final FieldAccessExpr D = new FieldAccessExpr("d", Type.INTEGER);

  private final PrestoSqlCompiler compiler = new PrestoSqlCompiler();

  private static ValuesNode values(String id, String... columns) {
    List<Type> types = Collections.nCopies(columns.length, Type.INTEGER);
    return new ValuesNode(id, List.of(RowBatch.of(Type.row(List.of(columns), types), List.of())));
  }

  private static Type intRow(String... columns) {
    return Type.row(List.of(columns), Collections.nCopies(columns.length, Type.INTEGER));
  }

  private String compile(PlanNode plan) {
    return compiler.toSql(plan).orElseThrow();
  }

  /** A node kind the compiler has no rendering for. */
  private static final class FilterNode extends PlanNode {

    FilterNode(String id, PlanNode source) {
      super(id, List.of(source));
    }

    @Override
    public Type outputType() {
      return sources().get(0).outputType();
    }
  }

  @Test
  void compilesProjection() {
    ProjectNode project = new ProjectNode("1", List.of("s"), List.of(new CallExpr("plus", Type.INTEGER, A, B)),
        values("0", "a", "b"));
    String sql = compile(project);
    assertEquals("SELECT (a + b) as s FROM t_0", sql);
    assertDoesNotThrow(() -> CCJSqlParserUtil.parse(sql));
  }

  @Test
  void wrapsNonLeafSourcesInSubqueries() {
    ProjectNode inner = new ProjectNode("1", List.of("s"), List.of(new CallExpr("plus", Type.INTEGER, A, B)),
        values("0", "a", "b"));
    ProjectNode outer = new ProjectNode("2", List.of("t"), List.of(new FieldAccessExpr("s", Type.INTEGER)), inner);
    assertEquals("SELECT s as t FROM (SELECT (a + b) as s FROM t_0)", compile(outer));
  }

  @Test
  void projectionWithUnsupportedExpressionIsNotSupported() {
    ProjectNode project = new ProjectNode("1", List.of("t"), List.of(new ConstantExpr(Type.TIMESTAMP, 0L)),
        values("0", "a"));
    assertTrue(compiler.toSql(project).isEmpty());
  }

  @Test
  void compilesGroupedAggregation() {
    AggregationNode node = new AggregationNode("1", AggregationNode.Step.SINGLE, List.of(A), List.of("total"),
        List.of(Aggregate.of(new CallExpr("sum", Type.BIGINT, B))), values("0", "a", "b"));
    String sql = compile(node);
    assertEquals("SELECT a, sum(b) as total FROM t_0 GROUP BY a", sql);
    assertDoesNotThrow(() -> CCJSqlParserUtil.parse(sql));
  }

  @Test
  void compilesDistinctOrderedMaskedAggregate() {
    Aggregate aggregate = new Aggregate(new CallExpr("array_agg", Type.array(Type.INTEGER), B), List.of(Type.INTEGER),
        new FieldAccessExpr("m", Type.BOOLEAN), List.of(B), List.of(SortOrder.ASC_NULLS_LAST), true);
    AggregationNode node = new AggregationNode("1", AggregationNode.Step.SINGLE, List.of(), List.of("agg"),
        List.of(aggregate), values("0", "b", "m"));
    assertEquals("SELECT array_agg(distinct b ORDER BY b ASC NULLS LAST) filter (where m) as agg FROM t_0",
        compile(node));
  }

  @Test
  void rejectsPartialAggregation() {
    AggregationNode node = new AggregationNode("1", AggregationNode.Step.PARTIAL, List.of(A), List.of("c"),
        List.of(Aggregate.of(new CallExpr("count", Type.BIGINT, B))), values("0", "a", "b"));
    assertThrows(IllegalArgumentException.class, () -> compiler.toSql(node));
  }

  @Test
  void compilesWindowFunctions() {
    WindowFrame rows = new WindowFrame(WindowFrame.Unit.ROWS, WindowFrame.BoundType.PRECEDING, C,
        WindowFrame.BoundType.CURRENT_ROW, null);
    WindowNode node = new WindowNode("1", List.of(A), List.of(B), List.of(SortOrder.DESC_NULLS_FIRST),
        List.of("r", "f"),
        List.of(new WindowNode.Function(new CallExpr("rank", Type.BIGINT), WindowFrame.DEFAULT, false),
            new WindowNode.Function(new CallExpr("first_value", Type.INTEGER, B), rows, true)),
        values("0", "a", "b", "c"));
    assertEquals("SELECT a, b, c, rank() OVER (PARTITION BY a ORDER BY b DESC NULLS FIRST RANGE BETWEEN UNBOUNDED"
        + " PRECEDING AND CURRENT ROW) as r, first_value(b) IGNORE NULLS OVER (PARTITION BY a ORDER BY b DESC NULLS"
        + " FIRST ROWS BETWEEN c PRECEDING AND CURRENT ROW) as f FROM t_0", compile(node));
  }

  @Test
  void compilesRowNumber() {
    RowNumberNode numbered = new RowNumberNode("1", List.of(A), "rn", null, values("0", "a", "b"));
    assertEquals("SELECT a, b, row_number() OVER (partition by a) as rn FROM t_0", compile(numbered));

    RowNumberNode limited = new RowNumberNode("1", List.of(A), null, 2, values("0", "a", "b"));
    assertEquals("SELECT a, b FROM (SELECT a, b, row_number() OVER (partition by a) as row_number FROM t_0)"
        + " WHERE row_number <= 2", compile(limited));
  }

  @Test
  void compilesTopNRowNumber() {
    TopNRowNumberNode node = new TopNRowNumberNode("1", List.of(A), List.of(B), List.of(SortOrder.ASC_NULLS_LAST),
        "rn", 3, values("0", "a", "b"));
    assertEquals("SELECT a, b, rn FROM (SELECT a, b, row_number() OVER (partition by a ORDER BY b ASC NULLS LAST)"
        + " as rn FROM t_0) WHERE rn <= 3", compile(node));
  }

  @Test
  void compilesPartitionedBucketedTableWrite() {
    HiveInsertTarget target = new HiveInsertTarget(
        List.of(new HiveInsertTarget.Column("a", Type.INTEGER, false),
            new HiveInsertTarget.Column("b", Type.INTEGER, true)),
        new HiveInsertTarget.BucketProperty(4, List.of("a"), List.of(new SortColumn("a", true))), "PARQUET");
    TableWriteNode node = new TableWriteNode("1", List.of("a", "b"), target, values("0", "a", "b"));
    assertEquals("CREATE TABLE tmp_write WITH (PARTITIONED_BY = ARRAY['b'], BUCKET_COUNT = 4, BUCKETED_BY = ARRAY['a'],"
        + " SORTED_BY = ARRAY['a ASC'], FORMAT = 'PARQUET') AS SELECT * FROM t_0", compile(node));
  }

  @Test
  void compilesUnpartitionedTableWrite() {
    HiveInsertTarget target = new HiveInsertTarget(List.of(new HiveInsertTarget.Column("a", Type.INTEGER, false)),
        null, "ORC");
    TableWriteNode node = new TableWriteNode("1", List.of("a"), target, "out", values("0", "a"));
    assertEquals("CREATE TABLE out WITH (FORMAT = 'ORC') AS SELECT * FROM t_0", compile(node));
  }

  private HashJoinNode hashJoin(JoinType type, boolean nullAware, CallExpr filter, Type outputType) {
    return new HashJoinNode("2", type, nullAware, List.of(A), List.of(C), filter, values("0", "a", "b"),
        values("1", "c", "d"), outputType);
  }

  @Test
  void compilesOuterHashJoins() {
    CallExpr filter = new CallExpr("gt", Type.BOOLEAN, B, D);
    String inner = compile(hashJoin(JoinType.INNER, false, filter, intRow("a", "b", "c", "d")));
    assertEquals("SELECT a, b, c, d FROM t_0 INNER JOIN t_1 ON a = c AND (b > d)", inner);
    assertDoesNotThrow(() -> CCJSqlParserUtil.parse(inner));
    assertEquals("SELECT a, d FROM t_0 FULL OUTER JOIN t_1 ON a = c",
        compile(hashJoin(JoinType.FULL, false, null, intRow("a", "d"))));
  }

  @Test
  void compilesSemiJoins() {
    assertEquals("SELECT a, b FROM t_0 WHERE a IN (SELECT c FROM t_1)",
        compile(hashJoin(JoinType.LEFT_SEMI_FILTER, false, null, intRow("a", "b"))));
    assertEquals("SELECT a, b FROM t_0 WHERE EXISTS (SELECT * FROM t_1 WHERE a = c AND (b > d))",
        compile(hashJoin(JoinType.LEFT_SEMI_FILTER, false, new CallExpr("gt", Type.BOOLEAN, B, D), intRow("a", "b"))));

    Type withMatch = Type.row(List.of("a", "b", "match"), List.of(Type.INTEGER, Type.INTEGER, Type.BOOLEAN));
    assertEquals("SELECT a, b, a IN (SELECT c FROM t_1) as match FROM t_0",
        compile(hashJoin(JoinType.LEFT_SEMI_PROJECT, true, null, withMatch)));
    assertEquals("SELECT a, b, EXISTS (SELECT * FROM t_1 WHERE a = c) as match FROM t_0",
        compile(hashJoin(JoinType.LEFT_SEMI_PROJECT, false, null, withMatch)));
    assertTrue(compiler.toSql(hashJoin(JoinType.LEFT_SEMI_PROJECT, true, new CallExpr("gt", Type.BOOLEAN, B, D),
        withMatch)).isEmpty());
    assertTrue(compiler.toSql(hashJoin(JoinType.RIGHT_SEMI_FILTER, false, null, intRow("c", "d"))).isEmpty());
  }

  @Test
  void compilesAntiJoins() {
    assertEquals("SELECT a, b FROM t_0 WHERE a NOT IN (SELECT c FROM t_1)",
        compile(hashJoin(JoinType.ANTI, true, null, intRow("a", "b"))));
    assertEquals("SELECT a, b FROM t_0 WHERE NOT EXISTS (SELECT * FROM t_1 WHERE a = c)",
        compile(hashJoin(JoinType.ANTI, false, null, intRow("a", "b"))));
  }

  @Test
  void compilesNestedLoopJoins() {
    NestedLoopJoinNode cross = new NestedLoopJoinNode("2", JoinType.LEFT, null, values("0", "a", "b"),
        values("1", "c", "d"), intRow("a", "b", "c", "d"));
    assertEquals("SELECT a, b, c, d FROM t_0 LEFT JOIN t_1 ON true", compile(cross));

    NestedLoopJoinNode conditional = new NestedLoopJoinNode("2", JoinType.INNER, new CallExpr("lt", Type.BOOLEAN,
        A, C), values("0", "a", "b"), values("1", "c", "d"), intRow("a", "c"));
    assertEquals("SELECT a, c FROM t_0 INNER JOIN t_1 ON (a < c)", compile(conditional));

    NestedLoopJoinNode anti = new NestedLoopJoinNode("2", JoinType.ANTI, null, values("0", "a"), values("1", "c"),
        intRow("a"));
    assertTrue(compiler.toSql(anti).isEmpty());
  }

  @Test
  void compilesLeavesAsTableSelects() {
    assertEquals("SELECT a, b FROM t_0", compile(values("0", "a", "b")));
    TableScanNode scan = new TableScanNode("0", "orders", intRow("id", "qty"), List.of());
    assertEquals("SELECT id, qty FROM orders", compile(scan));
  }

  @Test
  void leavesThatCannotBeMaterializedAreNotSupported() {
    Type jsonRow = Type.row(List.of("j"), List.of(Type.JSON));
    TableScanNode scan = new TableScanNode("0", "docs", jsonRow, List.of());
    assertEquals(Optional.empty(), compiler.toSql(scan));
    ProjectNode project = new ProjectNode("1", List.of("k"), List.of(new FieldAccessExpr("j", Type.JSON)), scan);
    assertEquals(Optional.empty(), compiler.toSql(project));
  }

  @Test
  void unknownNodeKindsThrow() {
    FilterNode filter = new FilterNode("1", values("0", "a"));
    UnsupportedOperationException e = assertThrows(UnsupportedOperationException.class, () -> compiler.toSql(filter));
    assertEquals("Plan node not implemented: Filter (1)", e.getMessage());
  }
}
