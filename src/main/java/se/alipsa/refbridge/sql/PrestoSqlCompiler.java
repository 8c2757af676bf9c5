package se.alipsa.refbridge.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import se.alipsa.refbridge.expr.FieldAccessExpr;
import se.alipsa.refbridge.plan.AggregationNode;
import se.alipsa.refbridge.plan.HashJoinNode;
import se.alipsa.refbridge.plan.JoinType;
import se.alipsa.refbridge.plan.NestedLoopJoinNode;
import se.alipsa.refbridge.plan.PartitionedWriteTarget;
import se.alipsa.refbridge.plan.PlanNode;
import se.alipsa.refbridge.plan.PlanNodeVisitor;
import se.alipsa.refbridge.plan.ProjectNode;
import se.alipsa.refbridge.plan.RowNumberNode;
import se.alipsa.refbridge.plan.SortOrder;
import se.alipsa.refbridge.plan.TableScanNode;
import se.alipsa.refbridge.plan.TableWriteNode;
import se.alipsa.refbridge.plan.TopNRowNumberNode;
import se.alipsa.refbridge.plan.ValuesNode;
import se.alipsa.refbridge.plan.WindowNode;
import se.alipsa.refbridge.type.Type;

/**
 * Compiles plan trees into Presto SQL. A node, or any expression within it,
 * without a Presto equivalent yields {@link Optional#empty()}; node kinds the
 * compiler does not know are a programming error and throw
 * {@link UnsupportedOperationException}.
 */
public class PrestoSqlCompiler implements PlanNodeVisitor<Optional<String>> {

  /** Name of the rank column when the plan does not emit it. */
  static final String DEFAULT_ROW_NUMBER_COLUMN = "row_number";

  /**
   * Compile a plan.
   *
   * @param plan
   *          the plan root
   * @return the SQL statement, or empty if the plan is not supported
   */
  public Optional<String> toSql(PlanNode plan) {
    return plan.accept(this);
  }

  /**
   * Compile a source of another node into something usable after
   * {@code FROM}: leaves are referenced by their table name, anything else
   * becomes a parenthesized sub query.
   */
  private Optional<String> sourceSql(PlanNode source) {
    if (source instanceof ValuesNode values) {
      return isMaterializable(values.outputType()) ? Optional.of(values.tableName()) : Optional.empty();
    }
    if (source instanceof TableScanNode scan) {
      return isMaterializable(scan.outputType()) ? Optional.of(scan.tableName()) : Optional.empty();
    }
    return toSql(source).map(sql -> "(" + sql + ")");
  }

  private static boolean isMaterializable(Type rowType) {
    return SqlSupport.isSupportedParquetType(rowType);
  }

  @Override
  public Optional<String> visitProject(ProjectNode node) {
    Optional<String> source = sourceSql(node.sources().get(0));
    if (source.isEmpty() || node.names().isEmpty()) {
      return Optional.empty();
    }
    List<String> columns = new ArrayList<>();
    for (int i = 0; i < node.names().size(); i++) {
      Optional<String> expr = PrestoSql.toExprSql(node.projections().get(i));
      if (expr.isEmpty()) {
        return Optional.empty();
      }
      columns.add(expr.get() + " as " + node.names().get(i));
    }
    return Optional.of("SELECT " + String.join(", ", columns) + " FROM " + source.get());
  }

  @Override
  public Optional<String> visitAggregation(AggregationNode node) {
    if (node.step() != AggregationNode.Step.SINGLE) {
      throw new IllegalArgumentException(
          "Only single step aggregations can be compiled, got " + node.step() + " in node " + node.id());
    }
    PlanNode input = node.sources().get(0);
    if (!isMaterializable(input.outputType())) {
      return Optional.empty();
    }
    List<String> groupingKeys = names(node.groupingKeys());
    List<String> columns = new ArrayList<>(groupingKeys);
    for (int i = 0; i < node.aggregates().size(); i++) {
      AggregationNode.Aggregate aggregate = node.aggregates().get(i);
      Optional<String> args = PrestoSql.toExprListSql(aggregate.call().inputs());
      if (args.isEmpty()) {
        return Optional.empty();
      }
      StringBuilder sql = new StringBuilder(aggregate.call().name()).append('(');
      if (aggregate.distinct()) {
        sql.append("distinct ");
      }
      sql.append(args.get());
      if (!aggregate.sortingKeys().isEmpty()) {
        sql.append(" ORDER BY ").append(orderBy(aggregate.sortingKeys(), aggregate.sortingOrders()));
      }
      sql.append(')');
      if (aggregate.mask() != null) {
        sql.append(" filter (where ").append(aggregate.mask().name()).append(')');
      }
      sql.append(" as ").append(node.aggregateNames().get(i));
      columns.add(sql.toString());
    }
    if (columns.isEmpty()) {
      return Optional.empty();
    }
    Optional<String> source = sourceSql(input);
    if (source.isEmpty()) {
      return Optional.empty();
    }
    StringBuilder sql = new StringBuilder("SELECT ").append(String.join(", ", columns)).append(" FROM ")
        .append(source.get());
    if (!groupingKeys.isEmpty()) {
      sql.append(" GROUP BY ").append(String.join(", ", groupingKeys));
    }
    return Optional.of(sql.toString());
  }

  @Override
  public Optional<String> visitWindow(WindowNode node) {
    PlanNode input = node.sources().get(0);
    if (!isMaterializable(input.outputType())) {
      return Optional.empty();
    }
    List<String> columns = new ArrayList<>(input.outputType().names());
    StringBuilder over = new StringBuilder();
    if (!node.partitionKeys().isEmpty()) {
      over.append("PARTITION BY ").append(String.join(", ", names(node.partitionKeys())));
    }
    if (!node.sortingKeys().isEmpty()) {
      if (over.length() > 0) {
        over.append(' ');
      }
      over.append("ORDER BY ").append(orderBy(node.sortingKeys(), node.sortingOrders()));
    }
    for (int i = 0; i < node.functions().size(); i++) {
      WindowNode.Function function = node.functions().get(i);
      Optional<String> args = PrestoSql.toExprListSql(function.call().inputs());
      Optional<String> frame = PrestoSql.toFrameSql(function.frame());
      if (args.isEmpty() || frame.isEmpty()) {
        return Optional.empty();
      }
      StringBuilder sql = new StringBuilder(function.call().name()).append('(').append(args.get()).append(')');
      if (function.ignoreNulls()) {
        sql.append(" IGNORE NULLS");
      }
      sql.append(" OVER (").append(over);
      if (over.length() > 0) {
        sql.append(' ');
      }
      sql.append(frame.get()).append(") as ").append(node.windowColumnNames().get(i));
      columns.add(sql.toString());
    }
    return sourceSql(input).map(source -> "SELECT " + String.join(", ", columns) + " FROM " + source);
  }

  @Override
  public Optional<String> visitRowNumber(RowNumberNode node) {
    String rowNumber = node.rowNumberColumnName().orElse(DEFAULT_ROW_NUMBER_COLUMN);
    return rankedSql(node.sources().get(0), node.partitionKeys(), List.of(), List.of(), rowNumber, node.limit(),
        node.outputType());
  }

  @Override
  public Optional<String> visitTopNRowNumber(TopNRowNumberNode node) {
    String rowNumber = node.rowNumberColumnName().orElse(DEFAULT_ROW_NUMBER_COLUMN);
    return rankedSql(node.sources().get(0), node.partitionKeys(), node.sortingKeys(), node.sortingOrders(),
        rowNumber, OptionalInt.of(node.limit()), node.outputType());
  }

  private Optional<String> rankedSql(PlanNode input, List<FieldAccessExpr> partitionKeys,
      List<FieldAccessExpr> sortingKeys, List<SortOrder> sortingOrders, String rowNumber, OptionalInt limit,
      Type outputType) {
    if (!isMaterializable(input.outputType())) {
      return Optional.empty();
    }
    Optional<String> source = sourceSql(input);
    if (source.isEmpty()) {
      return Optional.empty();
    }
    List<String> columns = new ArrayList<>(input.outputType().names());
    StringBuilder window = new StringBuilder("row_number() OVER (");
    if (!partitionKeys.isEmpty()) {
      window.append("partition by ").append(String.join(", ", names(partitionKeys)));
    }
    if (!sortingKeys.isEmpty()) {
      if (!partitionKeys.isEmpty()) {
        window.append(' ');
      }
      window.append("ORDER BY ").append(orderBy(sortingKeys, sortingOrders));
    }
    columns.add(window.append(") as ").append(rowNumber).toString());
    String ranked = "SELECT " + String.join(", ", columns) + " FROM " + source.get();
    if (limit.isEmpty()) {
      return Optional.of(ranked);
    }
    return Optional.of("SELECT " + String.join(", ", outputType.names()) + " FROM (" + ranked + ") WHERE "
        + rowNumber + " <= " + limit.getAsInt());
  }

  @Override
  public Optional<String> visitTableWrite(TableWriteNode node) {
    Optional<String> source = sourceSql(node.sources().get(0));
    if (source.isEmpty()) {
      return Optional.empty();
    }
    PartitionedWriteTarget target = node.target();
    List<String> properties = new ArrayList<>();
    if (!target.partitionedBy().isEmpty()) {
      properties.add("PARTITIONED_BY = " + stringArray(target.partitionedBy()));
    }
    if (target.bucketCount().isPresent()) {
      properties.add("BUCKET_COUNT = " + target.bucketCount().getAsInt());
      properties.add("BUCKETED_BY = " + stringArray(target.bucketedBy()));
      if (!target.sortedBy().isEmpty()) {
        List<String> sorted = new ArrayList<>();
        target.sortedBy().forEach(column -> sorted.add(column.toString()));
        properties.add("SORTED_BY = " + stringArray(sorted));
      }
    }
    properties.add("FORMAT = '" + target.storageFormat() + "'");
    return Optional.of("CREATE TABLE " + node.tableName() + " WITH (" + String.join(", ", properties)
        + ") AS SELECT * FROM " + source.get());
  }

  @Override
  public Optional<String> visitHashJoin(HashJoinNode node) {
    Optional<String> left = sourceSql(node.left());
    Optional<String> right = sourceSql(node.right());
    Optional<String> filter = node.filter().isPresent() ? PrestoSql.toExprSql(node.filter().get())
        : Optional.of("");
    if (left.isEmpty() || right.isEmpty() || filter.isEmpty()) {
      return Optional.empty();
    }
    List<String> conditions = new ArrayList<>();
    for (int i = 0; i < node.leftKeys().size(); i++) {
      conditions.add(node.leftKeys().get(i).name() + " = " + node.rightKeys().get(i).name());
    }
    if (!filter.get().isEmpty()) {
      conditions.add(filter.get());
    }
    String condition = String.join(" AND ", conditions);
    String outputs = String.join(", ", node.outputType().names());
    boolean inSubquery = node.isNullAware() && node.leftKeys().size() == 1 && node.filter().isEmpty();
    String probeKey = node.leftKeys().get(0).name();
    String buildKeys = "SELECT " + node.rightKeys().get(0).name() + " FROM " + right.get();
    String correlated = "SELECT * FROM " + right.get() + " WHERE " + condition;

    switch (node.joinType()) {
      case INNER, LEFT, RIGHT, FULL:
        return Optional.of("SELECT " + outputs + " FROM " + left.get() + " " + joinKeyword(node.joinType()) + " "
            + right.get() + " ON " + condition);
      case LEFT_SEMI_FILTER:
        if (node.leftKeys().size() == 1 && node.filter().isEmpty()) {
          return Optional.of("SELECT " + outputs + " FROM " + left.get() + " WHERE " + probeKey + " IN ("
              + buildKeys + ")");
        }
        return Optional.of("SELECT " + outputs + " FROM " + left.get() + " WHERE EXISTS (" + correlated + ")");
      case LEFT_SEMI_PROJECT: {
        if (node.isNullAware() && !inSubquery) {
          return Optional.empty();
        }
        List<String> names = node.outputType().names();
        List<String> columns = new ArrayList<>(names.subList(0, names.size() - 1));
        String match = names.get(names.size() - 1);
        columns.add(inSubquery ? probeKey + " IN (" + buildKeys + ") as " + match
            : "EXISTS (" + correlated + ") as " + match);
        return Optional.of("SELECT " + String.join(", ", columns) + " FROM " + left.get());
      }
      case ANTI:
        if (node.isNullAware()) {
          if (!inSubquery) {
            return Optional.empty();
          }
          return Optional.of("SELECT " + outputs + " FROM " + left.get() + " WHERE " + probeKey + " NOT IN ("
              + buildKeys + ")");
        }
        return Optional.of("SELECT " + outputs + " FROM " + left.get() + " WHERE NOT EXISTS (" + correlated + ")");
      default:
        return Optional.empty();
    }
  }

  @Override
  public Optional<String> visitNestedLoopJoin(NestedLoopJoinNode node) {
    if (!isPlainJoin(node.joinType())) {
      return Optional.empty();
    }
    Optional<String> left = sourceSql(node.left());
    Optional<String> right = sourceSql(node.right());
    Optional<String> condition = node.joinCondition().isPresent() ? PrestoSql.toExprSql(node.joinCondition().get())
        : Optional.of("true");
    if (left.isEmpty() || right.isEmpty() || condition.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of("SELECT " + String.join(", ", node.outputType().names()) + " FROM " + left.get() + " "
        + joinKeyword(node.joinType()) + " " + right.get() + " ON " + condition.get());
  }

  @Override
  public Optional<String> visitValues(ValuesNode node) {
    return leafSql(node.tableName(), node.outputType());
  }

  @Override
  public Optional<String> visitTableScan(TableScanNode node) {
    return leafSql(node.tableName(), node.outputType());
  }

  private Optional<String> leafSql(String tableName, Type outputType) {
    if (!isMaterializable(outputType)) {
      return Optional.empty();
    }
    String columns = outputType.size() == 0 ? "*" : String.join(", ", outputType.names());
    return Optional.of("SELECT " + columns + " FROM " + tableName);
  }

  @Override
  public Optional<String> visitOther(PlanNode node) {
    throw new UnsupportedOperationException("Plan node not implemented: " + node.name() + " (" + node.id() + ")");
  }

  private static boolean isPlainJoin(JoinType joinType) {
    return joinType == JoinType.INNER || joinType == JoinType.LEFT || joinType == JoinType.RIGHT
        || joinType == JoinType.FULL;
  }

  private static String joinKeyword(JoinType joinType) {
    return switch (joinType) {
      case INNER -> "INNER JOIN";
      case LEFT -> "LEFT JOIN";
      case RIGHT -> "RIGHT JOIN";
      case FULL -> "FULL OUTER JOIN";
      default -> throw new IllegalArgumentException("No join keyword for " + joinType);
    };
  }

  private static List<String> names(List<FieldAccessExpr> fields) {
    List<String> names = new ArrayList<>(fields.size());
    for (FieldAccessExpr field : fields) {
      names.add(field.name());
    }
    return names;
  }

  private static String orderBy(List<FieldAccessExpr> keys, List<SortOrder> orders) {
    List<String> parts = new ArrayList<>(keys.size());
    for (int i = 0; i < keys.size(); i++) {
      parts.add(keys.get(i).name() + " " + orders.get(i));
    }
    return String.join(", ", parts);
  }

  private static String stringArray(List<String> values) {
    List<String> quoted = new ArrayList<>(values.size());
    for (String value : values) {
      quoted.add("'" + value.replace("'", "''") + "'");
    }
    return "ARRAY[" + String.join(", ", quoted) + "]";
  }
}
