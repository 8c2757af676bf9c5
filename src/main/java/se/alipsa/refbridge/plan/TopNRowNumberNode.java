package se.alipsa.refbridge.plan;

import java.util.List;
import java.util.Optional;
import se.alipsa.refbridge.expr.FieldAccessExpr;
import se.alipsa.refbridge.type.Type;

/** Keeps the first {@code limit} rows of every partition in sorting key order. */
public final class TopNRowNumberNode extends PlanNode {

  private final List<FieldAccessExpr> partitionKeys;
  private final List<FieldAccessExpr> sortingKeys;
  private final List<SortOrder> sortingOrders;
  private final String rowNumberColumnName;
  private final int limit;

  /**
   * Create a top N per partition node.
   *
   * @param id
   *          the plan node id
   * @param partitionKeys
   *          the PARTITION BY columns
   * @param sortingKeys
   *          the ORDER BY columns
   * @param sortingOrders
   *          one order per sorting key
   * @param rowNumberColumnName
   *          name of the row number output column, or {@code null} when the
   *          row number is not part of the output
   * @param limit
   *          rows kept per partition
   * @param source
   *          the input
   */
  public TopNRowNumberNode(String id, List<FieldAccessExpr> partitionKeys, List<FieldAccessExpr> sortingKeys,
      List<SortOrder> sortingOrders, String rowNumberColumnName, int limit, PlanNode source) {
    super(id, requireSources("TopNRowNumber", List.of(source), 1));
    this.partitionKeys = List.copyOf(partitionKeys);
    this.sortingKeys = List.copyOf(sortingKeys);
    this.sortingOrders = List.copyOf(sortingOrders);
    this.rowNumberColumnName = rowNumberColumnName;
    this.limit = limit;
    if (sortingKeys.size() != sortingOrders.size()) {
      throw new IllegalArgumentException("TopNRowNumber node " + id + " needs one sort order per sorting key");
    }
    if (limit <= 0) {
      throw new IllegalArgumentException("TopNRowNumber node " + id + " needs a positive limit: " + limit);
    }
  }

  public List<FieldAccessExpr> partitionKeys() {
    return partitionKeys;
  }

  public List<FieldAccessExpr> sortingKeys() {
    return sortingKeys;
  }

  public List<SortOrder> sortingOrders() {
    return sortingOrders;
  }

  /**
   * Name of the emitted row number column.
   *
   * @return the name, empty when the row number is not part of the output
   */
  public Optional<String> rowNumberColumnName() {
    return Optional.ofNullable(rowNumberColumnName);
  }

  public boolean generateRowNumber() {
    return rowNumberColumnName != null;
  }

  public int limit() {
    return limit;
  }

  @Override
  public Type outputType() {
    Type input = sources().get(0).outputType();
    return rowNumberColumnName == null ? input : input.withField(rowNumberColumnName, Type.BIGINT);
  }

  @Override
  public <R> R accept(PlanNodeVisitor<R> visitor) {
    return visitor.visitTopNRowNumber(this);
  }
}
