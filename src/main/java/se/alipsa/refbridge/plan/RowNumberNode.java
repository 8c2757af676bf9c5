package se.alipsa.refbridge.plan;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import se.alipsa.refbridge.expr.FieldAccessExpr;
import se.alipsa.refbridge.type.Type;

/**
 * Numbers the rows of each partition, optionally keeping only the first
 * {@code limit} rows per partition.
 */
public final class RowNumberNode extends PlanNode {

  private final List<FieldAccessExpr> partitionKeys;
  private final String rowNumberColumnName;
  private final Integer limit;

  /**
   * Create a row number node.
   *
   * @param id
   *          the node id
   * @param partitionKeys
   *          the partitioning columns
   * @param rowNumberColumnName
   *          name of the emitted row number column, {@code null} when the
   *          number is not part of the output
   * @param limit
   *          maximum rows per partition or {@code null}
   * @param source
   *          the input
   */
  public RowNumberNode(String id, List<FieldAccessExpr> partitionKeys, String rowNumberColumnName, Integer limit,
      PlanNode source) {
    super(id, requireSources("RowNumber", List.of(source), 1));
    this.partitionKeys = List.copyOf(partitionKeys);
    this.rowNumberColumnName = rowNumberColumnName;
    this.limit = limit;
    if (rowNumberColumnName == null && limit == null) {
      throw new IllegalArgumentException("Row number node " + id + " must emit the row number or have a limit");
    }
  }

  public List<FieldAccessExpr> partitionKeys() {
    return partitionKeys;
  }

  public Optional<String> rowNumberColumnName() {
    return Optional.ofNullable(rowNumberColumnName);
  }

  public OptionalInt limit() {
    return limit == null ? OptionalInt.empty() : OptionalInt.of(limit);
  }

  @Override
  public Type outputType() {
    Type input = sources().get(0).outputType();
    return rowNumberColumnName == null ? input : input.withField(rowNumberColumnName, Type.BIGINT);
  }

  @Override
  public <R> R accept(PlanNodeVisitor<R> visitor) {
    return visitor.visitRowNumber(this);
  }
}
