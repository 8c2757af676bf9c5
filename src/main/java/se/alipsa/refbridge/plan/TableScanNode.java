package se.alipsa.refbridge.plan;

import java.util.List;
import java.util.Objects;
import se.alipsa.refbridge.data.RowBatch;
import se.alipsa.refbridge.type.Type;

/** Leaf node reading a named table whose content the harness supplies. */
public final class TableScanNode extends PlanNode {

  private final String tableName;
  private final Type outputType;
  private final List<RowBatch> data;

  /**
   * Create a table scan.
   *
   * @param id
   *          the node id
   * @param tableName
   *          the table to read
   * @param outputType
   *          the scanned columns
   * @param data
   *          the rows the table must contain in the reference engine
   */
  public TableScanNode(String id, String tableName, Type outputType, List<RowBatch> data) {
    super(id, List.of());
    this.tableName = Objects.requireNonNull(tableName, "tableName");
    this.outputType = Objects.requireNonNull(outputType, "outputType");
    this.data = List.copyOf(data);
  }

  public String tableName() {
    return tableName;
  }

  public List<RowBatch> data() {
    return data;
  }

  @Override
  public Type outputType() {
    return outputType;
  }

  @Override
  public <R> R accept(PlanNodeVisitor<R> visitor) {
    return visitor.visitTableScan(this);
  }
}
