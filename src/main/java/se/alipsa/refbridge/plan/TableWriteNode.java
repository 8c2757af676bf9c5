package se.alipsa.refbridge.plan;

import java.util.List;
import java.util.Objects;
import se.alipsa.refbridge.type.Type;

/** Writes its input to a new table and returns the number of rows written. */
public final class TableWriteNode extends PlanNode {

  /** Table name used when the plan does not name one. */
  public static final String DEFAULT_TABLE_NAME = "tmp_write";

  private final List<String> columnNames;
  private final PartitionedWriteTarget target;
  private final String tableName;

  /**
   * Create a write into the default output table.
   *
   * @param id
   *          the plan node id
   * @param columnNames
   *          names of the written columns
   * @param target
   *          partitioning, bucketing and storage format of the table
   * @param source
   *          the rows to write
   */
  public TableWriteNode(String id, List<String> columnNames, PartitionedWriteTarget target, PlanNode source) {
    this(id, columnNames, target, DEFAULT_TABLE_NAME, source);
  }

  /**
   * Create a write into a named table.
   *
   * @param id
   *          the plan node id
   * @param columnNames
   *          names of the written columns
   * @param target
   *          partitioning, bucketing and storage format of the table
   * @param tableName
   *          the table to create
   * @param source
   *          the rows to write
   */
  public TableWriteNode(String id, List<String> columnNames, PartitionedWriteTarget target, String tableName,
      PlanNode source) {
    super(id, requireSources("TableWrite", List.of(source), 1));
    this.columnNames = List.copyOf(columnNames);
    this.target = Objects.requireNonNull(target, "target");
    this.tableName = Objects.requireNonNull(tableName, "tableName");
  }

  public List<String> columnNames() {
    return columnNames;
  }

  public PartitionedWriteTarget target() {
    return target;
  }

  public String tableName() {
    return tableName;
  }

  @Override
  public Type outputType() {
    return Type.row(List.of("rows"), List.of(Type.BIGINT));
  }

  @Override
  public <R> R accept(PlanNodeVisitor<R> visitor) {
    return visitor.visitTableWrite(this);
  }
}
