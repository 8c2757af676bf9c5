package se.alipsa.refbridge.plan;

import java.util.List;
import java.util.Objects;
import se.alipsa.refbridge.data.RowBatch;
import se.alipsa.refbridge.type.Type;

/** Leaf node producing in-memory rows generated by the fuzzer. */
public final class ValuesNode extends PlanNode {

  private final List<RowBatch> values;

  /**
   * Create a values node.
   *
   * @param id
   *          the node id
   * @param values
   *          at least one batch; all batches share the row type of the first
   */
  public ValuesNode(String id, List<RowBatch> values) {
    super(id, List.of());
    Objects.requireNonNull(values, "values");
    if (values.isEmpty()) {
      throw new IllegalArgumentException("Values node " + id + " needs at least one batch");
    }
    this.values = List.copyOf(values);
  }

  public List<RowBatch> values() {
    return values;
  }

  /**
   * Name of the reference table these values are materialized into.
   *
   * @return {@code t_<id>}
   */
  public String tableName() {
    return "t_" + id();
  }

  @Override
  public Type outputType() {
    return values.get(0).type();
  }

  @Override
  public <R> R accept(PlanNodeVisitor<R> visitor) {
    return visitor.visitValues(this);
  }
}
