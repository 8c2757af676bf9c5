package se.alipsa.refbridge.plan;

import java.util.List;
import java.util.Objects;
import se.alipsa.refbridge.expr.CallExpr;
import se.alipsa.refbridge.expr.FieldAccessExpr;
import se.alipsa.refbridge.type.Type;

/**
 * Evaluates window functions over partitions of its input. Output is the input
 * columns followed by one column per function.
 */
public final class WindowNode extends PlanNode {

  /**
   * A window function with its frame.
   *
   * @param call
   *          the function call
   * @param frame
   *          the frame the function is evaluated over
   * @param ignoreNulls
   *          whether null inputs are skipped
   */
  public record Function(CallExpr call, WindowFrame frame, boolean ignoreNulls) {

    public Function {
      Objects.requireNonNull(call, "call");
      Objects.requireNonNull(frame, "frame");
    }
  }

  private final List<FieldAccessExpr> partitionKeys;
  private final List<FieldAccessExpr> sortingKeys;
  private final List<SortOrder> sortingOrders;
  private final List<String> windowColumnNames;
  private final List<Function> functions;

  /**
   * Create a window node. The output row is the source row followed by one
   * column per function.
   *
   * @param id
   *          the plan node id
   * @param partitionKeys
   *          the PARTITION BY columns
   * @param sortingKeys
   *          the ORDER BY columns
   * @param sortingOrders
   *          one order per sorting key
   * @param windowColumnNames
   *          output names of the window functions
   * @param functions
   *          the window functions, one per output name
   * @param source
   *          the input
   */
  public WindowNode(String id, List<FieldAccessExpr> partitionKeys, List<FieldAccessExpr> sortingKeys,
      List<SortOrder> sortingOrders, List<String> windowColumnNames, List<Function> functions, PlanNode source) {
    super(id, requireSources("Window", List.of(source), 1));
    this.partitionKeys = List.copyOf(partitionKeys);
    this.sortingKeys = List.copyOf(sortingKeys);
    this.sortingOrders = List.copyOf(sortingOrders);
    this.windowColumnNames = List.copyOf(windowColumnNames);
    this.functions = List.copyOf(functions);
    if (sortingKeys.size() != sortingOrders.size()) {
      throw new IllegalArgumentException("Window node " + id + " needs one sort order per sorting key");
    }
    if (windowColumnNames.size() != functions.size()) {
      throw new IllegalArgumentException("Window node " + id + " needs one column name per function");
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

  public List<String> windowColumnNames() {
    return windowColumnNames;
  }

  public List<Function> functions() {
    return functions;
  }

  @Override
  public Type outputType() {
    Type type = sources().get(0).outputType();
    for (int i = 0; i < functions.size(); i++) {
      type = type.withField(windowColumnNames.get(i), functions.get(i).call().type());
    }
    return type;
  }

  @Override
  public <R> R accept(PlanNodeVisitor<R> visitor) {
    return visitor.visitWindow(this);
  }
}
