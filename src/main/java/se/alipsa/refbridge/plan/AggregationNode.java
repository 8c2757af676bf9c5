package se.alipsa.refbridge.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import se.alipsa.refbridge.expr.CallExpr;
import se.alipsa.refbridge.expr.FieldAccessExpr;
import se.alipsa.refbridge.type.Type;

/** Groups its input by the grouping keys and evaluates aggregate functions. */
public final class AggregationNode extends PlanNode {

  /** Aggregation step; only {@link #SINGLE} is a complete aggregation. */
  public enum Step {
    PARTIAL,
    FINAL,
    INTERMEDIATE,
    SINGLE
  }

  /**
   * One aggregate function call.
   *
   * @param call
   *          the function call over input columns
   * @param rawInputTypes
   *          the argument types before any intermediate step
   * @param mask
   *          boolean column selecting the rows to aggregate, or {@code null}
   * @param sortingKeys
   *          keys ordering the input of order-sensitive aggregates
   * @param sortingOrders
   *          one order per sorting key
   * @param distinct
   *          whether only distinct inputs are aggregated
   */
  public record Aggregate(CallExpr call, List<Type> rawInputTypes, FieldAccessExpr mask,
      List<FieldAccessExpr> sortingKeys, List<SortOrder> sortingOrders, boolean distinct) {

    public Aggregate {
      Objects.requireNonNull(call, "call");
      rawInputTypes = List.copyOf(rawInputTypes);
      sortingKeys = List.copyOf(sortingKeys);
      sortingOrders = List.copyOf(sortingOrders);
      if (sortingKeys.size() != sortingOrders.size()) {
        throw new IllegalArgumentException("Aggregate " + call.name() + " needs one sort order per sorting key");
      }
    }

    /**
     * Create a plain aggregate without mask, ordering or distinct.
     *
     * @param call
     *          the function call
     * @return the aggregate
     */
    public static Aggregate of(CallExpr call) {
      List<Type> types = new ArrayList<>();
      call.inputs().forEach(in -> types.add(in.type()));
      return new Aggregate(call, types, null, List.of(), List.of(), false);
    }
  }

  private final Step step;
  private final List<FieldAccessExpr> groupingKeys;
  private final List<String> aggregateNames;
  private final List<Aggregate> aggregates;

  /**
   * Create an aggregation.
   *
   * @param id
   *          the plan node id
   * @param step
   *          the aggregation step, only single steps compile to SQL
   * @param groupingKeys
   *          the GROUP BY columns
   * @param aggregateNames
   *          output names of the aggregates
   * @param aggregates
   *          one aggregate per output name
   * @param source
   *          the input
   */
  public AggregationNode(String id, Step step, List<FieldAccessExpr> groupingKeys, List<String> aggregateNames,
      List<Aggregate> aggregates, PlanNode source) {
    super(id, requireSources("Aggregation", List.of(source), 1));
    this.step = Objects.requireNonNull(step, "step");
    this.groupingKeys = List.copyOf(groupingKeys);
    this.aggregateNames = List.copyOf(aggregateNames);
    this.aggregates = List.copyOf(aggregates);
    if (aggregateNames.size() != aggregates.size()) {
      throw new IllegalArgumentException("Aggregation node " + id + " needs one name per aggregate");
    }
  }

  public Step step() {
    return step;
  }

  public List<FieldAccessExpr> groupingKeys() {
    return groupingKeys;
  }

  public List<String> aggregateNames() {
    return aggregateNames;
  }

  public List<Aggregate> aggregates() {
    return aggregates;
  }

  @Override
  public Type outputType() {
    List<String> names = new ArrayList<>();
    List<Type> types = new ArrayList<>();
    for (FieldAccessExpr key : groupingKeys) {
      names.add(key.name());
      types.add(key.type());
    }
    for (int i = 0; i < aggregates.size(); i++) {
      names.add(aggregateNames.get(i));
      types.add(aggregates.get(i).call().type());
    }
    return Type.row(names, types);
  }

  @Override
  public <R> R accept(PlanNodeVisitor<R> visitor) {
    return visitor.visitAggregation(this);
  }
}
