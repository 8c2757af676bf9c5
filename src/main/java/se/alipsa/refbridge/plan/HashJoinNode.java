package se.alipsa.refbridge.plan;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import se.alipsa.refbridge.expr.FieldAccessExpr;
import se.alipsa.refbridge.expr.TypedExpr;
import se.alipsa.refbridge.type.Type;

/**
 * Equi-join of a probe (left) and a build (right) input with an optional
 * extra filter.
 */
public final class HashJoinNode extends PlanNode {

  private final JoinType joinType;
  private final boolean nullAware;
  private final List<FieldAccessExpr> leftKeys;
  private final List<FieldAccessExpr> rightKeys;
  private final TypedExpr filter;
  private final Type outputType;

  /**
   * Create a hash join.
   *
   * @param id
   *          the plan node id
   * @param joinType
   *          the join type
   * @param nullAware
   *          whether semi and anti joins follow IN semantics for nulls
   * @param leftKeys
   *          probe side keys
   * @param rightKeys
   *          build side keys, one per left key
   * @param filter
   *          extra join condition, or {@code null}
   * @param left
   *          the probe side
   * @param right
   *          the build side
   * @param outputType
   *          the output row type
   */
  public HashJoinNode(String id, JoinType joinType, boolean nullAware, List<FieldAccessExpr> leftKeys,
      List<FieldAccessExpr> rightKeys, TypedExpr filter, PlanNode left, PlanNode right, Type outputType) {
    super(id, requireSources("HashJoin", List.of(left, right), 2));
    this.joinType = Objects.requireNonNull(joinType, "joinType");
    this.nullAware = nullAware;
    this.leftKeys = List.copyOf(leftKeys);
    this.rightKeys = List.copyOf(rightKeys);
    this.filter = filter;
    this.outputType = Objects.requireNonNull(outputType, "outputType");
    if (leftKeys.isEmpty() || leftKeys.size() != rightKeys.size()) {
      throw new IllegalArgumentException(
          "Hash join " + id + " needs matching non-empty key lists: " + leftKeys + " / " + rightKeys);
    }
  }

  public JoinType joinType() {
    return joinType;
  }

  public boolean isNullAware() {
    return nullAware;
  }

  public List<FieldAccessExpr> leftKeys() {
    return leftKeys;
  }

  public List<FieldAccessExpr> rightKeys() {
    return rightKeys;
  }

  public Optional<TypedExpr> filter() {
    return Optional.ofNullable(filter);
  }

  public PlanNode left() {
    return sources().get(0);
  }

  public PlanNode right() {
    return sources().get(1);
  }

  @Override
  public Type outputType() {
    return outputType;
  }

  @Override
  public <R> R accept(PlanNodeVisitor<R> visitor) {
    return visitor.visitHashJoin(this);
  }
}
