package se.alipsa.refbridge.plan;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import se.alipsa.refbridge.expr.TypedExpr;
import se.alipsa.refbridge.type.Type;

/** Join evaluating an arbitrary condition for every pair of input rows. */
public final class NestedLoopJoinNode extends PlanNode {

  private final JoinType joinType;
  private final TypedExpr joinCondition;
  private final Type outputType;

  /**
   * Create a nested loop join.
   *
   * @param id
   *          the plan node id
   * @param joinType
   *          the join type
   * @param joinCondition
   *          the ON condition, or {@code null} for a cross join
   * @param left
   *          the outer side
   * @param right
   *          the inner side
   * @param outputType
   *          the output row type
   */
  public NestedLoopJoinNode(String id, JoinType joinType, TypedExpr joinCondition, PlanNode left, PlanNode right,
      Type outputType) {
    super(id, requireSources("NestedLoopJoin", List.of(left, right), 2));
    this.joinType = Objects.requireNonNull(joinType, "joinType");
    this.joinCondition = joinCondition;
    this.outputType = Objects.requireNonNull(outputType, "outputType");
  }

  public JoinType joinType() {
    return joinType;
  }

  /**
   * The join condition.
   *
   * @return the condition, empty for a cross join
   */
  public Optional<TypedExpr> joinCondition() {
    return Optional.ofNullable(joinCondition);
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
    return visitor.visitNestedLoopJoin(this);
  }
}
