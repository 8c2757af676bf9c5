package se.alipsa.refbridge.plan;

import java.util.ArrayList;
import java.util.List;
import se.alipsa.refbridge.expr.TypedExpr;
import se.alipsa.refbridge.type.Type;

/** Computes one named expression per output column. */
public final class ProjectNode extends PlanNode {

  private final List<String> names;
  private final List<TypedExpr> projections;

  /**
   * Create a projection.
   *
   * @param id
   *          the plan node id
   * @param names
   *          output column names
   * @param projections
   *          one expression per output column
   * @param source
   *          the input
   */
  public ProjectNode(String id, List<String> names, List<? extends TypedExpr> projections, PlanNode source) {
    super(id, requireSources("Project", List.of(source), 1));
    if (names.size() != projections.size()) {
      throw new IllegalArgumentException("Project node " + id + " has " + names.size() + " names and "
          + projections.size() + " projections");
    }
    this.names = List.copyOf(names);
    this.projections = List.copyOf(projections);
  }

  public List<String> names() {
    return names;
  }

  public List<TypedExpr> projections() {
    return projections;
  }

  @Override
  public Type outputType() {
    List<Type> types = new ArrayList<>();
    for (TypedExpr projection : projections) {
      types.add(projection.type());
    }
    return Type.row(names, types);
  }

  @Override
  public <R> R accept(PlanNodeVisitor<R> visitor) {
    return visitor.visitProject(this);
  }
}
