package se.alipsa.refbridge.plan;

import java.util.List;
import java.util.Objects;
import se.alipsa.refbridge.type.Type;

/**
 * A node of a query plan. Every kind the SQL compiler knows overrides
 * {@link #accept(PlanNodeVisitor)}; other kinds reach
 * {@link PlanNodeVisitor#visitOther(PlanNode)}.
 */
public abstract class PlanNode {

  private final String id;
  private final List<PlanNode> sources;

  /**
   * Create a plan node.
   *
   * @param id
   *          identifier unique within the plan
   * @param sources
   *          the input nodes
   */
  protected PlanNode(String id, List<PlanNode> sources) {
    this.id = Objects.requireNonNull(id, "id");
    this.sources = List.copyOf(sources);
  }

  public String id() {
    return id;
  }

  public List<PlanNode> sources() {
    return sources;
  }

  /**
   * The row type produced by this node.
   *
   * @return a ROW type
   */
  public abstract Type outputType();

  /**
   * Short name of the node kind used in messages.
   *
   * @return the kind, e.g. {@code "Project"}
   */
  public String name() {
    return getClass().getSimpleName().replaceFirst("Node$", "");
  }

  /**
   * Dispatch to the visitor method for this node kind.
   *
   * @param visitor
   *          the visitor
   * @param <R>
   *          the visitor result type
   * @return the visitor result
   */
  public <R> R accept(PlanNodeVisitor<R> visitor) {
    return visitor.visitOther(this);
  }

  /**
   * Check the number of sources a node kind needs.
   *
   * @param kind
   *          the kind name for the message
   * @param sources
   *          the supplied sources
   * @param expected
   *          the required count
   * @return {@code sources}
   */
  protected static List<PlanNode> requireSources(String kind, List<PlanNode> sources, int expected) {
    Objects.requireNonNull(sources, "sources");
    if (sources.size() != expected) {
      throw new IllegalArgumentException(kind + " node requires " + expected + " source(s) but got " + sources.size());
    }
    for (PlanNode source : sources) {
      Objects.requireNonNull(source, "source");
    }
    return sources;
  }

  @Override
  public String toString() {
    return name() + "[" + id + "]";
  }
}
