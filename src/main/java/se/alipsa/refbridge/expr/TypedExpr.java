package se.alipsa.refbridge.expr;

import java.util.List;
import java.util.Objects;
import se.alipsa.refbridge.type.Type;

/** Base class of the typed expressions found in plan nodes. */
public abstract class TypedExpr {

  private final Type type;
  private final List<TypedExpr> inputs;

  /**
   * Create an expression.
   *
   * @param type
   *          the result type
   * @param inputs
   *          the operand expressions
   */
  protected TypedExpr(Type type, List<? extends TypedExpr> inputs) {
    this.type = Objects.requireNonNull(type, "type");
    this.inputs = List.copyOf(inputs);
  }

  public Type type() {
    return type;
  }

  public List<TypedExpr> inputs() {
    return inputs;
  }
}
