package se.alipsa.refbridge.expr;

import java.util.List;
import java.util.Objects;
import se.alipsa.refbridge.type.Type;

/**
 * A function or operator call. Operators use their function names, e.g.
 * {@code plus}, {@code eq}, {@code and}.
 */
public final class CallExpr extends TypedExpr {

  private final String name;

  public CallExpr(String name, Type type, List<? extends TypedExpr> inputs) {
    super(type, inputs);
    this.name = Objects.requireNonNull(name, "name");
  }

  public CallExpr(String name, Type type, TypedExpr... inputs) {
    this(name, type, List.of(inputs));
  }

  public String name() {
    return name;
  }

  @Override
  public String toString() {
    return name + inputs();
  }
}
