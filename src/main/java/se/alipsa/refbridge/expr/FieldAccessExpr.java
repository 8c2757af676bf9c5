package se.alipsa.refbridge.expr;

import java.util.List;
import java.util.Objects;
import se.alipsa.refbridge.type.Type;

/** A reference to a column of the input row. */
public final class FieldAccessExpr extends TypedExpr {

  private final String name;

  public FieldAccessExpr(String name, Type type) {
    super(type, List.of());
    this.name = Objects.requireNonNull(name, "name");
  }

  public String name() {
    return name;
  }

  @Override
  public String toString() {
    return name;
  }
}
