package se.alipsa.refbridge.expr;

import java.util.List;
import se.alipsa.refbridge.type.Type;

/**
 * A literal value. The Java representation follows the row batch mapping,
 * e.g. {@code Integer} for INTEGER, {@code LocalDate} for DATE and
 * {@code List} for ARRAY; {@code null} is the typed NULL.
 */
public final class ConstantExpr extends TypedExpr {

  private final Object value;

  public ConstantExpr(Type type, Object value) {
    super(type, List.of());
    this.value = value;
  }

  public Object value() {
    return value;
  }

  public boolean isNull() {
    return value == null;
  }

  @Override
  public String toString() {
    return String.valueOf(value);
  }
}
