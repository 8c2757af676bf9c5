package se.alipsa.refbridge.expr;

import java.util.List;
import se.alipsa.refbridge.type.Type;

/** Conversion of a single input to {@link #type()}. */
public final class CastExpr extends TypedExpr {

  private final boolean nullOnFailure;

  /**
   * Create a cast.
   *
   * @param type
   *          the target type
   * @param input
   *          the value to convert
   * @param nullOnFailure
   *          {@code true} for try_cast semantics
   */
  public CastExpr(Type type, TypedExpr input, boolean nullOnFailure) {
    super(type, List.of(input));
    this.nullOnFailure = nullOnFailure;
  }

  public TypedExpr input() {
    return inputs().get(0);
  }

  public boolean nullOnFailure() {
    return nullOnFailure;
  }
}
