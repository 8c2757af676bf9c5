package se.alipsa.refbridge.plan;

import java.util.Objects;
import se.alipsa.refbridge.expr.TypedExpr;

/**
 * The frame of a window function, e.g.
 * {@code ROWS BETWEEN 2 PRECEDING AND CURRENT ROW}. Offsets are only present
 * for {@link BoundType#PRECEDING} and {@link BoundType#FOLLOWING} bounds.
 *
 * @param unit
 *          ROWS or RANGE
 * @param startType
 *          the start bound
 * @param startValue
 *          the start offset or {@code null}
 * @param endType
 *          the end bound
 * @param endValue
 *          the end offset or {@code null}
 */
public record WindowFrame(Unit unit, BoundType startType, TypedExpr startValue, BoundType endType,
    TypedExpr endValue) {

  /** The frame Presto uses when none is given. */
  public static final WindowFrame DEFAULT = new WindowFrame(Unit.RANGE, BoundType.UNBOUNDED_PRECEDING, null,
      BoundType.CURRENT_ROW, null);

  public WindowFrame {
    Objects.requireNonNull(unit, "unit");
    Objects.requireNonNull(startType, "startType");
    Objects.requireNonNull(endType, "endType");
    if (startType.hasOffset() != (startValue != null)) {
      throw new IllegalArgumentException("Start bound " + startType + " and offset " + startValue + " disagree");
    }
    if (endType.hasOffset() != (endValue != null)) {
      throw new IllegalArgumentException("End bound " + endType + " and offset " + endValue + " disagree");
    }
  }

  /** Frame unit. */
  public enum Unit {
    ROWS,
    RANGE
  }

  /** Frame bound kind. */
  public enum BoundType {
    UNBOUNDED_PRECEDING("UNBOUNDED PRECEDING"),
    PRECEDING("PRECEDING"),
    CURRENT_ROW("CURRENT ROW"),
    FOLLOWING("FOLLOWING"),
    UNBOUNDED_FOLLOWING("UNBOUNDED FOLLOWING");

    private final String sql;

    BoundType(String sql) {
      this.sql = sql;
    }

    public String sql() {
      return sql;
    }

    public boolean hasOffset() {
      return this == PRECEDING || this == FOLLOWING;
    }
  }
}
