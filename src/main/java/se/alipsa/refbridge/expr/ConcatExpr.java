package se.alipsa.refbridge.expr;

import java.util.ArrayList;
import java.util.List;
import se.alipsa.refbridge.type.Type;

/** Builds a row from its inputs; the result type is a ROW of the named inputs. */
public final class ConcatExpr extends TypedExpr {

  public ConcatExpr(List<String> names, List<? extends TypedExpr> inputs) {
    super(rowType(names, inputs), inputs);
  }

  private static Type rowType(List<String> names, List<? extends TypedExpr> inputs) {
    List<Type> types = new ArrayList<>(inputs.size());
    for (TypedExpr input : inputs) {
      types.add(input.type());
    }
    return Type.row(names, types);
  }
}
