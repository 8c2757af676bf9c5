package se.alipsa.refbridge.sql;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import se.alipsa.refbridge.expr.CallExpr;
import se.alipsa.refbridge.expr.CastExpr;
import se.alipsa.refbridge.expr.ConcatExpr;
import se.alipsa.refbridge.expr.ConstantExpr;
import se.alipsa.refbridge.expr.FieldAccessExpr;
import se.alipsa.refbridge.expr.TypedExpr;
import se.alipsa.refbridge.plan.WindowFrame;
import se.alipsa.refbridge.type.Type;
import se.alipsa.refbridge.type.TypeKind;

/**
 * Renders types, expressions and literals in the Presto SQL dialect.
 */
public final class PrestoSql {

  private static final Map<String, String> BINARY_OPERATORS = Map.ofEntries(Map.entry("plus", "+"),
      Map.entry("minus", "-"), Map.entry("multiply", "*"), Map.entry("divide", "/"), Map.entry("mod", "%"),
      Map.entry("eq", "="), Map.entry("neq", "<>"), Map.entry("lt", "<"), Map.entry("gt", ">"),
      Map.entry("lte", "<="), Map.entry("gte", ">="), Map.entry("distinct_from", "IS DISTINCT FROM"));

  private PrestoSql() {
  }

  /**
   * Render a type, e.g. {@code ROW(a INTEGER, b ARRAY(VARCHAR))}.
   *
   * @param type
   *          the type
   * @return the SQL type name
   */
  public static String toTypeSql(Type type) {
    return switch (type.kind()) {
      case ARRAY -> "ARRAY(" + toTypeSql(type.childAt(0)) + ")";
      case MAP -> "MAP(" + toTypeSql(type.childAt(0)) + ", " + toTypeSql(type.childAt(1)) + ")";
      case ROW -> {
        StringBuilder sb = new StringBuilder("ROW(");
        for (int i = 0; i < type.size(); i++) {
          if (i > 0) {
            sb.append(", ");
          }
          String name = type.nameOf(i);
          if (!name.isEmpty()) {
            sb.append(name).append(' ');
          }
          sb.append(toTypeSql(type.childAt(i)));
        }
        yield sb.append(')').toString();
      }
      case TDIGEST -> "TDIGEST(" + toTypeSql(type.childAt(0)) + ")";
      default -> type.toString();
    };
  }

  /**
   * Render an expression.
   *
   * @param expr
   *          the expression
   * @return the SQL text, empty when the expression or any part of it has no
   *         Presto rendering
   */
  public static Optional<String> toExprSql(TypedExpr expr) {
    if (!isExpressible(expr)) {
      return Optional.empty();
    }
    return Optional.of(render(expr));
  }

  /**
   * Render a list of expressions separated by commas.
   *
   * @param exprs
   *          the expressions
   * @return the SQL text, empty if any expression cannot be rendered
   */
  public static Optional<String> toExprListSql(List<? extends TypedExpr> exprs) {
    for (TypedExpr expr : exprs) {
      if (!isExpressible(expr)) {
        return Optional.empty();
      }
    }
    return Optional.of(renderList(exprs));
  }

  /**
   * Render a constant as a literal.
   *
   * @param constant
   *          the constant
   * @return the literal, e.g. {@code 'it''s'} or {@code cast(1 as BIGINT)}
   * @throws IllegalArgumentException
   *           if the constant type has no literal form
   */
  public static String toConstantSql(ConstantExpr constant) {
    if (!SqlSupport.isConstantExpressionSupported(constant)) {
      throw new IllegalArgumentException("No literal form for constant of type " + constant.type());
    }
    return literal(constant.type(), constant.value());
  }

  /**
   * Render a window frame, e.g. {@code ROWS BETWEEN 1 PRECEDING AND CURRENT ROW}.
   *
   * @param frame
   *          the frame
   * @return the frame clause, empty if an offset cannot be rendered
   */
  public static Optional<String> toFrameSql(WindowFrame frame) {
    Optional<String> start = boundSql(frame.startType(), frame.startValue());
    Optional<String> end = boundSql(frame.endType(), frame.endValue());
    if (start.isEmpty() || end.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(frame.unit().name() + " BETWEEN " + start.get() + " AND " + end.get());
  }

  private static Optional<String> boundSql(WindowFrame.BoundType type, TypedExpr offset) {
    if (offset == null) {
      return Optional.of(type.sql());
    }
    return toExprSql(offset).map(sql -> sql + " " + type.sql());
  }

  static boolean isExpressible(TypedExpr expr) {
    if (expr instanceof FieldAccessExpr) {
      return true;
    }
    if (expr instanceof ConstantExpr constant) {
      return SqlSupport.isConstantExpressionSupported(constant);
    }
    if (expr instanceof CallExpr call && "in".equals(call.name()) && isArrayConstantList(call)) {
      ConstantExpr list = (ConstantExpr) call.inputs().get(1);
      Type elementType = list.type().childAt(0);
      return isExpressible(call.inputs().get(0))
          && SqlSupport.isConstantExpressionSupported(new ConstantExpr(elementType, null));
    }
    if (expr instanceof CallExpr || expr instanceof CastExpr || expr instanceof ConcatExpr) {
      for (TypedExpr input : expr.inputs()) {
        if (!isExpressible(input)) {
          return false;
        }
      }
      return true;
    }
    return false;
  }

  private static String render(TypedExpr expr) {
    if (expr instanceof FieldAccessExpr field) {
      return field.name();
    }
    if (expr instanceof ConstantExpr constant) {
      return toConstantSql(constant);
    }
    if (expr instanceof CastExpr cast) {
      return (cast.nullOnFailure() ? "try_cast(" : "cast(") + render(cast.input()) + " as "
          + toTypeSql(cast.type()) + ")";
    }
    if (expr instanceof ConcatExpr concat) {
      return "cast(row(" + renderList(concat.inputs()) + ") as " + toTypeSql(concat.type()) + ")";
    }
    if (expr instanceof CallExpr call) {
      return renderCall(call);
    }
    throw new IllegalStateException("Unexpected expression " + expr.getClass().getName());
  }

  private static String renderCall(CallExpr call) {
    List<TypedExpr> in = call.inputs();
    String operator = BINARY_OPERATORS.get(call.name());
    if (operator != null && in.size() == 2) {
      return "(" + render(in.get(0)) + " " + operator + " " + render(in.get(1)) + ")";
    }
    switch (call.name()) {
      case "is_null":
        return "(" + render(in.get(0)) + " is null)";
      case "not_null":
        return "(" + render(in.get(0)) + " is not null)";
      case "and", "or": {
        List<String> parts = new ArrayList<>();
        in.forEach(e -> parts.add(render(e)));
        return "(" + String.join(" " + call.name() + " ", parts) + ")";
      }
      case "not":
        return "not(" + render(in.get(0)) + ")";
      case "negate":
        return "(- " + render(in.get(0)) + ")";
      case "in":
        return "(" + render(in.get(0)) + " in (" + inListSql(call) + "))";
      case "like":
        return "(" + render(in.get(0)) + " like " + render(in.get(1))
            + (in.size() > 2 ? " escape " + render(in.get(2)) : "") + ")";
      case "between":
        return "(" + render(in.get(0)) + " between " + render(in.get(1)) + " and " + render(in.get(2)) + ")";
      case "subscript":
        return render(in.get(0)) + "[" + render(in.get(1)) + "]";
      case "switch", "if":
        return caseSql(in);
      case "row_constructor":
        return "row(" + renderList(in) + ")";
      case "array_constructor":
        return "ARRAY[" + renderList(in) + "]";
      default:
        return call.name() + "(" + renderList(in) + ")";
    }
  }

  private static String inListSql(CallExpr call) {
    if (!isArrayConstantList(call)) {
      return renderList(call.inputs().subList(1, call.inputs().size()));
    }
    ConstantExpr list = (ConstantExpr) call.inputs().get(1);
    Type elementType = list.type().childAt(0);
    List<String> values = new ArrayList<>();
    for (Object value : (List<?>) list.value()) {
      values.add(literal(elementType, value));
    }
    return String.join(", ", values);
  }

  private static boolean isArrayConstantList(CallExpr call) {
    return call.inputs().size() == 2 && call.inputs().get(1) instanceof ConstantExpr constant
        && constant.type().kind() == TypeKind.ARRAY && constant.value() instanceof List;
  }

  private static String caseSql(List<TypedExpr> in) {
    StringBuilder sb = new StringBuilder("case");
    int i = 0;
    for (; i + 1 < in.size(); i += 2) {
      sb.append(" when ").append(render(in.get(i))).append(" then ").append(render(in.get(i + 1)));
    }
    if (i < in.size()) {
      sb.append(" else ").append(render(in.get(i)));
    }
    return sb.append(" end").toString();
  }

  private static String renderList(List<? extends TypedExpr> exprs) {
    List<String> parts = new ArrayList<>(exprs.size());
    for (TypedExpr expr : exprs) {
      parts.add(render(expr));
    }
    return String.join(", ", parts);
  }

  private static String literal(Type type, Object value) {
    String typeSql = toTypeSql(type);
    if (value == null) {
      return "cast(null as " + typeSql + ")";
    }
    switch (type.kind()) {
      case VARCHAR:
        return quote(value.toString());
      case VARBINARY:
        return "from_hex('" + hex(value) + "')";
      case BOOLEAN:
        return value.toString();
      case REAL, DOUBLE: {
        double d = ((Number) value).doubleValue();
        if (Double.isNaN(d)) {
          return "cast(nan() as " + typeSql + ")";
        }
        if (Double.isInfinite(d)) {
          return "cast(" + (d > 0 ? "infinity()" : "-infinity()") + " as " + typeSql + ")";
        }
        return "cast(" + value + " as " + typeSql + ")";
      }
      case DATE:
        return "DATE '" + (value instanceof LocalDate date ? date : LocalDate.ofEpochDay(((Number) value).longValue()))
            + "'";
      case DECIMAL: {
        BigDecimal decimal = value instanceof BigDecimal bd ? bd : new BigDecimal(value.toString());
        return "cast(DECIMAL '" + decimal.toPlainString() + "' as " + typeSql + ")";
      }
      default:
        if (value instanceof ByteBuffer || value instanceof byte[]) {
          return "cast(from_hex('" + hex(value) + "') as " + typeSql + ")";
        }
        if (value instanceof Number) {
          return "cast(" + value + " as " + typeSql + ")";
        }
        return "cast(" + quote(value.toString()) + " as " + typeSql + ")";
    }
  }

  private static String quote(String text) {
    return "'" + text.replace("'", "''") + "'";
  }

  private static String hex(Object value) {
    byte[] bytes;
    if (value instanceof ByteBuffer buffer) {
      ByteBuffer copy = buffer.duplicate();
      bytes = new byte[copy.remaining()];
      copy.get(bytes);
    } else {
      bytes = (byte[]) value;
    }
    return HexFormat.of().withUpperCase().formatHex(bytes);
  }
}
