package se.alipsa.refbridge.sql;

import java.util.List;
import se.alipsa.refbridge.expr.ConstantExpr;
import se.alipsa.refbridge.expr.FunctionSignature;
import se.alipsa.refbridge.expr.TypedExpr;
import se.alipsa.refbridge.type.Type;
import se.alipsa.refbridge.type.TypeKind;

/**
 * Predicates deciding what the reference engine can be asked to evaluate.
 */
public final class SqlSupport {

  // Not usable anywhere in a signature: no literals, no Hive columns, or not native to Presto
  private static final List<String> UNSUPPORTED_TYPE_NAMES = List.of("bingtile", "interval year to month", "hugeint",
      "hyperloglog", "tdigest");

  // Presto only accepts valid literals of these, so generated inputs would fail
  private static final List<String> UNSUPPORTED_INPUT_TYPE_NAMES = List.of("json", "ipaddress", "ipprefix", "uuid");

  private SqlSupport() {
  }

  /**
   * Whether functions with this signature may be used in generated queries.
   *
   * @param signature
   *          the function signature
   * @return {@code false} if the signature uses a type the reference engine
   *         cannot handle
   */
  public static boolean isSupportedFunctionSignature(FunctionSignature signature) {
    for (String name : UNSUPPORTED_TYPE_NAMES) {
      if (signature.usesTypeName(name)) {
        return false;
      }
    }
    for (String name : UNSUPPORTED_INPUT_TYPE_NAMES) {
      if (signature.usesInputTypeName(name)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Whether an expression can appear as-is in generated SQL. Only constants
   * are restricted: Presto coerces literals of some types implicitly (json,
   * ip addresses, uuid), interprets timestamps in its own time zone and has no
   * literal syntax for complex types or day-to-second intervals.
   *
   * @param expr
   *          the expression
   * @return {@code true} unless the expression is an unsupported constant
   */
  public static boolean isConstantExpressionSupported(TypedExpr expr) {
    if (!(expr instanceof ConstantExpr)) {
      return true;
    }
    Type type = expr.type();
    if (!type.isPrimitive()) {
      return false;
    }
    return switch (type.kind()) {
      case TIMESTAMP, JSON, INTERVAL_DAY_TIME, IPADDRESS, IPPREFIX, UUID -> false;
      default -> true;
    };
  }

  /**
   * Whether values of the type can be written to a Parquet file the reference
   * engine reads back as a table column.
   *
   * @param type
   *          the column type, checked at every nesting depth
   * @return {@code true} if the type can be materialized
   */
  public static boolean isSupportedParquetType(Type type) {
    TypeKind kind = type.kind();
    if (kind == TypeKind.UNKNOWN || kind == TypeKind.HUGEINT || kind == TypeKind.INTERVAL_DAY_TIME
        || kind == TypeKind.INTERVAL_YEAR_MONTH || kind.isCustom()) {
      return false;
    }
    if (kind == TypeKind.MAP && type.childAt(0).kind() != TypeKind.VARCHAR) {
      return false;
    }
    for (Type child : type.children()) {
      if (!isSupportedParquetType(child)) {
        return false;
      }
    }
    return true;
  }
}
