package se.alipsa.refbridge.type;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * An immutable Presto type. Scalar types are shared constants, containers are
 * built with {@link #array(Type)}, {@link #map(Type, Type)} and
 * {@link #row(List, List)}.
 */
public final class Type {

  public static final Type BOOLEAN = new Type(TypeKind.BOOLEAN);
  public static final Type TINYINT = new Type(TypeKind.TINYINT);
  public static final Type SMALLINT = new Type(TypeKind.SMALLINT);
  public static final Type INTEGER = new Type(TypeKind.INTEGER);
  public static final Type BIGINT = new Type(TypeKind.BIGINT);
  public static final Type HUGEINT = new Type(TypeKind.HUGEINT);
  public static final Type REAL = new Type(TypeKind.REAL);
  public static final Type DOUBLE = new Type(TypeKind.DOUBLE);
  public static final Type VARCHAR = new Type(TypeKind.VARCHAR);
  public static final Type VARBINARY = new Type(TypeKind.VARBINARY);
  public static final Type DATE = new Type(TypeKind.DATE);
  public static final Type TIMESTAMP = new Type(TypeKind.TIMESTAMP);
  public static final Type INTERVAL_DAY_TIME = new Type(TypeKind.INTERVAL_DAY_TIME);
  public static final Type INTERVAL_YEAR_MONTH = new Type(TypeKind.INTERVAL_YEAR_MONTH);
  public static final Type UNKNOWN = new Type(TypeKind.UNKNOWN);
  public static final Type JSON = new Type(TypeKind.JSON);
  public static final Type IPADDRESS = new Type(TypeKind.IPADDRESS);
  public static final Type IPPREFIX = new Type(TypeKind.IPPREFIX);
  public static final Type UUID = new Type(TypeKind.UUID);
  public static final Type HYPERLOGLOG = new Type(TypeKind.HYPERLOGLOG);
  public static final Type BINGTILE = new Type(TypeKind.BINGTILE);

  /** Largest precision stored in a single 64-bit value. */
  public static final int MAX_SHORT_DECIMAL_PRECISION = 18;

  private final TypeKind kind;
  private final List<Type> children;
  private final List<String> fieldNames;
  private final int precision;
  private final int scale;

  private Type(TypeKind kind) {
    this(kind, List.of(), List.of(), 0, 0);
  }

  private Type(TypeKind kind, List<Type> children, List<String> fieldNames, int precision, int scale) {
    this.kind = kind;
    this.children = List.copyOf(children);
    this.fieldNames = List.copyOf(fieldNames);
    this.precision = precision;
    this.scale = scale;
  }

  /**
   * Create an array type.
   *
   * @param elementType
   *          the element type
   * @return ARRAY(elementType)
   */
  public static Type array(Type elementType) {
    return new Type(TypeKind.ARRAY, List.of(Objects.requireNonNull(elementType, "elementType")), List.of(), 0, 0);
  }

  /**
   * Create a map type.
   *
   * @param keyType
   *          the key type
   * @param valueType
   *          the value type
   * @return MAP(keyType, valueType)
   */
  public static Type map(Type keyType, Type valueType) {
    return new Type(TypeKind.MAP,
        List.of(Objects.requireNonNull(keyType, "keyType"), Objects.requireNonNull(valueType, "valueType")), List.of(),
        0, 0);
  }

  /**
   * Create a row type.
   *
   * @param names
   *          the field names
   * @param types
   *          the field types, same size as {@code names}
   * @return ROW(name type, ...)
   */
  public static Type row(List<String> names, List<Type> types) {
    if (names.size() != types.size()) {
      throw new IllegalArgumentException(
          "Row type needs one name per field: " + names.size() + " names, " + types.size() + " types");
    }
    return new Type(TypeKind.ROW, types, names, 0, 0);
  }

  /**
   * Create a decimal type.
   *
   * @param precision
   *          total number of digits, 1 to 38
   * @param scale
   *          digits after the decimal point, 0 to precision
   * @return DECIMAL(precision, scale)
   */
  public static Type decimal(int precision, int scale) {
    if (precision < 1 || precision > 38 || scale < 0 || scale > precision) {
      throw new IllegalArgumentException("Invalid decimal(" + precision + ", " + scale + ")");
    }
    return new Type(TypeKind.DECIMAL, List.of(), List.of(), precision, scale);
  }

  /**
   * Create a tdigest type.
   *
   * @param parameter
   *          the digested value type, DOUBLE in practice
   * @return TDIGEST(parameter)
   */
  public static Type tdigest(Type parameter) {
    return new Type(TypeKind.TDIGEST, List.of(Objects.requireNonNull(parameter, "parameter")), List.of(), 0, 0);
  }

  public TypeKind kind() {
    return kind;
  }

  public List<Type> children() {
    return children;
  }

  public Type childAt(int index) {
    return children.get(index);
  }

  public int size() {
    return children.size();
  }

  /**
   * Field names of a ROW type.
   *
   * @return the names, empty for non-row types
   */
  public List<String> names() {
    return fieldNames;
  }

  public String nameOf(int index) {
    return fieldNames.get(index);
  }

  public int precision() {
    return precision;
  }

  public int scale() {
    return scale;
  }

  public boolean isRow() {
    return kind == TypeKind.ROW;
  }

  /**
   * Whether values of this decimal type fit in a 64-bit unscaled value.
   *
   * @return {@code true} for decimals with precision up to 18
   */
  public boolean isShortDecimal() {
    return kind == TypeKind.DECIMAL && precision <= MAX_SHORT_DECIMAL_PRECISION;
  }

  /**
   * Primitive types are those physically stored as a single scalar. IPPREFIX
   * is physically a row and is therefore not primitive.
   *
   * @return {@code true} if the type is not a container
   */
  public boolean isPrimitive() {
    return !kind.isComplex() && kind != TypeKind.IPPREFIX;
  }

  /**
   * Return a copy of this row type with one extra trailing field.
   *
   * @param name
   *          the new field name
   * @param type
   *          the new field type
   * @return the widened row type
   */
  public Type withField(String name, Type type) {
    if (!isRow()) {
      throw new IllegalStateException("Not a row type: " + this);
    }
    List<String> names = new ArrayList<>(fieldNames);
    List<Type> types = new ArrayList<>(children);
    names.add(name);
    types.add(type);
    return row(names, types);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Type other)) {
      return false;
    }
    return kind == other.kind && precision == other.precision && scale == other.scale
        && children.equals(other.children) && fieldNames.equals(other.fieldNames);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, children, fieldNames, precision, scale);
  }

  /**
   * Render the type the way Presto prints it in SQL, e.g.
   * {@code ROW(a INTEGER, b ARRAY(VARCHAR))}.
   */
  @Override
  public String toString() {
    return switch (kind) {
      case DECIMAL -> "DECIMAL(" + precision + ", " + scale + ")";
      case ARRAY -> "ARRAY(" + children.get(0) + ")";
      case MAP -> "MAP(" + children.get(0) + ", " + children.get(1) + ")";
      case TDIGEST -> "TDIGEST(" + children.get(0) + ")";
      case ROW -> {
        StringBuilder sb = new StringBuilder("ROW(");
        for (int i = 0; i < children.size(); i++) {
          if (i > 0) {
            sb.append(", ");
          }
          sb.append(fieldNames.get(i)).append(' ').append(children.get(i));
        }
        yield sb.append(')').toString();
      }
      default -> kind.displayName().toUpperCase(Locale.ROOT);
    };
  }
}
