package se.alipsa.refbridge.type;

/**
 * The kinds of types exchanged with the reference engine. The display name is
 * the lower-case Presto type name.
 */
public enum TypeKind {
  BOOLEAN("boolean"),
  TINYINT("tinyint"),
  SMALLINT("smallint"),
  INTEGER("integer"),
  BIGINT("bigint"),
  HUGEINT("hugeint"),
  REAL("real"),
  DOUBLE("double"),
  DECIMAL("decimal"),
  VARCHAR("varchar"),
  VARBINARY("varbinary"),
  DATE("date"),
  TIMESTAMP("timestamp"),
  INTERVAL_DAY_TIME("interval day to second"),
  INTERVAL_YEAR_MONTH("interval year to month"),
  UNKNOWN("unknown"),
  JSON("json"),
  IPADDRESS("ipaddress"),
  IPPREFIX("ipprefix"),
  UUID("uuid"),
  HYPERLOGLOG("hyperloglog"),
  TDIGEST("tdigest"),
  BINGTILE("bingtile"),
  ARRAY("array"),
  MAP("map"),
  ROW("row");

  private final String displayName;

  TypeKind(String displayName) {
    this.displayName = displayName;
  }

  /**
   * Get the Presto name of this kind.
   *
   * @return the lower-case type name, e.g. {@code "interval day to second"}
   */
  public String displayName() {
    return displayName;
  }

  /**
   * Whether the kind is a container of other types.
   *
   * @return {@code true} for ARRAY, MAP and ROW
   */
  public boolean isComplex() {
    return this == ARRAY || this == MAP || this == ROW;
  }

  /**
   * Whether the kind is a custom type layered on top of a physical type
   * (JSON on VARCHAR, UUID on HUGEINT and so on).
   *
   * @return {@code true} for custom types
   */
  public boolean isCustom() {
    return switch (this) {
      case JSON, IPADDRESS, IPPREFIX, UUID, HYPERLOGLOG, TDIGEST, BINGTILE -> true;
      default -> false;
    };
  }
}
