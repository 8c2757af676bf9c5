package se.alipsa.refbridge.plan;

/**
 * Sort direction and null placement of a sorting key.
 *
 * @param ascending
 *          {@code true} for ASC
 * @param nullsFirst
 *          {@code true} for NULLS FIRST
 */
public record SortOrder(boolean ascending, boolean nullsFirst) {

  public static final SortOrder ASC_NULLS_FIRST = new SortOrder(true, true);
  public static final SortOrder ASC_NULLS_LAST = new SortOrder(true, false);
  public static final SortOrder DESC_NULLS_FIRST = new SortOrder(false, true);
  public static final SortOrder DESC_NULLS_LAST = new SortOrder(false, false);

  @Override
  public String toString() {
    return (ascending ? "ASC" : "DESC") + " NULLS " + (nullsFirst ? "FIRST" : "LAST");
  }
}
