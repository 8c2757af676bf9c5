package se.alipsa.refbridge.plan;

/** Join semantics of the join nodes. */
public enum JoinType {
  INNER,
  LEFT,
  RIGHT,
  FULL,
  /** Left rows with at least one match. */
  LEFT_SEMI_FILTER,
  /** All left rows plus a boolean match column. */
  LEFT_SEMI_PROJECT,
  RIGHT_SEMI_FILTER,
  RIGHT_SEMI_PROJECT,
  /** Left rows without a match. */
  ANTI
}
