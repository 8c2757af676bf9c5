package se.alipsa.refbridge;

/** Outcome of running a plan on the reference engine. */
public enum ReferenceQueryErrorCode {
  SUCCESS,
  /** The plan cannot be expressed for the reference engine; it was not run. */
  REFERENCE_QUERY_UNSUPPORTED,
  /** The reference engine failed the query. */
  REFERENCE_QUERY_FAIL
}
