package se.alipsa.refbridge;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a reference query: rows when it succeeded, otherwise the reason it
 * did not produce any.
 *
 * @param rows
 *          the rows, present only on success
 * @param errorCode
 *          the outcome
 * @param <T>
 *          the row representation
 */
public record ReferenceQueryResult<T>(Optional<T> rows, ReferenceQueryErrorCode errorCode) {

  public ReferenceQueryResult {
    Objects.requireNonNull(rows, "rows");
    Objects.requireNonNull(errorCode, "errorCode");
    if (rows.isPresent() != (errorCode == ReferenceQueryErrorCode.SUCCESS)) {
      throw new IllegalArgumentException("Rows must be present exactly when the query succeeded: " + errorCode);
    }
  }

  public static <T> ReferenceQueryResult<T> success(T rows) {
    return new ReferenceQueryResult<>(Optional.of(rows), ReferenceQueryErrorCode.SUCCESS);
  }

  public static <T> ReferenceQueryResult<T> unsupported() {
    return new ReferenceQueryResult<>(Optional.empty(), ReferenceQueryErrorCode.REFERENCE_QUERY_UNSUPPORTED);
  }

  public static <T> ReferenceQueryResult<T> failed() {
    return new ReferenceQueryResult<>(Optional.empty(), ReferenceQueryErrorCode.REFERENCE_QUERY_FAIL);
  }

  public boolean isSuccess() {
    return errorCode == ReferenceQueryErrorCode.SUCCESS;
  }
}
