package se.alipsa.refbridge.client;

import java.util.List;
import se.alipsa.refbridge.data.RowBatch;

/** Runs SQL statements on the reference engine. */
public interface StatementExecutor {

  /**
   * Run a statement to completion.
   *
   * @param sql
   *          the statement
   * @param sessionProperty
   *          a session property such as {@code join_distribution_type=BROADCAST},
   *          blank for none
   * @return all result batches in arrival order, empty for statements without
   *         results
   * @throws ReferenceQueryException
   *           if the engine rejects or fails the statement
   */
  List<RowBatch> execute(String sql, String sessionProperty) throws ReferenceQueryException;

  /**
   * Run a statement without a session property.
   *
   * @param sql
   *          the statement
   * @return all result batches in arrival order
   * @throws ReferenceQueryException
   *           if the engine rejects or fails the statement
   */
  default List<RowBatch> execute(String sql) throws ReferenceQueryException {
    return execute(sql, "");
  }
}
