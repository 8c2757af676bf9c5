package se.alipsa.refbridge;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import se.alipsa.refbridge.client.ReferenceQueryException;
import se.alipsa.refbridge.data.RowBatch;
import se.alipsa.refbridge.expr.FunctionSignature;
import se.alipsa.refbridge.expr.TypedExpr;
import se.alipsa.refbridge.plan.PlanNode;
import se.alipsa.refbridge.type.Type;

/**
 * A trusted database engine the fuzzer compares its results against.
 */
public interface ReferenceQueryRunner extends AutoCloseable {

  /**
   * Compile a plan to the engine's SQL dialect.
   *
   * @param plan
   *          the plan
   * @return the SQL, empty if the plan cannot be expressed
   */
  Optional<String> toSql(PlanNode plan);

  /**
   * Run a plan after materializing its input tables.
   *
   * @param plan
   *          the plan
   * @return the result batches or the reason there are none
   */
  ReferenceQueryResult<List<RowBatch>> execute(PlanNode plan);

  /**
   * Run a plan and flatten its result into rows for an order-insensitive
   * comparison.
   *
   * @param plan
   *          the plan
   * @return the rows or the reason there are none
   */
  ReferenceQueryResult<List<List<Object>>> executeAndMaterialize(PlanNode plan);

  /**
   * Run SQL directly.
   *
   * @param sql
   *          the statement
   * @return the result batches
   * @throws ReferenceQueryException
   *           if the statement fails
   */
  List<RowBatch> execute(String sql) throws ReferenceQueryException;

  /**
   * Run SQL directly with a session property.
   *
   * @param sql
   *          the statement
   * @param sessionProperty
   *          the session property, blank for none
   * @return the result batches
   * @throws ReferenceQueryException
   *           if the statement fails
   */
  List<RowBatch> execute(String sql, String sessionProperty) throws ReferenceQueryException;

  boolean isSupported(FunctionSignature signature);

  boolean isConstantExprSupported(TypedExpr expr);

  /**
   * Scalar types the fuzzer may generate input columns of.
   *
   * @return the types
   */
  List<Type> supportedScalarTypes();

  /**
   * Input constraints for aggregate functions whose results diverge on
   * extreme values.
   *
   * @return the constraints keyed by function name
   */
  Map<String, DataSpec> aggregationFunctionDataSpecs();

  /**
   * Whether {@link #execute(PlanNode)} returns row batches.
   *
   * @return {@code true} if batch results are available
   */
  boolean supportsRowBatchResults();

  @Override
  void close();
}
