package se.alipsa.refbridge;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.apache.hadoop.conf.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.refbridge.client.PrestoStatementClient;
import se.alipsa.refbridge.client.ReferenceConnectionException;
import se.alipsa.refbridge.client.ReferenceEngineConfig;
import se.alipsa.refbridge.client.ReferenceQueryException;
import se.alipsa.refbridge.client.StatementExecutor;
import se.alipsa.refbridge.data.RowBatch;
import se.alipsa.refbridge.data.RowBatches;
import se.alipsa.refbridge.expr.FunctionSignature;
import se.alipsa.refbridge.expr.TypedExpr;
import se.alipsa.refbridge.plan.PlanNode;
import se.alipsa.refbridge.plan.TableScanNode;
import se.alipsa.refbridge.plan.ValuesNode;
import se.alipsa.refbridge.sql.PrestoSqlCompiler;
import se.alipsa.refbridge.sql.SqlSupport;
import se.alipsa.refbridge.storage.TableMaterializer;
import se.alipsa.refbridge.type.Type;

/**
 * Runs fuzzer plans on a Presto server. A plan is compiled to SQL, its input
 * tables are materialized as Parquet files in the engine's warehouse, and the
 * query is executed through the HTTP statement protocol.
 */
public class PrestoQueryRunner implements ReferenceQueryRunner {

  private static final Logger LOG = LoggerFactory.getLogger(PrestoQueryRunner.class);

  private static final List<Type> SUPPORTED_SCALAR_TYPES = List.of(Type.BOOLEAN, Type.TINYINT, Type.SMALLINT,
      Type.INTEGER, Type.BIGINT, Type.REAL, Type.DOUBLE, Type.VARCHAR, Type.VARBINARY, Type.TIMESTAMP);

  // Presto handles NaN and Infinity differently for these functions
  private static final Map<String, DataSpec> AGGREGATION_FUNCTION_DATA_SPECS = Map.ofEntries(
      Map.entry("regr_avgx", new DataSpec(false, false)), Map.entry("regr_avgy", new DataSpec(false, false)),
      Map.entry("regr_r2", new DataSpec(false, false)), Map.entry("regr_sxx", new DataSpec(false, false)),
      Map.entry("regr_syy", new DataSpec(false, false)), Map.entry("regr_sxy", new DataSpec(false, false)),
      Map.entry("regr_slope", new DataSpec(false, false)), Map.entry("regr_replacement", new DataSpec(false, false)),
      Map.entry("covar_pop", new DataSpec(true, false)), Map.entry("covar_samp", new DataSpec(true, false)));

  private final StatementExecutor executor;
  private final TableMaterializer materializer;
  private final PrestoSqlCompiler compiler = new PrestoSqlCompiler();
  private volatile boolean closed;

  /**
   * Create a runner talking to the configured coordinator.
   *
   * @param config
   *          the engine settings
   */
  public PrestoQueryRunner(ReferenceEngineConfig config) {
    this(new PrestoStatementClient(config), new Configuration());
  }

  /**
   * Create a runner on a statement executor.
   *
   * @param executor
   *          runs the SQL statements
   * @param conf
   *          Hadoop configuration used to write table files
   */
  public PrestoQueryRunner(StatementExecutor executor, Configuration conf) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.materializer = new TableMaterializer(executor, conf);
  }

  @Override
  public Optional<String> toSql(PlanNode plan) {
    return compiler.toSql(plan);
  }

  /**
   * {@inheritDoc}
   *
   * <p>
   * Plan shapes the compiler rejects outright (unknown node kinds, partial
   * aggregations) throw. A {@link ReferenceConnectionException} is rethrown
   * since it makes every further comparison pointless; all other failures are
   * reported as {@link ReferenceQueryErrorCode#REFERENCE_QUERY_FAIL}.
   * </p>
   */
  @Override
  public ReferenceQueryResult<List<RowBatch>> execute(PlanNode plan) {
    checkOpen();
    Optional<String> sql = toSql(plan);
    if (sql.isEmpty()) {
      LOG.info("Query not supported in Presto");
      return ReferenceQueryResult.unsupported();
    }
    try {
      for (Map.Entry<String, InputTable> table : inputTables(plan).entrySet()) {
        materializer.materialize(table.getKey(), table.getValue().type(), table.getValue().rows());
      }
      return ReferenceQueryResult.success(executor.execute(sql.get()));
    } catch (ReferenceConnectionException e) {
      throw e;
    } catch (ReferenceQueryException | IOException | RuntimeException e) {
      LOG.warn("Query failed in Presto: {}", e.getMessage(), e);
      return ReferenceQueryResult.failed();
    }
  }

  @Override
  public ReferenceQueryResult<List<List<Object>>> executeAndMaterialize(PlanNode plan) {
    ReferenceQueryResult<List<RowBatch>> result = execute(plan);
    if (result.rows().isPresent()) {
      return ReferenceQueryResult.success(RowBatches.toRows(result.rows().get()));
    }
    return new ReferenceQueryResult<>(Optional.empty(), result.errorCode());
  }

  @Override
  public List<RowBatch> execute(String sql) throws ReferenceQueryException {
    checkOpen();
    return executor.execute(sql);
  }

  @Override
  public List<RowBatch> execute(String sql, String sessionProperty) throws ReferenceQueryException {
    checkOpen();
    return executor.execute(sql, sessionProperty);
  }

  @Override
  public boolean isSupported(FunctionSignature signature) {
    return SqlSupport.isSupportedFunctionSignature(signature);
  }

  @Override
  public boolean isConstantExprSupported(TypedExpr expr) {
    return SqlSupport.isConstantExpressionSupported(expr);
  }

  @Override
  public List<Type> supportedScalarTypes() {
    return SUPPORTED_SCALAR_TYPES;
  }

  @Override
  public Map<String, DataSpec> aggregationFunctionDataSpecs() {
    return AGGREGATION_FUNCTION_DATA_SPECS;
  }

  @Override
  public boolean supportsRowBatchResults() {
    return true;
  }

  @Override
  public void close() {
    closed = true;
  }

  public boolean isClosed() {
    return closed;
  }

  private void checkOpen() {
    if (closed) {
      throw new IllegalStateException("Query runner is closed");
    }
  }

  /**
   * Collect the leaf tables of a plan, keyed by table name. The first leaf
   * wins when several read the same table.
   */
  static Map<String, InputTable> inputTables(PlanNode plan) {
    Map<String, InputTable> tables = new LinkedHashMap<>();
    collectInputTables(plan, tables);
    return tables;
  }

  private static void collectInputTables(PlanNode node, Map<String, InputTable> tables) {
    if (node instanceof ValuesNode values) {
      tables.putIfAbsent(values.tableName(), new InputTable(values.outputType(), values.values()));
    } else if (node instanceof TableScanNode scan) {
      tables.putIfAbsent(scan.tableName(), new InputTable(scan.outputType(), scan.data()));
    }
    for (PlanNode source : node.sources()) {
      collectInputTables(source, tables);
    }
  }

  record InputTable(Type type, List<RowBatch> rows) {
  }
}
