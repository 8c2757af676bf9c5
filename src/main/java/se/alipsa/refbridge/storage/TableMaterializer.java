package se.alipsa.refbridge.storage;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.refbridge.client.ReferenceQueryException;
import se.alipsa.refbridge.client.StatementExecutor;
import se.alipsa.refbridge.data.AvroTypes;
import se.alipsa.refbridge.data.RowBatch;
import se.alipsa.refbridge.data.RowBatches;
import se.alipsa.refbridge.helper.RefBridgeUtil;
import se.alipsa.refbridge.sql.PrestoSql;
import se.alipsa.refbridge.type.Type;

/**
 * Makes in-memory rows available as a table of the reference engine. The
 * engine is asked to create an empty Parquet table of the right shape and to
 * reveal where it keeps the table's files; the rows are then written as a
 * Parquet file into that directory.
 */
public class TableMaterializer {

  private static final Logger LOG = LoggerFactory.getLogger(TableMaterializer.class);

  /** Storage format of materialized tables. */
  public static final String FORMAT = "PARQUET";

  static final int LOCK_STRIPES = 64;

  private final StatementExecutor executor;
  private final ParquetTableWriter writer;
  // a table name always maps to the same stripe; unrelated names may share one
  private final Object[] tableLocks = new Object[LOCK_STRIPES];

  /**
   * Create a materializer.
   *
   * @param executor
   *          runs the table set up statements
   * @param conf
   *          Hadoop configuration used to write the data files
   */
  public TableMaterializer(StatementExecutor executor, Configuration conf) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.writer = new ParquetTableWriter(conf);
    for (int i = 0; i < LOCK_STRIPES; i++) {
      tableLocks[i] = new Object();
    }
  }

  /**
   * Create or replace a table holding exactly {@code rows}.
   *
   * @param tableName
   *          the table name
   * @param rowType
   *          the table's row type
   * @param rows
   *          the content, possibly empty
   * @return the written data file
   * @throws ReferenceQueryException
   *           if one of the set up statements fails
   * @throws IOException
   *           if the data file cannot be written
   */
  public Path materialize(String tableName, Type rowType, List<RowBatch> rows)
      throws ReferenceQueryException, IOException {
    Objects.requireNonNull(tableName, "tableName");
    Objects.requireNonNull(rowType, "rowType");
    Objects.requireNonNull(rows, "rows");
    Type tableType = rowType;
    List<RowBatch> content = rows;
    if (rowType.size() == 0) {
      // tables need at least one column
      RowBatch nullRows = RowBatches.makeNullRows(rows, tableName + "x");
      tableType = nullRows.type();
      content = List.of(nullRows);
    }
    synchronized (lockFor(tableName)) {
      Path directory = createTable(tableName, tableType);
      Path file = new Path(directory, tableName + "." + FORMAT.toLowerCase(Locale.ROOT));
      writer.write(file, AvroTypes.toSchema(tableType), content);
      LOG.debug("Materialized {} rows of table {} in {}", RowBatches.totalRows(content), tableName, file);
      return file;
    }
  }

  Object lockFor(String tableName) {
    return tableLocks[Math.floorMod(tableName.hashCode(), LOCK_STRIPES)];
  }

  int lockCount() {
    return tableLocks.length;
  }

  /**
   * Create an empty table of the given type and return its data directory.
   */
  private Path createTable(String name, Type type) throws ReferenceQueryException {
    List<String> columns = new ArrayList<>(type.size());
    List<String> nullValues = new ArrayList<>(type.size());
    for (int i = 0; i < type.size(); i++) {
      columns.add(type.nameOf(i));
      nullValues.add("cast(null as " + PrestoSql.toTypeSql(type.childAt(i)) + ")");
    }

    executor.execute("DROP TABLE IF EXISTS " + name);
    executor.execute("CREATE TABLE " + name + "(" + String.join(", ", columns) + ") WITH (format = '" + FORMAT
        + "') AS SELECT " + String.join(", ", nullValues));

    // the single null row tells us where the engine stores the table
    List<List<Object>> location = RowBatches.toRows(executor.execute("SELECT \"$path\" FROM " + name));
    if (location.size() != 1 || location.get(0).size() != 1 || !(location.get(0).get(0) instanceof String)) {
      throw new ReferenceQueryException("Expected a single file location for table " + name + " but got " + location);
    }
    String filePath = RefBridgeUtil.stripFileScheme((String) location.get(0).get(0));
    Path directory = new Path(filePath).getParent();

    executor.execute("DELETE FROM " + name);
    return directory;
  }
}
