package se.alipsa.refbridge.data;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;
import se.alipsa.refbridge.type.Type;

/**
 * A batch of rows sharing one row type. Rows are Avro records built from the
 * schema {@link AvroTypes#toSchema(Type)} derives; columns are addressed by
 * position because the Avro field names may be sanitized versions of the
 * column names.
 */
public final class RowBatch {

  private final Type type;
  private final Schema schema;
  private final List<GenericRecord> rows;

  /**
   * Create a batch from records.
   *
   * @param type
   *          the row type
   * @param schema
   *          the Avro schema of the records
   * @param rows
   *          the records
   */
  public RowBatch(Type type, Schema schema, List<GenericRecord> rows) {
    this.type = Objects.requireNonNull(type, "type");
    this.schema = Objects.requireNonNull(schema, "schema");
    this.rows = List.copyOf(rows);
    if (!type.isRow()) {
      throw new IllegalArgumentException("Row batch needs a row type: " + type);
    }
  }

  /**
   * Create a batch from positional values.
   *
   * @param type
   *          the row type
   * @param rows
   *          one list of field values per row; nested rows may be lists too
   * @return the batch
   */
  public static RowBatch of(Type type, List<? extends List<?>> rows) {
    Schema schema = AvroTypes.toSchema(type);
    List<GenericRecord> records = new ArrayList<>(rows.size());
    for (List<?> row : rows) {
      records.add(AvroTypes.toRecord(type, schema, row));
    }
    return new RowBatch(type, schema, records);
  }

  public Type type() {
    return type;
  }

  public Schema schema() {
    return schema;
  }

  public List<GenericRecord> rows() {
    return rows;
  }

  public int size() {
    return rows.size();
  }

  /**
   * Get a single value.
   *
   * @param row
   *          the row index
   * @param column
   *          the column index
   * @return the value, {@code null} for SQL NULL
   */
  public Object get(int row, int column) {
    return rows.get(row).get(column);
  }

  @Override
  public String toString() {
    return "RowBatch[" + type + ", " + rows.size() + " rows]";
  }
}
