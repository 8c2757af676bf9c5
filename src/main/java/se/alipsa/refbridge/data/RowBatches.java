package se.alipsa.refbridge.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.avro.generic.GenericRecord;
import se.alipsa.refbridge.type.Type;

/** Helpers for lists of {@link RowBatch}es. */
public final class RowBatches {

  private RowBatches() {
  }

  /**
   * Count the rows of all batches.
   *
   * @param batches
   *          the batches
   * @return the total row count
   */
  public static int totalRows(List<RowBatch> batches) {
    int total = 0;
    for (RowBatch batch : batches) {
      total += batch.size();
    }
    return total;
  }

  /**
   * Replace input without columns by a single all-null BOOLEAN column with the
   * same number of rows, since a table needs at least one column.
   *
   * @param input
   *          the original batches
   * @param columnName
   *          the name of the synthetic column
   * @return a single batch of null rows
   */
  public static RowBatch makeNullRows(List<RowBatch> input, String columnName) {
    Type type = Type.row(List.of(columnName), List.of(Type.BOOLEAN));
    int rowCount = totalRows(input);
    List<List<Object>> rows = new ArrayList<>(rowCount);
    for (int i = 0; i < rowCount; i++) {
      rows.add(Collections.singletonList(null));
    }
    return RowBatch.of(type, rows);
  }

  /**
   * Flatten batches into plain rows for multiset comparison. Nested records
   * become lists of their field values.
   *
   * @param batches
   *          the batches
   * @return one list of values per row
   */
  public static List<List<Object>> toRows(List<RowBatch> batches) {
    List<List<Object>> rows = new ArrayList<>(totalRows(batches));
    for (RowBatch batch : batches) {
      for (GenericRecord record : batch.rows()) {
        rows.add(recordValues(record));
      }
    }
    return rows;
  }

  private static List<Object> recordValues(GenericRecord record) {
    int fieldCount = record.getSchema().getFields().size();
    List<Object> values = new ArrayList<>(fieldCount);
    for (int i = 0; i < fieldCount; i++) {
      values.add(plain(record.get(i)));
    }
    return values;
  }

  private static Object plain(Object value) {
    if (value instanceof GenericRecord record) {
      return recordValues(record);
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object element : list) {
        copy.add(plain(element));
      }
      return copy;
    }
    if (value instanceof Map<?, ?> map) {
      Map<Object, Object> copy = new LinkedHashMap<>();
      map.forEach((k, v) -> copy.put(plain(k), plain(v)));
      return copy;
    }
    return value;
  }
}
