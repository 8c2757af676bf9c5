package se.alipsa.refbridge.data;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import se.alipsa.refbridge.type.Type;

/**
 * Maps {@link Type} row types onto Avro schemas so rows can be held as
 * {@link GenericRecord}s and written with parquet-avro. Every field is a
 * nullable union. Map keys keep their Java type; only VARCHAR keys survive a
 * round trip through Parquet.
 */
public final class AvroTypes {

  private AvroTypes() {
  }

  /**
   * Derive the Avro record schema for a row type.
   *
   * @param rowType
   *          a ROW type
   * @return the record schema
   */
  public static Schema toSchema(Type rowType) {
    if (!rowType.isRow()) {
      throw new IllegalArgumentException("Expected a row type but got " + rowType);
    }
    return recordSchema(rowType, new int[1]);
  }

  private static Schema recordSchema(Type rowType, int[] recordCounter) {
    String recordName = recordCounter[0] == 0 ? "row" : "row_" + recordCounter[0];
    recordCounter[0]++;
    List<Schema.Field> fields = new ArrayList<>();
    Set<String> used = new HashSet<>();
    for (int i = 0; i < rowType.size(); i++) {
      String name = uniqueName(sanitizeName(rowType.nameOf(i), i), used);
      fields.add(new Schema.Field(name, nullable(valueSchema(rowType.childAt(i), recordCounter)), null,
          Schema.Field.NULL_DEFAULT_VALUE));
    }
    return Schema.createRecord(recordName, null, "se.alipsa.refbridge", false, fields);
  }

  private static Schema valueSchema(Type type, int[] recordCounter) {
    return switch (type.kind()) {
      case BOOLEAN -> Schema.create(Schema.Type.BOOLEAN);
      case TINYINT, SMALLINT, INTEGER, INTERVAL_YEAR_MONTH -> Schema.create(Schema.Type.INT);
      case BIGINT, INTERVAL_DAY_TIME, BINGTILE -> Schema.create(Schema.Type.LONG);
      case REAL -> Schema.create(Schema.Type.FLOAT);
      case DOUBLE -> Schema.create(Schema.Type.DOUBLE);
      case VARCHAR, JSON, IPPREFIX, IPADDRESS -> Schema.create(Schema.Type.STRING);
      case VARBINARY, HYPERLOGLOG, TDIGEST, HUGEINT -> Schema.create(Schema.Type.BYTES);
      case DATE -> LogicalTypes.date().addToSchema(Schema.create(Schema.Type.INT));
      case TIMESTAMP -> LogicalTypes.timestampMillis().addToSchema(Schema.create(Schema.Type.LONG));
      case DECIMAL -> LogicalTypes.decimal(type.precision(), type.scale())
          .addToSchema(Schema.create(Schema.Type.BYTES));
      case UUID -> LogicalTypes.uuid().addToSchema(Schema.create(Schema.Type.STRING));
      case UNKNOWN -> Schema.create(Schema.Type.NULL);
      case ARRAY -> Schema.createArray(nullable(valueSchema(type.childAt(0), recordCounter)));
      case MAP -> Schema.createMap(nullable(valueSchema(type.childAt(1), recordCounter)));
      case ROW -> recordSchema(type, recordCounter);
    };
  }

  /**
   * Wrap a schema in a union with null.
   *
   * @param schema
   *          the value schema
   * @return {@code [null, schema]}, or {@code schema} itself when it already
   *         accepts null
   */
  public static Schema nullable(Schema schema) {
    if (schema.getType() == Schema.Type.NULL || schema.isNullable()) {
      return schema;
    }
    return Schema.createUnion(Schema.create(Schema.Type.NULL), schema);
  }

  /**
   * Return the non-null branch of a nullable union.
   *
   * @param schema
   *          a schema, possibly a union with null
   * @return the value schema
   */
  public static Schema nonNull(Schema schema) {
    if (schema.getType() != Schema.Type.UNION) {
      return schema;
    }
    for (Schema branch : schema.getTypes()) {
      if (branch.getType() != Schema.Type.NULL) {
        return branch;
      }
    }
    return schema.getTypes().get(0);
  }

  /**
   * Convert a Java value into the shape stored in a record of the given type.
   * Nested rows may be supplied as {@link List}s or {@link GenericRecord}s.
   *
   * @param type
   *          the value type
   * @param schema
   *          the Avro schema of the value, nullable or not
   * @param value
   *          the value
   * @return the stored value
   */
  public static Object toAvroValue(Type type, Schema schema, Object value) {
    if (value == null) {
      return null;
    }
    Schema valueSchema = nonNull(schema);
    switch (type.kind()) {
      case ROW -> {
        if (value instanceof GenericRecord record) {
          return record;
        }
        if (value instanceof List<?> fields) {
          return toRecord(type, valueSchema, fields);
        }
        throw new IllegalArgumentException("Expected row value for " + type + " but got " + value.getClass());
      }
      case ARRAY -> {
        List<Object> elements = new ArrayList<>();
        for (Object element : (Iterable<?>) value) {
          elements.add(toAvroValue(type.childAt(0), valueSchema.getElementType(), element));
        }
        return elements;
      }
      case MAP -> {
        Map<Object, Object> entries = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
          entries.put(entry.getKey(), toAvroValue(type.childAt(1), valueSchema.getValueType(), entry.getValue()));
        }
        return entries;
      }
      default -> {
        return value;
      }
    }
  }

  /**
   * Build a record from positional field values.
   *
   * @param rowType
   *          the row type
   * @param schema
   *          the record schema derived from {@code rowType}
   * @param values
   *          one value per field
   * @return the record
   */
  public static GenericRecord toRecord(Type rowType, Schema schema, List<?> values) {
    if (values.size() != rowType.size()) {
      throw new IllegalArgumentException(
          "Row has " + values.size() + " values but type " + rowType + " has " + rowType.size() + " fields");
    }
    GenericData.Record record = new GenericData.Record(schema);
    List<Schema.Field> fields = schema.getFields();
    for (int i = 0; i < values.size(); i++) {
      record.put(i, toAvroValue(rowType.childAt(i), fields.get(i).schema(), values.get(i)));
    }
    return record;
  }

  static String sanitizeName(String name, int index) {
    if (name == null || name.isEmpty()) {
      return "field" + index;
    }
    StringBuilder sb = new StringBuilder(name.length() + 1);
    if (!Character.isLetter(name.charAt(0)) && name.charAt(0) != '_') {
      sb.append('_');
    }
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      sb.append(c < 128 && (Character.isLetterOrDigit(c) || c == '_') ? c : '_');
    }
    return sb.toString();
  }

  private static String uniqueName(String name, Set<String> used) {
    String candidate = name;
    int suffix = 1;
    while (!used.add(candidate)) {
      candidate = name + "_" + suffix++;
    }
    return candidate;
  }
}
