package se.alipsa.refbridge.storage;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.avro.Conversions;
import org.apache.avro.Schema;
import org.apache.avro.data.TimeConversions;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.avro.AvroWriteSupport;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.hadoop.util.HadoopOutputFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.refbridge.data.AvroTypes;
import se.alipsa.refbridge.data.RowBatch;

/**
 * Writes row batches to a single Parquet file through parquet-avro.
 */
public class ParquetTableWriter {

  private static final Logger LOG = LoggerFactory.getLogger(ParquetTableWriter.class);

  private final Configuration conf;

  /**
   * Create a writer. The configuration is copied; the copy always writes the
   * three level list layout, the only one that holds null array elements.
   *
   * @param conf
   *          Hadoop configuration for the file system and Parquet settings
   */
  public ParquetTableWriter(Configuration conf) {
    this.conf = new Configuration(Objects.requireNonNull(conf, "conf"));
    this.conf.setBoolean(AvroWriteSupport.WRITE_OLD_LIST_STRUCTURE, false);
  }

  Configuration configuration() {
    return conf;
  }

  /**
   * Write all batches to {@code path}, replacing any existing file.
   *
   * @param path
   *          the file to write
   * @param schema
   *          the Avro schema shared by the batches
   * @param batches
   *          the rows
   * @throws IOException
   *           if the file cannot be written
   */
  public void write(Path path, Schema schema, List<RowBatch> batches) throws IOException {
    long count = 0;
    try (ParquetWriter<GenericRecord> writer = AvroParquetWriter
        .<GenericRecord>builder(HadoopOutputFile.fromPath(path, conf)).withConf(conf).withSchema(schema)
        .withDataModel(dataModel()).withCompressionCodec(CompressionCodecName.UNCOMPRESSED)
        .withWriteMode(ParquetFileWriter.Mode.OVERWRITE).build()) {
      for (RowBatch batch : batches) {
        for (GenericRecord record : batch.rows()) {
          writer.write(toWritable(record, schema));
          count++;
        }
      }
    }
    LOG.debug("Wrote {} rows to {}", count, path);
  }

  static GenericData dataModel() {
    GenericData model = new GenericData();
    model.addLogicalTypeConversion(new Conversions.DecimalConversion());
    model.addLogicalTypeConversion(new TimeConversions.DateConversion());
    model.addLogicalTypeConversion(new TimeConversions.TimestampMillisConversion());
    return model;
  }

  /**
   * Copy a record into the shape Avro resolves against its INT branch:
   * TINYINT and SMALLINT values are held as {@code Byte} and {@code Short}.
   */
  private static GenericRecord toWritable(GenericRecord record, Schema schema) {
    GenericData.Record copy = new GenericData.Record(schema);
    List<Schema.Field> fields = schema.getFields();
    for (int i = 0; i < fields.size(); i++) {
      copy.put(i, toWritable(record.get(i), fields.get(i).schema()));
    }
    return copy;
  }

  private static Object toWritable(Object value, Schema schema) {
    if (value == null) {
      return null;
    }
    Schema valueSchema = AvroTypes.nonNull(schema);
    if (value instanceof Byte || value instanceof Short) {
      return ((Number) value).intValue();
    }
    if (value instanceof GenericRecord record) {
      return toWritable(record, valueSchema);
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object element : list) {
        copy.add(toWritable(element, valueSchema.getElementType()));
      }
      return copy;
    }
    if (value instanceof Map<?, ?> map) {
      Map<String, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        copy.put(String.valueOf(entry.getKey()), toWritable(entry.getValue(), valueSchema.getValueType()));
      }
      return copy;
    }
    return value;
  }
}
