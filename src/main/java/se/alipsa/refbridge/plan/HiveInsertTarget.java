package se.alipsa.refbridge.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import se.alipsa.refbridge.type.Type;

/**
 * A Hive table insert: columns flagged as partition keys plus an optional
 * bucket property.
 */
public final class HiveInsertTarget implements PartitionedWriteTarget {

  /**
   * A written column.
   *
   * @param name
   *          the column name
   * @param type
   *          the column type
   * @param partitionKey
   *          whether the column is a partition key
   */
  public record Column(String name, Type type, boolean partitionKey) {
  }

  /**
   * Hive bucketing.
   *
   * @param bucketCount
   *          number of buckets
   * @param bucketedBy
   *          bucketing columns
   * @param sortedBy
   *          sort columns within each bucket
   */
  public record BucketProperty(int bucketCount, List<String> bucketedBy, List<SortColumn> sortedBy) {

    public BucketProperty {
      if (bucketCount <= 0) {
        throw new IllegalArgumentException("Bucket count must be positive: " + bucketCount);
      }
      bucketedBy = List.copyOf(bucketedBy);
      sortedBy = List.copyOf(sortedBy);
    }
  }

  private final List<Column> inputColumns;
  private final BucketProperty bucketProperty;
  private final String storageFormat;

  /**
   * Create an insert target.
   *
   * @param inputColumns
   *          the written columns
   * @param bucketProperty
   *          the bucketing or {@code null}
   * @param storageFormat
   *          the file format
   */
  public HiveInsertTarget(List<Column> inputColumns, BucketProperty bucketProperty, String storageFormat) {
    this.inputColumns = List.copyOf(inputColumns);
    this.bucketProperty = bucketProperty;
    this.storageFormat = Objects.requireNonNull(storageFormat, "storageFormat");
  }

  public List<Column> inputColumns() {
    return inputColumns;
  }

  public boolean isPartitioned() {
    return inputColumns.stream().anyMatch(Column::partitionKey);
  }

  @Override
  public List<String> partitionedBy() {
    List<String> keys = new ArrayList<>();
    for (Column column : inputColumns) {
      if (column.partitionKey()) {
        keys.add(column.name());
      }
    }
    return keys;
  }

  @Override
  public OptionalInt bucketCount() {
    return bucketProperty == null ? OptionalInt.empty() : OptionalInt.of(bucketProperty.bucketCount());
  }

  @Override
  public List<String> bucketedBy() {
    return bucketProperty == null ? List.of() : bucketProperty.bucketedBy();
  }

  @Override
  public List<SortColumn> sortedBy() {
    return bucketProperty == null ? List.of() : bucketProperty.sortedBy();
  }

  @Override
  public String storageFormat() {
    return storageFormat;
  }
}
