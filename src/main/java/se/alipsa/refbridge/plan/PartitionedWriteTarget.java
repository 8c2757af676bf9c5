package se.alipsa.refbridge.plan;

import java.util.List;
import java.util.OptionalInt;

/**
 * Layout of the table a {@link TableWriteNode} writes to. Connectors expose
 * their partitioning, bucketing and sorting through this interface so the SQL
 * compiler does not depend on connector classes.
 */
public interface PartitionedWriteTarget {

  /**
   * A column the written files are sorted by within each bucket.
   *
   * @param column
   *          the column name
   * @param ascending
   *          sort direction
   */
  record SortColumn(String column, boolean ascending) {

    @Override
    public String toString() {
      return column + (ascending ? " ASC" : " DESC");
    }
  }

  /**
   * Partition columns in declaration order.
   *
   * @return the partition column names, empty for unpartitioned tables
   */
  List<String> partitionedBy();

  /**
   * Number of buckets.
   *
   * @return the bucket count, empty for unbucketed tables
   */
  OptionalInt bucketCount();

  /**
   * Bucketing columns.
   *
   * @return the bucket column names, empty for unbucketed tables
   */
  List<String> bucketedBy();

  /**
   * Sorting within buckets.
   *
   * @return the sort columns, possibly empty
   */
  List<SortColumn> sortedBy();

  /**
   * The file format of the written table, e.g. {@code PARQUET} or {@code ORC}.
   *
   * @return the storage format name
   */
  String storageFormat();
}
