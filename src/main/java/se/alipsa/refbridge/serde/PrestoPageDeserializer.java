package se.alipsa.refbridge.serde;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.refbridge.data.RowBatch;
import se.alipsa.refbridge.type.Type;
import se.alipsa.refbridge.type.TypeKind;

/**
 * Decodes pages in the Presto binary wire format (the {@code binaryData}
 * entries of a statement response) into {@link RowBatch}es.
 *
 * <p>
 * A page is a little-endian header ({@code int positionCount, byte markers,
 * int uncompressedSize, int sizeInBytes, long checksum}) followed by
 * {@code int channelCount} and one block per channel. Every block starts with
 * its length-prefixed encoding name. The checksum is not verified; compressed
 * and encrypted pages are rejected.
 * </p>
 */
public class PrestoPageDeserializer {

  private static final Logger LOG = LoggerFactory.getLogger(PrestoPageDeserializer.class);

  static final int HEADER_SIZE = 4 + 1 + 4 + 4 + 8;
  static final byte COMPRESSED = 1;
  static final byte ENCRYPTED = 2;
  static final byte CHECKSUMMED = 4;

  private static final int DICTIONARY_ID_SIZE = 24;
  private static final long SIGN_BIT = 0x8000000000000000L;

  /**
   * Decode one base64 encoded page.
   *
   * @param base64
   *          the encoded page
   * @param rowType
   *          the row type built from the response column metadata
   * @return the decoded rows
   * @throws PageFormatException
   *           if the text is not base64 or the page is malformed
   */
  public RowBatch decodePage(String base64, Type rowType) throws PageFormatException {
    byte[] bytes;
    try {
      bytes = Base64.getDecoder().decode(base64);
    } catch (IllegalArgumentException e) {
      throw new PageFormatException("Result page is not valid base64", e);
    }
    return deserialize(rowType, bytes);
  }

  /**
   * Decode serialized pages. The input may hold several pages back to back;
   * their rows are concatenated.
   *
   * @param rowType
   *          the ROW type of the result
   * @param input
   *          the serialized bytes
   * @return the decoded rows
   * @throws PageFormatException
   *           if the bytes are not a well formed page of the given type
   */
  public RowBatch deserialize(Type rowType, byte[] input) throws PageFormatException {
    if (!rowType.isRow()) {
      throw new IllegalArgumentException("Pages decode into row types, not " + rowType);
    }
    ByteBuffer buf = ByteBuffer.wrap(input).order(ByteOrder.LITTLE_ENDIAN);
    List<List<Object>> rows = new ArrayList<>();
    try {
      do {
        readPage(buf, rowType, rows);
      } while (buf.hasRemaining());
    } catch (BufferUnderflowException | IllegalArgumentException e) {
      throw new PageFormatException("Truncated page after " + buf.position() + " of " + input.length + " bytes", e);
    }
    try {
      return RowBatch.of(rowType, rows);
    } catch (RuntimeException e) {
      throw new PageFormatException("Decoded values do not match " + rowType + ": " + e.getMessage(), e);
    }
  }

  private void readPage(ByteBuffer buf, Type rowType, List<List<Object>> rows) throws PageFormatException {
    int positionCount = buf.getInt();
    byte markers = buf.get();
    buf.getInt(); // uncompressed size
    int sizeInBytes = buf.getInt();
    buf.getLong(); // checksum
    if ((markers & (COMPRESSED | ENCRYPTED)) != 0) {
      throw new PageFormatException("Compressed or encrypted pages are not supported, markers=" + markers);
    }
    if (positionCount < 0 || sizeInBytes < 0 || sizeInBytes > buf.remaining()) {
      throw new PageFormatException("Invalid page header: positions=" + positionCount + ", size=" + sizeInBytes
          + ", remaining=" + buf.remaining());
    }
    int end = buf.position() + sizeInBytes;
    int channelCount = buf.getInt();
    if (channelCount != rowType.size()) {
      throw new PageFormatException("Page has " + channelCount + " columns but " + rowType.size() + " were expected");
    }
    Object[][] columns = new Object[channelCount][];
    for (int c = 0; c < channelCount; c++) {
      columns[c] = readBlock(buf, rowType.childAt(c));
      if (columns[c].length != positionCount) {
        throw new PageFormatException("Column " + rowType.nameOf(c) + " has " + columns[c].length
            + " positions but the page has " + positionCount);
      }
    }
    if (buf.position() != end) {
      throw new PageFormatException("Page body ends at " + buf.position() + " but header declares " + end);
    }
    for (int r = 0; r < positionCount; r++) {
      List<Object> row = new ArrayList<>(channelCount);
      for (int c = 0; c < channelCount; c++) {
        row.add(columns[c][r]);
      }
      rows.add(row);
    }
    LOG.debug("Decoded page with {} rows and {} columns", positionCount, channelCount);
  }

  Object[] readBlock(ByteBuffer buf, Type type) throws PageFormatException {
    String encoding = readEncodingName(buf);
    return switch (encoding) {
      case "BYTE_ARRAY" -> readFixedWidth(buf, type, encoding, 1);
      case "SHORT_ARRAY" -> readFixedWidth(buf, type, encoding, 2);
      case "INT_ARRAY" -> readFixedWidth(buf, type, encoding, 4);
      case "LONG_ARRAY" -> readFixedWidth(buf, type, encoding, 8);
      case "INT128_ARRAY" -> readFixedWidth(buf, type, encoding, 16);
      case "VARIABLE_WIDTH" -> readVariableWidth(buf, type);
      case "ARRAY" -> readArray(buf, type);
      case "MAP" -> readMap(buf, type);
      case "ROW" -> readRow(buf, type);
      case "RLE" -> readRunLength(buf, type);
      case "DICTIONARY" -> readDictionary(buf, type);
      default -> throw new PageFormatException("Unsupported block encoding " + encoding);
    };
  }

  private static String readEncodingName(ByteBuffer buf) throws PageFormatException {
    int length = buf.getInt();
    if (length <= 0 || length > buf.remaining()) {
      throw new PageFormatException("Invalid encoding name length " + length);
    }
    byte[] name = new byte[length];
    buf.get(name);
    return new String(name, StandardCharsets.UTF_8);
  }

  private static int readPositionCount(ByteBuffer buf) throws PageFormatException {
    int count = buf.getInt();
    if (count < 0) {
      throw new PageFormatException("Negative position count " + count);
    }
    return count;
  }

  private static boolean[] readNulls(ByteBuffer buf, int positionCount) {
    boolean[] nulls = new boolean[positionCount];
    if (buf.get() == 0) {
      return nulls;
    }
    for (int i = 0; i < positionCount; i += 8) {
      int bits = buf.get() & 0xFF;
      for (int j = 0; j < 8 && i + j < positionCount; j++) {
        nulls[i + j] = (bits & (0x80 >>> j)) != 0;
      }
    }
    return nulls;
  }

  private static int[] readOffsets(ByteBuffer buf, int count) {
    int[] offsets = new int[count];
    for (int i = 0; i < count; i++) {
      offsets[i] = buf.getInt();
    }
    return offsets;
  }

  private Object[] readFixedWidth(ByteBuffer buf, Type type, String encoding, int width)
      throws PageFormatException {
    int positionCount = readPositionCount(buf);
    boolean[] nulls = readNulls(buf, positionCount);
    Object[] values = new Object[positionCount];
    for (int i = 0; i < positionCount; i++) {
      if (nulls[i]) {
        continue;
      }
      values[i] = switch (width) {
        case 1 -> fromByte(type, buf.get(), encoding);
        case 2 -> fromShort(type, buf.getShort(), encoding);
        case 4 -> fromInt(type, buf.getInt(), encoding);
        case 8 -> fromLong(type, buf.getLong(), encoding);
        default -> fromInt128(type, buf.getLong(), buf.getLong(), encoding);
      };
    }
    return values;
  }

  private static Object fromByte(Type type, byte value, String encoding) throws PageFormatException {
    return switch (type.kind()) {
      case BOOLEAN -> value != 0;
      case TINYINT -> value;
      case UNKNOWN -> null;
      default -> throw mismatch(type, encoding);
    };
  }

  private static Object fromShort(Type type, short value, String encoding) throws PageFormatException {
    if (type.kind() == TypeKind.SMALLINT) {
      return value;
    }
    throw mismatch(type, encoding);
  }

  private static Object fromInt(Type type, int value, String encoding) throws PageFormatException {
    return switch (type.kind()) {
      case INTEGER, INTERVAL_YEAR_MONTH -> value;
      case REAL -> Float.intBitsToFloat(value);
      case DATE -> LocalDate.ofEpochDay(value);
      default -> throw mismatch(type, encoding);
    };
  }

  private static Object fromLong(Type type, long value, String encoding) throws PageFormatException {
    return switch (type.kind()) {
      case BIGINT, INTERVAL_DAY_TIME, BINGTILE -> value;
      case DOUBLE -> Double.longBitsToDouble(value);
      case TIMESTAMP -> Instant.ofEpochMilli(value);
      case DECIMAL -> {
        if (!type.isShortDecimal()) {
          throw mismatch(type, encoding);
        }
        yield BigDecimal.valueOf(value, type.scale());
      }
      default -> throw mismatch(type, encoding);
    };
  }

  private static Object fromInt128(Type type, long first, long second, String encoding)
      throws PageFormatException {
    switch (type.kind()) {
      case DECIMAL: {
        // sign and magnitude: low word first, sign bit in the high word
        BigInteger magnitude = unsigned(second & ~SIGN_BIT).shiftLeft(64).or(unsigned(first));
        return new BigDecimal((second & SIGN_BIT) != 0 ? magnitude.negate() : magnitude, type.scale());
      }
      case HUGEINT:
        return BigInteger.valueOf(second).shiftLeft(64).or(unsigned(first));
      case UUID:
        return new UUID(first, second);
      case IPADDRESS: {
        // the two words hold the address bytes in network order
        byte[] address = ByteBuffer.allocate(16).order(ByteOrder.LITTLE_ENDIAN).putLong(first).putLong(second)
            .array();
        try {
          return InetAddress.getByAddress(address);
        } catch (UnknownHostException e) {
          throw new PageFormatException("Invalid ip address " + Arrays.toString(address), e);
        }
      }
      default:
        throw mismatch(type, encoding);
    }
  }

  private static BigInteger unsigned(long value) {
    BigInteger result = BigInteger.valueOf(value & Long.MAX_VALUE);
    return value < 0 ? result.setBit(63) : result;
  }

  private Object[] readVariableWidth(ByteBuffer buf, Type type) throws PageFormatException {
    int positionCount = readPositionCount(buf);
    int[] ends = readOffsets(buf, positionCount);
    boolean[] nulls = readNulls(buf, positionCount);
    int totalLength = buf.getInt();
    if (totalLength < 0 || totalLength > buf.remaining()) {
      throw new PageFormatException("Invalid variable width data length " + totalLength);
    }
    byte[] data = new byte[totalLength];
    buf.get(data);
    Object[] values = new Object[positionCount];
    int start = 0;
    for (int i = 0; i < positionCount; i++) {
      int end = ends[i];
      if (end < start || end > totalLength) {
        throw new PageFormatException("Invalid variable width offset " + end + " at position " + i);
      }
      if (!nulls[i]) {
        byte[] bytes = Arrays.copyOfRange(data, start, end);
        values[i] = switch (type.kind()) {
          case VARCHAR, JSON -> new String(bytes, StandardCharsets.UTF_8);
          case VARBINARY, HYPERLOGLOG, TDIGEST, IPPREFIX -> ByteBuffer.wrap(bytes);
          default -> throw mismatch(type, "VARIABLE_WIDTH");
        };
      }
      start = end;
    }
    return values;
  }

  private Object[] readArray(ByteBuffer buf, Type type) throws PageFormatException {
    if (type.kind() != TypeKind.ARRAY) {
      throw mismatch(type, "ARRAY");
    }
    Object[] elements = readBlock(buf, type.childAt(0));
    int positionCount = readPositionCount(buf);
    int[] offsets = readOffsets(buf, positionCount + 1);
    boolean[] nulls = readNulls(buf, positionCount);
    Object[] values = new Object[positionCount];
    for (int i = 0; i < positionCount; i++) {
      checkRange(offsets, i, elements.length);
      if (!nulls[i]) {
        values[i] = new ArrayList<>(Arrays.asList(elements).subList(offsets[i], offsets[i + 1]));
      }
    }
    return values;
  }

  private Object[] readMap(ByteBuffer buf, Type type) throws PageFormatException {
    if (type.kind() != TypeKind.MAP) {
      throw mismatch(type, "MAP");
    }
    Object[] keys = readBlock(buf, type.childAt(0));
    Object[] entryValues = readBlock(buf, type.childAt(1));
    if (keys.length != entryValues.length) {
      throw new PageFormatException("Map has " + keys.length + " keys but " + entryValues.length + " values");
    }
    int hashTableLength = buf.getInt();
    if (hashTableLength > 0) {
      buf.position(buf.position() + hashTableLength * Integer.BYTES);
    }
    int positionCount = readPositionCount(buf);
    int[] offsets = readOffsets(buf, positionCount + 1);
    boolean[] nulls = readNulls(buf, positionCount);
    Object[] values = new Object[positionCount];
    for (int i = 0; i < positionCount; i++) {
      checkRange(offsets, i, keys.length);
      if (!nulls[i]) {
        Map<Object, Object> map = new LinkedHashMap<>();
        for (int j = offsets[i]; j < offsets[i + 1]; j++) {
          map.put(keys[j], entryValues[j]);
        }
        values[i] = map;
      }
    }
    return values;
  }

  private Object[] readRow(ByteBuffer buf, Type type) throws PageFormatException {
    if (type.kind() != TypeKind.ROW) {
      throw mismatch(type, "ROW");
    }
    int fieldCount = buf.getInt();
    if (fieldCount != type.size()) {
      throw new PageFormatException("Row block has " + fieldCount + " fields but " + type + " has " + type.size());
    }
    Object[][] fields = new Object[fieldCount][];
    for (int f = 0; f < fieldCount; f++) {
      fields[f] = readBlock(buf, type.childAt(f));
    }
    int positionCount = readPositionCount(buf);
    int[] offsets = readOffsets(buf, positionCount + 1);
    boolean[] nulls = readNulls(buf, positionCount);
    Object[] values = new Object[positionCount];
    for (int i = 0; i < positionCount; i++) {
      if (nulls[i]) {
        continue;
      }
      int fieldIndex = offsets[i];
      List<Object> row = new ArrayList<>(fieldCount);
      for (int f = 0; f < fieldCount; f++) {
        if (fieldIndex < 0 || fieldIndex >= fields[f].length) {
          throw new PageFormatException("Row field offset " + fieldIndex + " out of range at position " + i);
        }
        row.add(fields[f][fieldIndex]);
      }
      values[i] = row;
    }
    return values;
  }

  private Object[] readRunLength(ByteBuffer buf, Type type) throws PageFormatException {
    int positionCount = readPositionCount(buf);
    Object[] single = readBlock(buf, type);
    if (single.length != 1) {
      throw new PageFormatException("Run length block must hold one value but has " + single.length);
    }
    Object[] values = new Object[positionCount];
    Arrays.fill(values, single[0]);
    return values;
  }

  private Object[] readDictionary(ByteBuffer buf, Type type) throws PageFormatException {
    int positionCount = readPositionCount(buf);
    Object[] dictionary = readBlock(buf, type);
    int[] ids = readOffsets(buf, positionCount);
    buf.position(buf.position() + DICTIONARY_ID_SIZE);
    Object[] values = new Object[positionCount];
    for (int i = 0; i < positionCount; i++) {
      if (ids[i] < 0 || ids[i] >= dictionary.length) {
        throw new PageFormatException("Dictionary id " + ids[i] + " out of range at position " + i);
      }
      values[i] = dictionary[ids[i]];
    }
    return values;
  }

  private static void checkRange(int[] offsets, int position, int limit) throws PageFormatException {
    if (offsets[position] < 0 || offsets[position] > offsets[position + 1] || offsets[position + 1] > limit) {
      throw new PageFormatException("Invalid offsets [" + offsets[position] + ", " + offsets[position + 1]
          + ") at position " + position);
    }
  }

  private static PageFormatException mismatch(Type type, String encoding) {
    return new PageFormatException("Cannot decode " + type + " from a " + encoding + " block");
  }
}
