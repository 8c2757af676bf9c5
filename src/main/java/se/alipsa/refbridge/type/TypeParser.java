package se.alipsa.refbridge.type;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses the textual type names reported in the {@code columns} metadata of a
 * Presto response (e.g. {@code map(varchar, array(row(a integer, b double)))})
 * into {@link Type} instances.
 */
public final class TypeParser {

  private static final Map<String, Type> SCALARS = Map.ofEntries(Map.entry("boolean", Type.BOOLEAN),
      Map.entry("tinyint", Type.TINYINT), Map.entry("smallint", Type.SMALLINT), Map.entry("integer", Type.INTEGER),
      Map.entry("int", Type.INTEGER), Map.entry("bigint", Type.BIGINT), Map.entry("hugeint", Type.HUGEINT),
      Map.entry("real", Type.REAL), Map.entry("double", Type.DOUBLE), Map.entry("varchar", Type.VARCHAR),
      Map.entry("char", Type.VARCHAR), Map.entry("varbinary", Type.VARBINARY), Map.entry("date", Type.DATE),
      Map.entry("timestamp", Type.TIMESTAMP), Map.entry("interval day to second", Type.INTERVAL_DAY_TIME),
      Map.entry("interval year to month", Type.INTERVAL_YEAR_MONTH), Map.entry("unknown", Type.UNKNOWN),
      Map.entry("json", Type.JSON), Map.entry("ipaddress", Type.IPADDRESS), Map.entry("ipprefix", Type.IPPREFIX),
      Map.entry("uuid", Type.UUID), Map.entry("hyperloglog", Type.HYPERLOGLOG),
      Map.entry("p4hyperloglog", Type.HYPERLOGLOG), Map.entry("bingtile", Type.BINGTILE));

  private final String text;
  private int pos;

  private TypeParser(String text) {
    this.text = text;
  }

  /**
   * Parse a Presto type name.
   *
   * @param text
   *          the type text, case-insensitive
   * @return the parsed type
   * @throws IllegalArgumentException
   *           if the text is not a known type
   */
  public static Type parse(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Empty type name");
    }
    TypeParser parser = new TypeParser(text);
    Type type = parser.parseType();
    parser.skipWhitespace();
    if (parser.pos != text.length()) {
      throw parser.error("Unexpected trailing input");
    }
    return type;
  }

  private Type parseType() {
    skipWhitespace();
    String base = readBaseName();
    skipWhitespace();
    boolean hasParameters = peek() == '(';
    switch (base) {
      case "array" -> {
        expect('(');
        Type element = parseType();
        expect(')');
        return Type.array(element);
      }
      case "map" -> {
        expect('(');
        Type key = parseType();
        expect(',');
        Type value = parseType();
        expect(')');
        return Type.map(key, value);
      }
      case "row" -> {
        return parseRow();
      }
      case "decimal" -> {
        if (!hasParameters) {
          return Type.decimal(38, 0);
        }
        expect('(');
        int precision = readInt();
        int scale = 0;
        skipWhitespace();
        if (peek() == ',') {
          expect(',');
          scale = readInt();
        }
        expect(')');
        return Type.decimal(precision, scale);
      }
      case "tdigest" -> {
        if (!hasParameters) {
          return Type.tdigest(Type.DOUBLE);
        }
        expect('(');
        Type parameter = parseType();
        expect(')');
        return Type.tdigest(parameter);
      }
      default -> {
        Type scalar = SCALARS.get(base);
        if (scalar == null) {
          throw error("Unsupported type '" + base + "'");
        }
        if (hasParameters) {
          // varchar(n), char(n) and timestamp(p) carry a length or precision we do not track
          expect('(');
          readInt();
          expect(')');
        }
        return scalar;
      }
    }
  }

  private Type parseRow() {
    expect('(');
    List<String> names = new ArrayList<>();
    List<Type> types = new ArrayList<>();
    while (true) {
      skipWhitespace();
      String name = "";
      if (peek() == '"') {
        name = readQuotedName();
      } else {
        int mark = pos;
        String word = readWord();
        skipWhitespace();
        char next = peek();
        if (next == ',' || next == ')' || next == '(' || isMultiWordTypeStart(word)) {
          // anonymous field, the word starts the type itself
          pos = mark;
        } else {
          name = word;
        }
      }
      names.add(name);
      types.add(parseType());
      skipWhitespace();
      if (peek() == ',') {
        pos++;
        continue;
      }
      expect(')');
      return Type.row(names, types);
    }
  }

  private static boolean isMultiWordTypeStart(String word) {
    return "interval".equalsIgnoreCase(word);
  }

  private String readBaseName() {
    String word = readWord();
    if ("interval".equals(word)) {
      StringBuilder sb = new StringBuilder(word);
      for (int i = 0; i < 3; i++) {
        skipWhitespace();
        sb.append(' ').append(readWord());
      }
      return sb.toString();
    }
    return word;
  }

  private String readWord() {
    int start = pos;
    while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
      pos++;
    }
    if (start == pos) {
      throw error("Expected a name");
    }
    return text.substring(start, pos).toLowerCase(Locale.ROOT);
  }

  private String readQuotedName() {
    expect('"');
    StringBuilder sb = new StringBuilder();
    while (pos < text.length()) {
      char c = text.charAt(pos++);
      if (c == '"') {
        if (peek() == '"') {
          sb.append('"');
          pos++;
          continue;
        }
        return sb.toString();
      }
      sb.append(c);
    }
    throw error("Unterminated quoted name");
  }

  private int readInt() {
    skipWhitespace();
    int start = pos;
    while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
      pos++;
    }
    if (start == pos) {
      throw error("Expected a number");
    }
    return Integer.parseInt(text.substring(start, pos));
  }

  private void expect(char c) {
    skipWhitespace();
    if (peek() != c) {
      throw error("Expected '" + c + "'");
    }
    pos++;
  }

  private char peek() {
    return pos < text.length() ? text.charAt(pos) : '\0';
  }

  private void skipWhitespace() {
    while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
      pos++;
    }
  }

  private IllegalArgumentException error(String message) {
    return new IllegalArgumentException(message + " at position " + pos + " in type '" + text + "'");
  }
}
