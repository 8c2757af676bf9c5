package se.alipsa.refbridge.type;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A possibly generic type as it appears in a function signature, e.g.
 * {@code array(T)} or {@code map(varchar, hyperloglog)}. Unlike {@link Type}
 * the base name is free text so type variables and unknown names survive.
 */
public final class TypeSignature {

  private final String baseName;
  private final List<TypeSignature> parameters;

  /**
   * Create a signature.
   *
   * @param baseName
   *          the base name, e.g. {@code "array"}
   * @param parameters
   *          the type parameters
   */
  public TypeSignature(String baseName, List<TypeSignature> parameters) {
    this.baseName = Objects.requireNonNull(baseName, "baseName");
    this.parameters = List.copyOf(parameters);
  }

  /**
   * Parse a signature from its textual form.
   *
   * @param text
   *          the signature text, e.g. {@code "row(a json, b array(T))"}
   * @return the parsed signature
   */
  public static TypeSignature parse(String text) {
    Objects.requireNonNull(text, "text");
    String trimmed = text.trim();
    int open = trimmed.indexOf('(');
    if (open < 0) {
      return new TypeSignature(trimmed, List.of());
    }
    if (!trimmed.endsWith(")")) {
      throw new IllegalArgumentException("Unbalanced type signature: " + text);
    }
    String base = trimmed.substring(0, open).trim();
    boolean row = "row".equalsIgnoreCase(base);
    List<TypeSignature> params = new ArrayList<>();
    for (String part : splitTopLevel(trimmed.substring(open + 1, trimmed.length() - 1))) {
      params.add(parse(row ? stripFieldName(part) : part));
    }
    return new TypeSignature(base, params);
  }

  public String baseName() {
    return baseName;
  }

  public List<TypeSignature> parameters() {
    return parameters;
  }

  /**
   * Whether this signature or any nested parameter has the given base name.
   *
   * @param typeName
   *          the name to look for, compared case-insensitively
   * @return {@code true} if the name is used at any depth
   */
  public boolean usesTypeName(String typeName) {
    if (baseName.equalsIgnoreCase(typeName)) {
      return true;
    }
    for (TypeSignature parameter : parameters) {
      if (parameter.usesTypeName(typeName)) {
        return true;
      }
    }
    return false;
  }

  private static List<String> splitTopLevel(String inner) {
    List<String> parts = new ArrayList<>();
    int depth = 0;
    int start = 0;
    for (int i = 0; i < inner.length(); i++) {
      char c = inner.charAt(i);
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
      } else if (c == ',' && depth == 0) {
        parts.add(inner.substring(start, i));
        start = i + 1;
      }
    }
    String last = inner.substring(start);
    if (!last.isBlank() || !parts.isEmpty()) {
      parts.add(last);
    }
    return parts;
  }

  private static String stripFieldName(String field) {
    String trimmed = field.trim();
    int paren = trimmed.indexOf('(');
    String head = paren < 0 ? trimmed : trimmed.substring(0, paren);
    int space = head.indexOf(' ');
    if (space < 0 || head.toLowerCase(Locale.ROOT).startsWith("interval ")) {
      return trimmed;
    }
    return trimmed.substring(space + 1);
  }

  @Override
  public String toString() {
    if (parameters.isEmpty()) {
      return baseName;
    }
    StringBuilder sb = new StringBuilder(baseName).append('(');
    for (int i = 0; i < parameters.size(); i++) {
      if (i > 0) {
        sb.append(',');
      }
      sb.append(parameters.get(i));
    }
    return sb.append(')').toString();
  }
}
