package se.alipsa.refbridge.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import se.alipsa.refbridge.type.TypeSignature;

/** The declared return and argument types of a function the fuzzer may call. */
public final class FunctionSignature {

  private final TypeSignature returnType;
  private final List<TypeSignature> argumentTypes;

  /**
   * Create a signature.
   *
   * @param returnType
   *          the result type, possibly generic
   * @param argumentTypes
   *          the parameter types in call order
   */
  public FunctionSignature(TypeSignature returnType, List<TypeSignature> argumentTypes) {
    this.returnType = Objects.requireNonNull(returnType, "returnType");
    this.argumentTypes = List.copyOf(argumentTypes);
  }

  /**
   * Create a signature from textual type signatures.
   *
   * @param returnType
   *          the return type, e.g. {@code "array(T)"}
   * @param argumentTypes
   *          the argument types
   * @return the signature
   */
  public static FunctionSignature of(String returnType, String... argumentTypes) {
    List<TypeSignature> args = new ArrayList<>(argumentTypes.length);
    for (String argumentType : argumentTypes) {
      args.add(TypeSignature.parse(argumentType));
    }
    return new FunctionSignature(TypeSignature.parse(returnType), args);
  }

  public TypeSignature returnType() {
    return returnType;
  }

  public List<TypeSignature> argumentTypes() {
    return argumentTypes;
  }

  /**
   * Whether the return type or any argument type uses the given type name.
   *
   * @param typeName
   *          the type name, case-insensitive
   * @return {@code true} if used at any nesting depth
   */
  public boolean usesTypeName(String typeName) {
    return returnType.usesTypeName(typeName) || usesInputTypeName(typeName);
  }

  /**
   * Whether any argument type uses the given type name.
   *
   * @param typeName
   *          the type name, case-insensitive
   * @return {@code true} if an argument uses it at any nesting depth
   */
  public boolean usesInputTypeName(String typeName) {
    for (TypeSignature argument : argumentTypes) {
      if (argument.usesTypeName(typeName)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return argumentTypes + " -> " + returnType;
  }
}
