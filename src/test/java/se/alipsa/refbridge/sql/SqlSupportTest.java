package se.alipsa.refbridge.sql;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import se.alipsa.refbridge.expr.ConstantExpr;
import se.alipsa.refbridge.expr.FieldAccessExpr;
import se.alipsa.refbridge.expr.FunctionSignature;
import se.alipsa.refbridge.type.Type;

class SqlSupportTest {

  @Test
  void rejectsSignaturesUsingUnsupportedTypesAnywhere() {
    assertTrue(SqlSupport.isSupportedFunctionSignature(FunctionSignature.of("bigint", "array(T)")));
    assertFalse(SqlSupport.isSupportedFunctionSignature(FunctionSignature.of("bingtile", "integer", "integer")));
    assertFalse(SqlSupport.isSupportedFunctionSignature(FunctionSignature.of("bigint", "map(varchar, hyperloglog)")));
    assertFalse(SqlSupport.isSupportedFunctionSignature(FunctionSignature.of("double", "tdigest(double)")));
    assertFalse(SqlSupport.isSupportedFunctionSignature(FunctionSignature.of("interval year to month", "bigint")));
  }

  @Test
  void rejectsLiteralSensitiveTypesOnlyAsInputs() {
    assertTrue(SqlSupport.isSupportedFunctionSignature(FunctionSignature.of("json", "varchar")));
    assertFalse(SqlSupport.isSupportedFunctionSignature(FunctionSignature.of("varchar", "json")));
    assertFalse(SqlSupport.isSupportedFunctionSignature(FunctionSignature.of("boolean", "row(a ipaddress, b T)")));
    assertFalse(SqlSupport.isSupportedFunctionSignature(FunctionSignature.of("varchar", "uuid")));
  }

  @Test
  void restrictsOnlyConstants() {
    assertTrue(SqlSupport.isConstantExpressionSupported(new FieldAccessExpr("ts", Type.TIMESTAMP)));
    assertTrue(SqlSupport.isConstantExpressionSupported(new ConstantExpr(Type.BIGINT, 1L)));
    assertTrue(SqlSupport.isConstantExpressionSupported(new ConstantExpr(Type.VARCHAR, null)));
    assertFalse(SqlSupport.isConstantExpressionSupported(new ConstantExpr(Type.TIMESTAMP, 0L)));
    assertFalse(SqlSupport.isConstantExpressionSupported(new ConstantExpr(Type.JSON, "{}")));
    assertFalse(SqlSupport.isConstantExpressionSupported(new ConstantExpr(Type.INTERVAL_DAY_TIME, 10L)));
    assertFalse(SqlSupport.isConstantExpressionSupported(new ConstantExpr(Type.array(Type.BIGINT), List.of())));
  }

  @Test
  void rejectsIpAddressConstants() {
    assertFalse(SqlSupport.isConstantExpressionSupported(new ConstantExpr(Type.IPADDRESS, "192.168.0.1")));
  }

  @Test
  void rejectsIpPrefixConstants() {
    assertFalse(SqlSupport.isConstantExpressionSupported(new ConstantExpr(Type.IPPREFIX, "10.0.0.0/8")));
  }

  @Test
  void rejectsUuidConstants() {
    assertFalse(SqlSupport.isConstantExpressionSupported(
        new ConstantExpr(Type.UUID, "33355449-2c7d-43d7-967a-f53cd23215ad")));
  }

  @Test
  void acceptsIntegerConstants() {
    assertTrue(SqlSupport.isConstantExpressionSupported(new ConstantExpr(Type.INTEGER, 42)));
  }

  @Test
  void acceptsDoubleConstants() {
    assertTrue(SqlSupport.isConstantExpressionSupported(new ConstantExpr(Type.DOUBLE, 1.5d)));
  }

  @Test
  void checksParquetTypesRecursively() {
    assertTrue(SqlSupport.isSupportedParquetType(
        Type.row(List.of("a", "m"), List.of(Type.BIGINT, Type.map(Type.VARCHAR, Type.array(Type.DATE))))));
    assertFalse(SqlSupport.isSupportedParquetType(Type.map(Type.BIGINT, Type.VARCHAR)));
    assertFalse(SqlSupport.isSupportedParquetType(Type.array(Type.UNKNOWN)));
    assertFalse(SqlSupport.isSupportedParquetType(Type.row(List.of("j"), List.of(Type.JSON))));
    assertFalse(SqlSupport.isSupportedParquetType(Type.INTERVAL_DAY_TIME));
  }
}
