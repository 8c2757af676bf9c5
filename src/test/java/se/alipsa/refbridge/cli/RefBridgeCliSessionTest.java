package se.alipsa.refbridge.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.ConnectException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import se.alipsa.refbridge.client.ReferenceConnectionException;
import se.alipsa.refbridge.client.ReferenceEngineConfig;
import se.alipsa.refbridge.client.ReferenceQueryException;
import se.alipsa.refbridge.client.StatementExecutor;
import se.alipsa.refbridge.data.RowBatch;
import se.alipsa.refbridge.type.Type;

/**
 * Tests for the CLI session command handling against a fake engine.
 */
class RefBridgeCliSessionTest {

  private static final Type RESULT = Type.row(List.of("nationkey", "name"), List.of(Type.BIGINT, Type.VARCHAR));

  private final StringWriter outBuffer = new StringWriter();
  private final StringWriter errBuffer = new StringWriter();
  private final List<String> executed = new ArrayList<>();
  private final List<String> sessions = new ArrayList<>();
  private final List<ReferenceEngineConfig> configs = new ArrayList<>();

  private RefBridgeCliSession session(StatementExecutor executor) {
    return new RefBridgeCliSession(new PrintWriter(outBuffer, true), new PrintWriter(errBuffer, true), config -> {
      configs.add(config);
      return executor;
    });
  }

  private StatementExecutor recording(List<RowBatch> result) {
    return (sql, session) -> {
      executed.add(sql);
      sessions.add(session);
      return result;
    };
  }

  @Test
  void shouldConnectAndShowInfo() {
    try (RefBridgeCliSession session = session(recording(List.of()))) {
      session.handleLine("/connect http://presto:8080?user=fuzzer&catalog=tpch");
      assertTrue(outBuffer.toString().contains("Connected to http://presto:8080"));
      assertTrue(session.prompt().contains("refbridge(presto:8080)>"));
      assertEquals("fuzzer", configs.get(0).user());
      outBuffer.getBuffer().setLength(0);

      session.handleLine("/info");
      String output = outBuffer.toString();
      assertTrue(output.contains("Timeout: 10000 ms"));
      assertTrue(output.contains("Coordinator: http://presto:8080"));
      assertTrue(output.contains("User: fuzzer"));
      assertTrue(output.contains("Catalog: tpch"));
      assertTrue(output.contains("Session property: <none>"));
      assertTrue(errBuffer.toString().isEmpty());
    }
  }

  @Test
  void shouldExecuteQueryAndPrintTable() {
    RowBatch batch = RowBatch.of(RESULT, List.of(List.of(0L, "ALGERIA"), Arrays.asList(1L, null)));
    try (RefBridgeCliSession session = session(recording(List.of(batch)))) {
      session.connect("http://presto:8080");
      outBuffer.getBuffer().setLength(0);

      session.handleLine("SELECT nationkey, name FROM nation;");
      assertEquals(List.of("SELECT nationkey, name FROM nation"), executed);
      String[] lines = outBuffer.toString().split("\\R");
      assertEquals("nationkey | name   ", lines[0]);
      assertEquals("----------+--------", lines[1]);
      assertEquals("0         | ALGERIA", lines[2]);
      assertEquals("1         | NULL   ", lines[3]);
      assertEquals("(2 rows)", lines[4]);
    }
  }

  @Test
  void shouldSendSessionPropertyWithQueries() {
    try (RefBridgeCliSession session = session(recording(List.of()))) {
      session.handleLine("/connect http://presto:8080");
      session.handleLine("/session join_distribution_type=BROADCAST");
      assertTrue(outBuffer.toString().contains("Session property: join_distribution_type=BROADCAST"));
      session.handleLine("CREATE TABLE t AS SELECT 1 AS x");
      assertTrue(outBuffer.toString().contains("Statement executed."));
      session.handleLine("/session");
      assertTrue(outBuffer.toString().contains("Session property cleared."));
      session.handleLine("SELECT 1");
      assertEquals(List.of("join_distribution_type=BROADCAST", ""), sessions);
    }
  }

  @Test
  void shouldReportFailuresOnErrorStream() {
    StatementExecutor failing = (sql, session) -> {
      if (sql.contains("missing")) {
        throw new ReferenceQueryException("Presto query failed: 46 Table hive.tpch.missing does not exist");
      }
      throw new ReferenceConnectionException("Couldn't connect to server at http://presto:8080",
          new ConnectException("Connection refused"));
    };
    try (RefBridgeCliSession session = session(failing)) {
      session.handleLine("SELECT 1");
      assertTrue(errBuffer.toString().contains("Not connected"));

      session.handleLine("/connect http://presto:8080");
      session.handleLine("SELECT * FROM missing");
      assertTrue(errBuffer.toString().contains("SQL execution failed: Presto query failed: 46"));
      session.handleLine("SELECT 1");
      assertTrue(errBuffer.toString().contains("Connection failed: Couldn't connect"));

      session.handleLine("/connect http://presto:8080?timeoutMs=never");
      assertTrue(errBuffer.toString().contains("Failed to connect:"));
      session.handleLine("/bogus");
      assertTrue(errBuffer.toString().contains("Unknown command: /bogus"));
    }
  }

  @Test
  void executeShouldReportWhetherTheStatementRan() {
    StatementExecutor failing = (sql, session) -> {
      throw new ReferenceQueryException("Presto query failed: 1 line 1:8: mismatched input");
    };
    try (RefBridgeCliSession session = session(failing)) {
      assertFalse(session.execute("SELECT 1"));
      assertFalse(session.connect(" "));
      assertTrue(session.connect("http://presto:8080"));
      assertFalse(session.execute("SELECT FROM;"));
    }
    try (RefBridgeCliSession session = session(recording(List.of()))) {
      assertFalse(session.connect("http://presto:8080?password=secret"));
      assertTrue(errBuffer.toString().contains("Unknown setting 'password'"));
      assertTrue(session.connect("http://presto:8080"));
      assertTrue(session.execute("DROP TABLE IF EXISTS t;"));
      assertEquals(List.of("DROP TABLE IF EXISTS t"), executed);
    }
  }

  @Test
  void shouldCloseConnectionAndExit() {
    try (RefBridgeCliSession session = session(recording(List.of()))) {
      session.handleLine("/close");
      assertTrue(outBuffer.toString().contains("No active connection to close."));
      session.connect("http://presto:8080");
      session.handleLine("/close");
      assertTrue(outBuffer.toString().contains("Connection closed."));
      assertTrue(session.prompt().contains("refbridge>"));
      assertTrue(session.handleLine("   "));
      assertFalse(session.handleLine("/exit"));
      assertFalse(session.handleLine(null));
    }
  }

  @Test
  void promptShouldBeColoredLightGray() {
    try (RefBridgeCliSession session = session(recording(List.of()))) {
      String prompt = session.prompt();
      assertTrue(prompt.startsWith("\u001B[2;37m"));
      assertTrue(prompt.contains("\u001B[0m "));
    }
  }
}
