package se.alipsa.refbridge.cli;

import java.io.Closeable;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.apache.avro.generic.GenericRecord;
import se.alipsa.refbridge.client.PrestoStatementClient;
import se.alipsa.refbridge.client.ReferenceConnectionException;
import se.alipsa.refbridge.client.ReferenceEngineConfig;
import se.alipsa.refbridge.client.ReferenceQueryException;
import se.alipsa.refbridge.client.StatementExecutor;
import se.alipsa.refbridge.data.RowBatch;
import se.alipsa.refbridge.type.Type;

/**
 * Command processor of the console. Lines starting with {@code /} are
 * commands, everything else is sent to the reference engine as SQL and the
 * decoded result is printed as a table.
 */
public class RefBridgeCliSession implements Closeable {

  /**
   * ANSI color used for the CLI prompt to keep it subtly visible.
   */
  public static final String PROMPT_COLOR = "\u001B[2;37m";
  /**
   * ANSI code that resets styling after colored segments.
   */
  public static final String ANSI_RESET = "\u001B[0m";

  private final PrintWriter out;
  private final PrintWriter err;
  private final Function<ReferenceEngineConfig, StatementExecutor> executorFactory;
  private ReferenceEngineConfig config;
  private StatementExecutor executor;
  private String sessionProperty = "";

  /**
   * Create a session that talks HTTP to the engine.
   *
   * @param out
   *          writer used for standard output
   * @param err
   *          writer used for error output
   */
  public RefBridgeCliSession(PrintWriter out, PrintWriter err) {
    this(out, err, PrestoStatementClient::new);
  }

  /**
   * Create a session with a custom executor factory.
   *
   * @param out
   *          writer used for standard output
   * @param err
   *          writer used for error output
   * @param executorFactory
   *          creates the executor for a connection
   */
  public RefBridgeCliSession(PrintWriter out, PrintWriter err,
      Function<ReferenceEngineConfig, StatementExecutor> executorFactory) {
    this.out = Objects.requireNonNull(out, "out");
    this.err = Objects.requireNonNull(err, "err");
    this.executorFactory = Objects.requireNonNull(executorFactory, "executorFactory");
  }

  /**
   * Compute the prompt to display to the user.
   *
   * @return the current prompt string
   */
  public String prompt() {
    if (config == null) {
      return PROMPT_COLOR + "refbridge>" + ANSI_RESET + " ";
    }
    return PROMPT_COLOR + "refbridge(" + config.coordinatorUri().getAuthority() + ")>" + ANSI_RESET + " ";
  }

  /**
   * Handle a single line of input.
   *
   * @param line
   *          the input line
   * @return {@code false} if the session should terminate, {@code true} otherwise
   */
  public boolean handleLine(String line) {
    if (line == null) {
      return false;
    }
    String trimmed = line.trim();
    if (trimmed.isEmpty()) {
      return true;
    }
    if (trimmed.startsWith("/")) {
      return handleCommand(trimmed);
    }
    execute(trimmed);
    return true;
  }

  /**
   * Run one SQL statement and print its result.
   *
   * @param sql
   *          the statement, a trailing semicolon is dropped
   * @return {@code true} if the engine ran the statement
   */
  public boolean execute(String sql) {
    String statement = sql.trim();
    return executeSql(statement.endsWith(";") ? statement.substring(0, statement.length() - 1) : statement);
  }

  private boolean handleCommand(String command) {
    String lower = command.toLowerCase(Locale.ROOT);
    if ("/exit".equals(lower)) {
      close();
      return false;
    }
    if ("/help".equals(lower)) {
      printHelp();
      return true;
    }
    if ("/close".equals(lower)) {
      boolean wasOpen = executor != null;
      close();
      out.println(wasOpen ? "Connection closed." : "No active connection to close.");
      out.flush();
      return true;
    }
    if (lower.startsWith("/connect")) {
      connect(command.substring("/connect".length()).trim());
      return true;
    }
    if (lower.startsWith("/session")) {
      sessionProperty = command.substring("/session".length()).trim();
      out.println(sessionProperty.isEmpty() ? "Session property cleared." : "Session property: " + sessionProperty);
      out.flush();
      return true;
    }
    if ("/info".equals(lower)) {
      printInfo();
      return true;
    }
    err.println("Unknown command: " + command + ". Use /help to list commands.");
    err.flush();
    return true;
  }

  /**
   * Connect to a coordinator.
   *
   * @param url
   *          the coordinator URL with optional settings in the query string
   * @return {@code true} if the URL was accepted
   */
  public boolean connect(String url) {
    if (url == null || url.isBlank()) {
      err.println("Usage: /connect <coordinator url>");
      err.flush();
      return false;
    }
    close();
    try {
      config = ReferenceEngineConfig.fromUrl(url, null);
      executor = executorFactory.apply(config);
      sessionProperty = config.sessionProperty();
      out.println(PROMPT_COLOR + "Connected to " + config.coordinatorUri() + ANSI_RESET);
      out.flush();
      return true;
    } catch (IllegalArgumentException e) {
      config = null;
      executor = null;
      err.println("Failed to connect: " + e.getMessage());
      err.flush();
      return false;
    }
  }

  private boolean executeSql(String sql) {
    if (executor == null) {
      err.println("Not connected. Use /connect <coordinator url> first.");
      err.flush();
      return false;
    }
    try {
      List<RowBatch> batches = executor.execute(sql, sessionProperty);
      if (batches.isEmpty()) {
        out.println("Statement executed.");
      } else {
        printBatches(batches);
      }
      out.flush();
      return true;
    } catch (ReferenceQueryException e) {
      err.println("SQL execution failed: " + e.getMessage());
    } catch (ReferenceConnectionException e) {
      err.println("Connection failed: " + e.getMessage());
    }
    err.flush();
    return false;
  }

  private void printBatches(List<RowBatch> batches) {
    Type type = batches.get(0).type();
    List<String> headers = new ArrayList<>(type.names());
    List<Integer> widths = new ArrayList<>();
    headers.forEach(h -> widths.add(h.length()));
    List<List<String>> rows = new ArrayList<>();
    for (RowBatch batch : batches) {
      for (GenericRecord record : batch.rows()) {
        List<String> row = new ArrayList<>();
        for (int i = 0; i < headers.size(); i++) {
          Object value = record.get(i);
          String text = value == null ? "NULL" : value.toString();
          row.add(text);
          widths.set(i, Math.max(widths.get(i), text.length()));
        }
        rows.add(row);
      }
    }
    printRow(headers, widths);
    out.println(buildSeparator(widths));
    for (List<String> row : rows) {
      printRow(row, widths);
    }
    out.println("(" + rows.size() + (rows.size() == 1 ? " row)" : " rows)"));
  }

  private void printRow(List<String> columns, List<Integer> widths) {
    StringBuilder line = new StringBuilder();
    for (int i = 0; i < columns.size(); i++) {
      if (i > 0) {
        line.append(" | ");
      }
      String value = String.valueOf(columns.get(i));
      line.append(value);
      line.append(pad(widths.get(i) - value.length()));
    }
    out.println(line.toString());
  }

  private String buildSeparator(List<Integer> widths) {
    return widths.stream().map(w -> "-".repeat(w)).collect(Collectors.joining("-+-"));
  }

  private void printHelp() {
    out.println("Available commands:");
    out.println("/connect <coordinator url> - Connect to a Presto coordinator, e.g. http://localhost:8080?user=me");
    out.println("/close - Close the current connection");
    out.println("/session <name=value> - Set the session property sent with each query, empty to clear");
    out.println("/info - Show information about the current connection");
    out.println("/help - Display this help text");
    out.println("/exit - Exit the CLI");
    out.flush();
  }

  private void printInfo() {
    if (config == null) {
      err.println("Not connected. Use /connect <coordinator url> first.");
      err.flush();
      return;
    }
    out.println("Coordinator: " + config.coordinatorUri());
    out.println("User: " + config.user());
    out.println("Catalog: " + config.catalog());
    out.println("Schema: " + config.schema());
    out.println("Timeout: " + config.timeout().toMillis() + " ms");
    out.println("Session property: " + (sessionProperty.isEmpty() ? "<none>" : sessionProperty));
    out.flush();
  }

  private String pad(int count) {
    return count <= 0 ? "" : " ".repeat(count);
  }

  @Override
  public void close() {
    executor = null;
    config = null;
    sessionProperty = "";
  }
}
