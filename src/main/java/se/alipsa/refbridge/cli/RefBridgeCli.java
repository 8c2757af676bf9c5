package se.alipsa.refbridge.cli;

import static se.alipsa.refbridge.cli.RefBridgeCliSession.ANSI_RESET;
import static se.alipsa.refbridge.cli.RefBridgeCliSession.PROMPT_COLOR;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.bridge.SLF4JBridgeHandler;

/**
 * Entry point for the console that runs SQL on the reference engine.
 *
 * <pre>
 * refbridge [coordinator-url] [-e|--execute &lt;sql&gt;]
 * </pre>
 *
 * With {@code --execute} the statement is run once against the coordinator and
 * the process exits with status 1 if it fails; otherwise an interactive
 * session starts.
 */
public final class RefBridgeCli {

  private static final Logger LOG = LoggerFactory.getLogger(RefBridgeCli.class);

  static final String USAGE = "Usage: refbridge [coordinator-url] [-e|--execute <sql>]";

  private RefBridgeCli() {
    // utility class
  }

  /**
   * Parsed command line.
   *
   * @param coordinatorUrl
   *          coordinator URL with optional settings, or {@code null}
   * @param statement
   *          statement to run once, or {@code null} for an interactive session
   */
  record Options(String coordinatorUrl, String statement) {

    boolean oneShot() {
      return statement != null;
    }
  }

  /**
   * Start the CLI.
   *
   * @param args
   *          the command line, see the class description
   */
  public static void main(String[] args) {
    configureLogging();
    Options options;
    try {
      options = parseArgs(args);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.err.println(USAGE);
      System.exit(2);
      return;
    }
    if (options.oneShot()) {
      System.exit(runOnce(options, new PrintWriter(System.out, true, StandardCharsets.UTF_8),
          new PrintWriter(System.err, true, StandardCharsets.UTF_8)));
    }
    try {
      runInteractive(options);
    } catch (IOException e) {
      LOG.error("Failed to start RefBridge CLI: {}", e.getMessage(), e);
      System.exit(1);
    }
  }

  static Options parseArgs(String[] args) {
    String url = null;
    String statement = null;
    for (int i = 0; args != null && i < args.length; i++) {
      String arg = args[i];
      if ("-e".equals(arg) || "--execute".equals(arg)) {
        if (i + 1 >= args.length || args[i + 1].isBlank()) {
          throw new IllegalArgumentException(arg + " needs a SQL statement");
        }
        statement = args[++i];
      } else if (arg.startsWith("-")) {
        throw new IllegalArgumentException("Unknown option " + arg);
      } else if (url == null) {
        url = arg;
      } else {
        throw new IllegalArgumentException("Unexpected argument " + arg);
      }
    }
    if (statement != null && url == null) {
      throw new IllegalArgumentException("--execute needs a coordinator url");
    }
    return new Options(url, statement);
  }

  /**
   * Run the statement of a one shot invocation.
   *
   * @return the process exit status
   */
  static int runOnce(Options options, PrintWriter out, PrintWriter err) {
    try (RefBridgeCliSession session = new RefBridgeCliSession(out, err)) {
      return session.connect(options.coordinatorUrl()) && session.execute(options.statement()) ? 0 : 1;
    }
  }

  private static void runInteractive(Options options) throws IOException {
    Terminal terminal = TerminalBuilder.builder().system(true).build();
    Path historyFile = Paths.get(System.getProperty("user.home"), ".refbridge_history");
    LineReader reader = LineReaderBuilder.builder().terminal(terminal).appName("refbridge")
        .variable(LineReader.HISTORY_FILE, historyFile).build();
    PrintWriter out = new PrintWriter(terminal.output(), true);
    try (RefBridgeCliSession session = new RefBridgeCliSession(out, out)) {
      out.println(PROMPT_COLOR + "RefBridge console for Presto, /help lists the commands" + ANSI_RESET);
      if (options.coordinatorUrl() != null) {
        session.connect(options.coordinatorUrl());
      }
      boolean running = true;
      while (running) {
        String line;
        try {
          line = reader.readLine(session.prompt());
        } catch (UserInterruptException e) {
          // ctrl-c drops the current line only
          continue;
        } catch (EndOfFileException e) {
          break;
        }
        running = session.handleLine(line);
      }
    }
  }

  private static void configureLogging() {
    SLF4JBridgeHandler.removeHandlersForRootLogger();
    SLF4JBridgeHandler.install();
    System.setProperty(org.slf4j.simple.SimpleLogger.DEFAULT_LOG_LEVEL_KEY, "error");
    System.setProperty("org.slf4j.simpleLogger.log.org.apache.hadoop", "error");
    System.setProperty("org.slf4j.simpleLogger.log.org.apache.parquet", "error");
  }
}
