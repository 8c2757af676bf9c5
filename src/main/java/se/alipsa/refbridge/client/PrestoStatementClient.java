package se.alipsa.refbridge.client;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.refbridge.data.RowBatch;
import se.alipsa.refbridge.serde.PrestoPageDeserializer;

/**
 * Client of the Presto HTTP statement protocol. A statement is posted to
 * {@code /v1/statement}; the client then follows {@code nextUri} until the
 * engine omits it, collecting the binary result pages of every response.
 */
public class PrestoStatementClient implements StatementExecutor {

  private static final Logger LOG = LoggerFactory.getLogger(PrestoStatementClient.class);

  static final String STATEMENT_PATH = "/v1/statement?binaryResults=true";

  private final ReferenceEngineConfig config;
  private final HttpClient httpClient;
  private final PrestoPageDeserializer deserializer = new PrestoPageDeserializer();

  /**
   * Create a client with its own HTTP client.
   *
   * @param config
   *          the engine settings
   */
  public PrestoStatementClient(ReferenceEngineConfig config) {
    this(config, HttpClient.newBuilder().connectTimeout(config.timeout()).build());
  }

  /**
   * Create a client on a supplied HTTP client.
   *
   * @param config
   *          the engine settings
   * @param httpClient
   *          the transport
   */
  public PrestoStatementClient(ReferenceEngineConfig config, HttpClient httpClient) {
    this.config = Objects.requireNonNull(config, "config");
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
  }

  public ReferenceEngineConfig config() {
    return config;
  }

  /** Runs the statement with the configured default session property. */
  @Override
  public List<RowBatch> execute(String sql) throws ReferenceQueryException {
    return execute(sql, config.sessionProperty());
  }

  /**
   * {@inheritDoc}
   *
   * @throws ReferenceConnectionException
   *           if the engine cannot be reached
   */
  @Override
  public List<RowBatch> execute(String sql, String sessionProperty) throws ReferenceQueryException {
    LOG.info("Execute presto sql: {}", sql);
    ServerResponse response = ServerResponse.parse(startQuery(sql, sessionProperty));
    response.throwIfFailed();
    List<RowBatch> results = new ArrayList<>();
    while (true) {
      results.addAll(response.queryResults(deserializer));
      if (response.queryCompleted()) {
        break;
      }
      response = ServerResponse.parse(fetchNext(response.nextUri()));
      response.throwIfFailed();
    }
    LOG.debug("Query {} returned {} batches", response.queryId(), results.size());
    return results;
  }

  String startQuery(String sql, String sessionProperty) throws ReferenceQueryException {
    HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(config.coordinatorUri() + STATEMENT_PATH))
        .timeout(config.timeout()).header("X-Presto-User", config.user())
        .header("X-Presto-Catalog", config.catalog()).header("X-Presto-Schema", config.schema())
        .header("Content-Type", "text/plain").POST(HttpRequest.BodyPublishers.ofString(sql));
    if (sessionProperty != null && !sessionProperty.isBlank()) {
      builder.header("X-Presto-Session", sessionProperty);
    }
    return send(builder.build());
  }

  String fetchNext(String nextUri) throws ReferenceQueryException {
    HttpRequest request = HttpRequest.newBuilder(URI.create(nextUri)).timeout(config.timeout())
        .header("X-Presto-Client-Binary-Results", "true").GET().build();
    return send(request);
  }

  private String send(HttpRequest request) throws ReferenceQueryException {
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ReferenceQueryException("Interrupted while waiting for " + request.uri(), e);
    } catch (IOException | UnresolvedAddressException e) {
      if (isConnectionFailure(e)) {
        throw new ReferenceConnectionException("Couldn't connect to server at " + config.coordinatorUri(), e);
      }
      if (e instanceof HttpTimeoutException) {
        throw new ReferenceQueryException("Request to " + request.uri() + " timed out after " + config.timeout(), e);
      }
      throw new ReferenceQueryException("Request to " + request.uri() + " failed: " + e.getMessage(), e);
    }
    if (response.statusCode() != 200) {
      throw new ReferenceQueryException(
          "Unexpected HTTP status " + response.statusCode() + " from " + request.uri() + ": " + response.body());
    }
    return response.body();
  }

  static boolean isConnectionFailure(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (t instanceof ConnectException || t instanceof HttpConnectTimeoutException
          || t instanceof UnresolvedAddressException) {
        return true;
      }
      if (t.getCause() == t) {
        break;
      }
    }
    return false;
  }
}
