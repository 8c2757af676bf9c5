package se.alipsa.refbridge.client;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Connection settings of the reference engine.
 *
 * @param coordinatorUri
 *          base URI of the Presto coordinator, e.g. {@code http://localhost:8080}
 * @param user
 *          the principal sent as {@code X-Presto-User}
 * @param catalog
 *          the default catalog
 * @param schema
 *          the default schema
 * @param timeout
 *          timeout of every HTTP request
 * @param sessionProperty
 *          default {@code X-Presto-Session} value, may be empty
 */
public record ReferenceEngineConfig(URI coordinatorUri, String user, String catalog, String schema,
    Duration timeout, String sessionProperty) {

  public static final String DEFAULT_USER = "user";
  public static final String DEFAULT_CATALOG = "hive";
  public static final String DEFAULT_SCHEMA = "tpch";
  public static final long DEFAULT_TIMEOUT_MS = 10_000L;

  /** Keys accepted in the coordinator URL query string. */
  public static final Set<String> SETTING_KEYS = Set.of("user", "catalog", "schema", "timeoutMs", "session");

  public ReferenceEngineConfig {
    Objects.requireNonNull(coordinatorUri, "coordinatorUri");
    Objects.requireNonNull(user, "user");
    Objects.requireNonNull(catalog, "catalog");
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(timeout, "timeout");
    sessionProperty = sessionProperty == null ? "" : sessionProperty;
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("Timeout must be positive: " + timeout);
    }
  }

  /**
   * Settings with all defaults for the given coordinator.
   *
   * @param coordinatorUri
   *          the coordinator URI
   * @return the configuration
   */
  public static ReferenceEngineConfig of(String coordinatorUri) {
    return fromUrl(coordinatorUri, null);
  }

  /**
   * Parse a coordinator URL whose query string carries the settings, e.g.
   * {@code http://localhost:8080?user=fuzzer&timeoutMs=30000}. Entries in
   * {@code props} override the query string. Only {@link #SETTING_KEYS} may
   * appear in the query string.
   *
   * @param url
   *          the coordinator URL
   * @param props
   *          optional overrides, may be {@code null}
   * @return the configuration
   * @throws IllegalArgumentException
   *           for an unknown setting or a timeout that is not a positive number
   */
  public static ReferenceEngineConfig fromUrl(String url, Properties props) {
    Objects.requireNonNull(url, "url");
    String base = url.trim();
    Properties settings = new Properties();
    int q = base.indexOf('?');
    if (q >= 0) {
      settings.putAll(querySettings(base.substring(q + 1)));
      base = base.substring(0, q);
    }
    if (props != null) {
      settings.putAll(props);
    }
    while (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    long timeoutMs;
    String timeoutText = settings.getProperty("timeoutMs", String.valueOf(DEFAULT_TIMEOUT_MS));
    try {
      timeoutMs = Long.parseLong(timeoutText.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("timeoutMs is not a number: " + timeoutText, e);
    }
    return new ReferenceEngineConfig(URI.create(base), settings.getProperty("user", DEFAULT_USER),
        settings.getProperty("catalog", DEFAULT_CATALOG), settings.getProperty("schema", DEFAULT_SCHEMA),
        Duration.ofMillis(timeoutMs), settings.getProperty("session", ""));
  }

  private static Properties querySettings(String query) {
    Properties settings = new Properties();
    for (String pair : query.split("&")) {
      if (pair.isBlank()) {
        continue;
      }
      int eq = pair.indexOf('=');
      String key = URLDecoder.decode(eq < 0 ? pair : pair.substring(0, eq), StandardCharsets.UTF_8).trim();
      if (!SETTING_KEYS.contains(key)) {
        throw new IllegalArgumentException("Unknown setting '" + key + "', expected one of " + SETTING_KEYS);
      }
      // session values such as query_max_memory=1GB arrive percent encoded
      settings.setProperty(key, eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
    }
    return settings;
  }

  /**
   * Copy of this configuration with another default session property.
   *
   * @param session
   *          the session property, e.g. {@code query_max_memory=1GB}
   * @return the new configuration
   */
  public ReferenceEngineConfig withSessionProperty(String session) {
    return new ReferenceEngineConfig(coordinatorUri, user, catalog, schema, timeout, session);
  }
}
