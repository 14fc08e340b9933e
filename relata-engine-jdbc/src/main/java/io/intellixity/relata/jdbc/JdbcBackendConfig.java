package io.intellixity.relata.jdbc;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Connection settings for a pooled JDBC handle.
 *
 * <p>Properties keys (see {@link #fromProperties}):
 * <pre>
 * relata.jdbc.url                        (required)
 * relata.jdbc.username
 * relata.jdbc.password
 * relata.jdbc.schema
 * relata.jdbc.pool.maxSize               default 4
 * relata.jdbc.pool.connectionTimeoutMs   default 30000
 * relata.jdbc.driver.&lt;name&gt;              passed to the driver as data source property &lt;name&gt;
 * </pre>
 */
public record JdbcBackendConfig(
    String url,
    String username,
    String password,
    String schema,
    int maxPoolSize,
    Duration connectionTimeout,
    Map<String, String> driverProperties
) {
  public static final String PREFIX = "relata.jdbc.";
  public static final int DEFAULT_MAX_POOL_SIZE = 4;
  public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(30);

  public JdbcBackendConfig {
    Objects.requireNonNull(url, "url");
    if (url.isBlank()) throw new IllegalArgumentException("url must not be blank");
    if (maxPoolSize < 1) throw new IllegalArgumentException("maxPoolSize must be >= 1");
    connectionTimeout = connectionTimeout == null ? DEFAULT_CONNECTION_TIMEOUT : connectionTimeout;
    driverProperties = driverProperties == null ? Map.of() : Map.copyOf(driverProperties);
  }

  public static JdbcBackendConfig of(String url) {
    return new JdbcBackendConfig(url, null, null, null, DEFAULT_MAX_POOL_SIZE, DEFAULT_CONNECTION_TIMEOUT, Map.of());
  }

  public static JdbcBackendConfig fromProperties(Properties props) {
    Objects.requireNonNull(props, "props");
    String url = props.getProperty(PREFIX + "url");
    if (url == null || url.isBlank()) {
      throw new IllegalArgumentException("Missing required property " + PREFIX + "url");
    }
    Map<String, String> driver = new LinkedHashMap<>();
    String driverPrefix = PREFIX + "driver.";
    for (String name : props.stringPropertyNames()) {
      if (name.startsWith(driverPrefix)) driver.put(name.substring(driverPrefix.length()), props.getProperty(name));
    }
    return new JdbcBackendConfig(
        url.trim(),
        props.getProperty(PREFIX + "username"),
        props.getProperty(PREFIX + "password"),
        props.getProperty(PREFIX + "schema"),
        intProperty(props, PREFIX + "pool.maxSize", DEFAULT_MAX_POOL_SIZE),
        Duration.ofMillis(intProperty(props, PREFIX + "pool.connectionTimeoutMs",
            (int) DEFAULT_CONNECTION_TIMEOUT.toMillis())),
        driver);
  }

  public JdbcBackendConfig withCredentials(String username, String password) {
    return new JdbcBackendConfig(url, username, password, schema, maxPoolSize, connectionTimeout, driverProperties);
  }

  public JdbcBackendConfig withMaxPoolSize(int maxPoolSize) {
    return new JdbcBackendConfig(url, username, password, schema, maxPoolSize, connectionTimeout, driverProperties);
  }

  private static int intProperty(Properties props, String key, int dflt) {
    String v = props.getProperty(key);
    if (v == null || v.isBlank()) return dflt;
    try {
      return Integer.parseInt(v.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Property " + key + " must be an integer: " + v, e);
    }
  }

  @Override
  public String toString() {
    return "JdbcBackendConfig[url=" + url + ", username=" + username + ", password=" + (password == null ? null : "***")
        + ", schema=" + schema + ", maxPoolSize=" + maxPoolSize + ", connectionTimeout=" + connectionTimeout
        + ", driverProperties=" + driverProperties.keySet() + "]";
  }
}
