package io.intellixity.relata.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/** Factory for {@link JdbcHandle}s over HikariCP pools. */
public final class JdbcHandles {
  private static final Logger log = LoggerFactory.getLogger(JdbcHandles.class);
  private static final AtomicInteger SEQ = new AtomicInteger();

  private JdbcHandles() {}

  /** Pooled handle; closing the handle closes the pool. Each backend borrows one connection. */
  public static JdbcHandle pooled(JdbcBackendConfig config) {
    Objects.requireNonNull(config, "config");
    String id = "relata-pool-" + SEQ.incrementAndGet();

    HikariConfig hc = new HikariConfig();
    hc.setPoolName(id);
    hc.setJdbcUrl(config.url());
    if (config.username() != null) hc.setUsername(config.username());
    if (config.password() != null) hc.setPassword(config.password());
    hc.setMaximumPoolSize(config.maxPoolSize());
    hc.setMinimumIdle(0);
    hc.setConnectionTimeout(config.connectionTimeout().toMillis());
    hc.setAutoCommit(true);
    config.driverProperties().forEach(hc::addDataSourceProperty);

    log.debug("relata.jdbc pool id={} url={} maxPoolSize={}", id, config.url(), config.maxPoolSize());
    return new JdbcHandle(id, new HikariDataSource(hc), config.schema());
  }
}
