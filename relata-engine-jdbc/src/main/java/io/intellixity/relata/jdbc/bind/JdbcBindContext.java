package io.intellixity.relata.jdbc.bind;

import io.intellixity.relata.spi.bind.BindContext;

/** JDBC bind position (1-based, in driver placeholder order). */
public interface JdbcBindContext extends BindContext {
  int position1Based();
}
