package io.intellixity.relata.spi.bind;

import io.intellixity.relata.sql.StatementKind;

/** What a binder may know about the statement it binds into. */
public interface BindContext {
  String dialectId();

  StatementKind statementKind();
}
