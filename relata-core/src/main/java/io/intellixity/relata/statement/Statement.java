package io.intellixity.relata.statement;

import io.intellixity.relata.sql.StatementKind;

/** Immutable compiled-query structure; turned into SQL by a dialect. */
public sealed interface Statement
    permits SelectStatement, SetOperationStatement, InsertStatement, UpdateStatement, DeleteStatement {
  StatementKind kind();
}
