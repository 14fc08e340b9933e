package io.intellixity.relata.sql;

/** Feature-support flags a {@link Dialect} answers before anything is rendered. */
public enum Capability {
  CTE,
  RECURSIVE_CTE,
  WINDOW_FUNCTIONS,
  /** {@code COUNT(*) FILTER (WHERE ...)} on aggregates. */
  FILTER_CLAUSE,
  RETURNING,
  SAVEPOINT,
  /** {@code FOR UPDATE} / {@code FOR SHARE}. */
  ROW_LOCKING,
  RIGHT_JOIN,
  FULL_OUTER_JOIN,
  INTERSECT,
  EXCEPT,
  /** OFFSET may appear without a LIMIT. */
  OFFSET_WITHOUT_LIMIT,
  /** {@code NULLS FIRST} / {@code NULLS LAST} in ORDER BY. */
  NULLS_ORDERING,
  /** {@code GROUP BY ROLLUP(...)}, or MySQL's trailing {@code WITH ROLLUP}. */
  ROLLUP,
  CUBE,
  GROUPING_SETS,
  /** {@code ON CONFLICT} / {@code ON DUPLICATE KEY UPDATE} on INSERT. */
  UPSERT
}
