package io.intellixity.relata.error;

/** A recursive CTE would recurse past its configured depth bound, usually because of cyclic data. */
public final class RecursionLimitExceededException extends QueryExecutionException {
  private final String cteName;
  private final int maxDepth;

  public RecursionLimitExceededException(String dialectId, String cteName, int maxDepth) {
    super(dialectId, "WITH RECURSIVE " + cteName,
        "recursion exceeded max depth " + maxDepth + " (cyclic data?)");
    this.cteName = cteName;
    this.maxDepth = maxDepth;
  }

  public String cteName() { return cteName; }
  public int maxDepth() { return maxDepth; }
}
