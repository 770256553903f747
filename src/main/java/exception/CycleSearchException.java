package exception;

/**
 * Internal invariant violation during a cycle search, e.g. a lookup of a vertex id that is no longer
 * in the graph. Aborts the whole run.
 */
public class CycleSearchException extends RuntimeException {
  public CycleSearchException(String message) {
    super(message);
  }

  public CycleSearchException(String message, Throwable cause) {
    super(message, cause);
  }

  public static CycleSearchException missingVertex(int vertex) {
    return new CycleSearchException("vertex " + vertex + " does not exist in the graph");
  }
}
