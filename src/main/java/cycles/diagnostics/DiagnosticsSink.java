package cycles.diagnostics;

/**
 * Side channel for progress and summary messages of a cycle search. The search engine receives one
 * at construction instead of writing to a global log.
 */
@FunctionalInterface
public interface DiagnosticsSink {

  /** Discards every event. */
  DiagnosticsSink NONE = message -> {};

  void recordEvent(String message);
}
