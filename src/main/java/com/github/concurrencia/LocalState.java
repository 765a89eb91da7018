package com.github.concurrencia;

/**
 * A value belonging to exactly one process: an enumerated tag, a bounded counter, a named explicit
 * state or, for composite processes, a {@link ComposedState}.
 * 
 * Implementations must be immutable and implement structural equals() and hashCode(), the
 * explorer deduplicates states by them.
 */
public interface LocalState {

  /**
   * Short human readable rendering used in logs and reports.
   */
  String describe();

}
