package com.github.concurrencia;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * This object encapsulates a failed safety check: the name of the violated property and the
 * minimal counterexample trace from the initial state. The last action of the trace is the one
 * the property could not follow. Deadlocks are reported under {@link #DEADLOCK}, their trace leads
 * to a state without any enabled action.
 * 
 * A violation is the regular output of a failing check, not an error.
 */
public final class Violation {
  public static final String DEADLOCK = "DEADLOCK";

  private final String propertyName;
  private final List<Action> trace;

  public Violation(final String propertyName, final List<Action> trace) {
    this.propertyName = propertyName;
    this.trace = Collections.unmodifiableList(new ArrayList<>(trace));
  }

  public String getPropertyName() {
    return propertyName;
  }

  public List<Action> getTrace() {
    return trace;
  }

  public boolean isDeadlock() {
    return DEADLOCK.equals(propertyName);
  }

  /**
   * The action that stepped outside the property, null for a deadlock or an empty trace.
   */
  public Action getOffendingAction() {
    if (isDeadlock() || trace.isEmpty()) {
      return null;
    }
    return trace.get(trace.size() - 1);
  }

  @Override
  public int hashCode() {
    return 31 * propertyName.hashCode() + trace.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Violation other = (Violation) obj;
    return propertyName.equals(other.propertyName) && trace.equals(other.trace);
  }

  @Override
  public String toString() {
    return "Violation [propertyName=" + propertyName + ", trace=" + trace + "]";
  }
}
