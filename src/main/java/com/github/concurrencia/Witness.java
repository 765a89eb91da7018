package com.github.concurrencia;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * This object encapsulates a failed progress check: a terminal set of states the system can loop
 * in forever without ever performing one of the target actions.
 * 
 * {@link #getPrefixTrace()} leads from the initial state into the terminal set,
 * {@link #getCycleTrace()} is a non-empty closed walk inside it starting and ending at the state
 * the prefix reaches.
 */
public final class Witness {
  private final String progressName;
  private final Set<Action> targetActions;
  private final List<Action> prefixTrace;
  private final List<Action> cycleTrace;
  private final Set<Action> actionsInTerminalSet;

  public Witness(final String progressName, final Set<Action> targetActions,
      final List<Action> prefixTrace, final List<Action> cycleTrace,
      final Set<Action> actionsInTerminalSet) {
    this.progressName = progressName;
    this.targetActions = Collections.unmodifiableSet(new LinkedHashSet<>(targetActions));
    this.prefixTrace = Collections.unmodifiableList(new ArrayList<>(prefixTrace));
    this.cycleTrace = Collections.unmodifiableList(new ArrayList<>(cycleTrace));
    this.actionsInTerminalSet = Collections.unmodifiableSet(new TreeSet<>(actionsInTerminalSet));
  }

  public String getProgressName() {
    return progressName;
  }

  public Set<Action> getTargetActions() {
    return targetActions;
  }

  public List<Action> getPrefixTrace() {
    return prefixTrace;
  }

  public List<Action> getCycleTrace() {
    return cycleTrace;
  }

  public Set<Action> getActionsInTerminalSet() {
    return actionsInTerminalSet;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = progressName.hashCode();
    result = prime * result + prefixTrace.hashCode();
    result = prime * result + cycleTrace.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Witness other = (Witness) obj;
    return progressName.equals(other.progressName) && targetActions.equals(other.targetActions)
        && prefixTrace.equals(other.prefixTrace) && cycleTrace.equals(other.cycleTrace)
        && actionsInTerminalSet.equals(other.actionsInTerminalSet);
  }

  @Override
  public String toString() {
    return "Witness [progressName=" + progressName + ", targetActions=" + targetActions
        + ", prefixTrace=" + prefixTrace + ", cycleTrace=" + cycleTrace
        + ", actionsInTerminalSet=" + actionsInTerminalSet + "]";
  }
}
