package com.github.concurrencia;

/**
 * An immutable labelled edge fromState -action-> toState. Transitions are stateless values, the
 * same transition may be reported by any number of processes or graphs.
 */
public final class Transition {
  private final LocalState fromState;
  private final Action action;
  private final LocalState toState;

  public Transition(final LocalState fromState, final Action action, final LocalState toState) {
    if (fromState == null || action == null || toState == null) {
      throw new IllegalArgumentException("Transition endpoints and action cannot be null");
    }
    this.fromState = fromState;
    this.action = action;
    this.toState = toState;
  }

  public LocalState getFromState() {
    return fromState;
  }

  public Action getAction() {
    return action;
  }

  public LocalState getToState() {
    return toState;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + fromState.hashCode();
    result = prime * result + action.hashCode();
    result = prime * result + toState.hashCode();
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
    Transition other = (Transition) obj;
    return fromState.equals(other.fromState) && action.equals(other.action)
        && toState.equals(other.toState);
  }

  @Override
  public String toString() {
    return "Transition [" + fromState.describe() + " -" + action + "-> " + toState.describe()
        + "]";
  }
}
