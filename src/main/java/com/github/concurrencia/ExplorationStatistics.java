package com.github.concurrencia;

/**
 * Simple statistics holder for one exploration run.
 */
public final class ExplorationStatistics {
  private final String processName;
  private final ExplorationMode mode;
  private final int states;
  private final int transitions;
  private final int depth;
  private final long elapsedMillis;

  ExplorationStatistics(final String processName, final ExplorationMode mode, final int states,
      final int transitions, final int depth, final long elapsedMillis) {
    this.processName = processName;
    this.mode = mode;
    this.states = states;
    this.transitions = transitions;
    this.depth = depth;
    this.elapsedMillis = elapsedMillis;
  }

  public String getProcessName() {
    return processName;
  }

  public ExplorationMode getMode() {
    return mode;
  }

  public int getStates() {
    return states;
  }

  public int getTransitions() {
    return transitions;
  }

  /**
   * Number of breadth-first layers below the root.
   */
  public int getDepth() {
    return depth;
  }

  public long getElapsedMillis() {
    return elapsedMillis;
  }

  @Override
  public String toString() {
    return "ExplorationStatistics [processName=" + processName + ", mode=" + mode + ", states="
        + states + ", transitions=" + transitions + ", depth=" + depth + ", elapsedMillis="
        + elapsedMillis + "]";
  }
}
