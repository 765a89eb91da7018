package com.github.concurrencia;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The reachable state graph of a process: nodes are the distinct states reachable from the root,
 * numbered in breadth-first discovery order, edges are fired transitions. The graph also keeps
 * the breadth-first parent of every node so that {@link #traceTo(int)} yields a minimal trace.
 * 
 * A graph is immutable once the explorer hands it out.
 */
public final class ReachableGraph {
  private final String processName;
  private final List<LocalState> states;
  private final Map<LocalState, Integer> ids;
  private final List<List<Edge>> edges;
  private final int[] parents;
  private final Action[] parentActions;
  private final int transitionCount;
  private final ExplorationStatistics statistics;

  private ReachableGraph(final Builder builder, final ExplorationStatistics statistics) {
    this.processName = builder.processName;
    this.states = Collections.unmodifiableList(builder.states);
    this.ids = builder.ids;
    final List<List<Edge>> frozen = new ArrayList<>(builder.edges.size());
    for (final List<Edge> outgoing : builder.edges) {
      frozen.add(Collections.unmodifiableList(outgoing));
    }
    this.edges = Collections.unmodifiableList(frozen);
    this.parents = toIntArray(builder.parents);
    this.parentActions = builder.parentActions.toArray(new Action[builder.parentActions.size()]);
    this.transitionCount = builder.transitionCount;
    this.statistics = statistics;
  }

  public String getProcessName() {
    return processName;
  }

  public int getRoot() {
    return 0;
  }

  public int size() {
    return states.size();
  }

  public int getTransitionCount() {
    return transitionCount;
  }

  public LocalState getState(final int node) {
    return states.get(node);
  }

  public List<LocalState> getStates() {
    return states;
  }

  /**
   * Returns the node id of the given state or -1 if it is unreachable.
   */
  public int idOf(final LocalState state) {
    final Integer id = ids.get(state);
    return id == null ? -1 : id;
  }

  public List<Edge> getEdges(final int node) {
    return edges.get(node);
  }

  /**
   * The minimal sequence of actions leading from the root to the given node.
   */
  public List<Action> traceTo(final int node) {
    final List<Action> trace = new ArrayList<>();
    int current = node;
    while (current > 0) {
      trace.add(parentActions[current]);
      current = parents[current];
    }
    Collections.reverse(trace);
    return trace;
  }

  /**
   * Nodes without any outgoing transition, in discovery order.
   */
  public List<Integer> getDeadlocks() {
    final List<Integer> deadlocks = new ArrayList<>();
    for (int node = 0; node < edges.size(); node++) {
      if (edges.get(node).isEmpty()) {
        deadlocks.add(node);
      }
    }
    return deadlocks;
  }

  public ExplorationStatistics getStatistics() {
    return statistics;
  }

  @Override
  public String toString() {
    return "ReachableGraph [processName=" + processName + ", states=" + size() + ", transitions="
        + transitionCount + "]";
  }

  private static int[] toIntArray(final List<Integer> values) {
    final int[] array = new int[values.size()];
    for (int iter = 0; iter < array.length; iter++) {
      array[iter] = values.get(iter);
    }
    return array;
  }

  /**
   * A fired transition between two nodes.
   */
  public final static class Edge {
    private final int from;
    private final Action action;
    private final int to;

    Edge(final int from, final Action action, final int to) {
      this.from = from;
      this.action = action;
      this.to = to;
    }

    public int getFrom() {
      return from;
    }

    public Action getAction() {
      return action;
    }

    public int getTo() {
      return to;
    }

    @Override
    public String toString() {
      return from + " -" + action + "-> " + to;
    }
  }

  /**
   * Mutable graph under construction. Owned by a single exploring thread.
   */
  final static class Builder {
    private final String processName;
    private final List<LocalState> states = new ArrayList<>();
    private final Map<LocalState, Integer> ids = new HashMap<>();
    private final List<List<Edge>> edges = new ArrayList<>();
    private final List<Integer> parents = new ArrayList<>();
    private final List<Action> parentActions = new ArrayList<>();
    private int transitionCount;

    Builder(final String processName, final LocalState root) {
      this.processName = processName;
      add(root, -1, null);
    }

    int idOf(final LocalState state) {
      final Integer existing = ids.get(state);
      return existing == null ? -1 : existing;
    }

    void addEdge(final int from, final Action action, final int to) {
      edges.get(from).add(new Edge(from, action, to));
      transitionCount++;
    }

    int size() {
      return states.size();
    }

    int getRoot() {
      return 0;
    }

    int getTransitionCount() {
      return transitionCount;
    }

    LocalState state(final int node) {
      return states.get(node);
    }

    ReachableGraph build(final ExplorationStatistics statistics) {
      return new ReachableGraph(this, statistics);
    }

    int add(final LocalState state, final int parent, final Action action) {
      final int id = states.size();
      states.add(state);
      ids.put(state, id);
      edges.add(new ArrayList<>());
      parents.add(parent);
      parentActions.add(action);
      return id;
    }
  }
}
