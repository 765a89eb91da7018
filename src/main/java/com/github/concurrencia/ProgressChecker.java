package com.github.concurrencia;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.concurrencia.ReachableGraph.Edge;

/**
 * Checks progress properties over a reachable graph. The graph is split into strongly connected
 * components; a component no edge leaves is a terminal set, and a non-trivial terminal set (more
 * than one state, or one state with a self-loop) lacking every target action is a progress
 * violation: once there, the system loops forever without performing the required action.
 * 
 * Terminal sets are computed once per checker and shared by all properties checked with it.
 */
public final class ProgressChecker {
  private static final Logger logger = LogManager.getLogger(ProgressChecker.class.getSimpleName());

  private final ReachableGraph graph;
  private List<int[]> terminalSets;

  public ProgressChecker(final ReachableGraph graph) {
    this.graph = graph;
  }

  public Optional<Witness> check(final ProgressProperty property) {
    for (final int[] terminalSet : getTerminalSets()) {
      if (!containsTarget(terminalSet, property)) {
        final Witness witness = witness(terminalSet, property);
        logger.warn("Progress violation: " + witness);
        return Optional.of(witness);
      }
    }
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("Progress %s holds in %d terminal sets of %s", property.getName(),
          getTerminalSets().size(), graph.getProcessName()));
    }
    return Optional.empty();
  }

  /**
   * Non-trivial terminal sets ordered by their lowest node id, each sorted ascending.
   */
  public synchronized List<int[]> getTerminalSets() {
    if (terminalSets == null) {
      terminalSets = Collections.unmodifiableList(computeTerminalSets());
    }
    return terminalSets;
  }

  private boolean containsTarget(final int[] terminalSet, final ProgressProperty property) {
    for (final int node : terminalSet) {
      for (final Edge edge : graph.getEdges(node)) {
        if (property.isSatisfiedBy(edge.getAction())) {
          return true;
        }
      }
    }
    return false;
  }

  private Witness witness(final int[] terminalSet, final ProgressProperty property) {
    final int entry = terminalSet[0];
    final Set<Action> actions = new TreeSet<>();
    for (final int node : terminalSet) {
      for (final Edge edge : graph.getEdges(node)) {
        actions.add(edge.getAction());
      }
    }
    return new Witness(property.getName(), property.getTargetActions(), graph.traceTo(entry),
        cycleThrough(entry), actions);
  }

  /**
   * Shortest closed walk leaving and re-entering the given node. Only called for nodes of a
   * non-trivial terminal set, so such a walk exists and stays inside the set.
   */
  private List<Action> cycleThrough(final int entry) {
    final int[] parents = new int[graph.size()];
    final Action[] parentActions = new Action[graph.size()];
    Arrays.fill(parents, -2);
    final Deque<Integer> pending = new ArrayDeque<>();
    pending.add(entry);
    parents[entry] = -1;
    while (!pending.isEmpty()) {
      final int node = pending.poll();
      for (final Edge edge : graph.getEdges(node)) {
        if (edge.getTo() == entry) {
          final List<Action> cycle = new ArrayList<>();
          cycle.add(edge.getAction());
          for (int current = node; current != entry; current = parents[current]) {
            cycle.add(parentActions[current]);
          }
          Collections.reverse(cycle);
          return cycle;
        }
        if (parents[edge.getTo()] == -2) {
          parents[edge.getTo()] = node;
          parentActions[edge.getTo()] = edge.getAction();
          pending.add(edge.getTo());
        }
      }
    }
    throw new IllegalStateException("Node " + entry + " is not on a cycle");
  }

  /**
   * Iterative Tarjan, the graphs are far too deep for recursion.
   */
  private List<int[]> computeTerminalSets() {
    final int size = graph.size();
    final int[] index = new int[size];
    final int[] lowLink = new int[size];
    final int[] component = new int[size];
    final boolean[] onStack = new boolean[size];
    Arrays.fill(index, -1);
    Arrays.fill(component, -1);
    final int[] stack = new int[size];
    int stackTop = 0;
    final int[] callNodes = new int[size];
    final int[] callEdges = new int[size];
    int nextIndex = 0;
    final List<int[]> components = new ArrayList<>();

    for (int start = 0; start < size; start++) {
      if (index[start] >= 0) {
        continue;
      }
      int depth = 0;
      callNodes[0] = start;
      callEdges[0] = 0;
      index[start] = lowLink[start] = nextIndex++;
      stack[stackTop++] = start;
      onStack[start] = true;
      while (depth >= 0) {
        final int node = callNodes[depth];
        final List<Edge> edges = graph.getEdges(node);
        if (callEdges[depth] < edges.size()) {
          final int next = edges.get(callEdges[depth]++).getTo();
          if (index[next] < 0) {
            index[next] = lowLink[next] = nextIndex++;
            stack[stackTop++] = next;
            onStack[next] = true;
            depth++;
            callNodes[depth] = next;
            callEdges[depth] = 0;
          } else if (onStack[next]) {
            lowLink[node] = Math.min(lowLink[node], index[next]);
          }
          continue;
        }
        if (lowLink[node] == index[node]) {
          final List<Integer> members = new ArrayList<>();
          int member;
          do {
            member = stack[--stackTop];
            onStack[member] = false;
            component[member] = components.size();
            members.add(member);
          } while (member != node);
          final int[] sorted = new int[members.size()];
          for (int iter = 0; iter < sorted.length; iter++) {
            sorted[iter] = members.get(iter);
          }
          Arrays.sort(sorted);
          components.add(sorted);
        }
        depth--;
        if (depth >= 0) {
          final int parent = callNodes[depth];
          lowLink[parent] = Math.min(lowLink[parent], lowLink[node]);
        }
      }
    }

    final List<int[]> terminal = new ArrayList<>();
    for (int iter = 0; iter < components.size(); iter++) {
      final int[] members = components.get(iter);
      boolean closed = true;
      boolean cyclic = members.length > 1;
      for (final int node : members) {
        for (final Edge edge : graph.getEdges(node)) {
          if (component[edge.getTo()] != iter) {
            closed = false;
          } else if (edge.getTo() == node) {
            cyclic = true;
          }
        }
      }
      if (closed && cyclic) {
        terminal.add(members);
      }
    }
    Collections.sort(terminal, (left, right) -> Integer.compare(left[0], right[0]));
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("%s has %d components, %d non-trivial terminal sets",
          graph.getProcessName(), components.size(), terminal.size()));
    }
    return terminal;
  }
}
