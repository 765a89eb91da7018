package com.github.concurrencia;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Checks a process against safety properties by composing it with a {@link PropertyProcess}
 * monitor per property and exploring the product. A violation is any reachable product state in
 * which a monitor sits in ERROR, ie. the process fired an action the property could not follow
 * there. Every reachable state without enabled actions is a deadlock.
 * 
 * Node ids of the product graph follow breadth-first discovery order, so the lowest id showing a
 * violation yields a minimal counterexample.
 */
public final class SafetyChecker {
  private static final Logger logger = LogManager.getLogger(SafetyChecker.class.getSimpleName());

  private final StateSpaceExplorer explorer;

  public SafetyChecker(final StateSpaceExplorer explorer) {
    this.explorer = explorer;
  }

  /**
   * Violations of the given properties plus the first deadlock, if any. Properties are reported in
   * the given order, DEADLOCK last.
   */
  public List<Violation> check(final Process process, final List<Process> properties)
      throws ModelCheckException {
    final ReachableGraph graph = explore(process, properties);
    return violations(graph, properties);
  }

  /**
   * Explore the product of the process and one monitor per property. The process is participant
   * 0, the monitors follow in the given order.
   */
  public ReachableGraph explore(final Process process, final List<Process> properties)
      throws ModelCheckException {
    final Composition product = Composition.newBuilder("SAFETY(" + process.getName() + ")")
        .participant(process.getName(), process);
    for (final Process property : properties) {
      product.participant(property.getName(), new PropertyProcess(property));
    }
    return explorer.explore(product.build());
  }

  public List<Violation> violations(final ReachableGraph graph, final List<Process> properties) {
    final List<Violation> violations = new ArrayList<>();
    final int[] firstError = new int[properties.size()];
    Arrays.fill(firstError, -1);
    int firstDeadlock = -1;
    int pending = properties.size();
    for (int node = 0; node < graph.size() && (pending > 0 || firstDeadlock < 0); node++) {
      final ComposedState state = (ComposedState) graph.getState(node);
      for (int iter = 0; iter < properties.size(); iter++) {
        if (firstError[iter] < 0 && state.get(iter + 1) == PropertyProcess.ERROR) {
          firstError[iter] = node;
          pending--;
        }
      }
      if (firstDeadlock < 0 && graph.getEdges(node).isEmpty()) {
        firstDeadlock = node;
      }
    }
    for (int iter = 0; iter < properties.size(); iter++) {
      if (firstError[iter] >= 0) {
        final Violation violation =
            new Violation(properties.get(iter).getName(), graph.traceTo(firstError[iter]));
        logger.warn("Safety property violated: " + violation);
        violations.add(violation);
      }
    }
    if (firstDeadlock >= 0) {
      final Violation deadlock = new Violation(Violation.DEADLOCK, graph.traceTo(firstDeadlock));
      logger.warn("Deadlock reachable: " + deadlock);
      violations.add(deadlock);
    }
    if (violations.isEmpty()) {
      logger.info(String.format("No safety violations in %d states of %s", graph.size(),
          graph.getProcessName()));
    }
    return violations;
  }
}
