package com.github.concurrencia;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Verifies a {@link SystemModel} exhaustively: every interleaving of its processes is explored,
 * nothing is simulated.
 * 
 * Notes for users:<br>
 * 1. a checker is thread-safe and holds no graph between calls. Every verification explores the
 * model afresh, so repeated calls return equal results.<br>
 * 
 * 2. safety and progress violations are results, not failures. An exception means the check could
 * not reach a verdict, eg. the state space exceeded the configured cap.<br>
 * 
 * 3. every reported trace is complete and starts at the initial state, so it can be replayed
 * against the model action by action.<br>
 */
public interface ModelChecker {

  /**
   * Check the system against all its safety properties and for deadlocks. Violations are ordered
   * by property declaration, DEADLOCK last. An empty list means the model is safe.
   */
  List<Violation> verifySafety() throws ModelCheckException;

  /**
   * Check the named progress property. Returns a witness of starvation if there is one.
   */
  Optional<Witness> verifyProgress(final String progressName) throws ModelCheckException;

  /**
   * Check every progress property of the model over a single exploration.
   */
  Map<String, Optional<Witness>> verifyAllProgress() throws ModelCheckException;

  /**
   * The reachable graph of the system alone, without property monitors.
   */
  ReachableGraph explore() throws ModelCheckException;

  /**
   * Reports the id of this checker instance.
   */
  String getId();

  CheckerConfiguration getConfiguration();

  SystemModel getModel();

  CheckerStatistics getStatistics();

  /**
   * A simple builder to let users use fluent APIs to build checkers.
   */
  public final static class ModelCheckerBuilder {
    private CheckerConfiguration config;
    private SystemModel model;

    public static ModelCheckerBuilder newBuilder() {
      return new ModelCheckerBuilder();
    }

    public ModelCheckerBuilder config(final CheckerConfiguration config) {
      this.config = config;
      return this;
    }

    public ModelCheckerBuilder model(final SystemModel model) {
      this.model = model;
      return this;
    }

    public ModelChecker build() throws ModelCheckException {
      return new ModelCheckerImpl(config != null ? config : CheckerConfiguration.defaults(), model);
    }

    private ModelCheckerBuilder() {}
  }

}
