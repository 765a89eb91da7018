package com.github.concurrencia;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.concurrencia.ModelCheckException.Code;

/**
 * Default {@link ModelChecker}. Safety is checked over the product of the system and its property
 * monitors, progress over the graph of the system alone.
 */
public final class ModelCheckerImpl implements ModelChecker {
  private static final Logger logger = LogManager.getLogger(ModelCheckerImpl.class.getSimpleName());

  private final String checkerId = UUID.randomUUID().toString();
  private final CheckerConfiguration config;
  private final SystemModel model;
  private final StateSpaceExplorer explorer;
  private final CheckerStatistics statistics;

  ModelCheckerImpl(final CheckerConfiguration config, final SystemModel model)
      throws ModelCheckException {
    if (model == null) {
      throw new ModelCheckException(Code.INVALID_PROCESS, "Cannot check without a model");
    }
    this.config = config;
    this.model = model;
    this.explorer = new StateSpaceExplorer(config);
    this.statistics = new CheckerStatistics(checkerId);
    logInfo(checkerId, null, "Fired up checker for " + model + " with " + config);
  }

  @Override
  public List<Violation> verifySafety() throws ModelCheckException {
    logInfo(checkerId, null, "Checking " + model.getSafetyProperties().size()
        + " safety properties and deadlock freedom");
    final SafetyChecker checker = new SafetyChecker(explorer);
    final ReachableGraph graph;
    try {
      graph = checker.explore(model.getSystem(), model.getSafetyProperties());
    } catch (ModelCheckException problem) {
      logError(checkerId, null, "Safety check failed", problem);
      throw problem;
    }
    statistics.explored(graph.getStatistics());
    final List<Violation> violations = checker.violations(graph, model.getSafetyProperties());
    statistics.safetyChecked(violations.size());
    logInfo(checkerId, null, String.format("Safety check found %d violations in %d states",
        violations.size(), graph.size()));
    return violations;
  }

  @Override
  public Optional<Witness> verifyProgress(final String progressName)
      throws ModelCheckException {
    final ProgressProperty property = model.getProgressProperties().get(progressName);
    if (property == null) {
      logError(checkerId, progressName, "Unknown progress property, known ones are "
          + model.getProgressProperties().keySet(), null);
      throw new ModelCheckException(Code.UNKNOWN_PROGRESS_PROPERTY,
          "No progress property named " + progressName);
    }
    final ProgressChecker checker = new ProgressChecker(explore());
    return check(checker, property);
  }

  @Override
  public Map<String, Optional<Witness>> verifyAllProgress() throws ModelCheckException {
    final ProgressChecker checker = new ProgressChecker(explore());
    final Map<String, Optional<Witness>> results = new LinkedHashMap<>();
    for (final ProgressProperty property : model.getProgressProperties().values()) {
      results.put(property.getName(), check(checker, property));
    }
    return results;
  }

  @Override
  public ReachableGraph explore() throws ModelCheckException {
    final ReachableGraph graph;
    try {
      graph = explorer.explore(model.getSystem());
    } catch (ModelCheckException problem) {
      logError(checkerId, null, "Exploration failed", problem);
      throw problem;
    }
    statistics.explored(graph.getStatistics());
    logDebug(checkerId, null, "Explored " + graph);
    return graph;
  }

  private Optional<Witness> check(final ProgressChecker checker,
      final ProgressProperty property) {
    final Optional<Witness> witness = checker.check(property);
    statistics.progressChecked(witness.isPresent());
    logInfo(checkerId, property.getName(),
        witness.isPresent() ? "Progress violated" : "Progress holds");
    return witness;
  }

  @Override
  public String getId() {
    return checkerId;
  }

  @Override
  public CheckerConfiguration getConfiguration() {
    return config;
  }

  @Override
  public SystemModel getModel() {
    return model;
  }

  @Override
  public CheckerStatistics getStatistics() {
    return statistics;
  }

  private static void logError(final String checkerId, final String property, final String message,
      final Throwable problem) {
    logger.error(new StringBuilder().append("[m:").append(checkerId).append("][p:")
        .append(property).append("] ").append(message).toString(), problem);
  }

  private static void logInfo(final String checkerId, final String property, final String message) {
    logger.info(new StringBuilder().append("[m:").append(checkerId).append("][p:").append(property)
        .append("] ").append(message).toString());
  }

  private static void logDebug(final String checkerId, final String property,
      final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(checkerId).append("][p:")
          .append(property).append("] ").append(message).toString());
    }
  }
}
