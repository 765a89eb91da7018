package com.github.concurrencia;

/**
 * This class encapsulates all the configuration parameters for the checker. Use the
 * {@code CheckerConfigurationBuilder} to build it.
 * 
 * Notes:<br>
 * 1. If maxStates is not set, a default cap of 2 million reachable states is applied after which
 * exploration fails with STATE_EXPLOSION rather than running out of heap.<br>
 * 2. workerThreads only matters for {@link ExplorationMode#PARALLEL} and defaults to the number of
 * available processors.<br>
 */
public final class CheckerConfiguration {
  static final int defaultMaxStates = 2_000_000;

  private final int maxStates;
  private final ExplorationMode explorationMode;
  private final int workerThreads;

  public int getMaxStates() {
    return maxStates;
  }

  public ExplorationMode getExplorationMode() {
    return explorationMode;
  }

  public int getWorkerThreads() {
    return workerThreads;
  }

  public static CheckerConfiguration defaults() {
    return new CheckerConfiguration(defaultMaxStates, ExplorationMode.CALLER_THREAD,
        Runtime.getRuntime().availableProcessors());
  }

  public final static class CheckerConfigurationBuilder {
    private int maxStates = defaultMaxStates;
    private ExplorationMode explorationMode = ExplorationMode.CALLER_THREAD;
    private int workerThreads = Runtime.getRuntime().availableProcessors();

    public static CheckerConfigurationBuilder newBuilder() {
      return new CheckerConfigurationBuilder();
    }

    public CheckerConfigurationBuilder maxStates(final int maxStates) {
      this.maxStates = maxStates;
      return this;
    }

    public CheckerConfigurationBuilder explorationMode(final ExplorationMode explorationMode) {
      this.explorationMode = explorationMode;
      return this;
    }

    public CheckerConfigurationBuilder workerThreads(final int workerThreads) {
      this.workerThreads = workerThreads;
      return this;
    }

    public CheckerConfiguration build() throws ModelCheckException {
      final CheckerConfiguration config =
          new CheckerConfiguration(maxStates, explorationMode, workerThreads);
      config.validate();
      return config;
    }

    private CheckerConfigurationBuilder() {}
  }

  private void validate() throws ModelCheckException {
    StringBuilder messages = new StringBuilder();
    if (maxStates <= 0) {
      messages.append("maxStates must be positive. ");
    }
    if (explorationMode == null) {
      messages.append("ExplorationMode cannot be null. ");
    }
    if (workerThreads <= 0) {
      messages.append("workerThreads must be positive. ");
    }
    if (messages.length() > 0) {
      throw new ModelCheckException(ModelCheckException.Code.INVALID_CHECKER_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "CheckerConfiguration [maxStates=" + maxStates + ", explorationMode=" + explorationMode
        + ", workerThreads=" + workerThreads + "]";
  }

  private CheckerConfiguration(final int maxStates, final ExplorationMode explorationMode,
      final int workerThreads) {
    this.maxStates = maxStates;
    this.explorationMode = explorationMode;
    this.workerThreads = workerThreads;
  }

}
