package com.github.concurrencia;

/**
 * Holder of statistics for a checker: how many checks it ran and what the last exploration
 * looked like.
 */
public final class CheckerStatistics {
  private final String checkerId;
  private final long startTstampMillis = System.currentTimeMillis();

  private int totalExplorations;
  private int totalSafetyChecks;
  private int totalProgressChecks;
  private int totalViolations;
  private ExplorationStatistics lastExploration;

  CheckerStatistics(final String checkerId) {
    this.checkerId = checkerId;
  }

  synchronized void explored(final ExplorationStatistics statistics) {
    totalExplorations++;
    lastExploration = statistics;
  }

  synchronized void safetyChecked(final int violations) {
    totalSafetyChecks++;
    totalViolations += violations;
  }

  synchronized void progressChecked(final boolean violated) {
    totalProgressChecks++;
    if (violated) {
      totalViolations++;
    }
  }

  public String getCheckerId() {
    return checkerId;
  }

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public synchronized int getTotalExplorations() {
    return totalExplorations;
  }

  public synchronized int getTotalSafetyChecks() {
    return totalSafetyChecks;
  }

  public synchronized int getTotalProgressChecks() {
    return totalProgressChecks;
  }

  public synchronized int getTotalViolations() {
    return totalViolations;
  }

  /**
   * Statistics of the most recent exploration, null before the first one.
   */
  public synchronized ExplorationStatistics getLastExploration() {
    return lastExploration;
  }

  @Override
  public synchronized String toString() {
    return "CheckerStatistics [checkerId=" + checkerId + ", startTstampMillis="
        + startTstampMillis + ", totalExplorations=" + totalExplorations + ", totalSafetyChecks="
        + totalSafetyChecks + ", totalProgressChecks=" + totalProgressChecks
        + ", totalViolations=" + totalViolations + ", lastExploration=" + lastExploration + "]";
  }

}
