package com.github.concurrencia;

/**
 * This represents the mode used by the explorer to expand the reachable state space.
 */
public enum ExplorationMode {
  // expand every state on the caller thread.
  CALLER_THREAD,
  // expand each breadth-first layer on a pool of worker threads and merge the layer on the caller
  // thread. Produces the very same graph as CALLER_THREAD.
  PARALLEL;
}
