package com.github.concurrencia;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.concurrencia.ModelCheckException.Code;

/**
 * Breadth-first exploration of the reachable state space with structural deduplication.
 * 
 * Notes:<br>
 * 1. exploration either completes with the full graph or fails; a partial graph is never handed
 * out<br>
 * 
 * 2. in {@link ExplorationMode#PARALLEL}, successors of a whole layer are computed by worker
 * threads, then the layer is merged on the caller thread in frontier order. The visited set is
 * only ever touched by the caller thread, so node ids and traces match the sequential run
 * exactly<br>
 */
public final class StateSpaceExplorer {
  private static final Logger logger =
      LogManager.getLogger(StateSpaceExplorer.class.getSimpleName());

  // frontier slices smaller than this are not worth handing to a worker
  private final static int minSliceSize = 64;

  private final CheckerConfiguration config;

  public StateSpaceExplorer(final CheckerConfiguration config) {
    this.config = config;
  }

  public ReachableGraph explore(final Process process) throws ModelCheckException {
    return explore(process.getName(), process.getInitialState(), state -> process.steps(state));
  }

  public ReachableGraph explore(final String name, final LocalState root,
      final Function<LocalState, List<Transition>> successors) throws ModelCheckException {
    if (root == null) {
      throw new ModelCheckException(Code.INVALID_STATE, "Cannot explore " + name + " from null");
    }
    final long startMillis = System.currentTimeMillis();
    final ReachableGraph.Builder graph = new ReachableGraph.Builder(name, root);
    final ExecutorService workers = config.getExplorationMode() == ExplorationMode.PARALLEL
        ? Executors.newFixedThreadPool(config.getWorkerThreads(), new WorkerThreadFactory(name))
        : null;
    int depth = 0;
    try {
      List<Integer> frontier = new ArrayList<>();
      frontier.add(graph.getRoot());
      while (!frontier.isEmpty()) {
        final List<List<Transition>> expanded = workers == null
            ? expandOnCallerThread(graph, frontier, successors)
            : expandOnWorkers(workers, graph, frontier, successors);
        final List<Integer> nextFrontier = new ArrayList<>();
        for (int iter = 0; iter < frontier.size(); iter++) {
          final int from = frontier.get(iter);
          for (final Transition transition : expanded.get(iter)) {
            int to = graph.idOf(transition.getToState());
            if (to < 0) {
              if (graph.size() >= config.getMaxStates()) {
                logger.error(String.format("Exploration of %s exceeded %d states at depth %d",
                    name, config.getMaxStates(), depth));
                throw new ModelCheckException(Code.STATE_EXPLOSION, String.format(
                    "Exploration of %s exceeded the cap of %d states", name,
                    config.getMaxStates()));
              }
              to = graph.add(transition.getToState(), from, transition.getAction());
              nextFrontier.add(to);
            }
            graph.addEdge(from, transition.getAction(), to);
          }
        }
        if (!nextFrontier.isEmpty()) {
          depth++;
        }
        if (logger.isDebugEnabled()) {
          logger.debug(String.format("%s layer %d: frontier=%d, states=%d", name, depth,
              nextFrontier.size(), graph.size()));
        }
        frontier = nextFrontier;
      }
    } finally {
      if (workers != null) {
        workers.shutdownNow();
      }
    }
    final ExplorationStatistics statistics =
        new ExplorationStatistics(name, config.getExplorationMode(), graph.size(),
            graph.getTransitionCount(), depth, System.currentTimeMillis() - startMillis);
    logger.info("Explored " + statistics);
    return graph.build(statistics);
  }

  private static List<List<Transition>> expandOnCallerThread(final ReachableGraph.Builder graph,
      final List<Integer> frontier, final Function<LocalState, List<Transition>> successors) {
    final List<List<Transition>> expanded = new ArrayList<>(frontier.size());
    for (final int node : frontier) {
      expanded.add(successors.apply(graph.state(node)));
    }
    return expanded;
  }

  private List<List<Transition>> expandOnWorkers(final ExecutorService workers,
      final ReachableGraph.Builder graph, final List<Integer> frontier,
      final Function<LocalState, List<Transition>> successors) throws ModelCheckException {
    if (frontier.size() < minSliceSize) {
      return expandOnCallerThread(graph, frontier, successors);
    }
    final int slices = Math.min(config.getWorkerThreads(),
        (frontier.size() + minSliceSize - 1) / minSliceSize);
    final int sliceSize = (frontier.size() + slices - 1) / slices;
    final List<Callable<List<List<Transition>>>> tasks = new ArrayList<>(slices);
    for (int start = 0; start < frontier.size(); start += sliceSize) {
      final List<LocalState> slice = new ArrayList<>(sliceSize);
      for (final int node : frontier.subList(start, Math.min(start + sliceSize, frontier.size()))) {
        slice.add(graph.state(node));
      }
      tasks.add(new Callable<List<List<Transition>>>() {
        @Override
        public List<List<Transition>> call() {
          final List<List<Transition>> expanded = new ArrayList<>(slice.size());
          for (final LocalState state : slice) {
            expanded.add(successors.apply(state));
          }
          return expanded;
        }
      });
    }
    final List<List<Transition>> expanded = new ArrayList<>(frontier.size());
    try {
      // invokeAll is the per-layer barrier
      for (final Future<List<List<Transition>>> result : workers.invokeAll(tasks)) {
        expanded.addAll(result.get());
      }
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new ModelCheckException(Code.INTERRUPTED, exception);
    } catch (ExecutionException exception) {
      if (exception.getCause() instanceof RuntimeException) {
        throw (RuntimeException) exception.getCause();
      }
      throw new ModelCheckException(Code.UNKNOWN_FAILURE, exception.getCause());
    }
    return expanded;
  }

  private static final class WorkerThreadFactory implements ThreadFactory {
    private final String name;
    private final AtomicInteger counter = new AtomicInteger();

    private WorkerThreadFactory(final String name) {
      this.name = name;
    }

    @Override
    public Thread newThread(final Runnable runnable) {
      final Thread worker =
          new Thread(runnable, "explorer-" + name + "-" + counter.incrementAndGet());
      worker.setDaemon(true);
      return worker;
    }
  }
}
