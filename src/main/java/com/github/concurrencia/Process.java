package com.github.concurrencia;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A finite-state process: an alphabet, an initial local state and a guarded transition relation.
 * 
 * Notes for implementors:<br>
 * 1. processes are purely functional over their own local state, there is no hidden state beyond
 * what the {@link LocalState} encodes<br>
 * 
 * 2. the alphabet lists every action the process may ever participate in, including actions it
 * has no transition for in some (or all) of its states. Composition relies on this to know where
 * a process blocks an action<br>
 * 
 * 3. visible transitions are deterministic: every (state, action) pair maps to at most one
 * successor. Only {@link Action#TAU} steps produced by hiding may branch<br>
 */
public interface Process {

  String getName();

  /**
   * All visible actions this process declares. Never contains {@link Action#TAU}.
   */
  Set<Action> getAlphabet();

  LocalState getInitialState();

  /**
   * Returns the successor if a rule for the given visible action is enabled in the given state,
   * else empty.
   */
  Optional<LocalState> transition(final LocalState state, final Action action);

  /**
   * Every transition enabled in the given state, tau steps included, in a deterministic order.
   */
  List<Transition> steps(final LocalState state);

}
