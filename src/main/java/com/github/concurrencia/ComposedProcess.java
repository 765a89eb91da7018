package com.github.concurrencia;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The parallel composition of N processes. Shared actions fire in lock-step across every
 * participant that declares them, unshared actions and tau steps interleave freely.
 * 
 * An action is enabled in a composed state iff every participant whose alphabet contains it has
 * a transition for it from its current local state. Firing it advances exactly those participants
 * and leaves all others unchanged.
 * 
 * A composed process is itself a {@link Process}, so composites nest.
 */
public final class ComposedProcess implements Process {
  private final String name;
  private final List<String> names;
  private final Process[] participants;
  private final Set<Action> alphabet;
  // K=action, V=indices of every participant declaring it
  private final Map<Action, int[]> owners;
  private final ComposedState initialState;

  ComposedProcess(final String name, final List<String> names, final List<Process> participants) {
    this.name = name;
    this.names = Collections.unmodifiableList(new ArrayList<>(names));
    this.participants = participants.toArray(new Process[participants.size()]);

    final Set<Action> union = new LinkedHashSet<>();
    final Map<Action, List<Integer>> declaredBy = new HashMap<>();
    final LocalState[] initial = new LocalState[this.participants.length];
    for (int iter = 0; iter < this.participants.length; iter++) {
      initial[iter] = this.participants[iter].getInitialState();
      for (final Action action : this.participants[iter].getAlphabet()) {
        union.add(action);
        declaredBy.computeIfAbsent(action, k -> new ArrayList<>()).add(iter);
      }
    }
    this.alphabet = Collections.unmodifiableSet(union);
    this.owners = new HashMap<>();
    for (final Map.Entry<Action, List<Integer>> entry : declaredBy.entrySet()) {
      final int[] indices = new int[entry.getValue().size()];
      for (int iter = 0; iter < indices.length; iter++) {
        indices[iter] = entry.getValue().get(iter);
      }
      owners.put(entry.getKey(), indices);
    }
    this.initialState = new ComposedState(this.names, initial);
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public Set<Action> getAlphabet() {
    return alphabet;
  }

  @Override
  public ComposedState getInitialState() {
    return initialState;
  }

  public List<String> getParticipantNames() {
    return names;
  }

  public Process getParticipant(final String participant) {
    final int index = names.indexOf(participant);
    return index < 0 ? null : participants[index];
  }

  /**
   * Names of the participants that share the given action, empty if nobody declares it.
   */
  public List<String> sharedBy(final Action action) {
    final int[] indices = owners.get(action);
    if (indices == null) {
      return Collections.emptyList();
    }
    final List<String> sharing = new ArrayList<>(indices.length);
    for (final int index : indices) {
      sharing.add(names.get(index));
    }
    return sharing;
  }

  @Override
  public Optional<LocalState> transition(final LocalState state, final Action action) {
    final ComposedState composed = checkState(state);
    final int[] indices = owners.get(action);
    if (indices == null) {
      return Optional.empty();
    }
    final LocalState[] next = composed.components();
    for (final int index : indices) {
      final Optional<LocalState> successor = participants[index].transition(next[index], action);
      if (!successor.isPresent()) {
        return Optional.empty();
      }
      next[index] = successor.get();
    }
    return Optional.of(new ComposedState(names, next));
  }

  @Override
  public List<Transition> steps(final LocalState state) {
    final ComposedState composed = checkState(state);
    final List<Transition> steps = new ArrayList<>();
    final Set<Action> considered = new HashSet<>();
    for (int iter = 0; iter < participants.length; iter++) {
      for (final Transition local : participants[iter].steps(composed.get(iter))) {
        final Action action = local.getAction();
        if (action.isTau()) {
          steps.add(new Transition(composed, action, composed.with(iter, local.getToState())));
          continue;
        }
        if (!considered.add(action)) {
          continue;
        }
        final int[] indices = owners.get(action);
        final LocalState[] next = composed.components();
        if (indices == null) {
          next[iter] = local.getToState();
          steps.add(new Transition(composed, action, new ComposedState(names, next)));
          continue;
        }
        boolean enabled = true;
        for (final int owner : indices) {
          if (owner == iter) {
            next[owner] = local.getToState();
            continue;
          }
          final Optional<LocalState> successor =
              participants[owner].transition(next[owner], action);
          if (!successor.isPresent()) {
            enabled = false;
            break;
          }
          next[owner] = successor.get();
        }
        if (enabled) {
          steps.add(new Transition(composed, action, new ComposedState(names, next)));
        }
      }
    }
    return steps;
  }

  private ComposedState checkState(final LocalState state) {
    if (!(state instanceof ComposedState) || ((ComposedState) state).size() != participants.length) {
      throw new IllegalArgumentException(
          "State " + (state == null ? null : state.describe()) + " does not belong to " + name);
    }
    return (ComposedState) state;
  }

  @Override
  public String toString() {
    return "ComposedProcess [name=" + name + ", participants=" + names + ", alphabet="
        + alphabet.size() + " actions]";
  }
}
