package com.github.concurrencia;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import com.github.concurrencia.ExplicitProcess.ProcessBuilder;
import com.github.concurrencia.ModelCheckException.Code;

/**
 * Builds an {@link ExplicitProcess} out of guarded rules of the form
 * {@code when guard: action -> update}, the way parameterized FSP processes are written eg.
 * {@code COUNTER[i:0..N] = (when (i<N) arrive -> COUNTER[i+1] | ...)}.
 * 
 * The builder walks every local state reachable from the initial one and resolves guards into
 * explicit table entries. Rules with identical guards but distinct actions are alternate
 * transitions. Two enabled rules for the same action that disagree on the successor make the
 * process ambiguous and fail the build.
 */
public final class GuardedProcessBuilder<S extends LocalState> {
  private static final int maxLocalStates = 100_000;

  private final String name;
  private final Class<S> stateType;
  private S initialState;
  private final List<Action> declared = new ArrayList<>();
  private final List<Rule<S>> rules = new ArrayList<>();

  public static <S extends LocalState> GuardedProcessBuilder<S> newBuilder(final String name,
      final Class<S> stateType) {
    return new GuardedProcessBuilder<>(name, stateType);
  }

  public GuardedProcessBuilder<S> initial(final S initialState) {
    this.initialState = initialState;
    return this;
  }

  public GuardedProcessBuilder<S> alphabet(final Action... actions) {
    for (final Action action : actions) {
      declared.add(action);
    }
    return this;
  }

  public GuardedProcessBuilder<S> rule(final Predicate<S> guard, final Action action,
      final UnaryOperator<S> update) {
    rules.add(new Rule<>(guard, action, update));
    return this;
  }

  public ExplicitProcess build() throws ModelCheckException {
    if (initialState == null) {
      throw new ModelCheckException(Code.INVALID_STATE,
          "Guarded process " + name + " has no initial state");
    }
    final ProcessBuilder builder = ProcessBuilder.newBuilder(name).initial(initialState);
    builder.alphabet(declared);
    for (final Rule<S> rule : rules) {
      builder.alphabet(rule.action);
    }
    final Set<S> visited = new HashSet<>();
    final Deque<S> pending = new ArrayDeque<>();
    visited.add(initialState);
    pending.add(initialState);
    while (!pending.isEmpty()) {
      final S state = pending.poll();
      for (final Rule<S> rule : rules) {
        if (!rule.guard.test(state)) {
          continue;
        }
        final S next = rule.update.apply(state);
        if (next == null || !stateType.isInstance(next)) {
          throw new ModelCheckException(Code.INVALID_STATE, String.format(
              "Process %s produced an invalid successor for action %s", name, rule.action));
        }
        builder.transition(state, rule.action, next);
        if (visited.add(next)) {
          if (visited.size() > maxLocalStates) {
            throw new ModelCheckException(Code.INVALID_PROCESS,
                "Process " + name + " has more than " + maxLocalStates + " local states");
          }
          pending.add(next);
        }
      }
    }
    return builder.build();
  }

  private GuardedProcessBuilder(final String name, final Class<S> stateType) {
    this.name = name;
    this.stateType = stateType;
  }

  private static final class Rule<S> {
    private final Predicate<S> guard;
    private final Action action;
    private final UnaryOperator<S> update;

    private Rule(final Predicate<S> guard, final Action action, final UnaryOperator<S> update) {
      this.guard = guard;
      this.action = action;
      this.update = update;
    }
  }
}
