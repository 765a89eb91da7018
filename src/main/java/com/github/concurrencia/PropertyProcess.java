package com.github.concurrencia;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Monitor wrapper turning a property automaton into a non-blocking participant. Whenever the
 * monitored process fires an action of the property's alphabet that the property has no
 * transition for, the monitor moves to the absorbing {@link #ERROR} state instead of blocking.
 * 
 * The monitor never proposes actions on its own, it only follows what the other participants of
 * the composition fire.
 */
public final class PropertyProcess implements Process {
  public static final LocalState ERROR = new ErrorState();

  private final Process property;

  public PropertyProcess(final Process property) {
    this.property = property;
  }

  public Process getProperty() {
    return property;
  }

  @Override
  public String getName() {
    return property.getName();
  }

  @Override
  public Set<Action> getAlphabet() {
    return property.getAlphabet();
  }

  @Override
  public LocalState getInitialState() {
    return property.getInitialState();
  }

  @Override
  public Optional<LocalState> transition(final LocalState state, final Action action) {
    if (!property.getAlphabet().contains(action)) {
      return Optional.empty();
    }
    if (state == ERROR) {
      return Optional.of(ERROR);
    }
    final Optional<LocalState> next = property.transition(state, action);
    return next.isPresent() ? next : Optional.of(ERROR);
  }

  @Override
  public List<Transition> steps(final LocalState state) {
    return Collections.emptyList();
  }

  private static final class ErrorState implements LocalState {
    @Override
    public String describe() {
      return "ERROR";
    }

    @Override
    public String toString() {
      return "ERROR";
    }
  }
}
