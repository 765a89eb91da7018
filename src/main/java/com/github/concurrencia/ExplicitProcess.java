package com.github.concurrencia;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.github.concurrencia.ModelCheckException.Code;

/**
 * A table driven process. The table is fully hydrated once by the {@link ProcessBuilder} and
 * never modified afterwards.
 */
public final class ExplicitProcess implements Process {
  private final String name;
  private final Set<Action> alphabet;
  private final LocalState initialState;

  // K=fromState, V=(K=action, V=toState); insertion ordered to keep steps() deterministic
  private final Map<LocalState, Map<Action, LocalState>> transitionTable;

  private ExplicitProcess(final String name, final Set<Action> alphabet,
      final LocalState initialState,
      final Map<LocalState, Map<Action, LocalState>> transitionTable) {
    this.name = name;
    this.alphabet = Collections.unmodifiableSet(alphabet);
    this.initialState = initialState;
    this.transitionTable = transitionTable;
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
  public LocalState getInitialState() {
    return initialState;
  }

  @Override
  public Optional<LocalState> transition(final LocalState state, final Action action) {
    final Map<Action, LocalState> outgoing = transitionTable.get(state);
    if (outgoing == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(outgoing.get(action));
  }

  @Override
  public List<Transition> steps(final LocalState state) {
    final Map<Action, LocalState> outgoing = transitionTable.get(state);
    if (outgoing == null || outgoing.isEmpty()) {
      return Collections.emptyList();
    }
    final List<Transition> steps = new ArrayList<>(outgoing.size());
    for (final Map.Entry<Action, LocalState> entry : outgoing.entrySet()) {
      steps.add(new Transition(state, entry.getKey(), entry.getValue()));
    }
    return steps;
  }

  /**
   * All local states mentioned by the table, in insertion order.
   */
  public Set<LocalState> getStates() {
    final Set<LocalState> states = new LinkedHashSet<>();
    states.add(initialState);
    for (final Map.Entry<LocalState, Map<Action, LocalState>> entry : transitionTable.entrySet()) {
      states.add(entry.getKey());
      states.addAll(entry.getValue().values());
    }
    return states;
  }

  /**
   * All transitions of the table, in insertion order.
   */
  public List<Transition> getTransitions() {
    final List<Transition> transitions = new ArrayList<>();
    for (final LocalState state : transitionTable.keySet()) {
      transitions.addAll(steps(state));
    }
    return transitions;
  }

  /**
   * Start a builder pre-loaded with this process's alphabet, initial state and table.
   */
  public ProcessBuilder toBuilder() {
    final ProcessBuilder builder = ProcessBuilder.newBuilder(name).initial(initialState);
    builder.alphabet(alphabet);
    for (final Transition transition : getTransitions()) {
      builder.transitions.add(transition);
    }
    return builder;
  }

  @Override
  public String toString() {
    return "ExplicitProcess [name=" + name + ", alphabet=" + alphabet + ", states="
        + getStates().size() + "]";
  }

  /**
   * A simple builder to let users use fluent APIs to build explicit processes.
   */
  public final static class ProcessBuilder {
    private final String name;
    private LocalState initialState;
    private final Set<Action> alphabet = new LinkedHashSet<>();
    private final List<Transition> transitions = new ArrayList<>();

    public static ProcessBuilder newBuilder(final String name) {
      return new ProcessBuilder(name);
    }

    public ProcessBuilder initial(final LocalState initialState) {
      this.initialState = initialState;
      return this;
    }

    public ProcessBuilder transition(final LocalState fromState, final Action action,
        final LocalState toState) {
      this.transitions.add(new Transition(fromState, action, toState));
      return this;
    }

    /**
     * Declare actions the process participates in without necessarily having a transition for
     * them. Declared-but-never-enabled actions block in any composition.
     */
    public ProcessBuilder alphabet(final Iterable<Action> actions) {
      for (final Action action : actions) {
        this.alphabet.add(action);
      }
      return this;
    }

    public ProcessBuilder alphabet(final Action... actions) {
      for (final Action action : actions) {
        this.alphabet.add(action);
      }
      return this;
    }

    /**
     * Drop every transition out of the given state on the given action. Handy to derive a
     * variant of an existing process; the action stays in the alphabet.
     */
    public ProcessBuilder withoutTransition(final LocalState fromState, final Action action) {
      final List<Transition> kept = new ArrayList<>(transitions.size());
      for (final Transition transition : transitions) {
        if (!(transition.getFromState().equals(fromState)
            && transition.getAction().equals(action))) {
          kept.add(transition);
        }
      }
      transitions.clear();
      transitions.addAll(kept);
      return this;
    }

    public ExplicitProcess build() throws ModelCheckException {
      if (name == null || name.trim().isEmpty()) {
        throw new ModelCheckException(Code.INVALID_PROCESS, "Process name cannot be blank");
      }
      if (initialState == null) {
        throw new ModelCheckException(Code.INVALID_STATE,
            "Process " + name + " has no initial state");
      }
      final Set<Action> fullAlphabet = new LinkedHashSet<>(alphabet);
      if (fullAlphabet.contains(Action.TAU)) {
        throw new ModelCheckException(Code.INVALID_ACTION,
            "Process " + name + " cannot declare tau in its alphabet");
      }
      final Map<LocalState, Map<Action, LocalState>> table = new LinkedHashMap<>();
      for (final Transition transition : transitions) {
        final Action action = transition.getAction();
        if (action.isTau()) {
          throw new ModelCheckException(Code.INVALID_ACTION,
              "Process " + name + " cannot declare tau transitions, use hiding instead");
        }
        fullAlphabet.add(action);
        final Map<Action, LocalState> outgoing =
            table.computeIfAbsent(transition.getFromState(), k -> new LinkedHashMap<>());
        final LocalState existing = outgoing.putIfAbsent(action, transition.getToState());
        if (existing != null && !existing.equals(transition.getToState())) {
          throw new ModelCheckException(Code.AMBIGUOUS_TRANSITION,
              String.format("Process %s yields both %s and %s for action %s in state %s", name,
                  existing.describe(), transition.getToState().describe(), action,
                  transition.getFromState().describe()));
        }
      }
      return new ExplicitProcess(name.trim(), fullAlphabet, initialState, table);
    }

    private ProcessBuilder(final String name) {
      this.name = name;
    }
  }

}
