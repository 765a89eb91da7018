package com.github.concurrencia;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.github.concurrencia.ExplicitProcess.ProcessBuilder;
import com.github.concurrencia.ModelCheckException.Code;

/**
 * Label level operators over processes: relabeling, hiding and alphabet extension. None of them
 * alters the transition semantics of the underlying process.
 */
public final class Processes {

  private Processes() {}

  /**
   * Rewrite every label of the given process. Explicit processes are rewritten eagerly so that a
   * relabeling merging two actions into one ambiguous transition fails right here. Composite
   * processes are wrapped and the relabeling must be injective over their alphabet.
   */
  public static Process relabel(final Process process, final Relabeling relabeling)
      throws ModelCheckException {
    if (relabeling.isIdentity()) {
      return process;
    }
    if (process instanceof ExplicitProcess) {
      final ExplicitProcess explicit = (ExplicitProcess) process;
      final ProcessBuilder builder =
          ProcessBuilder.newBuilder(explicit.getName()).initial(explicit.getInitialState());
      for (final Action action : explicit.getAlphabet()) {
        builder.alphabet(relabeling.apply(action));
      }
      for (final Transition transition : explicit.getTransitions()) {
        builder.transition(transition.getFromState(), relabeling.apply(transition.getAction()),
            transition.getToState());
      }
      return builder.build();
    }
    return new RelabeledProcess(process, relabeling);
  }

  /**
   * Remove the given actions from the visible alphabet; their transitions become tau steps.
   */
  public static Process hide(final Process process, final Set<Action> hidden) {
    if (hidden.isEmpty()) {
      return process;
    }
    return new HiddenProcess(process, hidden);
  }

  /**
   * Declare extra actions without adding transitions for them. Since no state enables them, the
   * extended process blocks these actions in every composition it takes part in.
   */
  public static Process extend(final Process process, final Set<Action> actions)
      throws ModelCheckException {
    if (process instanceof ExplicitProcess) {
      return ((ExplicitProcess) process).toBuilder().alphabet(actions).build();
    }
    return new ExtendedProcess(process, actions);
  }

  private static final class RelabeledProcess implements Process {
    private final Process delegate;
    private final Relabeling relabeling;
    private final Set<Action> alphabet;
    // K=new label, V=old label
    private final Map<Action, Action> inverse = new HashMap<>();

    private RelabeledProcess(final Process delegate, final Relabeling relabeling)
        throws ModelCheckException {
      this.delegate = delegate;
      this.relabeling = relabeling;
      final Set<Action> relabeled = new LinkedHashSet<>();
      for (final Action action : delegate.getAlphabet()) {
        final Action renamed = relabeling.apply(action);
        final Action clash = inverse.put(renamed, action);
        if (clash != null) {
          throw new ModelCheckException(Code.INVALID_RELABELING,
              String.format("Relabeling merges %s and %s into %s in process %s", clash, action,
                  renamed, delegate.getName()));
        }
        relabeled.add(renamed);
      }
      this.alphabet = Collections.unmodifiableSet(relabeled);
    }

    @Override
    public String getName() {
      return delegate.getName();
    }

    @Override
    public Set<Action> getAlphabet() {
      return alphabet;
    }

    @Override
    public LocalState getInitialState() {
      return delegate.getInitialState();
    }

    @Override
    public Optional<LocalState> transition(final LocalState state, final Action action) {
      final Action original = inverse.get(action);
      if (original == null) {
        return Optional.empty();
      }
      return delegate.transition(state, original);
    }

    @Override
    public List<Transition> steps(final LocalState state) {
      final List<Transition> inner = delegate.steps(state);
      final List<Transition> steps = new ArrayList<>(inner.size());
      for (final Transition transition : inner) {
        steps.add(new Transition(state, relabeling.apply(transition.getAction()),
            transition.getToState()));
      }
      return steps;
    }
  }

  private static final class HiddenProcess implements Process {
    private final Process delegate;
    private final Set<Action> hidden;
    private final Set<Action> alphabet;

    private HiddenProcess(final Process delegate, final Set<Action> hidden) {
      this.delegate = delegate;
      this.hidden = Collections.unmodifiableSet(new LinkedHashSet<>(hidden));
      final Set<Action> visible = new LinkedHashSet<>(delegate.getAlphabet());
      visible.removeAll(hidden);
      this.alphabet = Collections.unmodifiableSet(visible);
    }

    @Override
    public String getName() {
      return delegate.getName();
    }

    @Override
    public Set<Action> getAlphabet() {
      return alphabet;
    }

    @Override
    public LocalState getInitialState() {
      return delegate.getInitialState();
    }

    @Override
    public Optional<LocalState> transition(final LocalState state, final Action action) {
      if (hidden.contains(action)) {
        return Optional.empty();
      }
      return delegate.transition(state, action);
    }

    @Override
    public List<Transition> steps(final LocalState state) {
      final List<Transition> inner = delegate.steps(state);
      final List<Transition> steps = new ArrayList<>(inner.size());
      for (final Transition transition : inner) {
        if (hidden.contains(transition.getAction())) {
          steps.add(new Transition(state, Action.TAU, transition.getToState()));
        } else {
          steps.add(transition);
        }
      }
      return steps;
    }
  }

  private static final class ExtendedProcess implements Process {
    private final Process delegate;
    private final Set<Action> alphabet;

    private ExtendedProcess(final Process delegate, final Set<Action> extension) {
      this.delegate = delegate;
      final Set<Action> extended = new LinkedHashSet<>(delegate.getAlphabet());
      extended.addAll(extension);
      this.alphabet = Collections.unmodifiableSet(extended);
    }

    @Override
    public String getName() {
      return delegate.getName();
    }

    @Override
    public Set<Action> getAlphabet() {
      return alphabet;
    }

    @Override
    public LocalState getInitialState() {
      return delegate.getInitialState();
    }

    @Override
    public Optional<LocalState> transition(final LocalState state, final Action action) {
      return delegate.transition(state, action);
    }

    @Override
    public List<Transition> steps(final LocalState state) {
      return delegate.steps(state);
    }
  }
}
