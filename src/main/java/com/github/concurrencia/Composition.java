package com.github.concurrencia;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.concurrencia.ModelCheckException.Code;

/**
 * Fluent composition of named processes, the Java rendition of an FSP composite
 * {@code ||SYS = (a:P || b:Q)/{new/old}\{hidden}}.
 * 
 * Per participant relabelings are applied first, then the composite wide relabelings, both as pure
 * label rewrites before composing. Hiding applies to the composed result.
 */
public final class Composition {
  private static final Logger logger = LogManager.getLogger(Composition.class.getSimpleName());

  private final String name;
  private final List<String> names = new ArrayList<>();
  private final List<Process> processes = new ArrayList<>();
  private final List<Relabeling> relabelings = new ArrayList<>();
  private Relabeling compositeRelabeling = Relabeling.identity();
  private final Set<Action> hidden = new LinkedHashSet<>();

  public static Composition newBuilder(final String name) {
    return new Composition(name);
  }

  public Composition participant(final String participantName, final Process process) {
    return participant(participantName, process, Relabeling.identity());
  }

  public Composition participant(final String participantName, final Process process,
      final Relabeling relabeling) {
    names.add(participantName);
    processes.add(process);
    relabelings.add(relabeling);
    return this;
  }

  public Composition relabel(final Action oldAction, final Action newAction) {
    compositeRelabeling = compositeRelabeling.rename(oldAction, newAction);
    return this;
  }

  public Composition hide(final Action... actions) {
    for (final Action action : actions) {
      hidden.add(action);
    }
    return this;
  }

  public Composition hide(final Set<Action> actions) {
    hidden.addAll(actions);
    return this;
  }

  public Process build() throws ModelCheckException {
    if (name == null || name.trim().isEmpty()) {
      throw new ModelCheckException(Code.INVALID_PROCESS, "Composite name cannot be blank");
    }
    if (processes.isEmpty()) {
      throw new ModelCheckException(Code.INVALID_PROCESS,
          "Composite " + name + " has no participants");
    }
    final Set<String> unique = new HashSet<>();
    final List<Process> prepared = new ArrayList<>(processes.size());
    for (int iter = 0; iter < processes.size(); iter++) {
      final String participantName = names.get(iter);
      if (participantName == null || participantName.trim().isEmpty()) {
        throw new ModelCheckException(Code.INVALID_PROCESS,
            "Composite " + name + " has a participant without a name");
      }
      if (!unique.add(participantName)) {
        throw new ModelCheckException(Code.INVALID_PROCESS,
            "Composite " + name + " has two participants named " + participantName);
      }
      if (processes.get(iter) == null) {
        throw new ModelCheckException(Code.INVALID_PROCESS,
            "Participant " + participantName + " of " + name + " is null");
      }
      Process process = Processes.relabel(processes.get(iter), relabelings.get(iter));
      process = Processes.relabel(process, compositeRelabeling);
      prepared.add(process);
    }
    final ComposedProcess composed = new ComposedProcess(name, names, prepared);
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("Composed %s from %s over %d actions", name, names,
          composed.getAlphabet().size()));
    }
    return Processes.hide(composed, hidden);
  }

  private Composition(final String name) {
    this.name = name;
  }
}
