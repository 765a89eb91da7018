package com.github.concurrencia;

import java.util.Arrays;
import java.util.List;

/**
 * The product state of a composite process: an ordered mapping from participant name to that
 * participant's local state. Two composed states are equal iff all components are equal.
 * 
 * The participant names list is shared by every state of the same composite; only the component
 * array is per state.
 */
public final class ComposedState implements LocalState {
  private final List<String> names;
  private final LocalState[] components;
  private final int hash;

  ComposedState(final List<String> names, final LocalState[] components) {
    this.names = names;
    this.components = components;
    this.hash = Arrays.hashCode(components);
  }

  public int size() {
    return components.length;
  }

  public List<String> getNames() {
    return names;
  }

  public LocalState get(final int index) {
    return components[index];
  }

  /**
   * The local state of the named direct participant, or null if there is no such participant.
   */
  public LocalState get(final String participant) {
    final int index = names.indexOf(participant);
    return index < 0 ? null : components[index];
  }

  /**
   * The local state of the named participant at any nesting depth, searched depth-first in
   * participant order. Returns null if no participant has that name.
   */
  public LocalState resolve(final String participant) {
    final LocalState direct = get(participant);
    if (direct != null) {
      return direct;
    }
    for (final LocalState component : components) {
      if (component instanceof ComposedState) {
        final LocalState nested = ((ComposedState) component).resolve(participant);
        if (nested != null) {
          return nested;
        }
      }
    }
    return null;
  }

  ComposedState with(final int index, final LocalState component) {
    final LocalState[] updated = components.clone();
    updated[index] = component;
    return new ComposedState(names, updated);
  }

  LocalState[] components() {
    return components.clone();
  }

  @Override
  public String describe() {
    final StringBuilder builder = new StringBuilder("(");
    for (int iter = 0; iter < components.length; iter++) {
      if (iter > 0) {
        builder.append(", ");
      }
      builder.append(names.get(iter)).append('=').append(components[iter].describe());
    }
    return builder.append(')').toString();
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ComposedState)) {
      return false;
    }
    final ComposedState other = (ComposedState) obj;
    return hash == other.hash && Arrays.equals(components, other.components)
        && names.equals(other.names);
  }

  @Override
  public String toString() {
    return "ComposedState " + describe();
  }
}
